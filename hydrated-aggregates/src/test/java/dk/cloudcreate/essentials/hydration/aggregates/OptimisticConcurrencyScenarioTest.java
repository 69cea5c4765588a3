package dk.cloudcreate.essentials.hydration.aggregates;

import dk.cloudcreate.essentials.hydration.aggregates.test_data.Counter;
import dk.cloudcreate.essentials.hydration.aggregates.test_data.CounterEvents.*;
import dk.cloudcreate.essentials.hydration.types.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Two writers read the same aggregate and race to apply an event
 */
class OptimisticConcurrencyScenarioTest {
    private static final List<RecordedEvent<Counter>> HISTORY = List.of(RecordedEvent.of(1, new CounterSet(1)),
                                                                        RecordedEvent.of(2, new CounterIncremented()),
                                                                        RecordedEvent.of(3, new CounterIncremented()));

    @Test
    void the_writer_with_a_stale_version_is_rejected_and_can_retry_after_rereading() {
        // Given
        var aggregate            = HydratedAggregate.create(Counter.class).rehydrate(HISTORY);
        var versionSeenByWriter1 = aggregate.version();
        var versionSeenByWriter2 = aggregate.version();
        assertThat(versionSeenByWriter1).isEqualTo(Version.of(3));
        assertThat(versionSeenByWriter2).isEqualTo(Version.of(3));

        // When writer 1 applies first
        aggregate.applyWithConcurrencyCheck(new CounterDoubled(), versionSeenByWriter1);

        // Then
        assertThat(aggregate.version()).isEqualTo(Version.of(4));
        assertThat(aggregate.state().counter).isEqualTo(6);

        // When writer 2 applies the identical event using its stale version
        assertThatThrownBy(() -> aggregate.applyWithConcurrencyCheck(new CounterDoubled(), versionSeenByWriter2))
                .isExactlyInstanceOf(VersionMismatchException.class)
                .hasMessageContaining("Version{3}")
                .hasMessageContaining("Version{4}")
                .satisfies(e -> {
                    var mismatch = (VersionMismatchException) e;
                    assertThat(mismatch.expectedVersion).isEqualTo(Version.of(3));
                    assertThat(mismatch.actualVersion).isEqualTo(Version.of(4));
                });

        // Then the failed attempt had no side effects
        assertThat(aggregate.version()).isEqualTo(Version.of(4));
        assertThat(aggregate.state().counter).isEqualTo(6);
        assertThat(aggregate.state().history).containsExactly("CounterSet(1)", "CounterIncremented", "CounterIncremented", "CounterDoubled");

        // And writer 2 can re-read the version and retry
        var rereadVersion = aggregate.version();
        aggregate.applyWithConcurrencyCheck(new CounterIncremented(), rereadVersion);
        assertThat(aggregate.version()).isEqualTo(Version.of(5));
        assertThat(aggregate.state().counter).isEqualTo(7);
    }

    @Test
    void independently_loaded_copies_are_independent_attempts() {
        // Given
        var copy1 = HydratedAggregate.create(Counter.class).rehydrate(HISTORY);
        var copy2 = HydratedAggregate.create(Counter.class).rehydrate(HISTORY);

        // When
        copy1.applyWithConcurrencyCheck(new CounterDoubled(), Version.of(3));
        copy2.applyWithConcurrencyCheck(new CounterIncremented(), Version.of(3));

        // Then both succeed locally, and it's up to the store to accept only one of them
        assertThat(copy1.version()).isEqualTo(Version.of(4));
        assertThat(copy2.version()).isEqualTo(Version.of(4));
        assertThat(copy1.state().counter).isEqualTo(6);
        assertThat(copy2.state().counter).isEqualTo(4);
    }
}
