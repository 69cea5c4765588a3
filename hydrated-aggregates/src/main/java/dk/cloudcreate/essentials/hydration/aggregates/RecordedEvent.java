package dk.cloudcreate.essentials.hydration.aggregates;

import dk.cloudcreate.essentials.hydration.types.Version;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * An {@link AggregateEvent} as it was recorded in an aggregate's event history, i.e. together with the {@link Version}
 * the aggregate reached when the event was applied.<br>
 * Used by {@link HydratedAggregate#rehydrate(Iterable)}, which verifies that the recorded versions form an unbroken sequence.
 *
 * @param <AGGREGATE_TYPE> the aggregate type the event applies to
 */
public final class RecordedEvent<AGGREGATE_TYPE extends Aggregate<AGGREGATE_TYPE>> {
    private final Version                         version;
    private final AggregateEvent<AGGREGATE_TYPE> event;

    private RecordedEvent(Version version, AggregateEvent<AGGREGATE_TYPE> event) {
        this.version = requireNonNull(version, "You must supply a version");
        this.event = requireNonNull(event, "You must supply an event");
        requireTrue(!version.isInitial(), msg("A recorded '{}' event cannot have version '{}'", event.eventType(), version));
    }

    public static <AGGREGATE_TYPE extends Aggregate<AGGREGATE_TYPE>> RecordedEvent<AGGREGATE_TYPE> of(Version version, AggregateEvent<AGGREGATE_TYPE> event) {
        return new RecordedEvent<>(version, event);
    }

    public static <AGGREGATE_TYPE extends Aggregate<AGGREGATE_TYPE>> RecordedEvent<AGGREGATE_TYPE> of(long version, AggregateEvent<AGGREGATE_TYPE> event) {
        return new RecordedEvent<>(Version.of(version), event);
    }

    /**
     * The version the aggregate reached when this event was applied
     */
    public Version version() {
        return version;
    }

    public AggregateEvent<AGGREGATE_TYPE> event() {
        return event;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordedEvent)) return false;
        RecordedEvent<?> that = (RecordedEvent<?>) o;
        return version.equals(that.version) && event.equals(that.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, event);
    }

    @Override
    public String toString() {
        return "RecordedEvent{" +
                "version=" + version +
                ", eventType=" + event.eventType() +
                '}';
    }
}
