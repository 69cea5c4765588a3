package dk.cloudcreate.essentials.hydration.types;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class SequenceNumberTest {
    @Test
    void first_sequence_number_is_one() {
        assertThat(SequenceNumber.FIRST.longValue()).isEqualTo(1L);
        assertThat(SequenceNumber.of(1)).isEqualTo(SequenceNumber.FIRST);
    }

    @Test
    void zero_and_negative_values_are_rejected() {
        assertThatThrownBy(() -> SequenceNumber.of(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SequenceNumber.of(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void increment_returns_the_next_value_and_leaves_the_original_unchanged() {
        // Given
        var sequenceNumber = SequenceNumber.of(41);

        // When
        var next = sequenceNumber.increment();

        // Then
        assertThat(next.longValue()).isEqualTo(42L);
        assertThat(sequenceNumber.longValue()).isEqualTo(41L);
    }

    @Test
    void increment_at_max_value_fails_with_overflow() {
        // Given
        var sequenceNumber = SequenceNumber.of(Long.MAX_VALUE);
        assertThat(sequenceNumber.isMaxValue()).isTrue();

        // When
        assertThatThrownBy(sequenceNumber::increment)
                .isExactlyInstanceOf(VersionOverflowException.class)
                .satisfies(e -> assertThat(((VersionOverflowException) e).version).isEqualTo(Version.of(Long.MAX_VALUE)));

        // Then
        assertThat(sequenceNumber.longValue()).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void equality_and_hashing_are_by_value() {
        var one     = SequenceNumber.of(7);
        var another = SequenceNumber.of(7);

        assertThat(one).isEqualTo(another);
        assertThat(one.hashCode()).isEqualTo(another.hashCode());
        assertThat(one).isNotEqualTo(SequenceNumber.of(8));
    }

    @Test
    void sequence_numbers_are_ordered_by_value() {
        assertThat(SequenceNumber.of(1).compareTo(SequenceNumber.of(2))).isNegative();
        assertThat(SequenceNumber.of(2).compareTo(SequenceNumber.of(1))).isPositive();
        assertThat(SequenceNumber.of(5).compareTo(SequenceNumber.of(5))).isZero();
        assertThat(SequenceNumber.of(Long.MAX_VALUE - 1).compareTo(SequenceNumber.of(Long.MAX_VALUE))).isNegative();
    }

    @Test
    void sorting_gives_numeric_order() {
        // Given
        var sequenceNumbers = new ArrayList<>(List.of(SequenceNumber.of(Long.MAX_VALUE),
                                                      SequenceNumber.of(10),
                                                      SequenceNumber.FIRST,
                                                      SequenceNumber.of(2),
                                                      SequenceNumber.of(9)));

        // When
        Collections.sort(sequenceNumbers);

        // Then
        assertThat(sequenceNumbers).containsExactly(SequenceNumber.FIRST,
                                                    SequenceNumber.of(2),
                                                    SequenceNumber.of(9),
                                                    SequenceNumber.of(10),
                                                    SequenceNumber.of(Long.MAX_VALUE));
    }
}
