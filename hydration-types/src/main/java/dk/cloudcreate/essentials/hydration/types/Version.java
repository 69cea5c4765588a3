package dk.cloudcreate.essentials.hydration.types;

import com.fasterxml.jackson.annotation.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The version of an aggregate instance.<br>
 * A {@link Version} is either {@link #INITIAL}, which signifies that no events have ever been applied to the aggregate,
 * or the {@link SequenceNumber} of the last event that was applied to the aggregate.<br>
 * <br>
 * {@link #INITIAL} only ever transitions to the {@link Version} with {@link SequenceNumber#FIRST}, and any numbered {@link Version} <code>n</code>
 * only ever transitions to <code>n+1</code> (see {@link #increment()} and {@link #validateSequence(Version)}).<br>
 * {@link #INITIAL} is ordered before every numbered {@link Version}, and numbered versions are ordered by their {@link SequenceNumber}.<br>
 * <br>
 * When serialized using Jackson a {@link Version} is represented by its {@link #longValue()}, where 0 represents {@link #INITIAL}
 */
public final class Version implements Comparable<Version> {
    /**
     * The version of an aggregate that hasn't had any events applied to it
     */
    public static final Version INITIAL = new Version(null);

    /**
     * null means {@link #INITIAL}
     */
    private final SequenceNumber sequenceNumber;

    private Version(SequenceNumber sequenceNumber) {
        this.sequenceNumber = sequenceNumber;
    }

    /**
     * Create a {@link Version} from a raw number. The value <code>0</code> is interpreted as {@link #INITIAL}, while any
     * positive value is interpreted as the {@link SequenceNumber} of the last event applied.
     *
     * @param number the raw version number (0 or positive)
     * @return the corresponding {@link Version}
     */
    @JsonCreator
    public static Version of(long number) {
        requireTrue(number >= 0, msg("A Version number cannot be negative, but was {}", number));
        if (number == 0) {
            return INITIAL;
        }
        return new Version(SequenceNumber.of(number));
    }

    /**
     * Create a numbered {@link Version}
     *
     * @param sequenceNumber the sequence number of the last event applied
     * @return the corresponding {@link Version}
     */
    public static Version of(SequenceNumber sequenceNumber) {
        return new Version(requireNonNull(sequenceNumber, "You must supply a sequenceNumber"));
    }

    public boolean isInitial() {
        return sequenceNumber == null;
    }

    /**
     * @return the {@link SequenceNumber} of the last event applied, or {@link Optional#empty()} for {@link #INITIAL}
     */
    public Optional<SequenceNumber> sequenceNumber() {
        return Optional.ofNullable(sequenceNumber);
    }

    /**
     * @return the raw version number, 0 for {@link #INITIAL}
     */
    @JsonValue
    public long longValue() {
        return sequenceNumber == null ? 0L : sequenceNumber.longValue();
    }

    /**
     * Get the next {@link Version} in the sequence. {@link #INITIAL} is followed by {@link SequenceNumber#FIRST}.
     * This instance is left unchanged.
     *
     * @return the next {@link Version}
     * @throws VersionOverflowException in case this {@link Version} is already at {@link Long#MAX_VALUE}
     */
    public Version increment() {
        if (sequenceNumber == null) {
            return new Version(SequenceNumber.FIRST);
        }
        return new Version(sequenceNumber.increment());
    }

    /**
     * Check if this {@link Version} is the version that immediately follows <code>previous</code>
     *
     * @param previous the version before this one
     * @return true if this {@link Version} is {@link SequenceNumber#FIRST} and <code>previous</code> is {@link #INITIAL},
     * or if this {@link Version} is exactly one higher than a numbered <code>previous</code>
     */
    public boolean isNextAfter(Version previous) {
        requireNonNull(previous, "You must supply a previous version");
        if (sequenceNumber == null) {
            return false;
        }
        if (previous.sequenceNumber == null) {
            return sequenceNumber.longValue() == SequenceNumber.FIRST.longValue();
        }
        return !previous.sequenceNumber.isMaxValue() && sequenceNumber.longValue() == previous.sequenceNumber.longValue() + 1;
    }

    /**
     * Validate that this {@link Version} is the version that immediately follows <code>previous</code>.<br>
     * No gaps, regressions or repeats are permitted.
     *
     * @param previous the version before this one
     * @throws InvalidSequenceException in case this {@link Version} doesn't immediately follow <code>previous</code>
     * @see #isNextAfter(Version)
     */
    public void validateSequence(Version previous) {
        if (!isNextAfter(previous)) {
            throw new InvalidSequenceException(previous, this);
        }
    }

    @Override
    public int compareTo(Version o) {
        Objects.requireNonNull(o, "Cannot compare to a null Version");
        return Long.compare(longValue(), o.longValue());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Version)) return false;
        return longValue() == ((Version) o).longValue();
    }

    @Override
    public int hashCode() {
        return Long.hashCode(longValue());
    }

    @Override
    public String toString() {
        return sequenceNumber == null ? "Version{INITIAL}" : "Version{" + sequenceNumber.longValue() + "}";
    }
}
