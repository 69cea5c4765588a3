package dk.cloudcreate.essentials.hydration.types;

import dk.cloudcreate.essentials.types.LongType;

import static dk.cloudcreate.essentials.shared.FailFast.requireTrue;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The position of an event within the history of a single aggregate instance, i.e. "the Nth event ever applied".<br>
 * A {@link SequenceNumber} is strictly positive: the first event applied to an aggregate has {@link #FIRST} (value 1),
 * the absence of any events is expressed using {@link Version#INITIAL} and never as a {@link SequenceNumber} with value 0.<br>
 * <br>
 * Instances are immutable. Incrementing past {@link Long#MAX_VALUE} fails with a {@link VersionOverflowException} instead of
 * wrapping around.
 */
public class SequenceNumber extends LongType<SequenceNumber> {
    /**
     * The {@link SequenceNumber} of the FIRST event applied to an aggregate instance
     */
    public static final SequenceNumber FIRST = new SequenceNumber(1L);

    public SequenceNumber(Long value) {
        super(value);
        requireTrue(value > 0, msg("A SequenceNumber must be strictly positive, but was {}", value));
    }

    public static SequenceNumber of(long value) {
        return new SequenceNumber(value);
    }

    /**
     * Is this the largest {@link SequenceNumber} that can be represented
     *
     * @return true if this {@link SequenceNumber} can't be incremented
     */
    public boolean isMaxValue() {
        return longValue() == Long.MAX_VALUE;
    }

    /**
     * Get the next {@link SequenceNumber}
     *
     * @return a new {@link SequenceNumber} with a value that is one higher than this instance
     * @throws VersionOverflowException in case this {@link SequenceNumber} already has the value {@link Long#MAX_VALUE}
     */
    public SequenceNumber increment() {
        if (isMaxValue()) {
            throw new VersionOverflowException(Version.of(this));
        }
        return new SequenceNumber(longValue() + 1);
    }
}
