package dk.cloudcreate.essentials.hydration.types;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when a {@link Version} or {@link SequenceNumber} is asked to increment beyond {@link Long#MAX_VALUE},
 * i.e. the sequence space of the aggregate instance has been exhausted.
 */
public class VersionOverflowException extends AggregateException {
    /**
     * The version that couldn't be incremented
     */
    public final Version version;

    public VersionOverflowException(Version version) {
        super(msg("Version overflow: cannot increment '{}' since the maximum number of events has been reached", requireNonNull(version, "No version provided")));
        this.version = version;
    }
}
