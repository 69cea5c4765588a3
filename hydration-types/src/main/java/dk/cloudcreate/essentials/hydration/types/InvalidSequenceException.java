package dk.cloudcreate.essentials.hydration.types;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when a {@link Version} doesn't immediately follow the previous {@link Version}, e.g. because
 * an event history contains a gap, a repeated version or events that are out of order
 *
 * @see Version#validateSequence(Version)
 */
public class InvalidSequenceException extends AggregateException {
    public final Version previousVersion;
    public final Version nextVersion;

    public InvalidSequenceException(Version previousVersion, Version nextVersion) {
        super(msg("Invalid event sequence: '{}' cannot follow '{}'",
                  requireNonNull(nextVersion, "No nextVersion provided"),
                  requireNonNull(previousVersion, "No previousVersion provided")));
        this.previousVersion = previousVersion;
        this.nextVersion = nextVersion;
    }
}
