package dk.cloudcreate.essentials.hydration.types;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an optimistic concurrency check fails: the aggregate was modified after the caller last observed its {@link Version}.<br>
 * The aggregate is left untouched when this exception is thrown, so the caller can reload and retry.
 */
public class VersionMismatchException extends AggregateException {
    public final Version expectedVersion;
    public final Version actualVersion;

    public VersionMismatchException(Version expectedVersion, Version actualVersion) {
        super(msg("Version mismatch: expected '{}' but the actual version was '{}'",
                  requireNonNull(expectedVersion, "No expectedVersion provided"),
                  requireNonNull(actualVersion, "No actualVersion provided")));
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
