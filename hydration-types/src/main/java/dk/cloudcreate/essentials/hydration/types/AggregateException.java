package dk.cloudcreate.essentials.hydration.types;

/**
 * Root of all exceptions raised when applying events to, or validating the {@link Version} of, an aggregate.<br>
 * All subtypes are recoverable, and describe a failure that the caller can branch on:
 * <ul>
 *     <li>{@link VersionOverflowException}</li>
 *     <li>{@link VersionMismatchException}</li>
 *     <li>{@link InvalidSequenceException}</li>
 * </ul>
 */
public class AggregateException extends RuntimeException {
    public AggregateException(String message) {
        super(message);
    }

    public AggregateException(String message, Throwable cause) {
        super(message, cause);
    }
}
