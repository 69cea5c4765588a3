package dk.cloudcreate.essentials.hydration.aggregates;

/**
 * A thing that happened: an immutable fact.<br>
 * An {@link Event} carries no identity nor version. The position of an event within an aggregate's history is tracked by
 * the {@link HydratedAggregate} it is applied to, or by the {@link RecordedEvent} it was loaded as.
 */
public interface Event {
    /**
     * The name of the type of event, e.g. "OrderAccepted".<br>
     * Note: This should effectively be a constant value, and should never change.
     */
    String eventType();
}
