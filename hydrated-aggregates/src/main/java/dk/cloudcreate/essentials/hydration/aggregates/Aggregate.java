package dk.cloudcreate.essentials.hydration.aggregates;

/**
 * Common interface that all aggregate projections must implement.<br>
 * An {@link Aggregate} is the current state of a domain entity, derived by folding its events (see {@link AggregateEvent}) in order.
 * It must only be mutated by applying events, and is normally wrapped by a {@link HydratedAggregate}, which keeps track of the
 * {@link dk.cloudcreate.essentials.hydration.types.Version} of the last event applied.<br>
 * <br>
 * Default instances (the state before any events have been applied) are created using an {@link AggregateInstanceFactory}.
 *
 * @param <AGGREGATE_TYPE> the aggregate self type (i.e. your concrete aggregate type)
 * @see HydratedAggregate
 */
public interface Aggregate<AGGREGATE_TYPE extends Aggregate<AGGREGATE_TYPE>> {
    /**
     * The name of the type of aggregate, e.g. "Orders".<br>
     * Note: This should effectively be a constant value, and should never change.
     */
    String aggregateType();

    /**
     * Apply the event to this aggregate instance to reflect the event as a state change to the aggregate.<br>
     * The default implementation delegates to {@link AggregateEvent#applyTo(Aggregate)}
     *
     * @param event the event to apply
     */
    @SuppressWarnings("unchecked")
    default void apply(AggregateEvent<AGGREGATE_TYPE> event) {
        event.applyTo((AGGREGATE_TYPE) this);
    }
}
