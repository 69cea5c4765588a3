package dk.cloudcreate.essentials.hydration.aggregates;

import dk.cloudcreate.essentials.shared.reflection.Reflector;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Supplies the empty state of an {@link Aggregate} projection, i.e. the state a {@link HydratedAggregate} starts from
 * before any event has been applied to it.<br>
 * The empty state must be fully initialized: events are applied to it as-is.
 *
 * @see HydratedAggregate#create(Class, AggregateInstanceFactory)
 * @see #usingNoArgsConstructor()
 */
@FunctionalInterface
public interface AggregateInstanceFactory {
    /**
     * Create a new, empty, instance of <code>aggregateType</code>. Every call must return a new instance
     *
     * @param aggregateType the concrete projection type
     * @return the new instance
     */
    Object newInstance(Class<?> aggregateType);

    /**
     * Type safe variant of {@link #newInstance(Class)}
     *
     * @param aggregateType    the concrete projection type
     * @param <AGGREGATE_TYPE> the projection type
     * @return the new instance
     * @throws IllegalStateException in case {@link #newInstance(Class)} returned null or an instance of another type
     */
    default <AGGREGATE_TYPE extends Aggregate<AGGREGATE_TYPE>> AGGREGATE_TYPE create(Class<AGGREGATE_TYPE> aggregateType) {
        requireNonNull(aggregateType, "You must supply an aggregateType");
        var instance = newInstance(aggregateType);
        if (!aggregateType.isInstance(instance)) {
            throw new IllegalStateException(msg("Expected a new instance of '{}' but got '{}'",
                                                aggregateType.getName(),
                                                instance == null ? "null" : instance.getClass().getName()));
        }
        return aggregateType.cast(instance);
    }

    /**
     * @return an {@link AggregateInstanceFactory} that calls the no-arguments constructor of the projection type, so field
     * initializers and constructor logic run as usual
     */
    static AggregateInstanceFactory usingNoArgsConstructor() {
        return aggregateType -> Reflector.reflectOn(aggregateType).newInstance();
    }
}
