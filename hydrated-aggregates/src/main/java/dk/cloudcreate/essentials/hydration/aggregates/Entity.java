package dk.cloudcreate.essentials.hydration.aggregates;

import dk.cloudcreate.essentials.hydration.types.VersionOverflowException;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An identified, specific instance of a {@link HydratedAggregate}, e.g. an Order with a given OrderId.
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the aggregate projection type
 */
public final class Entity<ID, AGGREGATE_TYPE extends Aggregate<AGGREGATE_TYPE>> {
    private final ID                                id;
    private final HydratedAggregate<AGGREGATE_TYPE> aggregate;

    public Entity(ID id, HydratedAggregate<AGGREGATE_TYPE> aggregate) {
        this.id = requireNonNull(id, "You must supply an id");
        this.aggregate = requireNonNull(aggregate, "You must supply a hydrated aggregate");
    }

    public static <ID, AGGREGATE_TYPE extends Aggregate<AGGREGATE_TYPE>> Entity<ID, AGGREGATE_TYPE> of(ID id, HydratedAggregate<AGGREGATE_TYPE> aggregate) {
        return new Entity<>(id, aggregate);
    }

    public ID id() {
        return id;
    }

    /**
     * The underlying (live) {@link HydratedAggregate}. Changes made through it are reflected by this {@link Entity}
     */
    public HydratedAggregate<AGGREGATE_TYPE> aggregate() {
        return aggregate;
    }

    /**
     * Apply an event to the entity's aggregate
     *
     * @param event the event to apply
     * @throws VersionOverflowException in case the aggregate version can't be advanced
     * @see HydratedAggregate#apply(AggregateEvent)
     */
    public void applyEvent(AggregateEvent<AGGREGATE_TYPE> event) {
        aggregate.apply(event);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entity)) return false;
        Entity<?, ?> entity = (Entity<?, ?>) o;
        return id.equals(entity.id) && aggregate.equals(entity.aggregate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, aggregate);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id=" + id +
                ", aggregate=" + aggregate +
                '}';
    }
}
