package dk.cloudcreate.essentials.hydration.aggregates;

/**
 * An {@link Event} that is bound to a specific {@link Aggregate} type and knows how to apply itself to it.<br>
 * Applying an event is a pure and synchronous in memory operation. Any I/O as a consequence of an event is the callers concern.
 * <p>
 * Example:
 * <pre>{@code
 * public class ProductAddedToOrder implements AggregateEvent<Order> {
 *     public final ProductId productId;
 *     public final int       quantity;
 *     ...
 *     public String eventType() {
 *         return "ProductAddedToOrder";
 *     }
 *
 *     public void applyTo(Order order) {
 *         order.productAndQuantity.merge(productId, quantity, Integer::sum);
 *     }
 * }
 * }</pre>
 *
 * @param <AGGREGATE_TYPE> the aggregate type the event applies to
 */
public interface AggregateEvent<AGGREGATE_TYPE extends Aggregate<AGGREGATE_TYPE>> extends Event {
    /**
     * Commit the effect of this event to the aggregate. An event instance is applied once, after which it
     * is considered consumed.
     *
     * @param aggregate the aggregate to mutate in place
     */
    void applyTo(AGGREGATE_TYPE aggregate);
}
