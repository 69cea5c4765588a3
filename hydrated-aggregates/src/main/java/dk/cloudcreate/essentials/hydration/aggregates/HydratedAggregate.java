package dk.cloudcreate.essentials.hydration.aggregates;

import dk.cloudcreate.essentials.hydration.types.*;
import org.slf4j.*;

import java.util.*;
import java.util.stream.Stream;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An {@link Aggregate} projection that has been hydrated (e.g. by replaying its event history), which keeps track of the
 * current {@link Version} of the aggregate and the {@link Version} of the snapshot it was loaded from (if any).<br>
 * <br>
 * The {@link #state()} and the {@link #version()} are only ever changed together, through the <code>apply</code> methods:
 * every successfully applied event advances the {@link #version()} by exactly one. Before an event is applied the next
 * {@link Version} is calculated, so a {@link VersionOverflowException} leaves both the state and the version untouched.<br>
 * <br>
 * Optimistic concurrency is supported through {@link #applyWithConcurrencyCheck(AggregateEvent, Version)}:
 * <pre>{@code
 * var order           = repository.load(orderId);  // e.g. at Version{3}
 * var expectedVersion = order.version();
 * ...
 * order.applyWithConcurrencyCheck(new OrderAccepted(orderId), expectedVersion);
 * }</pre>
 * If another writer has advanced the aggregate in between, a {@link VersionMismatchException} is thrown and nothing is applied.
 * Retrying is the callers concern.<br>
 * <br>
 * A {@link HydratedAggregate} is NOT thread safe; each instance is meant to be owned by a single caller at a time.
 *
 * @param <AGGREGATE_TYPE> the aggregate projection type
 */
public final class HydratedAggregate<AGGREGATE_TYPE extends Aggregate<AGGREGATE_TYPE>> {
    private static final Logger log = LoggerFactory.getLogger(HydratedAggregate.class);

    private final AGGREGATE_TYPE state;
    private       Version        version;
    private       Version        snapshotVersion;

    /**
     * Create a {@link HydratedAggregate} from an existing state, with version {@link Version#INITIAL} and no snapshot version
     *
     * @param state the aggregate state
     */
    public HydratedAggregate(AGGREGATE_TYPE state) {
        this(state, Version.INITIAL, null);
    }

    private HydratedAggregate(AGGREGATE_TYPE state, Version version, Version snapshotVersion) {
        this.state = requireNonNull(state, "You must supply an aggregate state");
        this.version = requireNonNull(version, "You must supply a version");
        this.snapshotVersion = snapshotVersion;
    }

    /**
     * Create a {@link HydratedAggregate} from an existing state, with version {@link Version#INITIAL} and no snapshot version
     *
     * @param state            the aggregate state
     * @param <AGGREGATE_TYPE> the aggregate projection type
     * @return the new {@link HydratedAggregate}
     */
    public static <AGGREGATE_TYPE extends Aggregate<AGGREGATE_TYPE>> HydratedAggregate<AGGREGATE_TYPE> of(AGGREGATE_TYPE state) {
        return new HydratedAggregate<>(state);
    }

    /**
     * Create an empty {@link HydratedAggregate}, where the state is created using the default no-arguments constructor of the aggregate type
     *
     * @param aggregateType    the aggregate projection type
     * @param <AGGREGATE_TYPE> the aggregate projection type
     * @return the new {@link HydratedAggregate} with version {@link Version#INITIAL}
     * @see AggregateInstanceFactory#usingNoArgsConstructor()
     */
    public static <AGGREGATE_TYPE extends Aggregate<AGGREGATE_TYPE>> HydratedAggregate<AGGREGATE_TYPE> create(Class<AGGREGATE_TYPE> aggregateType) {
        return create(aggregateType, AggregateInstanceFactory.usingNoArgsConstructor());
    }

    /**
     * Create an empty {@link HydratedAggregate}, where the state is created using the given {@link AggregateInstanceFactory}
     *
     * @param aggregateType    the aggregate projection type
     * @param instanceFactory  the factory that creates the default state instance
     * @param <AGGREGATE_TYPE> the aggregate projection type
     * @return the new {@link HydratedAggregate} with version {@link Version#INITIAL}
     */
    public static <AGGREGATE_TYPE extends Aggregate<AGGREGATE_TYPE>> HydratedAggregate<AGGREGATE_TYPE> create(Class<AGGREGATE_TYPE> aggregateType,
                                                                                                            AggregateInstanceFactory instanceFactory) {
        requireNonNull(aggregateType, "You must supply an aggregateType");
        requireNonNull(instanceFactory, "You must supply an instanceFactory");
        return new HydratedAggregate<>(instanceFactory.create(aggregateType));
    }

    /**
     * Create a {@link HydratedAggregate} from a snapshot of the aggregate state.<br>
     * Both the {@link #version()} and the {@link #snapshotVersion()} are set to <code>snapshotVersion</code>, so only the events recorded
     * after the snapshot need to be applied afterwards.
     *
     * @param snapshotState    the aggregate state as captured by the snapshot
     * @param snapshotVersion  the version at which the snapshot was captured
     * @param <AGGREGATE_TYPE> the aggregate projection type
     * @return the new {@link HydratedAggregate}
     */
    public static <AGGREGATE_TYPE extends Aggregate<AGGREGATE_TYPE>> HydratedAggregate<AGGREGATE_TYPE> fromSnapshot(AGGREGATE_TYPE snapshotState,
                                                                                                                  Version snapshotVersion) {
        requireNonNull(snapshotVersion, "You must supply a snapshotVersion");
        return new HydratedAggregate<>(snapshotState, snapshotVersion, snapshotVersion);
    }

    /**
     * The current version of the aggregate, i.e. the version of the last event applied
     */
    public Version version() {
        return version;
    }

    /**
     * The version of the latest snapshot taken of (or loaded into) the aggregate
     */
    public Optional<Version> snapshotVersion() {
        return Optional.ofNullable(snapshotVersion);
    }

    /**
     * Record that a snapshot of the aggregate was taken at <code>newSnapshotVersion</code>. Doesn't affect the {@link #version()}
     *
     * @param newSnapshotVersion the version at which the snapshot was taken
     */
    public void setSnapshotVersion(Version newSnapshotVersion) {
        this.snapshotVersion = requireNonNull(newSnapshotVersion, "You must supply a snapshot version");
    }

    /**
     * The aggregate state.<br>
     * <b>Note: Mutating the returned instance directly bypasses event sourcing</b> and is only meant for hydrating the state
     * from a snapshot. All other changes must be made by applying events.
     */
    public AGGREGATE_TYPE state() {
        return state;
    }

    /**
     * Apply a single event to the aggregate state and advance the {@link #version()} by one
     *
     * @param event the event to apply
     * @throws VersionOverflowException in case the version can't be advanced. Neither state nor version is changed in that case
     */
    public void apply(AggregateEvent<AGGREGATE_TYPE> event) {
        requireNonNull(event, "You must supply an event");
        Version nextVersion;
        try {
            nextVersion = version.increment();
        } catch (VersionOverflowException e) {
            log.debug("[{}] Cannot apply '{}' since {} cannot be incremented", state.aggregateType(), event.eventType(), version);
            throw e;
        }
        log.trace("[{}] Applying '{}' as {}", state.aggregateType(), event.eventType(), nextVersion);
        state.apply(event);
        version = nextVersion;
    }

    /**
     * Apply the events, in the order supplied, to the aggregate state. On success the {@link #version()} has advanced by exactly the number of events supplied.<br>
     * Processing stops at the first failure. <b>Events applied before the failing event are NOT rolled back.</b>
     *
     * @param events the events to apply
     * @throws VersionOverflowException in case the version can't be advanced
     */
    public void applyEvents(Iterable<? extends AggregateEvent<AGGREGATE_TYPE>> events) {
        requireNonNull(events, "You must supply events");
        for (AggregateEvent<AGGREGATE_TYPE> event : events) {
            apply(event);
        }
    }

    /**
     * Apply the events, in stream order, to the aggregate state.
     *
     * @param events the events to apply
     * @throws VersionOverflowException in case the version can't be advanced
     * @see #applyEvents(Iterable)
     */
    public void applyEvents(Stream<? extends AggregateEvent<AGGREGATE_TYPE>> events) {
        requireNonNull(events, "You must supply an events stream");
        events.forEachOrdered(this::apply);
    }

    /**
     * Apply an event with optimistic concurrency control: the event is only applied if the aggregate is still at <code>expectedVersion</code>
     *
     * @param event           the event to apply
     * @param expectedVersion the version of the aggregate the caller last observed
     * @throws VersionMismatchException in case the current {@link #version()} differs from <code>expectedVersion</code>. Nothing is applied in that case
     * @throws VersionOverflowException in case the version can't be advanced
     */
    public void applyWithConcurrencyCheck(AggregateEvent<AGGREGATE_TYPE> event, Version expectedVersion) {
        requireNonNull(event, "You must supply an event");
        checkVersion(expectedVersion);
        apply(event);
    }

    /**
     * Apply the events with optimistic concurrency control: the events are only applied if the aggregate is still at <code>expectedVersion</code>
     * when this method is called
     *
     * @param events          the events to apply
     * @param expectedVersion the version of the aggregate the caller last observed
     * @throws VersionMismatchException in case the current {@link #version()} differs from <code>expectedVersion</code>. Nothing is applied in that case
     * @throws VersionOverflowException in case the version can't be advanced
     * @see #applyEvents(Iterable)
     */
    public void applyEventsWithConcurrencyCheck(Iterable<? extends AggregateEvent<AGGREGATE_TYPE>> events, Version expectedVersion) {
        requireNonNull(events, "You must supply events");
        checkVersion(expectedVersion);
        applyEvents(events);
    }

    /**
     * Effectively performs a leftFold over previously recorded events, verifying that every {@link RecordedEvent#version()}
     * immediately follows the current {@link #version()} before the event is applied
     *
     * @param recordedEvents the recorded events, aka. the aggregates history (or the part of it that follows the snapshot)
     * @return this instance
     * @throws InvalidSequenceException in case the recorded versions contain a gap, a repeat or are out of order. Events
     *                                  before the offending event remain applied
     */
    public HydratedAggregate<AGGREGATE_TYPE> rehydrate(Iterable<RecordedEvent<AGGREGATE_TYPE>> recordedEvents) {
        requireNonNull(recordedEvents, "You must supply recordedEvents");
        for (RecordedEvent<AGGREGATE_TYPE> recordedEvent : recordedEvents) {
            try {
                recordedEvent.version().validateSequence(version);
            } catch (InvalidSequenceException e) {
                log.debug("[{}] Rejecting recorded '{}' with {} as the aggregate is at {}",
                          state.aggregateType(),
                          recordedEvent.event().eventType(),
                          recordedEvent.version(),
                          version);
                throw e;
            }
            apply(recordedEvent.event());
        }
        return this;
    }

    private void checkVersion(Version expectedVersion) {
        requireNonNull(expectedVersion, "You must supply an expectedVersion");
        if (!version.equals(expectedVersion)) {
            log.debug("[{}] Concurrent modification detected: expected {} but the actual version is {}", state.aggregateType(), expectedVersion, version);
            throw new VersionMismatchException(expectedVersion, version);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HydratedAggregate)) return false;
        HydratedAggregate<?> that = (HydratedAggregate<?>) o;
        return version.equals(that.version) &&
                Objects.equals(snapshotVersion, that.snapshotVersion) &&
                state.equals(that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, snapshotVersion, state);
    }

    @Override
    public String toString() {
        return "HydratedAggregate{" +
                "aggregateType=" + state.aggregateType() +
                ", version=" + version +
                ", snapshotVersion=" + snapshotVersion +
                ", state=" + state +
                '}';
    }
}
