package dk.cloudcreate.essentials.hydration.aggregates.test_data;

import dk.cloudcreate.essentials.hydration.aggregates.AggregateEvent;

public final class CounterEvents {
    public static class CounterSet implements AggregateEvent<Counter> {
        public final int value;

        public CounterSet(int value) {
            this.value = value;
        }

        @Override
        public String eventType() {
            return "CounterSet";
        }

        @Override
        public void applyTo(Counter aggregate) {
            aggregate.counter = value;
            aggregate.history.add(eventType() + "(" + value + ")");
        }
    }

    public static class CounterIncremented implements AggregateEvent<Counter> {
        @Override
        public String eventType() {
            return "CounterIncremented";
        }

        @Override
        public void applyTo(Counter aggregate) {
            aggregate.counter++;
            aggregate.history.add(eventType());
        }
    }

    public static class CounterDoubled implements AggregateEvent<Counter> {
        @Override
        public String eventType() {
            return "CounterDoubled";
        }

        @Override
        public void applyTo(Counter aggregate) {
            aggregate.counter *= 2;
            aggregate.history.add(eventType());
        }
    }
}
