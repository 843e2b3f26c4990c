package com.surveyflow.runtime.loop;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public class LoopModels {
    public enum LoopState { NOT_STARTED, ITERATING, DONE }

    public record LoopItem(String key, String label, Map<String, String> attributes) {}

    /**
     * Items of one battery for one session, in the order they will be iterated. Stored verbatim in
     * the session so a shuffled plan never changes between renders.
     */
    public record LoopPlan(String batteryId, List<LoopItem> items, int cursor) {
        public static LoopPlan start(String batteryId, List<LoopItem> items) {
            return new LoopPlan(batteryId, List.copyOf(items), 0);
        }

        public static LoopPlan empty(String batteryId) {
            return new LoopPlan(batteryId, List.of(), 0);
        }

        @JsonIgnore
        public boolean isComplete() {
            return cursor >= items.size();
        }

        @JsonIgnore
        public Optional<LoopItem> currentItem() {
            return isComplete() ? Optional.empty() : Optional.of(items.get(cursor));
        }

        public LoopPlan advance() {
            return isComplete() ? this : new LoopPlan(batteryId, items, cursor + 1);
        }

        public LoopPlan retreat() {
            return cursor == 0 ? this : new LoopPlan(batteryId, items, Math.min(cursor, items.size()) - 1);
        }

        public LoopPlan withCursor(int newCursor) {
            return new LoopPlan(batteryId, items, newCursor);
        }
    }

    /**
     * The iteration a page is rendered in.
     *
     * @param index zero-based position of {@code item} in the plan
     */
    public record LoopContext(String batteryId, LoopItem item, int index, int total) {
        public boolean isFirst() {
            return index == 0;
        }

        public boolean isLast() {
            return index == total - 1;
        }

        public int percentComplete() {
            return total == 0 ? 100 : (int) Math.round((index + 1) * 100.0 / total);
        }
    }

    public record LoopProgress(String batteryId, LoopState state, int currentIteration, int totalIterations,
                               int percentComplete, LoopItem currentItem) {}
}
