package com.surveyflow.runtime;

import com.surveyflow.runtime.domain.SurveyModels.OrderMode;
import com.surveyflow.runtime.ordering.OrderResolver;
import com.surveyflow.runtime.ordering.OrderResolver.OrderItem;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class OrderResolverTest {
    private final OrderResolver resolver = new OrderResolver(Fixtures.shuffler());

    private static List<OrderItem> items(String... ids) {
        return Arrays.stream(ids).map(OrderItem::of).toList();
    }

    @Test
    void sequentialKeepsAuthoredOrderAndCachesNothing() {
        Map<String, List<String>> cache = new HashMap<>();
        assertEquals(List.of("a", "b", "c"), resolver.order("question:q1", OrderMode.SEQUENTIAL, items("a", "b", "c"), cache));
        assertTrue(cache.isEmpty());
    }

    @Test
    void repeatedCallsAreStableAndNewIdsAreAppended() {
        Map<String, List<String>> cache = new HashMap<>();
        List<OrderItem> base = items("o1", "o2", "o3", "o4", "o5", "o6", "o7", "o8");

        List<String> first = resolver.order("question:q1", OrderMode.RANDOM, base, cache);
        List<String> second = resolver.order("question:q1", OrderMode.RANDOM, base, cache);
        assertEquals(first, second);
        assertEquals(Set.of("o1", "o2", "o3", "o4", "o5", "o6", "o7", "o8"), new HashSet<>(first));

        List<OrderItem> extended = new ArrayList<>(base);
        extended.add(OrderItem.of("o9"));
        List<String> third = resolver.order("question:q1", OrderMode.RANDOM, extended, cache);

        List<String> expected = new ArrayList<>(first);
        expected.add("o9");
        assertEquals(expected, third);
    }

    @Test
    void missingIdsAreSkippedButRememberedInCache() {
        Map<String, List<String>> cache = new HashMap<>();
        List<String> full = resolver.order("question:q2", OrderMode.RANDOM, items("a", "b", "c", "d"), cache);

        List<String> reduced = resolver.order("question:q2", OrderMode.RANDOM, items("a", "c", "d"), cache);
        assertEquals(full.stream().filter(id -> !id.equals("b")).toList(), reduced);

        assertEquals(full, resolver.order("question:q2", OrderMode.RANDOM, items("a", "b", "c", "d"), cache));
        assertEquals(full, cache.get(OrderResolver.cacheKey("question:q2", OrderMode.RANDOM)));
    }

    @Test
    void cacheIsKeyedByEntityAndMode() {
        Map<String, List<String>> cache = new HashMap<>();
        resolver.order("question:q1", OrderMode.RANDOM, items("a", "b"), cache);
        resolver.order("question:q1", OrderMode.WEIGHTED, items("a", "b"), cache);
        resolver.order("question:q2", OrderMode.RANDOM, items("a", "b"), cache);
        assertEquals(Set.of("question:q1:RANDOM", "question:q1:WEIGHTED", "question:q2:RANDOM"), cache.keySet());
    }

    @Test
    void groupRandomKeepsPartitionsTogetherInAuthoredOrder() {
        List<OrderItem> options = List.of(
                new OrderItem("red", "colour", null),
                new OrderItem("blue", "colour", null),
                new OrderItem("green", "colour", null),
                new OrderItem("cat", "animal", null),
                new OrderItem("dog", "animal", null),
                new OrderItem("other", null, null));

        List<String> ordered = resolver.order("question:q3", OrderMode.GROUP_RANDOM, options, new HashMap<>());

        assertEquals(Set.of("red", "blue", "green"), new HashSet<>(ordered.subList(0, 3)));
        assertEquals(Set.of("cat", "dog"), new HashSet<>(ordered.subList(3, 5)));
        assertEquals("other", ordered.get(5));
    }

    @Test
    void weightedIsAPermutationThatFavoursHeavyItems() {
        int heavyFirst = 0;
        for (int run = 0; run < 200; run++) {
            List<String> ordered = resolver.order("question:w" + run, OrderMode.WEIGHTED, List.of(
                    new OrderItem("light", null, 1.0),
                    new OrderItem("heavy", null, 50.0),
                    new OrderItem("plain", null, null)), new HashMap<>());
            assertEquals(Set.of("light", "heavy", "plain"), new HashSet<>(ordered));
            if (ordered.get(0).equals("heavy")) heavyFirst++;
        }
        assertTrue(heavyFirst > 150, "heavy item led " + heavyFirst + " of 200 runs");
    }

    @Test
    void randomShuffleReachesEveryPosition() {
        Map<String, Set<Integer>> positions = new HashMap<>();
        for (int run = 0; run < 100; run++) {
            List<String> ordered = resolver.order("page:p" + run, OrderMode.RANDOM, items("a", "b", "c"), new HashMap<>());
            IntStream.range(0, ordered.size()).forEach(i -> positions.computeIfAbsent(ordered.get(i), k -> new HashSet<>()).add(i));
        }
        assertEquals(Map.of("a", Set.of(0, 1, 2), "b", Set.of(0, 1, 2), "c", Set.of(0, 1, 2)),
                positions.entrySet().stream().collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue)));
    }

    @Test
    void sameSessionReproducesItsOrderWithoutTheCache() {
        List<OrderItem> base = items("a", "b", "c", "d", "e", "f");
        List<String> first = resolver.order("s-1", "question:q1", OrderMode.RANDOM, base, new HashMap<>());
        assertEquals(first, resolver.order("s-1", "question:q1", OrderMode.RANDOM, base, new HashMap<>()));
        assertEquals(first, new OrderResolver(Fixtures.shuffler()).order("s-1", "question:q1", OrderMode.RANDOM, base, new HashMap<>()));

        Set<List<String>> acrossSessions = new HashSet<>();
        for (int run = 0; run < 20; run++) {
            acrossSessions.add(resolver.order("s-" + run, "question:q1", OrderMode.RANDOM, base, new HashMap<>()));
        }
        assertTrue(acrossSessions.size() > 1);
    }
}
