package com.surveyflow.runtime.ordering;

import com.surveyflow.runtime.domain.SurveyModels.OrderMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Display order for groups, questions and options.
 * <p>
 * Non-sequential orders are remembered in the session's order cache under {@code entity:mode}, so a
 * page renders identically every time. Ids that were not part of the cached order are appended after
 * it in authored order; cached ids that are currently absent are skipped but kept in the cache.
 */
@Component
public class OrderResolver {
    private static final Logger log = LoggerFactory.getLogger(OrderResolver.class);

    private final Shuffler shuffler;

    public OrderResolver(Shuffler shuffler) {
        this.shuffler = shuffler;
    }

    public record OrderItem(String id, String groupKey, Double weight) {
        public static OrderItem of(String id) {
            return new OrderItem(id, null, null);
        }
    }

    public static String cacheKey(String entity, OrderMode mode) {
        return entity + ":" + mode;
    }

    public <T> List<T> arrange(String sessionId, String entity, OrderMode mode, List<T> items,
                               Function<T, OrderItem> describe, Map<String, List<String>> orderCache) {
        Map<String, T> byId = new LinkedHashMap<>();
        List<OrderItem> described = new ArrayList<>();
        for (T item : items) {
            OrderItem d = describe.apply(item);
            byId.put(d.id(), item);
            described.add(d);
        }
        return order(sessionId, entity, mode, described, orderCache).stream().map(byId::get).toList();
    }

    public List<String> order(String entity, OrderMode mode, List<OrderItem> items, Map<String, List<String>> orderCache) {
        return order(null, entity, mode, items, orderCache);
    }

    /**
     * @param sessionId seeds the shuffle together with the cache key; null draws from the shared generator
     */
    public List<String> order(String sessionId, String entity, OrderMode mode, List<OrderItem> items,
                              Map<String, List<String>> orderCache) {
        List<String> authored = items.stream().map(OrderItem::id).toList();
        if (mode == null || mode == OrderMode.SEQUENTIAL) {
            return authored;
        }

        String key = cacheKey(entity, mode);
        List<String> cached = orderCache.get(key);
        if (cached == null) {
            List<String> computed = compute(mode, items, shuffler.random(sessionId, key));
            orderCache.put(key, computed);
            log.debug("Computed {} order for {}: {}", mode, entity, computed);
            return computed;
        }

        Set<String> current = new HashSet<>(authored);
        Set<String> known = new HashSet<>(cached);
        List<String> result = new ArrayList<>(cached.stream().filter(current::contains).toList());
        List<String> added = authored.stream().filter(id -> !known.contains(id)).toList();
        if (!added.isEmpty()) {
            result.addAll(added);
            List<String> extended = new ArrayList<>(cached);
            extended.addAll(added);
            orderCache.put(key, List.copyOf(extended));
        }
        return result;
    }

    private List<String> compute(OrderMode mode, List<OrderItem> items, Random random) {
        return switch (mode) {
            case RANDOM -> shuffler.shuffle(items.stream().map(OrderItem::id).toList(), random);
            case GROUP_RANDOM -> groupRandom(items, random);
            case WEIGHTED -> weighted(items, random);
            case SEQUENTIAL -> items.stream().map(OrderItem::id).toList();
        };
    }

    private List<String> groupRandom(List<OrderItem> items, Random random) {
        Map<String, List<String>> partitions = items.stream()
                .filter(i -> i.groupKey() != null && !i.groupKey().isBlank())
                .collect(Collectors.groupingBy(OrderItem::groupKey, LinkedHashMap::new,
                        Collectors.mapping(OrderItem::id, Collectors.toList())));
        List<String> ungrouped = items.stream()
                .filter(i -> i.groupKey() == null || i.groupKey().isBlank())
                .map(OrderItem::id)
                .toList();

        List<String> result = new ArrayList<>();
        partitions.values().forEach(ids -> result.addAll(shuffler.shuffle(ids, random)));
        result.addAll(shuffler.shuffle(ungrouped, random));
        return List.copyOf(result);
    }

    // Efraimidis-Spirakis: key = u^(1/w), highest key first. Equal weights give a uniform shuffle.
    private List<String> weighted(List<OrderItem> items, Random random) {
        record Keyed(String id, double key) {}
        return items.stream()
                .map(i -> {
                    double w = i.weight() == null || i.weight() <= 0 ? 1.0 : i.weight();
                    return new Keyed(i.id(), Math.pow(random.nextDouble(), 1.0 / w));
                })
                .sorted(Comparator.comparingDouble(Keyed::key).reversed())
                .map(Keyed::id)
                .toList();
    }
}
