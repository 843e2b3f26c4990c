package com.surveyflow.runtime.loop;

import com.surveyflow.runtime.domain.SurveyModels.*;
import com.surveyflow.runtime.loop.LoopModels.LoopItem;
import com.surveyflow.runtime.loop.LoopModels.LoopPlan;
import com.surveyflow.runtime.ordering.Shuffler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds the item list a battery iterates over, from the source question's answer or from the
 * battery's dataset. Shuffle (if requested) happens before the {@code maxItems} cut.
 */
@Component
public class LoopPlanner {
    private static final Logger log = LoggerFactory.getLogger(LoopPlanner.class);

    private static final Comparator<LoopDatasetItem> DATASET_ORDER = Comparator
            .comparing(LoopDatasetItem::sortIndex, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(LoopDatasetItem::key);

    private final Shuffler shuffler;

    public LoopPlanner(Shuffler shuffler) {
        this.shuffler = shuffler;
    }

    public Optional<LoopPlan> plan(SurveyDefinition definition, LoopBattery battery, Map<String, List<String>> responses) {
        return plan(null, definition, battery, responses);
    }

    /**
     * @param sessionId seeds a randomized battery so the session always sees the same item order
     * @return the plan at cursor 0, or empty when there is nothing to iterate
     */
    public Optional<LoopPlan> plan(String sessionId, SurveyDefinition definition, LoopBattery battery,
                                   Map<String, List<String>> responses) {
        List<LoopItem> items = switch (battery.sourceType()) {
            case ANSWER -> answerItems(definition, battery, responses);
            case DATASET -> datasetItems(definition, battery);
        };

        if (battery.randomize()) {
            items = shuffler.shuffle(items, shuffler.random(sessionId, "loop:" + battery.id()));
        }
        if (battery.maxItems() != null && battery.maxItems() > 0 && items.size() > battery.maxItems()) {
            items = items.subList(0, battery.maxItems());
        }

        if (items.isEmpty()) {
            log.debug("Battery {} has no items; it will be skipped", battery.id());
            return Optional.empty();
        }
        log.debug("Battery {} planned with keys {}", battery.id(), items.stream().map(LoopItem::key).toList());
        return Optional.of(LoopPlan.start(battery.id(), items));
    }

    /**
     * Keys the battery's source currently offers. Plan items outside this set are stale.
     */
    public Set<String> liveKeys(SurveyDefinition definition, LoopBattery battery, Map<String, List<String>> responses) {
        List<LoopItem> items = switch (battery.sourceType()) {
            case ANSWER -> answerItems(definition, battery, responses);
            case DATASET -> datasetItems(definition, battery);
        };
        return items.stream().map(LoopItem::key).collect(Collectors.toSet());
    }

    private List<LoopItem> answerItems(SurveyDefinition definition, LoopBattery battery, Map<String, List<String>> responses) {
        if (battery.sourceQuestionId() == null || definition.question(battery.sourceQuestionId()).isEmpty()) {
            log.warn("Survey {} battery {} has no usable source question {}", definition.id(), battery.id(), battery.sourceQuestionId());
            return List.of();
        }
        List<String> selected = responses.getOrDefault(battery.sourceQuestionId(), List.of());
        Map<String, Option> optionsByValue = definition.optionsOf(battery.sourceQuestionId()).stream()
                .collect(Collectors.toMap(Option::value, Function.identity(), (a, b) -> a));

        List<LoopItem> items = new ArrayList<>();
        for (String value : new LinkedHashSet<>(selected)) {
            Option option = optionsByValue.get(value);
            if (option == null) {
                log.debug("Battery {} ignores value '{}' with no matching option", battery.id(), value);
                continue;
            }
            Map<String, String> attributes = new LinkedHashMap<>();
            attributes.put("value", option.value());
            attributes.put("label", option.label());
            items.add(new LoopItem(option.value(), option.label(), attributes));
        }
        return items;
    }

    private List<LoopItem> datasetItems(SurveyDefinition definition, LoopBattery battery) {
        return definition.datasetItemsOf(battery.id()).stream()
                .filter(LoopDatasetItem::active)
                .sorted(DATASET_ORDER)
                .map(row -> {
                    Map<String, String> attributes = row.attributes() == null ? Map.of() : row.attributes();
                    String label = attributes.getOrDefault("label", row.key());
                    return new LoopItem(row.key(), label, new LinkedHashMap<>(attributes));
                })
                .toList();
    }
}
