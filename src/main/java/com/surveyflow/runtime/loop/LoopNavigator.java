package com.surveyflow.runtime.loop;

import com.surveyflow.runtime.domain.SurveyModels.*;
import com.surveyflow.runtime.expression.EvaluationContext;
import com.surveyflow.runtime.loop.LoopModels.*;
import com.surveyflow.runtime.visibility.VisibilityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Page-to-page movement with loop batteries folded in.
 * <p>
 * Per (session, battery) the state is derived from the stored plan: no plan is NOT_STARTED, a plan
 * with items left is ITERATING(cursor), an exhausted or empty plan is DONE. Only the start and end
 * pages of a battery carry loop transitions; every other page moves by index, skipping pages whose
 * visibility condition is false.
 */
@Component
public class LoopNavigator {
    private static final Logger log = LoggerFactory.getLogger(LoopNavigator.class);

    private final LoopPlanner planner;
    private final VisibilityResolver visibility;

    public LoopNavigator(LoopPlanner planner, VisibilityResolver visibility) {
        this.planner = planner;
        this.visibility = visibility;
    }

    /**
     * Everything one navigation step needs. {@code plans} is the session's working copy and is
     * updated in place.
     */
    public record Scope(SurveyDefinition definition, EvaluationContext context, Map<String, LoopPlan> plans,
                        String sessionId) {
        public Scope(SurveyDefinition definition, EvaluationContext context, Map<String, LoopPlan> plans) {
            this(definition, context, plans, null);
        }
    }

    /**
     * Where navigation landed. A null page id means the survey has no further page.
     */
    public record PageTarget(String pageId, LoopContext loopContext) {
        public static PageTarget end() {
            return new PageTarget(null, null);
        }

        public boolean isEnd() {
            return pageId == null;
        }
    }

    public PageTarget first(Scope scope) {
        List<Page> pages = scope.definition().pages();
        return pages.isEmpty() ? PageTarget.end() : enter(scope, pages.get(0).id());
    }

    public PageTarget next(Scope scope, String currentPageId) {
        Optional<LoopPageRole> role = scope.definition().loopRole(currentPageId);
        if (role.isPresent() && role.get().role() == LoopRole.END) {
            return leaveEnd(scope, battery(scope, role.get()));
        }
        return enter(scope, indexAfter(scope.definition(), currentPageId));
    }

    /**
     * Moving back from a start page mid-loop returns to the end page of the previous iteration.
     * Everywhere else it is index - 1 over visible pages, stepping over batteries that were skipped.
     *
     * @return empty when there is no earlier page
     */
    public Optional<PageTarget> previous(Scope scope, String currentPageId) {
        SurveyDefinition definition = scope.definition();
        Optional<LoopPageRole> role = definition.loopRole(currentPageId);
        if (role.isPresent() && role.get().role() == LoopRole.START) {
            LoopPlan plan = scope.plans().get(role.get().batteryId());
            if (plan != null && plan.cursor() > 0 && !plan.items().isEmpty()) {
                LoopPlan back = plan.retreat();
                scope.plans().put(plan.batteryId(), back);
                LoopBattery battery = battery(scope, role.get());
                log.debug("Battery {} stepped back to iteration {}", battery.id(), back.cursor());
                return Optional.of(target(scope, battery.endPageId()));
            }
        }

        String pageId = indexBefore(definition, currentPageId);
        while (pageId != null) {
            Optional<LoopPageRole> candidateRole = definition.loopRole(pageId);
            if (candidateRole.isPresent()) {
                LoopBattery battery = battery(scope, candidateRole.get());
                LoopPlan plan = scope.plans().get(battery.id());
                if (plan == null || plan.items().isEmpty()) {
                    pageId = indexBefore(definition, battery.startPageId());
                    continue;
                }
                if (plan.isComplete()) {
                    scope.plans().put(battery.id(), plan.withCursor(plan.items().size() - 1));
                }
            }
            if (isVisible(scope, pageId)) {
                return Optional.of(target(scope, pageId));
            }
            pageId = indexBefore(definition, pageId);
        }
        return Optional.empty();
    }

    /**
     * Arrival at {@code pageId}, either sequentially or through a jump. Applies start-page planning
     * and skips invisible pages forward.
     */
    public PageTarget enter(Scope scope, String pageId) {
        SurveyDefinition definition = scope.definition();
        while (pageId != null) {
            Optional<LoopPageRole> role = definition.loopRole(pageId);
            boolean visible = isVisible(scope, pageId);

            if (role.isPresent() && role.get().role() == LoopRole.START) {
                LoopBattery battery = battery(scope, role.get());
                if (!visible) {
                    pageId = indexAfter(definition, battery.endPageId());
                    continue;
                }
                LoopPlan plan = arriveAtStart(scope, battery);
                if (plan.isComplete()) {
                    log.debug("Battery {} done; continuing after page {}", battery.id(), battery.endPageId());
                    pageId = indexAfter(definition, battery.endPageId());
                    continue;
                }
                return target(scope, pageId);
            }

            if (!visible) {
                if (role.isPresent() && role.get().role() == LoopRole.END) {
                    return leaveEnd(scope, battery(scope, role.get()));
                }
                pageId = indexAfter(definition, pageId);
                continue;
            }
            return target(scope, pageId);
        }
        return PageTarget.end();
    }

    public Optional<LoopContext> loopContext(Scope scope, String pageId) {
        return scope.definition().loopRole(pageId)
                .map(role -> scope.plans().get(role.batteryId()))
                .flatMap(plan -> plan.currentItem()
                        .map(item -> new LoopContext(plan.batteryId(), item, plan.cursor(), plan.items().size())));
    }

    /**
     * Discards plans of every battery sourced from {@code questionId}.
     */
    public void resetForQuestion(SurveyDefinition definition, String questionId, Map<String, LoopPlan> plans) {
        definition.batteriesSourcedBy(questionId).forEach(b -> {
            if (plans.remove(b.id()) != null) {
                log.debug("Battery {} reset after its source question {} changed", b.id(), questionId);
            }
        });
    }

    public LoopProgress progress(String batteryId, Map<String, LoopPlan> plans) {
        LoopPlan plan = plans.get(batteryId);
        if (plan == null) {
            return new LoopProgress(batteryId, LoopState.NOT_STARTED, 0, 0, 0, null);
        }
        int total = plan.items().size();
        if (plan.isComplete()) {
            return new LoopProgress(batteryId, LoopState.DONE, total, total, 100, null);
        }
        int iteration = plan.cursor() + 1;
        int percent = (int) Math.round(iteration * 100.0 / total);
        return new LoopProgress(batteryId, LoopState.ITERATING, iteration, total, percent, plan.currentItem().orElse(null));
    }

    private LoopPlan arriveAtStart(Scope scope, LoopBattery battery) {
        LoopPlan plan = scope.plans().get(battery.id());
        if (plan == null) {
            plan = planner.plan(scope.sessionId(), scope.definition(), battery, scope.context().responses())
                    .orElseGet(() -> LoopPlan.empty(battery.id()));
        }
        plan = skipStale(scope, battery, plan);
        scope.plans().put(battery.id(), plan);
        return plan;
    }

    /**
     * Leaving an end page while its battery still has items goes back to the start page. This is
     * checked before any jump on the end page, so jumps only fire once the last iteration is done.
     *
     * @return the start page of the next iteration, or empty when {@code currentPageId} is not an end
     * page or its battery has just completed
     */
    public Optional<PageTarget> continueLoop(Scope scope, String currentPageId) {
        Optional<LoopPageRole> role = scope.definition().loopRole(currentPageId);
        if (role.isEmpty() || role.get().role() != LoopRole.END) {
            return Optional.empty();
        }
        LoopBattery battery = battery(scope, role.get());
        LoopPlan plan = scope.plans().get(battery.id());
        if (plan == null || plan.isComplete()) {
            return Optional.empty();
        }
        plan = skipStale(scope, battery, plan.advance());
        scope.plans().put(battery.id(), plan);
        if (plan.isComplete()) {
            log.debug("Battery {} completed", battery.id());
            return Optional.empty();
        }
        log.debug("Battery {} advanced to iteration {}", battery.id(), plan.cursor() + 1);
        return Optional.of(target(scope, battery.startPageId()));
    }

    private PageTarget leaveEnd(Scope scope, LoopBattery battery) {
        return continueLoop(scope, battery.endPageId())
                .orElseGet(() -> enter(scope, indexAfter(scope.definition(), battery.endPageId())));
    }

    private LoopPlan skipStale(Scope scope, LoopBattery battery, LoopPlan plan) {
        if (plan.isComplete()) return plan;
        Set<String> live = planner.liveKeys(scope.definition(), battery, scope.context().responses());
        while (!plan.isComplete() && !live.contains(plan.currentItem().orElseThrow().key())) {
            log.warn("Battery {} item '{}' no longer exists in its source; skipped",
                    battery.id(), plan.currentItem().orElseThrow().key());
            plan = plan.advance();
        }
        return plan;
    }

    private PageTarget target(Scope scope, String pageId) {
        return new PageTarget(pageId, loopContext(scope, pageId).orElse(null));
    }

    private boolean isVisible(Scope scope, String pageId) {
        return scope.definition().page(pageId)
                .map(page -> visibility.isVisible(scope.definition(), page, scope.context()))
                .orElse(false);
    }

    private LoopBattery battery(Scope scope, LoopPageRole role) {
        return scope.definition().battery(role.batteryId()).orElseThrow();
    }

    static String indexAfter(SurveyDefinition definition, String pageId) {
        List<Page> pages = definition.pages();
        for (int i = 0; i < pages.size() - 1; i++) {
            if (pages.get(i).id().equals(pageId)) return pages.get(i + 1).id();
        }
        return null;
    }

    static String indexBefore(SurveyDefinition definition, String pageId) {
        List<Page> pages = definition.pages();
        for (int i = 1; i < pages.size(); i++) {
            if (pages.get(i).id().equals(pageId)) return pages.get(i - 1).id();
        }
        return null;
    }
}
