package com.surveyflow.runtime.session;

import com.surveyflow.runtime.config.RuntimeProperties;
import com.surveyflow.runtime.definition.SurveyDefinitionService;
import com.surveyflow.runtime.domain.SurveyModels.*;
import com.surveyflow.runtime.expression.EvaluationContext;
import com.surveyflow.runtime.jump.JumpResolver;
import com.surveyflow.runtime.loop.LoopModels.LoopPlan;
import com.surveyflow.runtime.loop.LoopModels.LoopProgress;
import com.surveyflow.runtime.loop.LoopNavigator;
import com.surveyflow.runtime.loop.LoopNavigator.PageTarget;
import com.surveyflow.runtime.repository.SessionJdbcRepository;
import com.surveyflow.runtime.session.SessionModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.function.Function;

/**
 * Respondent-facing operations. Each call loads the session, works on a copy and commits it with a
 * compare-and-swap; a lost race re-runs the step against the fresh state.
 */
@Service
public class SurveyRuntimeService {
    private static final Logger log = LoggerFactory.getLogger(SurveyRuntimeService.class);

    private final SurveyDefinitionService definitions;
    private final SessionJdbcRepository sessions;
    private final PageResolver pageResolver;
    private final JumpResolver jumpResolver;
    private final LoopNavigator navigator;
    private final RuntimeProperties properties;

    public SurveyRuntimeService(SurveyDefinitionService definitions,
                                SessionJdbcRepository sessions,
                                PageResolver pageResolver,
                                JumpResolver jumpResolver,
                                LoopNavigator navigator,
                                RuntimeProperties properties) {
        this.definitions = definitions;
        this.sessions = sessions;
        this.pageResolver = pageResolver;
        this.jumpResolver = jumpResolver;
        this.navigator = navigator;
        this.properties = properties;
    }

    public NavigationResult startSession(String surveyId, Map<String, String> embeddedData) {
        SurveyDefinition definition = definitions.definition(surveyId);
        String sessionId = UUID.randomUUID().toString();
        SessionState fresh = new SessionState(sessionId, surveyId, 0, SessionStatus.IN_PROGRESS, null, Map.of(),
                embeddedData == null ? Map.of() : Map.copyOf(embeddedData), SessionRenderState.initial(), List.of(),
                null, Instant.now());

        Working work = new Working(definition, fresh);
        PageTarget target = navigator.first(work.scope());
        work.moveTo(target);
        sessions.insert(work.toState());
        log.info("Session {} started on survey {} at page {}", sessionId, surveyId, target.pageId());
        return work.result(target, null);
    }

    public SessionState session(String sessionId) {
        return sessions.find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public ResolvedPage resolvePage(String sessionId, String pageId) {
        return mutate(sessionId, work -> {
            Page page = work.definition.page(pageId).orElseThrow(() -> new PageNotFoundException(pageId));
            if (work.definition.loopRole(pageId).filter(r -> r.role() == LoopRole.START).isPresent()) {
                // Rendering a start page directly counts as arriving there.
                navigator.enter(work.scope(), pageId);
            }
            return pageResolver.resolve(sessionId, work.definition, page, work.context(), work.orderCache,
                    navigator.loopContext(work.scope(), pageId).orElse(null));
        });
    }

    public AnswerResult submitAnswer(String sessionId, String questionId, List<String> values) {
        return mutate(sessionId, work -> {
            Question question = work.definition.question(questionId)
                    .orElseThrow(() -> new QuestionNotFoundException(questionId));
            if (work.status != SessionStatus.IN_PROGRESS) {
                return new AnswerResult(sessionId, work.status, questionId, null, false);
            }

            List<String> cleaned = values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
            List<String> previous = work.responses.getOrDefault(questionId, List.of());
            if (cleaned.isEmpty()) work.responses.remove(questionId);
            else work.responses.put(questionId, cleaned);

            boolean reset = false;
            if (!previous.equals(cleaned) && !work.definition.batteriesSourcedBy(questionId).isEmpty()) {
                navigator.resetForQuestion(work.definition, questionId, work.plans);
                reset = true;
            }

            EvaluationContext context = work.context();
            if (jumpResolver.shouldTerminate(work.definition, question, context)) {
                work.status = SessionStatus.TERMINATED;
                work.terminationReason = "question:" + questionId;
                work.currentPageId = null;
                log.info("Session {} terminated by answer to {}", sessionId, questionId);
                return new AnswerResult(sessionId, work.status, questionId, null, reset);
            }

            JumpDestination jump = jumpResolver.forQuestion(work.definition, questionId, context).orElse(null);
            return new AnswerResult(sessionId, work.status, questionId, jump, reset);
        });
    }

    public NavigationResult next(String sessionId) {
        return mutate(sessionId, work -> {
            if (work.status != SessionStatus.IN_PROGRESS || work.currentPageId == null) {
                return work.result(new PageTarget(work.currentPageId, null), null);
            }
            String current = work.currentPageId;
            Optional<PageTarget> repeat = navigator.continueLoop(work.scope(), current);
            if (repeat.isPresent()) {
                work.moveTo(repeat.get());
                return work.result(repeat.get(), null);
            }
            Optional<JumpDestination> jump = pendingJump(work, current);
            if (jump.isPresent()) {
                JumpDestination destination = jump.get();
                if (destination.type() == DestinationType.END) {
                    work.complete();
                    log.info("Session {} ended by jump from page {}", sessionId, current);
                    return work.result(PageTarget.end(), destination);
                }
                String targetPage = jumpResolver.targetPage(work.definition, destination).orElseThrow();
                PageTarget target = navigator.enter(work.scope(), targetPage);
                work.moveTo(target);
                return work.result(target, destination);
            }

            PageTarget target = navigator.next(work.scope(), current);
            work.moveTo(target);
            return work.result(target, null);
        });
    }

    public NavigationResult previous(String sessionId) {
        return mutate(sessionId, work -> {
            if (work.status != SessionStatus.IN_PROGRESS || work.currentPageId == null) {
                return work.result(new PageTarget(work.currentPageId, null), null);
            }
            PageTarget target = navigator.previous(work.scope(), work.currentPageId)
                    .orElseGet(() -> new PageTarget(work.currentPageId,
                            navigator.loopContext(work.scope(), work.currentPageId).orElse(null)));
            work.moveTo(target);
            return work.result(target, null);
        });
    }

    public LoopProgress loopProgress(String sessionId, String batteryId) {
        SessionState state = session(sessionId);
        definitions.definition(state.surveyId()).battery(batteryId)
                .orElseThrow(() -> new BatteryNotFoundException(batteryId));
        return navigator.progress(batteryId, state.renderState().loopPlans());
    }

    /**
     * Question jumps of the current page's visible, answered questions in page order, then the page's
     * own jumps.
     */
    private Optional<JumpDestination> pendingJump(Working work, String pageId) {
        EvaluationContext context = work.context();
        for (Question question : work.definition.questionsOf(pageId)) {
            if (!work.responses.containsKey(question.id())) continue;
            Optional<JumpDestination> jump = jumpResolver.forQuestion(work.definition, question.id(), context);
            if (jump.isPresent()) return jump;
        }
        return jumpResolver.forPage(work.definition, pageId, context);
    }

    private <T> T mutate(String sessionId, Function<Working, T> step) {
        int attempts = Math.max(1, properties.getCasMaxAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            SessionState state = session(sessionId);
            Working work = new Working(definitions.definition(state.surveyId()), state);
            T result = step.apply(work);
            if (sessions.compareAndSwap(work.toState(), state.version())) {
                return result;
            }
            log.warn("Session {} changed under us at version {} (attempt {}/{})", sessionId, state.version(), attempt, attempts);
        }
        throw new SessionConflictException(sessionId, attempts);
    }

    /**
     * Mutable copy of one session for the duration of a step.
     */
    private final class Working {
        private final SurveyDefinition definition;
        private final SessionState origin;
        private final Map<String, List<String>> responses;
        private final Map<String, LoopPlan> plans;
        private final Map<String, List<String>> orderCache;
        private final List<String> history;
        private SessionStatus status;
        private String currentPageId;
        private String terminationReason;

        Working(SurveyDefinition definition, SessionState state) {
            this.definition = definition;
            this.origin = state;
            this.responses = new LinkedHashMap<>(state.responses());
            this.plans = new LinkedHashMap<>(state.renderState().loopPlans());
            this.orderCache = new LinkedHashMap<>(state.renderState().orderCache());
            this.history = new ArrayList<>(state.visitHistory());
            this.status = state.status();
            this.currentPageId = state.currentPageId();
            this.terminationReason = state.terminationReason();
        }

        EvaluationContext context() {
            return new EvaluationContext(responses, origin.embeddedData(), definition.variableToQuestionId());
        }

        LoopNavigator.Scope scope() {
            return new LoopNavigator.Scope(definition, context(), plans, origin.sessionId());
        }

        void moveTo(PageTarget target) {
            if (target.isEnd()) {
                complete();
                return;
            }
            if (!target.pageId().equals(currentPageId) || history.isEmpty()) {
                history.add(target.pageId());
            }
            currentPageId = target.pageId();
        }

        void complete() {
            status = SessionStatus.COMPLETED;
            currentPageId = null;
            log.info("Session {} completed", origin.sessionId());
        }

        NavigationResult result(PageTarget target, JumpDestination jump) {
            return new NavigationResult(origin.sessionId(), status, target.pageId(), target.loopContext(), jump);
        }

        SessionState toState() {
            return new SessionState(origin.sessionId(), origin.surveyId(), origin.version(), status, currentPageId,
                    Map.copyOf(responses), origin.embeddedData(), new SessionRenderState(Map.copyOf(plans), Map.copyOf(orderCache)),
                    List.copyOf(history), terminationReason, origin.startedAt());
        }
    }
}
