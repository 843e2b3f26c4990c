package com.surveyflow.runtime.session;

import com.surveyflow.runtime.domain.SurveyModels.*;
import com.surveyflow.runtime.expression.EvaluationContext;
import com.surveyflow.runtime.loop.LoopModels.LoopContext;
import com.surveyflow.runtime.ordering.OrderResolver;
import com.surveyflow.runtime.ordering.OrderResolver.OrderItem;
import com.surveyflow.runtime.session.SessionModels.*;
import com.surveyflow.runtime.template.AnswerPipingResolver;
import com.surveyflow.runtime.template.LoopTemplateResolver;
import com.surveyflow.runtime.visibility.VisibilityResolver;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Produces the final content of one page: visible groups, questions and options in display order,
 * with loop tokens and piped answers substituted.
 */
@Component
public class PageResolver {
    static final String STANDALONE_GROUP = "standalone";

    private final VisibilityResolver visibility;
    private final OrderResolver orderResolver;
    private final LoopTemplateResolver loopTemplates;
    private final AnswerPipingResolver piping;

    public PageResolver(VisibilityResolver visibility,
                        OrderResolver orderResolver,
                        LoopTemplateResolver loopTemplates,
                        AnswerPipingResolver piping) {
        this.visibility = visibility;
        this.orderResolver = orderResolver;
        this.loopTemplates = loopTemplates;
        this.piping = piping;
    }

    public ResolvedPage resolve(String sessionId, SurveyDefinition definition, Page page, EvaluationContext context,
                                Map<String, List<String>> orderCache, LoopContext loop) {
        if (!visibility.isVisible(definition, page, context)) {
            return new ResolvedPage(definition.id(), page.id(), text(page.title(), definition, context, loop), false, List.of(), loop);
        }

        List<QuestionGroup> groups = orderResolver.arrange(sessionId, "page:" + page.id() + ":groups", page.groupOrderMode(),
                visibility.visibleOnly(definition, definition.groupsOf(page.id()), context),
                g -> OrderItem.of(g.id()), orderCache);

        List<Question> visibleQuestions = visibility.visibleOnly(definition, definition.questionsOf(page.id()), context);

        List<ResolvedGroup> resolved = new ArrayList<>();
        for (QuestionGroup group : groups) {
            List<Question> members = visibleQuestions.stream().filter(q -> group.id().equals(q.groupId())).toList();
            List<ResolvedQuestion> questions = orderResolver.arrange(sessionId, "group:" + group.id(), group.innerOrderMode(),
                            members, q -> OrderItem.of(q.id()), orderCache).stream()
                    .map(q -> question(sessionId, definition, q, context, orderCache, loop))
                    .toList();
            if (!questions.isEmpty()) {
                resolved.add(new ResolvedGroup(group.id(), text(group.title(), definition, context, loop), questions));
            }
        }

        List<Question> standalone = visibleQuestions.stream()
                .filter(q -> q.groupId() == null
                        || definition.groupsOf(page.id()).stream().noneMatch(g -> g.id().equals(q.groupId())))
                .toList();
        if (!standalone.isEmpty()) {
            List<ResolvedQuestion> questions = orderResolver.arrange(sessionId, "page:" + page.id(), page.questionOrderMode(),
                            standalone, q -> OrderItem.of(q.id()), orderCache).stream()
                    .map(q -> question(sessionId, definition, q, context, orderCache, loop))
                    .toList();
            resolved.add(new ResolvedGroup(STANDALONE_GROUP, null, questions));
        }

        return new ResolvedPage(definition.id(), page.id(), text(page.title(), definition, context, loop), true, resolved, loop);
    }

    private ResolvedQuestion question(String sessionId, SurveyDefinition definition, Question question, EvaluationContext context,
                                      Map<String, List<String>> orderCache, LoopContext loop) {
        List<Candidate> candidates = new ArrayList<>();
        Set<String> values = new HashSet<>();
        for (Option option : visibility.visibleOnly(definition, definition.optionsOf(question.id()), context)) {
            if (values.add(option.value())) candidates.add(new Candidate(option, false));
        }
        carriedForward(definition, question, context).forEach(option -> {
            if (values.add(option.value())) candidates.add(new Candidate(option, true));
        });

        List<ResolvedOption> options = orderResolver.arrange(sessionId, "question:" + question.id(), question.optionOrderMode(),
                        candidates, c -> new OrderItem(c.id(), c.option().groupKey(), c.option().weight()), orderCache).stream()
                .map(c -> new ResolvedOption(c.id(), c.option().value(), text(c.option().label(), definition, context, loop), c.carried()))
                .toList();

        return new ResolvedQuestion(question.id(), question.variableName(), question.type(),
                text(question.title(), definition, context, loop), options,
                matrix(definition, question, MatrixAxis.ROW, context, loop),
                matrix(definition, question, MatrixAxis.SCALE, context, loop));
    }

    private List<ResolvedMatrixEntry> matrix(SurveyDefinition definition, Question question, MatrixAxis axis,
                                             EvaluationContext context, LoopContext loop) {
        if (!question.type().isMatrix()) return List.of();
        return visibility.visibleOnly(definition, definition.matrixOf(question.id(), axis), context).stream()
                .map(e -> new ResolvedMatrixEntry(e.id(), e.value(), text(e.label(), definition, context, loop)))
                .toList();
    }

    /**
     * Options of the carry-forward source that the respondent selected, in the order selected.
     */
    private List<Option> carriedForward(SurveyDefinition definition, Question question, EvaluationContext context) {
        String sourceId = question.carryForwardQuestionId();
        if (sourceId == null) return List.of();
        List<String> selected = context.responses().getOrDefault(sourceId, List.of());
        List<Option> sourceOptions = definition.optionsOf(sourceId);
        List<Option> carried = new ArrayList<>();
        for (String value : selected) {
            sourceOptions.stream().filter(o -> o.value().equals(value)).findFirst().ifPresent(carried::add);
        }
        return carried;
    }

    private String text(String raw, SurveyDefinition definition, EvaluationContext context, LoopContext loop) {
        return piping.resolve(loopTemplates.resolve(raw, loop), definition, context);
    }

    private record Candidate(Option option, boolean carried) {
        String id() {
            return carried ? "cf:" + option.id() : option.id();
        }
    }
}
