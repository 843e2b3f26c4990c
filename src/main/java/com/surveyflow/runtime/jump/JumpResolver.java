package com.surveyflow.runtime.jump;

import com.surveyflow.runtime.domain.SurveyModels.*;
import com.surveyflow.runtime.expression.EvaluationContext;
import com.surveyflow.runtime.expression.ExpressionEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Prioritised conditional skips. Rules are tried by ascending priority (ties keep authored order);
 * the first rule whose condition holds wins. A condition that cannot be evaluated never triggers a
 * jump.
 */
@Component
public class JumpResolver {
    private static final Logger log = LoggerFactory.getLogger(JumpResolver.class);

    private final ExpressionEvaluator evaluator;

    public JumpResolver(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public Optional<JumpDestination> forQuestion(SurveyDefinition definition, String questionId, EvaluationContext context) {
        return resolve(definition, definition.questionJumps(questionId), context);
    }

    public Optional<JumpDestination> forPage(SurveyDefinition definition, String pageId, EvaluationContext context) {
        return resolve(definition, definition.pageJumps(pageId), context);
    }

    public Optional<JumpDestination> resolve(SurveyDefinition definition, List<JumpRule> rules, EvaluationContext context) {
        List<JumpRule> ordered = rules.stream().sorted(Comparator.comparingInt(JumpRule::priority)).toList();
        for (JumpRule rule : ordered) {
            if (!destinationExists(definition, rule.destination())) {
                log.warn("Survey {} jump {} points at missing {} {}; skipped",
                        definition.id(), rule.id(), rule.destination().type(), rule.destination().targetId());
                continue;
            }
            if (conditionHolds(definition, rule, context)) {
                log.debug("Jump {} taken to {}", rule.id(), rule.destination());
                return Optional.of(rule.destination());
            }
        }
        return Optional.empty();
    }

    /**
     * Termination is checked before a question's jumps. Failure to evaluate means "keep going".
     */
    public boolean shouldTerminate(SurveyDefinition definition, Question question, EvaluationContext context) {
        String expressionId = question.terminateIf();
        if (expressionId == null || expressionId.isBlank()) return false;
        Optional<String> dsl = definition.expressionDsl(expressionId);
        if (dsl.isEmpty()) {
            log.warn("Survey {} question {} terminates on missing expression {}", definition.id(), question.id(), expressionId);
            return false;
        }
        return evaluator.tryEvaluate(dsl.get(), context).orElse(false);
    }

    /**
     * Page a destination lands on; empty for END.
     */
    public Optional<String> targetPage(SurveyDefinition definition, JumpDestination destination) {
        return switch (destination.type()) {
            case PAGE -> definition.page(destination.targetId()).map(Page::id);
            case QUESTION -> definition.question(destination.targetId()).map(Question::pageId);
            case END -> Optional.empty();
        };
    }

    private boolean conditionHolds(SurveyDefinition definition, JumpRule rule, EvaluationContext context) {
        String expressionId = rule.conditionExpressionId();
        if (expressionId == null || expressionId.isBlank()) return true;
        Optional<String> dsl = definition.expressionDsl(expressionId);
        if (dsl.isEmpty()) {
            log.warn("Survey {} jump {} uses missing expression {}; not taken", definition.id(), rule.id(), expressionId);
            return false;
        }
        return evaluator.tryEvaluate(dsl.get(), context).orElse(false);
    }

    private boolean destinationExists(SurveyDefinition definition, JumpDestination destination) {
        if (destination == null) return false;
        return switch (destination.type()) {
            case END -> true;
            case PAGE -> definition.page(destination.targetId()).isPresent();
            case QUESTION -> definition.question(destination.targetId()).isPresent();
        };
    }
}
