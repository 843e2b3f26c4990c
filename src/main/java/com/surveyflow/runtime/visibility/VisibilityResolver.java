package com.surveyflow.runtime.visibility;

import com.surveyflow.runtime.domain.SurveyModels.Conditional;
import com.surveyflow.runtime.domain.SurveyModels.SurveyDefinition;
import com.surveyflow.runtime.expression.EvaluationContext;
import com.surveyflow.runtime.expression.ExpressionEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class VisibilityResolver {
    private static final Logger log = LoggerFactory.getLogger(VisibilityResolver.class);

    private final ExpressionEvaluator evaluator;

    public VisibilityResolver(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Same contract for pages, groups, questions and options. Recomputed on every call.
     */
    public boolean isVisible(SurveyDefinition definition, Conditional entity, EvaluationContext context) {
        String expressionId = entity.visibleIf();
        if (expressionId == null || expressionId.isBlank()) return true;

        Optional<String> dsl = definition.expressionDsl(expressionId);
        if (dsl.isEmpty()) {
            log.warn("Survey {} references missing expression {}; treating {} as visible",
                    definition.id(), expressionId, entity);
            return true;
        }
        return evaluator.evaluate(dsl.get(), context);
    }

    public <T extends Conditional> List<T> visibleOnly(SurveyDefinition definition, List<T> entities,
                                                      EvaluationContext context) {
        return entities.stream().filter(e -> isVisible(definition, e, context)).toList();
    }
}
