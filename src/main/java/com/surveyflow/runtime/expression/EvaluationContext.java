package com.surveyflow.runtime.expression;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of one respondent's answers as seen by the expression evaluator.
 *
 * @param responses           question id to submitted values
 * @param embeddedData        values attached to the session at start (url parameters, panel data)
 * @param questionIdsByVariable variable name to question id for the survey being taken
 */
public record EvaluationContext(Map<String, List<String>> responses,
                                Map<String, String> embeddedData,
                                Map<String, String> questionIdsByVariable) {

    public EvaluationContext {
        responses = responses == null ? Map.of() : responses;
        embeddedData = embeddedData == null ? Map.of() : embeddedData;
        questionIdsByVariable = questionIdsByVariable == null ? Map.of() : questionIdsByVariable;
    }

    /**
     * Values for a reference. A known but unanswered question resolves to an empty list; a reference
     * that matches neither a question nor a stored key raises {@link UnknownReferenceException}.
     */
    public List<String> resolve(String ref) {
        String questionId = questionIdsByVariable.get(ref);
        if (questionId != null) {
            return responses.getOrDefault(questionId, List.of());
        }
        if (responses.containsKey(ref)) {
            return responses.get(ref);
        }
        if (questionIdsByVariable.containsValue(ref)) {
            return List.of();
        }
        if (embeddedData.containsKey(ref)) {
            return List.of(embeddedData.get(ref));
        }
        throw new UnknownReferenceException(ref);
    }
}
