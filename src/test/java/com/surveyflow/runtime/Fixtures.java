package com.surveyflow.runtime;

import com.surveyflow.runtime.domain.SurveyModels.*;
import com.surveyflow.runtime.expression.EvaluationContext;
import com.surveyflow.runtime.expression.ExpressionEvaluator;
import com.surveyflow.runtime.expression.ExpressionParser;
import com.surveyflow.runtime.loop.LoopNavigator;
import com.surveyflow.runtime.loop.LoopPlanner;
import com.surveyflow.runtime.ordering.Shuffler;
import com.surveyflow.runtime.visibility.VisibilityResolver;

import java.util.List;
import java.util.Map;
import java.util.Random;

final class Fixtures {
    private Fixtures() {
    }

    static ExpressionEvaluator evaluator() {
        return new ExpressionEvaluator(new ExpressionParser());
    }

    static Shuffler shuffler() {
        return new Shuffler(new Random(42));
    }

    static LoopNavigator navigator() {
        return new LoopNavigator(new LoopPlanner(shuffler()), new VisibilityResolver(evaluator()));
    }

    static Page page(String id, int index) {
        return new Page(id, index, "Page " + id, null, OrderMode.SEQUENTIAL, OrderMode.SEQUENTIAL);
    }

    static Question question(String id, String pageId, String variable, QuestionType type) {
        return new Question(id, pageId, null, 1, variable, type, "Question " + id, OrderMode.SEQUENTIAL, null, null, null);
    }

    static Option option(String questionId, int index, String value, String label) {
        return new Option(questionId + ":" + value, questionId, index, value, label, null, null, null);
    }

    static LoopBattery answerBattery(String id, String start, String end, String sourceQuestionId, Integer maxItems) {
        return new LoopBattery(id, id, start, end, LoopSourceType.ANSWER, sourceQuestionId, maxItems, false, false);
    }

    static LoopBattery datasetBattery(String id, String start, String end, Integer maxItems) {
        return new LoopBattery(id, id, start, end, LoopSourceType.DATASET, null, maxItems, false, false);
    }

    static LoopDatasetItem item(String batteryId, String key, int sortIndex) {
        return new LoopDatasetItem(batteryId, key, Map.of("label", "Item " + key, "color", "c-" + key), true, sortIndex);
    }

    /**
     * p1 asks brand question q1 (variable BRANDS); p2..p3 loop over its answer; p4 follows.
     */
    static SurveyDefinition brandLoopSurvey() {
        return SurveyDefinition.of("brands", "1", "Brands",
                List.of(page("p1", 1), page("p2", 2), page("p3", 3), page("p4", 4)),
                List.of(),
                List.of(question("q1", "p1", "BRANDS", QuestionType.MULTIPLE_CHOICE),
                        question("q2", "p2", "RATING", QuestionType.NUMBER)),
                List.of(option("q1", 1, "a", "Alpha"), option("q1", 2, "b", "Beta"), option("q1", 3, "c", "Gamma")),
                List.of(), List.of(),
                List.of(answerBattery("b1", "p2", "p3", "q1", null)),
                List.of());
    }

    /**
     * Dataset loop over three active items A, B, C on p2..p3, capped at two.
     */
    static SurveyDefinition datasetLoopSurvey() {
        return SurveyDefinition.of("dataset", "1", "Dataset",
                List.of(page("p1", 1), page("p2", 2), page("p3", 3), page("p4", 4)),
                List.of(), List.of(), List.of(), List.of(), List.of(),
                List.of(datasetBattery("d1", "p2", "p3", 2)),
                List.of(item("d1", "C", 3), item("d1", "A", 1), item("d1", "B", 2)));
    }

    static EvaluationContext context(SurveyDefinition definition, Map<String, List<String>> responses) {
        return new EvaluationContext(responses, Map.of(), definition.variableToQuestionId());
    }
}
