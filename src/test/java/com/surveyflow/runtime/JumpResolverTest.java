package com.surveyflow.runtime;

import com.surveyflow.runtime.domain.SurveyModels.*;
import com.surveyflow.runtime.expression.EvaluationContext;
import com.surveyflow.runtime.jump.JumpResolver;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.surveyflow.runtime.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class JumpResolverTest {
    private final JumpResolver resolver = new JumpResolver(Fixtures.evaluator());

    private static JumpDestination toPage(String pageId) {
        return new JumpDestination(DestinationType.PAGE, pageId);
    }

    private static SurveyDefinition survey(List<JumpRule> jumps, Question... extra) {
        List<Question> questions = new ArrayList<>(List.of(question("q1", "p1", "SMOKER", QuestionType.SINGLE_CHOICE),
                question("q5", "p3", "LATER", QuestionType.TEXT)));
        questions.addAll(List.of(extra));
        return SurveyDefinition.of("jumps", "1", "Jumps",
                List.of(page("p1", 1), page("p2", 2), page("p3", 3)),
                List.of(), questions, List.of(),
                List.of(new Expression("yes", "equals(answer('SMOKER'), 'yes')"),
                        new Expression("always", "notEmpty(answer('SMOKER'))"),
                        new Expression("broken", "equals(answer('SMOKER')"),
                        new Expression("unknown", "equals(answer('GHOST'), 'x')")),
                jumps, List.of(), List.of());
    }

    private static EvaluationContext answered(SurveyDefinition definition) {
        return context(definition, Map.of("q1", List.of("yes")));
    }

    @Test
    void lowestPriorityNumberWinsRegardlessOfListOrder() {
        SurveyDefinition definition = survey(List.of(
                new JumpRule("j2", "q1", null, toPage("p2"), "always", 2),
                new JumpRule("j1", "q1", null, toPage("p1"), "always", 1)));

        assertEquals(Optional.of(toPage("p1")), resolver.forQuestion(definition, "q1", answered(definition)));
    }

    @Test
    void ruleWithoutConditionIsUnconditional() {
        SurveyDefinition definition = survey(List.of(
                new JumpRule("j1", "q1", null, toPage("p3"), "unknown", 1),
                new JumpRule("j2", "q1", null, JumpDestination.end(), null, 5)));

        assertEquals(Optional.of(JumpDestination.end()), resolver.forQuestion(definition, "q1", answered(definition)));
    }

    @Test
    void failedEvaluationNeverJumps() {
        SurveyDefinition definition = survey(List.of(
                new JumpRule("j1", "q1", null, toPage("p2"), "broken", 1),
                new JumpRule("j2", "q1", null, toPage("p3"), "unknown", 2),
                new JumpRule("j3", "q1", null, toPage("p3"), "missing-expression", 3)));

        assertEquals(Optional.empty(), resolver.forQuestion(definition, "q1", answered(definition)));
    }

    @Test
    void danglingDestinationsAreSkipped() {
        SurveyDefinition definition = survey(List.of(
                new JumpRule("j1", "q1", null, toPage("nowhere"), null, 1),
                new JumpRule("j2", "q1", null, new JumpDestination(DestinationType.QUESTION, "q5"), "yes", 2)));

        Optional<JumpDestination> jump = resolver.forQuestion(definition, "q1", answered(definition));
        assertEquals(Optional.of(new JumpDestination(DestinationType.QUESTION, "q5")), jump);
        assertEquals(Optional.of("p3"), resolver.targetPage(definition, jump.orElseThrow()));
        assertEquals(Optional.empty(), resolver.targetPage(definition, JumpDestination.end()));
    }

    @Test
    void falseConditionFallsThroughToNoJump() {
        SurveyDefinition definition = survey(List.of(new JumpRule("j1", "q1", null, toPage("p3"), "yes", 1)));
        assertEquals(Optional.empty(), resolver.forQuestion(definition, "q1", context(definition, Map.of("q1", List.of("no")))));
    }

    @Test
    void pageRulesAreSeparateFromQuestionRules() {
        SurveyDefinition definition = survey(List.of(
                new JumpRule("jp", null, "p1", toPage("p3"), null, 1)));

        assertEquals(Optional.empty(), resolver.forQuestion(definition, "q1", answered(definition)));
        assertEquals(Optional.of(toPage("p3")), resolver.forPage(definition, "p1", answered(definition)));
    }

    @Test
    void terminationOnlyOnATrueCondition() {
        Question screener = new Question("q9", "p2", null, 1, "AGE", QuestionType.NUMBER, "Age", OrderMode.SEQUENTIAL,
                null, null, "yes");
        Question badScreener = new Question("q10", "p2", null, 2, "AGE2", QuestionType.NUMBER, "Age", OrderMode.SEQUENTIAL,
                null, null, "broken");
        SurveyDefinition definition = survey(List.of(), screener, badScreener);

        assertTrue(resolver.shouldTerminate(definition, screener, answered(definition)));
        assertFalse(resolver.shouldTerminate(definition, screener, context(definition, Map.of("q1", List.of("no")))));
        assertFalse(resolver.shouldTerminate(definition, badScreener, answered(definition)));
    }
}
