package com.surveyflow.runtime.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ParserDtos {
    public record SurveyDoc(String version, String surveyId, String title,
                            List<ExpressionDoc> expressions,
                            List<PageDoc> pages,
                            List<GroupDoc> groups,
                            List<QuestionDoc> questions,
                            List<OptionDoc> options,
                            List<JumpDoc> jumps,
                            List<LoopDoc> loops,
                            List<LoopItemDoc> items,
                            List<MatrixEntryDoc> matrix) {}

    public record ExpressionDoc(String id, String dsl, int line) {}
    public record PageDoc(String id, int index, String title, String visibleIf, String questionOrder,
                          String groupOrder, int line) {}
    public record GroupDoc(String id, String pageId, int index, String title, String visibleIf, String order, int line) {}
    public record QuestionDoc(String id, String pageId, String groupId, int index, String variableName, String type,
                              String title, String optionOrder, String visibleIf, String carryForwardQuestionId,
                              String terminateIf, int line) {}
    public record OptionDoc(String id, String questionId, int index, String value, String label, String visibleIf,
                            String groupKey, Double weight, int line) {}
    public record JumpDoc(String id, String fromQuestionId, String fromPageId, String toQuestionId, String toPageId,
                          boolean toEnd, String when, int priority, int line) {}
    public record LoopDoc(String id, String name, String startPageId, String endPageId, String source,
                          String sourceQuestionId, Integer maxItems, boolean randomize,
                          boolean sampleWithoutReplacement, int line) {}
    public record LoopItemDoc(String loopId, String key, Map<String, String> attributes, boolean active,
                              Integer sortIndex, int line) {}

    public record MatrixEntryDoc(String id, String questionId, String axis, int index, String value, String label,
                                 String visibleIf, int line) {}

    public record ParseError(String code, String message, int line, String block, String sectionId) {}

    public static SurveyDoc emptySurvey() {
        return new SurveyDoc(null, null, null, new ArrayList<>(), new ArrayList<>(), new ArrayList<>(),
                new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>(),
                new ArrayList<>());
    }
}
