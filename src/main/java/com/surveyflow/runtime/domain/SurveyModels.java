package com.surveyflow.runtime.domain;

import java.util.*;
import java.util.stream.Collectors;

public class SurveyModels {
    /**
     * Anything that can carry a visibility expression reference.
     */
    public interface Conditional {
        String visibleIf();
    }

    public enum OrderMode { SEQUENTIAL, RANDOM, GROUP_RANDOM, WEIGHTED }

    public enum QuestionType {
        SINGLE_CHOICE, MULTIPLE_CHOICE, DROPDOWN, TEXT, NUMBER, BOOLEAN, MATRIX_SINGLE, MATRIX_MULTIPLE;

        public boolean isMatrix() {
            return this == MATRIX_SINGLE || this == MATRIX_MULTIPLE;
        }
    }

    public enum MatrixAxis { ROW, SCALE }

    public enum LoopSourceType { ANSWER, DATASET }

    public enum DestinationType { QUESTION, PAGE, END }

    public record Expression(String id, String dsl) {}

    public record Page(String id, int index, String title, String visibleIf,
                       OrderMode questionOrderMode, OrderMode groupOrderMode) implements Conditional {}

    public record QuestionGroup(String id, String pageId, int index, String title, String visibleIf,
                                OrderMode innerOrderMode) implements Conditional {}

    public record Question(String id, String pageId, String groupId, int index, String variableName,
                           QuestionType type, String title, OrderMode optionOrderMode, String visibleIf,
                           String carryForwardQuestionId, String terminateIf) implements Conditional {}

    public record Option(String id, String questionId, int index, String value, String label,
                         String visibleIf, String groupKey, Double weight) implements Conditional {}

    /**
     * A row (statement being rated) or a scale point (column) of a matrix question.
     */
    public record MatrixEntry(String id, String questionId, MatrixAxis axis, int index, String value, String label,
                              String visibleIf) implements Conditional {}

    public record JumpDestination(DestinationType type, String targetId) {
        public static JumpDestination end() {
            return new JumpDestination(DestinationType.END, null);
        }
    }

    public record JumpRule(String id, String fromQuestionId, String fromPageId, JumpDestination destination,
                           String conditionExpressionId, int priority) {}

    public record LoopBattery(String id, String name, String startPageId, String endPageId,
                              LoopSourceType sourceType, String sourceQuestionId, Integer maxItems,
                              boolean randomize, boolean sampleWithoutReplacement) {}

    public record LoopDatasetItem(String batteryId, String key, Map<String, String> attributes,
                                  boolean active, Integer sortIndex) {}

    public enum LoopRole { START, INTERIOR, END }

    public record LoopPageRole(String batteryId, LoopRole role) {}

    public record SurveyDefinition(String id, String version, String title,
                                   List<Page> pages,
                                   List<QuestionGroup> groups,
                                   List<Question> questions,
                                   List<Option> options,
                                   List<Expression> expressions,
                                   List<JumpRule> jumps,
                                   List<LoopBattery> batteries,
                                   List<LoopDatasetItem> datasetItems,
                                   List<MatrixEntry> matrixEntries,
                                   Lookup lookup) {

        public static SurveyDefinition of(String id, String version, String title,
                                          List<Page> pages, List<QuestionGroup> groups, List<Question> questions,
                                          List<Option> options, List<Expression> expressions, List<JumpRule> jumps,
                                          List<LoopBattery> batteries, List<LoopDatasetItem> datasetItems) {
            return of(id, version, title, pages, groups, questions, options, expressions, jumps, batteries,
                    datasetItems, List.of());
        }

        public static SurveyDefinition of(String id, String version, String title,
                                          List<Page> pages, List<QuestionGroup> groups, List<Question> questions,
                                          List<Option> options, List<Expression> expressions, List<JumpRule> jumps,
                                          List<LoopBattery> batteries, List<LoopDatasetItem> datasetItems,
                                          List<MatrixEntry> matrixEntries) {
            List<Page> sortedPages = pages.stream().sorted(Comparator.comparingInt(Page::index)).toList();
            return new SurveyDefinition(id, version, title, sortedPages, List.copyOf(groups), List.copyOf(questions),
                    List.copyOf(options), List.copyOf(expressions), List.copyOf(jumps), List.copyOf(batteries),
                    List.copyOf(datasetItems), List.copyOf(matrixEntries),
                    new Lookup(sortedPages, groups, questions, options, expressions, batteries, matrixEntries));
        }

        public Optional<Page> page(String pageId) {
            return Optional.ofNullable(lookup.pagesById().get(pageId));
        }

        public Optional<Question> question(String questionId) {
            return Optional.ofNullable(lookup.questionsById().get(questionId));
        }

        public Optional<Question> questionByVariable(String variableName) {
            return Optional.ofNullable(lookup.questionsByVariable().get(variableName));
        }

        public Optional<LoopBattery> battery(String batteryId) {
            return Optional.ofNullable(lookup.batteriesById().get(batteryId));
        }

        public Optional<String> expressionDsl(String expressionId) {
            return Optional.ofNullable(lookup.expressionsById().get(expressionId)).map(Expression::dsl);
        }

        public Optional<LoopPageRole> loopRole(String pageId) {
            return Optional.ofNullable(lookup.loopRoles().get(pageId));
        }

        public List<QuestionGroup> groupsOf(String pageId) {
            return lookup.groupsByPage().getOrDefault(pageId, List.of());
        }

        public List<Question> questionsOf(String pageId) {
            return lookup.questionsByPage().getOrDefault(pageId, List.of());
        }

        public List<Option> optionsOf(String questionId) {
            return lookup.optionsByQuestion().getOrDefault(questionId, List.of());
        }

        /**
         * Rows or scale points of a matrix question in authored order.
         */
        public List<MatrixEntry> matrixOf(String questionId, MatrixAxis axis) {
            return lookup.matrixByQuestion().getOrDefault(questionId, List.of()).stream()
                    .filter(e -> e.axis() == axis)
                    .toList();
        }

        public List<JumpRule> questionJumps(String questionId) {
            return jumps.stream().filter(j -> questionId.equals(j.fromQuestionId())).toList();
        }

        public List<JumpRule> pageJumps(String pageId) {
            return jumps.stream().filter(j -> pageId.equals(j.fromPageId())).toList();
        }

        public List<LoopDatasetItem> datasetItemsOf(String batteryId) {
            return datasetItems.stream().filter(i -> batteryId.equals(i.batteryId())).toList();
        }

        public List<LoopBattery> batteriesSourcedBy(String questionId) {
            return batteries.stream()
                    .filter(b -> b.sourceType() == LoopSourceType.ANSWER && questionId.equals(b.sourceQuestionId()))
                    .toList();
        }

        public Map<String, String> variableToQuestionId() {
            return lookup.questionsByVariable().entrySet().stream()
                    .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().id()));
        }
    }

    /**
     * Index tables built once per definition so runtime lookups never scan lists.
     */
    public record Lookup(Map<String, Page> pagesById,
                         Map<String, Question> questionsById,
                         Map<String, Question> questionsByVariable,
                         Map<String, Expression> expressionsById,
                         Map<String, LoopBattery> batteriesById,
                         Map<String, List<QuestionGroup>> groupsByPage,
                         Map<String, List<Question>> questionsByPage,
                         Map<String, List<Option>> optionsByQuestion,
                         Map<String, List<MatrixEntry>> matrixByQuestion,
                         Map<String, LoopPageRole> loopRoles) {

        Lookup(List<Page> pages, List<QuestionGroup> groups, List<Question> questions, List<Option> options,
               List<Expression> expressions, List<LoopBattery> batteries, List<MatrixEntry> matrixEntries) {
            this(index(pages, Page::id),
                    index(questions, Question::id),
                    index(questions, Question::variableName),
                    index(expressions, Expression::id),
                    index(batteries, LoopBattery::id),
                    groups.stream().sorted(Comparator.comparingInt(QuestionGroup::index))
                            .collect(Collectors.groupingBy(QuestionGroup::pageId, LinkedHashMap::new, Collectors.toList())),
                    questions.stream().sorted(Comparator.comparingInt(Question::index))
                            .collect(Collectors.groupingBy(Question::pageId, LinkedHashMap::new, Collectors.toList())),
                    options.stream().sorted(Comparator.comparingInt(Option::index))
                            .collect(Collectors.groupingBy(Option::questionId, LinkedHashMap::new, Collectors.toList())),
                    matrixEntries.stream().sorted(Comparator.comparingInt(MatrixEntry::index))
                            .collect(Collectors.groupingBy(MatrixEntry::questionId, LinkedHashMap::new, Collectors.toList())),
                    loopRoles(pages, batteries));
        }

        private static <T> Map<String, T> index(List<T> rows, java.util.function.Function<T, String> key) {
            Map<String, T> map = new HashMap<>();
            rows.forEach(r -> {
                String k = key.apply(r);
                if (k != null) map.putIfAbsent(k, r);
            });
            return map;
        }

        private static Map<String, LoopPageRole> loopRoles(List<Page> pages, List<LoopBattery> batteries) {
            Map<String, Integer> indexById = pages.stream().collect(Collectors.toMap(Page::id, Page::index, (a, b) -> a));
            Map<String, LoopPageRole> roles = new HashMap<>();
            for (LoopBattery battery : batteries) {
                Integer start = indexById.get(battery.startPageId());
                Integer end = indexById.get(battery.endPageId());
                if (start == null || end == null || start >= end) continue;
                for (Page page : pages) {
                    if (page.index() < start || page.index() > end) continue;
                    LoopRole role = page.index() == start ? LoopRole.START
                            : page.index() == end ? LoopRole.END : LoopRole.INTERIOR;
                    roles.putIfAbsent(page.id(), new LoopPageRole(battery.id(), role));
                }
            }
            return roles;
        }
    }
}
