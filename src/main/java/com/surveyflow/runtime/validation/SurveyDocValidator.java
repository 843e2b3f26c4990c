package com.surveyflow.runtime.validation;

import com.surveyflow.runtime.expression.ExpressionEvaluator;
import com.surveyflow.runtime.parser.ParserDtos.*;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Authoring checks run at import. Anything reported here would otherwise only show up at runtime as
 * a fail-open default.
 */
@Component
public class SurveyDocValidator {
    private final ExpressionEvaluator evaluator;

    public SurveyDocValidator(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public List<ParseError> validate(SurveyDoc doc) {
        List<ParseError> errors = new ArrayList<>();

        duplicate(doc.expressions().stream().map(e -> new Row(e.id(), e.line(), "expression")).toList(), "DUPLICATE_EXPRESSION", errors);
        duplicate(doc.pages().stream().map(p -> new Row(p.id(), p.line(), "page")).toList(), "DUPLICATE_PAGE", errors);
        duplicate(doc.pages().stream().map(p -> new Row(String.valueOf(p.index()), p.line(), "page")).toList(), "DUPLICATE_PAGE_INDEX", errors);
        duplicate(doc.groups().stream().map(g -> new Row(g.id(), g.line(), "group")).toList(), "DUPLICATE_GROUP", errors);
        duplicate(doc.questions().stream().map(q -> new Row(q.id(), q.line(), "question")).toList(), "DUPLICATE_QUESTION", errors);
        duplicate(doc.questions().stream().map(q -> new Row(q.variableName(), q.line(), "question")).toList(), "DUPLICATE_VARIABLE", errors);
        duplicate(doc.options().stream().map(o -> new Row(o.questionId() + "/" + o.value(), o.line(), "option")).toList(), "DUPLICATE_OPTION", errors);
        duplicate(doc.matrix().stream().map(m -> new Row(m.questionId() + "/" + m.axis() + "/" + m.value(), m.line(), m.axis())).toList(), "DUPLICATE_MATRIX_ENTRY", errors);
        duplicate(doc.jumps().stream().map(j -> new Row(j.id(), j.line(), "jump")).toList(), "DUPLICATE_JUMP", errors);
        duplicate(doc.loops().stream().map(l -> new Row(l.id(), l.line(), "loop")).toList(), "DUPLICATE_LOOP", errors);
        duplicate(doc.items().stream().map(i -> new Row(i.loopId() + "/" + i.key(), i.line(), "item")).toList(), "DUPLICATE_LOOP_ITEM", errors);

        doc.expressions().forEach(e -> evaluator.validate(e.dsl()).ifPresent(message ->
                errors.add(new ParseError("INVALID_EXPRESSION", "Expression " + e.id() + ": " + message, e.line(), "expression", e.id()))));

        Set<String> expressionIds = doc.expressions().stream().map(ExpressionDoc::id).collect(Collectors.toSet());
        Map<String, PageDoc> pages = doc.pages().stream().collect(Collectors.toMap(PageDoc::id, Function.identity(), (a, b) -> a));
        Map<String, GroupDoc> groups = doc.groups().stream().collect(Collectors.toMap(GroupDoc::id, Function.identity(), (a, b) -> a));
        Map<String, QuestionDoc> questions = doc.questions().stream().collect(Collectors.toMap(QuestionDoc::id, Function.identity(), (a, b) -> a));

        doc.pages().forEach(p -> expressionRef(p.visibleIf(), expressionIds, p.line(), "page", p.id(), errors));
        doc.groups().forEach(g -> {
            if (!pages.containsKey(g.pageId())) {
                errors.add(new ParseError("PAGE_NOT_FOUND", "Group references unknown page: " + g.pageId(), g.line(), "group", g.id()));
            }
            expressionRef(g.visibleIf(), expressionIds, g.line(), "group", g.id(), errors);
        });
        doc.questions().forEach(q -> {
            if (!pages.containsKey(q.pageId())) {
                errors.add(new ParseError("PAGE_NOT_FOUND", "Question references unknown page: " + q.pageId(), q.line(), "question", q.id()));
            }
            if (q.groupId() != null) {
                GroupDoc group = groups.get(q.groupId());
                if (group == null) {
                    errors.add(new ParseError("GROUP_NOT_FOUND", "Question references unknown group: " + q.groupId(), q.line(), "question", q.id()));
                } else if (!group.pageId().equals(q.pageId())) {
                    errors.add(new ParseError("GROUP_PAGE_MISMATCH", "Group " + q.groupId() + " is not on page " + q.pageId(), q.line(), "question", q.id()));
                }
            }
            if (q.carryForwardQuestionId() != null && !questions.containsKey(q.carryForwardQuestionId())) {
                errors.add(new ParseError("QUESTION_NOT_FOUND", "Carry-forward source not found: " + q.carryForwardQuestionId(), q.line(), "question", q.id()));
            }
            expressionRef(q.visibleIf(), expressionIds, q.line(), "question", q.id(), errors);
            expressionRef(q.terminateIf(), expressionIds, q.line(), "question", q.id(), errors);
        });
        doc.options().forEach(o -> {
            if (!questions.containsKey(o.questionId())) {
                errors.add(new ParseError("QUESTION_NOT_FOUND", "Option references unknown question: " + o.questionId(), o.line(), "option", o.id()));
            }
            if (o.weight() != null && o.weight() < 0) {
                errors.add(new ParseError("INVALID_WEIGHT", "Option weight must not be negative", o.line(), "option", o.id()));
            }
            expressionRef(o.visibleIf(), expressionIds, o.line(), "option", o.id(), errors);
        });

        validateMatrix(doc, questions, expressionIds, errors);
        doc.jumps().forEach(j -> validateJump(j, pages, questions, expressionIds, errors));
        validateLoops(doc, pages, questions, errors);
        return errors;
    }

    private void validateMatrix(SurveyDoc doc, Map<String, QuestionDoc> questions, Set<String> expressionIds,
                                List<ParseError> errors) {
        doc.matrix().forEach(m -> {
            QuestionDoc question = questions.get(m.questionId());
            if (question == null) {
                errors.add(new ParseError("QUESTION_NOT_FOUND", "Matrix " + m.axis() + " references unknown question: " + m.questionId(), m.line(), m.axis(), m.id()));
            } else if (!question.type().startsWith("matrix_")) {
                errors.add(new ParseError("INVALID_MATRIX_ENTRY", "Question " + question.id() + " is not a matrix", m.line(), m.axis(), m.id()));
            }
            expressionRef(m.visibleIf(), expressionIds, m.line(), m.axis(), m.id(), errors);
        });

        doc.questions().stream().filter(q -> q.type().startsWith("matrix_")).forEach(q -> {
            for (String axis : List.of("row", "scale")) {
                if (doc.matrix().stream().noneMatch(m -> m.questionId().equals(q.id()) && m.axis().equals(axis))) {
                    errors.add(new ParseError("MISSING_MATRIX_ENTRIES", "Matrix question " + q.id() + " needs at least one @" + axis, q.line(), "question", q.id()));
                }
            }
        });
    }

    private void validateJump(JumpDoc j, Map<String, PageDoc> pages, Map<String, QuestionDoc> questions,
                              Set<String> expressionIds, List<ParseError> errors) {
        if ((j.fromQuestionId() == null) == (j.fromPageId() == null)) {
            errors.add(new ParseError("INVALID_JUMP_SOURCE", "Jump needs exactly one of question or page", j.line(), "jump", j.id()));
        } else if (j.fromQuestionId() != null && !questions.containsKey(j.fromQuestionId())) {
            errors.add(new ParseError("QUESTION_NOT_FOUND", "Jump source question not found: " + j.fromQuestionId(), j.line(), "jump", j.id()));
        } else if (j.fromPageId() != null && !pages.containsKey(j.fromPageId())) {
            errors.add(new ParseError("PAGE_NOT_FOUND", "Jump source page not found: " + j.fromPageId(), j.line(), "jump", j.id()));
        }

        int destinations = (j.toQuestionId() == null ? 0 : 1) + (j.toPageId() == null ? 0 : 1) + (j.toEnd() ? 1 : 0);
        if (destinations != 1) {
            errors.add(new ParseError("INVALID_JUMP_DESTINATION", "Jump needs exactly one of to_question, to_page or to=\"end\"", j.line(), "jump", j.id()));
        } else if (j.toQuestionId() != null && !questions.containsKey(j.toQuestionId())) {
            errors.add(new ParseError("DESTINATION_NOT_FOUND", "Jump destination question not found: " + j.toQuestionId(), j.line(), "jump", j.id()));
        } else if (j.toPageId() != null && !pages.containsKey(j.toPageId())) {
            errors.add(new ParseError("DESTINATION_NOT_FOUND", "Jump destination page not found: " + j.toPageId(), j.line(), "jump", j.id()));
        }
        expressionRef(j.when(), expressionIds, j.line(), "jump", j.id(), errors);
    }

    private void validateLoops(SurveyDoc doc, Map<String, PageDoc> pages, Map<String, QuestionDoc> questions,
                               List<ParseError> errors) {
        record Range(String loopId, int start, int end) {}
        List<Range> ranges = new ArrayList<>();

        for (LoopDoc loop : doc.loops()) {
            PageDoc start = pages.get(loop.startPageId());
            PageDoc end = pages.get(loop.endPageId());
            if (start == null || end == null) {
                errors.add(new ParseError("PAGE_NOT_FOUND", "Loop start/end page not found", loop.line(), "loop", loop.id()));
            } else if (start.index() >= end.index()) {
                errors.add(new ParseError("INVALID_LOOP_RANGE", "Loop start page must come before its end page", loop.line(), "loop", loop.id()));
            } else {
                ranges.add(new Range(loop.id(), start.index(), end.index()));
            }

            if (loop.maxItems() != null && loop.maxItems() <= 0) {
                errors.add(new ParseError("INVALID_MAX_ITEMS", "Loop max_items must be positive", loop.line(), "loop", loop.id()));
            }

            if ("answer".equals(loop.source())) {
                QuestionDoc source = loop.sourceQuestionId() == null ? null : questions.get(loop.sourceQuestionId());
                if (source == null) {
                    errors.add(new ParseError("INVALID_LOOP_SOURCE", "Answer loop needs an existing source question", loop.line(), "loop", loop.id()));
                } else {
                    if (!"multiple_choice".equals(source.type())) {
                        errors.add(new ParseError("INVALID_LOOP_SOURCE", "Loop source question must be multiple choice: " + source.id(), loop.line(), "loop", loop.id()));
                    }
                    PageDoc sourcePage = pages.get(source.pageId());
                    if (start != null && sourcePage != null && sourcePage.index() >= start.index()) {
                        errors.add(new ParseError("INVALID_LOOP_SOURCE", "Loop source question must be answered before the loop starts", loop.line(), "loop", loop.id()));
                    }
                }
            }
        }

        for (int i = 0; i < ranges.size(); i++) {
            for (int j = i + 1; j < ranges.size(); j++) {
                Range a = ranges.get(i);
                Range b = ranges.get(j);
                if (a.start() <= b.end() && b.start() <= a.end()) {
                    LoopDoc later = doc.loops().stream().filter(l -> l.id().equals(b.loopId())).findFirst().orElseThrow();
                    errors.add(new ParseError("LOOP_OVERLAP", "Loops " + a.loopId() + " and " + b.loopId() + " share pages", later.line(), "loop", later.id()));
                }
            }
        }

        Set<String> loopIds = doc.loops().stream().map(LoopDoc::id).collect(Collectors.toSet());
        doc.items().forEach(item -> {
            if (!loopIds.contains(item.loopId())) {
                errors.add(new ParseError("LOOP_NOT_FOUND", "Item references unknown loop: " + item.loopId(), item.line(), "item", item.key()));
            }
        });
    }

    private void expressionRef(String expressionId, Set<String> expressionIds, int line, String block, String id,
                               List<ParseError> errors) {
        if (expressionId != null && !expressionIds.contains(expressionId)) {
            errors.add(new ParseError("EXPRESSION_NOT_FOUND", "Unknown expression: " + expressionId, line, block, id));
        }
    }

    private void duplicate(List<Row> rows, String code, List<ParseError> errors) {
        Map<String, Long> counts = rows.stream().filter(r -> r.id() != null)
                .collect(Collectors.groupingBy(Row::id, Collectors.counting()));
        rows.forEach(r -> {
            if (r.id() != null && counts.getOrDefault(r.id(), 0L) > 1) {
                errors.add(new ParseError(code, "Duplicate " + r.block() + " id/key: " + r.id(), r.line(), r.block(), r.id()));
            }
        });
    }

    private record Row(String id, int line, String block) {}
}
