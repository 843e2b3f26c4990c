package com.surveyflow.runtime.parser;

import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.surveyflow.runtime.parser.ParserDtos.*;

/**
 * Line-oriented survey definition format. Each block starts with {@code @marker attr="value" ...} and
 * may carry a free-text body on the following lines. Blocks that belong to a parent (group and
 * question to a page, option, row and scale to a question, item to a loop) default to the most recent parent.
 */
@Component
public class SurveyDocParser {
    private static final Pattern MARKER_PATTERN = Pattern.compile("^@([a-z][a-z0-9_]*)\\s*(.*)$");
    private static final Pattern ATTR_PATTERN = Pattern.compile("([a-z][a-z0-9_]*)=\"((?:\\\\.|[^\"\\\\])*)\"");

    private static final Set<String> ORDER_MODES = Set.of("sequential", "random", "group_random", "weighted");
    private static final Set<String> QUESTION_TYPES = Set.of("single_choice", "multiple_choice", "dropdown", "text", "number",
            "boolean", "matrix_single", "matrix_multiple");
    private static final Set<String> LOOP_SOURCES = Set.of("answer", "dataset");
    private static final Set<String> ITEM_RESERVED = Set.of("loop", "key", "sort", "active");

    public ParseResult parse(String content) {
        List<ParseError> errors = new ArrayList<>();
        SurveyDoc doc = emptySurvey();
        if (content == null) {
            errors.add(new ParseError("MISSING_META", "Document is empty", 1, "meta", "meta"));
            return new ParseResult(doc, errors);
        }
        List<String> lines = Arrays.asList(content.split("\\R", -1));

        String version = null, surveyId = null, title = null;
        Cursor cursor = new Cursor();

        String pendingMarker = null;
        Map<String, String> pendingAttrs = Map.of();
        int pendingLine = -1;
        StringBuilder body = new StringBuilder();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNo = i + 1;
            String trimmed = line.trim();
            if (trimmed.startsWith("#")) continue;

            Matcher markerMatcher = MARKER_PATTERN.matcher(trimmed);
            if (markerMatcher.matches()) {
                flushPending(pendingMarker, pendingAttrs, pendingLine, body.toString().trim(), doc, cursor, errors);

                pendingMarker = markerMatcher.group(1);
                pendingAttrs = parseAttrs(markerMatcher.group(2), lineNo, pendingMarker, errors);
                pendingLine = lineNo;
                body.setLength(0);

                if ("meta".equals(pendingMarker)) {
                    version = pendingAttrs.get("version");
                    surveyId = pendingAttrs.get("survey");
                    title = pendingAttrs.get("title");
                    if (version == null) errors.add(new ParseError("MISSING_FIELD", "@meta.version required", lineNo, "meta", "meta"));
                    if (surveyId == null) errors.add(new ParseError("MISSING_FIELD", "@meta.survey required", lineNo, "meta", "meta"));
                    pendingMarker = null;
                }
            } else if (pendingMarker != null && !trimmed.isEmpty()) {
                if (body.length() > 0) body.append("\n");
                body.append(line.trim());
            }
        }

        flushPending(pendingMarker, pendingAttrs, pendingLine, body.toString().trim(), doc, cursor, errors);

        if (version == null || surveyId == null) {
            errors.add(new ParseError("MISSING_META", "Document must contain @meta with version and survey", 1, "meta", "meta"));
        }

        SurveyDoc result = new SurveyDoc(version, surveyId, title, doc.expressions(), doc.pages(), doc.groups(),
                doc.questions(), doc.options(), doc.jumps(), doc.loops(), doc.items(), doc.matrix());
        return new ParseResult(result, errors);
    }

    private Map<String, String> parseAttrs(String attrsStr, int line, String marker, List<ParseError> errors) {
        Map<String, String> attrs = new LinkedHashMap<>();
        Matcher matcher = ATTR_PATTERN.matcher(attrsStr);
        while (matcher.find()) {
            attrs.put(matcher.group(1), unescape(matcher.group(2), line, marker, errors));
        }

        String rest = ATTR_PATTERN.matcher(attrsStr).replaceAll("").trim();
        if (!rest.isEmpty()) {
            errors.add(new ParseError("INVALID_ATTR_SYNTAX", "Cannot parse attributes: " + rest, line, marker, marker));
        }
        return attrs;
    }

    private String unescape(String raw, int line, String marker, List<ParseError> errors) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\\') {
                if (i + 1 >= raw.length()) {
                    errors.add(new ParseError("INVALID_ESCAPE", "Dangling escape", line, marker, marker));
                    break;
                }
                char n = raw.charAt(++i);
                switch (n) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case '@' -> sb.append('@');
                    default -> {
                        errors.add(new ParseError("INVALID_ESCAPE", "Unknown escape: \\" + n, line, marker, marker));
                        sb.append(n);
                    }
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private void flushPending(String marker, Map<String, String> attrs, int line, String body,
                              SurveyDoc doc, Cursor cursor, List<ParseError> errors) {
        if (marker == null) return;
        Fields f = new Fields(marker, attrs, line, errors);

        switch (marker) {
            case "expression" -> {
                String id = attrs.get("id");
                String dsl = attrs.getOrDefault("dsl", body);
                if (id == null || dsl == null || dsl.isBlank()) {
                    errors.add(new ParseError("MISSING_FIELD", "@expression id and body required", line, marker, id));
                    return;
                }
                doc.expressions().add(new ExpressionDoc(id, dsl.trim(), line));
            }
            case "page" -> {
                String id = attrs.get("id");
                if (id == null) {
                    errors.add(new ParseError("MISSING_FIELD", "@page id required", line, marker, null));
                    return;
                }
                Integer index = f.integer("index");
                doc.pages().add(new PageDoc(id, index == null ? doc.pages().size() + 1 : index,
                        attrs.getOrDefault("title", body), attrs.get("visible"),
                        f.choice("order", ORDER_MODES), f.choice("group_order", ORDER_MODES), line));
                cursor.page = id;
            }
            case "group" -> {
                String id = attrs.get("id");
                String page = attrs.getOrDefault("page", cursor.page);
                if (id == null || page == null) {
                    errors.add(new ParseError("MISSING_FIELD", "@group id/page required", line, marker, id));
                    return;
                }
                Integer index = f.integer("index");
                doc.groups().add(new GroupDoc(id, page, index == null ? doc.groups().size() + 1 : index,
                        attrs.getOrDefault("title", body), attrs.get("visible"), f.choice("order", ORDER_MODES), line));
            }
            case "question" -> {
                String id = attrs.get("id");
                String page = attrs.getOrDefault("page", cursor.page);
                String type = attrs.get("type");
                if (id == null || page == null || type == null) {
                    errors.add(new ParseError("MISSING_FIELD", "@question id/page/type required", line, marker, id));
                    return;
                }
                if (!QUESTION_TYPES.contains(type.toLowerCase(Locale.ROOT))) {
                    errors.add(new ParseError("INVALID_QUESTION_TYPE", "Unsupported question type: " + type, line, marker, id));
                    return;
                }
                Integer index = f.integer("index");
                doc.questions().add(new QuestionDoc(id, page, attrs.get("group"),
                        index == null ? doc.questions().size() + 1 : index,
                        attrs.getOrDefault("var", id), type.toLowerCase(Locale.ROOT),
                        attrs.getOrDefault("title", body), f.choice("order", ORDER_MODES), attrs.get("visible"),
                        attrs.get("carry_forward"), attrs.get("terminate"), line));
                cursor.question = id;
            }
            case "option" -> {
                String question = attrs.getOrDefault("question", cursor.question);
                String value = attrs.get("value");
                if (question == null || value == null) {
                    errors.add(new ParseError("MISSING_FIELD", "@option question/value required", line, marker, value));
                    return;
                }
                String label = attrs.getOrDefault("label", body.isEmpty() ? value : body);
                doc.options().add(new OptionDoc(attrs.getOrDefault("id", question + ":" + value), question,
                        doc.options().size() + 1, value, label, attrs.get("visible"), attrs.get("group"),
                        f.decimal("weight"), line));
            }
            case "row", "scale" -> {
                String question = attrs.getOrDefault("question", cursor.question);
                String value = attrs.get("value");
                if (question == null || value == null) {
                    errors.add(new ParseError("MISSING_FIELD", "@" + marker + " question/value required", line, marker, value));
                    return;
                }
                String label = attrs.getOrDefault("label", body.isEmpty() ? value : body);
                doc.matrix().add(new MatrixEntryDoc(attrs.getOrDefault("id", question + ":" + marker + ":" + value), question,
                        marker, doc.matrix().size() + 1, value, label, attrs.get("visible"), line));
            }
            case "jump" -> {
                String id = attrs.get("id");
                if (id == null) {
                    errors.add(new ParseError("MISSING_FIELD", "@jump id required", line, marker, null));
                    return;
                }
                String to = attrs.get("to");
                if (to != null && !"end".equals(to)) {
                    errors.add(new ParseError("INVALID_FIELD", "@jump to only accepts \"end\"", line, marker, id));
                }
                Integer priority = f.integer("priority");
                doc.jumps().add(new JumpDoc(id, attrs.get("question"), attrs.get("page"), attrs.get("to_question"),
                        attrs.get("to_page"), "end".equals(to), attrs.get("when"), priority == null ? 0 : priority, line));
            }
            case "loop" -> {
                String id = attrs.get("id");
                String source = f.choice("source", LOOP_SOURCES);
                if (id == null || attrs.get("start") == null || attrs.get("end") == null || source == null) {
                    errors.add(new ParseError("MISSING_FIELD", "@loop id/start/end/source required", line, marker, id));
                    return;
                }
                doc.loops().add(new LoopDoc(id, attrs.getOrDefault("name", id), attrs.get("start"), attrs.get("end"),
                        source, attrs.get("question"), f.integer("max_items"), f.bool("randomize", false),
                        f.bool("sample_without_replacement", false), line));
                cursor.loop = id;
            }
            case "item" -> {
                String loop = attrs.getOrDefault("loop", cursor.loop);
                String key = attrs.get("key");
                if (loop == null || key == null) {
                    errors.add(new ParseError("MISSING_FIELD", "@item loop/key required", line, marker, key));
                    return;
                }
                Map<String, String> custom = new LinkedHashMap<>();
                attrs.forEach((k, v) -> {
                    if (!ITEM_RESERVED.contains(k)) custom.put(k, v);
                });
                if (!body.isEmpty() && !custom.containsKey("label")) custom.put("label", body);
                doc.items().add(new LoopItemDoc(loop, key, custom, f.bool("active", true), f.integer("sort"), line));
            }
            default -> errors.add(new ParseError("UNKNOWN_MARKER", "Unsupported marker @" + marker, line, marker, marker));
        }
    }

    private static final class Cursor {
        private String page;
        private String question;
        private String loop;
    }

    private record Fields(String marker, Map<String, String> attrs, int line, List<ParseError> errors) {
        Integer integer(String name) {
            String raw = attrs.get(name);
            if (raw == null) return null;
            try {
                return Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                errors.add(new ParseError("INVALID_FIELD", "@" + marker + " " + name + " must be integer", line, marker, attrs.get("id")));
                return null;
            }
        }

        Double decimal(String name) {
            String raw = attrs.get(name);
            if (raw == null) return null;
            try {
                return Double.parseDouble(raw.trim());
            } catch (NumberFormatException e) {
                errors.add(new ParseError("INVALID_FIELD", "@" + marker + " " + name + " must be a number", line, marker, attrs.get("id")));
                return null;
            }
        }

        boolean bool(String name, boolean fallback) {
            String raw = attrs.get(name);
            if (raw == null) return fallback;
            if ("true".equalsIgnoreCase(raw) || "false".equalsIgnoreCase(raw)) return Boolean.parseBoolean(raw);
            errors.add(new ParseError("INVALID_FIELD", "@" + marker + " " + name + " must be true or false", line, marker, attrs.get("id")));
            return fallback;
        }

        String choice(String name, Set<String> allowed) {
            String raw = attrs.get(name);
            if (raw == null) return null;
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            if (!allowed.contains(normalized)) {
                errors.add(new ParseError("INVALID_FIELD", "@" + marker + " " + name + " must be one of " + new TreeSet<>(allowed),
                        line, marker, attrs.get("id")));
                return null;
            }
            return normalized;
        }
    }

    public record ParseResult(SurveyDoc doc, List<ParseError> errors) {}
}
