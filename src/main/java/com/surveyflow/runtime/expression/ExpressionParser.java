package com.surveyflow.runtime.expression;

import com.surveyflow.runtime.expression.PredicateAst.*;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the survey condition language.
 * <p>
 * Composition is flat: the text is split on top-level {@code " && "} first, then on
 * {@code " || "}, and each part is parsed again. The only grouping is a leading {@code !( ... )} that
 * wraps a whole (sub)expression.
 */
@Component
public class ExpressionParser {
    private static final String AND = " && ";
    private static final String OR = " || ";

    public Node parse(String dsl) {
        if (dsl == null || dsl.isBlank()) {
            throw new ExpressionParseException("Empty expression", 0);
        }
        return parseExpression(dsl.trim());
    }

    private Node parseExpression(String text) {
        String t = text.trim();
        if (t.isEmpty()) throw new ExpressionParseException("Empty operand", 0);

        if (t.startsWith("!(") && closingParen(t, 1) == t.length() - 1) {
            return new Not(parseExpression(t.substring(2, t.length() - 1)));
        }

        List<String> parts = splitTopLevel(t, AND);
        if (parts.size() > 1) {
            return new And(parts.stream().map(this::parseExpression).toList());
        }
        parts = splitTopLevel(t, OR);
        if (parts.size() > 1) {
            return new Or(parts.stream().map(this::parseExpression).toList());
        }
        return new PredicateReader(t).read();
    }

    private int closingParen(String text, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') i++;
                else if (c == quote) quote = 0;
                continue;
            }
            switch (c) {
                case '\'', '"' -> quote = c;
                case '(' -> depth++;
                case ')' -> {
                    depth--;
                    if (depth == 0) return i;
                }
                default -> {
                }
            }
        }
        return -1;
    }

    private List<String> splitTopLevel(String text, String separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') i++;
                else if (c == quote) quote = 0;
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (depth == 0 && text.startsWith(separator, i)) {
                parts.add(text.substring(start, i));
                start = i + separator.length();
                i = start - 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    /**
     * Reads exactly one predicate call, e.g. {@code anySelected('Q1', ['a','b'])}.
     */
    private static final class PredicateReader {
        private final String src;
        private int pos;

        PredicateReader(String src) {
            this.src = src;
        }

        Node read() {
            String function = identifier();
            expect('(');
            Node node = switch (function) {
                case "equals" -> new Equals(operand(), afterComma(this::scalar));
                case "notEquals" -> new NotEquals(operand(), afterComma(this::scalar));
                case "contains" -> new Contains(operand(), afterComma(this::scalar));
                case "startsWith" -> new StartsWith(operand(), afterComma(this::scalar));
                case "greaterThan" -> new GreaterThan(operand(), afterComma(this::number));
                case "lessThan" -> new LessThan(operand(), afterComma(this::number));
                case "anySelected" -> new AnySelected(operand(), afterComma(this::list));
                case "allSelected" -> new AllSelected(operand(), afterComma(this::list));
                case "noneSelected" -> new NoneSelected(operand(), afterComma(this::list));
                case "isEmpty" -> new IsEmpty(operand());
                case "notEmpty", "isNotEmpty" -> new NotEmpty(operand());
                default -> throw new ExpressionParseException("Unknown function '" + function + "'", 0);
            };
            expect(')');
            skipWhitespace();
            if (pos < src.length()) {
                throw new ExpressionParseException("Unexpected trailing input '" + src.substring(pos) + "'", pos);
            }
            return node;
        }

        private <T> T afterComma(java.util.function.Supplier<T> reader) {
            expect(',');
            return reader.get();
        }

        private String operand() {
            skipWhitespace();
            int mark = pos;
            if (peek() != '\'' && peek() != '"') {
                String word = identifier();
                skipWhitespace();
                if ("answer".equals(word) && peek() == '(') {
                    expect('(');
                    String ref = reference();
                    expect(')');
                    return ref;
                }
                pos = mark;
            }
            return reference();
        }

        private String reference() {
            skipWhitespace();
            char c = peek();
            String ref = (c == '\'' || c == '"') ? quoted() : identifier();
            if (ref.isBlank()) throw new ExpressionParseException("Empty reference", pos);
            return ref;
        }

        private String scalar() {
            skipWhitespace();
            char c = peek();
            if (c == '\'' || c == '"') return quoted();
            int start = pos;
            while (pos < src.length() && isBareChar(src.charAt(pos))) pos++;
            if (start == pos) throw new ExpressionParseException("Expected value", pos);
            return src.substring(start, pos);
        }

        private Double number() {
            int start = pos;
            Double value = PredicateAst.number(scalar());
            if (value == null) throw new ExpressionParseException("Expected number", start);
            return value;
        }

        private List<String> list() {
            skipWhitespace();
            if (peek() != '[') return List.of(scalar());
            expect('[');
            List<String> values = new ArrayList<>();
            skipWhitespace();
            if (peek() == ']') {
                pos++;
                return values;
            }
            values.add(scalar());
            skipWhitespace();
            while (peek() == ',') {
                pos++;
                values.add(scalar());
                skipWhitespace();
            }
            expect(']');
            return List.copyOf(values);
        }

        private String quoted() {
            char quote = src.charAt(pos++);
            StringBuilder sb = new StringBuilder();
            while (pos < src.length()) {
                char c = src.charAt(pos++);
                if (c == '\\' && pos < src.length()) {
                    sb.append(src.charAt(pos++));
                } else if (c == quote) {
                    return sb.toString();
                } else {
                    sb.append(c);
                }
            }
            throw new ExpressionParseException("Unterminated string", pos);
        }

        private String identifier() {
            skipWhitespace();
            int start = pos;
            while (pos < src.length() && isBareChar(src.charAt(pos))) pos++;
            if (start == pos) throw new ExpressionParseException("Expected identifier", pos);
            return src.substring(start, pos);
        }

        private void expect(char expected) {
            skipWhitespace();
            if (peek() != expected) {
                throw new ExpressionParseException("Expected '" + expected + "'", pos);
            }
            pos++;
        }

        private char peek() {
            return pos < src.length() ? src.charAt(pos) : 0;
        }

        private void skipWhitespace() {
            while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) pos++;
        }

        private static boolean isBareChar(char c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == '+';
        }
    }
}
