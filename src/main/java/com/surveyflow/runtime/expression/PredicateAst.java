package com.surveyflow.runtime.expression;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Tagged predicate tree produced by {@link ExpressionParser}. Every node evaluates against an
 * {@link EvaluationContext}; a reference that the context cannot resolve raises
 * {@link UnknownReferenceException} and the caller decides the safe default.
 */
public class PredicateAst {
    public interface Node {
        boolean test(EvaluationContext context);
    }

    public record Equals(String ref, String value) implements Node {
        @Override
        public boolean test(EvaluationContext context) {
            List<String> values = context.resolve(ref);
            return values.size() == 1 && sameValue(values.get(0), value);
        }
    }

    public record NotEquals(String ref, String value) implements Node {
        @Override
        public boolean test(EvaluationContext context) {
            return !new Equals(ref, value).test(context);
        }
    }

    public record AnySelected(String ref, List<String> candidates) implements Node {
        @Override
        public boolean test(EvaluationContext context) {
            Set<String> selected = new HashSet<>(context.resolve(ref));
            return candidates.stream().anyMatch(selected::contains);
        }
    }

    public record AllSelected(String ref, List<String> candidates) implements Node {
        @Override
        public boolean test(EvaluationContext context) {
            List<String> values = context.resolve(ref);
            if (values.isEmpty()) return false;
            return new HashSet<>(values).containsAll(candidates);
        }
    }

    public record NoneSelected(String ref, List<String> candidates) implements Node {
        @Override
        public boolean test(EvaluationContext context) {
            return !new AnySelected(ref, candidates).test(context);
        }
    }

    public record Contains(String ref, String fragment) implements Node {
        @Override
        public boolean test(EvaluationContext context) {
            return context.resolve(ref).stream().anyMatch(v -> v != null && v.contains(fragment));
        }
    }

    public record StartsWith(String ref, String prefix) implements Node {
        @Override
        public boolean test(EvaluationContext context) {
            List<String> values = context.resolve(ref);
            return !values.isEmpty() && values.get(0) != null && values.get(0).startsWith(prefix);
        }
    }

    public record GreaterThan(String ref, double threshold) implements Node {
        @Override
        public boolean test(EvaluationContext context) {
            Double number = scalarNumber(context.resolve(ref));
            return number != null && number > threshold;
        }
    }

    public record LessThan(String ref, double threshold) implements Node {
        @Override
        public boolean test(EvaluationContext context) {
            Double number = scalarNumber(context.resolve(ref));
            return number != null && number < threshold;
        }
    }

    public record IsEmpty(String ref) implements Node {
        @Override
        public boolean test(EvaluationContext context) {
            return context.resolve(ref).stream().allMatch(v -> v == null || v.isBlank());
        }
    }

    public record NotEmpty(String ref) implements Node {
        @Override
        public boolean test(EvaluationContext context) {
            return !new IsEmpty(ref).test(context);
        }
    }

    // And/Or evaluate every part: an unresolvable reference anywhere must reach the caller.
    public record And(List<Node> parts) implements Node {
        @Override
        public boolean test(EvaluationContext context) {
            return !parts.stream().map(p -> p.test(context)).toList().contains(false);
        }
    }

    public record Or(List<Node> parts) implements Node {
        @Override
        public boolean test(EvaluationContext context) {
            return parts.stream().map(p -> p.test(context)).toList().contains(true);
        }
    }

    public record Not(Node inner) implements Node {
        @Override
        public boolean test(EvaluationContext context) {
            return !inner.test(context);
        }
    }

    static boolean sameValue(String actual, String expected) {
        Double a = number(actual);
        Double b = number(expected);
        if (a != null && b != null) return a.doubleValue() == b.doubleValue();
        return Objects.equals(actual, expected);
    }

    static Double scalarNumber(Collection<String> values) {
        if (values.size() != 1) return null;
        return number(values.iterator().next());
    }

    static Double number(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            double parsed = Double.parseDouble(raw.trim());
            return Double.isNaN(parsed) ? null : parsed;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
