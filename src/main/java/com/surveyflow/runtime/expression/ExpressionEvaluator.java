package com.surveyflow.runtime.expression;

import com.surveyflow.runtime.expression.PredicateAst.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates condition expressions. {@link #evaluate} is fail-open: an empty, unparseable or
 * unresolvable expression is {@code true}, so an authoring mistake never hides content.
 * {@link #tryEvaluate} reports the same failures as an empty result for callers whose safe
 * default is "do nothing".
 */
@Component
public class ExpressionEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final ExpressionParser parser;
    private final Map<String, Node> parsed = new ConcurrentHashMap<>();

    public ExpressionEvaluator(ExpressionParser parser) {
        this.parser = parser;
    }

    public boolean evaluate(String dsl, EvaluationContext context) {
        if (dsl == null || dsl.isBlank()) return true;
        return tryEvaluate(dsl, context).orElse(true);
    }

    public Optional<Boolean> tryEvaluate(String dsl, EvaluationContext context) {
        if (dsl == null || dsl.isBlank()) return Optional.of(true);
        try {
            return Optional.of(parse(dsl).test(context));
        } catch (ExpressionParseException e) {
            log.warn("Unparseable expression '{}': {}", dsl, e.getMessage());
        } catch (UnknownReferenceException e) {
            log.warn("Expression '{}' references unknown question or key '{}'", dsl, e.ref());
        } catch (RuntimeException e) {
            log.warn("Expression '{}' failed to evaluate", dsl, e);
        }
        return Optional.empty();
    }

    /**
     * Syntax check used at import time.
     *
     * @return the parse error message, or empty when the expression is well formed
     */
    public Optional<String> validate(String dsl) {
        try {
            parse(dsl);
            return Optional.empty();
        } catch (ExpressionParseException e) {
            return Optional.of(e.getMessage());
        }
    }

    private Node parse(String dsl) {
        Node node = parsed.get(dsl);
        if (node == null) {
            node = parser.parse(dsl);
            parsed.put(dsl, node);
        }
        return node;
    }
}
