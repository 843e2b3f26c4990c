package com.surveyflow.runtime.template;

import com.surveyflow.runtime.domain.SurveyModels.Option;
import com.surveyflow.runtime.domain.SurveyModels.Question;
import com.surveyflow.runtime.domain.SurveyModels.SurveyDefinition;
import com.surveyflow.runtime.expression.EvaluationContext;
import com.surveyflow.runtime.expression.UnknownReferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Inserts earlier answers into text: {@code ${pipe:question:<variable>:<field>}} where field is
 * {@code response}, {@code text}, {@code choices} or {@code numeric}. Tokens that cannot be filled
 * are left as written.
 */
@Component
public class AnswerPipingResolver {
    private static final Logger log = LoggerFactory.getLogger(AnswerPipingResolver.class);
    private static final Pattern TOKEN = Pattern.compile("\\$\\{pipe:question:([^:}]+):([^}]+)}");

    public String resolve(String text, SurveyDefinition definition, EvaluationContext context) {
        if (text == null || !text.contains("${pipe:")) return text;

        Matcher matcher = TOKEN.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String replacement = value(matcher.group(1).trim(), matcher.group(2).trim(), definition, context)
                    .orElse(matcher.group());
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private Optional<String> value(String variable, String field, SurveyDefinition definition, EvaluationContext context) {
        List<String> values;
        try {
            values = context.resolve(variable);
        } catch (UnknownReferenceException e) {
            log.debug("Pipe token references unknown variable {}", variable);
            return Optional.empty();
        }
        if (values.isEmpty()) return Optional.empty();

        return switch (field) {
            case "response", "choices" -> Optional.of(String.join(", ", values));
            case "text" -> Optional.of(String.join(", ", labels(variable, values, definition)));
            case "numeric" -> numeric(values);
            default -> Optional.empty();
        };
    }

    private List<String> labels(String variable, List<String> values, SurveyDefinition definition) {
        Optional<Question> question = definition.questionByVariable(variable).or(() -> definition.question(variable));
        if (question.isEmpty()) return values;
        Map<String, String> byValue = definition.optionsOf(question.get().id()).stream()
                .collect(Collectors.toMap(Option::value, Option::label, (a, b) -> a));
        return values.stream().map(v -> byValue.getOrDefault(v, v)).toList();
    }

    private Optional<String> numeric(List<String> values) {
        if (values.size() != 1) return Optional.empty();
        try {
            return Optional.of(new BigDecimal(values.get(0).trim()).stripTrailingZeros().toPlainString());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
