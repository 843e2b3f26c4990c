package com.surveyflow.runtime.template;

import com.surveyflow.runtime.loop.LoopModels.LoopContext;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{loop.*}}} tokens with values of the current iteration. Single pass and
 * literal: replacement text is never scanned again, unknown tokens stay as written.
 */
@Component
public class LoopTemplateResolver {
    private static final Pattern TOKEN = Pattern.compile("\\{\\{loop\\.([^{}]+)}}");

    public String resolve(String text, LoopContext context) {
        if (text == null || context == null || !text.contains("{{loop.")) return text;

        Matcher matcher = TOKEN.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = value(matcher.group(1).trim(), context);
            matcher.appendReplacement(out, Matcher.quoteReplacement(value == null ? matcher.group() : value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String value(String name, LoopContext context) {
        return switch (name) {
            case "key" -> context.item().key();
            case "label" -> context.item().label();
            case "index" -> String.valueOf(context.index() + 1);
            case "total" -> String.valueOf(context.total());
            case "isFirst", "isFirstIteration" -> String.valueOf(context.isFirst());
            case "isLast", "isLastIteration" -> String.valueOf(context.isLast());
            case "progress", "progressPercent" -> String.valueOf(context.percentComplete());
            default -> attribute(name.startsWith("attributes.") ? name.substring("attributes.".length()) : name, context);
        };
    }

    private static String attribute(String name, LoopContext context) {
        return context.item().attributes() == null ? null : context.item().attributes().get(name);
    }
}
