package com.example.scenebrain_backend.brain;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cheap pre-classification of a prompt. Only used to pick the context tier before the model call;
 * the selector's model output decides the actual tool.
 */
@Component
public class CapabilityHeuristics {

    private static final Pattern DELETE = Pattern.compile(
            "\\b(delete|remove|get rid of|erase|drop)\\s+(the\\s+)?(\\w+\\s+)?(scene|slide|one|it|this|that)\\b");

    private static final Pattern SECONDS = Pattern.compile("\\b(\\d+(?:\\.\\d+)?)\\s*(?:seconds?|secs?|s)\\b");

    private static final Pattern DURATION_VERB = Pattern.compile(
            "\\b(duration|long|longer|shorter|shorten|lengthen|extend|last|lasts)\\b");

    private static final Pattern CREATE = Pattern.compile(
            "\\b(create|generate|build|add)\\b|\\bnew scene\\b|\\bmake (a|an|another|one more)\\b");

    private static final Pattern ATTRIBUTE = Pattern.compile(
            "\\b(rename|name it|call it|move (it|this|that|the \\w+ scene) to position)\\b");

    private static final Pattern EDIT = Pattern.compile(
            "\\b(change|edit|update|modify|make|set|turn|replace|fix|adjust|tweak|redesign|restyle|"
                    + "rearrange|moderni[sz]e|improve)\\b");

    public CapabilityKind guess(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return CapabilityKind.UNKNOWN;
        }
        String text = prompt.toLowerCase(Locale.ROOT);
        if (DELETE.matcher(text).find()) {
            return CapabilityKind.DELETE;
        }
        if (SECONDS.matcher(text).find() && DURATION_VERB.matcher(text).find()) {
            return CapabilityKind.CHANGE_DURATION;
        }
        if (ATTRIBUTE.matcher(text).find()) {
            return CapabilityKind.CHANGE_ATTRIBUTE;
        }
        if (CREATE.matcher(text).find()) {
            return CapabilityKind.CREATE;
        }
        if (EDIT.matcher(text).find()) {
            return CapabilityKind.EDIT;
        }
        return CapabilityKind.UNKNOWN;
    }

    /**
     * First "N seconds" figure in the prompt.
     */
    public OptionalDouble seconds(String prompt) {
        if (prompt == null) {
            return OptionalDouble.empty();
        }
        Matcher m = SECONDS.matcher(prompt.toLowerCase(Locale.ROOT));
        if (!m.find()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Double.parseDouble(m.group(1)));
    }
}
