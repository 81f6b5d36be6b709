package com.example.scenebrain_backend.learning;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical preference extraction. No model calls.
 */
@Component
public class PreferenceSignalExtractor {

    public static final String ANIMATION_SPEED = "animation_speed";
    public static final String ANIMATION_STYLE = "animation_style";
    public static final String STYLE = "style";
    public static final String PREFERRED_DURATION = "preferred_duration";
    public static final String PRIMARY_COLOR = "primary_color";

    private static final Pattern FAST = Pattern.compile("\\b(fast|quick|rapid|snappy)\\b");
    private static final Pattern SLOW = Pattern.compile("\\b(slow|gentle|gradual)\\b");
    private static final Pattern SMOOTH = Pattern.compile("\\bsmooth(ly)?\\b");
    private static final Pattern BOUNCY = Pattern.compile("\\b(bouncy|bounce|springy)\\b");
    private static final Pattern FADE = Pattern.compile("\\bfade(s|d)?\\b");
    private static final Pattern MINIMAL = Pattern.compile("\\b(minimal|minimalist|clean|simple)\\b");
    private static final Pattern DETAILED = Pattern.compile("\\b(complex|detailed|elaborate)\\b");
    private static final Pattern PLAYFUL = Pattern.compile("\\b(playful|fun|whimsical)\\b");
    private static final Pattern DURATION = Pattern.compile("\\b(\\d{1,3})\\s*(?:seconds?|secs?)\\b");
    private static final Pattern COLOR = Pattern.compile(
            "(#[0-9a-f]{6}\\b|\\b(?:red|blue|green|yellow|orange|purple|pink|black|white|gr[ae]y|teal|navy|gold)\\b)");
    private static final Pattern GENERALIZING = Pattern.compile(
            "\\b(always|i (?:always )?prefer|i like|from now on|going forward|in general|generally|by default"
                    + "|all (?:the |my )?(?:scenes|videos)|every (?:scene|video)|each scene)\\b");
    private static final Pattern CROSS_PROJECT = Pattern.compile("\\b(all my (?:videos|projects)|every (?:video|project))\\b");

    public List<PreferenceSignal> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String msg = text.toLowerCase(Locale.ROOT);
        List<PreferenceSignal> out = new ArrayList<>();
        if (FAST.matcher(msg).find()) {
            out.add(new PreferenceSignal(ANIMATION_SPEED, "fast"));
        } else if (SLOW.matcher(msg).find()) {
            out.add(new PreferenceSignal(ANIMATION_SPEED, "slow"));
        }
        if (SMOOTH.matcher(msg).find()) {
            out.add(new PreferenceSignal(ANIMATION_STYLE, "smooth"));
        } else if (BOUNCY.matcher(msg).find()) {
            out.add(new PreferenceSignal(ANIMATION_STYLE, "bouncy"));
        } else if (FADE.matcher(msg).find()) {
            out.add(new PreferenceSignal(ANIMATION_STYLE, "fade"));
        }
        if (MINIMAL.matcher(msg).find()) {
            out.add(new PreferenceSignal(STYLE, "minimal"));
        } else if (DETAILED.matcher(msg).find()) {
            out.add(new PreferenceSignal(STYLE, "detailed"));
        } else if (PLAYFUL.matcher(msg).find()) {
            out.add(new PreferenceSignal(STYLE, "playful"));
        }
        Matcher duration = DURATION.matcher(msg);
        if (duration.find()) {
            out.add(new PreferenceSignal(PREFERRED_DURATION, duration.group(1)));
        }
        Matcher color = COLOR.matcher(msg);
        if (color.find()) {
            out.add(new PreferenceSignal(PRIMARY_COLOR, color.group(1).replace("grey", "gray")));
        }
        return out;
    }

    /**
     * Whether the text states a standing preference rather than a one-off instruction.
     */
    public boolean isGeneralizing(String text) {
        return text != null && GENERALIZING.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    public boolean isCrossProject(String text) {
        return text != null && CROSS_PROJECT.matcher(text.toLowerCase(Locale.ROOT)).find();
    }
}
