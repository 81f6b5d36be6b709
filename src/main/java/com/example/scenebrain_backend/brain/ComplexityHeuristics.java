package com.example.scenebrain_backend.brain;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keyword guess of an edit's complexity. The model's label wins when both are present; this guess
 * fills in when the model omits one and is logged when the two disagree.
 * <p>
 * Precedence is structural, then creative, then surgical.
 */
@Component
public class ComplexityHeuristics {

    private static final Pattern STRUCTURAL = Pattern.compile(
            "\\b(redesign|re-design|restructure|rearrange|reorgani[sz]e|rebuild|re-?layout|layout|from scratch|"
                    + "completely (change|redo|rework)|overhaul|start over)\\b");

    private static final Pattern CREATIVE = Pattern.compile(
            "\\b(moderni[sz]e|modern|restyle|style|vibe|feel|look|polish|improve|pop|fancier|nicer|"
                    + "more (professional|playful|elegant|dynamic|energetic|minimal)|rewrite|reimagine)\\b");

    private static final Pattern SURGICAL = Pattern.compile(
            "\\b(change|set|make|update|turn|replace|fix)\\b.*\\b(colou?r|text|font|size|title|heading|subtitle|word|"
                    + "label|opacity|background|typo|spelling|logo)\\b|\\bto\\s+#[0-9a-f]{3,6}\\b");

    public Optional<EditComplexity> classify(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return Optional.empty();
        }
        String text = prompt.toLowerCase(Locale.ROOT);
        if (STRUCTURAL.matcher(text).find()) {
            return Optional.of(EditComplexity.STRUCTURAL);
        }
        if (CREATIVE.matcher(text).find()) {
            return Optional.of(EditComplexity.CREATIVE);
        }
        if (SURGICAL.matcher(text).find()) {
            return Optional.of(EditComplexity.SURGICAL);
        }
        return Optional.empty();
    }
}
