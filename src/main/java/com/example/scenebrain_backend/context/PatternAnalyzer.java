package com.example.scenebrain_backend.context;

import com.example.scenebrain_backend.sync.VersionedArtifact;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds style traits shared by the generated scenes of a project.
 */
@Component
public class PatternAnalyzer {

    private static final Pattern HEX_COLOR = Pattern.compile("#[0-9a-fA-F]{6}\\b");
    private static final Pattern TEXT_ELEMENT = Pattern.compile("<(h1|h2|h3|p|span)\\b", Pattern.CASE_INSENSITIVE);

    /**
     * A colour or trait is recurring when it appears in at least two scenes.
     */
    public PatternSummary analyze(List<VersionedArtifact> scenes) {
        if (scenes == null || scenes.isEmpty()) {
            return PatternSummary.EMPTY;
        }
        Map<String, Integer> colors = new LinkedHashMap<>();
        Map<String, Integer> styles = new LinkedHashMap<>();
        Map<String, Integer> elements = new LinkedHashMap<>();
        for (VersionedArtifact scene : scenes) {
            String code = scene.payload().code();
            Set<String> seenColors = new HashSet<>();
            Matcher matcher = HEX_COLOR.matcher(code);
            while (matcher.find()) {
                String color = matcher.group().toLowerCase(Locale.ROOT);
                if (seenColors.add(color)) {
                    colors.merge(color, 1, Integer::sum);
                }
            }
            for (String style : styles(code)) {
                styles.merge(style, 1, Integer::sum);
            }
            for (String element : elements(code)) {
                elements.merge(element, 1, Integer::sum);
            }
        }
        int threshold = scenes.size() == 1 ? 1 : 2;
        return new PatternSummary(recurring(colors, threshold), recurring(styles, threshold), recurring(elements, threshold));
    }

    private static List<String> styles(String code) {
        List<String> out = new ArrayList<>();
        if (code.contains("spring(")) {
            out.add("spring-animations");
        }
        if (code.toLowerCase(Locale.ROOT).contains("fade")) {
            out.add("fade-effects");
        }
        if (code.contains("interpolate(")) {
            out.add("interpolated-motion");
        }
        if (HEX_COLOR.matcher(code).find()) {
            out.add("custom-colors");
        }
        return out;
    }

    private static List<String> elements(String code) {
        List<String> out = new ArrayList<>();
        if (code.contains("AbsoluteFill")) {
            out.add("Background");
        }
        if (TEXT_ELEMENT.matcher(code).find()) {
            out.add("Text");
        }
        if (code.contains("<Img") || code.contains("<img")) {
            out.add("Image");
        }
        if (code.contains("interpolate")) {
            out.add("Animations");
        }
        return out;
    }

    private static List<String> recurring(Map<String, Integer> counts, int threshold) {
        return counts.entrySet().stream()
                .filter(e -> e.getValue() >= threshold)
                .map(Map.Entry::getKey)
                .toList();
    }
}
