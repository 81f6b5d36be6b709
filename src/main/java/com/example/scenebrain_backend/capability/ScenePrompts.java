package com.example.scenebrain_backend.capability;

import com.example.scenebrain_backend.context.ContextBundle;
import com.example.scenebrain_backend.context.ImageFact;
import com.example.scenebrain_backend.context.PatternSummary;
import com.example.scenebrain_backend.memory.PreferenceValue;

import java.util.List;
import java.util.Map;

/**
 * Renders context pieces as prompt text.
 */
final class ScenePrompts {

    private ScenePrompts() {
    }

    static String preferences(Map<String, PreferenceValue> preferences) {
        if (preferences.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("User preferences (follow unless the instruction says otherwise):\n");
        preferences.values().forEach(p -> sb.append("- ").append(p.key()).append(": ").append(p.value())
                .append(String.format(" (confidence %.2f)%n", p.confidence())));
        return sb.toString();
    }

    static String imageFacts(List<ImageFact> facts) {
        if (facts.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("Reference images:\n");
        for (ImageFact fact : facts) {
            sb.append("- ").append(fact.imageRefId()).append(": palette ").append(fact.palette())
                    .append(", mood ").append(fact.mood());
            if (fact.layout() != null) {
                sb.append(", layout ").append(fact.layout());
            }
            if (fact.detectedText() != null && !fact.detectedText().isBlank()) {
                sb.append(", text \"").append(fact.detectedText()).append('"');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    static String patterns(PatternSummary patterns) {
        if (patterns == null || patterns.equals(PatternSummary.EMPTY)) {
            return "";
        }
        return "Project style so far: colours " + patterns.recurringColors()
                + ", styles " + patterns.stylePatterns()
                + ", elements " + patterns.commonElements() + "\n";
    }

    static String context(ContextBundle bundle) {
        return preferences(bundle.preferences()) + imageFacts(bundle.imageFacts()) + patterns(bundle.patterns());
    }
}
