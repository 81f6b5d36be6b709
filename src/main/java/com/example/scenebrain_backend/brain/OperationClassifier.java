package com.example.scenebrain_backend.brain;

import com.example.scenebrain_backend.api.OrchestrationRequest;
import com.example.scenebrain_backend.context.OperationClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides which context tier a request needs before the selector runs.
 * <ul>
 *     <li>Analytical: images attached, or the user asks for analysis.</li>
 *     <li>Trivial: attribute, duration, delete or surgical edits on an explicitly targeted scene.</li>
 *     <li>Complex: creation, creative and structural edits.</li>
 *     <li>Moderate: everything else.</li>
 * </ul>
 */
@Component
public class OperationClassifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(OperationClassifier.class);

    private static final Pattern ANALYTICAL = Pattern.compile(
            "\\b(analy[sz]e|analysis|compare|review|audit|consistent|consistency|summari[sz]e|describe|"
                    + "what do you (see|think)|how does .* look)\\b");

    private final CapabilityHeuristics capabilities;
    private final ComplexityHeuristics complexities;

    public OperationClassifier(CapabilityHeuristics capabilities, ComplexityHeuristics complexities) {
        this.capabilities = capabilities;
        this.complexities = complexities;
    }

    public OperationClass classify(OrchestrationRequest request) {
        OperationClass result = decide(request);
        LOGGER.debug("Operation class project={} class={} tier={}", request.projectId(), result, result.tier());
        return result;
    }

    private OperationClass decide(OrchestrationRequest request) {
        String text = request.prompt().toLowerCase(Locale.ROOT);
        if (!request.attachedImageRefs().isEmpty() || ANALYTICAL.matcher(text).find()) {
            return OperationClass.ANALYTICAL;
        }
        boolean targeted = request.targetEntityId() != null;
        CapabilityKind kind = capabilities.guess(text);
        return switch (kind) {
            case CHANGE_ATTRIBUTE, CHANGE_DURATION, DELETE -> targeted ? OperationClass.TRIVIAL : OperationClass.MODERATE;
            case CREATE -> OperationClass.COMPLEX;
            case EDIT -> classifyEdit(complexities.classify(text), targeted);
            case UNKNOWN -> OperationClass.MODERATE;
        };
    }

    private OperationClass classifyEdit(Optional<EditComplexity> complexity, boolean targeted) {
        if (complexity.isEmpty()) {
            return OperationClass.MODERATE;
        }
        if (complexity.get() == EditComplexity.SURGICAL) {
            return targeted ? OperationClass.TRIVIAL : OperationClass.MODERATE;
        }
        return OperationClass.COMPLEX;
    }
}
