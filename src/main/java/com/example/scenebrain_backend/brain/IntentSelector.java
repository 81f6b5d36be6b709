package com.example.scenebrain_backend.brain;

import com.example.scenebrain_backend.api.ImageRef;
import com.example.scenebrain_backend.api.Message;
import com.example.scenebrain_backend.api.OrchestrationRequest;
import com.example.scenebrain_backend.context.ContextBundle;
import com.example.scenebrain_backend.context.EntitySummary;
import com.example.scenebrain_backend.llm.InvocationException;
import com.example.scenebrain_backend.llm.LlmMessage;
import com.example.scenebrain_backend.llm.ModelTier;
import com.example.scenebrain_backend.llm.SchemaRegistry;
import com.example.scenebrain_backend.llm.StructuredOutputService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Maps a prompt plus context to the tool steps that serve it.
 * <p>
 * The fast model classifies the request against the intent schema. Its complexity label is the
 * source of truth; the keyword heuristics only fill a missing label and flag disagreements in the
 * log. References are resolved deterministically by {@link ReferenceResolver}.
 */
@Service
public class IntentSelector {
    private static final Logger LOGGER = LoggerFactory.getLogger(IntentSelector.class);

    static final String SYSTEM_PROMPT = """
            You route requests for a video scene editor to tools. Reply with JSON only.
            Actions:
            - create: build a new scene (optionally from an image).
            - edit: change the code of an existing scene. Label complexity:
              surgical = a precise change (a colour, a word, a size),
              creative = restyle or improve while keeping the structure,
              structural = rearrange or redesign the layout.
            - change_attribute: rename a scene or set a named attribute; fill attribute and value.
            - change_duration: set the length of a scene; fill durationSeconds.
            - delete: remove a scene.
            Scenes are referred to as "Scene N" in the order listed. Put the words the user used to
            point at a scene or image into "reference" and the scene id into "targetEntityId".
            Split compound requests into at most 5 steps, in execution order.
            If the request cannot be routed without asking, leave steps empty and fill clarificationQuestion.
            """;

    private final StructuredOutputService structuredOutput;
    private final ReferenceResolver references;
    private final ComplexityHeuristics complexityHeuristics;
    private final CapabilityHeuristics capabilityHeuristics;
    private final ObjectMapper objectMapper;

    public IntentSelector(StructuredOutputService structuredOutput,
                          ReferenceResolver references,
                          ComplexityHeuristics complexityHeuristics,
                          CapabilityHeuristics capabilityHeuristics,
                          ObjectMapper objectMapper) {
        this.structuredOutput = structuredOutput;
        this.references = references;
        this.complexityHeuristics = complexityHeuristics;
        this.capabilityHeuristics = capabilityHeuristics;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws AmbiguousIntentException  when the user must clarify the request.
     * @throws NoCapabilityMatchException when no tool can serve the request.
     */
    public ToolPlan select(OrchestrationRequest request, ContextBundle bundle) {
        IntentClassification classification = classify(request, bundle);
        if (classification.needsClarification()) {
            LOGGER.info("Clarification needed project={} question={}", request.projectId(),
                    classification.clarificationQuestion());
            throw new AmbiguousIntentException(classification.clarificationQuestion());
        }
        if (classification.steps().isEmpty()) {
            throw new NoCapabilityMatchException("No tool matches the request");
        }
        List<IntentClassification.Step> steps = classification.steps();
        if (steps.size() > ToolPlan.MAX_STEPS) {
            LOGGER.warn("Truncating plan of {} steps project={}", steps.size(), request.projectId());
            steps = steps.subList(0, ToolPlan.MAX_STEPS);
        }
        boolean single = steps.size() == 1;
        List<ToolSelection> selections = new ArrayList<>();
        for (IntentClassification.Step step : steps) {
            selections.add(toSelection(step, request, bundle, single));
        }
        ToolPlan plan = new ToolPlan(selections, classification.reasoning());
        LOGGER.info("Selected tools project={} tools={} complexity={}", request.projectId(),
                selections.stream().map(ToolSelection::toolName).toList(), plan.complexity().orElse(null));
        return plan;
    }

    private IntentClassification classify(OrchestrationRequest request, ContextBundle bundle) {
        JsonNode output;
        try {
            output = structuredOutput.call(ModelTier.FAST, SchemaRegistry.INTENT_CLASSIFICATION, messages(request, bundle));
        } catch (InvocationException e) {
            LOGGER.warn("Intent classification failed project={} timeout={}: {}", request.projectId(), e.isTimeout(),
                    e.getMessage());
            throw new NoCapabilityMatchException("Could not classify the request", e);
        }
        try {
            return objectMapper.treeToValue(output, IntentClassification.class);
        } catch (JsonProcessingException e) {
            throw new NoCapabilityMatchException("Unreadable intent classification", e);
        }
    }

    List<LlmMessage> messages(OrchestrationRequest request, ContextBundle bundle) {
        StringBuilder context = new StringBuilder();
        if (bundle.entityList().isEmpty()) {
            context.append("The project has no scenes");
            if (bundle.targetEntity() != null) {
                context.append(" listed; the selected scene is ").append(describe(bundle.targetEntity()));
            }
            context.append(".\n");
        } else {
            context.append("Scenes:\n");
            for (EntitySummary scene : bundle.entityList()) {
                context.append("- ").append(describe(scene)).append('\n');
            }
        }
        if (request.targetEntityId() != null) {
            context.append("Selected scene id: ").append(request.targetEntityId()).append('\n');
        }
        List<ImageRef> images = references.conversationImages(request);
        if (!images.isEmpty()) {
            context.append("Images in conversation order:\n");
            for (int i = 0; i < images.size(); i++) {
                context.append("- Image ").append(i + 1).append(": id=").append(images.get(i).id()).append('\n');
            }
        }
        if (!bundle.recentHistory().isEmpty()) {
            context.append("Recent conversation:\n");
            for (Message message : bundle.recentHistory()) {
                context.append(message.role().name().toLowerCase(Locale.ROOT)).append(": ").append(message.content()).append('\n');
            }
        }
        CapabilityKind hint = capabilityHeuristics.guess(request.prompt());
        if (hint != CapabilityKind.UNKNOWN) {
            context.append("Keyword hint (may be wrong): ").append(hint.name().toLowerCase(Locale.ROOT)).append('\n');
        }
        return List.of(
                LlmMessage.system(SYSTEM_PROMPT),
                LlmMessage.system(context.toString()),
                LlmMessage.user(request.prompt()));
    }

    private ToolSelection toSelection(IntentClassification.Step step, OrchestrationRequest request,
                                      ContextBundle bundle, boolean single) {
        String instruction = blankToNull(step.instruction()) != null ? step.instruction() : request.prompt();
        String reference = blankToNull(step.reference()) != null ? step.reference()
                : single ? request.prompt() : instruction;
        String action = step.action() == null ? "" : step.action();
        switch (action) {
            case "create": {
                Optional<ImageRef> image = references.resolveImage(request, reference, step.imageRefId());
                return new ToolSelection.Create(instruction, image.map(ImageRef::id).orElse(null));
            }
            case "edit": {
                UUID target = references.resolveScene(request, bundle, reference, step.targetEntityId(), true);
                EditComplexity complexity = decideComplexity(step, instruction);
                Optional<ImageRef> image = references.resolveImage(request, reference, step.imageRefId());
                return new ToolSelection.Edit(target, complexity, instruction, image.map(ImageRef::id).orElse(null));
            }
            case "change_attribute": {
                UUID target = references.resolveScene(request, bundle, reference, step.targetEntityId(), true);
                if (blankToNull(step.attribute()) == null || step.value() == null) {
                    LOGGER.debug("Attribute step without attribute/value, treating as surgical edit");
                    return new ToolSelection.Edit(target, EditComplexity.SURGICAL, instruction, null);
                }
                return new ToolSelection.ChangeAttribute(target, step.attribute().trim(), step.value());
            }
            case "change_duration": {
                UUID target = references.resolveScene(request, bundle, reference, step.targetEntityId(), true);
                double seconds = step.durationSeconds() != null ? step.durationSeconds() : -1;
                if (seconds <= 0) {
                    OptionalDouble parsed = capabilityHeuristics.seconds(instruction);
                    seconds = parsed.orElse(-1);
                }
                if (seconds <= 0) {
                    throw new AmbiguousIntentException("How many seconds should the scene last?");
                }
                return new ToolSelection.ChangeDuration(target, seconds);
            }
            case "delete": {
                // deleting is destructive, so no silent fallback to the latest scene
                UUID target = references.resolveScene(request, bundle, reference, step.targetEntityId(), false);
                return new ToolSelection.Delete(target);
            }
            default:
                throw new NoCapabilityMatchException("Unknown action '" + action + "'");
        }
    }

    EditComplexity decideComplexity(IntentClassification.Step step, String instruction) {
        Optional<EditComplexity> fromModel = EditComplexity.parse(step.complexity());
        Optional<EditComplexity> fromHeuristics = complexityHeuristics.classify(instruction);
        if (fromModel.isPresent()) {
            if (fromHeuristics.isPresent() && fromHeuristics.get() != fromModel.get()) {
                LOGGER.info("Complexity disagreement model={} heuristics={} instruction='{}'",
                        fromModel.get(), fromHeuristics.get(), instruction);
            }
            return fromModel.get();
        }
        return fromHeuristics.orElse(EditComplexity.CREATIVE);
    }

    private static String describe(EntitySummary scene) {
        String label = scene.displayNumber() > 0 ? "Scene " + scene.displayNumber() : "Scene";
        return label + ": \"" + scene.name() + "\" id=" + scene.entityId()
                + " duration=" + scene.durationInFrames() + " frames";
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
