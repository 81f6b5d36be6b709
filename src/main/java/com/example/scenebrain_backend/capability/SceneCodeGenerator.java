package com.example.scenebrain_backend.capability;

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
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates scene code with the model, shaped by the scene-generation schema.
 */
@Component
public class SceneCodeGenerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(SceneCodeGenerator.class);

    static final String SYSTEM_PROMPT = """
            You write self-contained animated video scenes as React components.
            Export a default component, animate with frame-based interpolation at 30 fps, and keep
            all colours and copy inline. Reply with JSON: name, code, optional durationInFrames and
            optional string attributes describing the scene (for example animation_style, primary_color).
            """;

    private final StructuredOutputService structuredOutput;
    private final ObjectMapper objectMapper;

    public SceneCodeGenerator(StructuredOutputService structuredOutput, ObjectMapper objectMapper) {
        this.structuredOutput = structuredOutput;
        this.objectMapper = objectMapper;
    }

    /**
     * @param guidance  system-level instructions for this call (template, preferences, edit rules).
     * @param imageUrls images the model should look at, may be empty.
     * @throws InvocationException when the model fails twice or returns an unusable scene.
     */
    public GeneratedScene generate(ModelTier tier, String guidance, String instruction, List<String> imageUrls) {
        List<LlmMessage> messages = new ArrayList<>();
        messages.add(LlmMessage.system(SYSTEM_PROMPT));
        if (guidance != null && !guidance.isBlank()) {
            messages.add(LlmMessage.system(guidance));
        }
        messages.add(imageUrls == null || imageUrls.isEmpty()
                ? LlmMessage.user(instruction)
                : LlmMessage.userWithImages(instruction, imageUrls));

        long started = System.currentTimeMillis();
        JsonNode output = structuredOutput.call(tier, SchemaRegistry.SCENE_GENERATION, messages);
        GeneratedScene scene;
        try {
            scene = objectMapper.treeToValue(output, GeneratedScene.class);
        } catch (JsonProcessingException e) {
            throw new InvocationException("Unreadable scene output: " + e.getOriginalMessage());
        }
        LOGGER.debug("Generated scene tier={} name='{}' codeLength={} tookMs={}", tier, scene.name(),
                scene.code() == null ? 0 : scene.code().length(), System.currentTimeMillis() - started);
        return scene;
    }
}
