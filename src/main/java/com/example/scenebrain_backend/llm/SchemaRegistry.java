package com.example.scenebrain_backend.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads the response schemas under {@code classpath:schemas/} and validates model output against them.
 */
@Component
public class SchemaRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaRegistry.class);

    public static final String INTENT_CLASSIFICATION = "intent-classification";
    public static final String SCENE_GENERATION = "scene-generation";
    public static final String IMAGE_ANALYSIS = "image-analysis";

    private final ObjectMapper objectMapper;
    private final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private final Map<String, Loaded> schemas = new ConcurrentHashMap<>();

    public SchemaRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode definition(String name) {
        return load(name).definition();
    }

    /**
     * Validates a model response.
     *
     * @param name   schema name.
     * @param output parsed model output.
     * @return validation messages, empty when the output is valid.
     */
    public List<String> validate(String name, JsonNode output) {
        if (output == null || output.isNull() || output.isMissingNode()) {
            return List.of("output is empty");
        }
        Set<ValidationMessage> messages = load(name).schema().validate(output);
        return messages.stream().map(ValidationMessage::getMessage).sorted().toList();
    }

    private Loaded load(String name) {
        return schemas.computeIfAbsent(name, this::read);
    }

    private Loaded read(String name) {
        ClassPathResource resource = new ClassPathResource("schemas/" + name + ".json");
        try (InputStream in = resource.getInputStream()) {
            JsonNode definition = objectMapper.readTree(in);
            LOGGER.debug("Loaded response schema {}", name);
            return new Loaded(definition, factory.getSchema(definition));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load response schema " + name, e);
        }
    }

    private record Loaded(JsonNode definition, JsonSchema schema) {
    }
}
