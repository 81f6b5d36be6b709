package com.example.scenebrain_backend.llm;

import com.example.scenebrain_backend.config.LlmProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Chat-completions client using JSON-schema response formatting. Makes exactly one HTTP attempt per
 * call; retrying belongs to {@link StructuredOutputService}.
 */
@Service
public class OpenAiLanguageModelClient implements LanguageModelClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiLanguageModelClient.class);

    private final WebClient client;
    private final LlmProperties props;
    private final ObjectMapper objectMapper;

    public OpenAiLanguageModelClient(@Qualifier("llmWebClient") WebClient client,
                                     LlmProperties props,
                                     ObjectMapper objectMapper) {
        this.client = client;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode invoke(ModelTier tier, String schemaName, JsonNode schema, List<LlmMessage> messages) {
        String model = modelFor(tier);
        ObjectNode body = buildBody(model, schemaName, schema, messages);
        long t0 = System.nanoTime();
        String raw;
        try {
            raw = client.post()
                    .uri("/v1/chat/completions")
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(text -> new InvocationException("LLM error %s: %s".formatted(resp.statusCode(), truncate(text, 500)))))
                    .bodyToMono(String.class)
                    .timeout(props.getTimeout())
                    .block();
        } catch (InvocationException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable root = rootCause(e);
            if (root instanceof TimeoutException) {
                LOGGER.warn("LLM call timed out model={} schema={} after={}ms", model, schemaName, elapsedMs(t0));
                throw InvocationException.timeout("LLM call timed out after " + props.getTimeout().toMillis() + "ms", e);
            }
            LOGGER.warn("LLM call failed model={} schema={} type={} message={}", model, schemaName,
                    root.getClass().getSimpleName(), root.getMessage());
            throw new InvocationException("LLM call failed: " + root.getMessage(), false, e);
        }

        if (raw == null || raw.isBlank()) {
            throw new InvocationException("Empty response from LLM");
        }
        JsonNode content = extractContent(raw);
        LOGGER.debug("LLM call DONE model={} schema={} in={}ms", model, schemaName, elapsedMs(t0));
        return content;
    }

    private ObjectNode buildBody(String model, String schemaName, JsonNode schema, List<LlmMessage> messages) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("temperature", props.getTemperature());
        ArrayNode arr = body.putArray("messages");
        for (LlmMessage message : messages) {
            ObjectNode node = arr.addObject();
            node.put("role", message.role().name().toLowerCase(Locale.ROOT));
            if (message.imageUrls().isEmpty()) {
                node.put("content", message.content());
            } else {
                ArrayNode parts = node.putArray("content");
                parts.addObject().put("type", "text").put("text", message.content());
                for (String url : message.imageUrls()) {
                    ObjectNode part = parts.addObject();
                    part.put("type", "image_url");
                    part.putObject("image_url").put("url", url);
                }
            }
        }
        ObjectNode format = body.putObject("response_format");
        format.put("type", "json_schema");
        ObjectNode jsonSchema = format.putObject("json_schema");
        jsonSchema.put("name", schemaName);
        jsonSchema.set("schema", schema);
        return body;
    }

    private JsonNode extractContent(String raw) {
        try {
            JsonNode root = objectMapper.readTree(raw);
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            if (!content.isTextual() || content.asText().isBlank()) {
                throw new InvocationException("LLM response has no message content");
            }
            return objectMapper.readTree(content.asText());
        } catch (JsonProcessingException e) {
            throw new InvocationException("LLM response is not valid JSON: " + e.getOriginalMessage(), false, e);
        }
    }

    private String modelFor(ModelTier tier) {
        return switch (tier) {
            case FAST -> props.getFastModel();
            case QUALITY -> props.getQualityModel();
            case VISION -> props.getVisionModel();
        };
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000;
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
