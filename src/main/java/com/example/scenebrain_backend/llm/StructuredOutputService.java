package com.example.scenebrain_backend.llm;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Calls the language model for schema-shaped output. An invalid or failed answer is retried exactly
 * once with a stricter instruction; the second failure is thrown as {@link InvocationException}.
 */
@Service
public class StructuredOutputService {
    private static final Logger LOGGER = LoggerFactory.getLogger(StructuredOutputService.class);

    static final String STRICT_INSTRUCTION =
            "Your previous answer was rejected. Reply with a single JSON object that validates against the "
                    + "response schema. No prose, no markdown, no missing required fields.";

    private final LanguageModelClient client;
    private final SchemaRegistry schemas;

    public StructuredOutputService(LanguageModelClient client, SchemaRegistry schemas) {
        this.client = client;
        this.schemas = schemas;
    }

    public JsonNode call(ModelTier tier, String schemaName, List<LlmMessage> messages) {
        JsonNode schema = schemas.definition(schemaName);
        String firstProblem;
        try {
            JsonNode output = client.invoke(tier, schemaName, schema, messages);
            List<String> errors = schemas.validate(schemaName, output);
            if (errors.isEmpty()) {
                return output;
            }
            firstProblem = "schema violations " + errors;
        } catch (InvocationException e) {
            firstProblem = e.isTimeout() ? "timeout" : e.getMessage();
        }
        LOGGER.warn("Structured output rejected schema={} tier={} reason={}, retrying once", schemaName, tier, firstProblem);

        List<LlmMessage> stricter = new ArrayList<>(messages);
        stricter.add(LlmMessage.system(STRICT_INSTRUCTION));
        JsonNode output = client.invoke(tier, schemaName, schema, stricter);
        List<String> errors = schemas.validate(schemaName, output);
        if (!errors.isEmpty()) {
            LOGGER.warn("Structured output invalid after retry schema={} errors={}", schemaName, errors);
            throw new InvocationException("Model output does not match schema " + schemaName + ": " + errors);
        }
        return output;
    }
}
