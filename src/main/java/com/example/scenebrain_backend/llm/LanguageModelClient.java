package com.example.scenebrain_backend.llm;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Opaque structured model invocation. Implementations return the parsed JSON document the model
 * produced; they do not validate it against the schema.
 */
public interface LanguageModelClient {

    /**
     * Invokes the model and returns its JSON answer.
     *
     * @param tier       model class to use.
     * @param schemaName short name of the response schema.
     * @param schema     JSON schema the answer should follow.
     * @param messages   ordered prompt messages.
     * @return parsed JSON answer.
     * @throws InvocationException when the call fails, times out or the answer is not JSON.
     */
    JsonNode invoke(ModelTier tier, String schemaName, JsonNode schema, List<LlmMessage> messages);
}
