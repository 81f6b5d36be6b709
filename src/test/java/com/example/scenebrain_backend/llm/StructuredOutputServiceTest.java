package com.example.scenebrain_backend.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StructuredOutputServiceTest {

    @Mock
    private LanguageModelClient client;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StructuredOutputService service;

    private final List<LlmMessage> prompt = List.of(LlmMessage.system("route"), LlmMessage.user("edit scene 1"));

    @BeforeEach
    void setUp() {
        service = new StructuredOutputService(client, new SchemaRegistry(objectMapper));
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void validAnswerIsReturnedWithoutRetry() throws Exception {
        JsonNode answer = json("{\"steps\":[{\"action\":\"edit\",\"complexity\":\"surgical\"}]}");
        when(client.invoke(eq(ModelTier.FAST), eq(SchemaRegistry.INTENT_CLASSIFICATION), any(), anyList())).thenReturn(answer);

        JsonNode result = service.call(ModelTier.FAST, SchemaRegistry.INTENT_CLASSIFICATION, prompt);

        assertThat(result).isEqualTo(answer);
        verify(client, times(1)).invoke(eq(ModelTier.FAST), eq(SchemaRegistry.INTENT_CLASSIFICATION), any(), anyList());
    }

    @Test
    void invalidAnswerIsRetriedOnceWithStricterInstruction() throws Exception {
        JsonNode invalid = json("{\"steps\":[{\"action\":\"dance\"}]}");
        JsonNode valid = json("{\"steps\":[{\"action\":\"delete\"}]}");
        when(client.invoke(eq(ModelTier.FAST), eq(SchemaRegistry.INTENT_CLASSIFICATION), any(), anyList()))
                .thenReturn(invalid, valid);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<LlmMessage>> sent = ArgumentCaptor.forClass(List.class);

        JsonNode result = service.call(ModelTier.FAST, SchemaRegistry.INTENT_CLASSIFICATION, prompt);

        assertThat(result).isEqualTo(valid);
        verify(client, times(2)).invoke(eq(ModelTier.FAST), eq(SchemaRegistry.INTENT_CLASSIFICATION), any(), sent.capture());
        List<LlmMessage> retry = sent.getAllValues().get(1);
        assertThat(retry).hasSize(prompt.size() + 1);
        assertThat(retry.get(retry.size() - 1).content()).isEqualTo(StructuredOutputService.STRICT_INSTRUCTION);
    }

    @Test
    void timeoutIsRetriedAndSecondFailureThrows() throws Exception {
        when(client.invoke(eq(ModelTier.FAST), eq(SchemaRegistry.INTENT_CLASSIFICATION), any(), anyList()))
                .thenThrow(InvocationException.timeout("model timed out", new TimeoutException()))
                .thenReturn(json("{\"reasoning\":\"no steps\"}"));

        assertThatThrownBy(() -> service.call(ModelTier.FAST, SchemaRegistry.INTENT_CLASSIFICATION, prompt))
                .isInstanceOf(InvocationException.class)
                .hasMessageContaining(SchemaRegistry.INTENT_CLASSIFICATION);
        verify(client, times(2)).invoke(eq(ModelTier.FAST), eq(SchemaRegistry.INTENT_CLASSIFICATION), any(), anyList());
    }

    @Test
    void failureOfRetryPropagates() {
        when(client.invoke(eq(ModelTier.QUALITY), eq(SchemaRegistry.SCENE_GENERATION), any(), anyList()))
                .thenThrow(new InvocationException("bad gateway"), new InvocationException("still bad"));

        assertThatThrownBy(() -> service.call(ModelTier.QUALITY, SchemaRegistry.SCENE_GENERATION, prompt))
                .isInstanceOf(InvocationException.class)
                .hasMessage("still bad");
    }

    @Test
    void schemaRegistryReportsViolations() throws Exception {
        SchemaRegistry registry = new SchemaRegistry(objectMapper);

        assertThat(registry.validate(SchemaRegistry.INTENT_CLASSIFICATION, json("{\"steps\":[]}"))).isEmpty();
        assertThat(registry.validate(SchemaRegistry.INTENT_CLASSIFICATION, json("{}"))).isNotEmpty();
        assertThat(registry.validate(SchemaRegistry.INTENT_CLASSIFICATION, null)).containsExactly("output is empty");
    }
}
