package com.example.scenebrain_backend.llm;

import com.example.scenebrain_backend.config.LlmProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OpenAiLanguageModelClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ExchangeStrategies strategies = ExchangeStrategies.withDefaults();

    private static ClientResponse ok(String body) {
        return ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    private static String completion(String content) {
        return "{\"choices\":[{\"message\":{\"content\":" + new ObjectMapper().valueToTree(content) + "}}]}";
    }

    private String bodyOf(ClientRequest request) {
        MockClientHttpRequest mockRequest = new MockClientHttpRequest(request.method(), request.url());
        request.body().insert(mockRequest, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return strategies.messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        return mockRequest.getBodyAsString().block();
    }

    private OpenAiLanguageModelClient client(ExchangeFunction exchangeFunction, LlmProperties props) {
        WebClient webClient = WebClient.builder().exchangeFunction(exchangeFunction).build();
        return new OpenAiLanguageModelClient(webClient, props, mapper);
    }

    @Test
    void sendsTierModelSchemaAndImagesThenParsesContent() throws IOException {
        AtomicReference<String> sent = new AtomicReference<>();
        ExchangeFunction exchange = request -> {
            sent.set(bodyOf(request));
            return Mono.just(ok(completion("{\"action\":\"create\"}")));
        };
        LlmProperties props = new LlmProperties();
        props.setVisionModel("vision-model");

        JsonNode out = client(exchange, props).invoke(ModelTier.VISION, "intent_classification",
                mapper.readTree("{\"type\":\"object\"}"),
                List.of(LlmMessage.system("rules"), LlmMessage.userWithImages("make a scene", List.of("https://img/1.png"))));

        assertThat(out.path("action").asText()).isEqualTo("create");
        JsonNode body = mapper.readTree(sent.get());
        assertThat(body.path("model").asText()).isEqualTo("vision-model");
        assertThat(body.path("response_format").path("json_schema").path("name").asText()).isEqualTo("intent_classification");
        assertThat(body.path("messages").path(0).path("role").asText()).isEqualTo("system");
        JsonNode parts = body.path("messages").path(1).path("content");
        assertThat(parts.isArray()).isTrue();
        assertThat(parts.path(1).path("image_url").path("url").asText()).isEqualTo("https://img/1.png");
    }

    @Test
    void transportFailureIsReportedWithoutAnotherAttempt() {
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction exchange = request -> {
            attempts.incrementAndGet();
            return Mono.error(new WebClientRequestException(new IOException("reset"), HttpMethod.POST,
                    URI.create("http://llm/v1/chat/completions"), new HttpHeaders()));
        };

        InvocationException ex = assertThrows(InvocationException.class, () -> client(exchange, new LlmProperties())
                .invoke(ModelTier.FAST, "s", mapper.createObjectNode(), List.of(LlmMessage.user("hi"))));

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(ex.isTimeout()).isFalse();
    }

    @Test
    void errorStatusIsReportedWithoutAnotherAttempt() {
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction exchange = request -> {
            attempts.incrementAndGet();
            return Mono.just(ClientResponse.create(HttpStatus.BAD_REQUEST)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body("{\"error\":\"bad\"}")
                    .build());
        };

        InvocationException ex = assertThrows(InvocationException.class, () -> client(exchange, new LlmProperties())
                .invoke(ModelTier.FAST, "s", mapper.createObjectNode(), List.of(LlmMessage.user("hi"))));

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(ex.getMessage()).contains("400");
    }

    @Test
    void slowResponseTimesOut() {
        LlmProperties props = new LlmProperties();
        props.setTimeout(Duration.ofMillis(50));
        ExchangeFunction exchange = request -> Mono.<ClientResponse>never();

        InvocationException ex = assertThrows(InvocationException.class, () -> client(exchange, props)
                .invoke(ModelTier.QUALITY, "s", mapper.createObjectNode(), List.of(LlmMessage.user("hi"))));

        assertThat(ex.isTimeout()).isTrue();
    }

    @Test
    void nonJsonContentIsAnInvocationError() {
        ExchangeFunction exchange = request -> Mono.just(ok(completion("not json")));

        assertThrows(InvocationException.class, () -> client(exchange, new LlmProperties())
                .invoke(ModelTier.FAST, "s", mapper.createObjectNode(), List.of(LlmMessage.user("hi"))));
    }
}
