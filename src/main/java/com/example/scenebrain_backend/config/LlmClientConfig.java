package com.example.scenebrain_backend.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(LlmProperties.class)
public class LlmClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(LlmClientConfig.class);
    private static final Duration PENDING_ACQUIRE_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(20);
    private static final Duration MAX_LIFE_TIME = Duration.ofMinutes(5);

    @Bean("llmWebClient")
    WebClient llmWebClient(LlmProperties props) {
        ConnectionProvider provider = ConnectionProvider.builder("llm-http")
                .maxConnections(Math.max(1, props.getMaxConnections()))
                .pendingAcquireTimeout(PENDING_ACQUIRE_TIMEOUT)
                .maxIdleTime(MAX_IDLE_TIME)
                .maxLifeTime(MAX_LIFE_TIME)
                .build();

        HttpClient httpClient = HttpClient.create(provider)
                .protocol(HttpProtocol.HTTP11)
                .responseTimeout(props.getTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) props.getConnectTimeout().toMillis())
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(props.getTimeout().toSeconds(), TimeUnit.SECONDS)));

        LOGGER.info("Configuring LLM WebClient baseUrl={} fastModel={} qualityModel={} timeout={}s maxConn={}",
                props.getBaseUrl(),
                props.getFastModel(),
                props.getQualityModel(),
                props.getTimeout().toSeconds(),
                props.getMaxConnections());

        String apiKey = props.getApiKey() == null ? "" : props.getApiKey().trim();
        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Accept", "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(8 * 1024 * 1024))
                .build();
    }
}
