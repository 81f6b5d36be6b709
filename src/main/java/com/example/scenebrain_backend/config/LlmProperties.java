package com.example.scenebrain_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection and model settings for the chat-completions endpoint used for intent classification,
 * scene generation and image analysis.
 */
@ConfigurationProperties(prefix = "brain.llm")
public class LlmProperties {

    private String baseUrl = "https://api.openai.com";
    private String apiKey;
    private String fastModel = "gpt-4o-mini";
    private String qualityModel = "gpt-4o";
    private String visionModel = "gpt-4o";
    private double temperature = 0.1;
    private Duration timeout = Duration.ofSeconds(45);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private int maxConnections = 20;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getFastModel() {
        return fastModel;
    }

    public void setFastModel(String fastModel) {
        this.fastModel = fastModel;
    }

    public String getQualityModel() {
        return qualityModel;
    }

    public void setQualityModel(String qualityModel) {
        this.qualityModel = qualityModel;
    }

    public String getVisionModel() {
        return visionModel;
    }

    public void setVisionModel(String visionModel) {
        this.visionModel = visionModel;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }
}
