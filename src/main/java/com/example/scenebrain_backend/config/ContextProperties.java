package com.example.scenebrain_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Cache lifetimes and history limits used when assembling context bundles.
 */
@ConfigurationProperties(prefix = "brain.context")
public class ContextProperties {

    private Duration preferenceTtl = Duration.ofHours(6);
    /** Safety net only; entity lists are invalidated by commits. */
    private Duration entityListTtl = Duration.ofSeconds(30);
    private Duration arenaIdleTimeout = Duration.ofMinutes(30);
    private Duration imageFactWait = Duration.ofSeconds(3);
    private Duration fetchTimeout = Duration.ofSeconds(5);
    private int lightHistory = 2;
    private int standardHistory = 5;
    private int fullHistory = 50;
    private int maxCachedEntities = 500;

    public Duration getPreferenceTtl() {
        return preferenceTtl;
    }

    public void setPreferenceTtl(Duration preferenceTtl) {
        this.preferenceTtl = preferenceTtl;
    }

    public Duration getEntityListTtl() {
        return entityListTtl;
    }

    public void setEntityListTtl(Duration entityListTtl) {
        this.entityListTtl = entityListTtl;
    }

    public Duration getArenaIdleTimeout() {
        return arenaIdleTimeout;
    }

    public void setArenaIdleTimeout(Duration arenaIdleTimeout) {
        this.arenaIdleTimeout = arenaIdleTimeout;
    }

    public Duration getImageFactWait() {
        return imageFactWait;
    }

    public void setImageFactWait(Duration imageFactWait) {
        this.imageFactWait = imageFactWait;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }

    public int getLightHistory() {
        return lightHistory;
    }

    public void setLightHistory(int lightHistory) {
        this.lightHistory = lightHistory;
    }

    public int getStandardHistory() {
        return standardHistory;
    }

    public void setStandardHistory(int standardHistory) {
        this.standardHistory = standardHistory;
    }

    public int getFullHistory() {
        return fullHistory;
    }

    public void setFullHistory(int fullHistory) {
        this.fullHistory = fullHistory;
    }

    public int getMaxCachedEntities() {
        return maxCachedEntities;
    }

    public void setMaxCachedEntities(int maxCachedEntities) {
        this.maxCachedEntities = maxCachedEntities;
    }
}
