package com.jarcadia.rollout;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jarcadia.rollout.exception.RolloutException;

/**
 * Settings for a {@link RolloutManager}. Every property has a default, so a config file only needs the ones it
 * changes. Leaving redisUri unset runs rollouts without the deploy lock.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RolloutConfig {

    private String lockName = "deploy";
    private long lockWaitSeconds = 600;
    private long lockLeaseSeconds = 60;
    private long lockRetryMillis = 500;

    private long deployTimeoutSeconds = 30 * 60;
    private long deployPollSeconds = 15;

    private long loadBalancerTimeoutSeconds = 600;
    private long loadBalancerPollSeconds = 15;

    private String redisUri;
    private String eventStream;
    private long eventStreamMaxLength = 10000;

    private String webhookUrl;
    private int webhookTimeoutMillis = 5000;

    public static RolloutConfig load(ObjectMapper mapper, Path path) {
        try {
            return mapper.readValue(Files.readAllBytes(path), RolloutConfig.class);
        } catch (IOException ex) {
            throw new RolloutException("Unable to load rollout config from " + path, ex);
        }
    }

    public String getLockName() {
        return lockName;
    }

    public void setLockName(String lockName) {
        this.lockName = lockName;
    }

    public long getLockWaitSeconds() {
        return lockWaitSeconds;
    }

    public void setLockWaitSeconds(long lockWaitSeconds) {
        this.lockWaitSeconds = lockWaitSeconds;
    }

    public long getLockLeaseSeconds() {
        return lockLeaseSeconds;
    }

    public void setLockLeaseSeconds(long lockLeaseSeconds) {
        this.lockLeaseSeconds = lockLeaseSeconds;
    }

    public long getLockRetryMillis() {
        return lockRetryMillis;
    }

    public void setLockRetryMillis(long lockRetryMillis) {
        this.lockRetryMillis = lockRetryMillis;
    }

    public long getDeployTimeoutSeconds() {
        return deployTimeoutSeconds;
    }

    public void setDeployTimeoutSeconds(long deployTimeoutSeconds) {
        this.deployTimeoutSeconds = deployTimeoutSeconds;
    }

    public long getDeployPollSeconds() {
        return deployPollSeconds;
    }

    public void setDeployPollSeconds(long deployPollSeconds) {
        this.deployPollSeconds = deployPollSeconds;
    }

    public long getLoadBalancerTimeoutSeconds() {
        return loadBalancerTimeoutSeconds;
    }

    public void setLoadBalancerTimeoutSeconds(long loadBalancerTimeoutSeconds) {
        this.loadBalancerTimeoutSeconds = loadBalancerTimeoutSeconds;
    }

    public long getLoadBalancerPollSeconds() {
        return loadBalancerPollSeconds;
    }

    public void setLoadBalancerPollSeconds(long loadBalancerPollSeconds) {
        this.loadBalancerPollSeconds = loadBalancerPollSeconds;
    }

    public String getRedisUri() {
        return redisUri;
    }

    public void setRedisUri(String redisUri) {
        this.redisUri = redisUri;
    }

    public String getEventStream() {
        return eventStream;
    }

    public void setEventStream(String eventStream) {
        this.eventStream = eventStream;
    }

    public long getEventStreamMaxLength() {
        return eventStreamMaxLength;
    }

    public void setEventStreamMaxLength(long eventStreamMaxLength) {
        this.eventStreamMaxLength = eventStreamMaxLength;
    }

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public void setWebhookUrl(String webhookUrl) {
        this.webhookUrl = webhookUrl;
    }

    public int getWebhookTimeoutMillis() {
        return webhookTimeoutMillis;
    }

    public void setWebhookTimeoutMillis(int webhookTimeoutMillis) {
        this.webhookTimeoutMillis = webhookTimeoutMillis;
    }

    @JsonIgnore
    public Duration getLockWait() {
        return Duration.ofSeconds(lockWaitSeconds);
    }

    @JsonIgnore
    public Duration getDeployTimeout() {
        return Duration.ofSeconds(deployTimeoutSeconds);
    }
}
