package com.jarcadia.rollout;

import java.util.Objects;

public class RolloutRequest {

    private final String stackId;
    private final String layerId;
    private final String appId;
    private final Double percent;

    public RolloutRequest(String stackId, String layerId, String appId, Double percent) {
        this.stackId = Objects.requireNonNull(stackId, "stackId");
        this.layerId = Objects.requireNonNull(layerId, "layerId");
        this.appId = Objects.requireNonNull(appId, "appId");
        this.percent = percent;
    }

    public RolloutRequest(String stackId, String layerId, String appId) {
        this(stackId, layerId, appId, null);
    }

    public String getStackId() {
        return stackId;
    }

    public String getLayerId() {
        return layerId;
    }

    public String getAppId() {
        return appId;
    }

    /**
     * Fraction of the online instances to deploy per batch, or null to deploy to all of them at once
     */
    public Double getPercent() {
        return percent;
    }

    @Override
    public String toString() {
        return "app " + appId + " on layer " + layerId + " of stack " + stackId + (percent == null ? "" : " in batches of " + percent);
    }
}
