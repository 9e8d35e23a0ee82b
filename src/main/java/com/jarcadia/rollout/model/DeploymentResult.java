package com.jarcadia.rollout.model;

import java.time.Duration;

public class DeploymentResult {

    private final String deploymentId;
    private final DeploymentStatus status;
    private final Duration elapsed;

    public DeploymentResult(String deploymentId, DeploymentStatus status, Duration elapsed) {
        this.deploymentId = deploymentId;
        this.status = status;
        this.elapsed = elapsed;
    }

    public String getDeploymentId() {
        return deploymentId;
    }

    public DeploymentStatus getStatus() {
        return status;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public boolean isSuccessful() {
        return status == DeploymentStatus.Successful;
    }

    @Override
    public String toString() {
        return deploymentId + " " + status + " in " + elapsed.getSeconds() + "s";
    }
}
