package com.jarcadia.rollout.model;

import java.util.Objects;

public class DeploymentHandle {

    private final String deploymentId;

    public DeploymentHandle(String deploymentId) {
        this.deploymentId = Objects.requireNonNull(deploymentId, "deploymentId");
    }

    public String getDeploymentId() {
        return deploymentId;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DeploymentHandle && deploymentId.equals(((DeploymentHandle) obj).deploymentId);
    }

    @Override
    public int hashCode() {
        return deploymentId.hashCode();
    }

    @Override
    public String toString() {
        return deploymentId;
    }
}
