package com.jarcadia.rollout.model;

public enum DeploymentStatus {
    Running,
    Successful,
    Failed;

    public static DeploymentStatus parse(String value) {
        if (value == null) {
            return Running;
        }
        switch (value.trim().toLowerCase()) {
            case "successful":
                return Successful;
            case "failed":
                return Failed;
            default:
                return Running;
        }
    }

    public boolean isTerminal() {
        return this != Running;
    }
}
