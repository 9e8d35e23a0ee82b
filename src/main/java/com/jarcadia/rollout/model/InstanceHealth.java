package com.jarcadia.rollout.model;

/**
 * State of a single instance as reported by one load balancer.
 */
public enum InstanceHealth {
    InService,
    OutOfService,
    Unknown,
    NotRegistered;

    public boolean isDeregistered() {
        return this == OutOfService || this == NotRegistered;
    }

    public boolean isInService() {
        return this == InService;
    }
}
