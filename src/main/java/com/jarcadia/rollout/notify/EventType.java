package com.jarcadia.rollout.notify;

public enum EventType {
    LockDisabled,
    LockWaiting,
    LockAcquired,
    LockReleased,
    LockTimeout,

    BatchStarted,
    LoadBalancerSkipped,
    Detached,
    NoLoadBalancers,
    DeployStarted,
    DeployCompleted,
    Reattached,
    BatchDone,
    BatchFailed,

    DeployAllComplete;
}
