package com.jarcadia.rollout.notify;

@FunctionalInterface
public interface DeployEventListener {

    void onEvent(DeployEvent event);
}
