package com.jarcadia.rollout.model;

import java.util.List;

public class RegistrationResult {

    private final String loadBalancerName;
    private final List<String> registeredInstanceIds;

    public RegistrationResult(String loadBalancerName, List<String> registeredInstanceIds) {
        this.loadBalancerName = loadBalancerName;
        this.registeredInstanceIds = List.copyOf(registeredInstanceIds);
    }

    public String getLoadBalancerName() {
        return loadBalancerName;
    }

    /**
     * Every instance the load balancer reports as registered after the request
     */
    public List<String> getRegisteredInstanceIds() {
        return registeredInstanceIds;
    }

    @Override
    public String toString() {
        return loadBalancerName + registeredInstanceIds;
    }
}
