package com.jarcadia.rollout.exception;

public class LoadBalancerWaitTimeoutException extends RolloutException {

    private final String loadBalancerName;

    public LoadBalancerWaitTimeoutException(String loadBalancerName, String message)
    {
        super(message);
        this.loadBalancerName = loadBalancerName;
    }

    public String getLoadBalancerName() {
        return loadBalancerName;
    }
}
