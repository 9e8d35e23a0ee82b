package com.jarcadia.rollout.balancer;

import java.util.List;

import com.jarcadia.rollout.model.InstanceHealth;
import com.jarcadia.rollout.model.LoadBalancer;
import com.jarcadia.rollout.model.RegistrationResult;

/**
 * Remote load balancer API. Instance ids here are the load balancer facing ids.
 */
public interface LoadBalancerService {

    List<LoadBalancer> listLoadBalancers();

    /**
     * @return the ids still attached to the load balancer after the request
     */
    List<String> deregister(String loadBalancerName, List<String> instanceIds);

    RegistrationResult register(String loadBalancerName, List<String> instanceIds);

    InstanceHealth pollInstanceState(String loadBalancerName, String instanceId);
}
