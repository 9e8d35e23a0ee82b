package com.jarcadia.rollout;

import java.util.List;
import java.util.stream.Collectors;

import com.jarcadia.rollout.model.Batch;
import com.jarcadia.rollout.model.DeploymentResult;
import com.jarcadia.rollout.model.LoadBalancer;

public class BatchReport {

    private final Batch batch;
    private final List<LoadBalancer> loadBalancers;
    private final DeploymentResult deployment;

    public BatchReport(Batch batch, List<LoadBalancer> loadBalancers, DeploymentResult deployment) {
        this.batch = batch;
        this.loadBalancers = List.copyOf(loadBalancers);
        this.deployment = deployment;
    }

    public Batch getBatch() {
        return batch;
    }

    /**
     * Load balancers the batch was detached from and re-attached to
     */
    public List<LoadBalancer> getLoadBalancers() {
        return loadBalancers;
    }

    public List<String> getLoadBalancerNames() {
        return loadBalancers.stream().map(LoadBalancer::getName).collect(Collectors.toList());
    }

    public DeploymentResult getDeployment() {
        return deployment;
    }
}
