package com.jarcadia.rollout.deploy;

import java.util.List;

import com.jarcadia.rollout.model.DeploymentHandle;
import com.jarcadia.rollout.model.DeploymentRequest;
import com.jarcadia.rollout.model.DeploymentStatus;
import com.jarcadia.rollout.model.Instance;

/**
 * Remote compute orchestration API that owns the instances and runs deployments on them.
 */
public interface ComputeService {

    List<Instance> listInstances(String layerId);

    DeploymentHandle createDeployment(DeploymentRequest request);

    DeploymentStatus pollDeployment(DeploymentHandle handle);
}
