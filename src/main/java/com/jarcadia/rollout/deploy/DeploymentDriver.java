package com.jarcadia.rollout.deploy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jarcadia.rollout.exception.DeployTimeoutException;
import com.jarcadia.rollout.exception.DeploymentFailedException;
import com.jarcadia.rollout.model.DeploymentHandle;
import com.jarcadia.rollout.model.DeploymentRequest;
import com.jarcadia.rollout.model.DeploymentResult;
import com.jarcadia.rollout.model.DeploymentStatus;
import com.jarcadia.rollout.notify.EventType;
import com.jarcadia.rollout.notify.NotificationService;
import com.jarcadia.rollout.util.Waiter;

public class DeploymentDriver {

    private final Logger logger = LoggerFactory.getLogger(DeploymentDriver.class);

    private final ComputeService compute;
    private final NotificationService notify;
    private final Waiter waiter;
    private final Duration defaultTimeout;
    private final Duration pollInterval;

    public DeploymentDriver(ComputeService compute, NotificationService notify, Waiter waiter, Duration defaultTimeout, Duration pollInterval) {
        this.compute = compute;
        this.notify = notify;
        this.waiter = waiter;
        this.defaultTimeout = defaultTimeout;
        this.pollInterval = pollInterval;
    }

    public DeploymentResult deploy(String stackId, String appId, List<String> instanceIds) {
        return deploy(stackId, appId, instanceIds, defaultTimeout);
    }

    /**
     * Deploys the app on exactly the given instances, running migrations, and blocks until the deployment succeeds.
     *
     * @throws DeploymentFailedException if the deployment reports failure
     * @throws DeployTimeoutException if the deployment has not succeeded once timeout has elapsed
     */
    public DeploymentResult deploy(String stackId, String appId, List<String> instanceIds, Duration timeout) {
        if (stackId == null || stackId.isBlank() || appId == null || appId.isBlank()) {
            throw new IllegalArgumentException("stackId and appId are required");
        }
        if (instanceIds == null || instanceIds.isEmpty()) {
            throw new IllegalArgumentException("instanceIds must not be empty");
        }

        Instant start = waiter.getClock().instant();
        DeploymentRequest request = DeploymentRequest.deployAndMigrate(stackId, appId, instanceIds);
        DeploymentHandle handle = compute.createDeployment(request);
        String deploymentId = handle.getDeploymentId();
        notify.info(EventType.DeployStarted, "Deploy process running (id: " + deploymentId + ")...",
                Map.of("deployment", deploymentId, "app", appId, "instances", String.join(",", instanceIds)));

        AtomicReference<DeploymentStatus> last = new AtomicReference<>(DeploymentStatus.Running);
        boolean succeeded = waiter.await("deployment " + deploymentId, timeout, pollInterval, () -> {
            DeploymentStatus status = compute.pollDeployment(handle);
            last.set(status);
            if (!status.isTerminal()) {
                return false;
            }
            if (status == DeploymentStatus.Failed) {
                throw new DeploymentFailedException("Deployment " + deploymentId + " failed on " + instanceIds);
            }
            return true;
        });
        if (!succeeded) {
            logger.warn("Deployment {} still {} after {} seconds", deploymentId, last.get(), timeout.getSeconds());
            throw new DeployTimeoutException("Deployment " + deploymentId + " did not complete within " + timeout.getSeconds() + " seconds");
        }

        DeploymentResult result = new DeploymentResult(deploymentId, DeploymentStatus.Successful, waiter.elapsedSince(start));
        notify.info(EventType.DeployCompleted, "Deploy completed (id: " + deploymentId + ")", Map.of("deployment", deploymentId));
        return result;
    }
}
