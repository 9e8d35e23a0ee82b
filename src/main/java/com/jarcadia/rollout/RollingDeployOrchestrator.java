package com.jarcadia.rollout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jarcadia.rollout.balancer.LoadBalancerManager;
import com.jarcadia.rollout.batch.InstanceBatcher;
import com.jarcadia.rollout.deploy.ComputeService;
import com.jarcadia.rollout.deploy.DeploymentDriver;
import com.jarcadia.rollout.exception.LockTimeoutException;
import com.jarcadia.rollout.lock.DistributedLock;
import com.jarcadia.rollout.model.Batch;
import com.jarcadia.rollout.model.DeploymentResult;
import com.jarcadia.rollout.model.Instance;
import com.jarcadia.rollout.model.LoadBalancer;
import com.jarcadia.rollout.notify.EventType;
import com.jarcadia.rollout.notify.NotificationService;

/**
 * Deploys an app to every online instance of a layer, batch by batch:
 * <ol>
 *   <li>detach the batch from its load balancers and wait for the load balancers to confirm</li>
 *   <li>deploy and migrate, waiting for the deployment to succeed</li>
 *   <li>re-attach the batch and wait for it to be in service, also when the deploy failed</li>
 * </ol>
 * Only one rollout runs at a time per lock name, across processes.
 */
public class RollingDeployOrchestrator {

    private final Logger logger = LoggerFactory.getLogger(RollingDeployOrchestrator.class);

    private final ComputeService compute;
    private final DistributedLock lock;
    private final InstanceBatcher batcher;
    private final LoadBalancerManager loadBalancers;
    private final DeploymentDriver driver;
    private final NotificationService notify;
    private final String lockName;
    private final Duration lockWait;
    private final Duration deployTimeout;

    public RollingDeployOrchestrator(ComputeService compute, DistributedLock lock, InstanceBatcher batcher,
            LoadBalancerManager loadBalancers, DeploymentDriver driver, NotificationService notify,
            String lockName, Duration lockWait, Duration deployTimeout) {
        this.compute = compute;
        this.lock = lock;
        this.batcher = batcher;
        this.loadBalancers = loadBalancers;
        this.driver = driver;
        this.notify = notify;
        this.lockName = lockName;
        this.lockWait = lockWait;
        this.deployTimeout = deployTimeout;
    }

    /**
     * Runs the rollout while holding the deploy lock, waiting for any rollout already holding it to finish.
     *
     * @throws LockTimeoutException if the lock was not acquired in time, before any instance was touched
     */
    public RolloutReport rollingDeploy(RolloutRequest request) {
        return lock.withLock(lockName, lockWait, () -> rollingDeployWithoutLock(request));
    }

    RolloutReport rollingDeployWithoutLock(RolloutRequest request) {
        logger.info("Starting deploy of {}", request);

        List<Instance> online = compute.listInstances(request.getLayerId()).stream()
                .filter(Instance::isOnline)
                .collect(Collectors.toList());
        if (online.isEmpty()) {
            logger.warn("No online instances in layer {}, nothing to deploy", request.getLayerId());
        }

        List<BatchReport> reports = new ArrayList<>();
        for (Batch batch : batcher.batch(online, request.getPercent())) {
            reports.add(deployBatch(batch, request));
        }

        notify.info(EventType.DeployAllComplete, "SUCCESS: completed deploy for all instances on app " + request.getAppId(),
                Map.of("app", request.getAppId(), "instances", Integer.toString(online.size())));
        return new RolloutReport(request, reports);
    }

    private BatchReport deployBatch(Batch batch, RolloutRequest request) {
        String hosts = String.join(", ", batch.getHostnames());
        Map<String, String> attrs = Map.of("batch", Integer.toString(batch.getIndex()),
                "of", Integer.toString(batch.getTotal()), "hosts", hosts);
        notify.info(EventType.BatchStarted, "=== Starting deploy for " + hosts + " (batch " + batch.getIndex() + "/" + batch.getTotal() + ") ===", attrs);

        try {
            List<LoadBalancer> detached = loadBalancers.detach(batch.getInstances());
            DeploymentResult result;
            try {
                result = driver.deploy(request.getStackId(), request.getAppId(), batch.getInstanceIds(), deployTimeout);
            } catch (Throwable ex) {
                reattachAfterFailure(batch, detached, ex);
                throw ex;
            }
            loadBalancers.attach(batch.getInstances(), detached);

            notify.info(EventType.BatchDone, "=== Done deploying on " + hosts + " ===", attrs);
            return new BatchReport(batch, detached, result);
        } catch (Throwable ex) {
            notify.error(EventType.BatchFailed, "=== Deploy failed on " + hosts + " (batch " + batch.getIndex() + "/" +
                    batch.getTotal() + "): " + ex.getMessage() + " ===", attrs);
            throw ex;
        }
    }

    private void reattachAfterFailure(Batch batch, List<LoadBalancer> detached, Throwable failure) {
        try {
            loadBalancers.attach(batch.getInstances(), detached);
        } catch (RuntimeException ex) {
            logger.error("Unable to re-attach {} to {} after failed deploy", batch, detached, ex);
            failure.addSuppressed(ex);
        }
    }
}
