package com.jarcadia.rollout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jarcadia.rollout.deploy.DeploymentDriver;
import com.jarcadia.rollout.model.DeploymentResult;
import com.jarcadia.rollout.notify.NotificationService;

public class RolloutManager {

    private static final Logger logger = LoggerFactory.getLogger(RolloutManager.class);

    private final RollingDeployOrchestrator orchestrator;
    private final DeploymentDriver driver;
    private final NotificationService notificationService;
    private final List<AutoCloseable> resources;

    public RolloutManager(RollingDeployOrchestrator orchestrator, DeploymentDriver driver,
            NotificationService notificationService, List<AutoCloseable> resources) {
        this.orchestrator = orchestrator;
        this.driver = driver;
        this.notificationService = notificationService;
        this.resources = new ArrayList<>(resources);
    }

    public RolloutReport rollingDeploy(RolloutRequest request) {
        return orchestrator.rollingDeploy(request);
    }

    /**
     * Deploys directly to the given instances, without the deploy lock and without touching load balancers
     */
    public DeploymentResult deploy(String stackId, String appId, List<String> instanceIds) {
        return driver.deploy(stackId, appId, instanceIds);
    }

    public NotificationService getNotificationService() {
        return notificationService;
    }

    /**
     * Closes redis and http resources in the reverse order they were opened
     */
    public void shutdown() {
        closeAll(resources);
        resources.clear();
    }

    static void closeAll(List<AutoCloseable> resources) {
        List<AutoCloseable> reversed = new ArrayList<>(resources);
        Collections.reverse(reversed);
        for (AutoCloseable resource : reversed) {
            try {
                resource.close();
            } catch (Exception ex) {
                logger.warn("Error while closing {}", resource, ex);
            }
        }
    }
}
