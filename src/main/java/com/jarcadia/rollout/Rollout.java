package com.jarcadia.rollout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jarcadia.rollout.balancer.LoadBalancerManager;
import com.jarcadia.rollout.balancer.LoadBalancerService;
import com.jarcadia.rollout.batch.InstanceBatcher;
import com.jarcadia.rollout.deploy.ComputeService;
import com.jarcadia.rollout.deploy.DeploymentDriver;
import com.jarcadia.rollout.lock.DistributedLock;
import com.jarcadia.rollout.lock.LockService;
import com.jarcadia.rollout.lock.RedisLockService;
import com.jarcadia.rollout.notify.NotificationService;
import com.jarcadia.rollout.notify.RedisEventListener;
import com.jarcadia.rollout.notify.WebhookEventListener;
import com.jarcadia.rollout.util.Waiter;

import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;

public class Rollout {

    private static final Logger logger = LoggerFactory.getLogger(Rollout.class);

    public static RolloutManager init(RolloutConfig config, ComputeService compute, LoadBalancerService loadBalancerService) {
        return init(config, compute, loadBalancerService, Waiter.system());
    }

    public static RolloutManager init(RolloutConfig config, ComputeService compute, LoadBalancerService loadBalancerService, Waiter waiter) {
        ObjectMapper mapper = new ObjectMapper();
        NotificationService notificationService = new NotificationService(waiter.getClock());
        List<AutoCloseable> resources = new ArrayList<>();
        try {
            return wire(config, compute, loadBalancerService, waiter, mapper, notificationService, resources);
        } catch (RuntimeException ex) {
            logger.error("Unable to initialize rollout, closing {} opened resources", resources.size());
            RolloutManager.closeAll(resources);
            throw ex;
        }
    }

    private static RolloutManager wire(RolloutConfig config, ComputeService compute, LoadBalancerService loadBalancerService,
            Waiter waiter, ObjectMapper mapper, NotificationService notificationService, List<AutoCloseable> resources) {
        // Setup redis backed locking and event stream if configured
        Optional<LockService> lockService = Optional.empty();
        if (config.getRedisUri() != null) {
            RedisClient redisClient = RedisClient.create(config.getRedisUri());
            resources.add(redisClient::shutdown);
            StatefulRedisConnection<String, String> connection = redisClient.connect();
            resources.add(connection);

            RedisLockService redisLockService = new RedisLockService(connection.sync(), waiter,
                    Duration.ofSeconds(config.getLockLeaseSeconds()), Duration.ofMillis(config.getLockRetryMillis()));
            resources.add(redisLockService);
            lockService = Optional.of(redisLockService);

            if (config.getEventStream() != null) {
                notificationService.addListener(new RedisEventListener(connection.sync(), mapper,
                        config.getEventStream(), config.getEventStreamMaxLength()));
            }
        } else {
            logger.warn("No redisUri configured, rollouts will run without the deploy lock");
        }

        // Setup webhook notifications if configured
        if (config.getWebhookUrl() != null) {
            WebhookEventListener webhook = WebhookEventListener.create(mapper, config.getWebhookUrl(), config.getWebhookTimeoutMillis());
            notificationService.addListener(webhook);
            resources.add(webhook);
        }

        DistributedLock lock = new DistributedLock(lockService, notificationService);
        LoadBalancerManager loadBalancerManager = new LoadBalancerManager(loadBalancerService, notificationService, waiter,
                Duration.ofSeconds(config.getLoadBalancerTimeoutSeconds()), Duration.ofSeconds(config.getLoadBalancerPollSeconds()));
        DeploymentDriver driver = new DeploymentDriver(compute, notificationService, waiter,
                config.getDeployTimeout(), Duration.ofSeconds(config.getDeployPollSeconds()));

        RollingDeployOrchestrator orchestrator = new RollingDeployOrchestrator(compute, lock, new InstanceBatcher(),
                loadBalancerManager, driver, notificationService, config.getLockName(), config.getLockWait(), config.getDeployTimeout());

        return new RolloutManager(orchestrator, driver, notificationService, resources);
    }
}
