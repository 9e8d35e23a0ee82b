package com.jarcadia.rollout.balancer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jarcadia.rollout.exception.LoadBalancerWaitTimeoutException;
import com.jarcadia.rollout.exception.RolloutException;
import com.jarcadia.rollout.model.Instance;
import com.jarcadia.rollout.model.InstanceHealth;
import com.jarcadia.rollout.model.LoadBalancer;
import com.jarcadia.rollout.model.RegistrationResult;
import com.jarcadia.rollout.notify.EventType;
import com.jarcadia.rollout.notify.NotificationService;
import com.jarcadia.rollout.util.Waiter;

/**
 * Detaches instances from and re-attaches them to every load balancer they are registered with, blocking until the
 * load balancers confirm each transition.
 */
public class LoadBalancerManager {

    private final Logger logger = LoggerFactory.getLogger(LoadBalancerManager.class);

    private final LoadBalancerService service;
    private final NotificationService notify;
    private final Waiter waiter;
    private final Duration timeout;
    private final Duration pollInterval;

    public LoadBalancerManager(LoadBalancerService service, NotificationService notify, Waiter waiter,
            Duration timeout, Duration pollInterval) {
        this.service = service;
        this.notify = notify;
        this.waiter = waiter;
        this.timeout = timeout;
        this.pollInterval = pollInterval;
    }

    /**
     * Detaches the instances from each load balancer that has them attached, unless doing so would leave that load
     * balancer with no attached instances, in which case it is skipped.
     *
     * @return snapshots of the load balancers actually detached from, taken before the detach, possibly empty
     * @throws IllegalArgumentException if instances is empty or holds an instance without a load balancer facing id
     * @throws RolloutException if the service lists an unnamed load balancer, before anything is deregistered
     * @throws LoadBalancerWaitTimeoutException if a load balancer did not confirm the deregistration in time
     */
    public List<LoadBalancer> detach(Collection<Instance> instances) {
        List<String> ids = loadBalancerIds(instances);

        List<LoadBalancer> listed = service.listLoadBalancers();
        if (listed.stream().anyMatch(lb -> lb == null || lb.getName() == null)) {
            throw new RolloutException("Load balancer service listed a load balancer without a name: " + listed);
        }

        List<LoadBalancer> targets = new ArrayList<>();
        for (LoadBalancer lb : listed) {
            Set<String> matched = lb.matching(ids);
            if (matched.isEmpty()) {
                continue;
            }
            if (matched.size() < lb.getInstanceIds().size()) {
                targets.add(lb);
            } else {
                notify.warn(EventType.LoadBalancerSkipped, "Will not detach " + String.join(", ", matched) +
                        " from load balancer " + lb.getName() + " because they are the only instances attached",
                        Map.of("loadBalancer", lb.getName(), "instances", String.join(",", matched)));
            }
        }

        if (targets.isEmpty()) {
            notify.info(EventType.NoLoadBalancers, "No load balancers found for instances " + String.join(", ", ids),
                    Map.of("instances", String.join(",", ids)));
            return Collections.emptyList();
        }

        for (LoadBalancer lb : targets) {
            List<String> matched = List.copyOf(lb.matching(ids));
            List<String> remaining = service.deregister(lb.getName(), matched);
            logger.info("Will detach {} from {} (remaining attached instances: {})", matched, lb.getName(), remaining);
        }

        for (LoadBalancer lb : targets) {
            List<String> matched = List.copyOf(lb.matching(ids));
            awaitHealth(lb.getName(), matched, InstanceHealth::isDeregistered, "deregistered");
            notify.info(EventType.Detached, "Detached from " + lb.getName(),
                    Map.of("loadBalancer", lb.getName(), "instances", String.join(",", matched)));
        }
        return Collections.unmodifiableList(targets);
    }

    /**
     * Registers the instances with the given load balancers and blocks until every one reports them in service. Only
     * the instances a snapshot lists as attached are registered with it, so attaching the result of {@link #detach}
     * restores the membership seen before the detach.
     *
     * @return registration outcome by load balancer name, empty when there were no load balancers
     * @throws IllegalArgumentException for the same instances as {@link #detach}, or a null load balancer
     * @throws LoadBalancerWaitTimeoutException if a load balancer did not report the instances in service in time
     */
    public Map<String, RegistrationResult> attach(Collection<Instance> instances, Collection<LoadBalancer> loadBalancers) {
        List<String> ids = loadBalancerIds(instances);
        if (loadBalancers == null || loadBalancers.stream().anyMatch(lb -> lb == null || lb.getName() == null)) {
            throw new IllegalArgumentException("loadBalancers must be a collection of named load balancers");
        }

        if (loadBalancers.isEmpty()) {
            logger.info("No load balancers to attach to");
            return Collections.emptyMap();
        }

        Map<String, RegistrationResult> registered = new LinkedHashMap<>();
        for (LoadBalancer lb : loadBalancers) {
            registered.put(lb.getName(), service.register(lb.getName(), attachIds(lb, ids)));
        }

        logger.info("Re-attaching {} to {}", ids, registered.keySet());

        for (LoadBalancer lb : loadBalancers) {
            List<String> attached = attachIds(lb, ids);
            awaitHealth(lb.getName(), attached, InstanceHealth::isInService, "in service");
            notify.info(EventType.Reattached, "Re-attached to " + lb.getName(),
                    Map.of("loadBalancer", lb.getName(), "instances", String.join(",", attached)));
        }
        return Collections.unmodifiableMap(registered);
    }

    private List<String> attachIds(LoadBalancer lb, List<String> ids) {
        Set<String> matched = lb.matching(ids);
        return matched.isEmpty() ? ids : List.copyOf(matched);
    }

    private void awaitHealth(String loadBalancerName, List<String> instanceIds, Predicate<InstanceHealth> check, String expected) {
        List<String> pending = new ArrayList<>(instanceIds);
        boolean confirmed = waiter.await(instanceIds + " " + expected + " on " + loadBalancerName, timeout, pollInterval, () -> {
            pending.removeIf(id -> check.test(service.pollInstanceState(loadBalancerName, id)));
            return pending.isEmpty();
        });
        if (!confirmed) {
            throw new LoadBalancerWaitTimeoutException(loadBalancerName, "Load balancer " + loadBalancerName +
                    " did not report " + pending + " as " + expected + " within " + timeout.getSeconds() + " seconds");
        }
    }

    private List<String> loadBalancerIds(Collection<Instance> instances) {
        if (instances == null || instances.isEmpty()) {
            throw new IllegalArgumentException("instances must be a non-empty collection of instances");
        }
        if (instances.stream().anyMatch(i -> i == null || i.getEc2InstanceId() == null || i.getEc2InstanceId().isBlank())) {
            throw new IllegalArgumentException("instances must all be instances with a load balancer facing id");
        }
        return instances.stream()
                .map(Instance::getEc2InstanceId)
                .distinct()
                .collect(Collectors.toList());
    }
}
