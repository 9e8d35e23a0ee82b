package com.jarcadia.rollout;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mockito;

import com.jarcadia.rollout.balancer.InMemoryLoadBalancerService;
import com.jarcadia.rollout.balancer.LoadBalancerManager;
import com.jarcadia.rollout.balancer.LoadBalancerService;
import com.jarcadia.rollout.batch.InstanceBatcher;
import com.jarcadia.rollout.deploy.ComputeService;
import com.jarcadia.rollout.deploy.DeploymentDriver;
import com.jarcadia.rollout.exception.DeploymentFailedException;
import com.jarcadia.rollout.exception.LoadBalancerWaitTimeoutException;
import com.jarcadia.rollout.exception.LockTimeoutException;
import com.jarcadia.rollout.lock.DistributedLock;
import com.jarcadia.rollout.lock.LockService;
import com.jarcadia.rollout.lock.LockToken;
import com.jarcadia.rollout.model.DeploymentHandle;
import com.jarcadia.rollout.model.DeploymentRequest;
import com.jarcadia.rollout.model.DeploymentStatus;
import com.jarcadia.rollout.model.Instance;
import com.jarcadia.rollout.model.InstanceHealth;
import com.jarcadia.rollout.model.InstanceStatus;
import com.jarcadia.rollout.model.LoadBalancer;
import com.jarcadia.rollout.notify.EventType;
import com.jarcadia.rollout.notify.NotificationService;
import com.jarcadia.rollout.util.ManualClock;

public class RollingDeployOrchestratorUnitTest {

    private final Instance a = new Instance("ops-a", "i-a", "web-a", InstanceStatus.Online);
    private final Instance b = new Instance("ops-b", "i-b", "web-b", InstanceStatus.Online);
    private final Instance c = new Instance("ops-c", "i-c", "web-c", InstanceStatus.Online);
    private final Instance d = new Instance("ops-d", "i-d", "web-d", InstanceStatus.Online);
    private final Instance stopped = new Instance("ops-e", "i-e", "web-e", InstanceStatus.Stopped);

    private final ManualClock clock = new ManualClock();
    private final NotificationService notify = Mockito.spy(new NotificationService(clock));
    private final ComputeService compute = Mockito.mock(ComputeService.class);
    private final LockService lockService = Mockito.mock(LockService.class);
    private final LockToken token = new LockToken("deploy", "holder-1");

    private LoadBalancerManager loadBalancerManager;

    private RollingDeployOrchestrator orchestrator(LoadBalancerService loadBalancerService) {
        Mockito.when(lockService.acquire(Mockito.eq("deploy"), Mockito.any())).thenReturn(Optional.of(token));
        loadBalancerManager = Mockito.spy(new LoadBalancerManager(loadBalancerService, notify, clock.waiter(),
                Duration.ofMinutes(10), Duration.ofSeconds(15)));
        DeploymentDriver driver = new DeploymentDriver(compute, notify, clock.waiter(), Duration.ofMinutes(30), Duration.ofSeconds(15));
        return new RollingDeployOrchestrator(compute, new DistributedLock(Optional.of(lockService), notify), new InstanceBatcher(),
                loadBalancerManager, driver, notify, "deploy", Duration.ofSeconds(600), Duration.ofMinutes(30));
    }

    private void givenDeploymentsSucceed() {
        Mockito.when(compute.createDeployment(Mockito.any())).thenReturn(new DeploymentHandle("dep-1"), new DeploymentHandle("dep-2"));
        Mockito.when(compute.pollDeployment(Mockito.any())).thenReturn(DeploymentStatus.Successful);
    }

    @Test
    public void testRollingDeployInHalves() {
        InMemoryLoadBalancerService loadBalancerService = new InMemoryLoadBalancerService()
                .withLoadBalancer("web-lb", "i-a", "i-b", "i-c", "i-d");
        Mockito.when(compute.listInstances("layer")).thenReturn(List.of(a, b, stopped, c, d));
        givenDeploymentsSucceed();

        RolloutReport report = orchestrator(loadBalancerService).rollingDeploy(new RolloutRequest("stack", "layer", "app", 0.5));

        Assertions.assertEquals(2, report.getBatches().size());
        Assertions.assertEquals(4, report.getInstanceCount());
        Assertions.assertEquals(List.of("web-lb"), report.getBatches().get(0).getLoadBalancerNames());
        Assertions.assertEquals("dep-2", report.getBatches().get(1).getDeployment().getDeploymentId());
        Assertions.assertEquals(List.of(
                "list", "deregister web-lb [i-a, i-b]", "register web-lb [i-a, i-b]",
                "list", "deregister web-lb [i-c, i-d]", "register web-lb [i-c, i-d]"), loadBalancerService.getCalls());
        Assertions.assertEquals(Set.of("i-a", "i-b", "i-c", "i-d"), loadBalancerService.membersOf("web-lb"));

        ArgumentCaptor<DeploymentRequest> requests = ArgumentCaptor.forClass(DeploymentRequest.class);
        Mockito.verify(compute, Mockito.times(2)).createDeployment(requests.capture());
        Assertions.assertEquals(List.of("ops-a", "ops-b"), requests.getAllValues().get(0).getInstanceIds());
        Assertions.assertEquals(List.of("ops-c", "ops-d"), requests.getAllValues().get(1).getInstanceIds());

        InOrder inOrder = Mockito.inOrder(lockService, compute);
        inOrder.verify(lockService).acquire(Mockito.eq("deploy"), Mockito.eq(Duration.ofSeconds(600)));
        inOrder.verify(compute).listInstances("layer");
        inOrder.verify(lockService).release(token);
        Mockito.verify(notify).info(Mockito.eq(EventType.DeployAllComplete), Mockito.anyString(), Mockito.anyMap());
    }

    @Test
    public void testWithoutPercentDeploysAllAtOnce() {
        InMemoryLoadBalancerService loadBalancerService = new InMemoryLoadBalancerService()
                .withLoadBalancer("web-lb", "i-a", "i-b", "i-c", "i-d", "i-x");
        Mockito.when(compute.listInstances("layer")).thenReturn(List.of(a, b, c, d));
        givenDeploymentsSucceed();

        RolloutReport report = orchestrator(loadBalancerService).rollingDeploy(new RolloutRequest("stack", "layer", "app"));

        Assertions.assertEquals(1, report.getBatches().size());
        Assertions.assertEquals(List.of(a, b, c, d), report.getBatches().get(0).getBatch().getInstances());
        Assertions.assertEquals(Set.of("i-a", "i-b", "i-c", "i-d", "i-x"), loadBalancerService.membersOf("web-lb"));
    }

    @Test
    public void testDeployProceedsWhenLoadBalancerWouldBeDrained() {
        InMemoryLoadBalancerService loadBalancerService = new InMemoryLoadBalancerService()
                .withLoadBalancer("web-lb", "i-a", "i-b");
        Mockito.when(compute.listInstances("layer")).thenReturn(List.of(a, b));
        givenDeploymentsSucceed();

        RolloutReport report = orchestrator(loadBalancerService).rollingDeploy(new RolloutRequest("stack", "layer", "app"));

        Assertions.assertTrue(report.getBatches().get(0).getLoadBalancers().isEmpty());
        Assertions.assertEquals(List.of("list"), loadBalancerService.getCalls());
        Mockito.verify(compute).createDeployment(Mockito.any());
        Mockito.verify(loadBalancerManager).attach(List.of(a, b), List.of());
    }

    @Test
    public void testFailedDeployIsReattachedAndSurfaced() {
        InMemoryLoadBalancerService loadBalancerService = new InMemoryLoadBalancerService()
                .withLoadBalancer("web-lb", "i-a", "i-b", "i-c", "i-d")
                .withLoadBalancer("admin-lb", "i-a", "i-c");
        Mockito.when(compute.listInstances("layer")).thenReturn(List.of(a, b, c, d));
        Mockito.when(compute.createDeployment(Mockito.any())).thenReturn(new DeploymentHandle("dep-1"));
        Mockito.when(compute.pollDeployment(Mockito.any())).thenReturn(DeploymentStatus.Failed);
        RollingDeployOrchestrator orchestrator = orchestrator(loadBalancerService);

        Assertions.assertThrows(DeploymentFailedException.class,
                () -> orchestrator.rollingDeploy(new RolloutRequest("stack", "layer", "app", 0.5)));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<LoadBalancer>> reattached = ArgumentCaptor.forClass(List.class);
        Mockito.verify(loadBalancerManager, Mockito.times(1)).attach(Mockito.eq(List.of(a, b)), reattached.capture());
        Assertions.assertEquals(List.of("web-lb", "admin-lb"), reattached.getValue().stream().map(LoadBalancer::getName)
                .collect(Collectors.toList()));
        Assertions.assertEquals(Set.of("i-a", "i-b", "i-c", "i-d"), loadBalancerService.membersOf("web-lb"));
        Assertions.assertEquals(Set.of("i-a", "i-c"), loadBalancerService.membersOf("admin-lb"));

        // the second batch never starts
        Mockito.verify(compute, Mockito.times(1)).createDeployment(Mockito.any());
        Mockito.verify(lockService).release(token);
        Mockito.verify(notify).error(Mockito.eq(EventType.BatchFailed), Mockito.anyString(), Mockito.anyMap());
    }

    @Test
    public void testErrorDuringDeployStillReattaches() {
        InMemoryLoadBalancerService loadBalancerService = new InMemoryLoadBalancerService()
                .withLoadBalancer("web-lb", "i-a", "i-b");
        Mockito.when(compute.listInstances("layer")).thenReturn(List.of(a));
        Mockito.when(compute.createDeployment(Mockito.any())).thenReturn(new DeploymentHandle("dep-1"));
        Mockito.when(compute.pollDeployment(Mockito.any())).thenThrow(new Error("poller crashed"));
        RollingDeployOrchestrator orchestrator = orchestrator(loadBalancerService);

        Error ex = Assertions.assertThrows(Error.class,
                () -> orchestrator.rollingDeploy(new RolloutRequest("stack", "layer", "app")));

        Assertions.assertEquals("poller crashed", ex.getMessage());
        Assertions.assertEquals(List.of("list", "deregister web-lb [i-a]", "register web-lb [i-a]"), loadBalancerService.getCalls());
        Assertions.assertEquals(Set.of("i-a", "i-b"), loadBalancerService.membersOf("web-lb"));
        Mockito.verify(lockService).release(token);
        Mockito.verify(notify).error(Mockito.eq(EventType.BatchFailed), Mockito.anyString(), Mockito.anyMap());
    }

    @Test
    public void testReattachFailureIsSuppressedUnderDeployFailure() {
        LoadBalancerService loadBalancerService = Mockito.mock(LoadBalancerService.class);
        Mockito.when(loadBalancerService.listLoadBalancers()).thenReturn(List.of(new LoadBalancer("web-lb", List.of("i-a", "i-b"))));
        Mockito.when(loadBalancerService.pollInstanceState("web-lb", "i-a")).thenReturn(InstanceHealth.OutOfService);
        Mockito.when(compute.listInstances("layer")).thenReturn(List.of(a));
        Mockito.when(compute.createDeployment(Mockito.any())).thenReturn(new DeploymentHandle("dep-1"));
        Mockito.when(compute.pollDeployment(Mockito.any())).thenReturn(DeploymentStatus.Failed);
        RollingDeployOrchestrator orchestrator = orchestrator(loadBalancerService);

        DeploymentFailedException ex = Assertions.assertThrows(DeploymentFailedException.class,
                () -> orchestrator.rollingDeploy(new RolloutRequest("stack", "layer", "app")));

        Assertions.assertEquals(1, ex.getSuppressed().length);
        Assertions.assertTrue(ex.getSuppressed()[0] instanceof LoadBalancerWaitTimeoutException);
        Mockito.verify(loadBalancerService).register("web-lb", List.of("i-a"));
        Mockito.verify(lockService).release(token);
    }

    @Test
    public void testDetachFailureSkipsDeployAndAttach() {
        LoadBalancerService loadBalancerService = Mockito.mock(LoadBalancerService.class);
        Mockito.when(loadBalancerService.listLoadBalancers()).thenReturn(List.of(new LoadBalancer("web-lb", List.of("i-a", "i-b"))));
        Mockito.when(loadBalancerService.pollInstanceState("web-lb", "i-a")).thenReturn(InstanceHealth.InService);
        Mockito.when(compute.listInstances("layer")).thenReturn(List.of(a));
        RollingDeployOrchestrator orchestrator = orchestrator(loadBalancerService);

        Assertions.assertThrows(LoadBalancerWaitTimeoutException.class,
                () -> orchestrator.rollingDeploy(new RolloutRequest("stack", "layer", "app")));

        Mockito.verify(compute, Mockito.never()).createDeployment(Mockito.any());
        Mockito.verify(loadBalancerManager, Mockito.never()).attach(Mockito.any(), Mockito.any());
        Mockito.verify(lockService).release(token);
    }

    @Test
    public void testLockTimeoutTouchesNothing() {
        LoadBalancerService loadBalancerService = Mockito.mock(LoadBalancerService.class);
        RollingDeployOrchestrator orchestrator = orchestrator(loadBalancerService);
        Mockito.when(lockService.acquire(Mockito.eq("deploy"), Mockito.any())).thenReturn(Optional.empty());

        Assertions.assertThrows(LockTimeoutException.class,
                () -> orchestrator.rollingDeploy(new RolloutRequest("stack", "layer", "app")));

        Mockito.verifyNoInteractions(compute, loadBalancerService);
        Mockito.verify(lockService, Mockito.never()).release(Mockito.any());
    }

    @Test
    public void testNoOnlineInstances() {
        LoadBalancerService loadBalancerService = Mockito.mock(LoadBalancerService.class);
        Mockito.when(compute.listInstances("layer")).thenReturn(List.of(stopped));

        RolloutReport report = orchestrator(loadBalancerService).rollingDeploy(new RolloutRequest("stack", "layer", "app", 0.5));

        Assertions.assertTrue(report.getBatches().isEmpty());
        Mockito.verifyNoInteractions(loadBalancerService);
        Mockito.verify(compute, Mockito.never()).createDeployment(Mockito.any());
    }
}
