package com.jarcadia.rollout.lock;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import com.jarcadia.rollout.exception.LockTimeoutException;
import com.jarcadia.rollout.notify.EventType;
import com.jarcadia.rollout.notify.NotificationService;

/**
 * Runs work while holding a cluster wide lock so that separate rollouts never detach instances from the same load
 * balancers at the same time. Two rollouts that each saw the other's instance still attached could otherwise both
 * detach and leave a load balancer with nothing to route to.
 */
public class DistributedLock {

    private final Optional<LockService> lockService;
    private final NotificationService notify;

    public DistributedLock(Optional<LockService> lockService, NotificationService notify) {
        this.lockService = lockService;
        this.notify = notify;
    }

    public boolean isEnabled() {
        return lockService.isPresent();
    }

    /**
     * Runs body exclusively under the named lock. The lock is released whether body returns or throws.
     *
     * @throws LockTimeoutException if the lock could not be acquired within maxWait, in which case body never runs
     */
    public <T> T withLock(String name, Duration maxWait, Supplier<T> body) {
        if (lockService.isEmpty()) {
            notify.warn(EventType.LockDisabled, "No lock backend configured, will deploy without locking. " +
                    "WARNING: two or more rollouts running simultaneously could detach every instance from a load balancer",
                    Map.of("lock", name));
            return body.get();
        }

        LockService service = lockService.get();
        notify.info(EventType.LockWaiting, "Waiting for deploy lock " + name + "...", Map.of("lock", name));
        Optional<LockToken> token = service.acquire(name, maxWait);
        if (token.isEmpty()) {
            String msg = "Could not get deploy lock " + name + " within " + maxWait.getSeconds() + " seconds";
            notify.error(EventType.LockTimeout, msg, Map.of("lock", name));
            throw new LockTimeoutException(msg);
        }

        notify.info(EventType.LockAcquired, "Got lock " + name + ". Running deploy...", Map.of("lock", name));
        Throwable failure = null;
        try {
            return body.get();
        } catch (Throwable ex) {
            failure = ex;
            throw ex;
        } finally {
            release(service, token.get(), failure);
        }
    }

    private void release(LockService service, LockToken token, Throwable failure) {
        try {
            service.release(token);
            notify.info(EventType.LockReleased, "Lock " + token.getName() + " released", Map.of("lock", token.getName()));
        } catch (RuntimeException ex) {
            if (failure == null) {
                throw ex;
            }
            failure.addSuppressed(ex);
        }
    }
}
