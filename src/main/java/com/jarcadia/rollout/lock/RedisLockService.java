package com.jarcadia.rollout.lock;

import java.io.Closeable;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jarcadia.rollout.util.Waiter;

import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.sync.RedisCommands;

/**
 * {@link LockService} on a single Redis key per lock. The key holds a random holder id and expires after a lease,
 * which a keep-alive task extends every third of the lease while the lock is held. Release and renewal only touch the
 * key when it still holds the caller's id.
 */
public class RedisLockService implements LockService, Closeable {

    private final Logger logger = LoggerFactory.getLogger(RedisLockService.class);

    static final String KEY_PREFIX = "rollout.lock.";

    static final String RELEASE_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end";

    static final String RENEW_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('pexpire', KEYS[1], ARGV[2]) else return 0 end";

    private final RedisCommands<String, String> commands;
    private final Waiter waiter;
    private final Duration leaseTtl;
    private final Duration retryInterval;
    private final ScheduledExecutorService keepAlive;
    private final Map<LockToken, ScheduledFuture<?>> renewals;

    public RedisLockService(RedisCommands<String, String> commands, Waiter waiter, Duration leaseTtl, Duration retryInterval) {
        this.commands = commands;
        this.waiter = waiter;
        this.leaseTtl = leaseTtl;
        this.retryInterval = retryInterval;
        this.keepAlive = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "rollout-lock-keepalive");
            thread.setDaemon(true);
            return thread;
        });
        this.renewals = new ConcurrentHashMap<>();
    }

    @Override
    public Optional<LockToken> acquire(String name, Duration maxWait) {
        String key = KEY_PREFIX + name;
        String holder = UUID.randomUUID().toString();
        boolean acquired = waiter.await("lock " + key, maxWait, retryInterval, () -> tryAcquire(key, holder));
        if (!acquired) {
            return Optional.empty();
        }
        LockToken token = new LockToken(name, holder);
        long period = Math.max(1L, leaseTtl.toMillis() / 3);
        renewals.put(token, keepAlive.scheduleAtFixedRate(() -> renew(token), period, period, TimeUnit.MILLISECONDS));
        logger.debug("Acquired {} as {}", key, holder);
        return Optional.of(token);
    }

    @Override
    public void release(LockToken token) {
        ScheduledFuture<?> renewal = renewals.remove(token);
        if (renewal != null) {
            renewal.cancel(false);
        }
        String key = KEY_PREFIX + token.getName();
        Long deleted = commands.eval(RELEASE_SCRIPT, ScriptOutputType.INTEGER, new String[] { key }, token.getHolder());
        if (deleted == null || deleted == 0L) {
            logger.warn("Lock {} was no longer held by {} when released", key, token.getHolder());
        }
    }

    private boolean tryAcquire(String key, String holder) {
        return "OK".equals(commands.set(key, holder, SetArgs.Builder.nx().px(leaseTtl.toMillis())));
    }

    void renew(LockToken token) {
        String key = KEY_PREFIX + token.getName();
        try {
            Long renewed = commands.eval(RENEW_SCRIPT, ScriptOutputType.INTEGER, new String[] { key },
                    token.getHolder(), Long.toString(leaseTtl.toMillis()));
            if (renewed == null || renewed == 0L) {
                logger.warn("Lock {} lost by {} before it was released", key, token.getHolder());
            }
        } catch (RuntimeException ex) {
            logger.warn("Unable to renew lock {}", key, ex);
        }
    }

    @Override
    public void close() {
        keepAlive.shutdownNow();
    }
}
