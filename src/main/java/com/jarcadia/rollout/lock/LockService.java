package com.jarcadia.rollout.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * Backend for a cluster wide named mutex. At most one token may hold a given name at any instant.
 */
public interface LockService {

    /**
     * Blocks until the named lock is acquired or maxWait has elapsed.
     *
     * @return the token for the held lock, or empty if the wait expired
     */
    Optional<LockToken> acquire(String name, Duration maxWait);

    /**
     * Releases the lock if the token still holds it.
     */
    void release(LockToken token);
}
