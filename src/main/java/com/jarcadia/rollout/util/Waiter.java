package com.jarcadia.rollout.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jarcadia.rollout.exception.RolloutException;

/**
 * Polls a condition at a fixed interval until it holds or a wall-clock deadline passes. The number of attempts is
 * unbounded, only the total time is.
 */
public class Waiter {

    private final Logger logger = LoggerFactory.getLogger(Waiter.class);

    private final Clock clock;
    private final Sleeper sleeper;

    public Waiter(Clock clock, Sleeper sleeper) {
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public static Waiter system() {
        return new Waiter(Clock.systemUTC(), Sleeper.THREAD);
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Evaluates the condition immediately and then once per interval. Exceptions thrown by the condition propagate
     * and end the wait.
     *
     * @return true if the condition held before the deadline, false if the deadline passed first
     */
    public boolean await(String description, Duration timeout, Duration interval, BooleanSupplier condition) {
        Instant deadline = clock.instant().plus(timeout);
        int attempt = 0;
        while (true) {
            attempt++;
            if (condition.getAsBoolean()) {
                logger.debug("{} satisfied after {} attempts", description, attempt);
                return true;
            }
            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                logger.debug("{} not satisfied after {} attempts in {}s", description, attempt, timeout.getSeconds());
                return false;
            }
            Duration remaining = Duration.between(now, deadline);
            logger.debug("Waiting for {} (attempt {})", description, attempt);
            sleep(remaining.compareTo(interval) < 0 ? remaining : interval, description);
        }
    }

    public Duration elapsedSince(Instant start) {
        return Duration.between(start, clock.instant());
    }

    private void sleep(Duration duration, String description) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RolloutException("Interrupted while waiting for " + description, ex);
        }
    }
}
