package com.jarcadia.rollout.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Clock that only moves when something sleeps on it, so waits complete instantly in tests.
 */
public class ManualClock extends Clock implements Sleeper {

    private volatile Instant now;
    private final List<Duration> sleeps;

    public ManualClock() {
        this.now = Instant.parse("2020-01-11T00:00:00Z");
        this.sleeps = new CopyOnWriteArrayList<>();
    }

    public Waiter waiter() {
        return new Waiter(this, this);
    }

    @Override
    public synchronized void sleep(Duration duration) {
        sleeps.add(duration);
        now = now.plus(duration);
    }

    public synchronized void advance(Duration duration) {
        now = now.plus(duration);
    }

    public List<Duration> getSleeps() {
        return sleeps;
    }

    public Duration totalSlept() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }

    @Override
    public Instant instant() {
        return now;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
