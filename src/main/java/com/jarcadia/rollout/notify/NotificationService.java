package com.jarcadia.rollout.notify;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jarcadia.rollout.notify.DeployEvent.Level;

/**
 * Publishes rollout progress. Every event is logged, then handed to each registered listener. A listener failure is
 * logged and never reaches the deploy that emitted the event.
 */
public class NotificationService {

    private final Logger logger = LoggerFactory.getLogger(NotificationService.class);

    private final Clock clock;
    private final List<DeployEventListener> listeners;

    public NotificationService(Clock clock) {
        this.clock = clock;
        this.listeners = new CopyOnWriteArrayList<>();
    }

    public NotificationService() {
        this(Clock.systemUTC());
    }

    public void addListener(DeployEventListener listener) {
        listeners.add(listener);
    }

    public void info(EventType type, String msg) {
        publish(type, Level.info, msg, Map.of());
    }

    public void info(EventType type, String msg, Map<String, String> attributes) {
        publish(type, Level.info, msg, attributes);
    }

    public void warn(EventType type, String msg) {
        publish(type, Level.warn, msg, Map.of());
    }

    public void warn(EventType type, String msg, Map<String, String> attributes) {
        publish(type, Level.warn, msg, attributes);
    }

    public void error(EventType type, String msg, Map<String, String> attributes) {
        publish(type, Level.error, msg, attributes);
    }

    private void publish(EventType type, Level level, String msg, Map<String, String> attributes) {
        DeployEvent event = new DeployEvent(type, level, clock.millis(), msg, attributes);
        switch (level) {
            case warn:
                logger.warn(msg);
                break;
            case error:
                logger.error(msg);
                break;
            default:
                logger.info(msg);
        }
        for (DeployEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException ex) {
                logger.warn("Listener {} failed to handle {} event", listener.getClass().getSimpleName(), type, ex);
            }
        }
    }
}
