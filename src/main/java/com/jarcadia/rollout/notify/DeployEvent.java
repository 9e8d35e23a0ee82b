package com.jarcadia.rollout.notify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class DeployEvent {

    public enum Level {
        info,
        warn,
        error
    }

    private final EventType type;
    private final Level level;
    private final long ts;
    private final String msg;
    private final Map<String, String> attributes;

    public DeployEvent(EventType type, Level level, long ts, String msg, Map<String, String> attributes) {
        this.type = type;
        this.level = level;
        this.ts = ts;
        this.msg = msg;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public EventType getType() {
        return type;
    }

    public Level getLevel() {
        return level;
    }

    public long getTs() {
        return ts;
    }

    public String getMsg() {
        return msg;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return "[" + level + "] " + type + ": " + msg;
    }
}
