package com.jarcadia.rollout.notify;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jarcadia.rollout.exception.RolloutException;

import io.lettuce.core.XAddArgs;
import io.lettuce.core.api.sync.RedisCommands;

/**
 * Appends each event to a capped Redis stream so that dashboards and other deploys can follow progress.
 */
public class RedisEventListener implements DeployEventListener {

    private final RedisCommands<String, String> commands;
    private final ObjectMapper mapper;
    private final String streamKey;
    private final long maxLength;

    public RedisEventListener(RedisCommands<String, String> commands, ObjectMapper mapper, String streamKey, long maxLength) {
        this.commands = commands;
        this.mapper = mapper;
        this.streamKey = streamKey;
        this.maxLength = maxLength;
    }

    @Override
    public void onEvent(DeployEvent event) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("type", event.getType().name());
        body.put("level", event.getLevel().name());
        body.put("ts", Long.toString(event.getTs()));
        body.put("msg", event.getMsg());
        body.put("attrs", toJson(event.getAttributes()));
        commands.xadd(streamKey, XAddArgs.Builder.maxlen(maxLength), body);
    }

    private String toJson(Map<String, String> attributes) {
        try {
            return mapper.writeValueAsString(attributes);
        } catch (JsonProcessingException ex) {
            throw new RolloutException("Unable to serialize event attributes", ex);
        }
    }
}
