package com.jarcadia.rollout.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DeploymentRequest {

    public static final String DEPLOY_COMMAND = "deploy";
    public static final String MIGRATE_ARG = "migrate";

    private final String stackId;
    private final String appId;
    private final List<String> instanceIds;
    private final String command;
    private final Map<String, List<String>> args;

    private DeploymentRequest(String stackId, String appId, List<String> instanceIds, String command, Map<String, List<String>> args) {
        this.stackId = stackId;
        this.appId = appId;
        this.instanceIds = List.copyOf(instanceIds);
        this.command = command;
        this.args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    /**
     * Creates a deploy command that also runs the app's migrations
     */
    public static DeploymentRequest deployAndMigrate(String stackId, String appId, List<String> instanceIds) {
        return new DeploymentRequest(stackId, appId, instanceIds, DEPLOY_COMMAND, Map.of(MIGRATE_ARG, List.of("true")));
    }

    public String getStackId() {
        return stackId;
    }

    public String getAppId() {
        return appId;
    }

    public List<String> getInstanceIds() {
        return instanceIds;
    }

    public String getCommand() {
        return command;
    }

    public Map<String, List<String>> getArgs() {
        return args;
    }

    @Override
    public String toString() {
        return command + " " + appId + "@" + stackId + " on " + instanceIds;
    }
}
