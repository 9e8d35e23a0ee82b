package com.jarcadia.rollout.model;

public enum InstanceStatus {
    Online,
    Booting,
    RunningSetup,
    SetupFailed,
    Stopping,
    Stopped,
    Terminating,
    Terminated,
    Unknown;

    public static InstanceStatus parse(String value) {
        if (value == null) {
            return Unknown;
        }
        switch (value.trim().toLowerCase()) {
            case "online":
                return Online;
            case "booting":
            case "pending":
            case "requested":
                return Booting;
            case "running_setup":
                return RunningSetup;
            case "setup_failed":
            case "start_failed":
                return SetupFailed;
            case "stopping":
            case "shutting_down":
                return Stopping;
            case "stopped":
                return Stopped;
            case "terminating":
                return Terminating;
            case "terminated":
                return Terminated;
            default:
                return Unknown;
        }
    }

    public boolean isEligible() {
        return this == Online;
    }
}
