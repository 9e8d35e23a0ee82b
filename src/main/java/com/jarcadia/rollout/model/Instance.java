package com.jarcadia.rollout.model;

import java.util.Objects;

/**
 * Snapshot of a compute instance as listed by the compute orchestration service.
 */
public class Instance {

    private final String instanceId;
    private final String ec2InstanceId;
    private final String hostname;
    private final InstanceStatus status;

    public Instance(String instanceId, String ec2InstanceId, String hostname, InstanceStatus status) {
        this.instanceId = instanceId;
        this.ec2InstanceId = ec2InstanceId;
        this.hostname = hostname;
        this.status = status == null ? InstanceStatus.Unknown : status;
    }

    public Instance(String instanceId, String ec2InstanceId, String hostname, String status) {
        this(instanceId, ec2InstanceId, hostname, InstanceStatus.parse(status));
    }

    public String getInstanceId() {
        return instanceId;
    }

    /**
     * Identifier the load balancers know this instance by
     */
    public String getEc2InstanceId() {
        return ec2InstanceId;
    }

    public String getHostname() {
        return hostname;
    }

    public InstanceStatus getStatus() {
        return status;
    }

    public boolean isOnline() {
        return status.isEligible();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Instance)) {
            return false;
        }
        Instance other = (Instance) obj;
        return Objects.equals(instanceId, other.instanceId)
                && Objects.equals(ec2InstanceId, other.ec2InstanceId)
                && Objects.equals(hostname, other.hostname)
                && status == other.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(instanceId, ec2InstanceId, hostname, status);
    }

    @Override
    public String toString() {
        return hostname + "(" + instanceId + ")";
    }
}
