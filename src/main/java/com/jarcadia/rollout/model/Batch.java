package com.jarcadia.rollout.model;

import java.util.List;
import java.util.stream.Collectors;

public class Batch {

    private final int index;
    private final int total;
    private final List<Instance> instances;

    public Batch(int index, int total, List<Instance> instances) {
        this.index = index;
        this.total = total;
        this.instances = List.copyOf(instances);
    }

    /**
     * 1-based position of this batch in the rollout
     */
    public int getIndex() {
        return index;
    }

    public int getTotal() {
        return total;
    }

    public List<Instance> getInstances() {
        return instances;
    }

    public List<String> getInstanceIds() {
        return instances.stream().map(Instance::getInstanceId).collect(Collectors.toList());
    }

    public List<String> getHostnames() {
        return instances.stream().map(Instance::getHostname).collect(Collectors.toList());
    }

    public int size() {
        return instances.size();
    }

    @Override
    public String toString() {
        return "batch " + index + "/" + total + " " + getHostnames();
    }
}
