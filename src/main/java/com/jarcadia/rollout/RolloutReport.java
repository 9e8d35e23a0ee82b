package com.jarcadia.rollout;

import java.util.List;

public class RolloutReport {

    private final RolloutRequest request;
    private final List<BatchReport> batches;

    public RolloutReport(RolloutRequest request, List<BatchReport> batches) {
        this.request = request;
        this.batches = List.copyOf(batches);
    }

    public RolloutRequest getRequest() {
        return request;
    }

    public List<BatchReport> getBatches() {
        return batches;
    }

    public int getInstanceCount() {
        return batches.stream().mapToInt(b -> b.getBatch().size()).sum();
    }
}
