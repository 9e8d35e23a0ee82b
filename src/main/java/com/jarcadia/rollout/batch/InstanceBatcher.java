package com.jarcadia.rollout.batch;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.jarcadia.rollout.model.Batch;
import com.jarcadia.rollout.model.Instance;

/**
 * Slices an ordered instance list into consecutive batches.
 */
public class InstanceBatcher {

    /**
     * Without a percent the whole list is a single batch. With a percent each batch holds ceil(size * percent)
     * instances, at least one, and the last batch takes whatever remains.
     *
     * @param percent fraction of the instances per batch, 0 exclusive to 1 inclusive, or null
     */
    public List<Batch> batch(List<Instance> instances, Double percent) {
        if (percent != null && (percent.isNaN() || percent <= 0.0 || percent > 1.0)) {
            throw new IllegalArgumentException("percent must be greater than 0 and at most 1, was " + percent);
        }
        if (instances.isEmpty()) {
            return Collections.emptyList();
        }

        int size = percent == null ? instances.size() : batchSize(instances.size(), percent);
        int total = (instances.size() + size - 1) / size;
        List<Batch> batches = new ArrayList<>(total);
        for (int from = 0; from < instances.size(); from += size) {
            int to = Math.min(from + size, instances.size());
            batches.add(new Batch(batches.size() + 1, total, instances.subList(from, to)));
        }
        return batches;
    }

    static int batchSize(int count, double percent) {
        // decimal math keeps 10 * 0.7 from rounding up to 8
        int size = BigDecimal.valueOf(count)
                .multiply(BigDecimal.valueOf(percent))
                .setScale(0, RoundingMode.CEILING)
                .intValueExact();
        return Math.max(1, size);
    }
}
