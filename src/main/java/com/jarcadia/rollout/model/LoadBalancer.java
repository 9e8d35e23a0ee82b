package com.jarcadia.rollout.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Snapshot of a load balancer and the instance ids attached to it at the time it was listed.
 */
public class LoadBalancer {

    private final String name;
    private final Set<String> instanceIds;

    public LoadBalancer(String name, Collection<String> instanceIds) {
        this.name = name;
        this.instanceIds = Collections.unmodifiableSet(new LinkedHashSet<>(instanceIds));
    }

    public String getName() {
        return name;
    }

    public Set<String> getInstanceIds() {
        return instanceIds;
    }

    /**
     * Returns the given load balancer facing ids that are attached to this load balancer, in attachment order
     */
    public Set<String> matching(Collection<String> candidateIds) {
        return instanceIds.stream()
                .filter(candidateIds::contains)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LoadBalancer)) {
            return false;
        }
        LoadBalancer other = (LoadBalancer) obj;
        return Objects.equals(name, other.name) && instanceIds.equals(other.instanceIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, instanceIds);
    }

    @Override
    public String toString() {
        return name + instanceIds;
    }
}
