package com.jarcadia.rollout.lock;

import java.util.Objects;

/**
 * Proof of a held lock, returned by {@link LockService#acquire} and handed back on release.
 */
public final class LockToken {

    private final String name;
    private final String holder;

    public LockToken(String name, String holder) {
        this.name = name;
        this.holder = holder;
    }

    public String getName() {
        return name;
    }

    public String getHolder() {
        return holder;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LockToken)) {
            return false;
        }
        LockToken other = (LockToken) obj;
        return name.equals(other.name) && holder.equals(other.holder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, holder);
    }

    @Override
    public String toString() {
        return name + "@" + holder;
    }
}
