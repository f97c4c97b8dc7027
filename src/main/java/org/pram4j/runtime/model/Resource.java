package org.pram4j.runtime.model;

import org.pram4j.runtime.internal.services.ContentHasher;

import java.util.Objects;

/**
 * A resource shared by the agents of many groups (e.g., a public bus).
 * <p>
 * The capacity terminology follows concurrent computing: a resource <em>accommodates</em> agents and
 * is <em>released</em> once agents are done with it. Two resources are the same resource if their
 * names are equal.
 * <p>
 * This implementation is meant for use within a single simulation and is not thread-safe.
 */
public class Resource extends Entity {

    private final String name;
    private final int capacityMax;
    private int capacity;

    private long hash;
    private boolean hashComputed = false;

    /**
     * Creates a resource that accommodates a single agent.
     * @param name The name of the resource.
     */
    public Resource(String name) {
        this(name, 1);
    }

    /**
     * Creates an empty resource.
     * @param name The name of the resource.
     * @param capacityMax The maximum number of agents that can use the resource concurrently.
     */
    public Resource(String name, int capacityMax) {
        this(name, capacityMax, 0);
    }

    /**
     * Creates a resource with some capacity already in use.
     * @param name The name of the resource.
     * @param capacityMax The maximum number of agents that can use the resource concurrently.
     * @param capacity The number of agents currently accommodated.
     */
    public Resource(String name, int capacityMax, int capacity) {
        this.name = Objects.requireNonNull(name, "name");
        if (capacityMax < 0) {
            throw new IllegalArgumentException("capacityMax must be >= 0, was " + capacityMax);
        }
        if (capacity < 0 || capacity > capacityMax) {
            throw new IllegalArgumentException("capacity must be in [0, " + capacityMax + "], was " + capacity);
        }
        this.capacityMax = capacityMax;
        this.capacity = capacity;
    }

    /**
     * Allocates the resource to {@code n} agents.
     *
     * @param n The number of agents.
     * @param all Whether to admit all-or-nothing ({@code true}) or as many as fit ({@code false}).
     * @return The number of agents that were not accommodated.
     */
    public int allocate(int n, boolean all) {
        if (all) {
            return allocateAll(n) ? 0 : n;
        }
        return allocateAny(n);
    }

    /**
     * Admits as many of {@code n} agents as the remaining capacity allows.
     *
     * @param n The number of agents.
     * @return The number of agents that were not accommodated.
     */
    public int allocateAny(int n) {
        requireNonNegative(n);
        int admitted = Math.min(n, getCapacityLeft());
        capacity += admitted;
        return n - admitted;
    }

    /**
     * Admits either all {@code n} agents or none of them.
     *
     * @param n The number of agents.
     * @return {@code true} if all agents were admitted, {@code false} if none were.
     */
    public boolean allocateAll(int n) {
        requireNonNegative(n);
        if (!canAccommodateAll(n)) {
            return false;
        }
        capacity += n;
        return true;
    }

    public boolean canAccommodateAll(int n) {
        return n <= capacityMax - capacity;
    }

    /**
     * Checks whether at least one of {@code n} agents could be admitted.
     * @param n The number of agents.
     * @return {@code true} if some capacity is left and {@code n > 0}.
     */
    public boolean canAccommodateAny(int n) {
        return n > 0 && capacity < capacityMax;
    }

    public boolean canAccommodateOne() {
        return capacity < capacityMax;
    }

    /**
     * Releases {@code n} agent spots. Releasing always succeeds; capacity never drops below zero.
     * @param n The number of agents.
     */
    public void release(int n) {
        requireNonNegative(n);
        capacity = Math.max(0, capacity - n);
    }

    public int getCapacity() {
        return capacity;
    }

    public int getCapacityLeft() {
        return capacityMax - capacity;
    }

    public int getCapacityMax() {
        return capacityMax;
    }

    public String getName() {
        return name;
    }

    @Override
    public long getHash() {
        if (!hashComputed) {
            hash = computeHash();
            hashComputed = true;
        }
        return hash;
    }

    /**
     * Computes the content hash of this entity. Called at most once per instance.
     * @return The content hash.
     */
    protected long computeHash() {
        return ContentHasher.hash("resource", name);
    }

    private static void requireNonNegative(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Number of agents must be >= 0, was " + n);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((Resource) o).name);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(getHash());
    }

    @Override
    public String toString() {
        return String.format("Resource(name=%s, cap=%d/%d)", name, capacity, capacityMax);
    }
}
