package org.pram4j.runtime.model;

/**
 * Base type of everything that can be registered in a {@link GroupPopulation}.
 * <p>
 * Entities are identified by a deterministic content hash rather than by object identity, so two
 * independently constructed entities with equal content are interchangeable. A relation value that
 * is an entity is always reduced to this hash before a group is hashed or stored.
 */
public abstract class Entity {

    /**
     * Returns the content hash of this entity. The value is stable across runs.
     * @return The content hash.
     */
    public abstract long getHash();
}
