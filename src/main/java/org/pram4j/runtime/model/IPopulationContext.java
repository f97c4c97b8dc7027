package org.pram4j.runtime.model;

/**
 * The view of a population that rules receive. Besides read access it offers a single, deferred
 * way of injecting new mass.
 */
public interface IPopulationContext extends IPopulationReader {

    /**
     * Queues a VITA group. Its mass enters the population at the next post-iteration step, merged
     * into the registered group with the same content.
     * @param group The new mass.
     */
    void addVitaGroup(Group group);
}
