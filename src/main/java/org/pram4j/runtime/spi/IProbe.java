package org.pram4j.runtime.spi;

import org.pram4j.runtime.model.IPopulationReader;

/**
 * Observes the population once per iteration, after mass has been transferred.
 * Probes must not modify the population.
 */
public interface IProbe {

    /**
     * @param population Read-only view of the population.
     * @param iteration The iteration; 0 for the initial state.
     * @param time The simulation time.
     */
    void run(IPopulationReader population, long iteration, double time);
}
