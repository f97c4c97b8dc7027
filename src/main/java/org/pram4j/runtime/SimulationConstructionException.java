package org.pram4j.runtime;

/**
 * Thrown when a simulation is assembled in an invalid order, e.g. a group is added before any rule
 * exists or a rule is added after groups have been added.
 */
public class SimulationConstructionException extends IllegalStateException {

    public SimulationConstructionException(String message) {
        super(message);
    }
}
