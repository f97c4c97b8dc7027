package org.pram4j.runtime.model;

import java.util.List;

/**
 * Records that the mass of one source group flowed into a list of destination groups during a
 * single mass transfer.
 *
 * @param populationMass The mass of the population at the time of the transfer.
 * @param source The source group.
 * @param destinations The destination groups, as produced by the split.
 */
public record MassFlowSpec(double populationMass, Group source, List<Group> destinations) {

    public MassFlowSpec {
        destinations = List.copyOf(destinations);
    }

    public double getDestinationMass() {
        double m = 0.0;
        for (Group g : destinations) {
            m += g.getMass();
        }
        return m;
    }
}
