package org.pram4j.runtime.model;

import it.unimi.dsi.fastutil.longs.Long2DoubleMap;
import it.unimi.dsi.fastutil.longs.Long2DoubleMaps;
import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;

/**
 * Snapshot of population totals and per-group masses at the end of one mass transfer.
 */
public final class GroupPopulationHistory {

    private final double mass;
    private final double massIn;
    private final double massOut;
    private final Long2DoubleMap groupMasses;

    GroupPopulationHistory(GroupPopulation population) {
        this.mass = population.getMass();
        this.massIn = population.getMassIn();
        this.massOut = population.getMassOut();
        Long2DoubleOpenHashMap masses = new Long2DoubleOpenHashMap();
        for (Group g : population.getGroups(null)) {
            masses.put(g.getHash(), g.getMass());
        }
        this.groupMasses = Long2DoubleMaps.unmodifiable(masses);
    }

    public double getMass() {
        return mass;
    }

    public double getMassIn() {
        return massIn;
    }

    public double getMassOut() {
        return massOut;
    }

    /**
     * @param groupHash The content hash of a group.
     * @return The archived mass of the group, or 0 if it did not exist.
     */
    public double getGroupMass(long groupHash) {
        return groupMasses.get(groupHash);
    }

    public Long2DoubleMap getGroupMasses() {
        return groupMasses;
    }
}
