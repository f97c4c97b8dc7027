package org.pram4j.runtime.spi;

import org.pram4j.runtime.model.GroupSplitSpec;
import org.pram4j.runtime.model.IGroupReader;
import org.pram4j.runtime.model.IPopulationContext;

import java.util.List;

/**
 * A rule of the simulated system.
 * <p>
 * Rules never mutate groups. They describe how a group should split by returning a list of
 * {@link GroupSplitSpec}s; the population combines the outcomes of all applicable rules and moves
 * the mass. A rule that returns {@code null} or an empty list makes no claim on the group in that
 * iteration. Implementations must be pure functions of their arguments so that the order in which
 * groups are visited does not matter.
 */
public interface IRule {

    /**
     * @return A human-readable name used in logs.
     */
    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Checks whether the rule should be consulted for the group at the given iteration.
     *
     * @param group The group.
     * @param iteration The iteration (1-based).
     * @param time The simulation time.
     * @return {@code true} if {@link #apply} should be called.
     */
    boolean isApplicable(IGroupReader group, long iteration, double time);

    /**
     * Computes the outcomes of the rule for one group.
     *
     * @param population The population, for aggregate queries and VITA injection.
     * @param group The group.
     * @param iteration The iteration (1-based).
     * @param time The simulation time.
     * @return The outcomes, or {@code null} if the rule makes no claim.
     */
    List<GroupSplitSpec> apply(IPopulationContext population, IGroupReader group, long iteration, double time);

    /**
     * One-shot hook run for every group before the first iteration.
     * @param population The population.
     * @param group The group.
     * @return The outcomes, or {@code null} to leave the group alone.
     */
    default List<GroupSplitSpec> setup(IPopulationContext population, IGroupReader group) {
        return null;
    }

    /**
     * One-shot hook run for every group after the last iteration.
     * @param population The population.
     * @param group The group.
     * @return The outcomes, or {@code null} to leave the group alone.
     */
    default List<GroupSplitSpec> cleanup(IPopulationContext population, IGroupReader group) {
        return null;
    }
}
