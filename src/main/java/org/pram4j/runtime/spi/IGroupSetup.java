package org.pram4j.runtime.spi;

import org.pram4j.runtime.model.GroupSplitSpec;
import org.pram4j.runtime.model.IGroupReader;
import org.pram4j.runtime.model.IPopulationContext;

import java.util.List;

/**
 * Simulation-wide initializer, applied once to every group before the rules are set up.
 */
@FunctionalInterface
public interface IGroupSetup {

    List<GroupSplitSpec> apply(IPopulationContext population, IGroupReader group);
}
