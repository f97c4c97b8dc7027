package org.pram4j.runtime.testing;

import org.pram4j.runtime.model.GroupSplitSpec;
import org.pram4j.runtime.model.IGroupReader;
import org.pram4j.runtime.model.IPopulationContext;
import org.pram4j.runtime.spi.IRule;

import java.util.List;
import java.util.function.BiFunction;

/**
 * A rule assembled from functions, for tests that need one-off behavior.
 */
public class LambdaRule implements IRule {

    private final String name;
    private final BiFunction<IPopulationContext, IGroupReader, List<GroupSplitSpec>> apply;
    private BiFunction<IPopulationContext, IGroupReader, List<GroupSplitSpec>> setup = (pop, g) -> null;
    private BiFunction<IPopulationContext, IGroupReader, List<GroupSplitSpec>> cleanup = (pop, g) -> null;

    public LambdaRule(String name, BiFunction<IPopulationContext, IGroupReader, List<GroupSplitSpec>> apply) {
        this.name = name;
        this.apply = apply;
    }

    /**
     * A rule that applies to every group and never claims any.
     * @param name The rule name.
     * @return The rule.
     */
    public static LambdaRule idle(String name) {
        return new LambdaRule(name, (pop, g) -> null);
    }

    public LambdaRule withSetup(BiFunction<IPopulationContext, IGroupReader, List<GroupSplitSpec>> setup) {
        this.setup = setup;
        return this;
    }

    public LambdaRule withCleanup(BiFunction<IPopulationContext, IGroupReader, List<GroupSplitSpec>> cleanup) {
        this.cleanup = cleanup;
        return this;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isApplicable(IGroupReader group, long iteration, double time) {
        return true;
    }

    @Override
    public List<GroupSplitSpec> apply(IPopulationContext population, IGroupReader group, long iteration, double time) {
        return apply.apply(population, group);
    }

    @Override
    public List<GroupSplitSpec> setup(IPopulationContext population, IGroupReader group) {
        return setup.apply(population, group);
    }

    @Override
    public List<GroupSplitSpec> cleanup(IPopulationContext population, IGroupReader group) {
        return cleanup.apply(population, group);
    }
}
