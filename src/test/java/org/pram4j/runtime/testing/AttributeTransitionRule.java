package org.pram4j.runtime.testing;

import org.pram4j.runtime.model.GroupSplitSpec;
import org.pram4j.runtime.model.IGroupReader;
import org.pram4j.runtime.model.IPopulationContext;
import org.pram4j.runtime.spi.IRule;

import java.util.List;
import java.util.Map;

/**
 * Moves a proportion of every group with {@code attr = from} to {@code attr = to}.
 */
public class AttributeTransitionRule implements IRule {

    private final String attr;
    private final Object from;
    private final Object to;
    private final double p;

    public AttributeTransitionRule(String attr, Object from, Object to, double p) {
        this.attr = attr;
        this.from = from;
        this.to = to;
        this.p = p;
    }

    @Override
    public String getName() {
        return attr + ":" + from + "->" + to;
    }

    @Override
    public boolean isApplicable(IGroupReader group, long iteration, double time) {
        return group.hasAttr(Map.of(attr, from));
    }

    @Override
    public List<GroupSplitSpec> apply(IPopulationContext population, IGroupReader group, long iteration, double time) {
        return List.of(
                GroupSplitSpec.builder(p).setAttr(attr, to).build(),
                new GroupSplitSpec(1 - p));
    }
}
