package org.pram4j.runtime.analysis;

import org.pram4j.runtime.model.IGroupReader;
import org.pram4j.runtime.spi.IAttributeUsageObserver;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Records which attribute and relation names were conditioned on during a run, and reports the
 * ones present in groups that nothing ever looked at. Unused attributes usually mean the groups
 * carry more detail than the rules need, which inflates the number of groups.
 */
public class AttributeUsageTracker implements IAttributeUsageObserver {

    private final Set<String> usedAttributes = new TreeSet<>();
    private final Set<String> usedRelations = new TreeSet<>();

    @Override
    public void attributeUsed(String name) {
        usedAttributes.add(name);
    }

    @Override
    public void relationUsed(String name) {
        usedRelations.add(name);
    }

    public Set<String> getUsedAttributes() {
        return Collections.unmodifiableSet(usedAttributes);
    }

    public Set<String> getUsedRelations() {
        return Collections.unmodifiableSet(usedRelations);
    }

    /**
     * @param groups The groups to inspect.
     * @return Attribute names present in the groups but never used, sorted.
     */
    public Set<String> getUnusedAttributes(Collection<? extends IGroupReader> groups) {
        Set<String> unused = new TreeSet<>();
        for (IGroupReader g : groups) {
            unused.addAll(g.getAttrs().keySet());
        }
        unused.removeAll(usedAttributes);
        return unused;
    }

    /**
     * @param groups The groups to inspect.
     * @return Relation names present in the groups but never used, sorted.
     */
    public Set<String> getUnusedRelations(Collection<? extends IGroupReader> groups) {
        Set<String> unused = new TreeSet<>();
        for (IGroupReader g : groups) {
            unused.addAll(g.getRels().keySet());
        }
        unused.removeAll(usedRelations);
        return unused;
    }

    public void reset() {
        usedAttributes.clear();
        usedRelations.clear();
    }
}
