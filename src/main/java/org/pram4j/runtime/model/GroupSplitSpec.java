package org.pram4j.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Describes one outcome of splitting a group: the probability of the outcome and how the attributes
 * and relations of the resulting group differ from the source.
 * <p>
 * Deletions are applied after the set-maps and match by key only.
 *
 * @param p The probability of the outcome, in [0, 1].
 * @param attrSet Attributes to set (overwriting existing values).
 * @param attrDel Attribute names to remove.
 * @param relSet Relations to set; values may be entities.
 * @param relDel Relation names to remove.
 */
public record GroupSplitSpec(double p,
                             Map<String, Object> attrSet,
                             Set<String> attrDel,
                             Map<String, Object> relSet,
                             Set<String> relDel) {

    public GroupSplitSpec {
        if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException("The probability " + p + " is outside of the [0..1] range.");
        }
        attrSet = copyOf(attrSet);
        attrDel = copyOf(attrDel);
        relSet = copyOf(relSet);
        relDel = copyOf(relDel);
    }

    /**
     * Creates an outcome that leaves the group unchanged.
     * @param p The probability.
     */
    public GroupSplitSpec(double p) {
        this(p, null, null, null, null);
    }

    public static Builder builder(double p) {
        return new Builder(p);
    }

    // Values may be null (an attribute explicitly set to null), so Map.copyOf is not usable here.
    private static Map<String, Object> copyOf(Map<String, Object> map) {
        return (map == null || map.isEmpty()) ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    private static Set<String> copyOf(Set<String> set) {
        return (set == null || set.isEmpty()) ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(set));
    }

    public static final class Builder {
        private final double p;
        private final Map<String, Object> attrSet = new LinkedHashMap<>();
        private final Set<String> attrDel = new LinkedHashSet<>();
        private final Map<String, Object> relSet = new LinkedHashMap<>();
        private final Set<String> relDel = new LinkedHashSet<>();

        private Builder(double p) {
            this.p = p;
        }

        public Builder setAttr(String name, Object value) {
            attrSet.put(name, value);
            return this;
        }

        public Builder setAttrs(Map<String, ?> attrs) {
            attrSet.putAll(attrs);
            return this;
        }

        public Builder delAttr(String... names) {
            Collections.addAll(attrDel, names);
            return this;
        }

        public Builder setRel(String name, Object value) {
            relSet.put(name, value);
            return this;
        }

        public Builder setRels(Map<String, ?> rels) {
            relSet.putAll(rels);
            return this;
        }

        public Builder delRel(String... names) {
            Collections.addAll(relDel, names);
            return this;
        }

        public GroupSplitSpec build() {
            return new GroupSplitSpec(p, attrSet, attrDel, relSet, relDel);
        }
    }
}
