package org.pram4j.runtime.model;

import org.pram4j.runtime.internal.services.ContentHasher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Selects groups by their attributes, relations and arbitrary conditions.
 * <p>
 * A partial query matches every group that carries at least the queried attributes and relations
 * with equal values. A full query additionally requires the group to carry no other attributes or
 * relations. In both cases every condition must hold.
 * <p>
 * Queries are used as keys of the population and site result caches. Entity relation values are
 * reduced to content hashes so equal queries built from distinct entity instances are equal;
 * conditions are compared by reference, since arbitrary predicates cannot be compared by content.
 */
public final class GroupQuery {

    private final Map<String, Object> attrs;
    private final Map<String, Object> rels;
    private final List<Predicate<IGroupReader>> conditions;
    private final boolean full;

    private GroupQuery(Map<String, ?> attrs, Map<String, ?> rels, List<Predicate<IGroupReader>> conditions, boolean full) {
        this.attrs = Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
        this.rels = ContentHasher.resolveEntityReferences(rels);
        this.conditions = List.copyOf(conditions);
        this.full = full;
    }

    public static GroupQuery ofAttrs(Map<String, ?> attrs) {
        return new GroupQuery(attrs, Collections.emptyMap(), Collections.emptyList(), false);
    }

    public static GroupQuery ofRels(Map<String, ?> rels) {
        return new GroupQuery(Collections.emptyMap(), rels, Collections.emptyList(), false);
    }

    public static GroupQuery of(Map<String, ?> attrs, Map<String, ?> rels) {
        return new GroupQuery(attrs, rels, Collections.emptyList(), false);
    }

    /**
     * Creates a query that only matches groups with exactly the given attributes and relations.
     * @param attrs The attributes.
     * @param rels The relations.
     * @return The query.
     */
    public static GroupQuery exactly(Map<String, ?> attrs, Map<String, ?> rels) {
        return new GroupQuery(attrs, rels, Collections.emptyList(), true);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks whether the given group satisfies this query.
     *
     * @param group The group, or {@code null}.
     * @return {@code true} if the group matches; a {@code null} group never matches.
     */
    public boolean matches(IGroupReader group) {
        if (group == null) {
            return false;
        }
        if (!attrs.isEmpty() && !group.hasAttr(attrs)) {
            return false;
        }
        if (!rels.isEmpty() && !group.hasRel(rels)) {
            return false;
        }
        if (full && (group.getAttrs().size() != attrs.size() || group.getRels().size() != rels.size())) {
            return false;
        }
        for (Predicate<IGroupReader> condition : conditions) {
            if (!condition.test(group)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks a possibly absent query against a group. An absent query matches every group.
     * @param query The query, or {@code null}.
     * @param group The group.
     * @return {@code true} if the query is absent or matches.
     */
    public static boolean matches(GroupQuery query, IGroupReader group) {
        return query == null || query.matches(group);
    }

    /**
     * Returns a deterministic hash of the structural part of this query. Conditions only contribute
     * their count.
     * @return The content hash.
     */
    public long getContentHash() {
        return ContentHasher.hash("query", attrs, rels, full, conditions.size());
    }

    public Map<String, Object> getAttrs() {
        return attrs;
    }

    public Map<String, Object> getRels() {
        return rels;
    }

    public List<Predicate<IGroupReader>> getConditions() {
        return conditions;
    }

    public boolean isFull() {
        return full;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupQuery other)) return false;
        if (full != other.full || !attrs.equals(other.attrs) || !rels.equals(other.rels)) return false;
        if (conditions.size() != other.conditions.size()) return false;
        for (int i = 0; i < conditions.size(); i++) {
            if (conditions.get(i) != other.conditions.get(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(attrs, rels, full);
        for (Predicate<IGroupReader> c : conditions) {
            h = 31 * h + System.identityHashCode(c);
        }
        return h;
    }

    @Override
    public String toString() {
        return String.format("GroupQuery(attrs=%s, rels=%s, conditions=%d, full=%s)", attrs, rels, conditions.size(), full);
    }

    public static final class Builder {
        private final Map<String, Object> attrs = new LinkedHashMap<>();
        private final Map<String, Object> rels = new LinkedHashMap<>();
        private final List<Predicate<IGroupReader>> conditions = new ArrayList<>();
        private boolean full = false;

        private Builder() {}

        public Builder attr(String name, Object value) {
            attrs.put(name, value);
            return this;
        }

        public Builder attrs(Map<String, ?> values) {
            attrs.putAll(values);
            return this;
        }

        public Builder rel(String name, Object value) {
            rels.put(name, value);
            return this;
        }

        public Builder rels(Map<String, ?> values) {
            rels.putAll(values);
            return this;
        }

        public Builder condition(Predicate<IGroupReader> condition) {
            conditions.add(Objects.requireNonNull(condition, "condition"));
            return this;
        }

        public Builder full(boolean full) {
            this.full = full;
            return this;
        }

        public GroupQuery build() {
            return new GroupQuery(attrs, rels, conditions, full);
        }
    }
}
