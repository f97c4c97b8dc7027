package org.pram4j.runtime.model;

import it.unimi.dsi.fastutil.objects.ReferenceLinkedOpenHashSet;
import org.pram4j.runtime.Config;
import org.pram4j.runtime.internal.services.ContentHasher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A physical location that groups of agents can be at (e.g., a school or a store).
 * <p>
 * A group is at a site when its {@link #AT} relation points to
 * that site. The site keeps a back-reference to every such group, so that mass-weighted queries
 * over the groups at the site are cheap. The back-references are rebuilt by the owning population
 * whenever mass moves; the memoised query results are dropped at the same time.
 */
public class Site extends Resource {

    /**
     * The relation name under which groups record the site they are currently at.
     */
    public static final String AT = Config.AT_RELATION;

    private final Map<String, Object> attrs;
    private final String relName;

    private final ReferenceLinkedOpenHashSet<Group> groups = new ReferenceLinkedOpenHashSet<>();
    private double mass = 0.0;

    private final Map<GroupQuery, List<Group>> groupsCache = new HashMap<>();
    private final Map<GroupQuery, Double> massCache = new HashMap<>();

    public Site(String name) {
        this(name, Collections.emptyMap());
    }

    public Site(String name, Map<String, ?> attrs) {
        this(name, attrs, AT, Integer.MAX_VALUE);
    }

    /**
     * @param name The name of the site.
     * @param attrs The attributes describing the site.
     * @param relName The relation name under which groups record being at this site.
     * @param capacityMax The maximum number of agents the site can accommodate.
     */
    public Site(String name, Map<String, ?> attrs, String relName, int capacityMax) {
        super(name, capacityMax);
        this.attrs = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(attrs, "attrs")));
        this.relName = Objects.requireNonNull(relName, "relName");
    }

    @Override
    protected long computeHash() {
        return ContentHasher.hash("site", getName(), relName, attrs);
    }

    /**
     * Records that a group is at this site. Called by the population while relinking.
     * @param group The group.
     */
    void addGroupLink(Group group) {
        if (groups.add(group)) {
            mass += group.getMass();
            clearQueryCaches();
        }
    }

    /**
     * Adjusts the aggregate mass after the mass of a linked group changed in place.
     * @param delta The change in mass.
     */
    void groupMassChanged(double delta) {
        mass += delta;
        clearQueryCaches();
    }

    /**
     * Drops every group back-reference along with the memoised query results.
     */
    void resetGroupLinks() {
        groups.clear();
        mass = 0.0;
        clearQueryCaches();
    }

    private void clearQueryCaches() {
        groupsCache.clear();
        massCache.clear();
    }

    /**
     * Returns the groups at this site that match the query.
     *
     * @param query The query, or {@code null} to match every group.
     * @param nonEmptyOnly Whether to skip groups with zero mass.
     * @return The matching groups, in link order.
     */
    public List<Group> getGroups(GroupQuery query, boolean nonEmptyOnly) {
        List<Group> matching = groupsCache.get(query);
        if (matching == null) {
            List<Group> found = new ArrayList<>();
            for (Group g : groups) {
                if (query == null || query.matches(g)) {
                    found.add(g);
                }
            }
            matching = Collections.unmodifiableList(found);
            groupsCache.put(query, matching);
        }
        if (!nonEmptyOnly) {
            return matching;
        }
        List<Group> nonEmpty = new ArrayList<>(matching.size());
        for (Group g : matching) {
            if (g.getMass() > 0) {
                nonEmpty.add(g);
            }
        }
        return nonEmpty;
    }

    public List<Group> getGroups(GroupQuery query) {
        return getGroups(query, false);
    }

    /**
     * Returns the total mass of the groups at this site that match the query.
     * @param query The query, or {@code null} for the total mass at the site.
     * @return The mass.
     */
    public double getMass(GroupQuery query) {
        if (query == null) {
            return mass;
        }
        Double cached = massCache.get(query);
        if (cached != null) {
            return cached;
        }
        double sum = 0.0;
        for (Group g : getGroups(query, false)) {
            sum += g.getMass();
        }
        massCache.put(query, sum);
        return sum;
    }

    public double getMass() {
        return mass;
    }

    /**
     * Returns the mass of the matching groups as a proportion of the total mass at this site.
     * @param query The query.
     * @return The proportion, or 0 when the site is empty.
     */
    public double getMassProp(GroupQuery query) {
        return mass == 0 ? 0.0 : getMass(query) / mass;
    }

    public MassAndProportion getMassAndProp(GroupQuery query) {
        double m = getMass(query);
        return new MassAndProportion(m, mass == 0 ? 0.0 : m / mass);
    }

    public Object getAttr(String name) {
        return attrs.get(name);
    }

    public Map<String, Object> getAttrs() {
        return attrs;
    }

    public String getRelName() {
        return relName;
    }

    public int getGroupCount() {
        return groups.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return getHash() == ((Site) o).getHash();
    }

    @Override
    public int hashCode() {
        return Long.hashCode(getHash());
    }

    @Override
    public String toString() {
        return String.format("Site(name=%s, groups=%d, mass=%.2f)", getName(), groups.size(), mass);
    }
}
