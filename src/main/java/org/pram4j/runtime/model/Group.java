package org.pram4j.runtime.model;

import org.pram4j.runtime.Config;
import org.pram4j.runtime.internal.services.ContentHasher;
import org.pram4j.runtime.internal.services.MassPartitioner;
import org.pram4j.runtime.internal.services.SplitCombinator;
import org.pram4j.runtime.spi.IAttributeUsageObserver;
import org.pram4j.runtime.spi.IGroupSetup;
import org.pram4j.runtime.spi.IRule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A group of functionally identical agents.
 * <p>
 * A group is the unit that carries mass. Its identity is its content: the attributes and relations.
 * The name is a label only and the mass changes every iteration, so neither participates in
 * {@link #equals(Object)} or {@link #getHash()}. A population holds at most one group per content
 * hash; adding a group with known content merges its mass.
 * <p>
 * Groups start {@link MutationState#STANDALONE} and may be edited freely. Once registered in a
 * population they are frozen: the only sanctioned way to change them is to return split specs from
 * a rule. Direct writes throw {@link GroupFrozenException} unless forced.
 * <p>
 * Relation values that are entities ({@link Site}, {@link Resource}) are stored as their content
 * hashes once the group is registered.
 */
public class Group extends Entity implements IGroupReader {

    /**
     * Attributes of the VOID marker. A group carrying them is removed at the end of the iteration.
     */
    public static final Map<String, Object> VOID = Map.of(Config.VOID_ATTRIBUTE, Boolean.TRUE);

    private final String name;
    private double mass;
    private final Map<String, Object> attrs;
    private final Map<String, Object> rels;

    private MutationState state = MutationState.STANDALONE;
    private GroupPopulation population;

    private long hash;
    private boolean hashComputed = false;

    public Group(String name, double mass) {
        this(name, mass, Collections.emptyMap(), Collections.emptyMap());
    }

    /**
     * @param name The label of the group; may be {@code null}.
     * @param mass The mass (number of agents), non-negative.
     * @param attrs The attributes.
     * @param rels The relations; values may be entities.
     */
    public Group(String name, double mass, Map<String, ?> attrs, Map<String, ?> rels) {
        if (Double.isNaN(mass) || mass < 0) {
            throw new IllegalArgumentException("Group mass must be non-negative, was " + mass);
        }
        this.name = name;
        this.mass = mass;
        this.attrs = new LinkedHashMap<>(Objects.requireNonNull(attrs, "attrs"));
        this.rels = new LinkedHashMap<>(Objects.requireNonNull(rels, "rels"));
    }

    /**
     * Creates a VOID group with no mass. Rules split mass into it to remove agents from the population.
     * @return The VOID group.
     */
    public static Group createVoid() {
        return new Group("void", 0.0, VOID, Collections.emptyMap());
    }

    // ---------------------------------------------------------------------------------------------
    // Identity

    @Override
    public long getHash() {
        if (!hashComputed) {
            hash = ContentHasher.hash(attrs, rels);
            hashComputed = true;
        }
        return hash;
    }

    /**
     * Computes the hash a group with the given content would have.
     * @param attrs The attributes.
     * @param rels The relations; entity values are accepted.
     * @return The content hash.
     */
    public static long hashOf(Map<String, ?> attrs, Map<String, ?> rels) {
        return ContentHasher.hash(attrs, ContentHasher.resolveEntityReferences(rels));
    }

    private void resetHash() {
        hashComputed = false;
    }

    // ---------------------------------------------------------------------------------------------
    // Mutation

    public Group setAttr(String name, Object value) {
        return setAttr(name, value, false);
    }

    /**
     * Sets an attribute.
     *
     * @param name The attribute name.
     * @param value The value.
     * @param force Whether to write even if the group is registered.
     * @return This group, for chaining.
     * @throws GroupFrozenException if the group is registered and {@code force} is {@code false}.
     */
    public Group setAttr(String name, Object value, boolean force) {
        requireMutable(name, force);
        attrs.put(name, value);
        resetHash();
        return this;
    }

    public Group setAttrs(Map<String, ?> values) {
        return setAttrs(values, false);
    }

    public Group setAttrs(Map<String, ?> values, boolean force) {
        for (String key : values.keySet()) {
            requireMutable(key, force);
        }
        attrs.putAll(values);
        resetHash();
        return this;
    }

    public Group setRel(String name, Object value) {
        return setRel(name, value, false);
    }

    /**
     * Sets a relation. On a registered group an entity value is registered with the population and
     * stored by hash; writing the {@link Site#AT} relation moves the group to the new site.
     *
     * @param name The relation name.
     * @param value The value, possibly an entity.
     * @param force Whether to write even if the group is registered.
     * @return This group, for chaining.
     * @throws GroupFrozenException if the group is registered and {@code force} is {@code false}.
     */
    public Group setRel(String name, Object value, boolean force) {
        requireMutable(name, force);
        storeRel(name, value);
        resetHash();
        if (population != null && Site.AT.equals(name)) {
            population.relinkSites();
        }
        return this;
    }

    public Group setRels(Map<String, ?> values) {
        return setRels(values, false);
    }

    public Group setRels(Map<String, ?> values, boolean force) {
        for (String key : values.keySet()) {
            requireMutable(key, force);
        }
        for (Map.Entry<String, ?> e : values.entrySet()) {
            storeRel(e.getKey(), e.getValue());
        }
        resetHash();
        if (population != null && values.containsKey(Site.AT)) {
            population.relinkSites();
        }
        return this;
    }

    private void storeRel(String name, Object value) {
        rels.put(name, population != null ? population.registerEntity(value) : value);
    }

    private void requireMutable(String key, boolean force) {
        if (state == MutationState.REGISTERED && !force) {
            throw new GroupFrozenException(name, key);
        }
    }

    void setMass(double mass) {
        this.mass = mass;
    }

    void addMass(double delta) {
        this.mass += delta;
    }

    /**
     * Registers this group with a population: entity relation values are registered and replaced by
     * their hashes, and the group becomes frozen.
     */
    void attachTo(GroupPopulation population) {
        this.population = population;
        for (Map.Entry<String, Object> e : rels.entrySet()) {
            e.setValue(population.registerEntity(e.getValue()));
        }
        this.state = MutationState.REGISTERED;
    }

    void detach() {
        this.population = null;
    }

    /**
     * Adds this group to the back-references of the site it is at.
     */
    void linkToSiteAt() {
        Site site = getSiteAt();
        if (site != null) {
            site.addGroupLink(this);
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Splitting

    /**
     * Splits this group according to the given outcomes, rounding the destination masses to integers.
     *
     * @param specs The outcomes.
     * @return The destination groups; groups that would receive no mass are omitted.
     */
    public List<Group> split(List<GroupSplitSpec> specs) {
        return split(specs, false);
    }

    /**
     * Splits this group according to the given outcomes.
     * <p>
     * The destination masses always sum to the mass of this group. Destinations keep the name of
     * this group; whether they coincide with existing groups is decided later by content hash. This
     * group is not modified.
     *
     * @param specs The outcomes.
     * @param fractionalMass Whether destination masses may be fractional.
     * @return The destination groups; groups that would receive no mass are omitted.
     */
    public List<Group> split(List<GroupSplitSpec> specs, boolean fractionalMass) {
        double[] masses = MassPartitioner.partition(mass, specs);
        if (!fractionalMass) {
            masses = MassPartitioner.roundPreservingTotal(masses);
        }

        List<Group> destinations = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            if (masses[i] <= 0) {
                continue;
            }
            GroupSplitSpec spec = specs.get(i);

            Map<String, Object> relSet = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : spec.relSet().entrySet()) {
                relSet.put(e.getKey(), population != null
                        ? population.registerEntity(e.getValue())
                        : ContentHasher.resolveEntityReference(e.getValue()));
            }

            destinations.add(new Group(name, masses[i],
                    apply(attrs, spec.attrSet(), spec.attrDel()),
                    apply(rels, relSet, spec.relDel())));
        }
        return destinations;
    }

    private static Map<String, Object> apply(Map<String, Object> base, Map<String, Object> set, Set<String> del) {
        Map<String, Object> result = new LinkedHashMap<>(base);
        result.putAll(set);
        // Deletion matches by key only.
        result.keySet().removeAll(del);
        return result;
    }

    /**
     * Applies rules to this group and splits it accordingly.
     * <p>
     * In {@link RuleApplicationMode#ITERATION} mode only rules applicable at {@code (iteration, time)}
     * are consulted; the setup and cleanup modes call the corresponding hook of every rule. Rules that
     * make no claim are ignored; the outcomes of the others are combined into one joint distribution.
     *
     * @param population The population the rules may query.
     * @param rules The rules, in a fixed order.
     * @param iteration The iteration.
     * @param time The simulation time.
     * @param mode The application mode.
     * @param fractionalMass Whether destination masses may be fractional.
     * @return The destination groups, or {@code null} if no rule claimed this group.
     */
    public List<Group> applyRules(IPopulationContext population, List<? extends IRule> rules, long iteration,
                                  double time, RuleApplicationMode mode, boolean fractionalMass) {
        List<List<GroupSplitSpec>> perRule = new ArrayList<>(rules.size());
        for (IRule rule : rules) {
            List<GroupSplitSpec> specs = switch (mode) {
                case SETUP -> rule.setup(population, this);
                case CLEANUP -> rule.cleanup(population, this);
                case ITERATION -> rule.isApplicable(this, iteration, time)
                        ? rule.apply(population, this, iteration, time)
                        : null;
            };
            if (specs != null && !specs.isEmpty()) {
                perRule.add(specs);
            }
        }
        if (perRule.isEmpty()) {
            return null;
        }
        List<GroupSplitSpec> combined = SplitCombinator.combine(perRule);
        if (perRule.size() > 1) {
            combined = inDestinationOrder(combined);
        }
        return split(combined, fractionalMass);
    }

    /**
     * Orders combined outcomes by the content hash of the group each would produce, then by
     * probability. The order of the combined list otherwise follows the order of the rules, and both
     * the rounding tie-break and the floating-point accumulation in {@link #split} depend on it.
     */
    private List<GroupSplitSpec> inDestinationOrder(List<GroupSplitSpec> specs) {
        Map<GroupSplitSpec, Long> destinationHashes = new IdentityHashMap<>(specs.size() * 2);
        for (GroupSplitSpec spec : specs) {
            destinationHashes.put(spec, ContentHasher.hash(
                    apply(attrs, spec.attrSet(), spec.attrDel()),
                    apply(rels, spec.relSet(), spec.relDel())));
        }
        List<GroupSplitSpec> ordered = new ArrayList<>(specs);
        ordered.sort(Comparator.<GroupSplitSpec>comparingLong(destinationHashes::get)
                .thenComparingDouble(GroupSplitSpec::p));
        return ordered;
    }

    /**
     * Applies the simulation-wide initializer to this group.
     *
     * @param population The population.
     * @param setup The initializer.
     * @param fractionalMass Whether destination masses may be fractional.
     * @return The destination groups, or {@code null} if the initializer left this group alone.
     */
    public List<Group> applySetup(IPopulationContext population, IGroupSetup setup, boolean fractionalMass) {
        List<GroupSplitSpec> specs = setup.apply(population, this);
        if (specs == null || specs.isEmpty()) {
            return null;
        }
        return split(specs, fractionalMass);
    }

    // ---------------------------------------------------------------------------------------------
    // Reading

    @Override
    public String getName() {
        return name;
    }

    @Override
    public double getMass() {
        return mass;
    }

    @Override
    public Map<String, Object> getAttrs() {
        return Collections.unmodifiableMap(attrs);
    }

    @Override
    public Map<String, Object> getRels() {
        return Collections.unmodifiableMap(rels);
    }

    @Override
    public Object getAttr(String name) {
        observer().ifPresent(o -> o.attributeUsed(name));
        return attrs.get(name);
    }

    @Override
    public Object getRel(String name) {
        observer().ifPresent(o -> o.relationUsed(name));
        Object value = rels.get(name);
        if (population != null && value instanceof Long h) {
            Entity entity = population.getEntityByHash(h);
            if (entity != null) {
                return entity;
            }
        }
        return value;
    }

    @Override
    public boolean hasAttr(String name) {
        observer().ifPresent(o -> o.attributeUsed(name));
        return attrs.containsKey(name);
    }

    @Override
    public boolean hasAttr(Collection<String> names) {
        observer().ifPresent(o -> names.forEach(o::attributeUsed));
        return attrs.keySet().containsAll(names);
    }

    @Override
    public boolean hasAttr(Map<String, ?> values) {
        observer().ifPresent(o -> values.keySet().forEach(o::attributeUsed));
        for (Map.Entry<String, ?> e : values.entrySet()) {
            if (!attrs.containsKey(e.getKey()) || !ContentHasher.sameValue(attrs.get(e.getKey()), e.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean hasRel(String name) {
        observer().ifPresent(o -> o.relationUsed(name));
        return rels.containsKey(name);
    }

    @Override
    public boolean hasRel(Collection<String> names) {
        observer().ifPresent(o -> names.forEach(o::relationUsed));
        return rels.keySet().containsAll(names);
    }

    @Override
    public boolean hasRel(Map<String, ?> values) {
        observer().ifPresent(o -> values.keySet().forEach(o::relationUsed));
        for (Map.Entry<String, ?> e : values.entrySet()) {
            if (!rels.containsKey(e.getKey())) {
                return false;
            }
            if (!ContentHasher.sameValue(rels.get(e.getKey()), e.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Site getSiteAt() {
        Object at = rels.get(Site.AT);
        if (at instanceof Site site) {
            return site;
        }
        if (population != null && at instanceof Long h && population.getEntityByHash(h) instanceof Site site) {
            return site;
        }
        return null;
    }

    @Override
    public boolean isAtSite(Site site) {
        Object at = rels.get(Site.AT);
        return at != null && site != null
                && Objects.equals(ContentHasher.resolveEntityReference(at), site.getHash());
    }

    @Override
    public boolean isAtSiteName(String relation) {
        observer().ifPresent(o -> o.relationUsed(relation));
        Object at = rels.get(Site.AT);
        Object other = rels.get(relation);
        return at != null && other != null
                && Objects.equals(ContentHasher.resolveEntityReference(at), ContentHasher.resolveEntityReference(other));
    }

    @Override
    public boolean isVoid() {
        return Boolean.TRUE.equals(attrs.get(Config.VOID_ATTRIBUTE));
    }

    public MutationState getState() {
        return state;
    }

    /**
     * Creates a standalone copy of this group with the same content and mass.
     * @return The copy.
     */
    public Group copy() {
        return new Group(name, mass, attrs, rels);
    }

    private Optional<IAttributeUsageObserver> observer() {
        return population == null ? Optional.empty() : Optional.ofNullable(population.getUsageObserver());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return getHash() == ((Group) o).getHash();
    }

    @Override
    public int hashCode() {
        return Long.hashCode(getHash());
    }

    @Override
    public String toString() {
        return String.format("Group(name=%s, mass=%.2f, attrs=%s, rels=%s)", name, mass, attrs, rels);
    }
}
