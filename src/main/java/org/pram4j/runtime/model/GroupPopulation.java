package org.pram4j.runtime.model;

import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.objects.ObjectIterator;
import org.pram4j.runtime.Config;
import org.pram4j.runtime.SimulationSettings;
import org.pram4j.runtime.spi.IAttributeUsageObserver;
import org.pram4j.runtime.spi.IGroupSetup;
import org.pram4j.runtime.spi.IRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * The registry of all groups, sites and resources of a simulation, and the engine that moves mass
 * between groups.
 * <p>
 * Each iteration runs through the same steps: {@link #applyRules} splits every group claimed by a
 * rule and transfers the mass, then {@link #postIteration} removes VOID groups and folds in the VITA
 * groups queued by rules. Groups are keyed by content hash, so at most one group exists per content.
 * Total mass only changes through {@link #addGroup}, VOID removal and VITA injection.
 * <p>
 * This class is not thread-safe.
 */
public class GroupPopulation implements IPopulationContext {

    private static final Logger LOG = LoggerFactory.getLogger(GroupPopulation.class);

    private final Long2ObjectLinkedOpenHashMap<Group> groups = new Long2ObjectLinkedOpenHashMap<>();
    private final Long2ObjectLinkedOpenHashMap<Site> sites = new Long2ObjectLinkedOpenHashMap<>();
    private final Long2ObjectLinkedOpenHashMap<Resource> resources = new Long2ObjectLinkedOpenHashMap<>();
    private final Long2ObjectLinkedOpenHashMap<Group> vitaGroups = new Long2ObjectLinkedOpenHashMap<>();

    private final boolean fractionalMass;
    private final int historyLength;
    private final boolean keepMassFlowSpecs;

    private double mass = 0.0;
    private double massIn = 0.0;
    private double massOut = 0.0;

    private double lastIterationMassFlow = 0.0;
    private List<MassFlowSpec> lastMassFlowSpecs = Collections.emptyList();

    private final Deque<GroupPopulationHistory> history = new ArrayDeque<>();
    private final Map<GroupQuery, List<Group>> groupsCache = new HashMap<>();

    private IAttributeUsageObserver usageObserver;
    private int nextGroupId = 0;

    /**
     * Creates a population with integer masses and no history.
     */
    public GroupPopulation() {
        this(false, 0, false);
    }

    public GroupPopulation(SimulationSettings settings) {
        this(settings.isFractionalMass(), settings.getHistoryLength(), settings.isKeepMassFlowSpecs());
    }

    /**
     * @param fractionalMass Whether group masses may be fractional after a split.
     * @param historyLength How many iterations of history to retain; 0 disables history.
     * @param keepMassFlowSpecs Whether to retain the mass flow specs of the last transfer.
     */
    public GroupPopulation(boolean fractionalMass, int historyLength, boolean keepMassFlowSpecs) {
        if (historyLength < 0) {
            throw new IllegalArgumentException("History length must be >= 0, was " + historyLength);
        }
        this.fractionalMass = fractionalMass;
        this.historyLength = historyLength;
        this.keepMassFlowSpecs = keepMassFlowSpecs;
    }

    // ---------------------------------------------------------------------------------------------
    // Registration

    /**
     * Adds a group. If a group with the same content already exists its mass grows by the mass of
     * the given group, which is then discarded. Otherwise the group is registered and frozen, and
     * every site or resource it relates to is registered as well.
     *
     * @param group The group.
     * @return This population, for chaining.
     */
    public GroupPopulation addGroup(Group group) {
        mass += group.getMass();
        registerOrMerge(group);
        return this;
    }

    public GroupPopulation addGroups(Collection<Group> groups) {
        for (Group g : groups) {
            addGroup(g);
        }
        return this;
    }

    public GroupPopulation addSite(Site site) {
        sites.putIfAbsent(site.getHash(), site);
        return this;
    }

    public GroupPopulation addSites(Collection<? extends Site> sites) {
        for (Site s : sites) {
            addSite(s);
        }
        return this;
    }

    public GroupPopulation addResource(Resource resource) {
        if (resource instanceof Site site) {
            return addSite(site);
        }
        resources.putIfAbsent(resource.getHash(), resource);
        return this;
    }

    public GroupPopulation addResources(Collection<? extends Resource> resources) {
        for (Resource r : resources) {
            addResource(r);
        }
        return this;
    }

    /**
     * Registers a relation value if it is an entity and returns what a group should store for it.
     * @param value The relation value.
     * @return The hash of the registered entity, or the value itself.
     */
    Object registerEntity(Object value) {
        if (value instanceof Resource resource) {
            addResource(resource);
            return resource.getHash();
        }
        if (value instanceof Entity entity) {
            return entity.getHash();
        }
        return value;
    }

    @Override
    public void addVitaGroup(Group group) {
        Group existing = vitaGroups.get(group.getHash());
        if (existing != null) {
            existing.addMass(group.getMass());
        } else {
            vitaGroups.put(group.getHash(), group);
        }
    }

    private void registerOrMerge(Group group) {
        long h = group.getHash();
        Group existing = groups.get(h);
        if (existing != null) {
            existing.addMass(group.getMass());
            Site site = existing.getSiteAt();
            if (site != null) {
                site.groupMassChanged(group.getMass());
            }
            return;
        }
        group.attachTo(this);
        groups.put(h, group);
        group.linkToSiteAt();
        groupsCache.clear();
    }

    // ---------------------------------------------------------------------------------------------
    // Iteration

    public GroupPopulation applyRules(List<? extends IRule> rules, long iteration, double time) {
        return applyRules(rules, iteration, time, RuleApplicationMode.ITERATION);
    }

    /**
     * Applies the rules to every registered group and transfers the resulting mass. Nothing happens
     * if no rule claims any group.
     *
     * @param rules The rules, in a fixed order.
     * @param iteration The iteration.
     * @param time The simulation time.
     * @param mode The application mode.
     * @return This population, for chaining.
     */
    public GroupPopulation applyRules(List<? extends IRule> rules, long iteration, double time, RuleApplicationMode mode) {
        List<MassFlowSpec> flows = new ArrayList<>();
        for (Group g : new ArrayList<>(groups.values())) {
            List<Group> destinations = g.applyRules(this, rules, iteration, time, mode, fractionalMass);
            if (destinations != null) {
                flows.add(new MassFlowSpec(mass, g, destinations));
            }
        }
        if (flows.isEmpty()) {
            lastIterationMassFlow = 0.0;
            lastMassFlowSpecs = Collections.emptyList();
            return this;
        }
        return transferMass(flows);
    }

    /**
     * Applies the simulation-wide initializer to every registered group and transfers the mass.
     * @param setup The initializer.
     * @return This population, for chaining.
     */
    public GroupPopulation applySetup(IGroupSetup setup) {
        List<MassFlowSpec> flows = new ArrayList<>();
        for (Group g : new ArrayList<>(groups.values())) {
            List<Group> destinations = g.applySetup(this, setup, fractionalMass);
            if (destinations != null) {
                flows.add(new MassFlowSpec(mass, g, destinations));
            }
        }
        return flows.isEmpty() ? this : transferMass(flows);
    }

    /**
     * Moves mass from source groups to destination groups.
     * <p>
     * All destinations are computed before this method is called. Every source is emptied first so
     * that a destination equal to its own source is not counted twice; then each destination is merged
     * into the group with the same content or registered as a new group. Site back-references and
     * query caches are rebuilt afterwards.
     *
     * @param flows The mass flows.
     * @return This population, for chaining.
     */
    public GroupPopulation transferMass(List<MassFlowSpec> flows) {
        for (MassFlowSpec flow : flows) {
            flow.source().setMass(0.0);
        }

        double flowTotal = 0.0;
        for (MassFlowSpec flow : flows) {
            for (Group dst : flow.destinations()) {
                flowTotal += dst.getMass();
                registerOrMerge(dst.copy());
            }
        }

        lastIterationMassFlow = flowTotal;
        lastMassFlowSpecs = keepMassFlowSpecs ? List.copyOf(flows) : Collections.emptyList();
        LOG.debug("Transferred mass {} across {} source groups; {} groups registered", flowTotal, flows.size(), groups.size());

        relinkSites();
        archive();
        return this;
    }

    /**
     * Removes VOID groups and folds queued VITA groups into the population. Must run after every
     * mass transfer and before the next one.
     *
     * @return This population, for chaining.
     */
    public GroupPopulation postIteration() {
        double removed = 0.0;
        int removedCount = 0;
        ObjectIterator<Long2ObjectMap.Entry<Group>> it = groups.long2ObjectEntrySet().fastIterator();
        while (it.hasNext()) {
            Group g = it.next().getValue();
            if (g.isVoid()) {
                removed += g.getMass();
                removedCount++;
                g.detach();
                it.remove();
            }
        }
        mass -= removed;
        massOut += removed;

        double added = 0.0;
        for (Group vita : vitaGroups.values()) {
            added += vita.getMass();
            registerOrMerge(vita);
        }
        mass += added;
        massIn += added;
        int vitaCount = vitaGroups.size();
        vitaGroups.clear();

        if (removedCount > 0 || vitaCount > 0) {
            LOG.debug("Post-iteration: removed {} VOID groups (mass {}), folded {} VITA groups (mass {})",
                    removedCount, removed, vitaCount, added);
            relinkSites();
        }
        return this;
    }

    /**
     * Removes groups without mass. Mass-weighted results are unaffected.
     * @return This population, for chaining.
     */
    public GroupPopulation compact() {
        int before = groups.size();
        Iterator<Group> it = groups.values().iterator();
        while (it.hasNext()) {
            Group g = it.next();
            if (g.getMass() <= 0) {
                g.detach();
                it.remove();
            }
        }
        if (groups.size() != before) {
            LOG.debug("Compacted population: {} -> {} groups", before, groups.size());
            relinkSites();
        }
        return this;
    }

    /**
     * Rebuilds the back-references of every site from the current {@link Site#AT} relations and drops
     * all cached query results.
     */
    void relinkSites() {
        for (Site s : sites.values()) {
            s.resetGroupLinks();
        }
        for (Group g : groups.values()) {
            g.linkToSiteAt();
        }
        groupsCache.clear();
    }

    private void archive() {
        if (historyLength == 0) {
            return;
        }
        history.addLast(new GroupPopulationHistory(this));
        while (history.size() > historyLength) {
            history.removeFirst();
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Queries

    @Override
    public List<Group> getGroups(GroupQuery query) {
        if (query == null) {
            return Collections.unmodifiableList(new ArrayList<>(groups.values()));
        }
        List<Group> cached = groupsCache.get(query);
        if (cached != null) {
            return cached;
        }
        List<Group> found = new ArrayList<>();
        for (Group g : groups.values()) {
            if (query.matches(g)) {
                found.add(g);
            }
        }
        List<Group> result = Collections.unmodifiableList(found);
        groupsCache.put(query, result);
        return result;
    }

    @Override
    public double getGroupsMass(GroupQuery query) {
        double m = 0.0;
        for (Group g : getGroups(query)) {
            m += g.getMass();
        }
        return m;
    }

    @Override
    public double getGroupsMass(GroupQuery query, int histDelta) {
        if (histDelta < 0 || histDelta > historyLength) {
            throw new IllegalArgumentException(String.format(
                    "History delta %d is outside of the retained history (0..%d)", histDelta, historyLength));
        }
        double current = getGroupsMass(query);
        if (histDelta == 0) {
            return current;
        }
        if (histDelta > history.size()) {
            return 0.0;
        }
        GroupPopulationHistory past = pastEntry(histDelta);
        double pastMass = 0.0;
        for (Group g : getGroups(query)) {
            pastMass += past.getGroupMass(g.getHash());
        }
        return current - pastMass;
    }

    private GroupPopulationHistory pastEntry(int histDelta) {
        Iterator<GroupPopulationHistory> it = history.descendingIterator();
        GroupPopulationHistory entry = null;
        for (int i = 0; i < histDelta; i++) {
            entry = it.next();
        }
        return entry;
    }

    @Override
    public double getGroupsMassProp(GroupQuery query) {
        return mass == 0 ? 0.0 : getGroupsMass(query) / mass;
    }

    @Override
    public MassAndProportion getGroupsMassAndProp(GroupQuery query) {
        double m = getGroupsMass(query);
        return new MassAndProportion(m, mass == 0 ? 0.0 : m / mass);
    }

    @Override
    public Group getGroup(Map<String, ?> attrs, Map<String, ?> rels) {
        return groups.get(Group.hashOf(attrs, rels));
    }

    public Group getGroupByHash(long hash) {
        return groups.get(hash);
    }

    @Override
    public int getGroupCount(boolean onlyNonEmpty) {
        if (!onlyNonEmpty) {
            return groups.size();
        }
        int n = 0;
        for (Group g : groups.values()) {
            if (g.getMass() > 0) {
                n++;
            }
        }
        return n;
    }

    public int getGroupCount() {
        return getGroupCount(false);
    }

    @Override
    public int getSiteCount() {
        return sites.size();
    }

    @Override
    public Collection<Site> getSites() {
        return Collections.unmodifiableCollection(sites.values());
    }

    @Override
    public Collection<Resource> getResources() {
        return Collections.unmodifiableCollection(resources.values());
    }

    @Override
    public Entity getEntityByHash(long hash) {
        Site site = sites.get(hash);
        return site != null ? site : resources.get(hash);
    }

    /**
     * @return A fresh group name of the form {@code g.<n>}.
     */
    public String getNextGroupName() {
        return Config.GROUP_NAME_PREFIX + nextGroupId++;
    }

    @Override
    public double getMass() {
        return mass;
    }

    @Override
    public double getMassIn() {
        return massIn;
    }

    @Override
    public double getMassOut() {
        return massOut;
    }

    @Override
    public double getLastIterationMassFlow() {
        return lastIterationMassFlow;
    }

    /**
     * @return The mass flows of the last transfer; empty unless retention is enabled.
     */
    public List<MassFlowSpec> getLastMassFlowSpecs() {
        return lastMassFlowSpecs;
    }

    /**
     * @return The archived snapshots, oldest first.
     */
    public List<GroupPopulationHistory> getHistory() {
        return List.copyOf(history);
    }

    public int getVitaGroupCount() {
        return vitaGroups.size();
    }

    public boolean isFractionalMass() {
        return fractionalMass;
    }

    IAttributeUsageObserver getUsageObserver() {
        return usageObserver;
    }

    /**
     * Attaches an observer that records every attribute and relation name read through group
     * queries. Pass {@code null} to detach.
     * @param observer The observer, or {@code null}.
     */
    public void setUsageObserver(IAttributeUsageObserver observer) {
        this.usageObserver = observer;
    }
}
