package org.pram4j.runtime;

import org.pram4j.runtime.analysis.AttributeUsageTracker;
import org.pram4j.runtime.model.Group;
import org.pram4j.runtime.model.GroupPopulation;
import org.pram4j.runtime.model.RuleApplicationMode;
import org.pram4j.runtime.model.Site;
import org.pram4j.runtime.spi.IGroupSetup;
import org.pram4j.runtime.spi.IProbe;
import org.pram4j.runtime.spi.IRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Drives a group population through discrete iterations.
 * <p>
 * A simulation is assembled by adding rules first and groups second; rules define the timing basis of
 * the simulation, so groups cannot be added before them and rules cannot be added once groups exist.
 * Every iteration applies the rules to all groups, runs the probes, and then lets the population
 * remove VOID groups and fold in VITA groups.
 */
public class Simulation {
    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private final SimulationSettings settings;
    private final GroupPopulation population;
    private final List<IRule> rules = new ArrayList<>();
    private final List<IProbe> probes = new ArrayList<>();
    private IGroupSetup groupSetup;

    private final AttributeUsageTracker attributeUsage = new AttributeUsageTracker();

    private long currentIteration = 0L;
    private int runCount = 0;
    private boolean setupDone = false;
    private boolean autostopped = false;

    /**
     * Constructs a simulation with the settings from {@code reference.conf}.
     */
    public Simulation() {
        this(SimulationSettings.defaults());
    }

    /**
     * Constructs a new Simulation instance.
     * @param settings The simulation settings.
     */
    public Simulation(SimulationSettings settings) {
        this.settings = settings;
        this.population = new GroupPopulation(settings);
    }

    /**
     * Adds a rule.
     * @param rule The rule.
     * @return This simulation, for chaining.
     * @throws SimulationConstructionException if groups have already been added.
     */
    public Simulation addRule(IRule rule) {
        if (population.getGroupCount() > 0) {
            throw new SimulationConstructionException(
                    "A rule cannot be added after groups have been added (rule: " + rule.getName() + ")");
        }
        rules.add(rule);
        return this;
    }

    /**
     * Adds a group to the population.
     * @param group The group.
     * @return This simulation, for chaining.
     * @throws SimulationConstructionException if no rule has been added yet.
     */
    public Simulation addGroup(Group group) {
        if (rules.isEmpty()) {
            throw new SimulationConstructionException("A group cannot be added before any rule has been added");
        }
        population.addGroup(group);
        return this;
    }

    public Simulation addGroups(List<Group> groups) {
        for (Group g : groups) {
            addGroup(g);
        }
        return this;
    }

    public Simulation addSite(Site site) {
        population.addSite(site);
        return this;
    }

    public Simulation addProbe(IProbe probe) {
        probes.add(probe);
        return this;
    }

    /**
     * Sets the initializer applied once to every group before the rules are set up.
     * @param groupSetup The initializer.
     * @return This simulation, for chaining.
     */
    public Simulation setGroupSetup(IGroupSetup groupSetup) {
        this.groupSetup = groupSetup;
        return this;
    }

    /**
     * Runs the simulation for the given number of iterations. Repeated calls continue where the
     * previous call stopped.
     *
     * @param iterations The number of iterations.
     * @return This simulation, for chaining.
     */
    public Simulation run(int iterations) {
        if (rules.isEmpty() || population.getGroupCount() == 0) {
            LOG.warn("Nothing to simulate: {} rules, {} groups", rules.size(), population.getGroupCount());
            return this;
        }

        if (settings.isAnalyze()) {
            population.setUsageObserver(attributeUsage);
        }
        try {
            if (!setupDone) {
                setup();
                setupDone = true;
            }
            if (settings.isAutocompact()) {
                population.compact();
            }
            if (settings.isProbeCaptureInit() && runCount == 0) {
                runProbes(0L, 0.0);
            }

            LOG.info("Running simulation: mass={}, groups={}, sites={}",
                    population.getMass(), population.getGroupCount(), population.getSiteCount());
            runCount++;
            autostopped = false;

            int autostopStreak = 0;
            for (int i = 0; i < iterations; i++) {
                currentIteration++;
                double time = currentIteration * settings.getTimeStep();

                population.applyRules(rules, currentIteration, time);
                double massFlow = population.getLastIterationMassFlow();
                double populationMass = population.getMass();

                runProbes(currentIteration, time);
                population.postIteration();
                LOG.debug("Iteration {}: mass flow {}, groups {}", currentIteration, massFlow, population.getGroupCount());

                if (settings.isAutostopEnabled() && populationMass > 0) {
                    double proportion = massFlow / populationMass;
                    if (massFlow < settings.getAutostopMassThreshold() || proportion < settings.getAutostopProportionThreshold()) {
                        autostopStreak++;
                    } else {
                        autostopStreak = 0;
                    }
                    if (autostopStreak >= settings.getAutostopIterations()) {
                        LOG.info("Autostop at iteration {}: mass transferred {} of {} ({}%)",
                                currentIteration, massFlow, populationMass, proportion * 100);
                        autostopped = true;
                        break;
                    }
                }

                if (settings.isAutocompact()) {
                    population.compact();
                }
            }

            LOG.info("Simulation finished at iteration {}: mass={}, groups={}",
                    currentIteration, population.getMass(), population.getGroupCount());

            if (settings.isAnalyze()) {
                reportAttributeUsage();
            }
        } finally {
            population.setUsageObserver(null);
        }

        LOG.info("Running rule cleanup");
        applyEachRule(RuleApplicationMode.CLEANUP, currentIteration, currentIteration * settings.getTimeStep());
        if (settings.isAutocompact()) {
            population.compact();
        }
        return this;
    }

    private void setup() {
        if (groupSetup != null) {
            LOG.info("Running group setup");
            population.applySetup(groupSetup);
            population.postIteration();
        }
        LOG.info("Running rule setup");
        applyEachRule(RuleApplicationMode.SETUP, 0L, 0.0);
    }

    /**
     * Runs the setup or cleanup hook of one rule at a time, in rule order. The outcomes of different
     * rules are not combined; each rule sees the population left by the previous one.
     */
    private void applyEachRule(RuleApplicationMode mode, long iteration, double time) {
        for (IRule rule : rules) {
            population.applyRules(List.of(rule), iteration, time, mode);
            population.postIteration();
        }
    }

    private void runProbes(long iteration, double time) {
        for (IProbe probe : probes) {
            probe.run(population, iteration, time);
        }
    }

    private void reportAttributeUsage() {
        List<Group> groups = population.getGroups(null);
        Set<String> unusedAttrs = attributeUsage.getUnusedAttributes(groups);
        Set<String> unusedRels = attributeUsage.getUnusedRelations(groups);
        if (!unusedAttrs.isEmpty()) {
            LOG.info("Attributes never conditioned on by rules: {}", unusedAttrs);
        }
        if (!unusedRels.isEmpty()) {
            LOG.info("Relations never conditioned on by rules: {}", unusedRels);
        }
    }

    public GroupPopulation getPopulation() {
        return population;
    }

    public SimulationSettings getSettings() {
        return settings;
    }

    public List<IRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * @return The number of iterations run so far.
     */
    public long getCurrentIteration() {
        return currentIteration;
    }

    public boolean isAutostopped() {
        return autostopped;
    }

    /**
     * @return The attribute usage recorded during analysed runs.
     */
    public AttributeUsageTracker getAttributeUsage() {
        return attributeUsage;
    }
}
