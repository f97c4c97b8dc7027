package org.pram4j.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.pram4j.config.ConfigLoader;

/**
 * Typed, immutable view of the {@code pram.simulation} configuration block.
 */
public final class SimulationSettings {

    private final boolean fractionalMass;
    private final boolean autocompact;
    private final int historyLength;
    private final boolean keepMassFlowSpecs;
    private final boolean probeCaptureInit;
    private final boolean analyze;
    private final double timeStep;

    private final boolean autostopEnabled;
    private final double autostopMassThreshold;
    private final double autostopProportionThreshold;
    private final int autostopIterations;

    /**
     * Reads the settings from a configuration block. Missing keys take their default values.
     *
     * @param options The {@code pram.simulation} block.
     * @throws IllegalArgumentException if a value is out of range.
     */
    public SimulationSettings(Config options) {
        this.fractionalMass = options.hasPath("fractional-mass") && options.getBoolean("fractional-mass");
        this.autocompact = options.hasPath("autocompact") && options.getBoolean("autocompact");
        this.historyLength = options.hasPath("history-length") ? options.getInt("history-length") : 0;
        this.keepMassFlowSpecs = options.hasPath("keep-mass-flow-specs") && options.getBoolean("keep-mass-flow-specs");
        this.probeCaptureInit = !options.hasPath("probe-capture-init") || options.getBoolean("probe-capture-init");
        this.analyze = options.hasPath("analyze") && options.getBoolean("analyze");
        this.timeStep = options.hasPath("time-step") ? options.getDouble("time-step") : 1.0;

        Config autostop = options.hasPath("autostop") ? options.getConfig("autostop") : ConfigFactory.empty();
        this.autostopEnabled = autostop.hasPath("enabled") && autostop.getBoolean("enabled");
        this.autostopMassThreshold = autostop.hasPath("mass-threshold") ? autostop.getDouble("mass-threshold") : 0.0;
        this.autostopProportionThreshold = autostop.hasPath("proportion-threshold") ? autostop.getDouble("proportion-threshold") : 0.0;
        this.autostopIterations = autostop.hasPath("iterations") ? autostop.getInt("iterations") : 10;

        if (historyLength < 0) {
            throw new IllegalArgumentException("history-length must be >= 0, was " + historyLength);
        }
        if (!(timeStep > 0)) {
            throw new IllegalArgumentException("time-step must be > 0, was " + timeStep);
        }
        if (autostopIterations < 1) {
            throw new IllegalArgumentException("autostop.iterations must be >= 1, was " + autostopIterations);
        }
    }

    /**
     * @return The settings defined by {@code reference.conf}.
     */
    public static SimulationSettings defaults() {
        return fromConfig(ConfigFactory.parseResources("reference.conf").resolve());
    }

    /**
     * @param root A root configuration containing a {@code pram.simulation} block.
     * @return The settings; defaults apply if the block is missing.
     */
    public static SimulationSettings fromConfig(Config root) {
        return new SimulationSettings(root.hasPath(org.pram4j.runtime.Config.SETTINGS_PATH)
                ? root.getConfig(org.pram4j.runtime.Config.SETTINGS_PATH)
                : ConfigFactory.empty());
    }

    /**
     * Loads the settings through {@link ConfigLoader}.
     * @param configFile The configuration file.
     * @return The settings.
     */
    public static SimulationSettings load(String configFile) {
        return fromConfig(ConfigLoader.load(configFile));
    }

    public boolean isFractionalMass() {
        return fractionalMass;
    }

    public boolean isAutocompact() {
        return autocompact;
    }

    public int getHistoryLength() {
        return historyLength;
    }

    public boolean isKeepMassFlowSpecs() {
        return keepMassFlowSpecs;
    }

    public boolean isProbeCaptureInit() {
        return probeCaptureInit;
    }

    public boolean isAnalyze() {
        return analyze;
    }

    public double getTimeStep() {
        return timeStep;
    }

    public boolean isAutostopEnabled() {
        return autostopEnabled;
    }

    public double getAutostopMassThreshold() {
        return autostopMassThreshold;
    }

    public double getAutostopProportionThreshold() {
        return autostopProportionThreshold;
    }

    public int getAutostopIterations() {
        return autostopIterations;
    }
}
