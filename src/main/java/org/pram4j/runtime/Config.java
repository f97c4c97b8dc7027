package org.pram4j.runtime;

/**
 * Provides centralized constants for the group population engine.
 * This final class is not meant to be instantiated; tunable settings are read from
 * HOCON configuration via {@link SimulationSettings}.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * The relation name under which a group records the site it is currently at.
     */
    public static final String AT_RELATION = "@";

    /**
     * The attribute that flags a group as VOID. VOID groups are removed at the end of every iteration.
     */
    public static final String VOID_ATTRIBUTE = "__void__";

    /**
     * Tolerance used when deciding whether a running probability sum has reached one.
     */
    public static final double PROBABILITY_EPSILON = 1e-12;

    /**
     * The prefix of auto-generated group names.
     */
    public static final String GROUP_NAME_PREFIX = "g.";

    /**
     * The configuration path holding the simulation settings.
     */
    public static final String SETTINGS_PATH = "pram.simulation";
}
