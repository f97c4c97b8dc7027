package org.pram4j.runtime.model;

/**
 * The stage of a simulation in which rules are applied to a group.
 */
public enum RuleApplicationMode {
    /** Regular iteration; only applicable rules are consulted and their outcomes are combined. */
    ITERATION,
    /** One-shot rule setup before the first iteration; applicability is not checked. */
    SETUP,
    /** One-shot rule cleanup after the last iteration; applicability is not checked. */
    CLEANUP
}
