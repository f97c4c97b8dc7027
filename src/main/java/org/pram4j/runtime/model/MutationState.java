package org.pram4j.runtime.model;

/**
 * Whether a group may still be mutated freely.
 */
public enum MutationState {
    /** Not part of any population; attributes and relations may be changed. */
    STANDALONE,
    /** Owned by a population; changes require an explicit force flag. */
    REGISTERED
}
