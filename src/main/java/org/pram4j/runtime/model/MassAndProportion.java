package org.pram4j.runtime.model;

/**
 * The mass of a subset of groups together with its proportion of a reference mass.
 *
 * @param mass The mass.
 * @param proportion The proportion in [0, 1].
 */
public record MassAndProportion(double mass, double proportion) {
}
