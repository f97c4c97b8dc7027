package org.pram4j.runtime.model;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of a group population, handed to probes and (through
 * {@link IPopulationContext}) to rules.
 */
public interface IPopulationReader {

    /**
     * Returns the registered groups matching the query.
     * @param query The query, or {@code null} for all groups.
     * @return The matching groups.
     */
    List<Group> getGroups(GroupQuery query);

    double getGroupsMass(GroupQuery query);

    /**
     * Returns the change in mass of the matching groups relative to {@code histDelta} archived
     * iterations ago.
     *
     * @param query The query, or {@code null} for all groups.
     * @param histDelta How many archived iterations to look back; 0 returns the current mass.
     * @return The mass change (current minus past), or 0 while fewer than {@code histDelta}
     *         iterations have been archived.
     * @throws IllegalArgumentException if {@code histDelta} is negative or exceeds the configured
     *         history length.
     */
    double getGroupsMass(GroupQuery query, int histDelta);

    /**
     * @param query The query.
     * @return The mass of the matching groups relative to the population mass.
     */
    double getGroupsMassProp(GroupQuery query);

    MassAndProportion getGroupsMassAndProp(GroupQuery query);

    /**
     * Looks up a registered group by content.
     * @param attrs The attributes.
     * @param rels The relations; entity values are accepted.
     * @return The group, or {@code null}.
     */
    Group getGroup(Map<String, ?> attrs, Map<String, ?> rels);

    int getGroupCount(boolean onlyNonEmpty);

    int getSiteCount();

    Collection<Site> getSites();

    Collection<Resource> getResources();

    /**
     * Resolves a content hash to the registered site or resource.
     * @param hash The content hash.
     * @return The entity, or {@code null}.
     */
    Entity getEntityByHash(long hash);

    double getMass();

    double getMassIn();

    double getMassOut();

    /**
     * @return The total mass that flowed into destination groups during the last mass transfer.
     */
    double getLastIterationMassFlow();
}
