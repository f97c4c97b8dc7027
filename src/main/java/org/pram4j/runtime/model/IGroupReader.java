package org.pram4j.runtime.model;

import java.util.Collection;
import java.util.Map;

/**
 * Read-only view of a group, handed to rules and query predicates.
 */
public interface IGroupReader {

    String getName();

    double getMass();

    long getHash();

    /**
     * Returns the attributes of the group. The map is unmodifiable.
     * @return The attributes.
     */
    Map<String, Object> getAttrs();

    /**
     * Returns the relations of the group. Entity values of registered groups are stored as content
     * hashes. The map is unmodifiable.
     * @return The relations.
     */
    Map<String, Object> getRels();

    Object getAttr(String name);

    /**
     * Returns a relation value. For a registered group a stored hash is resolved back to the
     * registered {@link Site} or {@link Resource}.
     * @param name The relation name.
     * @return The relation value, or {@code null} if absent.
     */
    Object getRel(String name);

    boolean hasAttr(String name);

    boolean hasAttr(Collection<String> names);

    boolean hasAttr(Map<String, ?> attrs);

    boolean hasRel(String name);

    boolean hasRel(Collection<String> names);

    boolean hasRel(Map<String, ?> rels);

    /**
     * Returns the site this group is currently at, if any.
     * @return The site, or {@code null}.
     */
    Site getSiteAt();

    boolean isAtSite(Site site);

    /**
     * Checks whether this group is at the site referenced by the given relation.
     * @param relation The relation name pointing to a site.
     * @return {@code true} if both relations point to the same site.
     */
    boolean isAtSiteName(String relation);

    boolean isVoid();
}
