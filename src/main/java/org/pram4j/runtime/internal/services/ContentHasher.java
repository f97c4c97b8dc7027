package org.pram4j.runtime.internal.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.pram4j.runtime.model.Entity;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Computes deterministic content hashes for groups, sites, resources and queries.
 * <p>
 * Content is first reduced to a canonical form: map entries are ordered by key, sets are ordered,
 * integral numbers are widened to {@code long}, enum constants are tagged with their declaring type,
 * and every {@link Entity} is replaced by its own hash. The canonical form is rendered as JSON and digested with SHA-256; the first 64 bits of
 * the digest form the hash. The result depends only on content, never on insertion order or object
 * identity, and is stable across runs.
 */
public final class ContentHasher {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private static final Comparator<Object> CANONICAL_ORDER =
            Comparator.comparing(ContentHasher::renderForOrdering);

    private ContentHasher() {
        throw new AssertionError("Utility class - cannot be instantiated");
    }

    /**
     * Hashes the given content parts as one ordered tuple.
     *
     * @param parts The parts to hash (maps, collections, entities, primitives, strings, enums).
     * @return The 64-bit content hash.
     * @throws IllegalArgumentException if a value cannot be rendered canonically.
     */
    public static long hash(Object... parts) {
        List<Object> canonical = new ArrayList<>(parts.length);
        for (Object part : parts) {
            canonical.add(canonicalize(part));
        }

        byte[] json;
        try {
            json = MAPPER.writeValueAsBytes(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Content cannot be rendered for hashing: " + e.getOriginalMessage(), e);
        }

        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return ByteBuffer.wrap(digest.digest(json)).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 digest not available", e);
        }
    }

    /**
     * Returns a copy of a relation map in which every entity value is replaced by its content hash.
     * Entry order is preserved.
     *
     * @param relations The relation map.
     * @return The normalized, unmodifiable relation map.
     */
    public static Map<String, Object> resolveEntityReferences(Map<String, ?> relations) {
        if (relations.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> resolved = new LinkedHashMap<>(relations.size() * 2);
        for (Map.Entry<String, ?> e : relations.entrySet()) {
            resolved.put(e.getKey(), resolveEntityReference(e.getValue()));
        }
        return Collections.unmodifiableMap(resolved);
    }

    /**
     * Replaces an entity by its content hash and returns any other value unchanged.
     *
     * @param value The relation value.
     * @return The hash of the entity, or the value itself.
     */
    public static Object resolveEntityReference(Object value) {
        return (value instanceof Entity entity) ? entity.getHash() : value;
    }

    /**
     * Checks whether two attribute or relation values are the same content, i.e. whether they would
     * contribute identically to a content hash. Integral numbers compare by value regardless of their
     * boxed type, and an entity equals its own hash.
     *
     * @param a The first value.
     * @param b The second value.
     * @return {@code true} if both values have the same canonical form.
     */
    public static boolean sameValue(Object a, Object b) {
        return Objects.equals(canonicalize(a), canonicalize(b));
    }

    static Object canonicalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Entity entity) {
            return entity.getHash();
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            // Same decimal rendering as the float, so the JSON form is unchanged.
            return Double.valueOf(f.toString());
        }
        if (value instanceof Enum<?> e) {
            return e.getDeclaringClass().getName() + "." + e.name();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                sorted.put(String.valueOf(e.getKey()), canonicalize(e.getValue()));
            }
            return sorted;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(canonicalize(item));
            }
            if (collection instanceof Set<?>) {
                items.sort(CANONICAL_ORDER);
            }
            return items;
        }
        return value;
    }

    private static String renderForOrdering(Object canonical) {
        try {
            return MAPPER.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Content cannot be rendered for hashing: " + e.getOriginalMessage(), e);
        }
    }
}
