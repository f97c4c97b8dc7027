package org.pram4j.runtime.internal.services;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pram4j.runtime.model.MutationState;
import org.pram4j.runtime.model.Site;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ContentHasher}.
 */
@Tag("unit")
class ContentHasherTest {

    @Test
    void testHashIgnoresMapInsertionOrder() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("sex", "f");
        a.put("age", 30);
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("age", 30);
        b.put("sex", "f");

        assertThat(ContentHasher.hash(a, Map.of())).isEqualTo(ContentHasher.hash(b, Map.of()));
    }

    @Test
    void testSameValueAgreesWithHashOnNumbersAndEntities() {
        Site home = new Site("home");

        assertThat(ContentHasher.sameValue(1, 1L)).isTrue();
        assertThat(ContentHasher.sameValue((byte) 1, 1)).isTrue();
        assertThat(ContentHasher.sameValue(0.5f, 0.5)).isTrue();
        assertThat(ContentHasher.sameValue(1, 1.0)).isFalse();
        assertThat(ContentHasher.sameValue(home, home.getHash())).isTrue();
        assertThat(ContentHasher.sameValue(null, null)).isTrue();
        assertThat(ContentHasher.hash(Map.of("n", 1))).isEqualTo(ContentHasher.hash(Map.of("n", 1L)));
        assertThat(ContentHasher.hash(Map.of("n", 1))).isNotEqualTo(ContentHasher.hash(Map.of("n", 1.0)));
    }

    @Test
    void testHashIgnoresSetOrder() {
        Set<String> a = new LinkedHashSet<>(List.of("x", "y", "z"));
        Set<String> b = new LinkedHashSet<>(List.of("z", "x", "y"));
        assertThat(ContentHasher.hash(a)).isEqualTo(ContentHasher.hash(b));
    }

    @Test
    void testListOrderMatters() {
        assertThat(ContentHasher.hash(List.of(1, 2))).isNotEqualTo(ContentHasher.hash(List.of(2, 1)));
    }

    @Test
    void testEntityIsReplacedByItsHash() {
        Site school = new Site("school");
        assertThat(ContentHasher.hash(Map.of("@", school)))
                .isEqualTo(ContentHasher.hash(Map.of("@", school.getHash())));
    }

    @Test
    void testEqualEntitiesHashEqualRegardlessOfIdentity() {
        assertThat(ContentHasher.hash(Map.of("@", new Site("school"))))
                .isEqualTo(ContentHasher.hash(Map.of("@", new Site("school"))));
    }

    @Test
    void testEnumIsTaggedWithItsType() {
        assertThat(ContentHasher.hash(MutationState.STANDALONE)).isNotEqualTo(ContentHasher.hash("STANDALONE"));
        assertThat(ContentHasher.canonicalize(MutationState.REGISTERED))
                .isEqualTo("org.pram4j.runtime.model.MutationState.REGISTERED");
    }

    @Test
    void testDifferentContentHashesDifferently() {
        assertThat(ContentHasher.hash(Map.of("flu", "s"), Map.of()))
                .isNotEqualTo(ContentHasher.hash(Map.of("flu", "i"), Map.of()));
        assertThat(ContentHasher.hash(Map.of("flu", "s"), Map.of()))
                .isNotEqualTo(ContentHasher.hash(Map.of(), Map.of("flu", "s")));
    }

    @Test
    void testHashIsStableAcrossCalls() {
        Map<String, Object> attrs = Map.of("income", "l", "age", 42, "tags", Set.of("a", "b"));
        assertThat(ContentHasher.hash(attrs)).isEqualTo(ContentHasher.hash(Map.copyOf(attrs)));
    }

    @Test
    void testUnserializableValueIsRejected() {
        Map<String, Object> attrs = Map.of("thing", new Object());
        assertThatThrownBy(() -> ContentHasher.hash(attrs))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot be rendered");
    }

    @Test
    void testResolveEntityReferencesKeepsOrderAndPlainValues() {
        Site home = new Site("home");
        Map<String, Object> rels = new LinkedHashMap<>();
        rels.put("home", home);
        rels.put("city", "Pittsburgh");

        Map<String, Object> resolved = ContentHasher.resolveEntityReferences(rels);

        assertThat(resolved).containsExactly(Map.entry("home", home.getHash()), Map.entry("city", "Pittsburgh"));
    }
}
