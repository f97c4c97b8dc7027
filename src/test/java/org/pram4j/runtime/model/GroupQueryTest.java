package org.pram4j.runtime.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link GroupQuery} matching and identity.
 */
@Tag("unit")
class GroupQueryTest {

    private final Group group = new Group("g", 10, Map.of("x", 1, "y", 2), Map.of("home", "h1"));

    @Test
    void testPartialQueryMatchesSubset() {
        assertThat(GroupQuery.ofAttrs(Map.of("x", 1)).matches(group)).isTrue();
        assertThat(GroupQuery.ofAttrs(Map.of("x", 2)).matches(group)).isFalse();
        assertThat(GroupQuery.ofAttrs(Map.of("z", 1)).matches(group)).isFalse();
        assertThat(GroupQuery.ofRels(Map.of("home", "h1")).matches(group)).isTrue();
    }

    @Test
    void testIntegralValuesMatchAcrossBoxedTypesLikeTheHash() {
        Group withLong = new Group("g", 1, Map.of("age", 30L), Map.of("room", 7L));

        assertThat(GroupQuery.of(Map.of("age", 30), Map.of("room", (short) 7)).matches(withLong)).isTrue();
        assertThat(GroupQuery.ofAttrs(Map.of("age", 30.0)).matches(withLong)).isFalse();
        assertThat(withLong.getHash()).isEqualTo(Group.hashOf(Map.of("age", 30), Map.of("room", 7)));
    }

    @Test
    void testFullQueryRequiresExactContent() {
        Group bigger = new Group("g", 1, Map.of("x", 1, "y", 2, "z", 3), Map.of());
        Group exact = new Group("g", 1, Map.of("x", 1, "y", 2), Map.of());
        GroupQuery full = GroupQuery.exactly(Map.of("x", 1, "y", 2), Map.of());

        assertThat(full.matches(bigger)).isFalse();
        assertThat(full.matches(exact)).isTrue();
        assertThat(full.matches(group)).isFalse();
    }

    @Test
    void testConditionsMustAllHold() {
        GroupQuery heavy = GroupQuery.builder().attr("x", 1).condition(g -> g.getMass() > 5).build();
        GroupQuery light = GroupQuery.builder().attr("x", 1).condition(g -> g.getMass() < 5).build();

        assertThat(heavy.matches(group)).isTrue();
        assertThat(light.matches(group)).isFalse();
    }

    @Test
    void testAbsentQueryMatchesEverything() {
        assertThat(GroupQuery.matches(null, group)).isTrue();
        assertThat(GroupQuery.ofAttrs(Map.of()).matches(group)).isTrue();
        assertThat(GroupQuery.ofAttrs(Map.of()).matches(null)).isFalse();
    }

    @Test
    void testEntityRelationsAreComparedByContent() {
        Site school = new Site("school");
        Group pupil = new Group("g", 1, Map.of(), Map.of(Site.AT, school));

        GroupQuery q1 = GroupQuery.ofRels(Map.of(Site.AT, new Site("school")));
        GroupQuery q2 = GroupQuery.ofRels(Map.of(Site.AT, school.getHash()));

        assertThat(q1.matches(pupil)).isTrue();
        assertThat(q1).isEqualTo(q2);
        assertThat(q1.hashCode()).isEqualTo(q2.hashCode());
    }

    @Test
    void testEqualityComparesConditionsByReference() {
        Predicate<IGroupReader> cond = g -> true;
        GroupQuery a = GroupQuery.builder().attr("x", 1).condition(cond).build();
        GroupQuery b = GroupQuery.builder().attr("x", 1).condition(cond).build();
        GroupQuery c = GroupQuery.builder().attr("x", 1).condition(g -> true).build();

        assertThat(a).isEqualTo(b);
        assertThat(a).isNotEqualTo(c);
        assertThat(a.getContentHash()).isEqualTo(c.getContentHash());
    }

    @Test
    void testContentHashIsDeterministicAndDistinguishesFullMatch() {
        GroupQuery partial = GroupQuery.of(Map.of("x", 1), Map.of());
        GroupQuery full = GroupQuery.exactly(Map.of("x", 1), Map.of());

        assertThat(partial.getContentHash()).isEqualTo(GroupQuery.ofAttrs(Map.of("x", 1)).getContentHash());
        assertThat(partial.getContentHash()).isNotEqualTo(full.getContentHash());
        assertThat(partial).isNotEqualTo(full);
    }
}
