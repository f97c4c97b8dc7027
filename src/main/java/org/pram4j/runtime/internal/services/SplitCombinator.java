package org.pram4j.runtime.internal.services;

import org.pram4j.runtime.model.GroupSplitSpec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines the outcomes of several independent rules into one joint distribution.
 * <p>
 * Every element of the Cartesian product of the per-rule outcome lists becomes one combined outcome:
 * the probabilities are multiplied, the set-maps are merged in rule order (later rules win on a key
 * conflict) and the delete sets are united. Because every tuple of the product is enumerated, the
 * resulting distribution over destination content does not depend on the order of the rules beyond
 * that key-conflict rule.
 */
public final class SplitCombinator {

    private SplitCombinator() {
        throw new AssertionError("Utility class - cannot be instantiated");
    }

    /**
     * Computes the combined outcomes.
     *
     * @param perRule The outcome lists, one per rule, in rule order. Empty lists are skipped.
     * @return The combined outcomes in odometer order (the last rule varies fastest).
     */
    public static List<GroupSplitSpec> combine(List<List<GroupSplitSpec>> perRule) {
        List<List<GroupSplitSpec>> lists = new ArrayList<>(perRule.size());
        for (List<GroupSplitSpec> l : perRule) {
            if (l != null && !l.isEmpty()) {
                lists.add(l);
            }
        }
        if (lists.isEmpty()) {
            return Collections.emptyList();
        }
        if (lists.size() == 1) {
            return List.copyOf(lists.get(0));
        }

        int[] idx = new int[lists.size()];
        List<GroupSplitSpec> combined = new ArrayList<>();
        while (true) {
            combined.add(merge(lists, idx));

            int pos = idx.length - 1;
            while (pos >= 0 && ++idx[pos] == lists.get(pos).size()) {
                idx[pos] = 0;
                pos--;
            }
            if (pos < 0) {
                return combined;
            }
        }
    }

    private static GroupSplitSpec merge(List<List<GroupSplitSpec>> lists, int[] idx) {
        double[] factors = new double[idx.length];
        Map<String, Object> attrSet = new LinkedHashMap<>();
        Set<String> attrDel = new LinkedHashSet<>();
        Map<String, Object> relSet = new LinkedHashMap<>();
        Set<String> relDel = new LinkedHashSet<>();

        for (int r = 0; r < idx.length; r++) {
            GroupSplitSpec s = lists.get(r).get(idx[r]);
            factors[r] = s.p();
            attrSet.putAll(s.attrSet());
            attrDel.addAll(s.attrDel());
            relSet.putAll(s.relSet());
            relDel.addAll(s.relDel());
        }
        // Multiplied in sorted order so that the product does not depend on the rule order.
        Arrays.sort(factors);
        double p = 1.0;
        for (double f : factors) {
            p *= f;
        }
        return new GroupSplitSpec(Math.min(1.0, p), attrSet, attrDel, relSet, relDel);
    }
}
