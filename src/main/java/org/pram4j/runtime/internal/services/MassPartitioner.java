package org.pram4j.runtime.internal.services;

import org.apache.commons.math3.util.Precision;
import org.pram4j.runtime.Config;
import org.pram4j.runtime.model.GroupSplitSpec;

import java.util.Arrays;
import java.util.List;

/**
 * Partitions the mass of a group among the outcomes of a split.
 * <p>
 * The outcome that brings the running probability to one, or the last outcome if none does, receives
 * the complement of the mass handed out so far. The partition therefore always sums to the source
 * mass exactly, independent of floating-point drift in the individual products. Outcomes after that
 * point are unreachable and receive no mass.
 */
public final class MassPartitioner {

    private MassPartitioner() {
        throw new AssertionError("Utility class - cannot be instantiated");
    }

    /**
     * Computes the mass of every outcome.
     *
     * @param mass The source mass.
     * @param specs The outcomes, in order.
     * @return One mass per outcome, aligned with {@code specs}.
     */
    public static double[] partition(double mass, List<GroupSplitSpec> specs) {
        double[] masses = new double[specs.size()];
        double pSum = 0.0;
        double mSum = 0.0;

        for (int i = 0; i < specs.size(); i++) {
            boolean isLast = (i == specs.size() - 1);
            double p = specs.get(i).p();
            boolean reachesOne = Precision.compareTo(pSum + p, 1.0, Config.PROBABILITY_EPSILON) >= 0;

            if (isLast || reachesOne) {
                masses[i] = Math.max(0.0, mass - mSum);
                break;
            }
            masses[i] = mass * p;
            pSum += p;
            mSum += masses[i];
        }
        return masses;
    }

    /**
     * Rounds values to integers with the largest-remainder method: every value is rounded down, then
     * the units still missing to reach the rounded total go to the values with the largest fractional
     * parts. Ties go to the value that comes first.
     *
     * @param values The non-negative values to round.
     * @return The rounded values; their sum equals the rounded sum of the input.
     */
    public static double[] roundPreservingTotal(double[] values) {
        int n = values.length;
        double[] rounded = new double[n];
        double total = 0.0;
        double floorSum = 0.0;
        Integer[] order = new Integer[n];

        for (int i = 0; i < n; i++) {
            rounded[i] = Math.floor(values[i]);
            total += values[i];
            floorSum += rounded[i];
            order[i] = i;
        }

        long missing = Math.round(total) - Math.round(floorSum);
        if (missing <= 0) {
            return rounded;
        }

        // Arrays.sort on objects is stable, so equal remainders keep input order.
        Arrays.sort(order, (a, b) -> Double.compare(values[b] - rounded[b], values[a] - rounded[a]));
        for (int k = 0; k < missing && k < n; k++) {
            rounded[order[k]] += 1.0;
        }
        return rounded;
    }
}
