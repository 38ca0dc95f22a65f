package uk.gegc.mathdrill.features.expression.infra.solver;

import org.springframework.stereotype.Component;
import uk.gegc.mathdrill.features.expression.application.OperandPair;
import uk.gegc.mathdrill.features.expression.application.WeightedCandidates;
import uk.gegc.mathdrill.features.expression.domain.model.NumberRange;
import uk.gegc.mathdrill.features.expression.domain.model.OperatorType;

/**
 * Integer-exact division: a quotient {@code n} is produced as {@code (n * b) / b}.
 *
 * <p>A divisor {@code b} is valid for {@code n} when {@code |b| >= 2}, {@code b} lies in the
 * range and so does the dividend {@code n * b}. Valid divisors form at most two intervals, one
 * negative and one positive, which keeps both seeding and splitting free of per-divisor loops.</p>
 */
@Component
public class DivisionSolver extends OperandSolver {

    @Override
    public OperatorType supportedOperator() {
        return OperatorType.DIVISION;
    }

    /**
     * Quotients are weighted by how many divisors can produce them, so a quotient with many
     * possible problems is proportionally more likely.
     */
    @Override
    public WeightedCandidates resultCandidates(NumberRange range) {
        WeightedCandidates.Builder builder = WeightedCandidates.builder();
        for (long n = range.min(); n <= range.max(); n++) {
            if (Math.abs(n) < 2) {
                continue;
            }
            long count = 0;
            for (long[] interval : divisorIntervals(range, n)) {
                count += interval[1] - interval[0] + 1;
            }
            builder.add(n, count);
        }
        return builder.build();
    }

    /**
     * The pivot is the divisor. Quotients {@code -1, 0, 1} are never split.
     */
    @Override
    public WeightedCandidates splitCandidates(NumberRange range, int target) {
        if (Math.abs((long) target) < 2) {
            return WeightedCandidates.empty();
        }
        WeightedCandidates.Builder builder = WeightedCandidates.builder();
        for (long[] interval : divisorIntervals(range, target)) {
            builder.addRange(interval[0], interval[1], 1);
        }
        return builder.build();
    }

    @Override
    public OperandPair pairFor(int pivot, int target) {
        return new OperandPair(Math.multiplyExact(target, pivot), pivot);
    }

    @Override
    protected boolean accepts(OperandPair pair, NumberRange range) {
        return Math.abs(pair.right()) >= OperatorType.DIVISION_GUARD_EPSILON && super.accepts(pair, range);
    }

    /**
     * Divisor intervals for quotient {@code n}: the negative branch {@code [lo, -2]} and the
     * positive branch {@code [2, hi]}, each clipped to the range. Empty branches are omitted.
     */
    static long[][] divisorIntervals(NumberRange range, long n) {
        long min = range.min();
        long max = range.max();
        long lo;
        long hi;
        if (n > 0) {
            lo = ceilDiv(min, n);
            hi = Math.floorDiv(max, n);
        } else {
            lo = ceilDiv(max, n);
            hi = Math.floorDiv(min, n);
        }
        lo = Math.max(lo, min);
        hi = Math.min(hi, max);

        long[] negative = {lo, Math.min(hi, -2)};
        long[] positive = {Math.max(lo, 2), hi};
        boolean hasNegative = negative[0] <= negative[1];
        boolean hasPositive = positive[0] <= positive[1];
        if (hasNegative && hasPositive) {
            return new long[][]{negative, positive};
        }
        if (hasNegative) {
            return new long[][]{negative};
        }
        if (hasPositive) {
            return new long[][]{positive};
        }
        return new long[0][];
    }

    private static long ceilDiv(long dividend, long divisor) {
        return -Math.floorDiv(-dividend, divisor);
    }
}
