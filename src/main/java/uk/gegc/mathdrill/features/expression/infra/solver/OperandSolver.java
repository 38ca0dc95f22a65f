package uk.gegc.mathdrill.features.expression.infra.solver;

import uk.gegc.mathdrill.features.expression.application.OperandPair;
import uk.gegc.mathdrill.features.expression.application.WeightedCandidates;
import uk.gegc.mathdrill.features.expression.domain.model.NumberRange;
import uk.gegc.mathdrill.features.expression.domain.model.OperatorType;

import java.util.Optional;
import java.util.Random;

/**
 * Range arithmetic for one operator.
 *
 * <p>Each solver answers two questions: which results the operator can produce from two operands
 * inside the range, and which operand pairs produce a given target. Both are computed as
 * candidate sets first, so a caller can inspect them before drawing. An empty candidate set means
 * the combination is infeasible; retrying is the caller's job.</p>
 */
public abstract class OperandSolver {

    /**
     * Operator whose seed and split rules this solver implements; used as its registry key.
     */
    public abstract OperatorType supportedOperator();

    /**
     * Results reachable from two operands in {@code range}, weighted for drawing.
     */
    public abstract WeightedCandidates resultCandidates(NumberRange range);

    /**
     * Pivot values that can be completed into an operand pair for {@code target}.
     * See {@link #pairFor(int, int)} for what the pivot means.
     */
    public abstract WeightedCandidates splitCandidates(NumberRange range, int target);

    /**
     * Completes a pivot drawn from {@link #splitCandidates} into the operand pair.
     */
    public abstract OperandPair pairFor(int pivot, int target);

    public Optional<Integer> seedResult(NumberRange range, Random random) {
        WeightedCandidates candidates = resultCandidates(range);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(candidates.draw(random));
    }

    public Optional<OperandPair> split(NumberRange range, int target, Random random) {
        WeightedCandidates candidates = splitCandidates(range, target);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        OperandPair pair = pairFor(candidates.draw(random), target);
        if (!accepts(pair, range)) {
            return Optional.empty();
        }
        return Optional.of(pair);
    }

    protected boolean accepts(OperandPair pair, NumberRange range) {
        return range.contains(pair.left()) && range.contains(pair.right());
    }
}
