package uk.gegc.mathdrill.features.expression.infra.solver;

import org.springframework.stereotype.Component;
import uk.gegc.mathdrill.features.expression.application.OperandPair;
import uk.gegc.mathdrill.features.expression.application.WeightedCandidates;
import uk.gegc.mathdrill.features.expression.domain.model.NumberRange;
import uk.gegc.mathdrill.features.expression.domain.model.OperatorType;

@Component
public class AdditionSolver extends OperandSolver {

    @Override
    public OperatorType supportedOperator() {
        return OperatorType.ADDITION;
    }

    @Override
    public WeightedCandidates resultCandidates(NumberRange range) {
        long min = range.min();
        long max = range.max();
        return WeightedCandidates.uniform(Math.max(2 * min, min), Math.min(2 * max, max));
    }

    /**
     * The pivot is the left operand; the right one is whatever remains of the target.
     */
    @Override
    public WeightedCandidates splitCandidates(NumberRange range, int target) {
        long leftMin = Math.max((long) target - range.max(), range.min());
        long leftMax = Math.min((long) target - range.min(), range.max());
        return WeightedCandidates.uniform(leftMin, leftMax);
    }

    @Override
    public OperandPair pairFor(int pivot, int target) {
        return new OperandPair(pivot, target - pivot);
    }
}
