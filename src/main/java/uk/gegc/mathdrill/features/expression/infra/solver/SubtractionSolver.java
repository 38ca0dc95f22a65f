package uk.gegc.mathdrill.features.expression.infra.solver;

import org.springframework.stereotype.Component;
import uk.gegc.mathdrill.features.expression.application.OperandPair;
import uk.gegc.mathdrill.features.expression.application.WeightedCandidates;
import uk.gegc.mathdrill.features.expression.domain.model.NumberRange;
import uk.gegc.mathdrill.features.expression.domain.model.OperatorType;

@Component
public class SubtractionSolver extends OperandSolver {

    @Override
    public OperatorType supportedOperator() {
        return OperatorType.SUBTRACTION;
    }

    @Override
    public WeightedCandidates resultCandidates(NumberRange range) {
        long min = range.min();
        long max = range.max();
        return WeightedCandidates.uniform(Math.max(min - max, min), Math.min(max - min, max));
    }

    /**
     * The pivot is the minuend; the subtrahend is {@code left - target}.
     */
    @Override
    public WeightedCandidates splitCandidates(NumberRange range, int target) {
        long leftMin = Math.max(range.min(), (long) target + range.min());
        long leftMax = Math.min(range.max(), (long) target + range.max());
        return WeightedCandidates.uniform(leftMin, leftMax);
    }

    @Override
    public OperandPair pairFor(int pivot, int target) {
        return new OperandPair(pivot, pivot - target);
    }
}
