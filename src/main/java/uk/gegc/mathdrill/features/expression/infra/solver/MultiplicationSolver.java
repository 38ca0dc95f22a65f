package uk.gegc.mathdrill.features.expression.infra.solver;

import org.springframework.stereotype.Component;
import uk.gegc.mathdrill.features.expression.application.CompositeIndex;
import uk.gegc.mathdrill.features.expression.application.OperandPair;
import uk.gegc.mathdrill.features.expression.application.WeightedCandidates;
import uk.gegc.mathdrill.features.expression.domain.model.NumberRange;
import uk.gegc.mathdrill.features.expression.domain.model.OperatorType;

import java.util.Optional;
import java.util.Random;

/**
 * Products are seeded from the composite numbers of the range so the root always has a
 * non-trivial factorisation. Targets reached later are split by factor search.
 */
@Component
public class MultiplicationSolver extends OperandSolver {

    private final CompositeIndex compositeIndex;

    public MultiplicationSolver(CompositeIndex compositeIndex) {
        this.compositeIndex = compositeIndex;
    }

    @Override
    public OperatorType supportedOperator() {
        return OperatorType.MULTIPLICATION;
    }

    @Override
    public WeightedCandidates resultCandidates(NumberRange range) {
        return compositeIndex.candidates(range);
    }

    /**
     * Draws straight from the composite index, uniform over the same values as
     * {@link #resultCandidates(NumberRange)} without building the buckets.
     */
    @Override
    public Optional<Integer> seedResult(NumberRange range, Random random) {
        if (compositeIndex.count(range) == 0) {
            return Optional.empty();
        }
        return Optional.of(compositeIndex.draw(range, random));
    }

    /**
     * The pivot is the left factor. A zero target pairs any left operand with a zero on the right;
     * otherwise the left factor excludes {@code -1, 0, 1} and its cofactor must stay in range.
     */
    @Override
    public WeightedCandidates splitCandidates(NumberRange range, int target) {
        if (target == 0) {
            return WeightedCandidates.uniform(range.min(), range.max());
        }
        long magnitude = Math.abs((long) target);
        long from = Math.max(-magnitude + 1, range.min());
        long to = Math.min(magnitude - 1, range.max());

        WeightedCandidates.Builder builder = WeightedCandidates.builder();
        for (long i = from; i <= to; i++) {
            if (i >= -1 && i <= 1) {
                continue;
            }
            if (target % i == 0 && range.contains(target / i)) {
                builder.add(i, 1);
            }
        }
        return builder.build();
    }

    @Override
    public OperandPair pairFor(int pivot, int target) {
        if (target == 0) {
            return new OperandPair(pivot, 0);
        }
        return new OperandPair(pivot, target / pivot);
    }
}
