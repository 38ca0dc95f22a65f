package uk.gegc.mathdrill.shared.exception;

import lombok.Getter;
import uk.gegc.mathdrill.features.expression.domain.model.NumberRange;
import uk.gegc.mathdrill.features.expression.domain.model.OperatorType;

/**
 * Exception thrown when an expression cannot be generated for the requested configuration.
 * Callers may retry with a wider range or a different operator set.
 */
@Getter
public class ExpressionGenerationException extends RuntimeException {

    private final GenerationError error;
    private final OperatorType operator;
    private final NumberRange range;
    private final Integer target;

    public ExpressionGenerationException(GenerationError error, OperatorType operator, NumberRange range,
                                         Integer target, String message) {
        super(message);
        this.error = error;
        this.operator = operator;
        this.range = range;
        this.target = target;
    }

    public ExpressionGenerationException(GenerationError error, OperatorType operator, NumberRange range,
                                         Integer target, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.operator = operator;
        this.range = range;
        this.target = target;
    }

    public static ExpressionGenerationException infeasibleSeed(OperatorType operator, NumberRange range) {
        return new ExpressionGenerationException(GenerationError.INFEASIBLE_SEED, operator, range, null,
                "No result value fits operator " + operator + " in range " + range);
    }

    public static ExpressionGenerationException infeasibleSplit(OperatorType operator, NumberRange range,
                                                                int target, int attempts) {
        return new ExpressionGenerationException(GenerationError.INFEASIBLE_SPLIT, operator, range, target,
                "Could not split " + target + " into operands in range " + range
                        + " after " + attempts + " attempts (last operator " + operator + ")");
    }
}
