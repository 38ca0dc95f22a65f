package uk.gegc.mathdrill.features.expression.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import uk.gegc.mathdrill.features.expression.domain.model.Difficulty;
import uk.gegc.mathdrill.features.expression.domain.model.NumberRange;
import uk.gegc.mathdrill.features.expression.domain.model.OperatorType;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Schema(name = "ExpressionGenerationRequest", description = "Configuration for generating arithmetic expressions")
public record ExpressionGenerationRequest(
        @Schema(description = "Difficulty tier controlling the number of operands", example = "MEDIUM")
        @NotNull(message = "Difficulty must not be null")
        Difficulty difficulty,

        @Schema(description = "Smallest operand allowed (inclusive)", example = "1")
        @NotNull(message = "Minimum value must not be null")
        Integer min,

        @Schema(description = "Largest operand allowed (inclusive)", example = "100")
        @NotNull(message = "Maximum value must not be null")
        Integer max,

        @Schema(description = "Operators the expression may use", example = "[\"+\", \"-\"]")
        @NotEmpty(message = "At least one operator must be specified")
        Set<OperatorType> operators
) {
    public ExpressionGenerationRequest {
        operators = (operators == null || operators.isEmpty())
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(operators));
    }

    public static ExpressionGenerationRequest of(Difficulty difficulty, int min, int max, OperatorType... operators) {
        return new ExpressionGenerationRequest(difficulty, min, max, Set.of(operators));
    }

    @JsonIgnore
    @AssertTrue(message = "Minimum value must not exceed maximum value")
    public boolean isRangeOrdered() {
        return min == null || max == null || min <= max;
    }

    public NumberRange range() {
        return new NumberRange(min, max);
    }

    /**
     * Allowed operators in declaration order, so random picks are reproducible for a given seed.
     */
    public List<OperatorType> orderedOperators() {
        return operators.isEmpty() ? List.of() : List.copyOf(EnumSet.copyOf(operators));
    }
}
