package uk.gegc.mathdrill.features.expression.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.mathdrill.features.expression.domain.model.OperatorType;

import java.util.List;

@Schema(name = "GeneratedExpression", description = "A generated arithmetic expression with its answer")
public record GeneratedExpression(
        @Schema(description = "Rendered expression with the parentheses it needs", example = "(3 + 5) * 2")
        String expression,

        @Schema(description = "Exact value of the expression", example = "16")
        double result,

        @Schema(description = "Operators applied, in the order their nodes were expanded", example = "[\"*\", \"+\"]")
        List<OperatorType> operatorsUsed,

        @Schema(description = "Serialized expression tree")
        JsonNode tree
) {
    public GeneratedExpression {
        operatorsUsed = operatorsUsed == null ? List.of() : List.copyOf(operatorsUsed);
    }
}
