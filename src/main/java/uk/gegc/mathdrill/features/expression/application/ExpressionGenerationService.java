package uk.gegc.mathdrill.features.expression.application;

import uk.gegc.mathdrill.features.expression.api.dto.ExpressionGenerationRequest;
import uk.gegc.mathdrill.features.expression.api.dto.GeneratedExpression;

import java.util.List;
import java.util.Random;

public interface ExpressionGenerationService {

    /**
     * Generates one expression for the requested difficulty, range and operators.
     *
     * @throws uk.gegc.mathdrill.shared.exception.ExpressionGenerationException when no expression
     *         fits the configuration; the caller may retry or relax it
     * @throws IllegalArgumentException when the request itself is invalid
     */
    GeneratedExpression generate(ExpressionGenerationRequest request);

    GeneratedExpression generate(ExpressionGenerationRequest request, Random random);

    /**
     * Generates {@code count} independent expressions for one exercise. Fails as a whole if any
     * single generation fails.
     */
    List<GeneratedExpression> generateBatch(ExpressionGenerationRequest request, int count);

    List<GeneratedExpression> generateBatch(ExpressionGenerationRequest request, int count, Random random);
}
