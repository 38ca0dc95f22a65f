package uk.gegc.mathdrill.features.expression.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.mathdrill.features.expression.api.dto.ExpressionGenerationRequest;
import uk.gegc.mathdrill.features.expression.api.dto.GeneratedExpression;
import uk.gegc.mathdrill.features.expression.application.ExpressionGenerationService;
import uk.gegc.mathdrill.features.expression.domain.model.ExpressionTree;
import uk.gegc.mathdrill.features.expression.domain.model.NumberRange;
import uk.gegc.mathdrill.features.expression.infra.factory.OperandSolverFactory;
import uk.gegc.mathdrill.features.expression.infra.mapping.ExpressionTreeSerializer;
import uk.gegc.mathdrill.shared.config.ExpressionGenerationProperties;
import uk.gegc.mathdrill.shared.exception.DivisionByNearZeroException;
import uk.gegc.mathdrill.shared.exception.ExpressionGenerationException;
import uk.gegc.mathdrill.shared.exception.GenerationError;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExpressionGenerationServiceImpl implements ExpressionGenerationService {

    private final OperandSolverFactory solverFactory;
    private final ExpressionTreeSerializer treeSerializer;
    private final ExpressionGenerationProperties properties;

    @Override
    public GeneratedExpression generate(ExpressionGenerationRequest request) {
        return generate(request, ThreadLocalRandom.current());
    }

    @Override
    public GeneratedExpression generate(ExpressionGenerationRequest request, Random random) {
        NumberRange range = validate(request);
        int operandCount = request.difficulty().sampleOperandCount(random);
        log.debug("Generating {} expression with {} operands in range {} using {}",
                request.difficulty(), operandCount, range, request.operators());

        ExpressionTreeBuilder builder = new ExpressionTreeBuilder(
                solverFactory, range, request.orderedOperators(), properties.getMaxSplitAttempts(), random);
        ExpressionTree tree = builder.build(operandCount);

        String expression = tree.render();
        double result = evaluate(tree, range);
        return new GeneratedExpression(expression, result, builder.getOperatorsUsed(), treeSerializer.toJsonNode(tree));
    }

    @Override
    public List<GeneratedExpression> generateBatch(ExpressionGenerationRequest request, int count) {
        return generateBatch(request, count, ThreadLocalRandom.current());
    }

    @Override
    public List<GeneratedExpression> generateBatch(ExpressionGenerationRequest request, int count, Random random) {
        if (count < 1 || count > properties.getMaxBatchSize()) {
            throw new IllegalArgumentException(
                    "Batch size must be between 1 and " + properties.getMaxBatchSize() + ", got " + count);
        }
        List<GeneratedExpression> expressions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            expressions.add(generate(request, random));
        }
        log.info("Generated {} {} expressions in range [{}, {}]", count, request.difficulty(), request.min(), request.max());
        return expressions;
    }

    private double evaluate(ExpressionTree tree, NumberRange range) {
        int expected = tree.getRoot().getValue();
        double result;
        try {
            result = tree.evaluate();
        } catch (DivisionByNearZeroException e) {
            log.error("Generated expression {} divides by {}", tree.render(), e.getDivisor());
            throw new ExpressionGenerationException(GenerationError.DIVISION_BY_NEAR_ZERO,
                    tree.getRoot().getOperator(), range, expected,
                    "Generated expression " + tree.render() + " divides by a value near zero", e);
        }
        if (result != expected) {
            log.error("Expression {} evaluates to {} but its root stores {}", tree.render(), result, expected);
            throw new ExpressionGenerationException(GenerationError.EVALUATION_MISMATCH,
                    tree.getRoot().getOperator(), range, expected,
                    "Expression " + tree.render() + " evaluates to " + result + " instead of " + expected);
        }
        return result;
    }

    private NumberRange validate(ExpressionGenerationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Generation request must not be null");
        }
        if (request.difficulty() == null) {
            throw new IllegalArgumentException("Difficulty must not be null");
        }
        if (request.min() == null || request.max() == null) {
            throw new IllegalArgumentException("Range bounds must not be null");
        }
        if (request.operators().isEmpty()) {
            throw new IllegalArgumentException("At least one operator must be specified");
        }
        NumberRange range = request.range();
        if (range.maxAbsolute() > properties.getMaxAbsoluteBound()) {
            throw new IllegalArgumentException("Range " + range + " exceeds the supported bound of "
                    + properties.getMaxAbsoluteBound());
        }
        return range;
    }
}
