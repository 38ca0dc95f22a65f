package uk.gegc.mathdrill.features.expression.application.impl;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.mathdrill.features.expression.application.OperandPair;
import uk.gegc.mathdrill.features.expression.domain.model.ExpressionNode;
import uk.gegc.mathdrill.features.expression.domain.model.ExpressionTree;
import uk.gegc.mathdrill.features.expression.domain.model.NumberRange;
import uk.gegc.mathdrill.features.expression.domain.model.OperatorType;
import uk.gegc.mathdrill.features.expression.infra.factory.OperandSolverFactory;
import uk.gegc.mathdrill.shared.exception.ExpressionGenerationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Builds one expression tree top-down from a seeded result.
 *
 * <p>The root gets a random operator and a result that operator can produce. Unfinished nodes
 * wait in a frontier; each step expands a random one into two operands, giving the children
 * operators of their own unless this step places the last operand. A node that cannot be split
 * has its operator resampled, a bounded number of times. Children that were handed an operator
 * but never expanded lose it in a final cleanup pass.</p>
 *
 * <p>Instances hold per-call state and are used for a single {@link #build(int)}.</p>
 */
@Slf4j
public class ExpressionTreeBuilder {

    public enum Phase {
        SEEDING, EXPANDING, CLEANING, DONE, FAILED
    }

    private final OperandSolverFactory solverFactory;
    private final NumberRange range;
    private final List<OperatorType> operators;
    private final int maxSplitAttempts;
    private final Random random;

    private final ExpressionTree tree = new ExpressionTree();
    private final List<ExpressionNode> frontier = new ArrayList<>();
    private final List<OperatorType> operatorsUsed = new ArrayList<>();
    private Phase phase = Phase.SEEDING;

    public ExpressionTreeBuilder(OperandSolverFactory solverFactory,
                                 NumberRange range,
                                 List<OperatorType> operators,
                                 int maxSplitAttempts,
                                 Random random) {
        if (operators == null || operators.isEmpty()) {
            throw new IllegalArgumentException("At least one operator must be allowed");
        }
        if (maxSplitAttempts < 1) {
            throw new IllegalArgumentException("maxSplitAttempts must be at least 1");
        }
        this.solverFactory = solverFactory;
        this.range = range;
        this.operators = List.copyOf(new LinkedHashSet<>(operators));
        this.maxSplitAttempts = maxSplitAttempts;
        this.random = random;
    }

    public ExpressionTree build(int operandCount) {
        if (phase != Phase.SEEDING) {
            throw new IllegalStateException("Builder already used (phase " + phase + ")");
        }
        if (operandCount < 2) {
            throw new IllegalArgumentException("An expression needs at least 2 operands, got " + operandCount);
        }
        try {
            seed();
            expand(operandCount);
            clean();
            phase = Phase.DONE;
            log.debug("Built expression {} = {} with {} operands", tree.render(), tree.getRoot().getValue(), operandCount);
            return tree;
        } catch (RuntimeException e) {
            phase = Phase.FAILED;
            throw e;
        }
    }

    public Phase getPhase() {
        return phase;
    }

    /**
     * Operators of the expanded nodes, in expansion order.
     */
    public List<OperatorType> getOperatorsUsed() {
        return Collections.unmodifiableList(operatorsUsed);
    }

    private void seed() {
        OperatorType operator = randomOperator();
        Optional<Integer> seed = solverFactory.getSolver(operator).seedResult(range, random);
        if (seed.isEmpty()) {
            log.warn("No result value for operator {} in range {}", operator, range);
            throw ExpressionGenerationException.infeasibleSeed(operator, range);
        }
        log.debug("Seeded root with operator {} and result {}", operator, seed.get());

        ExpressionNode root = new ExpressionNode(seed.get(), operator);
        tree.setRoot(root);
        frontier.add(root);
        phase = Phase.EXPANDING;
    }

    private void expand(int operandCount) {
        int processed = 1;
        while (processed < operandCount) {
            if (frontier.isEmpty()) {
                throw new IllegalStateException("No node left to expand after " + processed + " operands");
            }
            ExpressionNode node = frontier.remove(random.nextInt(frontier.size()));
            boolean lastOperand = processed == operandCount - 1;
            OperatorType leftOperator = lastOperand ? null : randomOperator();
            OperatorType rightOperator = lastOperand ? null : randomOperator();

            OperandPair pair = splitWithRetry(node);

            ExpressionNode left = new ExpressionNode(pair.left(), leftOperator);
            ExpressionNode right = new ExpressionNode(pair.right(), rightOperator);
            node.attachChildren(left, right);
            operatorsUsed.add(node.getOperator());
            log.debug("Expanded {} into {} {} {}", node.getValue(), pair.left(), node.getOperator().getSymbol(), pair.right());

            if (leftOperator != null) {
                frontier.add(left);
            }
            if (rightOperator != null) {
                frontier.add(right);
            }
            processed++;
        }
    }

    private OperandPair splitWithRetry(ExpressionNode node) {
        for (int attempt = 1; attempt <= maxSplitAttempts; attempt++) {
            Optional<OperandPair> pair = solverFactory.getSolver(node.getOperator())
                    .split(range, node.getValue(), random);
            if (pair.isPresent()) {
                return pair.get();
            }
            if (attempt < maxSplitAttempts) {
                OperatorType previous = node.getOperator();
                node.setOperator(resampleOperator(previous));
                log.debug("Cannot split {} with {} (attempt {}), retrying with {}",
                        node.getValue(), previous, attempt, node.getOperator());
            }
        }
        log.warn("Giving up on splitting {} in range {} after {} attempts", node.getValue(), range, maxSplitAttempts);
        throw ExpressionGenerationException.infeasibleSplit(node.getOperator(), range, node.getValue(), maxSplitAttempts);
    }

    private void clean() {
        phase = Phase.CLEANING;
        clearLeafOperators(tree.getRoot());
    }

    private void clearLeafOperators(ExpressionNode node) {
        if (node == null) {
            return;
        }
        if (node.isLeaf()) {
            node.setOperator(null);
            return;
        }
        clearLeafOperators(node.getLeft());
        clearLeafOperators(node.getRight());
    }

    private OperatorType randomOperator() {
        return operators.get(random.nextInt(operators.size()));
    }

    // a different operator whenever one is available
    private OperatorType resampleOperator(OperatorType current) {
        List<OperatorType> others = new ArrayList<>(operators);
        others.remove(current);
        if (others.isEmpty()) {
            return current;
        }
        return others.get(random.nextInt(others.size()));
    }
}
