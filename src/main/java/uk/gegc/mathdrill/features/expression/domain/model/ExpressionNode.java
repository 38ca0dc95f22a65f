package uk.gegc.mathdrill.features.expression.domain.model;

import lombok.Getter;

/**
 * A node of an arithmetic expression tree.
 *
 * <p>{@code value} is the result of the subtree rooted here; for a leaf it is the literal operand.
 * An inner node always has both children and an operator, and applying that operator to the
 * children's values yields {@code value}. The parent reference is only consulted to decide
 * whether the rendered subtree needs parentheses.</p>
 */
@Getter
public class ExpressionNode {

    private final int value;
    private OperatorType operator;
    private ExpressionNode left;
    private ExpressionNode right;
    private ExpressionNode parent;

    public ExpressionNode(int value) {
        this(value, null);
    }

    public ExpressionNode(int value, OperatorType operator) {
        this.value = value;
        this.operator = operator;
    }

    public static ExpressionNode leaf(int value) {
        return new ExpressionNode(value);
    }

    public static ExpressionNode of(OperatorType operator, ExpressionNode left, ExpressionNode right) {
        double result = operator.apply(left.getValue(), right.getValue());
        if (result != Math.rint(result)) {
            throw new IllegalArgumentException(
                    left.getValue() + " " + operator.getSymbol() + " " + right.getValue() + " is not an integer");
        }
        ExpressionNode node = new ExpressionNode((int) result, operator);
        node.attachChildren(left, right);
        return node;
    }

    public boolean isLeaf() {
        return left == null && right == null;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isRightChild() {
        return parent != null && parent.right == this;
    }

    /**
     * Operators are reassigned while the node is still awaiting expansion, and cleared from
     * leaves once construction finishes.
     */
    public void setOperator(OperatorType operator) {
        this.operator = operator;
    }

    public void attachChildren(ExpressionNode left, ExpressionNode right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("An inner node needs both a left and a right child");
        }
        if (!isLeaf()) {
            throw new IllegalStateException("Node " + value + " already has children");
        }
        left.parent = this;
        right.parent = this;
        this.left = left;
        this.right = right;
    }

    @Override
    public String toString() {
        return isLeaf()
                ? "Leaf(" + value + ")"
                : "Node(" + value + ", " + operator.getSymbol() + ")";
    }
}
