package uk.gegc.mathdrill.features.expression.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Binary expression tree whose inner nodes store the result of their subtree.
 *
 * <p>Rendering is an inorder walk. A subtree is parenthesized when its operator binds looser
 * than its parent's, or binds equally and sits on the parent's right-hand side, so
 * {@code 1 - (2 - 3)} and {@code 1 + (2 + 3)} are both written with parentheses.</p>
 */
public class ExpressionTree {

    private ExpressionNode root;

    public ExpressionTree() {
    }

    public ExpressionTree(ExpressionNode root) {
        this.root = root;
    }

    public ExpressionNode getRoot() {
        return root;
    }

    public void setRoot(ExpressionNode root) {
        this.root = root;
    }

    public boolean isEmpty() {
        return root == null;
    }

    public String render() {
        return render(root);
    }

    public double evaluate() {
        if (root == null) {
            throw new IllegalStateException("Cannot evaluate an empty expression tree");
        }
        return evaluate(root);
    }

    public List<ExpressionNode> leaves() {
        List<ExpressionNode> leaves = new ArrayList<>();
        collectLeaves(root, leaves);
        return leaves;
    }

    /**
     * Inner nodes in preorder.
     */
    public List<ExpressionNode> innerNodes() {
        List<ExpressionNode> nodes = new ArrayList<>();
        collectInnerNodes(root, nodes);
        return nodes;
    }

    private String render(ExpressionNode node) {
        if (node == null) {
            return "";
        }
        if (node.isLeaf()) {
            return node.getValue() < 0 ? "(" + node.getValue() + ")" : String.valueOf(node.getValue());
        }

        String expression = render(node.getLeft()) + " " + node.getOperator().getSymbol() + " " + render(node.getRight());
        return needsParentheses(node) ? "(" + expression + ")" : expression;
    }

    static boolean needsParentheses(ExpressionNode node) {
        ExpressionNode parent = node.getParent();
        if (parent == null || node.getOperator() == null || parent.getOperator() == null) {
            return false;
        }
        int own = node.getOperator().getPrecedence();
        int enclosing = parent.getOperator().getPrecedence();
        if (own < enclosing) {
            return true;
        }
        return own == enclosing && node.isRightChild();
    }

    private double evaluate(ExpressionNode node) {
        if (node.isLeaf()) {
            return node.getValue();
        }
        double left = evaluate(node.getLeft());
        double right = evaluate(node.getRight());
        return node.getOperator().apply(left, right);
    }

    private void collectLeaves(ExpressionNode node, List<ExpressionNode> leaves) {
        if (node == null) {
            return;
        }
        if (node.isLeaf()) {
            leaves.add(node);
            return;
        }
        collectLeaves(node.getLeft(), leaves);
        collectLeaves(node.getRight(), leaves);
    }

    private void collectInnerNodes(ExpressionNode node, List<ExpressionNode> nodes) {
        if (node == null || node.isLeaf()) {
            return;
        }
        nodes.add(node);
        collectInnerNodes(node.getLeft(), nodes);
        collectInnerNodes(node.getRight(), nodes);
    }
}
