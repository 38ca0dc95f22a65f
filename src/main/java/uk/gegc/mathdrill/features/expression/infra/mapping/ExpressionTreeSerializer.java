package uk.gegc.mathdrill.features.expression.infra.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import uk.gegc.mathdrill.features.expression.domain.model.ExpressionNode;
import uk.gegc.mathdrill.features.expression.domain.model.ExpressionTree;
import uk.gegc.mathdrill.features.expression.domain.model.OperatorType;
import uk.gegc.mathdrill.shared.exception.InvalidExpressionTreeException;

/**
 * Converts expression trees to and from their stored JSON form:
 * {@code {"value": 4, "operator": "+", "left": {...}, "right": {...}}}.
 * Leaves carry {@code "operator": null} and omit both children. An empty tree is {@code {}}.
 */
@Component
public class ExpressionTreeSerializer {

    static final String VALUE = "value";
    static final String OPERATOR = "operator";
    static final String LEFT = "left";
    static final String RIGHT = "right";

    private static final double CONSISTENCY_EPSILON = 1e-9;

    private final ObjectMapper objectMapper;

    public ExpressionTreeSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toJsonNode(ExpressionTree tree) {
        if (tree == null || tree.isEmpty()) {
            return objectMapper.createObjectNode();
        }
        return toJsonNode(tree.getRoot());
    }

    public String toJson(ExpressionTree tree) {
        try {
            return objectMapper.writeValueAsString(toJsonNode(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write expression tree as JSON", e);
        }
    }

    public ExpressionTree fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new ExpressionTree();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidExpressionTreeException("Malformed expression tree JSON", e);
        }
        return fromJsonNode(root);
    }

    public ExpressionTree fromJsonNode(JsonNode root) {
        if (root == null || root.isNull() || (root.isObject() && root.isEmpty())) {
            return new ExpressionTree();
        }
        return new ExpressionTree(readNode(root, "$"));
    }

    private ObjectNode toJsonNode(ExpressionNode node) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put(VALUE, node.getValue());
        if (node.getOperator() == null) {
            json.putNull(OPERATOR);
        } else {
            json.put(OPERATOR, node.getOperator().getSymbol());
        }
        if (!node.isLeaf()) {
            json.set(LEFT, toJsonNode(node.getLeft()));
            json.set(RIGHT, toJsonNode(node.getRight()));
        }
        return json;
    }

    private ExpressionNode readNode(JsonNode json, String path) {
        if (!json.isObject()) {
            throw new InvalidExpressionTreeException("Expected an object at " + path);
        }
        JsonNode value = json.get(VALUE);
        if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new InvalidExpressionTreeException("Missing or non-integer 'value' at " + path);
        }

        OperatorType operator = readOperator(json.get(OPERATOR), path);
        JsonNode left = json.get(LEFT);
        JsonNode right = json.get(RIGHT);

        if (left == null && right == null) {
            if (operator != null) {
                throw new InvalidExpressionTreeException("Leaf at " + path + " must not carry an operator");
            }
            return ExpressionNode.leaf(value.intValue());
        }
        if (left == null || right == null) {
            throw new InvalidExpressionTreeException("Node at " + path + " must have both children or none");
        }
        if (operator == null) {
            throw new InvalidExpressionTreeException("Inner node at " + path + " requires an operator");
        }

        ExpressionNode leftNode = readNode(left, path + "." + LEFT);
        ExpressionNode rightNode = readNode(right, path + "." + RIGHT);
        double expected;
        try {
            expected = operator.apply(leftNode.getValue(), rightNode.getValue());
        } catch (ArithmeticException e) {
            throw new InvalidExpressionTreeException("Node at " + path + " divides by zero", e);
        }
        if (Math.abs(expected - value.intValue()) > CONSISTENCY_EPSILON) {
            throw new InvalidExpressionTreeException("Node at " + path + " stores " + value.intValue()
                    + " but its children evaluate to " + expected);
        }

        ExpressionNode node = new ExpressionNode(value.intValue(), operator);
        node.attachChildren(leftNode, rightNode);
        return node;
    }

    private OperatorType readOperator(JsonNode operator, String path) {
        if (operator == null || operator.isNull()) {
            return null;
        }
        if (!operator.isTextual()) {
            throw new InvalidExpressionTreeException("Operator at " + path + " must be a string");
        }
        try {
            return OperatorType.fromSymbol(operator.asText());
        } catch (IllegalArgumentException e) {
            throw new InvalidExpressionTreeException("Unknown operator '" + operator.asText() + "' at " + path, e);
        }
    }
}
