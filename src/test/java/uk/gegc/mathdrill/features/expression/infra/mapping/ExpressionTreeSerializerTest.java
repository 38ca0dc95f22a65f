package uk.gegc.mathdrill.features.expression.infra.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.mathdrill.BaseUnitTest;
import uk.gegc.mathdrill.features.expression.domain.model.ExpressionNode;
import uk.gegc.mathdrill.features.expression.domain.model.ExpressionTree;
import uk.gegc.mathdrill.shared.exception.InvalidExpressionTreeException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.mathdrill.features.expression.domain.model.ExpressionNode.leaf;
import static uk.gegc.mathdrill.features.expression.domain.model.ExpressionNode.of;
import static uk.gegc.mathdrill.features.expression.domain.model.OperatorType.ADDITION;
import static uk.gegc.mathdrill.features.expression.domain.model.OperatorType.DIVISION;
import static uk.gegc.mathdrill.features.expression.domain.model.OperatorType.MULTIPLICATION;
import static uk.gegc.mathdrill.features.expression.domain.model.OperatorType.SUBTRACTION;

@DisplayName("ExpressionTreeSerializer Tests")
class ExpressionTreeSerializerTest extends BaseUnitTest {

    private ObjectMapper objectMapper;
    private ExpressionTreeSerializer serializer;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        serializer = new ExpressionTreeSerializer(objectMapper);
    }

    @Test
    @DisplayName("toJsonNode: leaves carry a null operator and no children")
    void toJsonNode_structure() {
        ExpressionTree tree = new ExpressionTree(of(ADDITION, leaf(2), leaf(2)));

        JsonNode json = serializer.toJsonNode(tree);

        assertThat(json.get("value").asInt()).isEqualTo(4);
        assertThat(json.get("operator").asText()).isEqualTo("+");
        JsonNode left = json.get("left");
        assertThat(left.get("value").asInt()).isEqualTo(2);
        assertThat(left.has("operator")).isTrue();
        assertThat(left.get("operator").isNull()).isTrue();
        assertThat(left.has("left")).isFalse();
        assertThat(left.has("right")).isFalse();
    }

    @Test
    @DisplayName("round trip: structure, values and parent links survive")
    void roundTrip_preservesTree() throws Exception {
        ExpressionTree tree = new ExpressionTree(
                of(SUBTRACTION,
                        of(MULTIPLICATION, leaf(-3), leaf(4)),
                        of(DIVISION, leaf(12), leaf(3))));

        String json = serializer.toJson(tree);
        ExpressionTree restored = serializer.fromJson(json);

        assertThat(restored.render()).isEqualTo(tree.render()).isEqualTo("(-3) * 4 - 12 / 3");
        assertThat(restored.evaluate()).isEqualTo(-16.0);
        assertThat(serializer.toJsonNode(restored)).isEqualTo(objectMapper.readTree(json));

        ExpressionNode root = restored.getRoot();
        assertThat(root.getLeft().getParent()).isSameAs(root);
        assertThat(root.getRight().isRightChild()).isTrue();
        assertThat(root.getRight().getRight().getParent()).isSameAs(root.getRight());
    }

    @Test
    @DisplayName("empty tree is written as {} and read back as empty")
    void emptyTree() {
        assertThat(serializer.toJson(new ExpressionTree())).isEqualTo("{}");
        assertThat(serializer.fromJson("{}").isEmpty()).isTrue();
        assertThat(serializer.fromJson("  ").isEmpty()).isTrue();
        assertThat(serializer.fromJson(null).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("fromJson: rejects a node with a single child")
    void fromJson_singleChild() {
        String json = """
                {"value": 4, "operator": "+", "left": {"value": 4, "operator": null}}
                """;

        assertThatThrownBy(() -> serializer.fromJson(json))
                .isInstanceOf(InvalidExpressionTreeException.class)
                .hasMessageContaining("both children");
    }

    @Test
    @DisplayName("fromJson: rejects a leaf that carries an operator")
    void fromJson_leafWithOperator() {
        assertThatThrownBy(() -> serializer.fromJson("{\"value\": 4, \"operator\": \"*\"}"))
                .isInstanceOf(InvalidExpressionTreeException.class)
                .hasMessageContaining("must not carry an operator");
    }

    @Test
    @DisplayName("fromJson: rejects unknown operators and non-integer values")
    void fromJson_badFields() {
        String unknownOperator = """
                {"value": 1, "operator": "%",
                 "left": {"value": 3, "operator": null}, "right": {"value": 2, "operator": null}}
                """;

        assertThatThrownBy(() -> serializer.fromJson(unknownOperator))
                .isInstanceOf(InvalidExpressionTreeException.class)
                .hasMessageContaining("Unknown operator '%'");
        assertThatThrownBy(() -> serializer.fromJson("{\"value\": 2.5, \"operator\": null}"))
                .isInstanceOf(InvalidExpressionTreeException.class);
        assertThatThrownBy(() -> serializer.fromJson("{\"operator\": null}"))
                .isInstanceOf(InvalidExpressionTreeException.class);
    }

    @Test
    @DisplayName("fromJson: rejects a node whose value disagrees with its children")
    void fromJson_inconsistentValue() {
        String json = """
                {"value": 5, "operator": "+",
                 "left": {"value": 2, "operator": null}, "right": {"value": 2, "operator": null}}
                """;

        assertThatThrownBy(() -> serializer.fromJson(json))
                .isInstanceOf(InvalidExpressionTreeException.class)
                .hasMessageContaining("stores 5");
    }

    @Test
    @DisplayName("fromJson: malformed JSON is reported as InvalidExpressionTreeException")
    void fromJson_malformed() {
        assertThatThrownBy(() -> serializer.fromJson("{\"value\": "))
                .isInstanceOf(InvalidExpressionTreeException.class)
                .hasMessageContaining("Malformed");
    }
}
