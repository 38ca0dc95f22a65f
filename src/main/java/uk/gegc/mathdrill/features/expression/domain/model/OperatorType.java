package uk.gegc.mathdrill.features.expression.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import uk.gegc.mathdrill.shared.exception.DivisionByNearZeroException;

/**
 * The four arithmetic operators an expression may use.
 * Multiplication and division bind tighter than addition and subtraction.
 */
public enum OperatorType {
    ADDITION("+", 1),
    SUBTRACTION("-", 1),
    MULTIPLICATION("*", 2),
    DIVISION("/", 2);

    /**
     * Divisors closer to zero than this are rejected during evaluation.
     */
    public static final double DIVISION_GUARD_EPSILON = 1e-4;

    private final String symbol;
    private final int precedence;

    OperatorType(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public double apply(double left, double right) {
        return switch (this) {
            case ADDITION -> left + right;
            case SUBTRACTION -> left - right;
            case MULTIPLICATION -> left * right;
            case DIVISION -> {
                if (Math.abs(right) < DIVISION_GUARD_EPSILON) {
                    throw new DivisionByNearZeroException(left, right);
                }
                yield left / right;
            }
        };
    }

    @JsonCreator
    public static OperatorType fromSymbol(String symbol) {
        for (OperatorType type : values()) {
            if (type.symbol.equals(symbol)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown operator symbol: " + symbol);
    }
}
