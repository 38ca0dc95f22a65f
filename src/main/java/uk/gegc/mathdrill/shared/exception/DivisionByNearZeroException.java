package uk.gegc.mathdrill.shared.exception;

import lombok.Getter;

/**
 * Thrown when an expression divides by a value too close to zero to be meaningful.
 */
@Getter
public class DivisionByNearZeroException extends ArithmeticException {

    private final double dividend;
    private final double divisor;

    public DivisionByNearZeroException(double dividend, double divisor) {
        super("Divisor " + divisor + " is too close to zero (dividend " + dividend + ")");
        this.dividend = dividend;
        this.divisor = divisor;
    }
}
