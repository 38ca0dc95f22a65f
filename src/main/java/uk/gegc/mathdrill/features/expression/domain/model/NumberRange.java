package uk.gegc.mathdrill.features.expression.domain.model;

/**
 * Inclusive bounds every operand of a generated expression must respect.
 */
public record NumberRange(int min, int max) {

    public NumberRange {
        if (min > max) {
            throw new IllegalArgumentException("Range minimum " + min + " must not exceed maximum " + max);
        }
    }

    public static NumberRange of(int min, int max) {
        return new NumberRange(min, max);
    }

    public boolean contains(long value) {
        return value >= min && value <= max;
    }

    public long maxAbsolute() {
        return Math.max(Math.abs((long) min), Math.abs((long) max));
    }

    public boolean spansZero() {
        return min <= 0 && max >= 0;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
