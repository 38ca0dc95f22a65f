package uk.gegc.mathdrill.features.expression.domain.model;

import java.util.Random;

public enum Difficulty {
    EASY(2, 2),
    MEDIUM(2, 3),
    HARD(3, 4);

    private final int minOperands;
    private final int maxOperands;

    Difficulty(int minOperands, int maxOperands) {
        this.minOperands = minOperands;
        this.maxOperands = maxOperands;
    }

    public int getMinOperands() {
        return minOperands;
    }

    public int getMaxOperands() {
        return maxOperands;
    }

    /**
     * Samples the number of leaves for one expression, inclusive on both ends.
     */
    public int sampleOperandCount(Random random) {
        return minOperands + random.nextInt(maxOperands - minOperands + 1);
    }
}
