package uk.gegc.mathdrill.shared.exception;

public enum GenerationError {
    /**
     * No result value satisfies the operator and range combination.
     */
    INFEASIBLE_SEED,
    /**
     * A node could not be split into an operand pair within the allowed attempts.
     */
    INFEASIBLE_SPLIT,
    DIVISION_BY_NEAR_ZERO,
    /**
     * The evaluated expression disagrees with the value stored at the root.
     */
    EVALUATION_MISMATCH
}
