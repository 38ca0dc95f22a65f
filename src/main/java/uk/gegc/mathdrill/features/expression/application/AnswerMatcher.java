package uk.gegc.mathdrill.features.expression.application;

import org.springframework.stereotype.Component;

/**
 * Decides whether a submitted answer matches the generated result.
 */
@Component
public class AnswerMatcher {

    /**
     * Answers within this distance of the correct result are accepted.
     */
    public static final double ANSWER_MATCH_EPSILON = 1e-3;

    public boolean isCorrect(double correctAnswer, Double userAnswer) {
        if (userAnswer == null || userAnswer.isNaN()) {
            return false;
        }
        return Math.abs(correctAnswer - userAnswer) < ANSWER_MATCH_EPSILON;
    }
}
