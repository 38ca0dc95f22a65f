package uk.gegc.mathdrill.features.expression.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.mathdrill.BaseUnitTest;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AnswerMatcher Tests")
class AnswerMatcherTest extends BaseUnitTest {

    private final AnswerMatcher matcher = new AnswerMatcher();

    @Test
    @DisplayName("missing answer is never correct")
    void missingAnswer() {
        assertThat(matcher.isCorrect(4.0, null)).isFalse();
        assertThat(matcher.isCorrect(4.0, Double.NaN)).isFalse();
    }

    @Test
    @DisplayName("answers within the match epsilon are accepted")
    void withinEpsilon() {
        assertThat(matcher.isCorrect(4.0, 4.0)).isTrue();
        assertThat(matcher.isCorrect(4.0, 4.0005)).isTrue();
        assertThat(matcher.isCorrect(-12.0, -12.0009)).isTrue();
    }

    @Test
    @DisplayName("answers outside the match epsilon are rejected")
    void outsideEpsilon() {
        assertThat(matcher.isCorrect(4.0, 4.002)).isFalse();
        assertThat(matcher.isCorrect(4.0, -4.0)).isFalse();
    }
}
