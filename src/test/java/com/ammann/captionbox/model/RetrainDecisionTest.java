/* (C)2026 */
package com.ammann.captionbox.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.captionbox.enumeration.BoxLabel;
import com.ammann.captionbox.enumeration.RetrainReason;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class RetrainDecisionTest {

    @Test
    void describesTriggeredDecision() {
        RetrainDecision decision = new RetrainDecision(RetrainReason.ANNOTATION_COUNT_THRESHOLD, 120, 45.4, 158.6);

        assertThat(decision.shouldRetrain()).isTrue();
        assertThat(decision.describe())
                .startsWith("TRIGGERED: " + RetrainReason.ANNOTATION_COUNT_THRESHOLD.getValue())
                .contains("new=120")
                .contains("elapsed=45s");
    }

    @Test
    void describesSkippedDecision() {
        RetrainDecision decision = new RetrainDecision(RetrainReason.NO_NEW_ANNOTATIONS, 0, 10.0, 0.0);

        assertThat(decision.shouldRetrain()).isFalse();
        assertThat(decision.describe()).startsWith("Not triggered");
    }

    @Test
    void stateCountsNewAnnotations() {
        RetrainState state = new RetrainState(Instant.EPOCH, 20, 35);

        assertThat(state.newAnnotations()).isEqualTo(15);
    }

    @Test
    void rescoreOutcomeDetectsReversal() {
        BoxWithPrediction box = new BoxWithPrediction(
                new BoxRef(0, 0), FeatureVector.of(new double[26]), Prediction.uncertain());

        assertThat(RescoreOutcome.of(box, BoxLabel.IN, BoxLabel.OUT).reversed()).isTrue();
        assertThat(RescoreOutcome.of(box, BoxLabel.IN, BoxLabel.IN).reversed()).isFalse();
    }
}
