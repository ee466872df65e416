/* (C)2026 */
package com.ammann.captionbox.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.captionbox.exception.DimensionMismatchException;
import com.ammann.captionbox.support.TestDataFactory;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BoxClassificationModel")
class BoxClassificationModelTest {

    private static final List<GaussianParams> PARAMS = TestDataFactory.uniformParams(0.5, 0.1);

    @Test
    @DisplayName("should reject priors that do not sum to one")
    void shouldRejectUnbalancedPriors() {
        assertThatThrownBy(() -> model(0.6, 0.5, PARAMS, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Priors must sum to 1");
    }

    @Test
    @DisplayName("should reject parameter lists of the wrong length")
    void shouldRejectWrongParameterCount() {
        assertThatThrownBy(() -> model(0.5, 0.5, PARAMS.subList(0, 25), null, null))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    @DisplayName("should require covariance and inverse together")
    void shouldRequireCovarianceAndInverseTogether() {
        assertThatThrownBy(() -> model(0.5, 0.5, PARAMS, TestDataFactory.identity(), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("both present or both absent");
    }

    @Test
    @DisplayName("should reject a covariance matrix that is not 26x26")
    void shouldRejectWrongMatrixSize() {
        assertThatThrownBy(() -> model(0.5, 0.5, PARAMS, new double[25], new double[25]))
                .isInstanceOf(DimensionMismatchException.class)
                .hasMessageContaining("676");
    }

    @Test
    @DisplayName("should not expose its internal arrays")
    void shouldCopyArrays() {
        double[] inverse = TestDataFactory.identity();
        BoxClassificationModel model = model(0.5, 0.5, PARAMS, TestDataFactory.identity(), inverse);

        inverse[0] = 42.0;
        model.getCovarianceInverse().orElseThrow()[1] = 42.0;

        assertThat(model.getCovarianceInverse().orElseThrow()[0]).isEqualTo(1.0);
        assertThat(model.getCovarianceInverse().orElseThrow()[1]).isEqualTo(0.0);
    }

    @Test
    @DisplayName("should treat a model without training samples as the seed")
    void shouldDetectSeed() {
        assertThat(TestDataFactory.seedModel().isSeed()).isTrue();
        assertThat(TestDataFactory.seedModel().hasCovariance()).isFalse();
        assertThat(TestDataFactory.trainedModel(20, TestDataFactory.identity()).isSeed()).isFalse();
    }

    private static BoxClassificationModel model(
            double priorIn, double priorOut, List<GaussianParams> params, double[] covariance, double[] inverse) {
        return new BoxClassificationModel(
                "v", 10, priorIn, priorOut, params, params, null, covariance, inverse, false, Instant.now());
    }
}
