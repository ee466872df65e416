/* (C)2026 */
package com.ammann.captionbox.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ammann.captionbox.dto.AnnotationRequestDTO;
import com.ammann.captionbox.dto.BoxRegistrationDTO;
import com.ammann.captionbox.dto.PredictionDTO;
import com.ammann.captionbox.dto.StreamingUpdateResultDTO;
import com.ammann.captionbox.enumeration.BoxLabel;
import com.ammann.captionbox.exception.ValidationException;
import com.ammann.captionbox.model.Annotation;
import com.ammann.captionbox.model.BoxRef;
import com.ammann.captionbox.model.StreamingUpdateResult;
import com.ammann.captionbox.repository.InMemoryBoxPredictionRepository;
import com.ammann.captionbox.repository.InMemoryModelRepository;
import com.ammann.captionbox.service.BayesianPredictionService;
import com.ammann.captionbox.service.StreamingUpdateService;
import com.ammann.captionbox.support.TestDataFactory;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import jakarta.ws.rs.core.Response;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class AnnotationResourceTest {

    private static final StreamingUpdateResult UPDATED =
            new StreamingUpdateResult(true, false, "naive_bayes_v2-3", 12, 12, 1, 0.08, "exhausted_candidates", false);

    private AnnotationResource resource;
    private InMemoryBoxPredictionRepository boxRepository;
    private InMemoryModelRepository modelRepository;
    private StreamingUpdateService streamingUpdateService;

    @BeforeEach
    void setUp() {
        boxRepository = new InMemoryBoxPredictionRepository();
        modelRepository = new InMemoryModelRepository();
        streamingUpdateService = mock(StreamingUpdateService.class);

        resource = new AnnotationResource();
        resource.boxRepository = boxRepository;
        resource.modelRepository = modelRepository;
        resource.predictionService = new BayesianPredictionService();
        resource.streamingUpdateService = streamingUpdateService;
    }

    // =========================================================================
    // registerBox
    // =========================================================================

    @Test
    void registerBox_scoresWithCurrentModelAndStores() {
        modelRepository.save(TestDataFactory.trainedModel(30, TestDataFactory.identity()));

        Response response = resource.registerBox(new BoxRegistrationDTO(4, 2, features(1.0)));

        assertThat(response.getStatus()).isEqualTo(201);
        PredictionDTO body = (PredictionDTO) response.getEntity();
        assertThat(body.label()).isEqualTo("in");
        assertThat(body.confidence()).isGreaterThan(0.5);
        assertThat(boxRepository.find(new BoxRef(4, 2))).isPresent();
    }

    @Test
    void registerBox_withoutModel_storesUncertainPrediction() {
        PredictionDTO body = (PredictionDTO) resource.registerBox(new BoxRegistrationDTO(0, 0, features(0.3)))
                .getEntity();

        assertThat(body.confidence()).isEqualTo(0.5);
    }

    @Test
    void registerBox_wrongFeatureCount_throwsValidation() {
        assertThatThrownBy(() -> resource.registerBox(new BoxRegistrationDTO(0, 0, List.of(1.0, 2.0))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Expected 26");
    }

    @Test
    void registerBox_nullFeatureValue_throwsValidation() {
        List<Double> values = new ArrayList<>(features(0.5));
        values.set(3, null);

        assertThatThrownBy(() -> resource.registerBox(new BoxRegistrationDTO(0, 0, values)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("null");
    }

    @Test
    void registerBox_negativeIndex_throwsValidation() {
        assertThatThrownBy(() -> resource.registerBox(new BoxRegistrationDTO(-1, 0, features(0.5))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("frameIndex");
    }

    // =========================================================================
    // getUncertainBoxes
    // =========================================================================

    @Test
    @SuppressWarnings("unchecked")
    void getUncertainBoxes_returnsBoxesBelowThreshold() {
        boxRepository.save(TestDataFactory.box(0, 0, TestDataFactory.constantFeatures(0.5), BoxLabel.IN, 0.95));
        boxRepository.save(TestDataFactory.box(0, 1, TestDataFactory.constantFeatures(0.5), BoxLabel.OUT, 0.55));
        boxRepository.save(TestDataFactory.box(1, 0, TestDataFactory.constantFeatures(0.5), BoxLabel.IN, 0.7));

        List<PredictionDTO> body = (List<PredictionDTO>) resource.getUncertainBoxes(0.8).getEntity();

        assertThat(body).extracting(PredictionDTO::frameIndex, PredictionDTO::boxIndex)
                .containsExactly(tuple(0, 1), tuple(1, 0));
    }

    @Test
    void getUncertainBoxes_thresholdOutOfRange_throwsValidation() {
        assertThatThrownBy(() -> resource.getUncertainBoxes(1.5))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("threshold");
    }

    @Test
    @SuppressWarnings("unchecked")
    void getConfidentBoxes_usesDefaultThreshold() {
        boxRepository.save(TestDataFactory.box(0, 0, TestDataFactory.constantFeatures(0.5), BoxLabel.IN, 0.95));
        boxRepository.save(TestDataFactory.box(0, 1, TestDataFactory.constantFeatures(0.5), BoxLabel.OUT, 0.55));
        boxRepository.save(TestDataFactory.box(1, 0, TestDataFactory.constantFeatures(0.5), BoxLabel.OUT, 0.7));

        List<PredictionDTO> body = (List<PredictionDTO>) resource.getConfidentBoxes(null).getEntity();

        assertThat(body).extracting(PredictionDTO::frameIndex, PredictionDTO::boxIndex)
                .containsExactly(tuple(0, 0), tuple(1, 0));
    }

    @Test
    @SuppressWarnings("unchecked")
    void getConfidentBoxes_honoursExplicitThreshold() {
        boxRepository.save(TestDataFactory.box(0, 0, TestDataFactory.constantFeatures(0.5), BoxLabel.IN, 0.95));
        boxRepository.save(TestDataFactory.box(1, 0, TestDataFactory.constantFeatures(0.5), BoxLabel.OUT, 0.7));

        List<PredictionDTO> body = (List<PredictionDTO>) resource.getConfidentBoxes(0.9).getEntity();

        assertThat(body).extracting(PredictionDTO::frameIndex).containsExactly(0);
    }

    @Test
    void getConfidentBoxes_thresholdOutOfRange_throwsValidation() {
        assertThatThrownBy(() -> resource.getConfidentBoxes(-0.1))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("threshold");
    }

    // =========================================================================
    // annotate
    // =========================================================================

    @Test
    void annotate_usesRegisteredFeaturesWhenOmitted() {
        boxRepository.save(TestDataFactory.box(2, 5, TestDataFactory.constantFeatures(0.25), BoxLabel.IN, 0.6));
        when(streamingUpdateService.applyAnnotation(any())).thenReturn(UPDATED);

        Response response = resource.annotate(new AnnotationRequestDTO(2, 5, "OUT", null));

        ArgumentCaptor<Annotation> captor = ArgumentCaptor.forClass(Annotation.class);
        verify(streamingUpdateService).applyAnnotation(captor.capture());
        assertThat(captor.getValue().label()).isEqualTo(BoxLabel.OUT);
        assertThat(captor.getValue().features()).isEqualTo(TestDataFactory.constantFeatures(0.25));

        StreamingUpdateResultDTO body = (StreamingUpdateResultDTO) response.getEntity();
        assertThat(body.modelVersion()).isEqualTo("naive_bayes_v2-3");
        assertThat(body.stopReason()).isEqualTo("exhausted_candidates");
    }

    @Test
    void annotate_unknownBoxWithoutFeatures_throwsValidation() {
        assertThatThrownBy(() -> resource.annotate(new AnnotationRequestDTO(9, 9, "in", null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Unknown box");
        verifyNoInteractions(streamingUpdateService);
    }

    @Test
    void annotate_unknownLabel_throwsValidation() {
        assertThatThrownBy(() -> resource.annotate(new AnnotationRequestDTO(0, 0, "maybe", features(0.5))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("label");
    }

    @Test
    void annotate_missingBody_throwsValidation() {
        assertThatThrownBy(() -> resource.annotate(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void annotateAsync_mapsResult() {
        when(streamingUpdateService.applyAnnotationAsync(any())).thenReturn(Uni.createFrom().item(UPDATED));

        Response response = resource.annotateAsync(new AnnotationRequestDTO(0, 0, "in", features(0.5)))
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create())
                .assertCompleted()
                .getItem();

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(((StreamingUpdateResultDTO) response.getEntity()).boxesProcessed()).isEqualTo(12);
    }

    private static List<Double> features(double value) {
        Double[] values = new Double[26];
        Arrays.fill(values, value);
        return Collections.unmodifiableList(Arrays.asList(values));
    }
}
