/* (C)2026 */
package com.ammann.captionbox.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.captionbox.enumeration.BoxLabel;
import com.ammann.captionbox.enumeration.FeatureName;
import com.ammann.captionbox.enumeration.TrainingStatus;
import com.ammann.captionbox.exception.ModelPersistenceException;
import com.ammann.captionbox.model.BoxClassificationModel;
import com.ammann.captionbox.model.ClassSamples;
import com.ammann.captionbox.model.FeatureVector;
import com.ammann.captionbox.model.FisherScore;
import com.ammann.captionbox.model.SeedModelParameters;
import com.ammann.captionbox.model.TrainingResult;
import com.ammann.captionbox.repository.AnnotationRepository;
import com.ammann.captionbox.repository.AnnotationRepositories;
import com.ammann.captionbox.repository.InMemoryAnnotationRepository;
import com.ammann.captionbox.repository.InMemoryBoxPredictionRepository;
import com.ammann.captionbox.repository.InMemoryModelRepository;
import com.ammann.captionbox.repository.ModelRepository;
import com.ammann.captionbox.support.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ModelTrainingService")
class ModelTrainingServiceTest {

    private InMemoryAnnotationRepository annotationRepository;
    private InMemoryModelRepository modelRepository;
    private InMemoryBoxPredictionRepository boxRepository;
    private SimpleMeterRegistry registry;
    private ModelTrainingService service;

    private int nextBox;

    @BeforeEach
    void setUp() {
        annotationRepository = AnnotationRepositories.withDefaultLayout();
        modelRepository = new InMemoryModelRepository();
        boxRepository = new InMemoryBoxPredictionRepository();
        registry = new SimpleMeterRegistry();
        service = newService(annotationRepository, modelRepository);
        nextBox = 0;
    }

    @Test
    @DisplayName("should train model with priors from class frequencies")
    void shouldTrainWithClassPriors() {
        annotate(BoxLabel.IN, 15);
        annotate(BoxLabel.OUT, 10);

        TrainingResult result = service.train();

        assertThat(result.status()).isEqualTo(TrainingStatus.TRAINED);
        assertThat(result.inCount()).isEqualTo(15);
        assertThat(result.outCount()).isEqualTo(10);
        BoxClassificationModel model = result.trainedModel().orElseThrow();
        assertThat(model.getVersion()).startsWith("naive_bayes_v2-");
        assertThat(model.getNTrainingSamples()).isEqualTo(25);
        assertThat(model.getPriorIn()).isCloseTo(0.6, within(1e-12));
        assertThat(model.getPriorOut()).isCloseTo(0.4, within(1e-12));
        assertThat(model.getPriorIn() + model.getPriorOut()).isCloseTo(1.0, within(1e-9));
        assertThat(model.hasCovariance()).isTrue();
        assertThat(model.getFeatureImportance()).isEmpty();
        assertThat(modelRepository.loadCurrentModel()).containsSame(model);
        assertThat(registry.get("model_training_total").tag("outcome", "trained").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should floor every standard deviation at the minimum")
    void shouldFloorStandardDeviation() {
        annotate(BoxLabel.IN, 12);
        annotate(BoxLabel.OUT, 12);

        BoxClassificationModel model = service.train().trainedModel().orElseThrow();

        assertThat(model.getInFeatures()).allSatisfy(p -> assertThat(p.std()).isGreaterThanOrEqualTo(0.01));
        assertThat(model.getOutFeatures()).allSatisfy(p -> assertThat(p.std()).isGreaterThanOrEqualTo(0.01));
        assertThat(model.getInFeatures().get(FeatureName.NORMALIZED_Y.ordinal()).std()).isEqualTo(0.01);
        assertThat(model.getInFeatures().get(0).mean()).isCloseTo(1.0, within(1e-9));
        assertThat(model.getOutFeatures().get(0).mean()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    @DisplayName("should compute feature importance with enough samples")
    void shouldComputeFeatureImportance() {
        annotate(BoxLabel.IN, 30);
        annotate(BoxLabel.OUT, 30);

        BoxClassificationModel model = service.train().trainedModel().orElseThrow();

        List<FisherScore> importance = model.getFeatureImportance().orElseThrow();
        assertThat(importance).hasSize(FeatureName.COUNT);
        FisherScore best = importance.stream().max(Comparator.comparingDouble(FisherScore::fisherScore)).orElseThrow();
        assertThat(best.featureName()).isEqualTo(FeatureName.TOP_ALIGNMENT.getDisplayName());
        assertThat(best.importanceWeight()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should tag a singular covariance inverse as degraded")
    void shouldTagDegradedInverse() {
        annotate(BoxLabel.IN, 10);
        annotate(BoxLabel.OUT, 10);

        BoxClassificationModel model = service.train().trainedModel().orElseThrow();

        // only feature 0 varies, so the pooled covariance is singular
        assertThat(model.isCovarianceDegraded()).isTrue();
        double[] inverse = model.getCovarianceInverse().orElseThrow();
        int n = FeatureName.COUNT;
        assertThat(inverse[n + 1]).isEqualTo(1.0);
        assertThat(inverse[1]).isEqualTo(0.0);
        assertThat(inverse[0]).isGreaterThan(0.0);
        assertThat(registry.get("covariance_inversion_degraded_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should report insufficient data below the annotation minimum")
    void shouldReportInsufficientAnnotations() {
        service.initializeSeedModel();
        annotate(BoxLabel.IN, 5);
        annotate(BoxLabel.OUT, 5);

        TrainingResult result = service.train();

        assertThat(result.status()).isEqualTo(TrainingStatus.INSUFFICIENT_DATA);
        assertThat(result.annotationCount()).isEqualTo(10);
        assertThat(result.resetToSeedRequired()).isFalse();
        assertThat(result.trainedModel()).isEmpty();
        assertThat(modelRepository.loadCurrentModel().orElseThrow().getVersion())
                .isEqualTo(SeedModelParameters.SEED_VERSION);
    }

    @Test
    @DisplayName("should flag reset when annotations dropped below minimum after training")
    void shouldFlagResetAfterAnnotationsRemoved() {
        annotate(BoxLabel.IN, 12);
        annotate(BoxLabel.OUT, 12);
        BoxClassificationModel trained = service.train().trainedModel().orElseThrow();

        annotationRepository.clear();
        annotate(BoxLabel.IN, 3);

        TrainingResult result = service.train();

        assertThat(result.status()).isEqualTo(TrainingStatus.INSUFFICIENT_DATA);
        assertThat(result.resetToSeedRequired()).isTrue();
        assertThat(modelRepository.loadCurrentModel()).containsSame(trained);
    }

    @Test
    @DisplayName("should require two samples per class")
    void shouldRequireTwoSamplesPerClass() {
        annotate(BoxLabel.IN, 24);
        annotate(BoxLabel.OUT, 1);

        TrainingResult result = service.train();

        assertThat(result.status()).isEqualTo(TrainingStatus.INSUFFICIENT_DATA);
        assertThat(result.inCount()).isEqualTo(24);
        assertThat(result.outCount()).isEqualTo(1);
        assertThat(result.resetToSeedRequired()).isFalse();
        assertThat(service.loadTrainingSamples()).isEmpty();
    }

    @Test
    @DisplayName("should report missing layout as insufficient data")
    void shouldReportMissingLayout() {
        AnnotationRepository noLayout = mock(AnnotationRepository.class);
        when(noLayout.loadLayoutConfig()).thenReturn(Optional.empty());
        ModelTrainingService trainer = newService(noLayout, modelRepository);

        TrainingResult result = trainer.train();

        assertThat(result.status()).isEqualTo(TrainingStatus.INSUFFICIENT_DATA);
        assertThat(result.message()).isEqualTo("No layout configuration");
        verify(noLayout, never()).loadAnnotations();
    }

    @Test
    @DisplayName("should expose the samples it would train on")
    void shouldLoadTrainingSamples() {
        annotate(BoxLabel.IN, 11);
        annotate(BoxLabel.OUT, 9);

        List<ClassSamples> samples = service.loadTrainingSamples().orElseThrow();

        assertThat(samples).extracting(ClassSamples::n).containsExactly(11, 9);
    }

    @Test
    @DisplayName("should initialize seed model only once")
    void shouldInitializeSeedIdempotently() {
        service.initializeSeedModel();
        BoxClassificationModel first = modelRepository.loadCurrentModel().orElseThrow();

        service.initializeSeedModel();

        assertThat(modelRepository.loadCurrentModel()).containsSame(first);
        assertThat(first.getVersion()).isEqualTo(SeedModelParameters.SEED_VERSION);
        assertThat(first.isSeed()).isTrue();
        assertThat(first.getPriorIn()).isEqualTo(0.5);
        assertThat(first.hasCovariance()).isFalse();
        assertThat(first.getInFeatures()).isEqualTo(SeedModelParameters.IN_PARAMS);
    }

    @Test
    @DisplayName("should replace a trained model when resetting to seed")
    void shouldResetToSeed() {
        annotate(BoxLabel.IN, 12);
        annotate(BoxLabel.OUT, 12);
        service.train();

        service.resetToSeedModel();

        assertThat(modelRepository.loadCurrentModel().orElseThrow().isSeed()).isTrue();
    }

    @Test
    @DisplayName("should increase the version on every training")
    void shouldIncreaseVersion() {
        annotate(BoxLabel.IN, 12);
        annotate(BoxLabel.OUT, 12);

        String first = service.train().trainedModel().orElseThrow().getVersion();
        String second = service.train().trainedModel().orElseThrow().getVersion();

        assertThat(first).isEqualTo("naive_bayes_v2-1");
        assertThat(second).isEqualTo("naive_bayes_v2-2");
    }

    @Test
    @DisplayName("should propagate a failed model save")
    void shouldPropagatePersistenceFailure() {
        ModelRepository failing = mock(ModelRepository.class);
        when(failing.loadCurrentModel()).thenReturn(Optional.empty());
        doThrow(new IllegalStateException("disk full")).when(failing).save(any());
        ModelTrainingService trainer = newService(annotationRepository, failing);
        annotate(BoxLabel.IN, 12);
        annotate(BoxLabel.OUT, 12);

        assertThatThrownBy(trainer::train)
                .isInstanceOf(ModelPersistenceException.class)
                .hasMessageContaining("naive_bayes_v2")
                .hasRootCauseMessage("disk full");
        assertThat(registry.find("model_training_total").tag("outcome", "trained").counter()).isNull();
    }

    private ModelTrainingService newService(AnnotationRepository annotations, ModelRepository models) {
        ModelTrainingService trainer = new ModelTrainingService(
                annotations,
                models,
                new StoredFeatureExtractor(boxRepository),
                new GaussianStatisticsService(new LinearAlgebraService()),
                new LinearAlgebraService());
        trainer.meterRegistry = registry;
        trainer.minAnnotationsForRetrain = 20;
        trainer.minStd = 0.01;
        trainer.minSamplesForImportance = 50;
        return trainer;
    }

    /**
     * Registers and annotates boxes whose feature 0 is near 1.0 for "in" and near 0.0 for "out".
     */
    private void annotate(BoxLabel label, int count) {
        double center = label == BoxLabel.IN ? 1.0 : 0.0;
        for (int i = 0; i < count; i++) {
            double jitter = i % 2 == 0 ? -0.1 : 0.1;
            FeatureVector features = TestDataFactory.constantFeatures(0.5).with(FeatureName.TOP_ALIGNMENT, center + jitter);
            int box = nextBox++;
            boxRepository.save(TestDataFactory.box(0, box, features, label, 0.5));
            annotationRepository.save(TestDataFactory.annotation(0, box, label, features));
        }
    }
}
