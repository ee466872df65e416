/* (C)2026 */
package com.ammann.captionbox.service;

import com.ammann.captionbox.enumeration.BoxLabel;
import com.ammann.captionbox.exception.ModelPersistenceException;
import com.ammann.captionbox.model.Annotation;
import com.ammann.captionbox.model.BoxClassificationModel;
import com.ammann.captionbox.model.ClassSamples;
import com.ammann.captionbox.model.FeatureVector;
import com.ammann.captionbox.model.FisherScore;
import com.ammann.captionbox.model.GaussianParams;
import com.ammann.captionbox.model.InversionResult;
import com.ammann.captionbox.model.LayoutConfig;
import com.ammann.captionbox.model.SeedModelParameters;
import com.ammann.captionbox.model.TrainingResult;
import com.ammann.captionbox.repository.AnnotationRepository;
import com.ammann.captionbox.repository.ModelRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Trains the Gaussian Naive Bayes box classifier from user annotations.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load layout and annotations; stop with insufficient data below the retrain minimum</li>
 *   <li>Extract a feature vector per annotation and bucket it by label</li>
 *   <li>Require at least two samples per class</li>
 *   <li>Estimate per-feature Gaussian parameters and class priors</li>
 *   <li>Optionally compute Fisher-score feature importance</li>
 *   <li>Compute the pooled covariance and its inverse</li>
 *   <li>Store the new immutable model, replacing the previous one</li>
 * </ol>
 *
 * <p>The trainer never discards a stored model on its own. When the annotation count falls
 * below the minimum after a real model was trained, the result is flagged and the caller
 * decides whether to {@link #resetToSeedModel() reset}.
 */
@ApplicationScoped
public class ModelTrainingService {

    private static final Logger LOG = Logger.getLogger(ModelTrainingService.class);

    static final String MODEL_VERSION_PREFIX = "naive_bayes_v2";
    private static final int MIN_SAMPLES_PER_CLASS = 2;
    private static final int TOP_FEATURES_LOGGED = 5;

    @ConfigProperty(name = "captionbox.training.min-annotations-for-retrain", defaultValue = "20")
    int minAnnotationsForRetrain;

    @ConfigProperty(name = "captionbox.training.min-std", defaultValue = "0.01")
    double minStd;

    @ConfigProperty(name = "captionbox.training.min-samples-for-importance", defaultValue = "50")
    int minSamplesForImportance;

    @Inject MeterRegistry meterRegistry;

    private final AnnotationRepository annotationRepository;
    private final ModelRepository modelRepository;
    private final FeatureExtractor featureExtractor;
    private final GaussianStatisticsService statistics;
    private final LinearAlgebraService linearAlgebra;

    private final AtomicLong trainingSequence = new AtomicLong();

    @Inject
    public ModelTrainingService(
            AnnotationRepository annotationRepository,
            ModelRepository modelRepository,
            FeatureExtractor featureExtractor,
            GaussianStatisticsService statistics,
            LinearAlgebraService linearAlgebra) {
        this.annotationRepository = annotationRepository;
        this.modelRepository = modelRepository;
        this.featureExtractor = featureExtractor;
        this.statistics = statistics;
        this.linearAlgebra = linearAlgebra;
    }

    /**
     * Trains a new model from all stored user annotations and stores it.
     *
     * @return trained result carrying the stored model, or an insufficient-data result
     * @throws ModelPersistenceException if the new model could not be stored
     */
    public TrainingResult train() {
        Optional<LayoutConfig> layout = annotationRepository.loadLayoutConfig();
        if (layout.isEmpty()) {
            LOG.error("No layout configuration found, cannot train");
            recordTraining("no_layout");
            return TrainingResult.insufficientData(0, 0, 0, false, "No layout configuration");
        }

        List<Annotation> annotations = annotationRepository.loadAnnotations();
        int total = annotations.size();

        if (total < minAnnotationsForRetrain) {
            boolean resetRequired =
                    modelRepository
                            .loadCurrentModel()
                            .map(m -> m.getNTrainingSamples() >= minAnnotationsForRetrain)
                            .orElse(false);
            LOG.infof("Insufficient training data: %d samples (need %d+), reset to seed required=%b",
                    total, minAnnotationsForRetrain, resetRequired);
            recordTraining("insufficient_annotations");
            return TrainingResult.insufficientData(
                    total, 0, 0, resetRequired,
                    String.format("Insufficient training data: %d samples (need %d+)",
                            total, minAnnotationsForRetrain));
        }

        LOG.infof("Training with %d user annotations", total);

        ClassSamples[] samples = extractClassSamples(annotations, layout.get());
        ClassSamples inSamples = samples[0];
        ClassSamples outSamples = samples[1];

        if (inSamples.n() < MIN_SAMPLES_PER_CLASS || outSamples.n() < MIN_SAMPLES_PER_CLASS) {
            LOG.infof("Insufficient samples per class: in=%d, out=%d", inSamples.n(), outSamples.n());
            recordTraining("insufficient_class_samples");
            return TrainingResult.insufficientData(
                    total, inSamples.n(), outSamples.n(), false,
                    String.format("Insufficient samples per class: in=%d, out=%d",
                            inSamples.n(), outSamples.n()));
        }

        BoxClassificationModel model = buildModel(inSamples, outSamples, total);
        store(model);

        LOG.infof("Model %s trained: %d 'in', %d 'out'",
                model.getVersion(), inSamples.n(), outSamples.n());
        recordTraining("trained");
        return TrainingResult.trained(model, inSamples.n(), outSamples.n());
    }

    /**
     * Stores the seed model unless a model already exists.
     */
    public void initializeSeedModel() {
        if (modelRepository.loadCurrentModel().isPresent()) {
            LOG.info("Model already exists, skipping seed initialization");
            return;
        }
        LOG.info("Initializing seed model with typical caption parameters");
        store(seedModel());
        LOG.info("Seed model initialized successfully");
    }

    /**
     * Replaces the current model with the seed model.
     */
    public void resetToSeedModel() {
        LOG.info("Resetting to seed model (annotations cleared)");
        store(seedModel());
    }

    /**
     * Returns the per-class samples the current annotations would train on, or empty under the
     * same insufficiency rules as {@link #train()}.
     */
    public Optional<List<ClassSamples>> loadTrainingSamples() {
        Optional<LayoutConfig> layout = annotationRepository.loadLayoutConfig();
        if (layout.isEmpty()) {
            return Optional.empty();
        }
        List<Annotation> annotations = annotationRepository.loadAnnotations();
        if (annotations.size() < minAnnotationsForRetrain) {
            return Optional.empty();
        }
        ClassSamples[] samples = extractClassSamples(annotations, layout.get());
        if (samples[0].n() < MIN_SAMPLES_PER_CLASS || samples[1].n() < MIN_SAMPLES_PER_CLASS) {
            return Optional.empty();
        }
        return Optional.of(List.of(samples[0], samples[1]));
    }

    public BoxClassificationModel seedModel() {
        return new BoxClassificationModel(
                SeedModelParameters.SEED_VERSION,
                0,
                0.5,
                0.5,
                SeedModelParameters.IN_PARAMS,
                SeedModelParameters.OUT_PARAMS,
                null,
                null,
                null,
                false,
                Instant.now());
    }

    private ClassSamples[] extractClassSamples(List<Annotation> annotations, LayoutConfig layout) {
        List<FeatureVector> in = new ArrayList<>();
        List<FeatureVector> out = new ArrayList<>();

        for (Annotation annotation : annotations) {
            FeatureVector features = featureExtractor.extractFeatures(annotation.boxRef(), layout);
            if (annotation.label() == BoxLabel.IN) {
                in.add(features);
            } else {
                out.add(features);
            }
        }
        return new ClassSamples[] {ClassSamples.of(in), ClassSamples.of(out)};
    }

    private BoxClassificationModel buildModel(ClassSamples inSamples, ClassSamples outSamples, int total) {
        List<GaussianParams> inParams = statistics.gaussianParams(inSamples, minStd);
        List<GaussianParams> outParams = statistics.gaussianParams(outSamples, minStd);

        double priorIn = (double) inSamples.n() / total;
        double priorOut = (double) outSamples.n() / total;

        List<FisherScore> importance = null;
        if (total >= minSamplesForImportance) {
            importance = statistics.fisherScores(inParams, outParams);
            LOG.infof("Calculated feature importance (top %d): %s",
                    TOP_FEATURES_LOGGED, describeTopFeatures(importance));
        }

        double[] covariance = statistics.pooledCovariance(inSamples, outSamples);
        InversionResult inversion = linearAlgebra.invertSymmetric(covariance);
        if (inversion.degraded()) {
            LOG.warnf("Pooled covariance inverse is a diagonal approximation: %s", inversion.reason());
            recordDegradedInversion();
        }
        LOG.info("Computed pooled covariance matrix (26x26)");

        return new BoxClassificationModel(
                MODEL_VERSION_PREFIX + "-" + trainingSequence.incrementAndGet(),
                total,
                priorIn,
                priorOut,
                inParams,
                outParams,
                importance,
                covariance,
                inversion.inverse(),
                inversion.degraded(),
                Instant.now());
    }

    private void store(BoxClassificationModel model) {
        try {
            modelRepository.save(model);
        } catch (ModelPersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelPersistenceException("Failed to store model " + model.getVersion(), e);
        }
    }

    private static String describeTopFeatures(List<FisherScore> importance) {
        return importance.stream()
                .sorted(Comparator.comparingDouble(FisherScore::fisherScore).reversed())
                .limit(TOP_FEATURES_LOGGED)
                .map(f -> String.format("%s=%.2f", f.featureName(), f.fisherScore()))
                .collect(Collectors.joining(", "));
    }

    private void recordTraining(String outcome) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("model_training_total")
                .description("Model training attempts by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    private void recordDegradedInversion() {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("covariance_inversion_degraded_total")
                .description("Covariance inversions that fell back to the diagonal approximation")
                .register(meterRegistry)
                .increment();
    }
}
