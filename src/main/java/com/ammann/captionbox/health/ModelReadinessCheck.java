/* (C)2026 */
package com.ammann.captionbox.health;

import com.ammann.captionbox.model.BoxClassificationModel;
import com.ammann.captionbox.repository.ModelRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Optional;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

/**
 * Readiness check for the box classification model.
 *
 * <p>Ready as soon as any model, including the seed model, is loaded. The {@code trained} flag
 * stays false until a model was trained from annotations, so clients can show that the model is
 * not yet trained.
 */
@Readiness
@ApplicationScoped
public class ModelReadinessCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(ModelReadinessCheck.class);
    private static final String HEALTH_CHECK_NAME = "classification-model";

    @Inject ModelRepository modelRepository;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named(HEALTH_CHECK_NAME);

        Optional<BoxClassificationModel> model = modelRepository.loadCurrentModel();
        if (model.isEmpty()) {
            LOG.warn("Readiness check: no classification model loaded");
            return builder.withData("error", "No model loaded").down().build();
        }

        BoxClassificationModel current = model.get();
        if (current.isCovarianceDegraded()) {
            LOG.debugf("Model %s uses a diagonal covariance approximation", current.getVersion());
        }

        return builder.withData("version", current.getVersion())
                .withData("trained", !current.isSeed())
                .withData("training-samples", current.getNTrainingSamples())
                .withData("covariance-degraded", current.isCovarianceDegraded())
                .up()
                .build();
    }
}
