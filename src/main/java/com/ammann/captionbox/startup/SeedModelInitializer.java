/* (C)2026 */
package com.ammann.captionbox.startup;

import com.ammann.captionbox.service.ModelTrainingService;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Installs the seed model on application startup so that boxes can be scored before the first
 * annotation arrives. An existing model is left untouched.
 */
@ApplicationScoped
public class SeedModelInitializer {

    private static final Logger LOG = Logger.getLogger(SeedModelInitializer.class);

    @Inject ModelTrainingService trainingService;

    void onStart(@Observes StartupEvent event) {
        LOG.info("Seed model initialization: checking for an existing model...");
        trainingService.initializeSeedModel();
    }
}
