/* (C)2026 */
package com.ammann.captionbox.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for named ManagedExecutor instances.
 *
 * <p>Provides the "recalculation-executor" bean used by AdaptiveRecalculationService
 * to run re-scoring batches of the asynchronous recalculation.
 */
@ApplicationScoped
public class ExecutorProducer {

    @ConfigProperty(name = "quarkus.thread-pool.recalculation-executor.max-threads", defaultValue = "2")
    int maxThreads;

    @ConfigProperty(name = "quarkus.thread-pool.recalculation-executor.queue-size", defaultValue = "16")
    int queueSize;

    /**
     * Produces a named ManagedExecutor for recalculation batches.
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named("recalculation-executor")
    @ApplicationScoped
    public ManagedExecutor createRecalculationExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxThreads)
                .maxQueued(queueSize)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }

    void shutdown(@Disposes @Named("recalculation-executor") ManagedExecutor executor) {
        executor.shutdown();
    }
}
