/* (C)2026 */
package com.ammann.metrictester.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;
import org.jboss.logging.Logger;

/**
 * CDI producer for the executor that runs randomization tasks.
 *
 * <p>Provides the "randomization-executor" bean used by RandomizationService. The queue is
 * unbounded: a run submits one task per null model and then one per replicate, and none of
 * them may be rejected.
 */
@ApplicationScoped
public class ExecutorProducer {

    private static final Logger LOG = Logger.getLogger(ExecutorProducer.class);

    @ConfigProperty(name = "metrictester.randomization.max-async", defaultValue = "4")
    int maxAsync;

    /**
     * Produces the named ManagedExecutor for randomization work.
     *
     * <p>Configuration properties:
     * <ul>
     *   <li>metrictester.randomization.max-async</li>
     * </ul>
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named("randomization-executor")
    @ApplicationScoped
    public ManagedExecutor createRandomizationExecutor() {
        LOG.infof("Creating randomization executor with maxAsync=%d", maxAsync);
        return ManagedExecutor.builder()
                .maxAsync(maxAsync)
                .maxQueued(-1) // unbounded
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }

    void closeRandomizationExecutor(@Disposes @Named("randomization-executor") ManagedExecutor executor) {
        executor.shutdown();
    }
}
