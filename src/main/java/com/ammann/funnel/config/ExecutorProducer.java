/* (C)2026 */
package com.ammann.funnel.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;
import org.jboss.logging.Logger;

/**
 * CDI producer for the executor that runs funnel work units.
 *
 * <p>Provides the "funnel-executor" bean used by
 * {@link com.ammann.funnel.service.FunnelEngine} to match and tally actor batches in parallel.
 */
@ApplicationScoped
public class ExecutorProducer {

    private static final Logger LOG = Logger.getLogger(ExecutorProducer.class);

    @ConfigProperty(name = "funnel.executor.max-async", defaultValue = "4")
    int maxAsync = 4;

    @ConfigProperty(name = "funnel.executor.max-queued", defaultValue = "1000")
    int maxQueued = 1000;

    /**
     * Produces a named ManagedExecutor for funnel work units.
     *
     * <p>Configuration properties:
     * <ul>
     *   <li>funnel.executor.max-async</li>
     *   <li>funnel.executor.max-queued</li>
     * </ul>
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named("funnel-executor")
    @ApplicationScoped
    public ManagedExecutor createFunnelExecutor() {
        LOG.debugf("Creating funnel-executor (maxAsync=%d, maxQueued=%d)", maxAsync, maxQueued);
        return ManagedExecutor.builder()
                .maxAsync(maxAsync)
                .maxQueued(maxQueued)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }

    void closeFunnelExecutor(@Disposes @Named("funnel-executor") ManagedExecutor executor) {
        executor.shutdown();
    }
}
