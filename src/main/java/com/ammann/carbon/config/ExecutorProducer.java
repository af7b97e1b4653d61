/* (C)2026 */
package com.ammann.carbon.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for creating named ManagedExecutor instances.
 *
 * <p>Provides the "pattern-refresh-executor" bean used by the region pattern store to run
 * pattern recomputations off the request threads.
 */
@ApplicationScoped
public class ExecutorProducer {

    public static final String PATTERN_REFRESH_EXECUTOR = "pattern-refresh-executor";

    @ConfigProperty(name = "carbon.intelligence.executor.max-async", defaultValue = "4")
    int maxAsync;

    @ConfigProperty(name = "carbon.intelligence.executor.max-queued", defaultValue = "64")
    int maxQueued;

    /**
     * Produces a named ManagedExecutor for pattern recomputation.
     *
     * <p>Configuration properties:
     * <ul>
     *   <li>carbon.intelligence.executor.max-async</li>
     *   <li>carbon.intelligence.executor.max-queued</li>
     * </ul>
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named(PATTERN_REFRESH_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createPatternRefreshExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxAsync)
                .maxQueued(maxQueued)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }
}
