/* (C)2026 */
package com.ammann.carbon.health;

import com.ammann.carbon.scheduled.PatternRefreshScheduler;
import com.ammann.carbon.store.RegionPatternStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check for the region pattern cache.
 *
 * <p>Always UP: stale or missing patterns degrade responses but never make the service unusable.
 * The data section exposes cache state for operators.
 */
@Readiness
@ApplicationScoped
public class PatternStoreHealthCheck implements HealthCheck {

    @Inject RegionPatternStore patternStore;

    @Inject PatternRefreshScheduler refreshScheduler;

    @Override
    public HealthCheckResponse call() {
        Instant lastSweep = refreshScheduler.getLastSweep();

        return HealthCheckResponse.named("region-pattern-store")
                .up()
                .withData("cached-regions", patternStore.size())
                .withData("stale-regions", patternStore.staleRegions().size())
                .withData("in-flight-computations", patternStore.inFlightCount())
                .withData("refresh-enabled", refreshScheduler.isEnabled())
                .withData("last-sweep", lastSweep != null ? lastSweep.toString() : "never")
                .build();
    }
}
