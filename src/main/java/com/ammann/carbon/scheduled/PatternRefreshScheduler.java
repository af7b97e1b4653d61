/* (C)2026 */
package com.ammann.carbon.scheduled;

import com.ammann.carbon.config.IntelligenceSettings;
import com.ammann.carbon.store.RegionPatternStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.quarkus.scheduler.Scheduled;
import io.quarkus.scheduler.Scheduled.ConcurrentExecution;
import io.quarkus.scheduler.Scheduler;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Periodic refresh of every cached region pattern.
 * <p>
 * Each sweep takes a snapshot of the regions currently in the {@link RegionPatternStore} and
 * recomputes them one after another, waiting at most
 * {@code carbon.intelligence.refresh.region-timeout} for each. A failed or slow region is logged
 * and counted; its cached pattern stays in place and keeps being served.
 * <p>
 * The job can be switched off with {@code carbon.intelligence.refresh.enabled=false} and paused or
 * resumed at runtime through {@link #pause()} and {@link #resume()}.
 */
@ApplicationScoped
public class PatternRefreshScheduler {

    private static final Logger LOG = Logger.getLogger(PatternRefreshScheduler.class);

    static final String JOB_IDENTITY = "pattern-refresh";

    @Inject RegionPatternStore store;

    @Inject IntelligenceSettings settings;

    @Inject Scheduler scheduler;

    @Inject MeterRegistry meterRegistry;

    @ConfigProperty(name = "carbon.intelligence.refresh.enabled", defaultValue = "true")
    boolean enabled = true;

    private Timer sweepTimer;
    private volatile Instant lastSweep;
    private volatile RefreshSummary lastSummary;

    /**
     * Outcome of one sweep.
     *
     * @param attempted regions in the snapshot
     * @param refreshed regions recomputed successfully
     * @param failed    regions whose recomputation failed
     * @param timedOut  regions that did not finish within the per-region timeout
     */
    public record RefreshSummary(int attempted, int refreshed, int failed, int timedOut) {}

    @PostConstruct
    void init() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - sweep timing disabled");
            return;
        }
        sweepTimer = Timer.builder("carbon_pattern_sweep_duration")
                .description("Duration of a full pattern refresh sweep")
                .register(meterRegistry);
    }

    @Scheduled(
            every = "{carbon.intelligence.update-interval}",
            identity = JOB_IDENTITY,
            concurrentExecution = ConcurrentExecution.SKIP)
    void scheduledRefresh() {
        if (!enabled) {
            LOG.debug("Pattern refresh disabled - skipping sweep");
            return;
        }
        refreshAll();
    }

    /**
     * Recomputes every cached region sequentially.
     *
     * @return counts of the sweep's outcomes
     */
    public RefreshSummary refreshAll() {
        long startNanos = System.nanoTime();
        List<String> regions = store.cachedRegions();
        Duration regionTimeout = settings.regionRefreshTimeout();

        int refreshed = 0;
        int failed = 0;
        int timedOut = 0;

        for (String region : regions) {
            try {
                store.refresh(region).get(regionTimeout.toMillis(), TimeUnit.MILLISECONDS);
                refreshed++;
            } catch (ExecutionException e) {
                failed++;
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOG.errorf("Failed to refresh pattern for %s: %s", region, cause.getMessage());
            } catch (TimeoutException e) {
                timedOut++;
                LOG.errorf("Pattern refresh for %s did not finish within %s", region, regionTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warnf("Pattern refresh sweep interrupted after %d of %d regions",
                        refreshed + failed + timedOut, regions.size());
                break;
            }
        }

        RefreshSummary summary = new RefreshSummary(regions.size(), refreshed, failed, timedOut);
        long elapsedNanos = System.nanoTime() - startNanos;
        if (sweepTimer != null) {
            sweepTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
        }
        lastSweep = Instant.now();
        lastSummary = summary;

        if (!regions.isEmpty()) {
            LOG.infof("Pattern refresh sweep: %d/%d regions refreshed (%d failed, %d timed out) in %d ms",
                    refreshed, regions.size(), failed, timedOut, TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
        }
        return summary;
    }

    public void pause() {
        scheduler.pause(JOB_IDENTITY);
        LOG.info("Pattern refresh paused");
    }

    public void resume() {
        scheduler.resume(JOB_IDENTITY);
        LOG.info("Pattern refresh resumed");
    }

    public boolean isPaused() {
        return scheduler.isPaused(JOB_IDENTITY);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Completion time of the last sweep, or {@code null} before the first one. */
    public Instant getLastSweep() {
        return lastSweep;
    }

    public RefreshSummary getLastSummary() {
        return lastSummary;
    }
}
