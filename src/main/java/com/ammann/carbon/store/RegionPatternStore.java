/* (C)2026 */
package com.ammann.carbon.store;

import com.ammann.carbon.config.ExecutorProducer;
import com.ammann.carbon.config.IntelligenceSettings;
import com.ammann.carbon.exception.NoPatternAvailableException;
import com.ammann.carbon.model.HistoricalSample;
import com.ammann.carbon.model.RegionPattern;
import com.ammann.carbon.service.PatternCalculator;
import com.ammann.carbon.source.CarbonDataSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * Process-wide cache of {@link RegionPattern}s, one per region.
 *
 * <p>Per region the store moves through {@code absent -> computing -> fresh -> stale -> computing}.
 * Readers never take a lock: patterns live in a {@link ConcurrentHashMap} and a recomputed pattern
 * replaces the previous one with a single {@code put}. A second map holds the in-flight
 * recomputation of each region, so concurrent triggers for the same region share one
 * {@link CompletableFuture} and at most one recomputation per region runs at any time.
 *
 * <p>Recomputations run on the {@link ExecutorProducer#PATTERN_REFRESH_EXECUTOR} executor. When one
 * fails or does not finish within the caller's timeout, the previously cached pattern is served if
 * there is one. Entries are only removed through {@link #evict(String)} and {@link #clear()}.
 *
 * <p>Each eviction bumps the region's eviction generation. A recomputation that started before an
 * eviction still completes its waiters but does not install its result.
 */
@ApplicationScoped
public class RegionPatternStore {

    private static final Logger LOG = Logger.getLogger(RegionPatternStore.class);

    private final ConcurrentHashMap<String, RegionPattern> patterns = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<RegionPattern>> inFlight =
            new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Long> evictionGenerations = new ConcurrentHashMap<>();

    @Inject CarbonDataSource dataSource;

    @Inject PatternCalculator calculator;

    @Inject IntelligenceSettings settings;

    @Inject
    @Named(ExecutorProducer.PATTERN_REFRESH_EXECUTOR)
    Executor executor;

    @Inject MeterRegistry meterRegistry;

    Clock clock = Clock.systemUTC();

    private Counter refreshSuccessCounter;
    private Counter refreshFailureCounter;
    private Counter staleServedCounter;

    @PostConstruct
    void init() {
        initMetrics();
    }

    /**
     * Returns the pattern for {@code region}, waiting at most the configured read timeout for a
     * recomputation.
     */
    public RegionPattern getPattern(String region) {
        return getPattern(region, settings.readTimeout());
    }

    /**
     * Returns the pattern for {@code region}.
     *
     * <p>A fresh cached pattern is returned immediately. Otherwise the caller joins (or starts) the
     * region's recomputation and waits at most {@code timeout}. If the recomputation fails, times
     * out or the wait is interrupted, the latest cached pattern is returned instead.
     *
     * @param region  region identifier
     * @param timeout maximum time to wait for a recomputation
     * @return the fresh, recomputed or stale pattern
     * @throws NoPatternAvailableException if no pattern could be computed and none is cached
     */
    public RegionPattern getPattern(String region, Duration timeout) {
        RegionPattern cached = patterns.get(region);
        if (cached != null && !isStale(cached)) {
            return cached;
        }

        CompletableFuture<RegionPattern> future = trigger(region, true);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return fallback(region, "recomputation failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            return fallback(region, "recomputation did not finish within " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fallback(region, "interrupted while waiting for recomputation", e);
        }
    }

    /**
     * Triggers a recomputation of {@code region}, or joins the one already running.
     *
     * @return the future completed with the new pattern, or exceptionally with the failure cause
     */
    public CompletableFuture<RegionPattern> refresh(String region) {
        return trigger(region, false);
    }

    private CompletableFuture<RegionPattern> trigger(String region, boolean skipIfFresh) {
        CompletableFuture<RegionPattern> created = new CompletableFuture<>();
        CompletableFuture<RegionPattern> existing = inFlight.putIfAbsent(region, created);
        if (existing != null) {
            LOG.debugf("Joining in-flight pattern computation for %s", region);
            return existing;
        }

        if (skipIfFresh) {
            // a computation may have finished between the caller's cache check and putIfAbsent
            RegionPattern current = patterns.get(region);
            if (current != null && !isStale(current)) {
                inFlight.remove(region, created);
                created.complete(current);
                return created;
            }
        }

        try {
            executor.execute(() -> recompute(region, created));
        } catch (RejectedExecutionException e) {
            LOG.warnf("Pattern computation for %s rejected by executor: %s", region, e.getMessage());
            increment(refreshFailureCounter);
            inFlight.remove(region, created);
            created.completeExceptionally(e);
        }
        return created;
    }

    private void recompute(String region, CompletableFuture<RegionPattern> future) {
        long generation = evictionGeneration(region);
        try {
            Instant now = clock.instant();
            Instant start = now.minus(Duration.ofDays(settings.historyRetentionDays()));

            List<HistoricalSample> samples = dataSource.fetchHistoricalSamples(region, start, now);
            RegionPattern pattern = calculator.computePattern(
                    region, samples, settings.minDataPointsForAnalysis(), now);

            // the generation check and the put run under the map's lock for this key
            RegionPattern installed = patterns.compute(region,
                    (key, previous) -> evictionGeneration(key) == generation ? pattern : previous);
            increment(refreshSuccessCounter);
            if (installed == pattern) {
                LOG.infof(
                        "Updated pattern for %s: mean=%.1f, stddev=%.1f, p20=%.1f, p80=%.1f, trend=%s (%d samples)",
                        region, pattern.mean(), pattern.stdDev(), pattern.p20(), pattern.p80(),
                        pattern.trendDirection().getLabel(), pattern.sampleCount());
            } else {
                LOG.infof("Discarding pattern for %s: region was evicted during the computation", region);
            }

            inFlight.remove(region, future);
            future.complete(pattern);
        } catch (RuntimeException | Error e) {
            increment(refreshFailureCounter);
            LOG.warnf("Pattern computation failed for %s: %s", region, e.toString());
            inFlight.remove(region, future);
            future.completeExceptionally(e);
        }
    }

    private long evictionGeneration(String region) {
        return evictionGenerations.getOrDefault(region, 0L);
    }

    private void bumpEvictionGeneration(String region) {
        evictionGenerations.merge(region, 1L, Long::sum);
    }

    private RegionPattern fallback(String region, String reason, Throwable cause) {
        RegionPattern latest = patterns.get(region);
        if (latest == null) {
            throw new NoPatternAvailableException(region, reason, cause);
        }
        increment(staleServedCounter);
        LOG.warnf("Serving stale pattern for %s computed at %s (%s)", region, latest.lastUpdated(), reason);
        return latest;
    }

    /** Cached pattern for {@code region} regardless of staleness, or {@code null}. */
    public RegionPattern peek(String region) {
        return patterns.get(region);
    }

    /** Snapshot of the cached patterns keyed by region. */
    public Map<String, RegionPattern> snapshot() {
        return Map.copyOf(patterns);
    }

    public List<String> cachedRegions() {
        return patterns.keySet().stream().sorted().collect(Collectors.toList());
    }

    public List<String> staleRegions() {
        return patterns.values().stream()
                .filter(this::isStale)
                .map(RegionPattern::region)
                .sorted()
                .collect(Collectors.toList());
    }

    /** A pattern is stale once it is older than the update interval. */
    public boolean isStale(RegionPattern pattern) {
        Duration age = Duration.between(pattern.lastUpdated(), clock.instant());
        return age.compareTo(settings.updateInterval()) > 0;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public int size() {
        return patterns.size();
    }

    /**
     * Removes the cached pattern of {@code region}. A running recomputation is not cancelled, but
     * its result is not cached.
     *
     * @return {@code true} if a pattern was removed
     */
    public boolean evict(String region) {
        bumpEvictionGeneration(region);
        boolean removed = patterns.remove(region) != null;
        if (removed) {
            LOG.infof("Evicted cached pattern for %s", region);
        }
        return removed;
    }

    /** Removes all cached patterns and returns how many there were. */
    public int clear() {
        inFlight.keySet().forEach(this::bumpEvictionGeneration);
        patterns.keySet().forEach(this::bumpEvictionGeneration);
        int count = patterns.size();
        patterns.clear();
        LOG.infof("Cleared %d cached patterns", count);
        return count;
    }

    /**
     * Registers the store's meters. Safe to call when {@code meterRegistry} is null.
     */
    void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - metrics disabled");
            return;
        }

        try {
            refreshSuccessCounter = Counter.builder("carbon_pattern_refresh_total")
                    .description("Pattern recomputations by outcome")
                    .tag("outcome", "success")
                    .register(meterRegistry);

            refreshFailureCounter = Counter.builder("carbon_pattern_refresh_total")
                    .description("Pattern recomputations by outcome")
                    .tag("outcome", "failure")
                    .register(meterRegistry);

            staleServedCounter = Counter.builder("carbon_pattern_stale_served_total")
                    .description("Reads answered with a stale pattern after a failed or slow recomputation")
                    .register(meterRegistry);

            Gauge.builder("carbon_pattern_cached_regions", patterns, Map::size)
                    .description("Regions with a cached pattern")
                    .register(meterRegistry);
        } catch (Exception e) {
            LOG.warn("Failed to initialize metrics", e);
        }
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
