/* (C)2026 */
package com.ammann.carbon.scheduled;

import static com.ammann.carbon.support.TestDataFactory.pattern;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ammann.carbon.config.IntelligenceSettings;
import com.ammann.carbon.exception.CollaboratorFetchException;
import com.ammann.carbon.model.RegionPattern;
import com.ammann.carbon.store.RegionPatternStore;
import io.quarkus.scheduler.Scheduler;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PatternRefreshSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private RegionPatternStore store;
    private Scheduler jobScheduler;
    private PatternRefreshScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = mock(RegionPatternStore.class);
        jobScheduler = mock(Scheduler.class);

        scheduler = new PatternRefreshScheduler();
        scheduler.store = store;
        scheduler.scheduler = jobScheduler;
        scheduler.settings = IntelligenceSettings.defaults().withRegionRefreshTimeout(Duration.ofMillis(50));
        scheduler.init();
    }

    @Test
    void sweepRefreshesEveryCachedRegionAndCountsOutcomes() {
        RegionPattern de = pattern("DE", NOW, 200.0, 40.0, 150.0, 260.0);
        when(store.cachedRegions()).thenReturn(List.of("DE", "FR", "PL"));
        when(store.refresh("DE")).thenReturn(CompletableFuture.completedFuture(de));
        when(store.refresh("FR")).thenReturn(new CompletableFuture<>());
        when(store.refresh("PL")).thenReturn(CompletableFuture.failedFuture(
                new CollaboratorFetchException("PL", "fetch historical samples", "HTTP 500")));

        PatternRefreshScheduler.RefreshSummary summary = scheduler.refreshAll();

        assertThat(summary).isEqualTo(new PatternRefreshScheduler.RefreshSummary(3, 1, 1, 1));
        assertThat(scheduler.getLastSummary()).isEqualTo(summary);
        assertThat(scheduler.getLastSweep()).isNotNull();
        verify(store).refresh("DE");
        verify(store).refresh("FR");
        verify(store).refresh("PL");
    }

    @Test
    void emptyStoreSweepsNothing() {
        when(store.cachedRegions()).thenReturn(List.of());

        PatternRefreshScheduler.RefreshSummary summary = scheduler.refreshAll();

        assertThat(summary.attempted()).isZero();
        assertThat(scheduler.getLastSweep()).isNotNull();
    }

    @Test
    void disabledJobDoesNotTouchStore() {
        scheduler.enabled = false;

        scheduler.scheduledRefresh();

        verifyNoInteractions(store);
        assertThat(scheduler.getLastSweep()).isNull();
        assertThat(scheduler.isEnabled()).isFalse();
    }

    @Test
    void enabledJobRunsSweep() {
        when(store.cachedRegions()).thenReturn(List.of());

        scheduler.scheduledRefresh();

        verify(store).cachedRegions();
        assertThat(scheduler.getLastSummary()).isNotNull();
    }

    @Test
    void pauseAndResumeDelegateToScheduler() {
        when(jobScheduler.isPaused(PatternRefreshScheduler.JOB_IDENTITY)).thenReturn(true);

        scheduler.pause();
        scheduler.resume();

        verify(jobScheduler).pause(PatternRefreshScheduler.JOB_IDENTITY);
        verify(jobScheduler).resume(PatternRefreshScheduler.JOB_IDENTITY);
        assertThat(scheduler.isPaused()).isTrue();
    }
}
