/* (C)2026 */
package com.ammann.carbon.resource;

import static com.ammann.carbon.support.TestDataFactory.MONDAY_0400;
import static com.ammann.carbon.support.TestDataFactory.pattern;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.carbon.dto.GreenHoursForecastDTO;
import com.ammann.carbon.dto.PatternEvictionResponseDTO;
import com.ammann.carbon.dto.PatternSummaryDTO;
import com.ammann.carbon.dto.RegionalStrategyDTO;
import com.ammann.carbon.enumeration.TrendPeriod;
import com.ammann.carbon.exception.ValidationException;
import com.ammann.carbon.model.RegionPattern;
import com.ammann.carbon.properties.ApiProperties;
import com.ammann.carbon.service.CarbonIntelligenceService;
import com.ammann.carbon.service.ConfidenceScorer;
import com.ammann.carbon.service.RegionalStrategyCatalog;
import com.ammann.carbon.store.RegionPatternStore;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CarbonIntelligenceResourceTest {

    private CarbonIntelligenceResource resource;
    private CarbonIntelligenceService service;
    private RegionPatternStore store;
    private ConfidenceScorer scorer;

    @BeforeEach
    void setUp() {
        service = mock(CarbonIntelligenceService.class);
        store = mock(RegionPatternStore.class);
        scorer = mock(ConfidenceScorer.class);

        resource = new CarbonIntelligenceResource();
        resource.intelligenceService = service;
        resource.patternStore = store;
        resource.confidenceScorer = scorer;
        resource.strategyCatalog = new RegionalStrategyCatalog();
    }

    @Test
    void resource_classHasVersionedPath() {
        var path = CarbonIntelligenceResource.class.getAnnotation(jakarta.ws.rs.Path.class);
        assertThat(path).isNotNull();
        assertThat(path.value()).isEqualTo(ApiProperties.BASE_URL_V1);
    }

    @Test
    void evictEndpoint_usesDeleteOnRegionPath() throws NoSuchMethodException {
        var method = CarbonIntelligenceResource.class.getMethod("evictPattern", String.class);
        assertThat(method.getAnnotation(jakarta.ws.rs.DELETE.class)).isNotNull();
        assertThat(method.getAnnotation(jakarta.ws.rs.Path.class).value())
                .isEqualTo(ApiProperties.Carbon.PATTERN);
    }

    @Nested
    class Validation {

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        void blankRegionIsRejected(String region) {
            assertThatThrownBy(() -> resource.getRelativeIntensity(region))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("'region'");
            verify(service, never()).getRelativeCarbonIntensity(anyString());
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -1, 169})
        void forecastHorizonOutOfRangeIsRejected(int hours) {
            assertThatThrownBy(() -> resource.getGreenHours("DE", hours))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("'hours'");
            verify(service, never()).getDynamicGreenHours(anyString(), anyInt());
        }

        @Test
        void unknownPeriodIsRejected() {
            assertThatThrownBy(() -> resource.getTrends("DE", "hourly", null))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("'period'");
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 366})
        void trendDaysOutOfRangeAreRejected(int days) {
            assertThatThrownBy(() -> resource.getTrends("DE", "weekly", days))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("'days'");
        }
    }

    @Nested
    class Delegation {

        @Test
        void relativeIntensityUsesTrimmedRegion() {
            resource.getRelativeIntensity("  DE ");

            verify(service).getRelativeCarbonIntensity("DE");
        }

        @Test
        void greenHoursPassHorizonThrough() {
            GreenHoursForecastDTO dto = new GreenHoursForecastDTO(
                    "DE", List.of(), null, MONDAY_0400, MONDAY_0400, MONDAY_0400, "test", false, null, null);
            when(service.getDynamicGreenHours("DE", 48)).thenReturn(dto);

            Response response = resource.getGreenHours("DE", 48);

            assertThat(response.getStatus()).isEqualTo(200);
            assertThat(response.getEntity()).isSameAs(dto);
        }

        @Test
        void trendsParsePeriodLabel() {
            resource.getTrends("DE", "Weekly", 14);

            verify(service).getCarbonTrends("DE", TrendPeriod.WEEKLY, 14);
        }

        @Test
        void strategyComesFromCatalog() {
            Response response = resource.getStrategy("Warsaw");

            RegionalStrategyDTO strategy = (RegionalStrategyDTO) response.getEntity();
            assertThat(strategy.region()).isEqualTo("PL");
            assertThat(strategy.coalHeavyGrid()).isTrue();
        }
    }

    @Nested
    class Patterns {

        @Test
        @SuppressWarnings("unchecked")
        void listIsOrderedByRegion() {
            RegionPattern pl = pattern("PL", MONDAY_0400, 600, 80, 500, 700);
            RegionPattern de = pattern("DE", MONDAY_0400, 300, 60, 250, 380);
            when(store.snapshot()).thenReturn(Map.of("PL", pl, "DE", de));
            when(store.isStale(any())).thenReturn(false);
            when(store.isStale(pl)).thenReturn(true);
            when(scorer.confidence(any(RegionPattern.class))).thenReturn(0.75);

            List<PatternSummaryDTO> summaries = (List<PatternSummaryDTO>) resource.listPatterns().getEntity();

            assertThat(summaries).extracting(PatternSummaryDTO::region).containsExactly("DE", "PL");
            assertThat(summaries).extracting(PatternSummaryDTO::stale).containsExactly(false, true);
            assertThat(summaries.get(0).confidence()).isEqualTo(0.75);
            assertThat(summaries.get(1).p80()).isEqualTo(700.0);
        }

        @Test
        void clearReportsEvictedCount() {
            when(store.clear()).thenReturn(2);
            when(store.cachedRegions()).thenReturn(List.of());

            PatternEvictionResponseDTO body = (PatternEvictionResponseDTO) resource.clearPatterns().getEntity();

            assertThat(body.evicted()).isEqualTo(2);
            assertThat(body.remainingRegions()).isEmpty();
        }

        @Test
        void evictingCachedRegionSucceeds() {
            when(store.evict("DE")).thenReturn(true);
            when(store.cachedRegions()).thenReturn(List.of("PL"));

            PatternEvictionResponseDTO body = (PatternEvictionResponseDTO) resource.evictPattern("DE").getEntity();

            assertThat(body.evicted()).isEqualTo(1);
            assertThat(body.remainingRegions()).containsExactly("PL");
        }

        @Test
        void evictingUnknownRegionIsNotFound() {
            when(store.evict("ZA")).thenReturn(false);

            assertThatThrownBy(() -> resource.evictPattern("ZA"))
                    .isInstanceOf(NotFoundException.class)
                    .hasMessageContaining("ZA");
        }
    }
}
