/* (C)2026 */
package com.ammann.carbon.dto;

import com.ammann.carbon.enumeration.TrendDirection;
import com.ammann.carbon.model.RegionPattern;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Summary of a cached region pattern")
public record PatternSummaryDTO(
        @Schema(description = "Region identifier") String region,
        @Schema(description = "Time the pattern was computed") Instant lastUpdated,
        @Schema(description = "Number of retained samples") int sampleCount,
        @Schema(description = "Mean intensity in g CO2/kWh") double mean,
        @Schema(description = "Population standard deviation") double stdDev,
        @Schema(description = "20th percentile") double p20,
        @Schema(description = "80th percentile") double p80,
        @Schema(description = "Long-term trend") TrendDirection trendDirection,
        @Schema(description = "Trend confidence, 0-0.8") double trendConfidence,
        @Schema(description = "Pattern confidence, 0-1") double confidence,
        @Schema(description = "Pattern is due for recomputation") boolean stale) {

    public static PatternSummaryDTO from(RegionPattern pattern, double confidence, boolean stale) {
        return new PatternSummaryDTO(
                pattern.region(),
                pattern.lastUpdated(),
                pattern.sampleCount(),
                pattern.mean(),
                pattern.stdDev(),
                pattern.p20(),
                pattern.p80(),
                pattern.trendDirection(),
                pattern.trendConfidence(),
                confidence,
                stale);
    }
}
