/* (C)2026 */
package com.ammann.carbon.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * CDI producer that assembles {@link IntelligenceSettings} from application.properties.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>carbon.intelligence.history-retention-days</li>
 *   <li>carbon.intelligence.min-data-points</li>
 *   <li>carbon.intelligence.update-interval</li>
 *   <li>carbon.intelligence.high-variation-regions</li>
 *   <li>carbon.intelligence.zone</li>
 *   <li>carbon.intelligence.read-timeout</li>
 *   <li>carbon.intelligence.refresh.region-timeout</li>
 * </ul>
 */
@ApplicationScoped
public class IntelligenceSettingsProducer {

    private static final Logger LOG = Logger.getLogger(IntelligenceSettingsProducer.class);

    @ConfigProperty(name = "carbon.intelligence.history-retention-days", defaultValue = "30")
    int historyRetentionDays;

    @ConfigProperty(name = "carbon.intelligence.min-data-points", defaultValue = "168")
    int minDataPoints;

    @ConfigProperty(name = "carbon.intelligence.update-interval", defaultValue = "15m")
    Duration updateInterval;

    @ConfigProperty(
            name = "carbon.intelligence.high-variation-regions",
            defaultValue = "PL,US-TEX,CN,IN,AU-NSW,ZA")
    List<String> highVariationRegions;

    @ConfigProperty(name = "carbon.intelligence.zone", defaultValue = "UTC")
    String zone;

    @ConfigProperty(name = "carbon.intelligence.read-timeout", defaultValue = "10s")
    Duration readTimeout;

    @ConfigProperty(name = "carbon.intelligence.refresh.region-timeout", defaultValue = "5m")
    Duration regionRefreshTimeout;

    @Produces
    @Singleton
    public IntelligenceSettings intelligenceSettings() {
        IntelligenceSettings settings =
                new IntelligenceSettings(
                        historyRetentionDays,
                        minDataPoints,
                        updateInterval,
                        new HashSet<>(highVariationRegions),
                        ZoneId.of(zone),
                        readTimeout,
                        regionRefreshTimeout);

        LOG.infof(
                "Carbon intelligence settings: retention=%d days, minDataPoints=%d,"
                        + " updateInterval=%s, zone=%s, highVariationRegions=%s",
                settings.historyRetentionDays(),
                settings.minDataPointsForAnalysis(),
                settings.updateInterval(),
                settings.zone(),
                settings.highVariationRegions());
        return settings;
    }
}
