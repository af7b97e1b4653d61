/* (C)2026 */
package com.ammann.carbon.source;

import com.ammann.carbon.exception.CollaboratorFetchException;
import com.ammann.carbon.model.CurrentIntensity;
import com.ammann.carbon.model.GreenHour;
import com.ammann.carbon.model.GreenHoursForecast;
import com.ammann.carbon.model.HistoricalSample;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * {@link CarbonDataSource} backed by the Electricity Maps v3 HTTP API.
 *
 * <p>Endpoints used:
 * <ul>
 *   <li>{@code /carbon-intensity/latest} for the current reading</li>
 *   <li>{@code /carbon-intensity/past-range} for history, requested in windows of at most
 *       10 days as the API rejects longer ranges</li>
 *   <li>{@code /carbon-intensity/forecast} for green-hour forecasts</li>
 * </ul>
 *
 * <p>The renewable share is taken from {@code renewablePercentage} when the payload carries it,
 * otherwise derived as {@code 100 - fossilFuelPercentage}, otherwise 0. Without a configured API
 * key every call fails with {@link CollaboratorFetchException}.
 */
@ApplicationScoped
public class ElectricityMapsCarbonDataSource implements CarbonDataSource {

    private static final Logger LOG = Logger.getLogger(ElectricityMapsCarbonDataSource.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    static final String SOURCE = "electricity_maps";
    static final String USER_AGENT = "carbon-intelligence/1.0";
    static final Duration MAX_PAST_RANGE = Duration.ofDays(10);

    /** Forecast hours at or above this intensity are not offered as green hours. */
    static final double GREEN_HOUR_THRESHOLD = 200.0;

    /** Confidence attached to provider forecast hours, 0-100 scale. */
    static final double FORECAST_CONFIDENCE = 70.0;

    @ConfigProperty(name = "electricity-maps.base-url", defaultValue = "https://api.electricitymap.org/v3")
    String baseUrl;

    @ConfigProperty(name = "electricity-maps.api-key")
    Optional<String> apiKey = Optional.empty();

    @ConfigProperty(name = "electricity-maps.request-timeout", defaultValue = "10s")
    Duration requestTimeout = Duration.ofSeconds(10);

    HttpClient httpClient;

    @PostConstruct
    void init() {
        if (httpClient == null) {
            httpClient = HttpClient.newBuilder().connectTimeout(requestTimeout).build();
        }
        if (apiKey.isEmpty() || apiKey.get().isBlank()) {
            LOG.warn("electricity-maps.api-key not set - carbon data requests will fail");
        }
    }

    @Override
    public List<HistoricalSample> fetchHistoricalSamples(String region, Instant start, Instant end) {
        String zone = GridZoneResolver.resolve(region);
        List<HistoricalSample> samples = new ArrayList<>();

        Instant chunkStart = start;
        while (chunkStart.isBefore(end)) {
            Instant chunkEnd = chunkStart.plus(MAX_PAST_RANGE);
            if (chunkEnd.isAfter(end)) {
                chunkEnd = end;
            }

            JsonNode root = get(region, "fetch historical samples", "/carbon-intensity/past-range"
                    + "?zone=" + encode(zone)
                    + "&start=" + encode(chunkStart.toString())
                    + "&end=" + encode(chunkEnd.toString()));

            for (JsonNode entry : root.path("data")) {
                JsonNode intensity = entry.get("carbonIntensity");
                if (intensity == null || intensity.isNull()) {
                    continue; // provider gap
                }
                samples.add(new HistoricalSample(
                        parseInstant(region, entry.path("datetime").asText()),
                        Math.max(0.0, intensity.asDouble()),
                        renewablePercent(entry)));
            }
            chunkStart = chunkEnd;
        }

        samples.sort(Comparator.comparing(HistoricalSample::timestamp));
        LOG.debugf("Fetched %d historical samples for %s (zone %s) between %s and %s",
                samples.size(), region, zone, start, end);
        return samples;
    }

    @Override
    public CurrentIntensity fetchCurrentIntensity(String region) {
        String zone = GridZoneResolver.resolve(region);
        JsonNode root = get(region, "fetch current intensity",
                "/carbon-intensity/latest?zone=" + encode(zone));

        JsonNode intensity = root.get("carbonIntensity");
        if (intensity == null || intensity.isNull()) {
            throw new CollaboratorFetchException(region, "fetch current intensity",
                    "response contains no carbonIntensity");
        }

        CurrentIntensity current = new CurrentIntensity(
                region,
                intensity.asDouble(),
                renewablePercent(root),
                parseInstant(region, root.path("datetime").asText()),
                root.path("zone").asText(zone),
                SOURCE);

        LOG.debugf("Current intensity for %s: %.1f g CO2/kWh", region, current.carbonIntensity());
        return current;
    }

    @Override
    public GreenHoursForecast fetchGreenHoursForecast(String region, int hours) {
        String zone = GridZoneResolver.resolve(region);
        JsonNode root = get(region, "fetch forecast",
                "/carbon-intensity/forecast?zone=" + encode(zone));

        Instant now = Instant.now();
        Instant horizon = now.plus(Duration.ofHours(hours));
        List<GreenHour> greenHours = new ArrayList<>();

        for (JsonNode entry : root.path("forecast")) {
            JsonNode intensity = entry.get("carbonIntensity");
            if (intensity == null || intensity.isNull()) {
                continue;
            }
            Instant start = parseInstant(region, entry.path("datetime").asText());
            if (start.isAfter(horizon) || start.plus(Duration.ofHours(1)).isBefore(now)) {
                continue;
            }
            if (intensity.asDouble() < GREEN_HOUR_THRESHOLD) {
                greenHours.add(new GreenHour(
                        start,
                        start.plus(Duration.ofHours(1)),
                        intensity.asDouble(),
                        renewablePercent(entry),
                        FORECAST_CONFIDENCE));
            }
        }

        greenHours.sort(Comparator.comparing(GreenHour::start));
        return new GreenHoursForecast(
                region,
                greenHours,
                GreenHoursForecast.lowestIntensity(greenHours),
                now,
                horizon,
                now,
                SOURCE);
    }

    private JsonNode get(String region, String operation, String pathAndQuery) {
        String key = apiKey.filter(k -> !k.isBlank()).orElseThrow(() ->
                new CollaboratorFetchException(region, operation, "Electricity Maps API key is not configured"));

        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + pathAndQuery))
                .header("auth-token", key)
                .header("User-Agent", USER_AGENT)
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CollaboratorFetchException(region, operation, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorFetchException(region, operation, "interrupted", e);
        }

        if (response.statusCode() != 200) {
            LOG.warnf("Electricity Maps returned HTTP %d for %s (%s)", response.statusCode(), region, operation);
            throw new CollaboratorFetchException(region, operation, "HTTP " + response.statusCode());
        }

        try {
            return JSON_MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new CollaboratorFetchException(region, operation, "malformed response", e);
        }
    }

    static double renewablePercent(JsonNode node) {
        JsonNode renewable = node.get("renewablePercentage");
        if (renewable != null && renewable.isNumber()) {
            return clampPercent(renewable.asDouble());
        }
        JsonNode fossil = node.get("fossilFuelPercentage");
        if (fossil != null && fossil.isNumber()) {
            return clampPercent(100.0 - fossil.asDouble());
        }
        return 0.0;
    }

    private static double clampPercent(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }

    private static Instant parseInstant(String region, String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new CollaboratorFetchException(region, "parse timestamp", "invalid datetime '" + value + "'", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
