/* (C)2026 */
package com.ammann.carbon.source;

import com.ammann.carbon.exception.CollaboratorFetchException;
import com.ammann.carbon.model.CurrentIntensity;
import com.ammann.carbon.model.GreenHoursForecast;
import com.ammann.carbon.model.HistoricalSample;
import java.time.Instant;
import java.util.List;

/**
 * Provider of grid carbon-intensity data for a region.
 *
 * <p>Implementations may block on network I/O. Every failure is reported as a
 * {@link CollaboratorFetchException}.
 */
public interface CarbonDataSource {

    /**
     * Fetches historical samples in {@code [start, end]}.
     *
     * @return samples in ascending timestamp order; callers do not re-sort
     * @throws CollaboratorFetchException if the provider cannot deliver the history
     */
    List<HistoricalSample> fetchHistoricalSamples(String region, Instant start, Instant end);

    /**
     * Fetches the latest reading for {@code region}.
     *
     * @throws CollaboratorFetchException if the provider cannot deliver the reading
     */
    CurrentIntensity fetchCurrentIntensity(String region);

    /**
     * Fetches the provider's green-hours forecast over the next {@code hours} hours.
     *
     * @throws CollaboratorFetchException if the provider cannot deliver the forecast
     */
    GreenHoursForecast fetchGreenHoursForecast(String region, int hours);
}
