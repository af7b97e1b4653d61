/* (C)2026 */
package com.ammann.carbon.service;

import com.ammann.carbon.dto.CarbonTrendDTO;
import com.ammann.carbon.enumeration.TrendDirection;
import com.ammann.carbon.enumeration.TrendPeriod;
import com.ammann.carbon.model.HistoricalSample;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives trend information from an ordered sample set.
 *
 * <p>The trend slope is an ordinary least-squares fit of intensity against the sample
 * <em>index</em>, not elapsed time. Irregularly spaced samples therefore distort the slope;
 * the data source is not required to deliver uniform spacing.
 */
@ApplicationScoped
public class TrendAnalyzer {

    /** Slopes (g CO2/kWh per sample) below this magnitude count as stable. */
    static final double STABLE_SLOPE_THRESHOLD = 0.1;

    /** Upper bound of {@link #trendConfidence(List, int)}. */
    static final double MAX_TREND_CONFIDENCE = 0.8;

    static final int EXTREME_HOURS = 3;
    static final int MAX_EMBEDDED_DATA_POINTS = 24;

    public static final String WEEKDAY_AVERAGE = "weekday_average";
    public static final String WEEKEND_AVERAGE = "weekend_average";

    public TrendDirection trendDirection(List<HistoricalSample> samples) {
        if (samples == null || samples.size() < 2) {
            return TrendDirection.STABLE;
        }

        double slope = slope(samples);
        if (Math.abs(slope) < STABLE_SLOPE_THRESHOLD) {
            return TrendDirection.STABLE;
        }
        return slope < 0 ? TrendDirection.IMPROVING : TrendDirection.WORSENING;
    }

    /**
     * Conservative proxy for the reliability of the trend: {@code min(n / (4 * minPoints), 1) * 0.8}.
     * It ignores how well the regression actually fits.
     */
    public double trendConfidence(List<HistoricalSample> samples, int minPoints) {
        int count = samples == null ? 0 : samples.size();
        if (count < minPoints || minPoints <= 0) {
            return 0.0;
        }
        double dataFactor = Math.min((double) count / (minPoints * 4.0), 1.0);
        return dataFactor * MAX_TREND_CONFIDENCE;
    }

    /**
     * Least-squares slope of intensity over sample index. Requires at least two samples.
     */
    static double slope(List<HistoricalSample> samples) {
        double n = samples.size();
        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;

        for (int i = 0; i < samples.size(); i++) {
            double x = i;
            double y = samples.get(i).carbonIntensity();
            sumX += x;
            sumY += y;
            sumXY += x * y;
            sumX2 += x * x;
        }

        return (n * sumXY - sumX * sumY) / (n * sumX2 - sumX * sumX);
    }

    /**
     * Builds a trend report over {@code samples}.
     *
     * @param location requested location
     * @param period   reporting period
     * @param samples  samples in ascending time order
     * @param start    start of the analysed window
     * @param end      end of the analysed window
     * @param zone     zone used for hour-of-day and weekday
     * @return the report; statistics are zero when {@code samples} is empty
     */
    public CarbonTrendDTO buildTrendReport(
            String location,
            TrendPeriod period,
            List<HistoricalSample> samples,
            Instant start,
            Instant end,
            ZoneId zone) {
        if (samples == null || samples.isEmpty()) {
            return new CarbonTrendDTO(location, period, start, end, 0, 0.0, 0.0, 0.0, 0.0,
                    List.of(), List.of(), Map.of(), null);
        }

        double sum = 0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        double weekdaySum = 0, weekendSum = 0;
        int weekdayCount = 0, weekendCount = 0;
        Map<Integer, double[]> hourly = new TreeMap<>();

        for (HistoricalSample sample : samples) {
            double value = sample.carbonIntensity();
            sum += value;
            min = Math.min(min, value);
            max = Math.max(max, value);

            ZonedDateTime local = sample.timestamp().atZone(zone);
            double[] acc = hourly.computeIfAbsent(local.getHour(), h -> new double[2]);
            acc[0] += value;
            acc[1]++;

            if (isWeekend(local.getDayOfWeek())) {
                weekendSum += value;
                weekendCount++;
            } else {
                weekdaySum += value;
                weekdayCount++;
            }
        }

        double average = sum / samples.size();
        double varianceSum = 0;
        for (HistoricalSample sample : samples) {
            double diff = sample.carbonIntensity() - average;
            varianceSum += diff * diff;
        }
        double stdDeviation = Math.sqrt(varianceSum / samples.size());

        // TreeMap iteration gives hour order, so the stable sorts break ties by hour
        List<Map.Entry<Integer, Double>> ascending = new ArrayList<>();
        hourly.forEach((hour, acc) -> ascending.add(Map.entry(hour, acc[0] / acc[1])));
        List<Map.Entry<Integer, Double>> descending = new ArrayList<>(ascending);
        ascending.sort(Map.Entry.comparingByValue());
        descending.sort(Map.Entry.<Integer, Double>comparingByValue().reversed());

        List<Integer> cleanest = new ArrayList<>();
        List<Integer> dirtiest = new ArrayList<>();
        if (ascending.size() >= EXTREME_HOURS) {
            for (int i = 0; i < EXTREME_HOURS; i++) {
                cleanest.add(ascending.get(i).getKey());
                dirtiest.add(descending.get(i).getKey());
            }
        }

        Map<String, Double> weekdayVsWeekend = new LinkedHashMap<>();
        if (weekdayCount > 0) {
            weekdayVsWeekend.put(WEEKDAY_AVERAGE, weekdaySum / weekdayCount);
        }
        if (weekendCount > 0) {
            weekdayVsWeekend.put(WEEKEND_AVERAGE, weekendSum / weekendCount);
        }

        List<HistoricalSample> dataPoints =
                period == TrendPeriod.DAILY && samples.size() <= MAX_EMBEDDED_DATA_POINTS
                        ? List.copyOf(samples)
                        : null;

        return new CarbonTrendDTO(
                location,
                period,
                start,
                end,
                samples.size(),
                average,
                min,
                max,
                stdDeviation,
                List.copyOf(cleanest),
                List.copyOf(dirtiest),
                weekdayVsWeekend,
                dataPoints);
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
