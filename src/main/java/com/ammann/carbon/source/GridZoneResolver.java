/* (C)2026 */
package com.ammann.carbon.source;

import java.util.Locale;
import java.util.Map;

/**
 * Maps free-text locations (cities, country names) to Electricity Maps grid zones.
 *
 * <p>Values that are not in the table are treated as zone codes and returned upper-cased.
 */
public final class GridZoneResolver {

    private static final Map<String, String> ZONES = Map.ofEntries(
            Map.entry("berlin", "DE"),
            Map.entry("germany", "DE"),
            Map.entry("deutschland", "DE"),
            Map.entry("paris", "FR"),
            Map.entry("france", "FR"),
            Map.entry("london", "GB"),
            Map.entry("uk", "GB"),
            Map.entry("britain", "GB"),
            Map.entry("england", "GB"),
            Map.entry("madrid", "ES"),
            Map.entry("spain", "ES"),
            Map.entry("rome", "IT"),
            Map.entry("italy", "IT"),
            Map.entry("amsterdam", "NL"),
            Map.entry("netherlands", "NL"),
            Map.entry("vienna", "AT"),
            Map.entry("austria", "AT"),
            Map.entry("stockholm", "SE"),
            Map.entry("sweden", "SE"),
            Map.entry("oslo", "NO"),
            Map.entry("norway", "NO"),
            Map.entry("copenhagen", "DK"),
            Map.entry("denmark", "DK"),
            Map.entry("helsinki", "FI"),
            Map.entry("finland", "FI"),
            Map.entry("brussels", "BE"),
            Map.entry("belgium", "BE"),
            Map.entry("zurich", "CH"),
            Map.entry("switzerland", "CH"),
            Map.entry("dublin", "IE"),
            Map.entry("ireland", "IE"),
            Map.entry("lisbon", "PT"),
            Map.entry("portugal", "PT"),
            Map.entry("warsaw", "PL"),
            Map.entry("poland", "PL"),
            Map.entry("prague", "CZ"),
            Map.entry("czech", "CZ"),
            Map.entry("budapest", "HU"),
            Map.entry("hungary", "HU"),
            Map.entry("bucharest", "RO"),
            Map.entry("romania", "RO"),
            Map.entry("sofia", "BG"),
            Map.entry("bulgaria", "BG"),
            Map.entry("athens", "GR"),
            Map.entry("greece", "GR"),
            Map.entry("new york", "US-NY"),
            Map.entry("california", "US-CA"),
            Map.entry("texas", "US-TEX"),
            Map.entry("florida", "US-FLA"),
            Map.entry("toronto", "CA-ON"),
            Map.entry("vancouver", "CA-BC"),
            Map.entry("sydney", "AU-NSW"),
            Map.entry("melbourne", "AU-VIC"),
            Map.entry("tokyo", "JP"),
            Map.entry("japan", "JP"));

    private GridZoneResolver() {}

    public static String resolve(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location must not be blank");
        }
        String normalized = location.trim().toLowerCase(Locale.ROOT);
        return ZONES.getOrDefault(normalized, location.trim().toUpperCase(Locale.ROOT));
    }
}
