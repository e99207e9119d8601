package com.waypoint.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * Maps a set of source countries to a preferred region and a fallback. Country codes are
 * normalised to upper case, so matching is case-insensitive.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeoRoutingRule(
        @JsonProperty(value = "source_country", required = true) List<String> sourceCountries,
        @JsonProperty(value = "target_region", required = true) String targetRegionId,
        @JsonProperty("fallback_region") String fallbackRegionId
) {
    public GeoRoutingRule {
        sourceCountries = sourceCountries == null
                ? List.of()
                : sourceCountries.stream()
                        .filter(c -> c != null && !c.isBlank())
                        .map(c -> c.trim().toUpperCase(Locale.ROOT))
                        .toList();
    }

    public boolean matches(String sourceCountry) {
        if (sourceCountry == null || sourceCountry.isBlank()) return false;
        return sourceCountries.contains(sourceCountry.trim().toUpperCase(Locale.ROOT));
    }
}
