package org.jstats.seasonrelay_api.modules.season.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * @param location                catalog resource, any Spring resource string
 * @param zone                    zone used to turn "now" into today's date
 * @param transitionThresholdDays default window for ending-soon and upcoming states
 */
@ConfigurationProperties(prefix = "relay.seasons")
public record SeasonProperties(
        String location,
        String zone,
        Integer transitionThresholdDays
) {

    public SeasonProperties {
        if (location == null || location.isBlank()) location = "classpath:seasons.json";
        if (zone == null || zone.isBlank()) zone = "America/New_York";
        if (transitionThresholdDays == null) transitionThresholdDays = 14;
        if (transitionThresholdDays < 0) {
            throw new IllegalArgumentException("relay.seasons.transition-threshold-days must not be negative");
        }
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
