package org.jstats.seasonrelay_api.modules.season.monitor;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under {@code relay.monitor}. The check timings ({@code interval}, {@code initial-delay})
 * are read by {@link SeasonChangeMonitor#scheduledCheck()} straight from the environment.
 */
@ConfigurationProperties(prefix = "relay.monitor")
public record MonitorProperties(
        Boolean enabled,
        Integer historySize
) {
    public MonitorProperties {
        if (enabled == null) enabled = Boolean.TRUE;
        if (historySize == null || historySize < 1) historySize = 100;
    }
}
