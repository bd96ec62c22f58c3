package org.jstats.seasonrelay_api.modules.relay.model;

import org.jspecify.annotations.Nullable;

/**
 * Season information attached to every relay response.
 *
 * @param phase      phase code or placement code, e.g. {@code regular-season} or {@code between-phases}
 * @param phaseLabel human label, e.g. "Regular Season"
 * @param week       week within the phase, only for week-numbered phases
 */
public record SeasonContext(
        int seasonYear,
        String seasonName,
        String phase,
        String phaseLabel,
        @Nullable Integer week
) {}
