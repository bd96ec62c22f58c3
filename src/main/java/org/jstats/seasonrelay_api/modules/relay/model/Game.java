package org.jstats.seasonrelay_api.modules.relay.model;

import org.jspecify.annotations.Nullable;

/**
 * One game as the relay republishes it. Scores are only set once the upstream reports numeric
 * scores; records are the teams' "W-L" summaries when known.
 */
public record Game(
        @Nullable String id,
        String awayTeam,
        String homeTeam,
        @Nullable Integer awayScore,
        @Nullable Integer homeScore,
        String status,
        @Nullable String awayRecord,
        @Nullable String homeRecord,
        @Nullable String startTime
) {

    public boolean scored() {
        return awayScore != null && homeScore != null;
    }
}
