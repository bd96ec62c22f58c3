package org.jstats.seasonrelay_api.modules.relay.model;

import org.jspecify.annotations.Nullable;
import org.jstats.seasonrelay_api.modules.season.model.Sport;

import java.util.List;
import java.util.Map;

/**
 * Standings grouped by conference (insertion order kept), or as one league-wide table when
 * {@code group} is {@link StandingsGroup#LEAGUE}.
 */
public record StandingsResponse(
        Sport sport,
        StandingsGroup group,
        @Nullable Map<String, List<StandingsEntry>> conferences,
        @Nullable List<StandingsEntry> leagueWide,
        SeasonContext season
) {}
