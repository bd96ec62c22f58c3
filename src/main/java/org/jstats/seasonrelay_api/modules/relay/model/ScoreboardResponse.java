package org.jstats.seasonrelay_api.modules.relay.model;

import org.jstats.seasonrelay_api.modules.season.model.Sport;

import java.time.LocalDate;
import java.util.List;

/** Scores or schedule of one sport on one date. */
public record ScoreboardResponse(
        Sport sport,
        LocalDate date,
        List<Game> games,
        SeasonContext season
) {}
