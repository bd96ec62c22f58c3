package org.jstats.seasonrelay_api.modules.relay.model;

public record StandingsEntry(
        String team,
        String abbreviation,
        int wins,
        int losses,
        double gamesBehind,
        String conference
) {}
