package org.jstats.seasonrelay_api.modules.season.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

/**
 * Everything the season engine can say about one date in one season.
 */
public record SeasonSnapshot(
        Sport sport,
        int seasonYear,
        String seasonName,
        LocalDate date,
        PhaseResolution resolution,
        @Nullable Integer week,
        @Nullable Milestone nextMilestone,
        TransitionState transition,
        int thresholdDays,
        SeasonProgress progress
) {}
