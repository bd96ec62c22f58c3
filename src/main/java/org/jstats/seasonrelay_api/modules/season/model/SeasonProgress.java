package org.jstats.seasonrelay_api.modules.season.model;

import org.jspecify.annotations.Nullable;

/**
 * How far a date is through a season.
 *
 * @param percentComplete      share of the season elapsed, 0..100 with one decimal
 * @param daysElapsed          days since the season started, 0 before the start
 * @param totalDays            season length in days, counting both bounds
 * @param daysRemaining        days left until the season end, 0 after it
 * @param phasePercentComplete share of the current phase elapsed, only when inside a phase
 */
public record SeasonProgress(
        double percentComplete,
        long daysElapsed,
        long totalDays,
        long daysRemaining,
        @Nullable Double phasePercentComplete
) {}
