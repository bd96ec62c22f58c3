package org.jstats.seasonrelay_api.modules.season.engine;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.seasonrelay_api.modules.season.model.SeasonDefinition;
import org.jstats.seasonrelay_api.modules.season.model.TransitionState;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Derives the cross-season state of a sport on a date from the current season and, optionally,
 * the next registered one.
 */
@Component
@NullMarked
public class TransitionDetector {

    private final PhaseResolver resolver;

    public TransitionDetector(PhaseResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @param thresholdDays how close (in days) a season end or start must be to count as
     *                      ending soon or upcoming; must not be negative
     */
    public TransitionState transitionState(SeasonDefinition current, @Nullable SeasonDefinition next,
                                           LocalDate date, int thresholdDays) {
        if (thresholdDays < 0) {
            throw new IllegalArgumentException("thresholdDays must not be negative, was " + thresholdDays);
        }
        var resolution = resolver.resolve(current, date);
        return switch (resolution.placement()) {
            case IN_PHASE -> current.isLast(resolution.phase())
                    && resolution.daysRemainingInPhase() != null
                    && resolution.daysRemainingInPhase() <= thresholdDays
                    ? TransitionState.ENDING_SOON
                    : TransitionState.ACTIVE;
            case BETWEEN_PHASES -> TransitionState.ACTIVE;
            case BEFORE_SEASON -> daysUntil(date, current.seasonStart()) <= thresholdDays
                    ? TransitionState.UPCOMING
                    : TransitionState.OFFSEASON;
            case AFTER_SEASON -> afterSeason(next, date, thresholdDays);
        };
    }

    private TransitionState afterSeason(@Nullable SeasonDefinition next, LocalDate date, int thresholdDays) {
        if (next == null) {
            return TransitionState.OFFSEASON;
        }
        long untilNext = daysUntil(date, next.seasonStart());
        if (untilNext <= 0) {
            return transitionState(next, null, date, thresholdDays);
        }
        return untilNext <= thresholdDays ? TransitionState.UPCOMING : TransitionState.OFFSEASON;
    }

    private static long daysUntil(LocalDate from, LocalDate to) {
        return ChronoUnit.DAYS.between(from, to);
    }
}
