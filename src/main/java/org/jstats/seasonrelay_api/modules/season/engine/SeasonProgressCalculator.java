package org.jstats.seasonrelay_api.modules.season.engine;

import org.jspecify.annotations.NullMarked;
import org.jstats.seasonrelay_api.modules.season.model.PhaseInterval;
import org.jstats.seasonrelay_api.modules.season.model.SeasonDefinition;
import org.jstats.seasonrelay_api.modules.season.model.SeasonProgress;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

@Component
@NullMarked
public class SeasonProgressCalculator {

    private final PhaseResolver resolver;

    public SeasonProgressCalculator(PhaseResolver resolver) {
        this.resolver = resolver;
    }

    public SeasonProgress progress(SeasonDefinition definition, LocalDate date) {
        var start = definition.seasonStart();
        var end = definition.seasonEnd();
        long totalDays = ChronoUnit.DAYS.between(start, end) + 1;

        long elapsed = clamp(ChronoUnit.DAYS.between(start, date), 0, totalDays);
        long remaining = clamp(ChronoUnit.DAYS.between(date, end), 0, totalDays);
        double percent = date.isAfter(end) ? 100.0 : percent(elapsed, totalDays);

        var resolution = resolver.resolve(definition, date);
        Double phasePercent = null;
        if (resolution.inPhase() && resolution.phase() != null) {
            phasePercent = phasePercent(resolution.phase(), date);
        }
        return new SeasonProgress(percent, elapsed, totalDays, remaining, phasePercent);
    }

    private static double phasePercent(PhaseInterval phase, LocalDate date) {
        return percent(ChronoUnit.DAYS.between(phase.start(), date), phase.lengthInDays());
    }

    // one decimal, 0..100
    private static double percent(long part, long whole) {
        if (whole <= 0) {
            return 0.0;
        }
        double raw = Math.min(100.0, Math.max(0.0, part * 100.0 / whole));
        return Math.round(raw * 10.0) / 10.0;
    }

    private static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }
}
