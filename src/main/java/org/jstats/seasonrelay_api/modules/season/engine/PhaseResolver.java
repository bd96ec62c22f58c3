package org.jstats.seasonrelay_api.modules.season.engine;

import org.jspecify.annotations.NullMarked;
import org.jstats.seasonrelay_api.modules.season.model.PhaseInterval;
import org.jstats.seasonrelay_api.modules.season.model.PhaseResolution;
import org.jstats.seasonrelay_api.modules.season.model.SeasonDefinition;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Classifies a date against a season's phases. Stateless; every date is valid input.
 */
@Component
@NullMarked
public class PhaseResolver {

    public PhaseResolution resolve(SeasonDefinition definition, LocalDate date) {
        var phases = definition.phases();
        var first = definition.firstPhase();
        if (date.isBefore(first.start())) {
            return PhaseResolution.beforeSeason(first, date);
        }
        var last = definition.lastPhase();
        if (date.isAfter(last.end())) {
            return PhaseResolution.afterSeason(last, date);
        }

        int idx = lastStartingOnOrBefore(phases, date);
        var candidate = phases.get(idx);
        if (candidate.contains(date)) {
            return PhaseResolution.inPhase(candidate, date, WeekCalculator.weekOf(candidate, date).orElse(null));
        }
        // date sits after candidate.end and before the next start
        return PhaseResolution.betweenPhases(candidate, phases.get(idx + 1), date);
    }

    // phases are sorted by start and date >= phases[0].start here, so the result is always >= 0
    private static int lastStartingOnOrBefore(List<PhaseInterval> phases, LocalDate date) {
        int lo = 0;
        int hi = phases.size() - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (phases.get(mid).start().isAfter(date)) {
                hi = mid - 1;
            } else {
                lo = mid;
            }
        }
        return lo;
    }
}
