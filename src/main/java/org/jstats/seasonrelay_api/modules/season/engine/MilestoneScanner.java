package org.jstats.seasonrelay_api.modules.season.engine;

import org.jspecify.annotations.NullMarked;
import org.jstats.seasonrelay_api.modules.season.model.Milestone;
import org.jstats.seasonrelay_api.modules.season.model.PhaseInterval;
import org.jstats.seasonrelay_api.modules.season.model.SeasonDefinition;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds phase boundaries strictly after a date, within a single season.
 * <p>
 * Boundaries are visited in the order start0, end0, start1, end1, ... which is already
 * chronological because phases are sorted and never overlap. A one-day phase yields its start
 * before its end.
 */
@Component
@NullMarked
public class MilestoneScanner {

    public Optional<Milestone> nextMilestone(SeasonDefinition definition, LocalDate date) {
        var upcoming = upcomingMilestones(definition, date, 1);
        return upcoming.isEmpty() ? Optional.empty() : Optional.of(upcoming.get(0));
    }

    /**
     * Up to {@code limit} boundaries after {@code date}, soonest first.
     *
     * @throws IllegalArgumentException if {@code limit} is not positive
     */
    public List<Milestone> upcomingMilestones(SeasonDefinition definition, LocalDate date, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, was " + limit);
        }
        var result = new ArrayList<Milestone>(Math.min(limit, definition.phases().size() * 2));
        for (PhaseInterval phase : definition.phases()) {
            if (phase.start().isAfter(date)) {
                result.add(milestone(definition, phase, Milestone.Boundary.START, phase.start(), date));
                if (result.size() == limit) {
                    break;
                }
            }
            if (phase.end().isAfter(date)) {
                result.add(milestone(definition, phase, Milestone.Boundary.END, phase.end(), date));
                if (result.size() == limit) {
                    break;
                }
            }
        }
        return List.copyOf(result);
    }

    private static Milestone milestone(SeasonDefinition definition, PhaseInterval phase,
                                       Milestone.Boundary boundary, LocalDate at, LocalDate from) {
        return new Milestone(definition.year(), phase, boundary, at, ChronoUnit.DAYS.between(from, at));
    }
}
