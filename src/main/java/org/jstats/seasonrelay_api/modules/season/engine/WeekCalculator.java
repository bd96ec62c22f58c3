package org.jstats.seasonrelay_api.modules.season.engine;

import org.jspecify.annotations.NullMarked;
import org.jstats.seasonrelay_api.modules.season.model.PhaseInterval;
import org.jstats.seasonrelay_api.modules.season.model.SeasonDefinition;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * 1-based week number within a week-numbered phase: {@code floor(daysIntoPhase / 7) + 1}.
 * Empty for phases without week numbering and for dates outside every phase.
 */
@Component
@NullMarked
public class WeekCalculator {

    private final PhaseResolver resolver;

    public WeekCalculator(PhaseResolver resolver) {
        this.resolver = resolver;
    }

    public Optional<Integer> weekOf(SeasonDefinition definition, LocalDate date) {
        return resolver.resolve(definition, date).weekNumber();
    }

    public static Optional<Integer> weekOf(PhaseInterval phase, LocalDate date) {
        if (!phase.weekNumbered() || !phase.contains(date)) {
            return Optional.empty();
        }
        long daysInto = ChronoUnit.DAYS.between(phase.start(), date);
        return Optional.of((int) (daysInto / 7) + 1);
    }
}
