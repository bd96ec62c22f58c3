package org.jstats.seasonrelay_api.modules.season.model;

import org.jspecify.annotations.NullMarked;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * A named, date-bounded segment of a season. Both bounds are inclusive calendar dates.
 *
 * @param name          phase name
 * @param start         first day of the phase
 * @param end           last day of the phase, never before {@code start}
 * @param weekNumbered  whether dates inside this phase get a week number
 */
@NullMarked
public record PhaseInterval(
        PhaseName name,
        LocalDate start,
        LocalDate end,
        boolean weekNumbered
) {

    public PhaseInterval {
        if (name == null) {
            throw new InvalidSeasonConfigException("Phase name is required");
        }
        if (start == null || end == null) {
            throw new InvalidSeasonConfigException("Phase " + name.code() + " needs both a start and an end date");
        }
        if (start.isAfter(end)) {
            throw new InvalidSeasonConfigException(
                    "Phase %s starts after it ends (%s > %s)".formatted(name.code(), start, end));
        }
    }

    public static PhaseInterval of(PhaseName name, LocalDate start, LocalDate end) {
        return new PhaseInterval(name, start, end, name.weekNumberedByDefault());
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    /** Closed-range intersection test. Adjacent intervals do not overlap. */
    public boolean overlaps(PhaseInterval other) {
        return !start.isAfter(other.end) && !other.start.isAfter(end);
    }

    /** Number of calendar days covered, counting both bounds. */
    public long lengthInDays() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    @Override
    public String toString() {
        return name.code() + " [" + start + " .. " + end + "]";
    }
}
