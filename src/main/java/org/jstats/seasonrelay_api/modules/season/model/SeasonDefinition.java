package org.jstats.seasonrelay_api.modules.season.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jspecify.annotations.NullMarked;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One season of one sport: an ordered list of non-overlapping phase intervals.
 * <p>
 * Instances are validated on construction and immutable afterwards. Gaps between phases are
 * allowed, touching phases are allowed, overlapping phases are not. Key dates are informational
 * and must fall inside the season.
 */
@NullMarked
public record SeasonDefinition(
        Sport sport,
        int year,
        String displayName,
        List<PhaseInterval> phases,
        List<KeyDate> keyDates
) {

    public SeasonDefinition(Sport sport, int year, String displayName, List<PhaseInterval> phases) {
        this(sport, year, displayName, phases, List.of());
    }

    public SeasonDefinition {
        if (sport == null) {
            throw new InvalidSeasonConfigException("Season sport is required");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = sport.name() + " " + year;
        }
        if (phases == null || phases.isEmpty()) {
            throw new InvalidSeasonConfigException(
                    "Season %s %d has no phases".formatted(sport.code(), year));
        }
        for (PhaseInterval phase : phases) {
            if (phase == null) {
                throw new InvalidSeasonConfigException(
                        "Season %s %d contains a null phase".formatted(sport.code(), year));
            }
        }
        phases = List.copyOf(phases);
        for (int i = 1; i < phases.size(); i++) {
            var previous = phases.get(i - 1);
            var current = phases.get(i);
            if (current.start().isBefore(previous.start())) {
                throw new InvalidSeasonConfigException("Season %s %d phases are not ordered by start date: %s before %s"
                        .formatted(sport.code(), year, previous, current));
            }
            if (current.overlaps(previous)) {
                throw new InvalidSeasonConfigException("Season %s %d phases overlap: %s and %s"
                        .formatted(sport.code(), year, previous, current));
            }
        }

        var seasonStart = phases.get(0).start();
        var seasonEnd = phases.get(phases.size() - 1).end();
        var dates = new ArrayList<KeyDate>(keyDates == null ? List.of() : keyDates);
        for (KeyDate keyDate : dates) {
            if (keyDate == null) {
                throw new InvalidSeasonConfigException(
                        "Season %s %d contains a null key date".formatted(sport.code(), year));
            }
            if (keyDate.start().isBefore(seasonStart) || keyDate.end().isAfter(seasonEnd)) {
                throw new InvalidSeasonConfigException("Season %s %d key date %s lies outside %s .. %s"
                        .formatted(sport.code(), year, keyDate, seasonStart, seasonEnd));
            }
        }
        dates.sort(Comparator.comparing(KeyDate::start));
        keyDates = List.copyOf(dates);
    }

    public static SeasonDefinition of(Sport sport, int year, List<PhaseInterval> phases) {
        return new SeasonDefinition(sport, year, null, phases);
    }

    @JsonIgnore
    public PhaseInterval firstPhase() {
        return phases.get(0);
    }

    @JsonIgnore
    public PhaseInterval lastPhase() {
        return phases.get(phases.size() - 1);
    }

    public LocalDate seasonStart() {
        return firstPhase().start();
    }

    public LocalDate seasonEnd() {
        return lastPhase().end();
    }

    public boolean isLast(PhaseInterval phase) {
        return lastPhase().equals(phase);
    }
}
