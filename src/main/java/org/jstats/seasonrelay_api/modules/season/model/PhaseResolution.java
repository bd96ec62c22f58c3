package org.jstats.seasonrelay_api.modules.season.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Where a date falls relative to a season's phases.
 * <p>
 * Exactly one placement applies to any date. {@code phase}, {@code daysIntoPhase} and
 * {@code daysRemainingInPhase} are only set for {@link Placement#IN_PHASE}; {@code week} is only
 * set when the matched phase is week-numbered.
 */
@NullMarked
public record PhaseResolution(
        Placement placement,
        LocalDate date,
        @Nullable PhaseInterval phase,
        @Nullable PhaseInterval previous,
        @Nullable PhaseInterval next,
        @Nullable Integer week,
        @Nullable Long daysIntoPhase,
        @Nullable Long daysRemainingInPhase
) {

    public enum Placement {
        IN_PHASE("in-phase"),
        BEFORE_SEASON("before-season"),
        BETWEEN_PHASES("between-phases"),
        AFTER_SEASON("after-season");

        private final String code;

        Placement(String code) {
            this.code = code;
        }

        @JsonValue
        public String code() {
            return code;
        }
    }

    public static PhaseResolution inPhase(PhaseInterval phase, LocalDate date, @Nullable Integer week) {
        return new PhaseResolution(Placement.IN_PHASE, date, phase, null, null, week,
                ChronoUnit.DAYS.between(phase.start(), date),
                ChronoUnit.DAYS.between(date, phase.end()));
    }

    public static PhaseResolution beforeSeason(PhaseInterval first, LocalDate date) {
        return new PhaseResolution(Placement.BEFORE_SEASON, date, null, null, first, null, null, null);
    }

    public static PhaseResolution betweenPhases(PhaseInterval previous, PhaseInterval next, LocalDate date) {
        return new PhaseResolution(Placement.BETWEEN_PHASES, date, null, previous, next, null, null, null);
    }

    public static PhaseResolution afterSeason(PhaseInterval last, LocalDate date) {
        return new PhaseResolution(Placement.AFTER_SEASON, date, null, last, null, null, null, null);
    }

    public boolean inPhase() {
        return placement == Placement.IN_PHASE;
    }

    public Optional<Integer> weekNumber() {
        return Optional.ofNullable(week);
    }

    /** Machine label: the phase code when inside a phase, otherwise the placement code. */
    @JsonProperty("label")
    public String label() {
        if (placement == Placement.IN_PHASE && phase != null) {
            return phase.name().code();
        }
        return placement.code();
    }

    @JsonProperty("description")
    public String describe() {
        return switch (placement) {
            case IN_PHASE -> phase == null ? "In Phase" : phase.name().label();
            case BEFORE_SEASON -> next == null ? "Before Season" : "Before Season (" + next.name().label() + " starts " + next.start() + ")";
            case BETWEEN_PHASES -> previous == null || next == null
                    ? "Between Phases"
                    : "Between " + previous.name().label() + " and " + next.name().label();
            case AFTER_SEASON -> "After Season";
        };
    }
}
