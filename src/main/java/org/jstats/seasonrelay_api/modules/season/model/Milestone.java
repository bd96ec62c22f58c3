package org.jstats.seasonrelay_api.modules.season.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.NullMarked;

import java.time.LocalDate;

/**
 * A phase boundary strictly after some reference date.
 *
 * @param seasonYear the season the boundary belongs to
 * @param daysUntil  calendar days from the reference date to {@code date}, always positive
 */
@NullMarked
public record Milestone(
        int seasonYear,
        PhaseInterval phase,
        Boundary boundary,
        LocalDate date,
        long daysUntil
) {

    public enum Boundary {
        START("start"),
        END("end");

        private final String code;

        Boundary(String code) {
            this.code = code;
        }

        @JsonValue
        public String code() {
            return code;
        }
    }

    @JsonProperty("label")
    public String label() {
        return phase.name().code() + " " + boundary.code();
    }
}
