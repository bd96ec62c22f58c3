package org.jstats.seasonrelay_api.modules.season.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Sports the relay knows about. The lowercase code is used on the wire, in the season
 * catalog and in upstream URLs.
 */
public enum Sport {
    WNBA("wnba"),
    NBA("nba"),
    NHL("nhl"),
    MLB("mlb"),
    NFL("nfl");

    private final String code;

    Sport(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Parses a sport code, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException if the code is blank or unknown
     */
    @JsonCreator
    public static Sport fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Sport code is required");
        }
        var normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Sport sport : values()) {
            if (sport.code.equals(normalized)) {
                return sport;
            }
        }
        throw new IllegalArgumentException("Unknown sport: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
