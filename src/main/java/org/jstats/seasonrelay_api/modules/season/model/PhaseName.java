package org.jstats.seasonrelay_api.modules.season.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of season phase names. Phases only carry a name and dates; nothing here knows the
 * rules of a particular sport.
 */
public enum PhaseName {
    PRE_SEASON("pre-season", "Pre-Season", true),
    REGULAR_SEASON("regular-season", "Regular Season", true),
    MID_SEASON_EVENT("mid-season-event", "Mid-Season Event", false),
    ALL_STAR_BREAK("all-star-break", "All-Star Break", false),
    PLAYOFFS("playoffs", "Playoffs", true),
    OFFSEASON("offseason", "Offseason", false);

    private final String code;
    private final String label;
    private final boolean weekNumberedByDefault;

    PhaseName(String code, String label, boolean weekNumberedByDefault) {
        this.code = code;
        this.label = label;
        this.weekNumberedByDefault = weekNumberedByDefault;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    /** Week numbering used when a catalog entry does not say. */
    public boolean weekNumberedByDefault() {
        return weekNumberedByDefault;
    }

    /**
     * Parses a phase code such as {@code regular-season}. Underscores and case are tolerated.
     *
     * @throws InvalidSeasonConfigException if the code is unknown
     */
    @JsonCreator
    public static PhaseName fromCode(String code) {
        if (code != null) {
            var normalized = code.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (PhaseName name : values()) {
                if (name.code.equals(normalized)) {
                    return name;
                }
            }
        }
        throw new InvalidSeasonConfigException("Unknown phase name: " + code);
    }
}
