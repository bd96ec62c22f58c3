package org.jstats.seasonrelay_api.modules.relay.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StandingsGroup {
    CONFERENCE("conference"),
    LEAGUE("league");

    private final String code;

    StandingsGroup(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * @throws IllegalArgumentException for anything but {@code conference} or {@code league}
     */
    public static StandingsGroup fromCode(String code) {
        if (code != null) {
            var normalized = code.trim().toLowerCase(Locale.ROOT);
            for (StandingsGroup g : values()) {
                if (g.code.equals(normalized)) {
                    return g;
                }
            }
        }
        throw new IllegalArgumentException("group must be 'conference' or 'league', was '" + code + "'");
    }
}
