package org.jstats.seasonrelay_api.modules.season.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TransitionState {
    ACTIVE("active"),
    ENDING_SOON("ending_soon"),
    OFFSEASON("offseason"),
    UPCOMING("upcoming");

    private final String code;

    TransitionState(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
