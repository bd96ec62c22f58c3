package org.jstats.seasonrelay_api.modules.season.monitor;

import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;
import org.jstats.seasonrelay_api.modules.season.model.Sport;

import java.time.Instant;

/**
 * One detected change in a sport's season state.
 *
 * @param phase the phase the change happened in; only set for week changes
 */
public record SeasonAlert(
        String id,
        Sport sport,
        ChangeType type,
        int seasonYear,
        @Nullable String phase,
        String from,
        String to,
        String message,
        Instant timestamp
) {

    public enum ChangeType {
        SEASON_CHANGE("season_change"),
        PHASE_CHANGE("phase_change"),
        WEEK_CHANGE("week_change");

        private final String code;

        ChangeType(String code) {
            this.code = code;
        }

        @JsonValue
        public String code() {
            return code;
        }
    }
}
