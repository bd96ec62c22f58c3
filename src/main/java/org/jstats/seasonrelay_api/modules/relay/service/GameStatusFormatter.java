package org.jstats.seasonrelay_api.modules.relay.service;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Turns upstream game status into the short strings shown next to a score: {@code F}, {@code H},
 * {@code Q3}, {@code 2OT}, {@code F/OT}, ...
 */
@Component
public class GameStatusFormatter {

    private static final int REGULATION_PERIODS = 4;

    private static final Map<String, String> DIRECT = Map.of(
            "STATUS_SCHEDULED", "Scheduled",
            "STATUS_IN_PROGRESS", "Live",
            "STATUS_HALFTIME", "H",
            "STATUS_FINAL", "F",
            "STATUS_FINAL_OVERTIME", "F/OT",
            "STATUS_POSTPONED", "Postponed",
            "STATUS_CANCELLED", "Cancelled",
            "STATUS_SUSPENDED", "Suspended"
    );

    public String format(String statusName, String description, Integer period) {
        var name = statusName == null ? "" : statusName;
        var desc = description == null ? "" : description;

        // overtime first: period 5 is OT, 6 is 2OT, ...
        if (period != null && period > REGULATION_PERIODS) {
            var ot = overtime(period - REGULATION_PERIODS);
            return "STATUS_FINAL".equals(name) ? "F/" + ot : ot;
        }

        var direct = DIRECT.get(name);
        if (direct != null) {
            return direct;
        }

        if (desc.contains("Q")) {
            var words = desc.trim().split("\\s+");
            var last = words[words.length - 1];
            if (last.startsWith("Q")) {
                return last;
            }
        }

        var upper = desc.toUpperCase(Locale.ROOT);
        if (upper.contains("HALF")) {
            return "H";
        }
        if (upper.contains("FINAL")) {
            return "F";
        }
        if (upper.contains("LIVE") || upper.contains("IN PROGRESS")) {
            return "Live";
        }
        if (!desc.isEmpty()) {
            return desc;
        }
        return name.isEmpty() ? "Unknown" : name;
    }

    private static String overtime(int extraPeriods) {
        return extraPeriods == 1 ? "OT" : extraPeriods + "OT";
    }
}
