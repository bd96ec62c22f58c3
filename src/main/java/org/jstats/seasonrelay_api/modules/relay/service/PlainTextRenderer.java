package org.jstats.seasonrelay_api.modules.relay.service;

import org.jstats.seasonrelay_api.modules.relay.model.Game;
import org.jstats.seasonrelay_api.modules.relay.model.ScoreboardResponse;
import org.jstats.seasonrelay_api.modules.relay.model.SeasonContext;
import org.jstats.seasonrelay_api.modules.relay.model.StandingsEntry;
import org.jstats.seasonrelay_api.modules.relay.model.StandingsResponse;
import org.jstats.seasonrelay_api.modules.season.model.KeyDate;
import org.jstats.seasonrelay_api.modules.season.model.PhaseInterval;
import org.jstats.seasonrelay_api.modules.season.model.PhaseName;
import org.jstats.seasonrelay_api.modules.season.model.SeasonDefinition;
import org.jstats.seasonrelay_api.modules.season.model.SeasonSnapshot;
import org.jstats.seasonrelay_api.modules.season.model.Sport;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Terminal-friendly text for the {@code /curl} endpoints. Output is plain lines joined with
 * {@code \n}, no trailing newline.
 */
@Component
public class PlainTextRenderer {

    private static final DateTimeFormatter HEADER_DATE = DateTimeFormatter.ofPattern("EEE dd MMM yy", Locale.ENGLISH);

    public String help() {
        return String.join("\n",
                "Season Relay - Curl Endpoints",
                "=============================",
                "",
                "Sports: " + String.join(", ", sportCodes()),
                "",
                "Available endpoints:",
                "- /curl/help - Show this help message",
                "- /curl/{sport}/standings - Show current standings",
                "- /curl/{sport}/scores - Show today's scores",
                "- /curl/{sport}/schedule - Show today's schedule",
                "- /curl/{sport}/season - Show the season phase, week and next milestone",
                "",
                "Optional parameters:",
                "- date: YYYY-MM-DD format (e.g., ?date=2025-07-09)",
                "- group: \"conference\" or \"league\" (for standings only)",
                "",
                "Examples:",
                "- /curl/wnba/standings",
                "- /curl/nba/standings?group=league",
                "- /curl/wnba/scores?date=2025-07-09",
                "- /curl/nhl/season");
    }

    public String standings(StandingsResponse response, LocalDate date) {
        var lines = new ArrayList<String>();
        lines.add("%s standings for %s:".formatted(upper(response.sport()), date));
        lines.add("Season: " + response.season().seasonName());
        lines.add("");

        if (response.leagueWide() != null) {
            response.leagueWide().forEach(e -> lines.add(standingsLine(e)));
        } else if (response.conferences() != null) {
            response.conferences().forEach((conference, entries) -> {
                lines.add(conference + ":");
                entries.forEach(e -> lines.add(standingsLine(e)));
                lines.add("");
            });
        }
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        lines.add("Season: " + response.season().phaseLabel());
        if (response.season().week() != null) {
            lines.add("Week: " + response.season().week());
        }
        return String.join("\n", lines);
    }

    public String scores(ScoreboardResponse response) {
        return scoreboard(response, "scores", this::scoreLine);
    }

    public String schedule(ScoreboardResponse response) {
        return scoreboard(response, "schedule", this::scheduleLine);
    }

    public String season(SeasonSnapshot snapshot, SeasonDefinition definition) {
        var lines = new ArrayList<String>();
        lines.add("%s (%s)".formatted(snapshot.seasonName(), snapshot.sport().code()));
        lines.add("Date: " + snapshot.date());
        lines.add("Season: " + snapshot.resolution().describe());
        if (snapshot.week() != null) {
            lines.add("Week: " + snapshot.week());
        }
        var next = snapshot.nextMilestone();
        if (next != null) {
            lines.add("Next: %s on %s (%d %s)".formatted(next.label(), next.date(), next.daysUntil(),
                    next.daysUntil() == 1 ? "day" : "days"));
        }
        lines.add("State: " + snapshot.transition().code());
        var progress = snapshot.progress();
        lines.add(String.format(Locale.ROOT, "Progress: %.1f%% (day %d of %d)", progress.percentComplete(),
                Math.min(progress.daysElapsed() + 1, progress.totalDays()), progress.totalDays()));
        lines.add("");
        lines.add("Phases:");
        for (PhaseInterval phase : definition.phases()) {
            lines.add("  %-16s %s .. %s".formatted(phase.name().label(), phase.start(), phase.end()));
        }
        if (!definition.keyDates().isEmpty()) {
            lines.add("");
            lines.add("Key dates:");
            for (KeyDate keyDate : definition.keyDates()) {
                lines.add(keyDate.start().equals(keyDate.end())
                        ? "  %-20s %s".formatted(keyDate.label(), keyDate.start())
                        : "  %-20s %s .. %s".formatted(keyDate.label(), keyDate.start(), keyDate.end()));
            }
        }
        return String.join("\n", lines);
    }

    // ---------- helpers ----------

    private String scoreboard(ScoreboardResponse response, String kind, Function<Game, String> line) {
        var lines = new ArrayList<String>();
        if (response.games().isEmpty()) {
            lines.add("No games scheduled for the %s on %s.".formatted(upper(response.sport()), response.date()));
        } else {
            lines.add("%s %s for %s:".formatted(upper(response.sport()), kind, HEADER_DATE.format(response.date())));
            lines.add("");
            response.games().forEach(g -> lines.add(line.apply(g)));
        }
        lines.add("");
        lines.add(seasonFooter(response.season()));
        return String.join("\n", lines);
    }

    String scoreLine(Game game) {
        var home = pad(game.homeTeam());
        var away = pad(game.awayTeam());
        String text;
        if (game.scored()) {
            if (game.homeScore() >= game.awayScore()) {
                text = "%s (h) [%d - %d] %s (v)".formatted(home, game.homeScore(), game.awayScore(), away);
            } else {
                text = "%s (v) [%d - %d] %s (h)".formatted(away, game.awayScore(), game.homeScore(), home);
            }
        } else {
            text = "%s (v) [vs] %s (h)".formatted(away, home);
        }
        return text + " " + game.status();
    }

    String scheduleLine(Game game) {
        var home = pad(game.homeTeam());
        var away = pad(game.awayTeam());
        var awayRecord = splitRecord(game.awayRecord());
        var homeRecord = splitRecord(game.homeRecord());
        if (awayRecord != null && homeRecord != null) {
            return "%s (v) [%2s - %2s] - %s [%2s - %2s] (h)".formatted(
                    away, awayRecord[0], awayRecord[1], home, homeRecord[0], homeRecord[1]);
        }
        return "%s (v) - %s (h)".formatted(away, home);
    }

    static String seasonFooter(SeasonContext season) {
        if (season.week() == null) {
            return "Season: " + season.phaseLabel();
        }
        var weekLabel = PhaseName.PLAYOFFS.code().equals(season.phase()) ? "Playoff wk" : "wk";
        return "Season: %s / %s: %d".formatted(season.phaseLabel(), weekLabel, season.week());
    }

    private static String standingsLine(StandingsEntry e) {
        var team = "%-15s".formatted(e.abbreviation() + " " + e.team());
        return String.format(Locale.ROOT, "%s %-2d - %-2d GB: %.1f", team, e.wins(), e.losses(), e.gamesBehind());
    }

    private static String[] splitRecord(String summary) {
        if (summary == null) {
            return null;
        }
        var parts = summary.split("-");
        if (parts.length < 2) {
            return null;
        }
        return new String[]{parts[0].trim(), parts[1].trim()};
    }

    private static String pad(String abbreviation) {
        return "%4s".formatted(abbreviation);
    }

    private static String upper(Sport sport) {
        return sport.name();
    }

    private static List<String> sportCodes() {
        var codes = new ArrayList<String>();
        for (Sport s : Sport.values()) {
            codes.add(s.code());
        }
        return codes;
    }
}
