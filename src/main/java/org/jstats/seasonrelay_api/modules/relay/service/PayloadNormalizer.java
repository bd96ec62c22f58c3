package org.jstats.seasonrelay_api.modules.relay.service;

import org.jstats.seasonrelay_api.modules.relay.model.Game;
import org.jstats.seasonrelay_api.modules.relay.model.StandingsEntry;
import org.jstats.seasonrelay_api.modules.sportsblaze_gatherer.fetch.SportsPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps upstream payloads onto the relay's own records. Malformed entries are skipped and logged,
 * never fatal for the whole response.
 */
@Component
public class PayloadNormalizer {

    private static final Logger log = LoggerFactory.getLogger(PayloadNormalizer.class);

    private final GameStatusFormatter statusFormatter;

    public PayloadNormalizer(GameStatusFormatter statusFormatter) {
        this.statusFormatter = statusFormatter;
    }

    /** Conference name -> entries, in upstream order. */
    public Map<String, List<StandingsEntry>> byConference(SportsPayload.Standings standings) {
        var result = new LinkedHashMap<String, List<StandingsEntry>>();
        for (SportsPayload.StandingsGroup group : standings.children()) {
            if (group == null) {
                log.debug("Skipping empty upstream standings group");
                continue;
            }
            var conference = group.name() == null ? "Unknown" : group.name();
            var entries = new ArrayList<StandingsEntry>();
            if (group.standings() != null) {
                for (SportsPayload.StandingsRow row : group.standings().entries()) {
                    toEntry(row, conference).ifPresent(entries::add);
                }
            }
            result.put(conference, List.copyOf(entries));
        }
        return result;
    }

    /** All teams in one table, most wins first. */
    public List<StandingsEntry> leagueWide(SportsPayload.Standings standings) {
        return byConference(standings).values().stream()
                .flatMap(List::stream)
                .sorted(Comparator.comparingInt(StandingsEntry::wins).reversed()
                        .thenComparingInt(StandingsEntry::losses))
                .toList();
    }

    /**
     * @param scheduleOnly schedule responses never carry scores and always read "Scheduled"
     */
    public List<Game> games(SportsPayload.Scoreboard scoreboard, boolean scheduleOnly) {
        var games = new ArrayList<Game>();
        for (SportsPayload.Event event : scoreboard.events()) {
            var game = toGame(event, scheduleOnly);
            if (game.isPresent()) {
                games.add(game.get());
            } else if (log.isDebugEnabled()) {
                log.debug("Skipping malformed upstream event {}", event == null ? null : event.id());
            }
        }
        return List.copyOf(games);
    }

    Optional<StandingsEntry> toEntry(SportsPayload.StandingsRow row, String conference) {
        if (row == null || row.team() == null || row.team().abbreviation() == null) {
            return Optional.empty();
        }
        var team = row.team();
        var name = team.shortDisplayName() != null ? team.shortDisplayName() : team.displayName();
        return Optional.of(new StandingsEntry(
                name == null ? team.abbreviation() : name,
                team.abbreviation(),
                (int) stat(row, "wins"),
                (int) stat(row, "losses"),
                stat(row, "gamesBehind"),
                conference));
    }

    Optional<Game> toGame(SportsPayload.Event event, boolean scheduleOnly) {
        if (event == null || event.competitions().isEmpty() || event.competitions().get(0) == null) {
            return Optional.empty();
        }
        var competition = event.competitions().get(0);
        SportsPayload.Competitor home = null;
        SportsPayload.Competitor away = null;
        for (SportsPayload.Competitor c : competition.competitors()) {
            if (c == null) {
                continue;
            }
            if ("home".equals(c.homeAway())) {
                home = c;
            } else if ("away".equals(c.homeAway())) {
                away = c;
            }
        }
        if (home == null || away == null || home.team() == null || away.team() == null) {
            return Optional.empty();
        }

        Integer homeScore = scheduleOnly ? null : score(home.score());
        Integer awayScore = scheduleOnly ? null : score(away.score());
        String status = scheduleOnly ? "Scheduled" : status(competition.status());

        return Optional.of(new Game(event.id(), away.team().abbreviation(), home.team().abbreviation(),
                awayScore, homeScore, status, record(away), record(home), event.date()));
    }

    private String status(SportsPayload.Status status) {
        if (status == null) {
            return statusFormatter.format(null, null, null);
        }
        var type = status.type();
        return statusFormatter.format(type == null ? null : type.name(),
                type == null ? null : type.description(),
                status.period());
    }

    private static double stat(SportsPayload.StandingsRow row, String name) {
        for (SportsPayload.Stat s : row.stats()) {
            if (s != null && s.name() != null && s.name().equalsIgnoreCase(name) && s.value() != null) {
                return s.value();
            }
        }
        return 0;
    }

    static Integer score(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        var trimmed = raw.trim();
        if (!trimmed.chars().allMatch(ch -> ch >= '0' && ch <= '9')) {
            return null;
        }
        try {
            return Integer.valueOf(trimmed);
        } catch (NumberFormatException e) {
            log.debug("Ignoring out-of-range score '{}'", trimmed);
            return null;
        }
    }

    private static String record(SportsPayload.Competitor competitor) {
        if (competitor.records().isEmpty() || competitor.records().get(0) == null) {
            return null;
        }
        var summary = competitor.records().get(0).summary();
        return summary == null || summary.isBlank() ? null : summary;
    }
}
