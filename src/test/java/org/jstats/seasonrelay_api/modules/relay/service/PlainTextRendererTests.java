package org.jstats.seasonrelay_api.modules.relay.service;

import org.jstats.seasonrelay_api.modules.relay.model.Game;
import org.jstats.seasonrelay_api.modules.relay.model.ScoreboardResponse;
import org.jstats.seasonrelay_api.modules.relay.model.SeasonContext;
import org.jstats.seasonrelay_api.modules.relay.model.StandingsEntry;
import org.jstats.seasonrelay_api.modules.relay.model.StandingsGroup;
import org.jstats.seasonrelay_api.modules.relay.model.StandingsResponse;
import org.jstats.seasonrelay_api.modules.season.model.KeyDate;
import org.jstats.seasonrelay_api.modules.season.model.PhaseName;
import org.jstats.seasonrelay_api.modules.season.model.SeasonDefinition;
import org.jstats.seasonrelay_api.modules.season.model.Sport;
import org.jstats.seasonrelay_api.modules.season.registry.SeasonRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;

import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.d;
import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.service;
import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.wnba;
import static org.junit.jupiter.api.Assertions.*;

class PlainTextRendererTests {

    private static final SeasonContext REGULAR = new SeasonContext(2025, "WNBA 2025", "regular-season", "Regular Season", 8);

    private final PlainTextRenderer renderer = new PlainTextRenderer();

    private static Game final_(String away, int awayScore, String home, int homeScore) {
        return new Game("1", away, home, awayScore, homeScore, "F", null, null, null);
    }

    @Test
    void scoreLine_putsTheWinnerFirst() {
        assertEquals(" LVA (h) [85 - 78]  NYL (v) F", renderer.scoreLine(final_("NYL", 78, "LVA", 85)));
        assertEquals(" NYL (v) [90 - 80]  LVA (h) F", renderer.scoreLine(final_("NYL", 90, "LVA", 80)));
        assertEquals(" NYL (v) [vs]  LVA (h) Scheduled",
                renderer.scoreLine(new Game("2", "NYL", "LVA", null, null, "Scheduled", null, null, null)));
    }

    @Test
    void scheduleLine_showsRecordsWhenBothAreKnown() {
        assertEquals(" NYL (v) [20 -  5] -  LVA [18 -  7] (h)",
                renderer.scheduleLine(new Game("1", "NYL", "LVA", null, null, "Scheduled", "20-5", "18-7", null)));
        assertEquals(" NYL (v) -  LVA (h)",
                renderer.scheduleLine(new Game("1", "NYL", "LVA", null, null, "Scheduled", "20-5", null, null)));
    }

    @Test
    void seasonFooter_variants() {
        assertEquals("Season: Regular Season / wk: 8", PlainTextRenderer.seasonFooter(REGULAR));
        assertEquals("Season: Playoffs / Playoff wk: 2", PlainTextRenderer.seasonFooter(
                new SeasonContext(2025, "WNBA 2025", "playoffs", "Playoffs", 2)));
        assertEquals("Season: Between Regular Season and Playoffs", PlainTextRenderer.seasonFooter(
                new SeasonContext(2025, "WNBA 2025", "between-phases", "Between Regular Season and Playoffs", null)));
    }

    @Test
    void scores_withAndWithoutGames() {
        var empty = new ScoreboardResponse(Sport.WNBA, d("2025-07-09"), List.of(), REGULAR);
        assertEquals("No games scheduled for the WNBA on 2025-07-09.\n\nSeason: Regular Season / wk: 8",
                renderer.scores(empty));

        var board = new ScoreboardResponse(Sport.WNBA, d("2025-07-09"), List.of(final_("NYL", 78, "LVA", 85)), REGULAR);
        assertEquals(String.join("\n",
                        "WNBA scores for Wed 09 Jul 25:",
                        "",
                        " LVA (h) [85 - 78]  NYL (v) F",
                        "",
                        "Season: Regular Season / wk: 8"),
                renderer.scores(board));
    }

    @Test
    void standings_byConference() {
        var conferences = new LinkedHashMap<String, List<StandingsEntry>>();
        conferences.put("East", List.of(new StandingsEntry("Liberty", "NYL", 27, 17, 0.0, "East")));
        conferences.put("West", List.of(new StandingsEntry("Aces", "LVA", 9, 13, 3.5, "West")));
        var response = new StandingsResponse(Sport.WNBA, StandingsGroup.CONFERENCE, conferences, null, REGULAR);

        var text = renderer.standings(response, d("2025-07-09"));

        assertEquals(String.join("\n",
                "WNBA standings for 2025-07-09:",
                "Season: WNBA 2025",
                "",
                "East:",
                "NYL Liberty     27 - 17 GB: 0.0",
                "",
                "West:",
                "LVA Aces        9  - 13 GB: 3.5",
                "Season: Regular Season",
                "Week: 8"), text);
    }

    @Test
    void season_describesSnapshotAndPhases() {
        var seasons = service(new SeasonRegistry(List.of(wnba(2025), wnba(2026))),
                Clock.fixed(Instant.parse("2025-09-01T16:00:00Z"), ZoneOffset.UTC));
        var snapshot = seasons.snapshot(Sport.WNBA, 2025, d("2025-09-01"), 14);

        var text = renderer.season(snapshot, seasons.getSeason(Sport.WNBA, 2025));

        assertTrue(text.startsWith("WNBA 2025 (wnba)\nDate: 2025-09-01\nSeason: Regular Season\nWeek: 16\n"), text);
        assertTrue(text.contains("Next: regular-season end on 2025-09-11 (10 days)"), text);
        assertTrue(text.contains("State: active"), text);
        assertTrue(text.contains("Progress: 71.3% (day 123 of 171)"), text);
        assertTrue(text.endsWith("  Playoffs         2025-09-14 .. 2025-10-19"), text);
    }

    @Test
    void season_listsKeyDatesAfterThePhases() {
        var base = wnba(2025);
        var definition = new SeasonDefinition(Sport.WNBA, 2025, base.displayName(), base.phases(), List.of(
                new KeyDate(PhaseName.MID_SEASON_EVENT, "Commissioner's Cup", d("2025-06-01"), d("2025-06-17")),
                new KeyDate(PhaseName.ALL_STAR_BREAK, "All-Star Game", d("2025-07-19"), d("2025-07-19"))));
        var seasons = service(new SeasonRegistry(List.of(definition)),
                Clock.fixed(Instant.parse("2025-06-05T16:00:00Z"), ZoneOffset.UTC));

        var text = renderer.season(seasons.snapshot(Sport.WNBA, 2025, d("2025-06-05"), 14), definition);

        assertTrue(text.contains("Season: Regular Season\n"), text);
        assertTrue(text.endsWith("\n\nKey dates:\n"
                + "  Commissioner's Cup   2025-06-01 .. 2025-06-17\n"
                + "  All-Star Game        2025-07-19"), text);
    }

    @Test
    void help_listsEverySport() {
        var help = renderer.help();
        for (Sport sport : Sport.values()) {
            assertTrue(help.contains(sport.code()));
        }
        assertTrue(help.contains("/curl/{sport}/season"));
    }
}
