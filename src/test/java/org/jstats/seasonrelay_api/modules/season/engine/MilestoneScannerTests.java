package org.jstats.seasonrelay_api.modules.season.engine;

import org.jstats.seasonrelay_api.modules.season.model.Milestone;
import org.jstats.seasonrelay_api.modules.season.model.PhaseName;
import org.jstats.seasonrelay_api.modules.season.model.SeasonDefinition;
import org.jstats.seasonrelay_api.modules.season.model.Sport;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.d;
import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.phase;
import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.wnba2025;
import static org.junit.jupiter.api.Assertions.*;

class MilestoneScannerTests {

    private final MilestoneScanner scanner = new MilestoneScanner();
    private final SeasonDefinition season = wnba2025();

    @Test
    void lateRegularSeason_nextIsRegularSeasonEnd() {
        var m = scanner.nextMilestone(season, d("2025-09-01")).orElseThrow();

        assertEquals("regular-season end", m.label());
        assertEquals(d("2025-09-11"), m.date());
        assertEquals(10, m.daysUntil());
        assertEquals(2025, m.seasonYear());
    }

    @Test
    void boundaryOnTheDateItself_isSkipped() {
        var m = scanner.nextMilestone(season, d("2025-05-15")).orElseThrow();

        assertEquals(PhaseName.REGULAR_SEASON, m.phase().name());
        assertEquals(Milestone.Boundary.START, m.boundary());
        assertEquals(1, m.daysUntil());
    }

    @Test
    void beforeSeason_nextIsFirstStart() {
        var m = scanner.nextMilestone(season, d("2025-04-01")).orElseThrow();

        assertEquals("pre-season start", m.label());
        assertEquals(31, m.daysUntil());
    }

    @Test
    void onOrAfterLastEnd_thereIsNoMilestone() {
        assertTrue(scanner.nextMilestone(season, d("2025-10-19")).isEmpty());
        assertTrue(scanner.nextMilestone(season, d("2026-03-01")).isEmpty());
    }

    @Test
    void oneDayPhase_reportsStartBeforeEnd() {
        var oneDay = SeasonDefinition.of(Sport.WNBA, 2025, List.of(
                phase(PhaseName.MID_SEASON_EVENT, "2025-07-01", "2025-07-01")));

        var upcoming = scanner.upcomingMilestones(oneDay, d("2025-06-30"), 5);

        assertEquals(2, upcoming.size());
        assertEquals(Milestone.Boundary.START, upcoming.get(0).boundary());
        assertEquals(Milestone.Boundary.END, upcoming.get(1).boundary());
    }

    @Test
    void upcomingMilestones_areChronologicalAndLimited() {
        var upcoming = scanner.upcomingMilestones(season, d("2025-09-01"), 3);

        assertEquals(List.of("regular-season end", "playoffs start", "playoffs end"),
                upcoming.stream().map(Milestone::label).toList());
        assertThrows(IllegalArgumentException.class, () -> scanner.upcomingMilestones(season, d("2025-09-01"), 0));
    }

    @Test
    void nextMilestone_isTheEarliestBoundaryAfterTheDate() {
        for (LocalDate date = d("2025-04-15"); date.isBefore(d("2025-10-19")); date = date.plusDays(1)) {
            var m = scanner.nextMilestone(season, date).orElseThrow();
            assertTrue(m.date().isAfter(date));
            for (var p : season.phases()) {
                if (p.start().isAfter(date)) {
                    assertFalse(p.start().isBefore(m.date()), "start " + p + " before " + m + " on " + date);
                }
                if (p.end().isAfter(date)) {
                    assertFalse(p.end().isBefore(m.date()), "end " + p + " before " + m + " on " + date);
                }
            }
        }
    }
}
