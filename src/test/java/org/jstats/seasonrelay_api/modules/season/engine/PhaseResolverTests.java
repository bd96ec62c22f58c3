package org.jstats.seasonrelay_api.modules.season.engine;

import org.jstats.seasonrelay_api.modules.season.model.PhaseName;
import org.jstats.seasonrelay_api.modules.season.model.PhaseResolution.Placement;
import org.jstats.seasonrelay_api.modules.season.model.SeasonDefinition;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.d;
import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.wnba2025;
import static org.junit.jupiter.api.Assertions.*;

class PhaseResolverTests {

    private final PhaseResolver resolver = new PhaseResolver();
    private final SeasonDefinition season = wnba2025();

    @Test
    void firstDayOfRegularSeason_isWeekOne() {
        var r = resolver.resolve(season, d("2025-05-16"));

        assertEquals(Placement.IN_PHASE, r.placement());
        assertEquals(PhaseName.REGULAR_SEASON, r.phase().name());
        assertEquals(1, r.week());
        assertEquals(0L, r.daysIntoPhase());
        assertEquals(118L, r.daysRemainingInPhase());
        assertEquals("regular-season", r.label());
        assertEquals("Regular Season", r.describe());
    }

    @Test
    void oneWeekIn_isWeekTwo() {
        assertEquals(2, resolver.resolve(season, d("2025-05-23")).week());
    }

    @Test
    void gapBetweenPhases_exposesBothNeighbours() {
        var r = resolver.resolve(season, d("2025-09-12"));

        assertEquals(Placement.BETWEEN_PHASES, r.placement());
        assertNull(r.phase());
        assertNull(r.week());
        assertEquals(PhaseName.REGULAR_SEASON, r.previous().name());
        assertEquals(PhaseName.PLAYOFFS, r.next().name());
        assertEquals("between-phases", r.label());
        assertEquals("Between Regular Season and Playoffs", r.describe());
    }

    @Test
    void afterLastPhase_isAfterSeason() {
        var r = resolver.resolve(season, d("2025-10-20"));

        assertEquals(Placement.AFTER_SEASON, r.placement());
        assertEquals(PhaseName.PLAYOFFS, r.previous().name());
        assertNull(r.next());
        assertTrue(r.weekNumber().isEmpty());
    }

    @Test
    void beforeFirstPhase_isBeforeSeason() {
        var r = resolver.resolve(season, d("2025-01-01"));

        assertEquals(Placement.BEFORE_SEASON, r.placement());
        assertEquals(PhaseName.PRE_SEASON, r.next().name());
        assertEquals("before-season", r.label());
    }

    @Test
    void boundsAreInclusive() {
        for (var phase : season.phases()) {
            var atStart = resolver.resolve(season, phase.start());
            var atEnd = resolver.resolve(season, phase.end());
            assertEquals(phase, atStart.phase());
            assertEquals(phase, atEnd.phase());
            assertEquals(0L, atEnd.daysRemainingInPhase());
        }
    }

    @Test
    void everyDateGetsExactlyOnePlacement_andResolvingTwiceGivesTheSameAnswer() {
        for (LocalDate day = d("2025-04-01"); day.isBefore(d("2025-11-30")); day = day.plusDays(1)) {
            var date = day;
            var first = resolver.resolve(season, date);
            assertEquals(first, resolver.resolve(season, date));

            long containing = season.phases().stream().filter(p -> p.contains(date)).count();
            if (first.placement() == Placement.IN_PHASE) {
                assertEquals(1, containing, "date " + date);
                assertTrue(first.phase().contains(date));
            } else {
                assertEquals(0, containing, "date " + date);
            }
        }
    }
}
