package org.jstats.seasonrelay_api.modules.season.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.d;
import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.phase;
import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.wnba2025;
import static org.junit.jupiter.api.Assertions.*;

class SeasonDefinitionTests {

    @Test
    void validSeason_exposesBoundsAndKeepsPhaseOrder() {
        var season = wnba2025();

        assertEquals(d("2025-05-02"), season.seasonStart());
        assertEquals(d("2025-10-19"), season.seasonEnd());
        assertEquals(PhaseName.PRE_SEASON, season.firstPhase().name());
        assertEquals(PhaseName.PLAYOFFS, season.lastPhase().name());
        assertTrue(season.isLast(season.phases().get(2)));
        assertFalse(season.isLast(season.phases().get(1)));
    }

    @Test
    void phasesAreCopiedAndUnmodifiable() {
        var phases = new ArrayList<>(wnba2025().phases());
        var season = SeasonDefinition.of(Sport.WNBA, 2025, phases);
        phases.clear();

        assertEquals(3, season.phases().size());
        assertThrows(UnsupportedOperationException.class, () -> season.phases().add(season.firstPhase()));
    }

    @Test
    void blankDisplayName_defaultsToSportAndYear() {
        var season = new SeasonDefinition(Sport.NHL, 2026, " ", List.of(
                phase(PhaseName.REGULAR_SEASON, "2026-10-07", "2027-04-19")));

        assertEquals("NHL 2026", season.displayName());
    }

    @Test
    void contiguousPhases_areAccepted() {
        var season = SeasonDefinition.of(Sport.MLB, 2025, List.of(
                phase(PhaseName.PRE_SEASON, "2025-02-15", "2025-03-26"),
                phase(PhaseName.REGULAR_SEASON, "2025-03-27", "2025-09-28")));

        assertEquals(2, season.phases().size());
    }

    @Test
    void overlappingPhases_areRejected() {
        var ex = assertThrows(InvalidSeasonConfigException.class, () -> SeasonDefinition.of(Sport.WNBA, 2025, List.of(
                phase(PhaseName.REGULAR_SEASON, "2025-05-16", "2025-09-11"),
                phase(PhaseName.PLAYOFFS, "2025-09-11", "2025-10-19"))));

        assertTrue(ex.getMessage().contains("wnba"));
        assertTrue(ex.getMessage().contains("overlap"));
    }

    @Test
    void allStarBreakInsideRegularSeason_isRejectedAsOverlap() {
        // the break sits inside the regular season, so it is a key date and not a phase
        assertThrows(InvalidSeasonConfigException.class, () -> SeasonDefinition.of(Sport.WNBA, 2025, List.of(
                phase(PhaseName.PRE_SEASON, "2025-05-02", "2025-05-15"),
                phase(PhaseName.REGULAR_SEASON, "2025-05-16", "2025-09-11"),
                phase(PhaseName.ALL_STAR_BREAK, "2025-07-18", "2025-07-20"),
                phase(PhaseName.PLAYOFFS, "2025-09-14", "2025-10-19"))));
    }

    @Test
    void keyDatesMayOverlapPhases_andAreSortedByStart() {
        var season = new SeasonDefinition(Sport.WNBA, 2025, "WNBA 2025", wnba2025().phases(), List.of(
                new KeyDate(PhaseName.ALL_STAR_BREAK, null, d("2025-07-17"), d("2025-07-21")),
                new KeyDate(PhaseName.MID_SEASON_EVENT, "Commissioner's Cup", d("2025-06-01"), d("2025-06-17"))));

        assertEquals(List.of("Commissioner's Cup", "All-Star Break"),
                season.keyDates().stream().map(KeyDate::label).toList());
        assertThrows(UnsupportedOperationException.class, () -> season.keyDates().clear());
        assertTrue(wnba2025().keyDates().isEmpty());
    }

    @Test
    void keyDatesOutsideTheSeason_areRejected() {
        var phases = wnba2025().phases();

        var ex = assertThrows(InvalidSeasonConfigException.class, () -> new SeasonDefinition(Sport.WNBA, 2025, null, phases,
                List.of(new KeyDate(PhaseName.ALL_STAR_BREAK, null, d("2025-10-19"), d("2025-10-20")))));
        assertTrue(ex.getMessage().contains("outside"), ex.getMessage());
        assertThrows(InvalidSeasonConfigException.class,
                () -> new KeyDate(PhaseName.ALL_STAR_BREAK, "Break", d("2025-07-21"), d("2025-07-17")));
    }

    @Test
    void unsortedPhases_areRejected() {
        var ex = assertThrows(InvalidSeasonConfigException.class, () -> SeasonDefinition.of(Sport.WNBA, 2025, List.of(
                phase(PhaseName.PLAYOFFS, "2025-09-14", "2025-10-19"),
                phase(PhaseName.REGULAR_SEASON, "2025-05-16", "2025-09-11"))));

        assertTrue(ex.getMessage().contains("not ordered"));
    }

    @Test
    void phaseEndingBeforeItStarts_isRejected() {
        assertThrows(InvalidSeasonConfigException.class,
                () -> phase(PhaseName.PLAYOFFS, "2025-10-19", "2025-09-14"));
    }

    @Test
    void emptyOrNullPhaseList_isRejected() {
        assertThrows(InvalidSeasonConfigException.class, () -> SeasonDefinition.of(Sport.NFL, 2025, List.of()));
        assertThrows(InvalidSeasonConfigException.class, () -> SeasonDefinition.of(Sport.NFL, 2025, null));

        var withNull = new ArrayList<PhaseInterval>();
        withNull.add(null);
        assertThrows(InvalidSeasonConfigException.class, () -> SeasonDefinition.of(Sport.NFL, 2025, withNull));
    }

    @Test
    void phaseInterval_overlapIsInclusiveAndAdjacencyIsNot() {
        var regular = phase(PhaseName.REGULAR_SEASON, "2025-05-16", "2025-09-11");

        assertTrue(regular.overlaps(phase(PhaseName.PLAYOFFS, "2025-09-11", "2025-10-19")));
        assertFalse(regular.overlaps(phase(PhaseName.PLAYOFFS, "2025-09-12", "2025-10-19")));
        assertEquals(119, regular.lengthInDays());
    }

    @Test
    void codesParseCaseInsensitively() {
        assertEquals(Sport.WNBA, Sport.fromCode(" WNBA "));
        assertEquals(PhaseName.REGULAR_SEASON, PhaseName.fromCode("REGULAR_SEASON"));
        assertThrows(IllegalArgumentException.class, () -> Sport.fromCode("mls"));
        assertThrows(InvalidSeasonConfigException.class, () -> PhaseName.fromCode("spring-training"));
    }
}
