package org.jstats.seasonrelay_api.modules.season.engine;

import org.jstats.seasonrelay_api.modules.season.model.InvalidSeasonConfigException;
import org.jstats.seasonrelay_api.modules.season.model.KeyDate;
import org.jstats.seasonrelay_api.modules.season.model.PhaseName;
import org.jstats.seasonrelay_api.modules.season.model.SeasonDefinition;
import org.jstats.seasonrelay_api.modules.season.model.Sport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.d;
import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.nba2025;
import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.phase;
import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.wnba2025;
import static org.junit.jupiter.api.Assertions.*;

class SeasonProjectorTests {

    private final SeasonProjector projector = new SeasonProjector();

    @Test
    void projectsEveryBoundaryByTheYearDifference() {
        var projected = projector.project(nba2025(), 2027);

        assertEquals(2027, projected.year());
        assertEquals(d("2027-10-01"), projected.seasonStart());
        assertEquals(d("2028-06-23"), projected.seasonEnd());
        assertEquals(List.of(PhaseName.PRE_SEASON, PhaseName.REGULAR_SEASON, PhaseName.PLAYOFFS),
                projected.phases().stream().map(p -> p.name()).toList());
    }

    @Test
    void yearInDisplayNameFollowsTheTarget() {
        assertEquals("WNBA 2030", projector.project(wnba2025(), 2030).displayName());
    }

    @Test
    void keyDatesMoveWithThePhases() {
        var source = new SeasonDefinition(Sport.WNBA, 2025, "WNBA 2025", wnba2025().phases(), List.of(
                new KeyDate(PhaseName.MID_SEASON_EVENT, "Commissioner's Cup", d("2025-06-01"), d("2025-06-17"))));

        var cup = projector.project(source, 2026).keyDates().get(0);

        assertEquals("Commissioner's Cup", cup.label());
        assertEquals(d("2026-06-01"), cup.start());
        assertEquals(d("2026-06-17"), cup.end());
    }

    @Test
    void sameYear_returnsTheSource() {
        var season = wnba2025();
        assertSame(season, projector.project(season, 2025));
    }

    @Test
    void projectionIsValidatedAgain() {
        // Feb 29 collapses onto Feb 28 in a non-leap year and collides with the previous phase
        var leap = SeasonDefinition.of(Sport.NHL, 2024, List.of(
                phase(PhaseName.REGULAR_SEASON, "2024-02-01", "2024-02-28"),
                phase(PhaseName.MID_SEASON_EVENT, "2024-02-29", "2024-03-10")));

        assertThrows(InvalidSeasonConfigException.class, () -> projector.project(leap, 2025));
    }
}
