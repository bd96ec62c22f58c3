package org.jstats.seasonrelay_api.modules.season.engine;

import org.jstats.seasonrelay_api.modules.season.model.SeasonDefinition;
import org.jstats.seasonrelay_api.modules.season.model.TransitionState;
import org.junit.jupiter.api.Test;

import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.d;
import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.wnba;
import static org.jstats.seasonrelay_api.modules.season.SeasonFixtures.wnba2025;
import static org.junit.jupiter.api.Assertions.*;

class TransitionDetectorTests {

    private final TransitionDetector detector = new TransitionDetector(new PhaseResolver());
    private final SeasonDefinition current = wnba2025();
    private final SeasonDefinition next = wnba(2026);

    @Test
    void lateInLastPhase_isEndingSoon() {
        assertEquals(TransitionState.ENDING_SOON, detector.transitionState(current, null, d("2025-10-10"), 14));
    }

    @Test
    void lastDayWithZeroThreshold_isEndingSoon() {
        assertEquals(TransitionState.ENDING_SOON, detector.transitionState(current, null, d("2025-10-19"), 0));
        assertEquals(TransitionState.ACTIVE, detector.transitionState(current, null, d("2025-10-18"), 0));
    }

    @Test
    void nearEndOfNonFinalPhase_isStillActive() {
        assertEquals(TransitionState.ACTIVE, detector.transitionState(current, next, d("2025-09-01"), 14));
    }

    @Test
    void gapBetweenPhases_isActive() {
        assertEquals(TransitionState.ACTIVE, detector.transitionState(current, next, d("2025-09-12"), 14));
    }

    @Test
    void afterSeasonWithoutNextSeason_isOffseason() {
        assertEquals(TransitionState.OFFSEASON, detector.transitionState(current, null, d("2025-11-01"), 14));
    }

    @Test
    void afterSeason_farFromNextSeason_isOffseason() {
        assertEquals(TransitionState.OFFSEASON, detector.transitionState(current, next, d("2025-11-01"), 14));
    }

    @Test
    void afterSeason_withinThresholdOfNextSeason_isUpcoming() {
        assertEquals(TransitionState.UPCOMING, detector.transitionState(current, next, d("2026-04-25"), 14));
        assertEquals(TransitionState.UPCOMING, detector.transitionState(current, next, d("2026-05-01"), 14));
    }

    @Test
    void onceNextSeasonHasStarted_itIsEvaluatedInstead() {
        assertEquals(TransitionState.ACTIVE, detector.transitionState(current, next, d("2026-05-02"), 14));
        assertEquals(TransitionState.ENDING_SOON, detector.transitionState(current, next, d("2026-10-15"), 14));
        assertEquals(TransitionState.OFFSEASON, detector.transitionState(current, next, d("2026-12-01"), 14));
    }

    @Test
    void beforeSeason_dependsOnDistanceToFirstStart() {
        assertEquals(TransitionState.UPCOMING, detector.transitionState(current, next, d("2025-04-25"), 14));
        assertEquals(TransitionState.OFFSEASON, detector.transitionState(current, next, d("2025-01-01"), 14));
    }

    @Test
    void negativeThreshold_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> detector.transitionState(current, next, d("2025-06-01"), -1));
    }
}
