package org.jstats.seasonrelay_api.modules.sportsblaze_gatherer.config;

import org.jstats.seasonrelay_api.modules.season.model.Sport;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SportsBlazeCredentialsTests {

    @Test
    void sportKeyWinsOverSharedKey() {
        var credentials = SportsBlazeCredentials.resolve("shared",
                name -> name.equals("NBA_API_KEY") ? "nba-key" : null);

        assertEquals("nba-key", credentials.keyFor(Sport.NBA));
        assertEquals("shared", credentials.keyFor(Sport.WNBA));
        assertEquals("NBA_API_KEY", credentials.describe(Sport.NBA));
        assertEquals("shared", credentials.describe(Sport.NHL));
    }

    @Test
    void blankValuesCountAsMissing() {
        var credentials = new SportsBlazeCredentials("  ", Map.of(Sport.MLB, ""));

        assertTrue(credentials.isEmpty());
        assertEquals("none", credentials.describe(Sport.MLB));
        var ex = assertThrows(IllegalStateException.class, () -> credentials.keyFor(Sport.MLB));
        assertTrue(ex.getMessage().contains("MLB_API_KEY"));
    }

    @Test
    void sportKeysAloneAreEnough() {
        var credentials = SportsBlazeCredentials.resolve(null, name -> name.equals("NFL_API_KEY") ? "nfl" : null);

        assertFalse(credentials.isEmpty());
        assertEquals("nfl", credentials.keyFor(Sport.NFL));
        assertThrows(IllegalStateException.class, () -> credentials.keyFor(Sport.NHL));
    }

    @Test
    void resolvedPropertyIsUsedAsIs() {
        assertEquals("from-yaml", SportsBlazeSourceConfig.resolveApiKey("from-yaml"));
    }
}
