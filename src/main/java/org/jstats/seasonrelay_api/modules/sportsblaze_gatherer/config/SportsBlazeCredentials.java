package org.jstats.seasonrelay_api.modules.sportsblaze_gatherer.config;

import org.jstats.seasonrelay_api.modules.season.model.Sport;
import org.springframework.util.StringUtils;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Bearer keys for the upstream API. A sport-specific key ({@code NBA_API_KEY}, ...) wins over the
 * shared SportsBlaze key.
 */
public final class SportsBlazeCredentials {

    private final String sharedKey;
    private final Map<Sport, String> sportKeys;

    public SportsBlazeCredentials(String sharedKey, Map<Sport, String> sportKeys) {
        this.sharedKey = StringUtils.hasText(sharedKey) ? sharedKey : null;
        var copy = new EnumMap<Sport, String>(Sport.class);
        sportKeys.forEach((sport, key) -> {
            if (StringUtils.hasText(key)) {
                copy.put(sport, key);
            }
        });
        this.sportKeys = copy;
    }

    /**
     * Reads {@code <SPORT>_API_KEY} for every sport through {@code lookup}, which is usually
     * "system property, then environment variable".
     */
    public static SportsBlazeCredentials resolve(String sharedKey, UnaryOperator<String> lookup) {
        var keys = new EnumMap<Sport, String>(Sport.class);
        for (Sport sport : Sport.values()) {
            var value = lookup.apply(sport.name() + "_API_KEY");
            if (StringUtils.hasText(value)) {
                keys.put(sport, value);
            }
        }
        return new SportsBlazeCredentials(sharedKey, keys);
    }

    /**
     * @throws IllegalStateException if neither a sport key nor the shared key is configured
     */
    public String keyFor(Sport sport) {
        var key = sportKeys.get(sport);
        if (key != null) {
            return key;
        }
        if (sharedKey != null) {
            return sharedKey;
        }
        throw new IllegalStateException("No API key found for %s. Set %s_API_KEY or SPORTSBLAZE_API_KEY."
                .formatted(sport.name(), sport.name()));
    }

    public boolean isEmpty() {
        return sharedKey == null && sportKeys.isEmpty();
    }

    /** Where the key for {@code sport} comes from, for logs. Never returns the key itself. */
    public String describe(Sport sport) {
        if (sportKeys.containsKey(sport)) {
            return sport.name() + "_API_KEY";
        }
        return Optional.ofNullable(sharedKey).map(k -> "shared").orElse("none");
    }
}
