package org.jstats.seasonrelay_api.modules.season.registry;

import org.jstats.seasonrelay_api.modules.season.model.Sport;

public class SeasonNotFoundException extends RuntimeException {

    private final Sport sport;
    private final Integer year;

    public SeasonNotFoundException(Sport sport, int year) {
        super("No %s season registered for %d".formatted(sport.code(), year));
        this.sport = sport;
        this.year = year;
    }

    public SeasonNotFoundException(Sport sport) {
        super("No %s seasons registered".formatted(sport.code()));
        this.sport = sport;
        this.year = null;
    }

    public Sport sport() {
        return sport;
    }

    /** The requested year, or {@code null} when the sport has no seasons at all. */
    public Integer year() {
        return year;
    }
}
