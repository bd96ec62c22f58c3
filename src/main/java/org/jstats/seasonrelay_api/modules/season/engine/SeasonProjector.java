package org.jstats.seasonrelay_api.modules.season.engine;

import org.jspecify.annotations.NullMarked;
import org.jstats.seasonrelay_api.modules.season.model.PhaseInterval;
import org.jstats.seasonrelay_api.modules.season.model.SeasonDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Projects a known season onto another year by shifting every boundary by the year difference.
 * Used to sketch a season that has not been published yet.
 */
@Component
@NullMarked
public class SeasonProjector {

    private static final Logger log = LoggerFactory.getLogger(SeasonProjector.class);

    public SeasonDefinition project(SeasonDefinition source, int targetYear) {
        int shift = targetYear - source.year();
        if (shift == 0) {
            return source;
        }
        var phases = source.phases().stream()
                .map(p -> new PhaseInterval(p.name(), p.start().plusYears(shift), p.end().plusYears(shift), p.weekNumbered()))
                .toList();
        var keyDates = source.keyDates().stream().map(k -> k.shiftYears(shift)).toList();
        var name = source.displayName().replace(String.valueOf(source.year()), String.valueOf(targetYear));
        if (log.isDebugEnabled()) {
            log.debug("Projecting {} {} onto {} ({} phases)", source.sport(), source.year(), targetYear, phases.size());
        }
        // plusYears clamps Feb 29 to Feb 28; the constructor validates the shifted dates again
        return new SeasonDefinition(source.sport(), targetYear, name, phases, keyDates);
    }
}
