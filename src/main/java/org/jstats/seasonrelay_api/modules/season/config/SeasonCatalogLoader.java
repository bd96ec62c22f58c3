package org.jstats.seasonrelay_api.modules.season.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jstats.seasonrelay_api.modules.season.model.InvalidSeasonConfigException;
import org.jstats.seasonrelay_api.modules.season.model.KeyDate;
import org.jstats.seasonrelay_api.modules.season.model.PhaseInterval;
import org.jstats.seasonrelay_api.modules.season.model.PhaseName;
import org.jstats.seasonrelay_api.modules.season.model.SeasonDefinition;
import org.jstats.seasonrelay_api.modules.season.model.Sport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Reads season definitions from the JSON catalog configured by {@code relay.seasons.location}.
 *
 * <p>The catalog looks like:
 *
 * <pre>
 * {"seasons": {"wnba": {"2025": {"name": "WNBA 2025",
 *     "phases": [{"name": "pre-season", "start": "2025-05-02", "end": "2025-05-15"}],
 *     "keyDates": [{"kind": "all-star-break", "start": "2025-07-17", "end": "2025-07-21"}]}}}}
 * </pre>
 *
 * <p>Every season is validated. Any problem aborts the whole load so a partial catalog is never
 * returned.
 */
@Component
public class SeasonCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(SeasonCatalogLoader.class);

    private final ResourceLoader resources;
    private final ObjectMapper mapper;
    private final SeasonProperties props;

    public SeasonCatalogLoader(ResourceLoader resources, ObjectMapper mapper, SeasonProperties props) {
        this.resources = resources;
        this.mapper = mapper;
        this.props = props;
    }

    public String location() {
        return props.location();
    }

    /**
     * @throws InvalidSeasonConfigException if the catalog is malformed or any season is invalid
     * @throws IllegalStateException        if the catalog cannot be read
     */
    public List<SeasonDefinition> load() {
        var location = props.location();
        var resource = resources.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Season catalog not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            var definitions = parse(in);
            log.info("Loaded {} season definitions from {}", definitions.size(), location);
            return definitions;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read season catalog from " + location, e);
        }
    }

    List<SeasonDefinition> parse(InputStream in) throws IOException {
        Catalog catalog;
        try {
            catalog = mapper.readValue(in, Catalog.class);
        } catch (JsonProcessingException e) {
            throw new InvalidSeasonConfigException("Season catalog is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (catalog == null || catalog.seasons() == null) {
            throw new InvalidSeasonConfigException("Season catalog has no \"seasons\" object");
        }

        var definitions = new ArrayList<SeasonDefinition>();
        catalog.seasons().forEach((sportCode, byYear) -> {
            Sport sport = sport(sportCode);
            if (byYear == null) {
                return;
            }
            byYear.forEach((yearKey, season) -> definitions.add(toDefinition(sport, year(sportCode, yearKey), season)));
        });
        definitions.sort(Comparator.comparing(SeasonDefinition::sport).thenComparingInt(SeasonDefinition::year));
        return List.copyOf(definitions);
    }

    private static SeasonDefinition toDefinition(Sport sport, int year, CatalogSeason season) {
        if (season == null || season.phases() == null) {
            throw new InvalidSeasonConfigException("Season %s %d has no phases".formatted(sport.code(), year));
        }
        var phases = new ArrayList<PhaseInterval>(season.phases().size());
        for (CatalogPhase p : season.phases()) {
            if (p == null) {
                throw new InvalidSeasonConfigException("Season %s %d contains an empty phase".formatted(sport.code(), year));
            }
            var name = PhaseName.fromCode(p.name());
            var start = date(sport, year, p.name(), "start", p.start());
            var end = date(sport, year, p.name(), "end", p.end());
            boolean weekNumbered = p.weekNumbered() != null ? p.weekNumbered() : name.weekNumberedByDefault();
            phases.add(new PhaseInterval(name, start, end, weekNumbered));
        }
        var keyDates = new ArrayList<KeyDate>();
        if (season.keyDates() != null) {
            for (CatalogKeyDate k : season.keyDates()) {
                if (k == null) {
                    throw new InvalidSeasonConfigException("Season %s %d contains an empty key date".formatted(sport.code(), year));
                }
                var kind = PhaseName.fromCode(k.kind());
                var label = k.label() == null || k.label().isBlank() ? kind.label() : k.label();
                keyDates.add(new KeyDate(kind, label,
                        date(sport, year, label, "start", k.start()),
                        date(sport, year, label, "end", k.end())));
            }
        }
        return new SeasonDefinition(sport, year, season.name(), phases, keyDates);
    }

    private static Sport sport(String code) {
        try {
            return Sport.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new InvalidSeasonConfigException("Season catalog names an unknown sport: " + code, e);
        }
    }

    private static int year(String sportCode, String key) {
        try {
            return Integer.parseInt(key.trim());
        } catch (NumberFormatException e) {
            throw new InvalidSeasonConfigException("Season catalog has a non-numeric year '%s' for %s".formatted(key, sportCode), e);
        }
    }

    private static LocalDate date(Sport sport, int year, String phase, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidSeasonConfigException("Season %s %d phase %s is missing its %s date"
                    .formatted(sport.code(), year, phase, field));
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidSeasonConfigException("Season %s %d phase %s has an invalid %s date '%s'"
                    .formatted(sport.code(), year, phase, field, value), e);
        }
    }

    // ---------- catalog document ----------
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Catalog(LinkedHashMap<String, LinkedHashMap<String, CatalogSeason>> seasons) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogSeason(String name, List<CatalogPhase> phases, List<CatalogKeyDate> keyDates) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogPhase(String name, String start, String end, Boolean weekNumbered) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogKeyDate(String kind, String label, String start, String end) {}
}
