package org.jstats.seasonrelay_api.modules.season.registry;

import org.jspecify.annotations.NullMarked;
import org.jstats.seasonrelay_api.modules.season.model.SeasonDefinition;
import org.jstats.seasonrelay_api.modules.season.model.Sport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Season definitions keyed by sport and year.
 * <p>
 * The whole content is an immutable snapshot behind an {@link AtomicReference}. Readers never
 * lock and always see either the old or the new snapshot, never a mix. Writers build a new
 * snapshot and swap it in.
 */
@NullMarked
public class SeasonRegistry {

    private static final Logger log = LoggerFactory.getLogger(SeasonRegistry.class);

    private final AtomicReference<Map<Sport, NavigableMap<Integer, SeasonDefinition>>> snapshot =
            new AtomicReference<>(Map.of());

    public SeasonRegistry() {
    }

    public SeasonRegistry(Collection<SeasonDefinition> definitions) {
        replaceAll(definitions);
    }

    /** Inserts or replaces one season. */
    public void register(SeasonDefinition definition) {
        snapshot.updateAndGet(current -> {
            var copy = mutableCopy(current);
            copy.computeIfAbsent(definition.sport(), s -> new TreeMap<>()).put(definition.year(), definition);
            return freeze(copy);
        });
        if (log.isDebugEnabled()) {
            log.debug("Registered {} {}", definition.sport(), definition.year());
        }
    }

    /** Replaces the whole content; the previous snapshot stays visible until the swap. */
    public void replaceAll(Collection<SeasonDefinition> definitions) {
        var fresh = new EnumMap<Sport, NavigableMap<Integer, SeasonDefinition>>(Sport.class);
        for (SeasonDefinition d : definitions) {
            fresh.computeIfAbsent(d.sport(), s -> new TreeMap<>()).put(d.year(), d);
        }
        snapshot.set(freeze(fresh));
    }

    public SeasonDefinition get(Sport sport, int year) {
        return find(sport, year).orElseThrow(() -> new SeasonNotFoundException(sport, year));
    }

    public Optional<SeasonDefinition> find(Sport sport, int year) {
        return Optional.ofNullable(bySport(sport).get(year));
    }

    public List<SeasonDefinition> seasons(Sport sport) {
        return List.copyOf(bySport(sport).values());
    }

    public List<Integer> years(Sport sport) {
        return List.copyOf(bySport(sport).keySet());
    }

    /** Seasons with {@code fromYear <= year <= toYear}, ascending. */
    public List<SeasonDefinition> range(Sport sport, int fromYear, int toYear) {
        if (fromYear > toYear) {
            return List.of();
        }
        return List.copyOf(bySport(sport).subMap(fromYear, true, toYear, true).values());
    }

    public Optional<SeasonDefinition> next(Sport sport, int year) {
        var entry = bySport(sport).higherEntry(year);
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    public Optional<SeasonDefinition> previous(Sport sport, int year) {
        var entry = bySport(sport).lowerEntry(year);
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    public List<Sport> sports() {
        return List.copyOf(snapshot.get().keySet());
    }

    public int size() {
        return snapshot.get().values().stream().mapToInt(Map::size).sum();
    }

    /**
     * The season year a date belongs to: the season whose span contains the date, else the latest
     * season that started on or before it, else the earliest registered season.
     *
     * @throws SeasonNotFoundException if the sport has no seasons
     */
    public int currentSeasonYear(Sport sport, LocalDate date) {
        var seasons = bySport(sport);
        if (seasons.isEmpty()) {
            throw new SeasonNotFoundException(sport);
        }
        SeasonDefinition startedBefore = null;
        for (SeasonDefinition d : seasons.values()) {
            if (!date.isBefore(d.seasonStart()) && !date.isAfter(d.seasonEnd())) {
                return d.year();
            }
            if (!d.seasonStart().isAfter(date)) {
                startedBefore = d;
            }
        }
        return startedBefore != null ? startedBefore.year() : seasons.firstKey();
    }

    private NavigableMap<Integer, SeasonDefinition> bySport(Sport sport) {
        var seasons = snapshot.get().get(sport);
        return seasons == null ? Collections.emptyNavigableMap() : seasons;
    }

    private static EnumMap<Sport, NavigableMap<Integer, SeasonDefinition>> mutableCopy(
            Map<Sport, NavigableMap<Integer, SeasonDefinition>> source) {
        var copy = new EnumMap<Sport, NavigableMap<Integer, SeasonDefinition>>(Sport.class);
        source.forEach((sport, seasons) -> copy.put(sport, new TreeMap<>(seasons)));
        return copy;
    }

    private static Map<Sport, NavigableMap<Integer, SeasonDefinition>> freeze(
            Map<Sport, NavigableMap<Integer, SeasonDefinition>> source) {
        var frozen = new EnumMap<Sport, NavigableMap<Integer, SeasonDefinition>>(Sport.class);
        source.forEach((sport, seasons) -> frozen.put(sport, Collections.unmodifiableNavigableMap(seasons)));
        return Collections.unmodifiableMap(frozen);
    }

    @Override
    public String toString() {
        var parts = new ArrayList<String>();
        snapshot.get().forEach((sport, seasons) -> parts.add(sport.code() + "=" + seasons.keySet()));
        return "SeasonRegistry" + parts;
    }
}
