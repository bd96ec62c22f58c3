package org.jstats.seasonrelay_api.modules.season.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.seasonrelay_api.modules.season.config.SeasonCatalogLoader;
import org.jstats.seasonrelay_api.modules.season.config.SeasonProperties;
import org.jstats.seasonrelay_api.modules.season.engine.MilestoneScanner;
import org.jstats.seasonrelay_api.modules.season.engine.PhaseResolver;
import org.jstats.seasonrelay_api.modules.season.engine.SeasonProgressCalculator;
import org.jstats.seasonrelay_api.modules.season.engine.SeasonProjector;
import org.jstats.seasonrelay_api.modules.season.engine.TransitionDetector;
import org.jstats.seasonrelay_api.modules.season.engine.WeekCalculator;
import org.jstats.seasonrelay_api.modules.season.model.InvalidSeasonConfigException;
import org.jstats.seasonrelay_api.modules.season.model.Milestone;
import org.jstats.seasonrelay_api.modules.season.model.PhaseResolution;
import org.jstats.seasonrelay_api.modules.season.model.SeasonDefinition;
import org.jstats.seasonrelay_api.modules.season.model.SeasonProgress;
import org.jstats.seasonrelay_api.modules.season.model.SeasonSnapshot;
import org.jstats.seasonrelay_api.modules.season.model.Sport;
import org.jstats.seasonrelay_api.modules.season.model.TransitionState;
import org.jstats.seasonrelay_api.modules.season.registry.SeasonRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for everything season related. Looks definitions up in the registry and hands them
 * to the engine components. The date is always an argument; {@link #today()} is the only method
 * that reads the clock.
 */
@Service
@NullMarked
public class SeasonService {

    private static final Logger log = LoggerFactory.getLogger(SeasonService.class);

    private final SeasonRegistry registry;
    private final PhaseResolver resolver;
    private final WeekCalculator weeks;
    private final MilestoneScanner milestones;
    private final TransitionDetector transitions;
    private final SeasonProgressCalculator progressCalculator;
    private final SeasonProjector projector;
    private final SeasonCatalogLoader catalogLoader;
    private final SeasonProperties props;
    private final Clock clock;

    public SeasonService(SeasonRegistry registry,
                         PhaseResolver resolver,
                         WeekCalculator weeks,
                         MilestoneScanner milestones,
                         TransitionDetector transitions,
                         SeasonProgressCalculator progressCalculator,
                         SeasonProjector projector,
                         SeasonCatalogLoader catalogLoader,
                         SeasonProperties props,
                         Clock clock) {
        this.registry = registry;
        this.resolver = resolver;
        this.weeks = weeks;
        this.milestones = milestones;
        this.transitions = transitions;
        this.progressCalculator = progressCalculator;
        this.projector = projector;
        this.catalogLoader = catalogLoader;
        this.props = props;
        this.clock = clock;
    }

    // ---------- core queries ----------

    public PhaseResolution resolve(Sport sport, int year, LocalDate date) {
        return resolver.resolve(registry.get(sport, year), date);
    }

    public Optional<Integer> weekOf(Sport sport, int year, LocalDate date) {
        return weeks.weekOf(registry.get(sport, year), date);
    }

    public Optional<Milestone> nextMilestone(Sport sport, int year, LocalDate date) {
        return milestones.nextMilestone(registry.get(sport, year), date);
    }

    public List<Milestone> upcomingMilestones(Sport sport, int year, LocalDate date, int limit) {
        return milestones.upcomingMilestones(registry.get(sport, year), date, limit);
    }

    public TransitionState transitionState(Sport sport, int year, LocalDate date, int thresholdDays) {
        var current = registry.get(sport, year);
        var next = registry.next(sport, year).orElse(null);
        return transitions.transitionState(current, next, date, thresholdDays);
    }

    public TransitionState transitionState(Sport sport, int year, LocalDate date) {
        return transitionState(sport, year, date, props.transitionThresholdDays());
    }

    // ---------- registration ----------

    /**
     * @throws InvalidSeasonConfigException if the definition's sport or year differ from the key
     */
    public void registerSeason(Sport sport, int year, SeasonDefinition definition) {
        if (definition.sport() != sport || definition.year() != year) {
            throw new InvalidSeasonConfigException("Definition for %s %d cannot be registered as %s %d"
                    .formatted(definition.sport().code(), definition.year(), sport.code(), year));
        }
        registry.register(definition);
        log.info("Registered season {} {} ({} phases)", sport, year, definition.phases().size());
    }

    public SeasonDefinition getSeason(Sport sport, int year) {
        return registry.get(sport, year);
    }

    public List<Integer> years(Sport sport) {
        return registry.years(sport);
    }

    public List<Sport> sports() {
        return registry.sports();
    }

    /**
     * Re-reads the catalog and swaps the registry content in one step. On failure the current
     * content stays in place and the exception propagates.
     *
     * @return number of seasons now registered
     */
    public int reload() {
        var definitions = catalogLoader.load();
        registry.replaceAll(definitions);
        log.info("Season catalog reloaded from {}: {}", catalogLoader.location(), registry);
        return definitions.size();
    }

    public String catalogLocation() {
        return catalogLoader.location();
    }

    // ---------- derived views ----------

    public int currentSeasonYear(Sport sport, LocalDate date) {
        return registry.currentSeasonYear(sport, date);
    }

    /** Next boundary in this season, or the first boundary of a later registered season. */
    public Optional<Milestone> nextMilestoneAcrossSeasons(Sport sport, int year, LocalDate date) {
        var definition = registry.get(sport, year);
        while (true) {
            var found = milestones.nextMilestone(definition, date);
            if (found.isPresent()) {
                return found;
            }
            var next = registry.next(sport, definition.year());
            if (next.isEmpty()) {
                return Optional.empty();
            }
            definition = next.get();
        }
    }

    public SeasonProgress progress(Sport sport, int year, LocalDate date) {
        return progressCalculator.progress(registry.get(sport, year), date);
    }

    public SeasonDefinition project(Sport sport, int year, int targetYear) {
        return projector.project(registry.get(sport, year), targetYear);
    }

    public SeasonSnapshot snapshot(Sport sport, int year, LocalDate date, int thresholdDays) {
        var definition = registry.get(sport, year);
        var resolution = resolver.resolve(definition, date);
        var milestone = milestones.nextMilestone(definition, date).orElse(null);
        var state = transitions.transitionState(definition, registry.next(sport, year).orElse(null), date, thresholdDays);
        var progress = progressCalculator.progress(definition, date);
        if (log.isDebugEnabled()) {
            log.debug("Snapshot {} {} on {}: {} / {}", sport, year, date, resolution.label(), state);
        }
        return new SeasonSnapshot(sport, year, definition.displayName(), date, resolution,
                resolution.week(), milestone, state, thresholdDays, progress);
    }

    public SeasonSnapshot currentSnapshot(Sport sport, LocalDate date) {
        return snapshot(sport, currentSeasonYear(sport, date), date, props.transitionThresholdDays());
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(zone()));
    }

    public ZoneId zone() {
        return props.zoneId();
    }

    public int defaultThresholdDays() {
        return props.transitionThresholdDays();
    }
}
