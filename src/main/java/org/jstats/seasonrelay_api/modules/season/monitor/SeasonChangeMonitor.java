package org.jstats.seasonrelay_api.modules.season.monitor;

import org.jspecify.annotations.Nullable;
import org.jstats.seasonrelay_api.modules.season.model.Sport;
import org.jstats.seasonrelay_api.modules.season.registry.SeasonNotFoundException;
import org.jstats.seasonrelay_api.modules.season.service.SeasonService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Periodically works out each sport's current season, phase and week and reports what changed
 * since the previous check.
 *
 * <p>Only one change is reported per sport and check, in priority order season, phase, week. The
 * first check of a sport only records its state. Changes are published as
 * {@link SeasonChangeEvent}s and kept in a bounded history.
 */
@Component
@EnableConfigurationProperties(MonitorProperties.class)
public class SeasonChangeMonitor {

    private static final Logger log = LoggerFactory.getLogger(SeasonChangeMonitor.class);
    private static final DateTimeFormatter ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final SeasonService seasons;
    private final ApplicationEventPublisher events;
    private final MonitorProperties props;
    private final Clock clock;

    private final Map<Sport, Observation> lastObserved = new EnumMap<>(Sport.class);
    private final Deque<SeasonAlert> history = new ArrayDeque<>();

    public SeasonChangeMonitor(SeasonService seasons,
                               ApplicationEventPublisher events,
                               MonitorProperties props,
                               Clock clock) {
        this.seasons = seasons;
        this.events = events;
        this.props = props;
        this.clock = clock;
    }

    record Observation(int seasonYear, String phase, @Nullable Integer week) {}

    @Scheduled(fixedDelayString = "${relay.monitor.interval:PT1H}",
            initialDelayString = "${relay.monitor.initial-delay:PT10S}")
    public void scheduledCheck() {
        if (!props.enabled()) {
            return;
        }
        try {
            var alerts = checkNow();
            if (log.isDebugEnabled()) {
                log.debug("Season monitor check finished with {} alert(s)", alerts.size());
            }
        } catch (RuntimeException ex) {
            // keep the schedule alive; the next run starts from the last recorded state
            log.error("Season monitor check failed", ex);
        }
    }

    /** Runs one check for every sport with registered seasons and returns the new alerts. */
    public synchronized List<SeasonAlert> checkNow() {
        var today = seasons.today();
        var alerts = new ArrayList<SeasonAlert>();
        for (Sport sport : seasons.sports()) {
            Observation current;
            try {
                int year = seasons.currentSeasonYear(sport, today);
                var resolution = seasons.resolve(sport, year, today);
                current = new Observation(year, resolution.label(), resolution.week());
            } catch (SeasonNotFoundException ex) {
                // sport vanished in a concurrent reload
                lastObserved.remove(sport);
                continue;
            }

            var previous = lastObserved.put(sport, current);
            if (previous == null) {
                continue;
            }
            var alert = compare(sport, previous, current);
            if (alert != null) {
                record(alert);
                alerts.add(alert);
            }
        }
        return alerts;
    }

    /** Most recent alerts, oldest first; {@code limit <= 0} returns the whole history. */
    public synchronized List<SeasonAlert> alerts(int limit) {
        var all = new ArrayList<>(history);
        if (limit <= 0 || limit >= all.size()) {
            return all;
        }
        return List.copyOf(all.subList(all.size() - limit, all.size()));
    }

    private @Nullable SeasonAlert compare(Sport sport, Observation previous, Observation current) {
        if (previous.seasonYear() != current.seasonYear()) {
            return alert(sport, SeasonAlert.ChangeType.SEASON_CHANGE, current.seasonYear(), null,
                    String.valueOf(previous.seasonYear()), String.valueOf(current.seasonYear()),
                    "%s SEASON TRANSITION: %d -> %d".formatted(label(sport), previous.seasonYear(), current.seasonYear()));
        }
        if (!previous.phase().equals(current.phase())) {
            return alert(sport, SeasonAlert.ChangeType.PHASE_CHANGE, current.seasonYear(), null,
                    previous.phase(), current.phase(),
                    "%s PHASE CHANGE: %s -> %s (Season %d)".formatted(label(sport), previous.phase(), current.phase(), current.seasonYear()));
        }
        if (current.week() != null && !Objects.equals(previous.week(), current.week())) {
            return alert(sport, SeasonAlert.ChangeType.WEEK_CHANGE, current.seasonYear(), current.phase(),
                    String.valueOf(previous.week()), String.valueOf(current.week()),
                    "%s WEEK %s -> %d (%s, Season %d)".formatted(label(sport), previous.week(), current.week(), current.phase(), current.seasonYear()));
        }
        return null;
    }

    private SeasonAlert alert(Sport sport, SeasonAlert.ChangeType type, int seasonYear, @Nullable String phase,
                              String from, String to, String message) {
        var now = Instant.now(clock);
        var id = sport.code() + "_" + type.code() + "_" + ID_FORMAT.format(now);
        return new SeasonAlert(id, sport, type, seasonYear, phase, from, to, message, now);
    }

    private void record(SeasonAlert alert) {
        history.addLast(alert);
        while (history.size() > props.historySize()) {
            history.removeFirst();
        }
        log.info("Season alert: {}", alert.message());
        events.publishEvent(new SeasonChangeEvent(this, alert));
    }

    private static String label(Sport sport) {
        return sport.name();
    }
}
