package org.jstats.seasonrelay_api.modules.relay.service;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.seasonrelay_api.modules.relay.model.ScoreboardResponse;
import org.jstats.seasonrelay_api.modules.relay.model.SeasonContext;
import org.jstats.seasonrelay_api.modules.relay.model.StandingsGroup;
import org.jstats.seasonrelay_api.modules.relay.model.StandingsResponse;
import org.jstats.seasonrelay_api.modules.season.model.Sport;
import org.jstats.seasonrelay_api.modules.season.service.SeasonService;
import org.jstats.seasonrelay_api.modules.sportsblaze_gatherer.fetch.SportsBlazeClient;
import org.jstats.seasonrelay_api.modules.sportsblaze_gatherer.fetch.SportsPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.util.List;

import static org.springframework.http.HttpStatus.SERVICE_UNAVAILABLE;

/**
 * Fetches upstream data for a sport and date, normalizes it and attaches the season context
 * (season year, phase, week) of that date.
 */
@Service
@NullMarked
public class SportsRelayService {

    private static final Logger log = LoggerFactory.getLogger(SportsRelayService.class);

    private final SportsBlazeClient client;
    private final PayloadNormalizer normalizer;
    private final SeasonService seasons;

    public SportsRelayService(SportsBlazeClient client, PayloadNormalizer normalizer, SeasonService seasons) {
        this.client = client;
        this.normalizer = normalizer;
        this.seasons = seasons;
    }

    @CircuitBreaker(name = "sportsBlaze", fallbackMethod = "standingsFallback")
    public StandingsResponse standings(Sport sport, StandingsGroup group, @Nullable LocalDate date) {
        var on = date != null ? date : seasons.today();
        var context = seasonContext(sport, on);
        var payload = client.getStandings(sport, context.seasonYear())
                .orElseGet(() -> new SportsPayload.Standings(List.of()));

        if (log.isDebugEnabled()) {
            log.debug("Relaying {} standings ({}) for season {}: {} groups",
                    sport, group.code(), context.seasonYear(), payload.children().size());
        }
        return switch (group) {
            case CONFERENCE -> new StandingsResponse(sport, group, normalizer.byConference(payload), null, context);
            case LEAGUE -> new StandingsResponse(sport, group, null, normalizer.leagueWide(payload), context);
        };
    }

    @CircuitBreaker(name = "sportsBlaze", fallbackMethod = "scoreboardFallback")
    public ScoreboardResponse scores(Sport sport, @Nullable LocalDate date) {
        var on = date != null ? date : seasons.today();
        var context = seasonContext(sport, on);
        var games = client.getScores(sport, on, context.seasonYear())
                .map(p -> normalizer.games(p, false))
                .orElse(List.of());
        return new ScoreboardResponse(sport, on, games, context);
    }

    @CircuitBreaker(name = "sportsBlaze", fallbackMethod = "scoreboardFallback")
    public ScoreboardResponse schedule(Sport sport, @Nullable LocalDate date) {
        var on = date != null ? date : seasons.today();
        var context = seasonContext(sport, on);
        var games = client.getSchedule(sport, on, context.seasonYear())
                .map(p -> normalizer.games(p, true))
                .orElse(List.of());
        return new ScoreboardResponse(sport, on, games, context);
    }

    public SeasonContext seasonContext(Sport sport, LocalDate date) {
        int year = seasons.currentSeasonYear(sport, date);
        var definition = seasons.getSeason(sport, year);
        var resolution = seasons.resolve(sport, year, date);
        return new SeasonContext(year, definition.displayName(), resolution.label(), resolution.describe(), resolution.week());
    }

    // Only an open circuit lands here; every other failure propagates unchanged.
    private StandingsResponse standingsFallback(Sport sport, StandingsGroup group, @Nullable LocalDate date,
                                                CallNotPermittedException ex) {
        throw unavailable(sport, ex);
    }

    private ScoreboardResponse scoreboardFallback(Sport sport, @Nullable LocalDate date, CallNotPermittedException ex) {
        throw unavailable(sport, ex);
    }

    private static ResponseStatusException unavailable(Sport sport, CallNotPermittedException ex) {
        log.warn("SportsBlaze circuit open, rejecting {} request: {}", sport, ex.getMessage());
        return new ResponseStatusException(SERVICE_UNAVAILABLE,
                "SportsBlaze is temporarily unavailable; try again shortly");
    }
}
