package org.jstats.seasonrelay_api.modules.sportsblaze_gatherer.fetch;

import org.jstats.seasonrelay_api.modules.season.model.Sport;
import org.jstats.seasonrelay_api.modules.sportsblaze_gatherer.config.SportsBlazeCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;

import static org.springframework.http.HttpStatus.*;

/**
 * SportsBlaze REST client: {@code GET /{sport}/{standings|scores|schedule}?season=&date=}.
 * <ul>
 *   <li>200 JSON -> body</li>
 *   <li>404 -> Optional.empty()</li>
 *   <li>429/5xx/IO -> retry with exponential backoff, then 429/502/504</li>
 *   <li>other 4xx -> surfaced as-is, no retry</li>
 *   <li>unparseable JSON -> 502, no retry</li>
 * </ul>
 */
@Component
public class SportsBlazeClient {

    private static final Logger log = LoggerFactory.getLogger(SportsBlazeClient.class);

    static final String STANDINGS = "standings";
    static final String SCORES = "scores";
    static final String SCHEDULE = "schedule";

    private final RestClient http;
    private final SportsBlazeCredentials credentials;

    public SportsBlazeClient(@Qualifier("sportsblaze") RestClient http, SportsBlazeCredentials credentials) {
        this.http = http;
        this.credentials = credentials;
    }

    @Retryable(
            retryFor = {
                    RateLimitedException.class,       // 429
                    Upstream5xxException.class,       // 5xx
                    ResourceAccessException.class     // I/O timeouts, connection issues
            },
            noRetryFor = {
                    UpstreamJsonParseException.class,
                    ResponseStatusException.class,
                    HttpClientErrorException.class
            },
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2.0, maxDelay = 8000),
            recover = "recoverStandings"
    )
    public Optional<SportsPayload.Standings> getStandings(Sport sport, int seasonYear) {
        return fetch(sport, STANDINGS, null, seasonYear, SportsPayload.Standings.class);
    }

    @Retryable(
            retryFor = {RateLimitedException.class, Upstream5xxException.class, ResourceAccessException.class},
            noRetryFor = {UpstreamJsonParseException.class, ResponseStatusException.class, HttpClientErrorException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2.0, maxDelay = 8000),
            recover = "recoverScoreboard"
    )
    public Optional<SportsPayload.Scoreboard> getScores(Sport sport, LocalDate date, int seasonYear) {
        return fetch(sport, SCORES, date, seasonYear, SportsPayload.Scoreboard.class);
    }

    @Retryable(
            retryFor = {RateLimitedException.class, Upstream5xxException.class, ResourceAccessException.class},
            noRetryFor = {UpstreamJsonParseException.class, ResponseStatusException.class, HttpClientErrorException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2.0, maxDelay = 8000),
            recover = "recoverScoreboard"
    )
    public Optional<SportsPayload.Scoreboard> getSchedule(Sport sport, LocalDate date, int seasonYear) {
        return fetch(sport, SCHEDULE, date, seasonYear, SportsPayload.Scoreboard.class);
    }

    private <T> Optional<T> fetch(Sport sport, String resource, LocalDate date, int seasonYear, Class<T> type) {
        try {
            if (log.isDebugEnabled()) {
                log.debug("Calling SportsBlaze GET /{}/{} season={} date={} (key: {})",
                        sport.code(), resource, seasonYear, date, credentials.describe(sport));
            }

            var resp = http.get()
                    .uri(u -> {
                        var b = u.path("/{sport}/{resource}").queryParam("season", seasonYear);
                        if (date != null) {
                            b = b.queryParam("date", date.toString());
                        }
                        return b.build(sport.code(), resource);
                    })
                    .headers(h -> h.setBearerAuth(credentials.keyFor(sport)))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(s -> s.value() == 404, (req, res) -> { throw new NotFoundException(); })
                    .onStatus(s -> s.value() == 429, (req, res) -> {
                        throw new RateLimitedException(parseRetryAfter(res.getHeaders()));
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        throw new Upstream5xxException(res.getStatusCode().value());
                    })
                    .toEntity(type);

            return Optional.ofNullable(resp.getBody());

        } catch (NotFoundException nf) {
            if (log.isDebugEnabled()) {
                log.debug("SportsBlaze has no {} for {} season {}", resource, sport.code(), seasonYear);
            }
            return Optional.empty();
        } catch (HttpClientErrorException ex) {
            var status = ex.getStatusCode();
            var bodyBytes = ex.getResponseBodyAsByteArray();
            var preview = new String(bodyBytes, 0, Math.min(bodyBytes.length, 500), StandardCharsets.UTF_8);

            if (log.isWarnEnabled()) {
                log.warn("SportsBlaze client error {} for {}/{}. Body: {}", status.value(), sport.code(), resource, preview);
            }

            if (status.value() == 401) {
                throw new ResponseStatusException(UNAUTHORIZED, problemMsg("Unauthorized at SportsBlaze (check the API key)", preview));
            } else if (status.value() == 403) {
                throw new ResponseStatusException(FORBIDDEN, problemMsg("Forbidden at SportsBlaze (key lacks access to " + sport.code() + ")", preview));
            } else {
                throw new ResponseStatusException(status, problemMsg("Upstream 4xx from SportsBlaze", preview));
            }
        } catch (org.springframework.http.converter.HttpMessageConversionException conv) {
            var cause = conv.getCause();
            var msg = (cause instanceof com.fasterxml.jackson.core.JsonProcessingException jp)
                    ? jp.getOriginalMessage()
                    : conv.getMessage();

            if (log.isErrorEnabled()) {
                log.error("Failed to parse SportsBlaze JSON for {}/{}: {}", sport.code(), resource, msg);
            }
            throw new UpstreamJsonParseException(msg);
        }
    }

    // ---------- Retry helpers / exception types ----------
    public static final class NotFoundException extends RuntimeException {}

    public static final class RateLimitedException extends RuntimeException {
        public final Duration retryAfter;
        RateLimitedException(Duration ra) { this.retryAfter = ra; }
    }

    public static final class Upstream5xxException extends RuntimeException {
        public final int status;
        Upstream5xxException(int status) { this.status = status; }
    }

    public static final class UpstreamJsonParseException extends RuntimeException {
        UpstreamJsonParseException(String msg) { super(msg); }
    }

    static Duration parseRetryAfter(HttpHeaders headers) {
        var ra = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (ra == null || ra.isBlank()) return Duration.ofSeconds(2);
        try { return Duration.ofSeconds(Math.max(1, Long.parseLong(ra.trim()))); }
        catch (NumberFormatException notSeconds) { return Duration.ofSeconds(2); }
    }

    private static String problemMsg(String leading, String preview) {
        if (preview == null || preview.isBlank()) return leading;
        var safe = preview.length() > 500 ? preview.substring(0, 500) : preview;
        return leading + ": " + safe;
    }

    // ---------- @Recover handlers (run after the final attempt, or at once for non-retryable errors) ----------
    @Recover
    public Optional<SportsPayload.Standings> recoverStandings(RuntimeException ex, Sport sport, int seasonYear) {
        throw translate(ex, sport, STANDINGS);
    }

    @Recover
    public Optional<SportsPayload.Scoreboard> recoverScoreboard(RuntimeException ex, Sport sport, LocalDate date, int seasonYear) {
        throw translate(ex, sport, SCORES + "/" + SCHEDULE + " " + date);
    }

    private RuntimeException translate(RuntimeException ex, Sport sport, String what) {
        if (ex instanceof ResponseStatusException rse) {
            return rse;
        }
        if (ex instanceof RateLimitedException rl) {
            if (log.isWarnEnabled()) {
                log.warn("Recover after rate limit for {} {}. Retry-After ~{}s", sport.code(), what, rl.retryAfter.toSeconds());
            }
            return new ResponseStatusException(TOO_MANY_REQUESTS,
                    "Rate limit reached at SportsBlaze; retry after ~" + rl.retryAfter.toSeconds() + "s");
        }
        if (ex instanceof Upstream5xxException up) {
            if (log.isErrorEnabled()) {
                log.error("Recover after upstream 5xx {} for {} {}", up.status, sport.code(), what);
            }
            return new ResponseStatusException(BAD_GATEWAY, "Upstream error from SportsBlaze: HTTP " + up.status);
        }
        if (ex instanceof ResourceAccessException) {
            if (log.isErrorEnabled()) {
                log.error("Recover after IO error while calling SportsBlaze for {} {}", sport.code(), what, ex);
            }
            return new ResponseStatusException(GATEWAY_TIMEOUT, "Upstream timeout while calling SportsBlaze");
        }
        if (ex instanceof UpstreamJsonParseException) {
            return new ResponseStatusException(BAD_GATEWAY, "Failed to parse SportsBlaze JSON: " + ex.getMessage());
        }
        return ex;
    }
}
