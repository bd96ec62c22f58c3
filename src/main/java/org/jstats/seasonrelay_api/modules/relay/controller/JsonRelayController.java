package org.jstats.seasonrelay_api.modules.relay.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import org.jstats.seasonrelay_api.modules.relay.model.ScoreboardResponse;
import org.jstats.seasonrelay_api.modules.relay.model.StandingsGroup;
import org.jstats.seasonrelay_api.modules.relay.model.StandingsResponse;
import org.jstats.seasonrelay_api.modules.relay.service.SportsRelayService;
import org.jstats.seasonrelay_api.modules.season.model.Sport;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@Tag(name = "Sports Relay (JSON)", description = "Standings, scores and schedule with season context.")
@Validated
@RestController
@RequestMapping("/api/{sport}")
public class JsonRelayController {

    private final SportsRelayService relay;

    public JsonRelayController(SportsRelayService relay) {
        this.relay = relay;
    }

    /**
     * Example:
     * GET /api/wnba/standings?group=league
     */
    @Operation(
            summary = "Standings by conference or league-wide",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK"),
                    @ApiResponse(responseCode = "400", description = "Bad Request",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "404", description = "No season registered for the sport",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "429", description = "Too Many Requests",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "502", description = "Upstream error",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "503", description = "Upstream circuit open",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @GetMapping("/standings")
    public StandingsResponse standings(
            @PathVariable Sport sport,
            @RequestParam(defaultValue = "conference")
            @Pattern(regexp = "^(?i)(conference|league)$", message = "group must be 'conference' or 'league'")
            String group,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        return relay.standings(sport, StandingsGroup.fromCode(group), date);
    }

    @Operation(summary = "Scores for a date (defaults to today)")
    @GetMapping("/scores")
    public ScoreboardResponse scores(
            @PathVariable Sport sport,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        return relay.scores(sport, date);
    }

    @Operation(summary = "Schedule for a date (defaults to today)")
    @GetMapping("/schedule")
    public ScoreboardResponse schedule(
            @PathVariable Sport sport,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        return relay.schedule(sport, date);
    }
}
