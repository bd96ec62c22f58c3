package org.jstats.seasonrelay_api.modules.season.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.jstats.seasonrelay_api.modules.season.model.Milestone;
import org.jstats.seasonrelay_api.modules.season.model.SeasonDefinition;
import org.jstats.seasonrelay_api.modules.season.model.SeasonSnapshot;
import org.jstats.seasonrelay_api.modules.season.model.Sport;
import org.jstats.seasonrelay_api.modules.season.monitor.SeasonAlert;
import org.jstats.seasonrelay_api.modules.season.monitor.SeasonChangeMonitor;
import org.jstats.seasonrelay_api.modules.season.service.SeasonService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.util.List;

@Tag(name = "Seasons", description = "Season phases, weeks, milestones and transitions per sport.")
@Validated
@RestController
@RequestMapping("/api/seasons")
public class SeasonController {

    static final String CURRENT = "current";

    private final SeasonService seasons;
    private final SeasonChangeMonitor monitor;

    public SeasonController(SeasonService seasons, SeasonChangeMonitor monitor) {
        this.seasons = seasons;
        this.monitor = monitor;
    }

    public record SeasonSummary(Sport sport, List<Integer> years, int currentSeasonYear, LocalDate today) {}

    public record ReloadResult(int seasons, String location) {}

    @Operation(
            summary = "List registered seasons of a sport",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK"),
                    @ApiResponse(responseCode = "400", description = "Unknown sport",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "404", description = "No seasons registered",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @GetMapping("/{sport}")
    public SeasonSummary summary(@PathVariable Sport sport) {
        var today = seasons.today();
        return new SeasonSummary(sport, seasons.years(sport), seasons.currentSeasonYear(sport, today), today);
    }

    @Operation(summary = "Get a season definition", description = "Year may be a number or 'current'.")
    @GetMapping("/{sport}/{year}")
    public SeasonDefinition definition(@PathVariable Sport sport, @PathVariable String year) {
        return seasons.getSeason(sport, resolveYear(sport, year, seasons.today()));
    }

    /**
     * Example:
     * GET /api/seasons/wnba/2025/snapshot?date=2025-09-01&threshold=14
     */
    @Operation(
            summary = "Phase, week, next milestone, transition state and progress for a date",
            description = "Date defaults to today in the configured zone; threshold defaults to relay.seasons.transition-threshold-days.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK"),
                    @ApiResponse(responseCode = "400", description = "Bad Request",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "404", description = "Season not registered",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @GetMapping("/{sport}/{year}/snapshot")
    public SeasonSnapshot snapshot(
            @PathVariable Sport sport,
            @PathVariable String year,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) @PositiveOrZero Integer threshold) {

        var on = date != null ? date : seasons.today();
        int days = threshold != null ? threshold : seasons.defaultThresholdDays();
        return seasons.snapshot(sport, resolveYear(sport, year, on), on, days);
    }

    @Operation(summary = "Upcoming phase boundaries within the season")
    @GetMapping("/{sport}/{year}/milestones")
    public List<Milestone> milestones(
            @PathVariable Sport sport,
            @PathVariable String year,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "5") @Min(1) @Max(50) int limit) {

        var on = date != null ? date : seasons.today();
        return seasons.upcomingMilestones(sport, resolveYear(sport, year, on), on, limit);
    }

    @Operation(summary = "Project a season onto another year",
            description = "Shifts every phase boundary by the year difference. Nothing is registered.")
    @GetMapping("/{sport}/{year}/projection")
    public SeasonDefinition projection(
            @PathVariable Sport sport,
            @PathVariable String year,
            @RequestParam @Min(1900) @Max(2200) int targetYear) {

        return seasons.project(sport, resolveYear(sport, year, seasons.today()), targetYear);
    }

    @Operation(
            summary = "Reload the season catalog",
            description = "Swaps all definitions at once. On a catalog error the current definitions stay in place.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK"),
                    @ApiResponse(responseCode = "422", description = "Invalid catalog",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping("/reload")
    public ReloadResult reload() {
        int count = seasons.reload();
        return new ReloadResult(count, seasons.catalogLocation());
    }

    @Operation(summary = "Recent season change alerts, oldest first")
    @GetMapping("/alerts")
    public List<SeasonAlert> alerts(@RequestParam(defaultValue = "20") @Min(0) int limit) {
        return monitor.alerts(limit);
    }

    private int resolveYear(Sport sport, String year, LocalDate date) {
        if (CURRENT.equalsIgnoreCase(year)) {
            return seasons.currentSeasonYear(sport, date);
        }
        try {
            return Integer.parseInt(year);
        } catch (NumberFormatException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "year must be a number or '%s', was '%s'".formatted(CURRENT, year));
        }
    }
}
