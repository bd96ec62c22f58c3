package org.jstats.seasonrelay_api.modules.relay.controller;

import io.swagger.v3.oas.annotations.Hidden;
import org.jstats.seasonrelay_api.modules.relay.model.StandingsGroup;
import org.jstats.seasonrelay_api.modules.relay.service.PlainTextRenderer;
import org.jstats.seasonrelay_api.modules.relay.service.SportsRelayService;
import org.jstats.seasonrelay_api.modules.season.model.Sport;
import org.jstats.seasonrelay_api.modules.season.service.SeasonService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * Human-readable twins of the JSON endpoints, for {@code curl} in a terminal.
 */
@Hidden
@RestController
@RequestMapping("/curl")
public class PlainTextRelayController {

    private final SportsRelayService relay;
    private final SeasonService seasons;
    private final PlainTextRenderer renderer;

    public PlainTextRelayController(SportsRelayService relay, SeasonService seasons, PlainTextRenderer renderer) {
        this.relay = relay;
        this.seasons = seasons;
        this.renderer = renderer;
    }

    @GetMapping("/help")
    public String help() {
        return renderer.help() + "\n";
    }

    @GetMapping("/{sport}/standings")
    public String standings(
            @PathVariable Sport sport,
            @RequestParam(defaultValue = "conference") String group,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        // unknown groups fall back to conference here; the JSON endpoint rejects them
        var grouping = "league".equalsIgnoreCase(group) ? StandingsGroup.LEAGUE : StandingsGroup.CONFERENCE;
        var on = date != null ? date : seasons.today();
        return renderer.standings(relay.standings(sport, grouping, on), on) + "\n";
    }

    @GetMapping("/{sport}/scores")
    public String scores(
            @PathVariable Sport sport,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        return renderer.scores(relay.scores(sport, date)) + "\n";
    }

    @GetMapping("/{sport}/schedule")
    public String schedule(
            @PathVariable Sport sport,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        return renderer.schedule(relay.schedule(sport, date)) + "\n";
    }

    @GetMapping("/{sport}/season")
    public String season(
            @PathVariable Sport sport,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        var on = date != null ? date : seasons.today();
        var snapshot = seasons.currentSnapshot(sport, on);
        return renderer.season(snapshot, seasons.getSeason(sport, snapshot.seasonYear())) + "\n";
    }
}
