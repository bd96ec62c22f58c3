package org.jstats.seasonrelay_api.modules.sportsblaze_gatherer.fetch;

import com.fasterxml.jackson.annotation.*;

import java.util.List;

/**
 * Upstream JSON shapes. Only the fields the relay reads are mapped; everything else is ignored.
 */
public final class SportsPayload {

    private SportsPayload() {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Standings(
            List<StandingsGroup> children
    ) {
        public Standings {
            if (children == null) children = List.of();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StandingsGroup(
            String name,
            StandingsTable standings
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StandingsTable(
            List<StandingsRow> entries
    ) {
        public StandingsTable {
            if (entries == null) entries = List.of();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StandingsRow(
            TeamRef team,
            List<Stat> stats
    ) {
        public StandingsRow {
            if (stats == null) stats = List.of();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Stat(
            String name,
            Double value,
            String displayValue
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TeamRef(
            String abbreviation,
            String displayName,
            String shortDisplayName
    ) {
    }

    /** Scores and schedule share this shape. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Scoreboard(
            List<Event> events
    ) {
        public Scoreboard {
            if (events == null) events = List.of();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Event(
            String id,
            String date,
            String name,
            List<Competition> competitions
    ) {
        public Event {
            if (competitions == null) competitions = List.of();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Competition(
            List<Competitor> competitors,
            Status status
    ) {
        public Competition {
            if (competitors == null) competitors = List.of();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Competitor(
            String homeAway,
            String score,
            TeamRef team,
            List<TeamRecord> records
    ) {
        public Competitor {
            if (records == null) records = List.of();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TeamRecord(
            String name,
            String summary
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(
            Integer period,
            String displayClock,
            StatusType type
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StatusType(
            String name,
            String description,
            String state,
            Boolean completed
    ) {
    }
}
