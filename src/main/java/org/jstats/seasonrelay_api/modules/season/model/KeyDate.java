package org.jstats.seasonrelay_api.modules.season.model;

import org.jspecify.annotations.NullMarked;

import java.time.LocalDate;

/**
 * An informational date range inside a season, such as a cup tournament or an all-star break.
 * Key dates may overlap phases and each other; they never affect phase resolution.
 *
 * @param kind  what sort of event this is
 * @param label display text, defaults to the kind's label
 */
@NullMarked
public record KeyDate(
        PhaseName kind,
        String label,
        LocalDate start,
        LocalDate end
) {

    public KeyDate {
        if (kind == null) {
            throw new InvalidSeasonConfigException("Key date kind is required");
        }
        if (label == null || label.isBlank()) {
            label = kind.label();
        }
        if (start == null || end == null) {
            throw new InvalidSeasonConfigException("Key date " + label + " needs both a start and an end date");
        }
        if (start.isAfter(end)) {
            throw new InvalidSeasonConfigException(
                    "Key date %s starts after it ends (%s > %s)".formatted(label, start, end));
        }
    }

    public KeyDate shiftYears(int years) {
        return new KeyDate(kind, label, start.plusYears(years), end.plusYears(years));
    }

    @Override
    public String toString() {
        return label + " [" + start + " .. " + end + "]";
    }
}
