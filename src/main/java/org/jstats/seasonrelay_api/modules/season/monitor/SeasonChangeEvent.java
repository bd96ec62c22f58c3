package org.jstats.seasonrelay_api.modules.season.monitor;

import org.springframework.context.ApplicationEvent;

/**
 * Published when a sport moves to another season, phase or week.
 *
 * <p>Detected by {@link SeasonChangeMonitor} on its scheduled checks. Listeners receive the alert
 * exactly as it is kept in the monitor's history.
 */
public class SeasonChangeEvent extends ApplicationEvent {

    private final SeasonAlert alert;

    public SeasonChangeEvent(Object source, SeasonAlert alert) {
        super(source);
        this.alert = alert;
    }

    public SeasonAlert getAlert() {
        return alert;
    }
}
