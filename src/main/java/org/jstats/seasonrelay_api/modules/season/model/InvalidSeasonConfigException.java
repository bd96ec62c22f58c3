package org.jstats.seasonrelay_api.modules.season.model;

/**
 * Raised when phase data cannot form a valid season: an interval ends before it starts,
 * intervals are out of order, or two intervals overlap. Nothing is registered when this is thrown.
 */
public class InvalidSeasonConfigException extends RuntimeException {

    public InvalidSeasonConfigException(String message) {
        super(message);
    }

    public InvalidSeasonConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
