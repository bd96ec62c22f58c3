package org.jstats.seasonrelay_api.core.config;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import jakarta.validation.ConstraintViolationException;
import org.jstats.seasonrelay_api.modules.season.model.InvalidSeasonConfigException;
import org.jstats.seasonrelay_api.modules.season.registry.SeasonNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;

import static org.springframework.http.HttpStatus.BAD_GATEWAY;
import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.GATEWAY_TIMEOUT;
import static org.springframework.http.HttpStatus.NOT_FOUND;
import static org.springframework.http.HttpStatus.SERVICE_UNAVAILABLE;
import static org.springframework.http.HttpStatus.TOO_MANY_REQUESTS;

@RestControllerAdvice
public class ProblemHandler {

    private static final Logger log = LoggerFactory.getLogger(ProblemHandler.class);
    private static final String PROBLEM_BASE = "https://api.jstats.org/problems/";

    // Anything thrown as ResponseStatusException becomes a Problem
    @ExceptionHandler(ResponseStatusException.class)
    public ProblemDetail handle(ResponseStatusException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(ex.getStatusCode(), ex.getReason());
        pd.setType(URI.create(PROBLEM_BASE + ex.getStatusCode().value()));
        var status = HttpStatus.resolve(ex.getStatusCode().value());
        pd.setTitle(status == null ? "Request Failed" : switch (status) {
            case NOT_FOUND -> "Resource Not Found";
            case BAD_REQUEST -> "Bad Request";
            case TOO_MANY_REQUESTS -> "Too Many Requests";
            case BAD_GATEWAY -> "Upstream Error";
            case GATEWAY_TIMEOUT -> "Upstream Timeout";
            case SERVICE_UNAVAILABLE -> "Service Unavailable";
            default -> "Request Failed";
        });
        return pd; // Spring sets Content-Type: application/problem+json
    }

    @ExceptionHandler(SeasonNotFoundException.class)
    public ProblemDetail seasonNotFound(SeasonNotFoundException ex) {
        var pd = ProblemDetail.forStatusAndDetail(NOT_FOUND, ex.getMessage());
        pd.setType(URI.create(PROBLEM_BASE + "season-not-found"));
        pd.setTitle("Season Not Found");
        pd.setProperty("sport", ex.sport().code());
        if (ex.year() != null) {
            pd.setProperty("year", ex.year());
        }
        return pd;
    }

    @ExceptionHandler(InvalidSeasonConfigException.class)
    public ProblemDetail invalidSeason(InvalidSeasonConfigException ex) {
        log.warn("Rejected season configuration: {}", ex.getMessage());
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
        pd.setType(URI.create(PROBLEM_BASE + "invalid-season-config"));
        pd.setTitle("Invalid Season Configuration");
        return pd;
    }

    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            ConstraintViolationException.class,
            HandlerMethodValidationException.class,
            IllegalArgumentException.class
    })
    public ProblemDetail badRequest(Exception ex) {
        var detail = ex instanceof MethodArgumentTypeMismatchException mismatch
                ? "Invalid value '%s' for parameter '%s'".formatted(mismatch.getValue(), mismatch.getName())
                : ex.getMessage();
        var pd = ProblemDetail.forStatusAndDetail(BAD_REQUEST, detail);
        pd.setType(URI.create(PROBLEM_BASE + "400"));
        pd.setTitle("Bad Request");
        return pd;
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ProblemDetail circuitOpen(CallNotPermittedException ex) {
        var pd = ProblemDetail.forStatusAndDetail(SERVICE_UNAVAILABLE,
                "SportsBlaze is temporarily unavailable; try again shortly");
        pd.setType(URI.create(PROBLEM_BASE + "upstream-unavailable"));
        pd.setTitle("Service Unavailable");
        return pd;
    }

    // Catch any other unexpected exception as a 500 Problem (avoid leaking internals)
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected error. If this persists, contact support.");
        pd.setType(URI.create(PROBLEM_BASE + "internal-error"));
        pd.setTitle("Internal Server Error");
        return pd;
    }
}
