package com.williamcallahan.film_rating_aggregator.model;

import java.time.Duration;

/**
 * Outcome of one aggregation run as reported to an external job runner.
 *
 * @param reference the reference that was aggregated
 * @param status overall status
 * @param reason human-readable explanation, never null
 * @param film the aggregated film, null when FAILED
 * @param ratingsCount number of ratings in the film
 * @param elapsed wall time of the run
 */
public record AggregationJobResult(
    FilmReference reference,
    Status status,
    String reason,
    UnifiedFilm film,
    int ratingsCount,
    Duration elapsed
) {
    public enum Status {
        SUCCESS,
        DEGRADED,
        FAILED
    }

    public boolean isSuccessful() {
        return status != Status.FAILED;
    }
}
