package com.williamcallahan.film_rating_aggregator.exception;

import com.williamcallahan.film_rating_aggregator.model.FilmReference;

import java.time.Duration;

/**
 * Aggregation did not finish within the deadline imposed by the caller.
 *
 * @author William Callahan
 */
public class AggregationTimeoutException extends AggregationException {
    private final Duration deadline;

    public AggregationTimeoutException(FilmReference reference, Duration deadline, Throwable cause) {
        super("Aggregation exceeded deadline of " + deadline.toMillis() + "ms for " + reference, reference, cause);
        this.deadline = deadline;
    }

    public Duration getDeadline() {
        return deadline;
    }
}
