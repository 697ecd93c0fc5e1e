package com.williamcallahan.film_rating_aggregator.exception;

import com.williamcallahan.film_rating_aggregator.model.FilmReference;

/**
 * Fatal aggregation failure: the primary provider was unreachable or returned no usable record.
 * The message is meant to be shown as the reason of a failed job.
 *
 * @author William Callahan
 */
public class AggregationException extends RuntimeException {
    private final transient FilmReference reference;

    public AggregationException(String message, FilmReference reference) {
        super(message);
        this.reference = reference;
    }

    public AggregationException(String message, FilmReference reference, Throwable cause) {
        super(message, cause);
        this.reference = reference;
    }

    public FilmReference getReference() {
        return reference;
    }
}
