package com.williamcallahan.film_rating_aggregator.exception;

/**
 * Rating data whose value or scale cannot be placed on the common 0-10 scale.
 * RETRYABLE: No. Callers skip the offending rating and keep aggregating.
 *
 * @author William Callahan
 */
public class RatingScaleException extends RuntimeException {
    public RatingScaleException(String message) {
        super(message);
    }
}
