package com.williamcallahan.film_rating_aggregator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.film_rating_aggregator.exception.RatingScaleException;

/**
 * A rating exactly as a provider reported it, on the provider's own scale.
 *
 * @param source rating origin
 * @param value rating value, within [0, maxValue]
 * @param maxValue top of the scale, strictly positive
 * @param votes vote count when the provider exposes one
 */
public record RawRating(
    RatingSource source,
    double value,
    @JsonProperty("max_value") double maxValue,
    Long votes
) {
    public RawRating {
        if (source == null) {
            throw new RatingScaleException("Rating source is required");
        }
        if (Double.isNaN(maxValue) || maxValue <= 0) {
            throw new RatingScaleException("Rating scale for " + source.getKey() + " must be positive, got " + maxValue);
        }
        if (Double.isNaN(value) || value < 0 || value > maxValue) {
            throw new RatingScaleException("Rating value " + value + " for " + source.getKey() + " is outside [0, " + maxValue + "]");
        }
    }

    public static RawRating of(RatingSource source, double value, double maxValue) {
        return new RawRating(source, value, maxValue, null);
    }
}
