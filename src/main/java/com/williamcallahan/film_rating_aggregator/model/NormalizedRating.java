package com.williamcallahan.film_rating_aggregator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A {@link RawRating} projected onto the common 0-10 scale.
 * Instances are produced by {@code RatingNormalizer}; the projection is {@code value / max * 10}.
 */
public record NormalizedRating(
    RawRating raw,
    @JsonProperty("normalized_value") double normalizedValue
) {
    @JsonIgnore
    public RatingSource source() {
        return raw.source();
    }

    @JsonProperty("source")
    public String sourceKey() {
        return raw.source().getKey();
    }
}
