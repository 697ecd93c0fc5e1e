package com.williamcallahan.film_rating_aggregator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Director or cast member credited on a film
 */
public record PersonCredit(
    String name,
    Role role,
    String character,
    @JsonProperty("photo_url") String photoUrl
) {
    public enum Role {
        DIRECTOR,
        ACTOR
    }
}
