package com.williamcallahan.film_rating_aggregator.model;

/**
 * External data providers the aggregation engine talks to
 */
public enum ProviderTag {
    PRIMARY("TMDB"),
    RATINGS("OMDb"),
    REGIONAL("Kinopoisk");

    private final String displayName;

    ProviderTag(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
