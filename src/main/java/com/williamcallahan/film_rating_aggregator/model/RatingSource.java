package com.williamcallahan.film_rating_aggregator.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Origin of a single rating value, independent of the provider that reported it.
 * IMDb ratings for example are reported both by OMDb and by Kinopoisk.
 */
public enum RatingSource {
    TMDB("tmdb", "TMDB"),
    IMDB("imdb", "IMDb"),
    ROTTEN_TOMATOES("rotten_tomatoes", "Rotten Tomatoes"),
    METACRITIC("metacritic", "Metacritic"),
    KINOPOISK("kinopoisk", "Kinopoisk"),
    FILM_CRITICS("film_critics", "Film Critics");

    private final String key;
    private final String displayName;

    RatingSource(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Looks up a source by its key or enum name, ignoring case
     *
     * @param value key such as {@code rotten_tomatoes} or name such as {@code ROTTEN_TOMATOES}
     * @return matching source, or empty when unknown
     */
    public static Optional<RatingSource> fromKey(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(source -> source.key.equals(normalized))
                .findFirst();
    }
}
