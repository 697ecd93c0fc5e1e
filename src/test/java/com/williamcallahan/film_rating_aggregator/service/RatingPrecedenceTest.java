package com.williamcallahan.film_rating_aggregator.service;

import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.model.RatingSource;
import com.williamcallahan.film_rating_aggregator.model.RawRating;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RatingPrecedenceTest {

    @Test
    void regionalImdbRatingWinsOverRatingsProvider() {
        Map<ProviderTag, Collection<RawRating>> byProvider = new EnumMap<>(ProviderTag.class);
        byProvider.put(ProviderTag.RATINGS, List.of(RawRating.of(RatingSource.IMDB, 8.7, 10),
            RawRating.of(RatingSource.METACRITIC, 73, 100)));
        byProvider.put(ProviderTag.REGIONAL, List.of(RawRating.of(RatingSource.IMDB, 8.6, 10),
            RawRating.of(RatingSource.KINOPOISK, 8.5, 10)));
        byProvider.put(ProviderTag.PRIMARY, List.of(RawRating.of(RatingSource.TMDB, 8.2, 10)));

        Map<RatingSource, RawRating> collected = RatingPrecedence.collect(byProvider);

        assertThat(collected).containsOnlyKeys(RatingSource.IMDB, RatingSource.METACRITIC,
            RatingSource.KINOPOISK, RatingSource.TMDB);
        assertThat(collected.get(RatingSource.IMDB).value()).isEqualTo(8.6);
        assertThat(RatingPrecedence.winner(RatingSource.IMDB, byProvider)).isEqualTo(ProviderTag.REGIONAL);
        assertThat(RatingPrecedence.winner(RatingSource.METACRITIC, byProvider)).isEqualTo(ProviderTag.RATINGS);
    }

    @Test
    void missingProvidersAreSkipped() {
        Map<ProviderTag, Collection<RawRating>> byProvider = Map.of(
            ProviderTag.PRIMARY, List.of(RawRating.of(RatingSource.TMDB, 7.0, 10)));

        assertThat(RatingPrecedence.collect(byProvider)).containsOnlyKeys(RatingSource.TMDB);
        assertThat(RatingPrecedence.winner(RatingSource.IMDB, byProvider)).isNull();
    }
}
