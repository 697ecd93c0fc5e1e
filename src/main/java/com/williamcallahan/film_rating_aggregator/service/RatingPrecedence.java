package com.williamcallahan.film_rating_aggregator.service;

import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.model.RatingSource;
import com.williamcallahan.film_rating_aggregator.model.RawRating;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Provider preference for ratings reported by more than one provider.
 * Providers are visited in {@link #ORDER}; the first rating seen for a source is kept.
 * The regional catalog is authoritative for the sources it rates itself.
 */
public final class RatingPrecedence {

    public static final List<ProviderTag> ORDER = List.of(
        ProviderTag.REGIONAL,
        ProviderTag.RATINGS,
        ProviderTag.PRIMARY
    );

    private RatingPrecedence() {
    }

    /**
     * Merges per-provider ratings into one rating per source.
     *
     * @param byProvider raw ratings reported by each resolved provider
     * @return one rating per source, chosen by provider preference
     */
    public static Map<RatingSource, RawRating> collect(Map<ProviderTag, ? extends Collection<RawRating>> byProvider) {
        Map<RatingSource, RawRating> chosen = new EnumMap<>(RatingSource.class);
        for (ProviderTag provider : ORDER) {
            Collection<RawRating> ratings = byProvider.get(provider);
            if (ratings == null) {
                continue;
            }
            for (RawRating rating : ratings) {
                chosen.putIfAbsent(rating.source(), rating);
            }
        }
        return chosen;
    }

    /**
     * @return the provider whose rating wins for a source when several report it
     */
    public static ProviderTag winner(RatingSource source, Map<ProviderTag, ? extends Collection<RawRating>> byProvider) {
        for (ProviderTag provider : ORDER) {
            Collection<RawRating> ratings = byProvider.get(provider);
            if (ratings != null && ratings.stream().anyMatch(r -> r.source() == source)) {
                return provider;
            }
        }
        return null;
    }
}
