/**
 * Composite scores over normalized ratings
 *
 * @author William Callahan
 *
 * Features:
 * - Arithmetic mean, rounded half-up to 2 decimals, null for no ratings
 * - Weighted mean over configured sources, equal weights for IMDb, Kinopoisk, Rotten Tomatoes and Metacritic by default
 * - Summary statistics per rating set
 */
package com.williamcallahan.film_rating_aggregator.service.rating;

import com.williamcallahan.film_rating_aggregator.config.AppConfigurationProperties;
import com.williamcallahan.film_rating_aggregator.model.NormalizedRating;
import com.williamcallahan.film_rating_aggregator.model.RatingSource;
import com.williamcallahan.film_rating_aggregator.model.RatingStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

@Slf4j
@Component
public class CompositeRatingCalculator {

    /** Used when {@code app.aggregation.weights} is empty */
    static final Map<RatingSource, Double> DEFAULT_WEIGHTS = defaultWeights();

    private final Map<RatingSource, Double> configuredWeights;

    public CompositeRatingCalculator(AppConfigurationProperties appProperties) {
        Map<RatingSource, Double> weights = new EnumMap<>(RatingSource.class);
        appProperties.getAggregation().getWeights().forEach((key, weight) -> RatingSource.fromKey(key)
            .ifPresentOrElse(source -> weights.put(source, requireNonNegative(key, weight)),
                () -> log.warn("Ignoring weight for unknown rating source '{}'", key)));
        this.configuredWeights = weights.isEmpty() ? DEFAULT_WEIGHTS : Collections.unmodifiableMap(weights);
    }

    public Map<RatingSource, Double> getWeights() {
        return configuredWeights;
    }

    public BigDecimal computeComposite(Collection<NormalizedRating> ratings) {
        return RatingStatistics.mean(ratings);
    }

    /**
     * Weighted mean with the weights from {@code app.aggregation.weights}, or the defaults when none are set.
     */
    public BigDecimal computeWeighted(Collection<NormalizedRating> ratings) {
        return computeWeighted(ratings, configuredWeights);
    }

    /**
     * Weighted mean. Sources without a weight are left out of both numerator and denominator.
     *
     * @return the weighted composite, or null when no weighted source remains or the total weight is zero
     * @throws IllegalArgumentException for a negative weight
     */
    public BigDecimal computeWeighted(Collection<NormalizedRating> ratings, Map<RatingSource, Double> weights) {
        if (ratings == null || ratings.isEmpty() || weights == null || weights.isEmpty()) {
            return null;
        }
        BigDecimal numerator = BigDecimal.ZERO;
        BigDecimal totalWeight = BigDecimal.ZERO;
        for (NormalizedRating rating : ratings) {
            Double weight = weights.get(rating.source());
            if (weight == null) {
                continue;
            }
            if (weight < 0) {
                throw new IllegalArgumentException("Negative weight for " + rating.source().getKey());
            }
            BigDecimal w = BigDecimal.valueOf(weight);
            numerator = numerator.add(w.multiply(BigDecimal.valueOf(rating.normalizedValue())));
            totalWeight = totalWeight.add(w);
        }
        if (totalWeight.signum() == 0) {
            return null;
        }
        return numerator.divide(totalWeight, RatingStatistics.SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Count, min, max, mean and per-source detail of a rating set.
     */
    public RatingStatistics summarize(Collection<NormalizedRating> ratings) {
        return RatingStatistics.of(ratings);
    }

    private static Double requireNonNegative(String key, Double weight) {
        if (weight == null || weight < 0) {
            throw new IllegalArgumentException("Invalid weight " + weight + " for rating source '" + key + "'");
        }
        return weight;
    }

    private static Map<RatingSource, Double> defaultWeights() {
        Map<RatingSource, Double> weights = new EnumMap<>(RatingSource.class);
        weights.put(RatingSource.IMDB, 0.25);
        weights.put(RatingSource.KINOPOISK, 0.25);
        weights.put(RatingSource.ROTTEN_TOMATOES, 0.25);
        weights.put(RatingSource.METACRITIC, 0.25);
        return Collections.unmodifiableMap(weights);
    }
}
