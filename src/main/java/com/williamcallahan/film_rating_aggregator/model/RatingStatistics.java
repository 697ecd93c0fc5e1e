package com.williamcallahan.film_rating_aggregator.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Summary of a rating set on the 0-10 scale.
 * Min, max and average are {@code null} when no rating is present.
 */
public record RatingStatistics(
    int sourcesCount,
    BigDecimal min,
    BigDecimal max,
    BigDecimal average,
    List<SourceDetail> sources
) {
    /** Decimal places of every composite and summary value */
    public static final int SCALE = 2;

    public RatingStatistics {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static RatingStatistics empty() {
        return new RatingStatistics(0, null, null, null, List.of());
    }

    /**
     * Mean of the normalized values, half-up to 2 decimals.
     *
     * @return the mean, or null when there are no ratings
     */
    public static BigDecimal mean(Collection<NormalizedRating> ratings) {
        if (ratings == null || ratings.isEmpty()) {
            return null;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (NormalizedRating rating : ratings) {
            sum = sum.add(BigDecimal.valueOf(rating.normalizedValue()));
        }
        return sum.divide(BigDecimal.valueOf(ratings.size()), SCALE, RoundingMode.HALF_UP);
    }

    public static RatingStatistics of(Collection<NormalizedRating> ratings) {
        if (ratings == null || ratings.isEmpty()) {
            return empty();
        }
        List<SourceDetail> details = new ArrayList<>();
        BigDecimal min = null;
        BigDecimal max = null;
        for (NormalizedRating rating : ratings) {
            BigDecimal value = BigDecimal.valueOf(rating.normalizedValue()).setScale(SCALE, RoundingMode.HALF_UP);
            min = min == null || value.compareTo(min) < 0 ? value : min;
            max = max == null || value.compareTo(max) > 0 ? value : max;
            details.add(new SourceDetail(rating.source(), rating.raw().value(),
                rating.raw().maxValue(), value, rating.raw().votes()));
        }
        return new RatingStatistics(ratings.size(), min, max, mean(ratings), details);
    }

    public record SourceDetail(
        RatingSource source,
        double value,
        double maxValue,
        BigDecimal normalized,
        Long votes
    ) {
    }
}
