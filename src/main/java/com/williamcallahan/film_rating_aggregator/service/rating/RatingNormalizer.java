package com.williamcallahan.film_rating_aggregator.service.rating;

import com.williamcallahan.film_rating_aggregator.exception.RatingScaleException;
import com.williamcallahan.film_rating_aggregator.model.NormalizedRating;
import com.williamcallahan.film_rating_aggregator.model.RatingSource;
import com.williamcallahan.film_rating_aggregator.model.RawRating;
import com.williamcallahan.film_rating_aggregator.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Projects raw ratings onto the common 0-10 scale.
 */
@Slf4j
@Component
public class RatingNormalizer {

    private static final BigDecimal TEN = BigDecimal.TEN;

    /**
     * @return the rating with {@code normalizedValue = value / max * 10}
     * @throws RatingScaleException when the scale is not positive or the value lies outside it
     */
    public NormalizedRating normalize(RawRating raw) {
        if (raw == null) {
            throw new RatingScaleException("Cannot normalize a missing rating");
        }
        if (raw.maxValue() <= 0) {
            throw new RatingScaleException("Rating scale for " + raw.source().getKey() + " must be positive");
        }
        // Decimal arithmetic so 89 of 100 gives exactly 8.9
        double normalized = BigDecimal.valueOf(raw.value())
            .multiply(TEN)
            .divide(BigDecimal.valueOf(raw.maxValue()), MathContext.DECIMAL64)
            .doubleValue();
        if (normalized < 0 || normalized > 10) {
            throw new RatingScaleException("Normalized " + raw.source().getKey() + " rating " + normalized + " is outside [0, 10]");
        }
        return new NormalizedRating(raw, normalized);
    }

    /**
     * Normalizes every rating, skipping (and logging) those whose scale is invalid.
     */
    public Map<RatingSource, NormalizedRating> normalizeAll(Collection<RawRating> ratings) {
        Map<RatingSource, NormalizedRating> normalized = new EnumMap<>(RatingSource.class);
        for (RawRating raw : ratings) {
            try {
                normalized.put(raw.source(), normalize(raw));
            } catch (RatingScaleException e) {
                LoggingUtils.warn(log, e, "Skipping rating that cannot be normalized: {}", raw);
            }
        }
        return normalized;
    }
}
