/**
 * Canonical merged view of one film across all providers
 *
 * @author William Callahan
 *
 * Features:
 * - Canonical descriptive fields taken primary first, then regional, then the ratings provider
 * - Up to one {@link ProviderRecord} per provider tag
 * - Rating set keyed by source; adding a rating for a source replaces the previous one
 * - Composite rating and statistics always recomputed from the current rating set
 * - Weighted rating computed once at aggregation time, dropped when the rating set changes
 */
package com.williamcallahan.film_rating_aggregator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

public record UnifiedFilm(
    @JsonProperty("primary_id") String primaryId,
    @JsonProperty("cross_ref_id") String crossRefId,
    String title,
    @JsonProperty("original_title") String originalTitle,
    Integer year,
    String description,
    @JsonProperty("poster_url") String posterUrl,
    @JsonProperty("runtime_minutes") Integer runtimeMinutes,
    List<String> genres,
    List<String> countries,
    List<PersonCredit> credits,
    @JsonProperty("provider_records") Map<ProviderTag, ProviderRecord> providerRecords,
    Map<RatingSource, NormalizedRating> ratings,
    @JsonProperty("weighted_rating") BigDecimal weightedRating
) {
    /** Order in which provider records feed canonical fields */
    private static final List<ProviderTag> CANONICAL_ORDER =
        List.of(ProviderTag.PRIMARY, ProviderTag.REGIONAL, ProviderTag.RATINGS);

    public UnifiedFilm {
        genres = genres == null ? List.of() : List.copyOf(genres);
        countries = countries == null ? List.of() : List.copyOf(countries);
        credits = credits == null ? List.of() : List.copyOf(credits);
        providerRecords = freeze(providerRecords, ProviderTag.class);
        ratings = freeze(ratings, RatingSource.class);
    }

    /**
     * Builds a film from the resolved provider records and the normalized ratings collected for them.
     *
     * @param records resolved records keyed by provider, PRIMARY expected
     * @param ratings normalized ratings keyed by source
     */
    public static UnifiedFilm fromRecords(Map<ProviderTag, ProviderRecord> records,
                                          Map<RatingSource, NormalizedRating> ratings) {
        return fromRecords(records, ratings, null);
    }

    /**
     * @param weightedRating weighted composite over {@code ratings}, null when not computed
     */
    public static UnifiedFilm fromRecords(Map<ProviderTag, ProviderRecord> records,
                                          Map<RatingSource, NormalizedRating> ratings,
                                          BigDecimal weightedRating) {
        Objects.requireNonNull(records, "records");
        ProviderRecord primary = records.get(ProviderTag.PRIMARY);
        return new UnifiedFilm(
            primary != null ? primary.nativeId() : null,
            first(records, ProviderRecord::crossRefId),
            first(records, ProviderRecord::title),
            first(records, ProviderRecord::originalTitle),
            first(records, ProviderRecord::year),
            first(records, ProviderRecord::description),
            first(records, ProviderRecord::posterUrl),
            first(records, ProviderRecord::runtimeMinutes),
            firstNonEmpty(records, ProviderRecord::genres),
            firstNonEmpty(records, ProviderRecord::countries),
            firstNonEmpty(records, ProviderRecord::credits),
            records,
            ratings,
            weightedRating
        );
    }

    /**
     * @return composite score rounded half-up to 2 decimals, or {@code null} with no ratings
     */
    @JsonProperty("composite_rating")
    public BigDecimal compositeRating() {
        return RatingStatistics.mean(ratings.values());
    }

    @JsonProperty("statistics")
    public RatingStatistics statistics() {
        return RatingStatistics.of(ratings.values());
    }

    @JsonProperty("ratings_count")
    public int ratingsCount() {
        return ratings.size();
    }

    /**
     * @return a copy with the rating set, replacing any rating already held for the same source;
     *         the weighted rating is cleared since it no longer matches the set
     */
    public UnifiedFilm withRating(NormalizedRating rating) {
        Map<RatingSource, NormalizedRating> updated = new EnumMap<>(RatingSource.class);
        updated.putAll(ratings);
        updated.put(rating.source(), rating);
        return new UnifiedFilm(primaryId, crossRefId, title, originalTitle, year, description, posterUrl,
            runtimeMinutes, genres, countries, credits, providerRecords, updated, null);
    }

    public boolean hasProvider(ProviderTag tag) {
        return providerRecords.containsKey(tag);
    }

    private static <T> T first(Map<ProviderTag, ProviderRecord> records, Function<ProviderRecord, T> field) {
        for (ProviderTag tag : CANONICAL_ORDER) {
            ProviderRecord record = records.get(tag);
            if (record != null && field.apply(record) != null) {
                return field.apply(record);
            }
        }
        return null;
    }

    private static <T> List<T> firstNonEmpty(Map<ProviderTag, ProviderRecord> records,
                                             Function<ProviderRecord, List<T>> field) {
        for (ProviderTag tag : CANONICAL_ORDER) {
            ProviderRecord record = records.get(tag);
            if (record != null && !field.apply(record).isEmpty()) {
                return field.apply(record);
            }
        }
        return List.of();
    }

    private static <K extends Enum<K>, V> Map<K, V> freeze(Map<K, V> source, Class<K> keyType) {
        Map<K, V> copy = new EnumMap<>(keyType);
        if (source != null) {
            copy.putAll(source);
        }
        return Collections.unmodifiableMap(copy);
    }
}
