/**
 * One provider's view of a film, mapped from the provider's JSON payload
 *
 * @author William Callahan
 *
 * Features:
 * - Tagged with the provider that produced it
 * - Keeps the provider-native id and the shared cross-reference (IMDb) id apart
 * - Holds zero or more raw ratings in the provider's own scales
 * - Optional descriptive fields (credits, genres, poster) used to fill the unified film
 */
package com.williamcallahan.film_rating_aggregator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.film_rating_aggregator.exception.MalformedProviderPayloadException;
import com.williamcallahan.film_rating_aggregator.util.ValidationUtils;
import lombok.Builder;

import java.util.List;
import java.util.Optional;

@Builder(toBuilder = true)
public record ProviderRecord(
    ProviderTag provider,
    @JsonProperty("native_id") String nativeId,
    String title,
    @JsonProperty("original_title") String originalTitle,
    Integer year,
    @JsonProperty("cross_ref_id") String crossRefId,
    List<RawRating> ratings,
    String description,
    @JsonProperty("poster_url") String posterUrl,
    @JsonProperty("runtime_minutes") Integer runtimeMinutes,
    List<String> genres,
    List<String> countries,
    List<PersonCredit> credits
) {
    public ProviderRecord {
        if (provider == null) {
            throw new MalformedProviderPayloadException(null, "Provider tag is required");
        }
        if (!ValidationUtils.hasText(nativeId)) {
            throw new MalformedProviderPayloadException(provider, "Record has no provider-native id");
        }
        nativeId = nativeId.trim();
        crossRefId = ValidationUtils.trimToNull(crossRefId);
        title = ValidationUtils.trimToNull(title);
        originalTitle = ValidationUtils.trimToNull(originalTitle);
        ratings = ratings == null ? List.of() : List.copyOf(ratings);
        genres = genres == null ? List.of() : List.copyOf(genres);
        countries = countries == null ? List.of() : List.copyOf(countries);
        credits = credits == null ? List.of() : List.copyOf(credits);
    }

    /**
     * @return the native rating this provider reported for the given source, if any
     */
    public Optional<RawRating> ratingFor(RatingSource source) {
        return ratings.stream().filter(r -> r.source() == source).findFirst();
    }
}
