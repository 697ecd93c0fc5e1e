/**
 * Maps TMDB v3 movie payloads into {@link ProviderRecord}s
 *
 * @author William Callahan
 *
 * Features:
 * - Handles both full {@code movie/{id}} details (with appended credits) and search result entries
 * - Exposes the native {@code vote_average} as the TMDB rating on a 0-10 scale, dropping out-of-range values
 * - Builds poster and profile image URLs from TMDB relative paths
 * - Keeps at most 3 directors and 10 cast members
 */
package com.williamcallahan.film_rating_aggregator.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.film_rating_aggregator.exception.MalformedProviderPayloadException;
import com.williamcallahan.film_rating_aggregator.exception.RatingScaleException;
import com.williamcallahan.film_rating_aggregator.model.PersonCredit;
import com.williamcallahan.film_rating_aggregator.model.ProviderRecord;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.model.RatingSource;
import com.williamcallahan.film_rating_aggregator.model.RawRating;
import com.williamcallahan.film_rating_aggregator.util.LoggingUtils;
import com.williamcallahan.film_rating_aggregator.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
public class TmdbFilmMapper {

    static final String POSTER_BASE_URL = "https://image.tmdb.org/t/p/original";
    static final String PROFILE_BASE_URL = "https://image.tmdb.org/t/p/w185";
    static final int MAX_DIRECTORS = 3;
    static final int MAX_CAST = 10;

    /**
     * Maps a movie object (details or search entry).
     *
     * @throws MalformedProviderPayloadException when the payload is not an object or carries no id
     */
    public ProviderRecord map(JsonNode movie) {
        if (movie == null || !movie.isObject()) {
            throw new MalformedProviderPayloadException(ProviderTag.PRIMARY, "Movie payload is not a JSON object");
        }
        JsonNode id = movie.get("id");
        if (id == null || !id.canConvertToLong()) {
            throw new MalformedProviderPayloadException(ProviderTag.PRIMARY, "Movie payload has no numeric id");
        }

        return ProviderRecord.builder()
            .provider(ProviderTag.PRIMARY)
            .nativeId(id.asText())
            .title(ValidationUtils.textOrNull(movie, "title"))
            .originalTitle(ValidationUtils.textOrNull(movie, "original_title"))
            .year(yearOf(ValidationUtils.textOrNull(movie, "release_date")))
            .crossRefId(ValidationUtils.textOrNull(movie, "imdb_id"))
            .ratings(ratingOf(movie, id.asText()))
            .description(ValidationUtils.textOrNull(movie, "overview"))
            .posterUrl(imageUrl(POSTER_BASE_URL, ValidationUtils.textOrNull(movie, "poster_path")))
            .runtimeMinutes(positiveOrNull(ValidationUtils.intOrNull(movie, "runtime")))
            .genres(names(movie.path("genres")))
            .countries(names(movie.path("production_countries")))
            .credits(credits(movie.path("credits")))
            .build();
    }

    /**
     * @return the embedded id of a movie payload, or null when absent
     */
    public String embeddedId(JsonNode movie) {
        JsonNode id = movie == null ? null : movie.get("id");
        return id == null || id.isNull() ? null : id.asText();
    }

    static Integer yearOf(String releaseDate) {
        if (releaseDate == null || releaseDate.length() < 4) {
            return null;
        }
        try {
            return Integer.parseInt(releaseDate.substring(0, 4));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private List<RawRating> ratingOf(JsonNode movie, String movieId) {
        JsonNode average = movie.get("vote_average");
        if (average == null || !average.isNumber() || average.asDouble() <= 0) {
            return List.of();
        }
        JsonNode count = movie.get("vote_count");
        Long votes = count != null && count.canConvertToLong() ? count.asLong() : null;
        try {
            return List.of(new RawRating(RatingSource.TMDB, average.asDouble(), 10.0, votes));
        } catch (RatingScaleException e) {
            LoggingUtils.warn(log, e, "Skipping out-of-range TMDB vote_average for movie {}", movieId);
            return List.of();
        }
    }

    private List<String> names(JsonNode array) {
        List<String> names = new ArrayList<>();
        for (JsonNode entry : array) {
            String name = ValidationUtils.textOrNull(entry, "name");
            if (name != null) {
                names.add(name);
            }
        }
        return names;
    }

    private List<PersonCredit> credits(JsonNode credits) {
        List<PersonCredit> result = new ArrayList<>();
        int directors = 0;
        for (JsonNode person : credits.path("crew")) {
            if (directors >= MAX_DIRECTORS) {
                break;
            }
            String name = ValidationUtils.textOrNull(person, "name");
            if (name != null && "Director".equals(ValidationUtils.textOrNull(person, "job"))) {
                result.add(new PersonCredit(name, PersonCredit.Role.DIRECTOR, null,
                    imageUrl(PROFILE_BASE_URL, ValidationUtils.textOrNull(person, "profile_path"))));
                directors++;
            }
        }
        int cast = 0;
        for (JsonNode person : credits.path("cast")) {
            if (cast >= MAX_CAST) {
                break;
            }
            cast++;
            String name = ValidationUtils.textOrNull(person, "name");
            if (name != null) {
                result.add(new PersonCredit(name, PersonCredit.Role.ACTOR,
                    ValidationUtils.textOrNull(person, "character"),
                    imageUrl(PROFILE_BASE_URL, ValidationUtils.textOrNull(person, "profile_path"))));
            }
        }
        return result;
    }

    private static String imageUrl(String base, String path) {
        return path == null ? null : base + path;
    }

    private static Integer positiveOrNull(Integer value) {
        return value != null && value > 0 ? value : null;
    }
}
