/**
 * Maps Kinopoisk unofficial API v2.2 film payloads into {@link ProviderRecord}s
 *
 * @author William Callahan
 *
 * Features:
 * - Accepts both {@code films/{id}} details and {@code films?keyword=} search items
 * - Prefers the Russian title as the display title, with the original or English name as original title
 * - Extracts Kinopoisk, IMDb and film critics ratings on their 0-10 scales
 */
package com.williamcallahan.film_rating_aggregator.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.film_rating_aggregator.exception.MalformedProviderPayloadException;
import com.williamcallahan.film_rating_aggregator.exception.RatingScaleException;
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
public class KinopoiskFilmMapper {

    public ProviderRecord map(JsonNode film) {
        if (film == null || !film.isObject()) {
            throw new MalformedProviderPayloadException(ProviderTag.REGIONAL, "Film payload is not a JSON object");
        }
        String id = embeddedId(film);
        if (id == null) {
            throw new MalformedProviderPayloadException(ProviderTag.REGIONAL, "Film payload has no kinopoiskId");
        }

        String nameRu = ValidationUtils.textOrNull(film, "nameRu");
        String nameOriginal = ValidationUtils.textOrNull(film, "nameOriginal");
        String nameEn = ValidationUtils.textOrNull(film, "nameEn");
        String original = nameOriginal != null ? nameOriginal : nameEn;

        List<RawRating> ratings = new ArrayList<>();
        addRating(ratings, film, RatingSource.KINOPOISK, "ratingKinopoisk", "ratingKinopoiskVoteCount", id);
        addRating(ratings, film, RatingSource.IMDB, "ratingImdb", "ratingImdbVoteCount", id);
        addRating(ratings, film, RatingSource.FILM_CRITICS, "ratingFilmCritics", "ratingFilmCriticsVoteCount", id);

        return ProviderRecord.builder()
            .provider(ProviderTag.REGIONAL)
            .nativeId(id)
            .title(nameRu != null ? nameRu : original)
            .originalTitle(original)
            .year(ValidationUtils.intOrNull(film, "year"))
            .crossRefId(ValidationUtils.textOrNull(film, "imdbId"))
            .ratings(ratings)
            .description(ValidationUtils.textOrNull(film, "description"))
            .posterUrl(ValidationUtils.textOrNull(film, "posterUrl"))
            .runtimeMinutes(ValidationUtils.intOrNull(film, "filmLength"))
            .genres(values(film.path("genres"), "genre"))
            .countries(values(film.path("countries"), "country"))
            .build();
    }

    /**
     * Search items carry {@code kinopoiskId}; older payloads use {@code filmId}.
     */
    public String embeddedId(JsonNode film) {
        if (film == null) {
            return null;
        }
        for (String field : List.of("kinopoiskId", "filmId")) {
            JsonNode id = film.get(field);
            if (id != null && id.canConvertToLong()) {
                return id.asText();
            }
        }
        return null;
    }

    private void addRating(List<RawRating> ratings, JsonNode film, RatingSource source,
                           String valueField, String votesField, String filmId) {
        JsonNode value = film.get(valueField);
        if (value == null || value.isNull()) {
            return;
        }
        double rating;
        if (value.isNumber()) {
            rating = value.asDouble();
        } else {
            String text = ValidationUtils.textOrNull(film, valueField);
            if (text == null) {
                return;
            }
            try {
                rating = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                log.debug("Skipping non-numeric Kinopoisk {} '{}' for film {}", valueField, text, filmId);
                return;
            }
        }
        if (rating <= 0) {
            return;
        }
        JsonNode votes = film.get(votesField);
        try {
            ratings.add(new RawRating(source, rating, 10.0,
                votes != null && votes.canConvertToLong() ? votes.asLong() : null));
        } catch (RatingScaleException e) {
            LoggingUtils.warn(log, e, "Skipping out-of-range Kinopoisk {} for film {}", valueField, filmId);
        }
    }

    private List<String> values(JsonNode array, String field) {
        List<String> values = new ArrayList<>();
        for (JsonNode entry : array) {
            String value = ValidationUtils.textOrNull(entry, field);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }
}
