/**
 * Parses OMDb responses into ratings and provider records
 *
 * @author William Callahan
 *
 * Features:
 * - Reads {@code imdbRating}/{@code imdbVotes} and {@code Metascore} top-level fields
 * - Reads the {@code Ratings} array, accepting {@code "89%"} and {@code "x/y"} value formats
 * - Drops {@code "N/A"} placeholders and skips individually malformed values
 * - Treats {@code Response: "False"} as "no film"
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
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class OmdbRatingParser {

    /**
     * @return true when OMDb answered with {@code Response: "False"}
     */
    public boolean isNotFound(JsonNode payload) {
        return payload == null || "False".equalsIgnoreCase(payload.path("Response").asText());
    }

    /**
     * Extracts every usable rating from a by-id or by-title response.
     *
     * @return ratings keyed by source; empty for a not-found response
     */
    public Map<RatingSource, RawRating> parseRatings(JsonNode payload) {
        Map<RatingSource, RawRating> ratings = new EnumMap<>(RatingSource.class);
        if (isNotFound(payload)) {
            return ratings;
        }
        String imdbId = ValidationUtils.textOrNull(payload, "imdbID");

        String imdbRating = ValidationUtils.textOrNull(payload, "imdbRating");
        if (imdbRating != null) {
            Double value = parseNumber(imdbRating, "imdbRating", imdbId);
            if (value != null) {
                put(ratings, RatingSource.IMDB, value, 10.0, parseVotes(ValidationUtils.textOrNull(payload, "imdbVotes")), imdbId);
            }
        }

        String metascore = ValidationUtils.textOrNull(payload, "Metascore");
        if (metascore != null) {
            Double value = parseNumber(metascore, "Metascore", imdbId);
            if (value != null) {
                put(ratings, RatingSource.METACRITIC, value, 100.0, null, imdbId);
            }
        }

        for (JsonNode entry : payload.path("Ratings")) {
            String sourceName = ValidationUtils.textOrNull(entry, "Source");
            String value = ValidationUtils.textOrNull(entry, "Value");
            if (sourceName == null || value == null) {
                continue;
            }
            RatingSource source = sourceOf(sourceName);
            if (source == null) {
                log.debug("Ignoring unknown OMDb rating source '{}' for {}", sourceName, imdbId);
                continue;
            }
            // The top-level imdbRating carries votes, keep it when present
            if (source == RatingSource.IMDB && ratings.containsKey(RatingSource.IMDB)) {
                continue;
            }
            double[] parsed = parseScaledValue(value, sourceName, imdbId);
            if (parsed != null) {
                put(ratings, source, parsed[0], parsed[1], null, imdbId);
            }
        }
        return ratings;
    }

    /**
     * Maps a by-id or by-title response into a RATINGS record.
     *
     * @throws MalformedProviderPayloadException when the payload has no imdbID
     */
    public ProviderRecord mapRecord(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new MalformedProviderPayloadException(ProviderTag.RATINGS, "Payload is not a JSON object");
        }
        String imdbId = ValidationUtils.textOrNull(payload, "imdbID");
        if (imdbId == null) {
            throw new MalformedProviderPayloadException(ProviderTag.RATINGS, "Payload has no imdbID");
        }
        List<PersonCredit> credits = new ArrayList<>();
        splitList(ValidationUtils.textOrNull(payload, "Director")).stream().limit(3)
            .forEach(name -> credits.add(new PersonCredit(name, PersonCredit.Role.DIRECTOR, null, null)));
        splitList(ValidationUtils.textOrNull(payload, "Actors")).stream().limit(10)
            .forEach(name -> credits.add(new PersonCredit(name, PersonCredit.Role.ACTOR, null, null)));

        return ProviderRecord.builder()
            .provider(ProviderTag.RATINGS)
            .nativeId(imdbId)
            .crossRefId(imdbId)
            .title(ValidationUtils.textOrNull(payload, "Title"))
            .year(yearOf(ValidationUtils.textOrNull(payload, "Year")))
            .ratings(List.copyOf(parseRatings(payload).values()))
            .description(ValidationUtils.textOrNull(payload, "Plot"))
            .posterUrl(ValidationUtils.textOrNull(payload, "Poster"))
            .runtimeMinutes(ValidationUtils.intOrNull(payload, "Runtime"))
            .genres(splitList(ValidationUtils.textOrNull(payload, "Genre")))
            .countries(splitList(ValidationUtils.textOrNull(payload, "Country")))
            .credits(credits)
            .build();
    }

    /**
     * Maps one entry of a {@code ?s=} search response; these carry no ratings.
     */
    public ProviderRecord mapSearchEntry(JsonNode entry) {
        String imdbId = ValidationUtils.textOrNull(entry, "imdbID");
        if (imdbId == null) {
            throw new MalformedProviderPayloadException(ProviderTag.RATINGS, "Search entry has no imdbID");
        }
        return ProviderRecord.builder()
            .provider(ProviderTag.RATINGS)
            .nativeId(imdbId)
            .crossRefId(imdbId)
            .title(ValidationUtils.textOrNull(entry, "Title"))
            .year(yearOf(ValidationUtils.textOrNull(entry, "Year")))
            .posterUrl(ValidationUtils.textOrNull(entry, "Poster"))
            .build();
    }

    static RatingSource sourceOf(String sourceName) {
        if (sourceName.contains("Rotten Tomatoes")) {
            return RatingSource.ROTTEN_TOMATOES;
        }
        if (sourceName.contains("Metacritic")) {
            return RatingSource.METACRITIC;
        }
        if (sourceName.contains("Internet Movie Database")) {
            return RatingSource.IMDB;
        }
        return null;
    }

    /**
     * Parses {@code "89%"} as 89 of 100 and {@code "7.8/10"} as 7.8 of 10.
     *
     * @return {value, max} or null when the text is not in either format
     */
    static double[] parseScaledValue(String text, String sourceName, String imdbId) {
        String trimmed = text.trim();
        try {
            if (trimmed.endsWith("%")) {
                return new double[] {Double.parseDouble(trimmed.substring(0, trimmed.length() - 1).trim()), 100.0};
            }
            int slash = trimmed.indexOf('/');
            if (slash > 0) {
                return new double[] {
                    Double.parseDouble(trimmed.substring(0, slash).trim()),
                    Double.parseDouble(trimmed.substring(slash + 1).trim())
                };
            }
        } catch (NumberFormatException e) {
            log.warn("Skipping malformed OMDb {} value '{}' for {}", sourceName, text, imdbId);
            return null;
        }
        log.warn("Skipping OMDb {} value '{}' for {}: unrecognized format", sourceName, text, imdbId);
        return null;
    }

    private static Double parseNumber(String text, String field, String imdbId) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            log.warn("Skipping malformed OMDb {} '{}' for {}", field, text, imdbId);
            return null;
        }
    }

    static Long parseVotes(String text) {
        if (text == null) {
            return null;
        }
        String digits = text.replace(",", "").trim();
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static void put(Map<RatingSource, RawRating> ratings, RatingSource source, double value,
                            double max, Long votes, String imdbId) {
        try {
            ratings.put(source, new RawRating(source, value, max, votes));
        } catch (RatingScaleException e) {
            LoggingUtils.warn(log, e, "Skipping out-of-range OMDb {} rating for {}", source.getKey(), imdbId);
        }
    }

    private static Integer yearOf(String year) {
        if (year == null || year.length() < 4) {
            return null;
        }
        try {
            return Integer.parseInt(year.substring(0, 4));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<String> splitList(String text) {
        if (text == null) {
            return Collections.emptyList();
        }
        return Arrays.stream(text.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }
}
