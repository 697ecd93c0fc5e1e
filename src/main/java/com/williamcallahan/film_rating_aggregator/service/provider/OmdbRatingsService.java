/**
 * Service for fetching ratings from the OMDb API
 *
 * @author William Callahan
 *
 * Features:
 * - Ratings by IMDb id: IMDb, Rotten Tomatoes and Metacritic
 * - Lookup by IMDb id and by exact title, plus paged search
 * - Treats {@code Response: "False"} as not found
 * - Failures degrade to empty results and are logged
 */
package com.williamcallahan.film_rating_aggregator.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.film_rating_aggregator.exception.MalformedProviderPayloadException;
import com.williamcallahan.film_rating_aggregator.mapper.OmdbRatingParser;
import com.williamcallahan.film_rating_aggregator.model.ProviderRecord;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.model.RatingSource;
import com.williamcallahan.film_rating_aggregator.model.RawRating;
import com.williamcallahan.film_rating_aggregator.service.gateway.RequestGateway;
import com.williamcallahan.film_rating_aggregator.util.ExternalApiLogger;
import com.williamcallahan.film_rating_aggregator.util.LoggingUtils;
import com.williamcallahan.film_rating_aggregator.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class OmdbRatingsService implements FilmProviderClient {

    private static final String API_NAME = ProviderTag.RATINGS.getDisplayName();
    private static final String ROOT = "/";

    private final RequestGateway gateway;
    private final OmdbRatingParser parser;

    public OmdbRatingsService(@Qualifier("omdbGateway") RequestGateway gateway, OmdbRatingParser parser) {
        this.gateway = gateway;
        this.parser = parser;
    }

    @Override
    public ProviderTag provider() {
        return ProviderTag.RATINGS;
    }

    /**
     * Fetches every rating OMDb knows for an IMDb id.
     *
     * @return ratings keyed by source; empty when not found or on failure
     */
    public Mono<Map<RatingSource, RawRating>> getRatingsByCrossRefId(String imdbId) {
        if (!ValidationUtils.hasText(imdbId)) {
            return Mono.just(Map.of());
        }
        String id = imdbId.trim();
        return gateway.get(ROOT, Map.of("i", id))
            .map(parser::parseRatings)
            .doOnNext(ratings -> ExternalApiLogger.logApiCallSuccess(log, API_NAME, "RATINGS", id, ratings.size()))
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "OMDb ratings lookup failed for {}", id);
                ExternalApiLogger.logApiCallFailure(log, API_NAME, "RATINGS", id, e.getMessage());
                return Mono.just(Map.of());
            })
            .defaultIfEmpty(Map.of());
    }

    /**
     * The OMDb native id is the IMDb id.
     */
    @Override
    public Mono<ProviderRecord> getByNativeId(String nativeId) {
        if (!ValidationUtils.hasText(nativeId)) {
            return Mono.empty();
        }
        String id = nativeId.trim();
        return gateway.get(ROOT, Map.of("i", id))
            .flatMap(body -> {
                if (parser.isNotFound(body)) {
                    log.debug("OMDb has no film for {}: {}", id, ValidationUtils.textOrNull(body, "Error"));
                    return Mono.empty();
                }
                String embedded = ValidationUtils.textOrNull(body, "imdbID");
                if (!id.equalsIgnoreCase(embedded)) {
                    ExternalApiLogger.logIdMismatch(log, API_NAME, id, embedded);
                    return Mono.empty();
                }
                return Mono.just(parser.mapRecord(body));
            })
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "OMDb lookup failed for {}", id);
                ExternalApiLogger.logApiCallFailure(log, API_NAME, "DETAILS", id, e.getMessage());
                return Mono.empty();
            });
    }

    @Override
    public Mono<ProviderRecord> findByCrossRefId(String crossRefId, Integer year) {
        return getByNativeId(crossRefId);
    }

    /**
     * Exact-title lookup through {@code ?t=}.
     */
    public Mono<ProviderRecord> getByTitle(String title) {
        if (!ValidationUtils.hasText(title)) {
            return Mono.empty();
        }
        return gateway.get(ROOT, Map.of("t", title.trim()))
            .flatMap(body -> parser.isNotFound(body) ? Mono.<ProviderRecord>empty() : Mono.just(parser.mapRecord(body)))
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "OMDb title lookup failed for '{}'", title);
                ExternalApiLogger.logApiCallFailure(log, API_NAME, "TITLE", title, e.getMessage());
                return Mono.empty();
            });
    }

    @Override
    public Mono<List<ProviderRecord>> searchByTitle(String title, Integer year, int page) {
        if (!ValidationUtils.hasText(title)) {
            return Mono.just(List.of());
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("s", title.trim());
        params.put("page", Math.max(1, page));
        params.put("y", year);
        return gateway.get(ROOT, params)
            .map(body -> parser.isNotFound(body) ? List.<ProviderRecord>of() : mapSearch(body.path("Search")))
            .doOnNext(results -> ExternalApiLogger.logApiCallSuccess(log, API_NAME, "SEARCH", title, results.size()))
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "OMDb search failed for '{}'", title);
                ExternalApiLogger.logApiCallFailure(log, API_NAME, "SEARCH", title, e.getMessage());
                return Mono.just(List.of());
            })
            .defaultIfEmpty(List.of());
    }

    private List<ProviderRecord> mapSearch(JsonNode entries) {
        List<ProviderRecord> records = new ArrayList<>();
        for (JsonNode entry : entries) {
            try {
                records.add(parser.mapSearchEntry(entry));
            } catch (MalformedProviderPayloadException e) {
                log.debug("Dropping OMDb search entry: {}", e.getMessage());
            }
        }
        return records;
    }
}
