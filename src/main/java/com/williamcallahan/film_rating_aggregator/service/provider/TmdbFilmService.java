/**
 * Service for fetching film data from The Movie Database (TMDB) v3 API
 *
 * @author William Callahan
 *
 * Features:
 * - Title search with language, year and adult-content filters
 * - Validated details lookup with credits appended
 * - IMDb id lookup through the {@code find} endpoint
 * - Failures degrade to empty results and are logged
 */
package com.williamcallahan.film_rating_aggregator.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.film_rating_aggregator.config.ProviderConfigurationProperties;
import com.williamcallahan.film_rating_aggregator.exception.MalformedProviderPayloadException;
import com.williamcallahan.film_rating_aggregator.mapper.TmdbFilmMapper;
import com.williamcallahan.film_rating_aggregator.model.ProviderRecord;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
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
public class TmdbFilmService implements FilmProviderClient {

    private static final String API_NAME = ProviderTag.PRIMARY.getDisplayName();

    private final RequestGateway gateway;
    private final TmdbFilmMapper mapper;
    private final String language;

    public TmdbFilmService(@Qualifier("tmdbGateway") RequestGateway gateway,
                           TmdbFilmMapper mapper,
                           ProviderConfigurationProperties providerProperties) {
        this.gateway = gateway;
        this.mapper = mapper;
        this.language = providerProperties.getTmdb().getLanguage();
    }

    @Override
    public ProviderTag provider() {
        return ProviderTag.PRIMARY;
    }

    @Override
    public Mono<List<ProviderRecord>> searchByTitle(String title, Integer year, int page) {
        if (!ValidationUtils.hasText(title)) {
            return Mono.just(List.of());
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("query", title.trim());
        params.put("page", Math.max(1, page));
        params.put("language", language);
        params.put("include_adult", "false");
        params.put("year", year);

        return gateway.get("search/movie", params)
            .map(body -> mapResults(body.path("results")))
            .doOnNext(results -> ExternalApiLogger.logApiCallSuccess(log, API_NAME, "SEARCH", title, results.size()))
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "TMDB search failed for title '{}' (year {})", title, year);
                ExternalApiLogger.logApiCallFailure(log, API_NAME, "SEARCH", title, e.getMessage());
                return Mono.just(List.of());
            })
            .defaultIfEmpty(List.of());
    }

    @Override
    public Mono<ProviderRecord> getByNativeId(String nativeId) {
        if (!ValidationUtils.hasText(nativeId) || !nativeId.trim().chars().allMatch(Character::isDigit)) {
            log.debug("Rejecting non-numeric TMDB id '{}'", nativeId);
            return Mono.empty();
        }
        String id = nativeId.trim();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("language", language);
        params.put("append_to_response", "credits");

        return gateway.get("movie/" + id, params)
            .flatMap(body -> {
                String embedded = mapper.embeddedId(body);
                if (!id.equals(embedded)) {
                    ExternalApiLogger.logIdMismatch(log, API_NAME, id, embedded);
                    return Mono.empty();
                }
                return Mono.just(mapper.map(body));
            })
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "TMDB details lookup failed for id {}", id);
                ExternalApiLogger.logApiCallFailure(log, API_NAME, "DETAILS", id, e.getMessage());
                return Mono.empty();
            });
    }

    /**
     * Resolves an IMDb id through {@code find/{imdbId}}. The find endpoint returns summary
     * entries, so the cross-reference id is filled from the request.
     */
    @Override
    public Mono<ProviderRecord> findByCrossRefId(String crossRefId, Integer year) {
        if (!ValidationUtils.hasText(crossRefId)) {
            return Mono.empty();
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("external_source", "imdb_id");
        params.put("language", language);

        return gateway.get("find/" + crossRefId.trim(), params)
            .flatMap(body -> {
                JsonNode movies = body.path("movie_results");
                if (!movies.isArray() || movies.isEmpty()) {
                    log.debug("TMDB find returned no movie for {}", crossRefId);
                    return Mono.empty();
                }
                ProviderRecord record = mapper.map(movies.get(0));
                return Mono.just(record.toBuilder().crossRefId(crossRefId.trim()).build());
            })
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "TMDB find failed for IMDb id {}", crossRefId);
                ExternalApiLogger.logApiCallFailure(log, API_NAME, "FIND", crossRefId, e.getMessage());
                return Mono.empty();
            });
    }

    private List<ProviderRecord> mapResults(JsonNode results) {
        List<ProviderRecord> records = new ArrayList<>();
        for (JsonNode entry : results) {
            try {
                records.add(mapper.map(entry));
            } catch (MalformedProviderPayloadException e) {
                log.debug("Dropping TMDB search entry: {}", e.getMessage());
            }
        }
        return records;
    }
}
