/**
 * Service for fetching film data from the unofficial Kinopoisk API v2.2
 *
 * @author William Callahan
 *
 * Features:
 * - Keyword search with an optional single-year window
 * - Validated details lookup by Kinopoisk id
 * - IMDb id lookup through keyword search filtered on {@code imdbId}, with a sanitized-title fallback
 * - Failures degrade to empty results and are logged
 */
package com.williamcallahan.film_rating_aggregator.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.film_rating_aggregator.exception.MalformedProviderPayloadException;
import com.williamcallahan.film_rating_aggregator.mapper.KinopoiskFilmMapper;
import com.williamcallahan.film_rating_aggregator.model.ProviderRecord;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.service.gateway.RequestGateway;
import com.williamcallahan.film_rating_aggregator.util.ExternalApiLogger;
import com.williamcallahan.film_rating_aggregator.util.LoggingUtils;
import com.williamcallahan.film_rating_aggregator.util.TextUtils;
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
public class KinopoiskFilmService implements FilmProviderClient {

    private static final String API_NAME = ProviderTag.REGIONAL.getDisplayName();

    private final RequestGateway gateway;
    private final KinopoiskFilmMapper mapper;

    public KinopoiskFilmService(@Qualifier("kinopoiskGateway") RequestGateway gateway, KinopoiskFilmMapper mapper) {
        this.gateway = gateway;
        this.mapper = mapper;
    }

    @Override
    public ProviderTag provider() {
        return ProviderTag.REGIONAL;
    }

    @Override
    public Mono<List<ProviderRecord>> searchByTitle(String title, Integer year, int page) {
        if (!ValidationUtils.hasText(title)) {
            return Mono.just(List.of());
        }
        return searchItems(title.trim(), year, page)
            .map(this::mapItems)
            .doOnNext(results -> ExternalApiLogger.logApiCallSuccess(log, API_NAME, "SEARCH", title, results.size()))
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "Kinopoisk search failed for title '{}' (year {})", title, year);
                ExternalApiLogger.logApiCallFailure(log, API_NAME, "SEARCH", title, e.getMessage());
                return Mono.just(List.of());
            })
            .defaultIfEmpty(List.of());
    }

    @Override
    public Mono<ProviderRecord> getByNativeId(String nativeId) {
        if (!ValidationUtils.hasText(nativeId) || !nativeId.trim().chars().allMatch(Character::isDigit)) {
            log.debug("Rejecting non-numeric Kinopoisk id '{}'", nativeId);
            return Mono.empty();
        }
        String id = nativeId.trim();
        return gateway.get("films/" + id, Map.of())
            .flatMap(body -> {
                String embedded = mapper.embeddedId(body);
                if (!id.equals(embedded)) {
                    ExternalApiLogger.logIdMismatch(log, API_NAME, id, embedded);
                    return Mono.empty();
                }
                return Mono.just(mapper.map(body));
            })
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "Kinopoisk details lookup failed for id {}", id);
                ExternalApiLogger.logApiCallFailure(log, API_NAME, "DETAILS", id, e.getMessage());
                return Mono.empty();
            });
    }

    /**
     * Keyword search with the IMDb id, accepting only the item whose {@code imdbId} equals it.
     */
    @Override
    public Mono<ProviderRecord> findByCrossRefId(String crossRefId, Integer year) {
        if (!ValidationUtils.hasText(crossRefId)) {
            return Mono.empty();
        }
        String imdbId = crossRefId.trim();
        return searchItems(imdbId, year, 1)
            .flatMap(items -> {
                for (JsonNode item : items) {
                    if (imdbId.equals(ValidationUtils.textOrNull(item, "imdbId"))) {
                        return Mono.just(mapper.map(item));
                    }
                }
                log.debug("Kinopoisk keyword search found no item with imdbId {}", imdbId);
                return Mono.<ProviderRecord>empty();
            })
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "Kinopoisk IMDb lookup failed for {}", imdbId);
                ExternalApiLogger.logApiCallFailure(log, API_NAME, "FIND", imdbId, e.getMessage());
                return Mono.empty();
            });
    }

    /**
     * IMDb id lookup that falls back to a search by the sanitized title (and year),
     * accepting the first item of that search.
     *
     * @param imdbId IMDb id to match
     * @param title title used for the fallback search, may be null
     * @param year release year, may be null
     */
    public Mono<ProviderRecord> getByCrossRefId(String imdbId, String title, Integer year) {
        return findByCrossRefId(imdbId, year)
            .switchIfEmpty(Mono.defer(() -> searchSanitized(title, year)));
    }

    /**
     * Searches with {@link #sanitizeTitle(String)} applied and returns the first hit.
     */
    public Mono<ProviderRecord> searchSanitized(String title, Integer year) {
        String clean = sanitizeTitle(title);
        if (clean.isEmpty()) {
            return Mono.empty();
        }
        log.debug("Kinopoisk fallback search with sanitized title '{}' (from '{}')", clean, title);
        return searchByTitle(clean, year, 1)
            .flatMap(results -> results.isEmpty() ? Mono.<ProviderRecord>empty() : Mono.just(results.get(0)));
    }

    /**
     * Strips year and other parenthetical suffixes and collapses punctuation, for fallback searches only.
     */
    public static String sanitizeTitle(String title) {
        return TextUtils.sanitizeTitleForSearch(title);
    }

    private Mono<JsonNode> searchItems(String keyword, Integer year, int page) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("keyword", keyword);
        params.put("page", Math.max(1, page));
        params.put("yearFrom", year);
        params.put("yearTo", year);
        return gateway.get("films", params).map(body -> body.path("items"));
    }

    private List<ProviderRecord> mapItems(JsonNode items) {
        List<ProviderRecord> records = new ArrayList<>();
        for (JsonNode item : items) {
            try {
                records.add(mapper.map(item));
            } catch (MalformedProviderPayloadException e) {
                log.debug("Dropping Kinopoisk search item: {}", e.getMessage());
            }
        }
        return records;
    }
}
