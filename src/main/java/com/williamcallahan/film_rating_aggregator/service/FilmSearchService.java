package com.williamcallahan.film_rating_aggregator.service;

import com.williamcallahan.film_rating_aggregator.config.CacheComponentsConfig;
import com.williamcallahan.film_rating_aggregator.model.ProviderRecord;
import com.williamcallahan.film_rating_aggregator.service.cache.PrimaryTitleGuessCache;
import com.williamcallahan.film_rating_aggregator.service.provider.TmdbFilmService;
import com.williamcallahan.film_rating_aggregator.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Film search against the primary catalog.
 * Results are cached briefly and every hit feeds {@link PrimaryTitleGuessCache}, so a later
 * aggregation by id can recover through a title search if the id lookup fails.
 */
@Service
@Slf4j
public class FilmSearchService {

    static final int MAX_RESULTS = 20;

    private final TmdbFilmService tmdbFilmService;
    private final PrimaryTitleGuessCache titleGuessCache;

    public FilmSearchService(TmdbFilmService tmdbFilmService, PrimaryTitleGuessCache titleGuessCache) {
        this.tmdbFilmService = tmdbFilmService;
        this.titleGuessCache = titleGuessCache;
    }

    /**
     * @param query title text
     * @param year release year filter, may be null
     * @return at most {@value #MAX_RESULTS} primary records, empty for a blank query
     */
    @Cacheable(value = CacheComponentsConfig.FILM_SEARCH_CACHE, key = "#query.trim().toLowerCase() + '-' + #year",
        condition = "#query != null")
    public Mono<List<ProviderRecord>> searchFilms(String query, Integer year) {
        if (!ValidationUtils.hasText(query)) {
            return Mono.just(List.of());
        }
        return tmdbFilmService.searchByTitle(query.trim(), year, 1)
            .map(results -> results.size() > MAX_RESULTS ? List.copyOf(results.subList(0, MAX_RESULTS)) : results)
            .doOnNext(results -> {
                results.forEach(record -> titleGuessCache.record(record.nativeId(), record.title()));
                log.debug("Film search '{}' ({}) returned {} result(s)", query, year, results.size());
            });
    }
}
