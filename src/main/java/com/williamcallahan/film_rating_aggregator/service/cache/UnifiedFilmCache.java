/**
 * Cache of aggregation results keyed by primary id
 *
 * @author William Callahan
 *
 * Features:
 * - Refuses to store a film under a key other than its own primary id
 * - Evicts and reports a miss when a stored film's id does not match the key it was read with
 */
package com.williamcallahan.film_rating_aggregator.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.film_rating_aggregator.config.AppConfigurationProperties;
import com.williamcallahan.film_rating_aggregator.model.UnifiedFilm;
import com.williamcallahan.film_rating_aggregator.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@Component
public class UnifiedFilmCache {

    private final Cache<String, UnifiedFilm> films;

    public UnifiedFilmCache(AppConfigurationProperties appProperties) {
        this.films = Caffeine.newBuilder()
            .maximumSize(appProperties.getCache().getMaxSize())
            .expireAfterWrite(appProperties.getCache().getResultTtl())
            .recordStats()
            .build();
    }

    /**
     * @return true when stored
     */
    public boolean put(String primaryId, UnifiedFilm film) {
        if (!ValidationUtils.hasText(primaryId) || film == null) {
            return false;
        }
        if (!primaryId.equals(film.primaryId())) {
            log.warn("Refusing to cache film with primary id {} under key {}", film.primaryId(), primaryId);
            return false;
        }
        films.put(primaryId, film);
        return true;
    }

    public Optional<UnifiedFilm> get(String primaryId) {
        if (!ValidationUtils.hasText(primaryId)) {
            return Optional.empty();
        }
        UnifiedFilm film = films.getIfPresent(primaryId);
        if (film == null) {
            return Optional.empty();
        }
        if (!primaryId.equals(film.primaryId())) {
            log.warn("Cached film under key {} carries primary id {}; evicting", primaryId, film.primaryId());
            films.invalidate(primaryId);
            return Optional.empty();
        }
        return Optional.of(film);
    }

    public void evict(String primaryId) {
        films.invalidate(primaryId);
    }

    public void clear() {
        films.invalidateAll();
    }

    public long size() {
        films.cleanUp();
        return films.estimatedSize();
    }
}
