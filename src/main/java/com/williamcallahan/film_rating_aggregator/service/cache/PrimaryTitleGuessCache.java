package com.williamcallahan.film_rating_aggregator.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.film_rating_aggregator.config.AppConfigurationProperties;
import com.williamcallahan.film_rating_aggregator.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Remembers the last title seen for each primary (TMDB) id, from search results and
 * successful aggregations. Used to recover when a primary lookup by id comes back empty.
 */
@Slf4j
@Component
public class PrimaryTitleGuessCache {

    private final Cache<String, String> guesses;

    public PrimaryTitleGuessCache(AppConfigurationProperties appProperties) {
        this.guesses = Caffeine.newBuilder()
            .maximumSize(appProperties.getCache().getMaxSize())
            .expireAfterWrite(appProperties.getCache().getTitleGuessTtl())
            .build();
    }

    public void record(String primaryId, String title) {
        if (!ValidationUtils.hasText(primaryId) || !ValidationUtils.hasText(title)) {
            return;
        }
        guesses.put(primaryId.trim(), title.trim());
    }

    public Optional<String> get(String primaryId) {
        if (!ValidationUtils.hasText(primaryId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(guesses.getIfPresent(primaryId.trim()));
    }

    public void clear() {
        guesses.invalidateAll();
    }
}
