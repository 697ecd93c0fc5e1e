package com.williamcallahan.film_rating_aggregator.service.cache;

import com.williamcallahan.film_rating_aggregator.config.AppConfigurationProperties;
import com.williamcallahan.film_rating_aggregator.model.ProviderRecord;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.model.UnifiedFilm;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UnifiedFilmCacheTest {

    private final UnifiedFilmCache cache = new UnifiedFilmCache(new AppConfigurationProperties());

    @Test
    void storesUnderOwnPrimaryId() {
        UnifiedFilm film = film("603");

        assertThat(cache.put("603", film)).isTrue();
        assertThat(cache.get("603")).contains(film);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void refusesMismatchedKey() {
        assertThat(cache.put("604", film("603"))).isFalse();
        assertThat(cache.get("604")).isEmpty();
    }

    @Test
    void evictAndClear() {
        cache.put("603", film("603"));
        cache.put("949", film("949"));

        cache.evict("603");
        assertThat(cache.get("603")).isEmpty();

        cache.clear();
        assertThat(cache.size()).isZero();
    }

    private static UnifiedFilm film(String primaryId) {
        return UnifiedFilm.fromRecords(Map.of(ProviderTag.PRIMARY,
            ProviderRecord.builder().provider(ProviderTag.PRIMARY).nativeId(primaryId).title("Film " + primaryId).build()),
            Map.of());
    }
}
