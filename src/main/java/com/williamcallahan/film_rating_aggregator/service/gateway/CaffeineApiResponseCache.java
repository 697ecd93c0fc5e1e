package com.williamcallahan.film_rating_aggregator.service.gateway;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * In-memory response cache with a time to live per entry.
 */
public class CaffeineApiResponseCache implements ApiResponseCache {

    private final Cache<String, TimedBody> cache;

    public CaffeineApiResponseCache(long maximumSize) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new Expiry<String, TimedBody>() {
                @Override
                public long expireAfterCreate(String key, TimedBody value, long currentTime) {
                    return value.ttl().toNanos();
                }

                @Override
                public long expireAfterUpdate(String key, TimedBody value, long currentTime, long currentDuration) {
                    return value.ttl().toNanos();
                }

                @Override
                public long expireAfterRead(String key, TimedBody value, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .build();
    }

    @Override
    public Optional<String> get(String key) {
        TimedBody hit = cache.getIfPresent(key);
        return hit == null ? Optional.empty() : Optional.of(hit.body());
    }

    @Override
    public void put(String key, String body, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        cache.put(key, new TimedBody(body, ttl));
    }

    @Override
    public void evict(String key) {
        cache.invalidate(key);
    }

    @Override
    public long clear() {
        List<String> keys = cache.asMap().keySet().stream()
            .filter(k -> k.startsWith(KEY_PREFIX))
            .toList();
        cache.invalidateAll(keys);
        return keys.size();
    }

    private record TimedBody(String body, Duration ttl) {
    }
}
