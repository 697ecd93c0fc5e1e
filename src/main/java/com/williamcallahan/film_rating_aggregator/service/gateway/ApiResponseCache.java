package com.williamcallahan.film_rating_aggregator.service.gateway;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store for raw provider response bodies.
 * Implementations must be safe for concurrent use; concurrent writes to one key are last-write-wins.
 */
public interface ApiResponseCache {

    /** Prefix shared by every key the gateways write */
    String KEY_PREFIX = "api_cache:";

    Optional<String> get(String key);

    /**
     * Stores a body under the key for the given time to live.
     */
    void put(String key, String body, Duration ttl);

    void evict(String key);

    /**
     * Removes every {@value #KEY_PREFIX} entry.
     *
     * @return number of entries removed
     */
    long clear();
}
