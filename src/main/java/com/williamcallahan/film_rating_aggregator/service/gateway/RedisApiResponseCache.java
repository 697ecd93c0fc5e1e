/**
 * Redis-backed response cache shared by every instance of the aggregator
 *
 * @author William Callahan
 *
 * Features:
 * - Stores raw bodies with SETEX so Redis expires entries itself
 * - Degrades to a miss when Redis is unreachable instead of failing the request
 * - Clears only keys under the gateway prefix using SCAN
 */
package com.williamcallahan.film_rating_aggregator.service.gateway;

import com.williamcallahan.film_rating_aggregator.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.time.Duration;
import java.util.Optional;

@Slf4j
public class RedisApiResponseCache implements ApiResponseCache {

    private static final int SCAN_BATCH = 500;

    private final JedisPooled jedis;

    public RedisApiResponseCache(JedisPooled jedis) {
        this.jedis = jedis;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(jedis.get(key));
        } catch (Exception e) {
            LoggingUtils.warn(log, e, "Redis read failed for key {}; treating as cache miss", key);
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, String body, Duration ttl) {
        if (ttl == null || ttl.getSeconds() <= 0) {
            return;
        }
        try {
            jedis.setex(key, ttl.getSeconds(), body);
        } catch (Exception e) {
            LoggingUtils.warn(log, e, "Redis write failed for key {}", key);
        }
    }

    @Override
    public void evict(String key) {
        try {
            jedis.del(key);
        } catch (Exception e) {
            LoggingUtils.warn(log, e, "Redis delete failed for key {}", key);
        }
    }

    @Override
    public long clear() {
        long removed = 0;
        String cursor = ScanParams.SCAN_POINTER_START;
        ScanParams params = new ScanParams().match(KEY_PREFIX + "*").count(SCAN_BATCH);
        do {
            ScanResult<String> page = jedis.scan(cursor, params);
            if (!page.getResult().isEmpty()) {
                removed += jedis.del(page.getResult().toArray(new String[0]));
            }
            cursor = page.getCursor();
        } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
        log.info("Cleared {} cached provider responses from Redis", removed);
        return removed;
    }
}
