/**
 * Configuration class for cache-related components and beans
 * It handles:
 * - Choosing the provider response cache (Redis when configured, Caffeine otherwise)
 * - The Spring cache manager used by {@code @Cacheable} search results
 *
 * @author William Callahan
 */
package com.williamcallahan.film_rating_aggregator.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.film_rating_aggregator.service.gateway.ApiResponseCache;
import com.williamcallahan.film_rating_aggregator.service.gateway.CaffeineApiResponseCache;
import com.williamcallahan.film_rating_aggregator.service.gateway.RedisApiResponseCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import redis.clients.jedis.JedisPooled;

import java.util.List;

@Configuration
@Slf4j
public class CacheComponentsConfig {

    public static final String FILM_SEARCH_CACHE = "filmSearch";

    @Bean
    public ApiResponseCache apiResponseCache(ObjectProvider<JedisPooled> jedisPooled,
                                             AppConfigurationProperties appProperties) {
        JedisPooled jedis = jedisPooled.getIfAvailable();
        if (jedis != null) {
            log.info("Using Redis for provider response caching");
            return new RedisApiResponseCache(jedis);
        }
        log.info("Using in-memory Caffeine cache for provider responses (maxSize={})", appProperties.getCache().getMaxSize());
        return new CaffeineApiResponseCache(appProperties.getCache().getMaxSize());
    }

    @Bean
    @Primary
    public CacheManager cacheManager(AppConfigurationProperties appProperties) {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(2_000)
                .expireAfterWrite(appProperties.getCache().getSearchTtl())
                .recordStats());
        cacheManager.setCacheNames(List.of(FILM_SEARCH_CACHE));
        cacheManager.setAsyncCacheMode(true); // Reactive @Cacheable methods return Mono
        return cacheManager;
    }
}
