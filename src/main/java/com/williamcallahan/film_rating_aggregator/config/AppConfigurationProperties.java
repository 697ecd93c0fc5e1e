/**
 * Main application configuration properties
 * Centralizes all app.* configuration properties for type safety and IDE support
 *
 * @author William Callahan
 */

package com.williamcallahan.film_rating_aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "app")
public class AppConfigurationProperties {

    @NestedConfigurationProperty
    private Gateway gateway = new Gateway();

    @NestedConfigurationProperty
    private Cache cache = new Cache();

    @NestedConfigurationProperty
    private Aggregation aggregation = new Aggregation();

    public Gateway getGateway() { return gateway; }
    public void setGateway(Gateway gateway) { this.gateway = gateway; }

    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    public Aggregation getAggregation() { return aggregation; }
    public void setAggregation(Aggregation aggregation) { this.aggregation = aggregation; }

    public static class Gateway {
        /** Total attempts per request */
        private int maxRetries = 3;
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration timeout = Duration.ofSeconds(10);

        @NestedConfigurationProperty
        private RateLimit rateLimit = new RateLimit();

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public Duration getBackoffBase() { return backoffBase; }
        public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public RateLimit getRateLimit() { return rateLimit; }
        public void setRateLimit(RateLimit rateLimit) { this.rateLimit = rateLimit; }

        public static class RateLimit {
            private int limitForPeriod = 20;
            private Duration refreshPeriod = Duration.ofSeconds(1);
            private Duration timeout = Duration.ofMillis(500);

            public int getLimitForPeriod() { return limitForPeriod; }
            public void setLimitForPeriod(int limitForPeriod) { this.limitForPeriod = limitForPeriod; }

            public Duration getRefreshPeriod() { return refreshPeriod; }
            public void setRefreshPeriod(Duration refreshPeriod) { this.refreshPeriod = refreshPeriod; }

            public Duration getTimeout() { return timeout; }
            public void setTimeout(Duration timeout) { this.timeout = timeout; }
        }
    }

    public static class Cache {
        private long maxSize = 10_000;
        private Duration resultTtl = Duration.ofHours(6);
        private Duration searchTtl = Duration.ofMinutes(5);
        private Duration titleGuessTtl = Duration.ofHours(24);

        public long getMaxSize() { return maxSize; }
        public void setMaxSize(long maxSize) { this.maxSize = maxSize; }

        public Duration getResultTtl() { return resultTtl; }
        public void setResultTtl(Duration resultTtl) { this.resultTtl = resultTtl; }

        public Duration getSearchTtl() { return searchTtl; }
        public void setSearchTtl(Duration searchTtl) { this.searchTtl = searchTtl; }

        public Duration getTitleGuessTtl() { return titleGuessTtl; }
        public void setTitleGuessTtl(Duration titleGuessTtl) { this.titleGuessTtl = titleGuessTtl; }
    }

    public static class Aggregation {
        private Duration deadline = Duration.ofSeconds(60);
        private int yearTolerance = 2;
        /** Weights keyed by rating source key, e.g. {@code imdb=2.0}; empty means 0.25 each for imdb, kinopoisk, rotten_tomatoes and metacritic */
        private Map<String, Double> weights = new LinkedHashMap<>();

        public Duration getDeadline() { return deadline; }
        public void setDeadline(Duration deadline) { this.deadline = deadline; }

        public int getYearTolerance() { return yearTolerance; }
        public void setYearTolerance(int yearTolerance) { this.yearTolerance = yearTolerance; }

        public Map<String, Double> getWeights() { return weights; }
        public void setWeights(Map<String, Double> weights) { this.weights = weights; }
    }
}
