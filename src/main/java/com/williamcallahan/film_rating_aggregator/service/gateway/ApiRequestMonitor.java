/**
 * Service for monitoring provider request metrics
 * - Tracks call counts by provider endpoint
 * - Maintains hourly and daily statistics
 * - Counts every gateway outcome type, including client-side throttling
 *
 * @author William Callahan
 */
package com.williamcallahan.film_rating_aggregator.service.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class ApiRequestMonitor {
    private static final Logger logger = LoggerFactory.getLogger(ApiRequestMonitor.class);
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // Track total calls since application start
    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong totalSuccessful = new AtomicLong(0);
    private final AtomicLong totalFailed = new AtomicLong(0);

    // Reset every hour
    private final AtomicInteger hourlyRequests = new AtomicInteger(0);
    private final AtomicInteger hourlySuccessful = new AtomicInteger(0);
    private final AtomicInteger hourlyFailed = new AtomicInteger(0);
    private volatile LocalDateTime currentHour = LocalDateTime.now();

    // Reset at midnight
    private final AtomicInteger dailyRequests = new AtomicInteger(0);
    private final AtomicInteger dailySuccessful = new AtomicInteger(0);
    private final AtomicInteger dailyFailed = new AtomicInteger(0);
    private volatile LocalDateTime currentDay = LocalDateTime.now();

    private final Map<String, AtomicInteger> endpointCounts = new ConcurrentHashMap<>();
    private final Map<GatewayOutcome.Type, AtomicLong> outcomeCounts = new EnumMap<>(GatewayOutcome.Type.class);
    private final AtomicLong cacheHits = new AtomicLong(0);

    private volatile LocalDateTime lastHourlyReset = LocalDateTime.now();
    private volatile LocalDateTime lastDailyReset = LocalDateTime.now();

    public ApiRequestMonitor() {
        for (GatewayOutcome.Type type : GatewayOutcome.Type.values()) {
            outcomeCounts.put(type, new AtomicLong(0));
        }
    }

    /**
     * Records one gateway attempt outcome against an endpoint
     *
     * @param endpoint provider-qualified endpoint template, e.g. {@code TMDB:movie/{id}}
     * @param outcome the attempt's outcome
     */
    public void recordOutcome(String endpoint, GatewayOutcome outcome) {
        outcomeCounts.get(outcome.type()).incrementAndGet();
        if (outcome.isSuccess()) {
            recordSuccessfulRequest(endpoint);
        } else {
            recordFailedRequest(endpoint, outcome.type() + " " + outcome.detail());
        }
    }

    /**
     * Records a successful API request
     * @param endpoint The API endpoint that was called
     */
    public void recordSuccessfulRequest(String endpoint) {
        totalRequests.incrementAndGet();
        totalSuccessful.incrementAndGet();
        hourlyRequests.incrementAndGet();
        hourlySuccessful.incrementAndGet();
        dailyRequests.incrementAndGet();
        dailySuccessful.incrementAndGet();

        endpointCounts.computeIfAbsent(endpoint, k -> new AtomicInteger(0)).incrementAndGet();

        int hourly = hourlyRequests.get();
        if (hourly % 50 == 0) {
            logger.info("Provider request count: {} in the current hour", hourly);
        }

        checkAndUpdateTimePeriods();
    }

    /**
     * Records a failed API request
     * @param endpoint The API endpoint that was called
     * @param errorMessage The error message from the failed call
     */
    public void recordFailedRequest(String endpoint, String errorMessage) {
        totalRequests.incrementAndGet();
        totalFailed.incrementAndGet();
        hourlyRequests.incrementAndGet();
        hourlyFailed.incrementAndGet();
        dailyRequests.incrementAndGet();
        dailyFailed.incrementAndGet();

        // Failures count per endpoint too
        endpointCounts.computeIfAbsent(endpoint, k -> new AtomicInteger(0)).incrementAndGet();

        logger.warn("Failed provider request to endpoint {}: {}", endpoint, errorMessage);

        checkAndUpdateTimePeriods();
    }

    public void recordCacheHit(String endpoint) {
        cacheHits.incrementAndGet();
        logger.debug("Response cache hit for {}", endpoint);
    }

    private void checkAndUpdateTimePeriods() {
        LocalDateTime now = LocalDateTime.now();
        if (now.getHour() != currentHour.getHour() || now.getDayOfYear() != currentHour.getDayOfYear()) {
            resetHourlyCounters();
            currentHour = now;
        }

        if (now.getDayOfYear() != currentDay.getDayOfYear()) {
            resetDailyCounters();
            currentDay = now;
        }
    }

    /**
     * Runs at the beginning of each hour
     */
    @Scheduled(cron = "0 0 * * * ?")
    public void resetHourlyCounters() {
        int requests = hourlyRequests.getAndSet(0);
        int successful = hourlySuccessful.getAndSet(0);
        int failed = hourlyFailed.getAndSet(0);

        LocalDateTime now = LocalDateTime.now();
        lastHourlyReset = now;
        currentHour = now;
        logger.info("Hourly provider metrics reset. Previous hour: {} requests ({} successful, {} failed)",
                requests, successful, failed);
    }

    /**
     * Runs at midnight every day; also clears endpoint counts
     */
    @Scheduled(cron = "0 0 0 * * ?")
    public void resetDailyCounters() {
        int requests = dailyRequests.getAndSet(0);
        int successful = dailySuccessful.getAndSet(0);
        int failed = dailyFailed.getAndSet(0);

        endpointCounts.clear();

        LocalDateTime now = LocalDateTime.now();
        lastDailyReset = now;
        currentDay = now;
        logger.info("Daily provider metrics reset. Previous day: {} requests ({} successful, {} failed)",
                requests, successful, failed);
    }

    public int getCurrentHourlyRequests() {
        return hourlyRequests.get();
    }

    public int getCurrentDailyRequests() {
        return dailyRequests.get();
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getOutcomeCount(GatewayOutcome.Type type) {
        return outcomeCounts.get(type).get();
    }

    public int getEndpointCount(String endpoint) {
        AtomicInteger count = endpointCounts.get(endpoint);
        return count == null ? 0 : count.get();
    }

    public long getCacheHits() {
        return cacheHits.get();
    }

    /**
     * Returns a map of all current metrics
     *
     * @return Map containing all metrics
     */
    public Map<String, Object> getMetricsMap() {
        Map<String, Object> metrics = new ConcurrentHashMap<>();

        metrics.put("hourly_requests", hourlyRequests.get());
        metrics.put("hourly_successful", hourlySuccessful.get());
        metrics.put("hourly_failed", hourlyFailed.get());

        metrics.put("daily_requests", dailyRequests.get());
        metrics.put("daily_successful", dailySuccessful.get());
        metrics.put("daily_failed", dailyFailed.get());

        metrics.put("total_requests", totalRequests.get());
        metrics.put("total_successful", totalSuccessful.get());
        metrics.put("total_failed", totalFailed.get());
        metrics.put("cache_hits", cacheHits.get());

        Map<String, Integer> endpoints = new ConcurrentHashMap<>();
        endpointCounts.forEach((endpoint, count) -> endpoints.put(endpoint, count.get()));
        metrics.put("endpoints", endpoints);

        Map<String, Long> outcomes = new ConcurrentHashMap<>();
        outcomeCounts.forEach((type, count) -> outcomes.put(type.name(), count.get()));
        metrics.put("outcomes", outcomes);

        metrics.put("last_hourly_reset", TIME_FORMATTER.format(lastHourlyReset));
        metrics.put("last_daily_reset", TIME_FORMATTER.format(lastDailyReset));

        return metrics;
    }
}
