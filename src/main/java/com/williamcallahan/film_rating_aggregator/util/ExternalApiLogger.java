package com.williamcallahan.film_rating_aggregator.util;

import org.slf4j.Logger;

/**
 * Uniform log lines for calls to the film providers.
 *
 * Every line carries the {@code [EXTERNAL-API]} prefix and the provider name so a single
 * aggregation can be followed across TMDB, OMDb and Kinopoisk:
 * - one ATTEMPT line per gateway attempt
 * - SUCCESS / FAILURE lines per adapter operation
 * - RETRY lines with the wait chosen for the next attempt
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String query, int attempt, int maxAttempts) {
        log.info("{} [{}] ATTEMPT {}/{}: {} for query='{}'", PREFIX, apiName, attempt, maxAttempts, operation, query);
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query, int resultCount) {
        log.info("{} [{}] SUCCESS: {} returned {} result(s) for query='{}'", PREFIX, apiName, operation, resultCount, query);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for query='{}' - {}", PREFIX, apiName, operation, query, reason);
    }

    public static void logRetryScheduled(Logger log, String apiName, String endpoint, String outcome, int attempt, long waitMillis) {
        log.info("{} [{}] RETRY: {} after {} on attempt {}, waiting {} ms", PREFIX, apiName, endpoint, outcome, attempt, waitMillis);
    }

    public static void logCacheHit(Logger log, String apiName, String endpoint) {
        log.debug("{} [{}] CACHE-HIT: {}", PREFIX, apiName, endpoint);
    }

    /**
     * Log a record whose embedded id does not match the id that was requested
     */
    public static void logIdMismatch(Logger log, String apiName, String requestedId, String returnedId) {
        log.warn("{} [{}] ID-MISMATCH: requested id='{}' but payload carried id='{}'", PREFIX, apiName, requestedId, returnedId);
    }

    /**
     * Log HTTP response details
     */
    public static void logHttpResponse(Logger log, String apiName, int statusCode, String url, int bodySize) {
        log.debug("{} [{}] [HTTP] Response: status={}, url={}, bodySize={} bytes", PREFIX, apiName, statusCode, url, bodySize);
    }
}
