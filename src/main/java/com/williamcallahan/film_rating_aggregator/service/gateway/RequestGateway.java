/**
 * Resilient HTTP gateway for one film provider
 *
 * @author William Callahan
 *
 * Features:
 * - Joins the provider base URL and endpoint, attaches query parameters
 * - Serves GET requests from the injected {@link ApiResponseCache} when asked to
 * - Classifies every attempt as a {@link GatewayOutcome} and retries with linear backoff
 *   (doubled for HTTP 429) until the attempt budget is spent
 * - Applies a Resilience4j rate limiter before each attempt; a refused permit counts as RATE_LIMITED
 * - Records every outcome in {@link ApiRequestMonitor}
 */
package com.williamcallahan.film_rating_aggregator.service.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.film_rating_aggregator.exception.ExternalApiRequestException;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.util.ExternalApiLogger;
import com.williamcallahan.film_rating_aggregator.util.LoggingUtils;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Pattern;

@Slf4j
public class RequestGateway {

    private static final Pattern ID_SEGMENT = Pattern.compile("\\d+|tt\\d+");

    private final ProviderTag provider;
    private final String baseUrl;
    private final WebClient webClient;
    private final ApiResponseCache responseCache;
    private final ApiRequestMonitor apiRequestMonitor;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final GatewaySettings settings;

    /**
     * Tunables shared by every request of one gateway
     *
     * @param backoffBase base wait between attempts
     * @param timeout per-attempt response timeout
     * @param defaultMaxRetries attempt budget used by {@link #get(String, Map)}
     * @param defaultCacheTtl cache lifetime used by {@link #get(String, Map)}
     */
    public record GatewaySettings(Duration backoffBase, Duration timeout, int defaultMaxRetries, Duration defaultCacheTtl) {
        public GatewaySettings {
            if (defaultMaxRetries < 1) {
                throw new IllegalArgumentException("defaultMaxRetries must be at least 1");
            }
        }
    }

    public RequestGateway(ProviderTag provider,
                          String baseUrl,
                          WebClient webClient,
                          ApiResponseCache responseCache,
                          ApiRequestMonitor apiRequestMonitor,
                          RateLimiter rateLimiter,
                          ObjectMapper objectMapper,
                          GatewaySettings settings) {
        this.provider = provider;
        this.baseUrl = baseUrl;
        this.webClient = webClient;
        this.responseCache = responseCache;
        this.apiRequestMonitor = apiRequestMonitor;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    public ProviderTag getProvider() {
        return provider;
    }

    /**
     * Cached GET with the gateway's default budget and TTL.
     */
    public Mono<JsonNode> get(String endpoint, Map<String, ?> params) {
        return request(HttpMethod.GET, endpoint, params, true, settings.defaultCacheTtl(), settings.defaultMaxRetries());
    }

    /**
     * Issues a request against the provider.
     *
     * @param method HTTP method
     * @param endpoint path relative to the base URL
     * @param params query parameters; null values are skipped
     * @param useCache consult and fill the response cache (GET only)
     * @param cacheTtl lifetime of a stored response
     * @param maxRetries total number of attempts, at least 1
     * @return the parsed JSON body, or an {@link ExternalApiRequestException} once the budget is spent
     */
    public Mono<JsonNode> request(HttpMethod method, String endpoint, Map<String, ?> params,
                                  boolean useCache, Duration cacheTtl, int maxRetries) {
        if (maxRetries < 1) {
            return Mono.error(new IllegalArgumentException("maxRetries must be at least 1"));
        }
        boolean cacheable = useCache && HttpMethod.GET.equals(method);
        String cacheKey = cacheable ? CacheKeyGenerator.generate(objectMapper, method, baseUrl, endpoint, params) : null;
        URI uri = buildUri(endpoint, params);
        String monitorKey = provider.getDisplayName() + ":" + endpointTemplate(endpoint);

        return Mono.defer(() -> {
            if (cacheable) {
                JsonNode cached = readCached(cacheKey);
                if (cached != null) {
                    ExternalApiLogger.logCacheHit(log, provider.getDisplayName(), endpoint);
                    apiRequestMonitor.recordCacheHit(monitorKey);
                    return Mono.just(cached);
                }
            }
            return attempt(method, uri, endpoint, monitorKey, 1, maxRetries)
                .doOnNext(outcome -> {
                    if (cacheable) {
                        responseCache.put(cacheKey, outcome.rawBody(), cacheTtl);
                    }
                })
                .map(GatewayOutcome::body);
        });
    }

    /**
     * Drops the cached response of one request.
     */
    public void evict(HttpMethod method, String endpoint, Map<String, ?> params) {
        responseCache.evict(CacheKeyGenerator.generate(objectMapper, method, baseUrl, endpoint, params));
    }

    /**
     * Wait before the attempt that follows a failed {@code attempt}.
     */
    static Duration backoffFor(GatewayOutcome.Type type, int attempt, Duration backoffBase) {
        Duration linear = backoffBase.multipliedBy(attempt);
        return type == GatewayOutcome.Type.RATE_LIMITED ? linear.multipliedBy(2) : linear;
    }

    private Mono<GatewayOutcome> attempt(HttpMethod method, URI uri, String endpoint, String monitorKey,
                                         int attempt, int maxAttempts) {
        return Mono.defer(() -> {
            ExternalApiLogger.logApiCallAttempt(log, provider.getDisplayName(), method.name(), endpoint, attempt, maxAttempts);
            return executeOnce(method, uri, attempt);
        }).flatMap(outcome -> {
            apiRequestMonitor.recordOutcome(monitorKey, outcome);
            if (outcome.isSuccess()) {
                ExternalApiLogger.logHttpResponse(log, provider.getDisplayName(), outcome.statusCode(),
                    uri.toString(), outcome.rawBody().length());
                return Mono.just(outcome);
            }
            if (attempt >= maxAttempts) {
                ExternalApiRequestException error = new ExternalApiRequestException(provider, endpoint, outcome, attempt);
                LoggingUtils.warn(log, outcome.cause(), "{} request to {} gave up after {} attempt(s): {}",
                    provider.getDisplayName(), endpoint, attempt, outcome.detail());
                return Mono.error(error);
            }
            Duration wait = backoffFor(outcome.type(), attempt, settings.backoffBase());
            ExternalApiLogger.logRetryScheduled(log, provider.getDisplayName(), endpoint, outcome.type().name(),
                attempt, wait.toMillis());
            return Mono.delay(wait).then(attempt(method, uri, endpoint, monitorKey, attempt + 1, maxAttempts));
        });
    }

    private Mono<GatewayOutcome> executeOnce(HttpMethod method, URI uri, int attempt) {
        return webClient.method(method)
            .uri(uri)
            .exchangeToMono(response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> classify(response.statusCode().value(), body, attempt)))
            .timeout(settings.timeout())
            .transformDeferred(RateLimiterOperator.of(rateLimiter))
            .onErrorResume(RequestNotPermitted.class, e -> Mono.just(GatewayOutcome.throttled(attempt, e)))
            .onErrorResume(e -> Mono.just(GatewayOutcome.transportError(attempt, e)));
    }

    private GatewayOutcome classify(int status, String body, int attempt) {
        if (status < 200 || status >= 300) {
            return GatewayOutcome.forErrorStatus(attempt, status);
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || node.isMissingNode() || !node.isContainerNode()) {
                return GatewayOutcome.parseError(attempt, status, null);
            }
            return GatewayOutcome.success(attempt, status, node, body);
        } catch (JsonProcessingException e) {
            return GatewayOutcome.parseError(attempt, status, e);
        }
    }

    private JsonNode readCached(String cacheKey) {
        return responseCache.get(cacheKey).map(body -> {
            try {
                return objectMapper.readTree(body);
            } catch (JsonProcessingException e) {
                LoggingUtils.warn(log, e, "Discarding unreadable cached {} response {}", provider.getDisplayName(), cacheKey);
                responseCache.evict(cacheKey);
                return null;
            }
        }).orElse(null);
    }

    private URI buildUri(String endpoint, Map<String, ?> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(joinUrl(baseUrl, endpoint));
        if (params != null) {
            params.forEach((name, value) -> {
                if (value != null) {
                    builder.queryParam(name, value);
                }
            });
        }
        return builder.build().encode().toUri();
    }

    /**
     * Endpoint with id segments (numeric or IMDb style) replaced by {@code {id}}, e.g. {@code movie/{id}}.
     */
    static String endpointTemplate(String endpoint) {
        if (endpoint == null) {
            return "";
        }
        String[] segments = endpoint.split("/", -1);
        for (int i = 0; i < segments.length; i++) {
            if (ID_SEGMENT.matcher(segments[i]).matches()) {
                segments[i] = "{id}";
            }
        }
        return String.join("/", segments);
    }

    /**
     * Joins base URL and endpoint with exactly one slash between them.
     */
    static String joinUrl(String baseUrl, String endpoint) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String path = endpoint == null ? "" : endpoint;
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        return base + "/" + path;
    }
}
