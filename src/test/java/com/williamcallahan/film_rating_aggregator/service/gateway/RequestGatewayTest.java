/**
 * Tests for RequestGateway retry, classification and caching behavior
 *
 * @author William Callahan
 */
package com.williamcallahan.film_rating_aggregator.service.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.film_rating_aggregator.exception.ExternalApiRequestException;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RequestGatewayTest {

    private static final String BASE_URL = "https://api.example.test/3";
    private static final Duration BACKOFF = Duration.ofMillis(10);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Deque<StubResponse> responses = new ArrayDeque<>();
    private final List<URI> requestedUris = new ArrayList<>();
    private final AtomicInteger networkCalls = new AtomicInteger();

    private CaffeineApiResponseCache cache;
    private ApiRequestMonitor monitor;

    @BeforeEach
    void setUp() {
        cache = new CaffeineApiResponseCache(100);
        monitor = new ApiRequestMonitor();
    }

    @Test
    void cachedResponseIsServedWithoutSecondNetworkCall() {
        String body = "{\"id\":603,\"title\":\"The Matrix\"}";
        respond(HttpStatus.OK, body);
        RequestGateway gateway = gateway(permissiveLimiter(), 3);
        Map<String, Object> params = Map.of("language", "en-US");

        StepVerifier.create(gateway.get("movie/603", params))
            .assertNext(node -> assertEquals("The Matrix", node.path("title").asText()))
            .verifyComplete();
        StepVerifier.create(gateway.get("movie/603", params))
            .assertNext(node -> assertEquals(603, node.path("id").asInt()))
            .verifyComplete();

        assertEquals(1, networkCalls.get());
        assertEquals(1L, monitor.getCacheHits());
        String key = CacheKeyGenerator.generate(objectMapper, HttpMethod.GET, BASE_URL, "movie/603", params);
        assertEquals(body, cache.get(key).orElseThrow());
    }

    @Test
    void uncachedRequestAlwaysHitsNetwork() {
        respond(HttpStatus.OK, "{\"results\":[]}");
        respond(HttpStatus.OK, "{\"results\":[]}");
        RequestGateway gateway = gateway(permissiveLimiter(), 3);

        gateway.request(HttpMethod.GET, "search/movie", Map.of("query", "x"), false, Duration.ofMinutes(5), 1).block();
        gateway.request(HttpMethod.GET, "search/movie", Map.of("query", "x"), false, Duration.ofMinutes(5), 1).block();

        assertEquals(2, networkCalls.get());
        assertEquals(0L, monitor.getCacheHits());
    }

    @Test
    void rateLimitedResponseIsRetriedThenSucceeds() {
        respond(HttpStatus.TOO_MANY_REQUESTS, "{\"status_message\":\"slow down\"}");
        respond(HttpStatus.OK, "{\"ok\":true}");
        RequestGateway gateway = gateway(permissiveLimiter(), 3);

        StepVerifier.create(gateway.get("search/movie", Map.of("query", "matrix")))
            .assertNext(node -> assertTrue(node.path("ok").asBoolean()))
            .verifyComplete();

        assertEquals(2, networkCalls.get());
        assertEquals(1L, monitor.getOutcomeCount(GatewayOutcome.Type.RATE_LIMITED));
        assertEquals(1L, monitor.getOutcomeCount(GatewayOutcome.Type.SUCCESS));
    }

    @Test
    void serverErrorsExhaustTheAttemptBudget() {
        for (int i = 0; i < 3; i++) {
            respond(HttpStatus.SERVICE_UNAVAILABLE, "{}");
        }
        RequestGateway gateway = gateway(permissiveLimiter(), 3);

        StepVerifier.create(gateway.get("movie/1", Map.of()))
            .expectErrorSatisfies(error -> {
                ExternalApiRequestException apiError = assertInstanceOf(ExternalApiRequestException.class, error);
                assertEquals(ProviderTag.PRIMARY, apiError.getProvider());
                assertEquals("movie/1", apiError.getEndpoint());
                assertEquals(3, apiError.getAttempts());
                assertEquals(GatewayOutcome.Type.SERVER_ERROR, apiError.getLastOutcome());
            })
            .verify(Duration.ofSeconds(5));

        assertEquals(3, networkCalls.get());
    }

    @Test
    void clientErrorsAreRetriedUntilBudgetIsSpent() {
        respond(HttpStatus.NOT_FOUND, "{}");
        respond(HttpStatus.NOT_FOUND, "{}");
        RequestGateway gateway = gateway(permissiveLimiter(), 2);

        StepVerifier.create(gateway.get("movie/999999", Map.of()))
            .expectErrorSatisfies(error -> {
                ExternalApiRequestException apiError = assertInstanceOf(ExternalApiRequestException.class, error);
                assertEquals(GatewayOutcome.Type.CLIENT_ERROR, apiError.getLastOutcome());
                assertEquals(2, apiError.getAttempts());
            })
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void nonJsonSuccessBodyIsParseError() {
        respond(HttpStatus.OK, "<html>maintenance</html>");
        RequestGateway gateway = gateway(permissiveLimiter(), 1);

        StepVerifier.create(gateway.get("films", Map.of("keyword", "matrix")))
            .expectErrorSatisfies(error -> assertEquals(GatewayOutcome.Type.PARSE_ERROR,
                ((ExternalApiRequestException) error).getLastOutcome()))
            .verify(Duration.ofSeconds(5));

        String key = CacheKeyGenerator.generate(objectMapper, HttpMethod.GET, BASE_URL, "films", Map.of("keyword", "matrix"));
        assertTrue(cache.get(key).isEmpty());
    }

    @Test
    void exhaustedRateLimiterCountsAsRateLimited() {
        RateLimiter limiter = RateLimiter.of("single-permit", RateLimiterConfig.custom()
            .limitForPeriod(1)
            .limitRefreshPeriod(Duration.ofMinutes(10))
            .timeoutDuration(Duration.ZERO)
            .build());
        respond(HttpStatus.OK, "{\"first\":true}");
        RequestGateway gateway = gateway(limiter, 1);

        StepVerifier.create(gateway.request(HttpMethod.GET, "a", Map.of(), false, Duration.ZERO, 1))
            .expectNextCount(1)
            .verifyComplete();
        StepVerifier.create(gateway.request(HttpMethod.GET, "b", Map.of(), false, Duration.ZERO, 1))
            .expectErrorSatisfies(error -> assertEquals(GatewayOutcome.Type.RATE_LIMITED,
                ((ExternalApiRequestException) error).getLastOutcome()))
            .verify(Duration.ofSeconds(5));

        assertEquals(1, networkCalls.get());
    }

    @Test
    void nullParamsAreSkippedInUrl() {
        respond(HttpStatus.OK, "{}");
        RequestGateway gateway = gateway(permissiveLimiter(), 1);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("query", "Amélie");
        params.put("year", null);

        gateway.get("/search/movie", params).block();

        URI uri = requestedUris.get(0);
        assertEquals("/3/search/movie", uri.getPath());
        assertTrue(uri.getRawQuery().startsWith("query="));
        assertFalse(uri.getRawQuery().contains("year"));
    }

    @Test
    void rejectsZeroAttemptBudget() {
        RequestGateway gateway = gateway(permissiveLimiter(), 1);

        StepVerifier.create(gateway.request(HttpMethod.GET, "x", Map.of(), true, Duration.ofMinutes(1), 0))
            .expectError(IllegalArgumentException.class)
            .verify();
        assertEquals(0, networkCalls.get());
    }

    @Test
    void evictDropsCachedResponse() {
        respond(HttpStatus.OK, "{\"v\":1}");
        respond(HttpStatus.OK, "{\"v\":2}");
        RequestGateway gateway = gateway(permissiveLimiter(), 1);

        assertEquals(1, gateway.get("films/301", Map.of()).block().path("v").asInt());
        gateway.evict(HttpMethod.GET, "films/301", Map.of());
        assertEquals(2, gateway.get("films/301", Map.of()).block().path("v").asInt());
    }

    @Test
    void backoffGrowsLinearlyAndDoublesWhenRateLimited() {
        Duration base = Duration.ofMillis(100);
        assertEquals(Duration.ofMillis(100), RequestGateway.backoffFor(GatewayOutcome.Type.SERVER_ERROR, 1, base));
        assertEquals(Duration.ofMillis(300), RequestGateway.backoffFor(GatewayOutcome.Type.TRANSPORT_ERROR, 3, base));
        assertEquals(Duration.ofMillis(400), RequestGateway.backoffFor(GatewayOutcome.Type.RATE_LIMITED, 2, base));
    }

    @Test
    void monitorCountsRequestsPerEndpointTemplate() {
        respond(HttpStatus.OK, "{\"id\":603}");
        respond(HttpStatus.OK, "{\"id\":604}");
        RequestGateway gateway = gateway(permissiveLimiter(), 1);

        gateway.get("movie/603", Map.of()).block();
        gateway.get("movie/604", Map.of()).block();

        assertEquals(2, monitor.getEndpointCount("TMDB:movie/{id}"));
        assertEquals(0, monitor.getEndpointCount("TMDB:movie/603"));
    }

    @Test
    void endpointTemplateReplacesIdSegments() {
        assertEquals("movie/{id}", RequestGateway.endpointTemplate("movie/550"));
        assertEquals("find/{id}", RequestGateway.endpointTemplate("find/tt0133093"));
        assertEquals("films/{id}", RequestGateway.endpointTemplate("films/301"));
        assertEquals("search/movie", RequestGateway.endpointTemplate("search/movie"));
        assertEquals("/", RequestGateway.endpointTemplate("/"));
    }

    @Test
    void joinUrlUsesSingleSlash() {
        assertEquals("https://x.test/3/movie/1", RequestGateway.joinUrl("https://x.test/3/", "/movie/1"));
        assertEquals("https://x.test/3/movie/1", RequestGateway.joinUrl("https://x.test/3", "movie/1"));
        assertEquals("https://www.omdbapi.com/", RequestGateway.joinUrl("https://www.omdbapi.com", "/"));
    }

    private RequestGateway gateway(RateLimiter limiter, int maxRetries) {
        WebClient webClient = WebClient.builder()
            .exchangeFunction(request -> {
                networkCalls.incrementAndGet();
                requestedUris.add(request.url());
                StubResponse next = responses.poll();
                if (next == null) {
                    return Mono.error(new IllegalStateException("No stubbed response left"));
                }
                return Mono.just(ClientResponse.create(next.status())
                    .header(HttpHeaders.CONTENT_TYPE, "application/json")
                    .body(next.body())
                    .build());
            })
            .build();
        RequestGateway.GatewaySettings settings = new RequestGateway.GatewaySettings(
            BACKOFF, Duration.ofSeconds(2), maxRetries, Duration.ofMinutes(10));
        return new RequestGateway(ProviderTag.PRIMARY, BASE_URL, webClient, cache, monitor, limiter,
            objectMapper, settings);
    }

    private static RateLimiter permissiveLimiter() {
        return RateLimiter.of("permissive", RateLimiterConfig.custom()
            .limitForPeriod(1000)
            .limitRefreshPeriod(Duration.ofSeconds(1))
            .timeoutDuration(Duration.ZERO)
            .build());
    }

    private void respond(HttpStatus status, String body) {
        responses.add(new StubResponse(status, body));
    }

    private record StubResponse(HttpStatus status, String body) {
    }
}
