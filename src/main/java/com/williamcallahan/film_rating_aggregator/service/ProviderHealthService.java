/**
 * Reachability checks for the three film providers
 *
 * @author William Callahan
 *
 * Features:
 * - Issues one uncached, single-attempt search per provider
 * - Reports UP or DOWN per provider with the failure reason and latency
 */
package com.williamcallahan.film_rating_aggregator.service;

import com.williamcallahan.film_rating_aggregator.exception.ExternalApiRequestException;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.service.gateway.RequestGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class ProviderHealthService {

    private static final String CHECK_QUERY = "matrix";

    private final List<HealthCheck> checks;

    public ProviderHealthService(@Qualifier("tmdbGateway") RequestGateway tmdbGateway,
                                 @Qualifier("omdbGateway") RequestGateway omdbGateway,
                                 @Qualifier("kinopoiskGateway") RequestGateway kinopoiskGateway) {
        this.checks = List.of(
            new HealthCheck(tmdbGateway, "search/movie", Map.of("query", CHECK_QUERY, "page", 1)),
            new HealthCheck(omdbGateway, "/", Map.of("s", CHECK_QUERY, "page", 1)),
            new HealthCheck(kinopoiskGateway, "films", Map.of("keyword", CHECK_QUERY, "page", 1))
        );
    }

    public enum Status {
        UP,
        DOWN
    }

    public record ProviderHealth(ProviderTag provider, Status status, String message, Duration latency) {
    }

    /**
     * Checks every provider concurrently.
     */
    public Mono<Map<ProviderTag, ProviderHealth>> checkAll() {
        return Flux.fromIterable(checks)
            .flatMap(this::check)
            .collectMap(ProviderHealth::provider, health -> health, () -> new EnumMap<>(ProviderTag.class));
    }

    private Mono<ProviderHealth> check(HealthCheck healthCheck) {
        ProviderTag provider = healthCheck.gateway().getProvider();
        Instant start = Instant.now();
        return healthCheck.gateway().request(HttpMethod.GET, healthCheck.endpoint(), healthCheck.params(), false, Duration.ZERO, 1)
            .map(body -> new ProviderHealth(provider, Status.UP, "reachable", Duration.between(start, Instant.now())))
            .onErrorResume(e -> {
                String reason = e instanceof ExternalApiRequestException apiError
                    ? apiError.getLastOutcome().name()
                    : e.getClass().getSimpleName();
                log.warn("{} health check failed: {}", provider.getDisplayName(), e.getMessage());
                return Mono.just(new ProviderHealth(provider, Status.DOWN, reason, Duration.between(start, Instant.now())));
            });
    }

    private record HealthCheck(RequestGateway gateway, String endpoint, Map<String, ?> params) {
    }
}
