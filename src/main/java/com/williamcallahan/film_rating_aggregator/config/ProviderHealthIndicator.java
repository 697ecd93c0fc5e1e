/**
 * Actuator health for the film providers
 *
 * The aggregator cannot work without the primary catalog, so its state decides the overall
 * status; a secondary provider being down is reported in the details only.
 *
 * @author William Callahan
 */
package com.williamcallahan.film_rating_aggregator.config;

import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.service.ProviderHealthService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component("providers")
public class ProviderHealthIndicator implements ReactiveHealthIndicator {

    private final ProviderHealthService providerHealthService;

    public ProviderHealthIndicator(ProviderHealthService providerHealthService) {
        this.providerHealthService = providerHealthService;
    }

    @Override
    public Mono<Health> health() {
        return providerHealthService.checkAll().map(results -> {
            ProviderHealthService.ProviderHealth primary = results.get(ProviderTag.PRIMARY);
            Health.Builder builder = primary != null && primary.status() == ProviderHealthService.Status.UP
                ? Health.up()
                : Health.down();
            results.forEach((tag, health) -> builder.withDetail(tag.getDisplayName(),
                health.status() + " (" + health.message() + ", " + health.latency().toMillis() + " ms)"));
            return builder.build();
        });
    }
}
