package com.williamcallahan.film_rating_aggregator.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.williamcallahan.film_rating_aggregator.config.ProviderHealthIndicator;
import com.williamcallahan.film_rating_aggregator.exception.ExternalApiRequestException;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.service.gateway.GatewayOutcome;
import com.williamcallahan.film_rating_aggregator.service.gateway.RequestGateway;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProviderHealthServiceTest {

    @Test
    void reportsEachProviderAndUsesUncachedSingleAttempt() {
        RequestGateway tmdb = gateway(ProviderTag.PRIMARY, true);
        RequestGateway omdb = gateway(ProviderTag.RATINGS, false);
        RequestGateway kinopoisk = gateway(ProviderTag.REGIONAL, true);
        ProviderHealthService service = new ProviderHealthService(tmdb, omdb, kinopoisk);

        StepVerifier.create(service.checkAll())
            .assertNext(results -> {
                assertEquals(3, results.size());
                assertEquals(ProviderHealthService.Status.UP, results.get(ProviderTag.PRIMARY).status());
                assertEquals(ProviderHealthService.Status.DOWN, results.get(ProviderTag.RATINGS).status());
                assertEquals("SERVER_ERROR", results.get(ProviderTag.RATINGS).message());
            })
            .verifyComplete();

        verify(tmdb).request(eq(HttpMethod.GET), eq("search/movie"), anyMap(), eq(false), any(), eq(1));
    }

    @Test
    void indicatorIsDownOnlyWhenPrimaryIsDown() {
        ProviderHealthService secondaryDown = new ProviderHealthService(gateway(ProviderTag.PRIMARY, true),
            gateway(ProviderTag.RATINGS, false), gateway(ProviderTag.REGIONAL, false));
        ProviderHealthService primaryDown = new ProviderHealthService(gateway(ProviderTag.PRIMARY, false),
            gateway(ProviderTag.RATINGS, true), gateway(ProviderTag.REGIONAL, true));

        StepVerifier.create(new ProviderHealthIndicator(secondaryDown).health())
            .assertNext(health -> {
                assertEquals(Status.UP, health.getStatus());
                assertTrue(health.getDetails().containsKey("OMDb"));
            })
            .verifyComplete();
        StepVerifier.create(new ProviderHealthIndicator(primaryDown).health())
            .assertNext(health -> assertEquals(Status.DOWN, health.getStatus()))
            .verifyComplete();
    }

    private static RequestGateway gateway(ProviderTag tag, boolean up) {
        RequestGateway gateway = mock(RequestGateway.class);
        when(gateway.getProvider()).thenReturn(tag);
        when(gateway.request(any(HttpMethod.class), anyString(), anyMap(), anyBoolean(), any(), anyInt()))
            .thenReturn(up
                ? Mono.just(JsonNodeFactory.instance.objectNode())
                : Mono.error(new ExternalApiRequestException(tag, "search/movie", GatewayOutcome.forErrorStatus(1, 500), 1)));
        return gateway;
    }
}
