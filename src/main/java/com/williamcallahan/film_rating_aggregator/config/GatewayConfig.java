/**
 * Builds one {@link RequestGateway} per film provider
 *
 * @author William Callahan
 *
 * Features:
 * - Injects provider authentication into each gateway's WebClient
 *   (TMDB bearer token, Kinopoisk X-API-KEY header, OMDb apikey query parameter)
 * - Gives every gateway its own Resilience4j rate limiter
 * - Shares the response cache and request monitor across gateways
 */
package com.williamcallahan.film_rating_aggregator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.service.gateway.ApiRequestMonitor;
import com.williamcallahan.film_rating_aggregator.service.gateway.ApiResponseCache;
import com.williamcallahan.film_rating_aggregator.service.gateway.RequestGateway;
import com.williamcallahan.film_rating_aggregator.util.ValidationUtils;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

@Configuration
@Slf4j
public class GatewayConfig {

    static final String KINOPOISK_API_KEY_HEADER = "X-API-KEY";
    static final String OMDB_API_KEY_PARAM = "apikey";

    private final AppConfigurationProperties appProperties;
    private final ProviderConfigurationProperties providerProperties;
    private final ApiResponseCache apiResponseCache;
    private final ApiRequestMonitor apiRequestMonitor;
    private final ObjectMapper objectMapper;

    public GatewayConfig(AppConfigurationProperties appProperties,
                         ProviderConfigurationProperties providerProperties,
                         ApiResponseCache apiResponseCache,
                         ApiRequestMonitor apiRequestMonitor,
                         ObjectMapper objectMapper) {
        this.appProperties = appProperties;
        this.providerProperties = providerProperties;
        this.apiResponseCache = apiResponseCache;
        this.apiRequestMonitor = apiRequestMonitor;
        this.objectMapper = objectMapper;
    }

    @Bean
    public RequestGateway tmdbGateway(WebClient.Builder webClientBuilder) {
        ProviderConfigurationProperties.Provider tmdb = providerProperties.getTmdb();
        if (ValidationUtils.hasText(tmdb.getApiKey())) {
            webClientBuilder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + tmdb.getApiKey());
        } else {
            log.warn("No TMDB API key configured (providers.tmdb.api-key); primary lookups will be rejected");
        }
        return buildGateway(ProviderTag.PRIMARY, tmdb, webClientBuilder);
    }

    @Bean
    public RequestGateway omdbGateway(WebClient.Builder webClientBuilder) {
        ProviderConfigurationProperties.Provider omdb = providerProperties.getOmdb();
        if (ValidationUtils.hasText(omdb.getApiKey())) {
            webClientBuilder.filter(apiKeyQueryParameter(omdb.getApiKey()));
        } else {
            log.warn("No OMDb API key configured (providers.omdb.api-key); rating lookups will be rejected");
        }
        return buildGateway(ProviderTag.RATINGS, omdb, webClientBuilder);
    }

    @Bean
    public RequestGateway kinopoiskGateway(WebClient.Builder webClientBuilder) {
        ProviderConfigurationProperties.Provider kinopoisk = providerProperties.getKinopoisk();
        if (ValidationUtils.hasText(kinopoisk.getApiKey())) {
            webClientBuilder.defaultHeader(KINOPOISK_API_KEY_HEADER, kinopoisk.getApiKey());
        } else {
            log.warn("No Kinopoisk API key configured (providers.kinopoisk.api-key); regional lookups will be rejected");
        }
        return buildGateway(ProviderTag.REGIONAL, kinopoisk, webClientBuilder);
    }

    private RequestGateway buildGateway(ProviderTag tag, ProviderConfigurationProperties.Provider provider,
                                        WebClient.Builder webClientBuilder) {
        AppConfigurationProperties.Gateway gateway = appProperties.getGateway();
        WebClient webClient = webClientBuilder
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .build();
        RequestGateway.GatewaySettings settings = new RequestGateway.GatewaySettings(
            gateway.getBackoffBase(), gateway.getTimeout(), gateway.getMaxRetries(), provider.getCacheTtl());
        log.info("Configured {} gateway: baseUrl={}, maxRetries={}, cacheTtl={}",
            tag.getDisplayName(), provider.getBaseUrl(), gateway.getMaxRetries(), provider.getCacheTtl());
        return new RequestGateway(tag, provider.getBaseUrl(), webClient, apiResponseCache, apiRequestMonitor,
            rateLimiterFor(tag), objectMapper, settings);
    }

    private RateLimiter rateLimiterFor(ProviderTag tag) {
        AppConfigurationProperties.Gateway.RateLimit rateLimit = appProperties.getGateway().getRateLimit();
        RateLimiterConfig config = RateLimiterConfig.custom()
            .limitForPeriod(rateLimit.getLimitForPeriod())
            .limitRefreshPeriod(rateLimit.getRefreshPeriod())
            .timeoutDuration(rateLimit.getTimeout())
            .build();
        return RateLimiter.of(tag.getDisplayName().toLowerCase() + "-gateway", config);
    }

    /**
     * Appends the OMDb key to every outgoing request URL.
     */
    static ExchangeFilterFunction apiKeyQueryParameter(String apiKey) {
        return (request, next) -> next.exchange(ClientRequest.from(request)
            .url(UriComponentsBuilder.fromUri(request.url())
                .queryParam(OMDB_API_KEY_PARAM, apiKey)
                .build(true)
                .toUri())
            .build());
    }
}
