/**
 * Configuration for WebClient
 * - Defines the shared WebClient.Builder the provider gateways start from
 * - Sets connection, read, write and response timeouts
 *
 * @author William Callahan
 */
package com.williamcallahan.film_rating_aggregator.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Connection timeout 5000ms
     * - Read/write and response timeouts follow {@code app.gateway.timeout}
     * - 10MB in-memory buffer for large credit lists
     *
     * @return a fresh builder per injection point, since each gateway mutates its own
     */
    @Bean
    @Scope("prototype")
    public WebClient.Builder webClientBuilder(AppConfigurationProperties appProperties) {
        Duration timeout = appProperties.getGateway().getTimeout();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS))
            )
            .responseTimeout(timeout);

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(10 * 1024 * 1024)) // 10MB
            .build();

        return WebClient.builder()
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
