package com.williamcallahan.film_rating_aggregator.exception;

import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.service.gateway.GatewayOutcome;

/**
 * Raised by a request gateway once its attempt budget is spent without a successful response.
 */
public class ExternalApiRequestException extends RuntimeException {

    private final ProviderTag provider;
    private final String endpoint;
    private final GatewayOutcome.Type lastOutcome;
    private final int attempts;

    public ExternalApiRequestException(ProviderTag provider, String endpoint, GatewayOutcome lastOutcome, int attempts) {
        super(String.format("%s request to '%s' failed after %d attempt(s): %s (%s)",
                provider.getDisplayName(), endpoint, attempts, lastOutcome.type(), lastOutcome.detail()),
            lastOutcome.cause());
        this.provider = provider;
        this.endpoint = endpoint;
        this.lastOutcome = lastOutcome.type();
        this.attempts = attempts;
    }

    public ProviderTag getProvider() {
        return provider;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public GatewayOutcome.Type getLastOutcome() {
        return lastOutcome;
    }

    public int getAttempts() {
        return attempts;
    }
}
