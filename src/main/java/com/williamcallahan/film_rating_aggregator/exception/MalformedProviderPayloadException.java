package com.williamcallahan.film_rating_aggregator.exception;

import com.williamcallahan.film_rating_aggregator.model.ProviderTag;

/**
 * Provider response that does not have the shape of a film record (missing id, wrong node type).
 * Raised by mappers so loosely typed JSON never travels past the adapter boundary.
 *
 * @author William Callahan
 */
public class MalformedProviderPayloadException extends RuntimeException {
    private final ProviderTag provider;

    public MalformedProviderPayloadException(ProviderTag provider, String message) {
        super("[" + (provider != null ? provider.getDisplayName() : "unknown") + "] " + message);
        this.provider = provider;
    }

    public ProviderTag getProvider() {
        return provider;
    }
}
