package com.williamcallahan.film_rating_aggregator.service.provider;

import com.williamcallahan.film_rating_aggregator.model.ProviderRecord;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Uniform view of one film provider. Implementations never propagate provider failures:
 * errors are logged and surface as an empty result.
 */
public interface FilmProviderClient {

    ProviderTag provider();

    /**
     * Best-effort title search. Entries without a native id are dropped.
     *
     * @param title search text
     * @param year release year filter, may be null
     * @param page 1-based result page
     * @return matching records, empty on failure
     */
    Mono<List<ProviderRecord>> searchByTitle(String title, Integer year, int page);

    /**
     * Direct lookup by the provider's own id. Completes empty when the payload's
     * embedded id differs from the requested one.
     */
    Mono<ProviderRecord> getByNativeId(String nativeId);

    /**
     * Exact lookup by IMDb id, empty when not found or unsupported.
     */
    Mono<ProviderRecord> findByCrossRefId(String crossRefId, Integer year);

    default boolean supportsCrossRefLookup() {
        return true;
    }
}
