package com.williamcallahan.film_rating_aggregator.service;

import com.williamcallahan.film_rating_aggregator.model.ProviderRecord;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Records resolved for one reference, keyed by provider. Unresolved providers are absent.
 */
public record IdentityResolution(Map<ProviderTag, ProviderRecord> records) {

    public IdentityResolution {
        Map<ProviderTag, ProviderRecord> copy = new EnumMap<>(ProviderTag.class);
        if (records != null) {
            copy.putAll(records);
        }
        records = Collections.unmodifiableMap(copy);
    }

    public Optional<ProviderRecord> get(ProviderTag tag) {
        return Optional.ofNullable(records.get(tag));
    }

    public int resolvedCount() {
        return records.size();
    }
}
