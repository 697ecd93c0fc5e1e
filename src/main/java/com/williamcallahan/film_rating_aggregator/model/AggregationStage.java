package com.williamcallahan.film_rating_aggregator.model;

/**
 * Stages one aggregation passes through, in order. FAILED is reachable from any stage.
 */
public enum AggregationStage {
    FETCHING_PRIMARY,
    RESOLVING_SECONDARY,
    COLLECTING_RATINGS,
    NORMALIZING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
