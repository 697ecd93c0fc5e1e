package com.williamcallahan.film_rating_aggregator.service;

import com.williamcallahan.film_rating_aggregator.model.AggregationStage;
import com.williamcallahan.film_rating_aggregator.model.FilmReference;
import com.williamcallahan.film_rating_aggregator.model.ProviderRecord;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of a single aggregation. One instance per request, never shared.
 * Stages only move forward; FAILED can be entered from any non-terminal stage.
 */
public class AggregationContext {

    private final FilmReference reference;
    private final Instant startedAt = Instant.now();
    private final Map<ProviderTag, ProviderRecord> records = new EnumMap<>(ProviderTag.class);
    private final List<AggregationStage> history = new ArrayList<>();
    private volatile AggregationStage stage;
    private volatile Throwable failure;

    public AggregationContext(FilmReference reference) {
        this.reference = reference;
        this.stage = AggregationStage.FETCHING_PRIMARY;
        this.history.add(stage);
    }

    public synchronized void advance(AggregationStage next) {
        if (stage.isTerminal()) {
            throw new IllegalStateException("Aggregation already finished in stage " + stage);
        }
        if (next == AggregationStage.FAILED || next.ordinal() <= stage.ordinal()) {
            throw new IllegalStateException("Cannot move from " + stage + " to " + next);
        }
        stage = next;
        history.add(next);
    }

    public synchronized void fail(Throwable cause) {
        if (stage.isTerminal()) {
            return;
        }
        failure = cause;
        stage = AggregationStage.FAILED;
        history.add(AggregationStage.FAILED);
    }

    public synchronized void putRecord(ProviderRecord record) {
        records.put(record.provider(), record);
    }

    public synchronized Map<ProviderTag, ProviderRecord> getRecords() {
        return Collections.unmodifiableMap(new EnumMap<>(records));
    }

    public synchronized ProviderRecord getRecord(ProviderTag tag) {
        return records.get(tag);
    }

    public FilmReference getReference() {
        return reference;
    }

    public AggregationStage getStage() {
        return stage;
    }

    public synchronized List<AggregationStage> getHistory() {
        return List.copyOf(history);
    }

    public Throwable getFailure() {
        return failure;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, Instant.now());
    }
}
