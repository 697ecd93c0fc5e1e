/**
 * Entry point for external job runners
 *
 * @author William Callahan
 *
 * Features:
 * - Runs one aggregation and reports SUCCESS, DEGRADED or FAILED with a readable reason
 * - Runs batches sequentially, isolating each film's failure from the rest
 */
package com.williamcallahan.film_rating_aggregator.service;

import com.williamcallahan.film_rating_aggregator.model.AggregationJobResult;
import com.williamcallahan.film_rating_aggregator.model.FilmReference;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.model.UnifiedFilm;
import com.williamcallahan.film_rating_aggregator.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Service
@Slf4j
public class FilmAggregationJobService {

    private final FilmAggregationOrchestrator orchestrator;

    public FilmAggregationJobService(FilmAggregationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public Mono<AggregationJobResult> runAggregation(FilmReference reference) {
        return runAggregation(reference, false);
    }

    /**
     * Never errors: failures are reported through the result status.
     */
    public Mono<AggregationJobResult> runAggregation(FilmReference reference, boolean forceRefresh) {
        Instant start = Instant.now();
        return Mono.defer(() -> orchestrator.aggregate(reference, orchestrator.getDefaultDeadline(), forceRefresh))
            .map(film -> toResult(reference, film, Duration.between(start, Instant.now())))
            .onErrorResume(e -> {
                LoggingUtils.error(log, e, "Aggregation job failed for {}", reference);
                return Mono.just(new AggregationJobResult(reference, AggregationJobResult.Status.FAILED,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), null, 0,
                    Duration.between(start, Instant.now())));
            });
    }

    /**
     * Aggregates each reference in order, one at a time.
     */
    public Mono<List<AggregationJobResult>> runBatch(List<FilmReference> references) {
        return Flux.fromIterable(references)
            .concatMap(this::runAggregation)
            .collectList()
            .doOnNext(results -> log.info("Aggregation batch finished: {} succeeded, {} degraded, {} failed",
                count(results, AggregationJobResult.Status.SUCCESS),
                count(results, AggregationJobResult.Status.DEGRADED),
                count(results, AggregationJobResult.Status.FAILED)));
    }

    private AggregationJobResult toResult(FilmReference reference, UnifiedFilm film, Duration elapsed) {
        List<ProviderTag> missing = Arrays.stream(ProviderTag.values())
            .filter(tag -> !film.hasProvider(tag))
            .toList();
        if (missing.isEmpty()) {
            return new AggregationJobResult(reference, AggregationJobResult.Status.SUCCESS,
                "Aggregated from all providers", film, film.ratingsCount(), elapsed);
        }
        String reason = "Missing " + missing.stream().map(ProviderTag::getDisplayName).collect(Collectors.joining(", "));
        return new AggregationJobResult(reference, AggregationJobResult.Status.DEGRADED, reason, film,
            film.ratingsCount(), elapsed);
    }

    private static long count(List<AggregationJobResult> results, AggregationJobResult.Status status) {
        return results.stream().filter(r -> r.status() == status).count();
    }
}
