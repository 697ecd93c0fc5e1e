/**
 * Orchestrates one film aggregation across all providers
 *
 * @author William Callahan
 *
 * Features:
 * - Fetches the primary (TMDB) record, recovering through a title-guess search when the id lookup fails
 * - Resolves the same film in OMDb and Kinopoisk through {@link FilmIdentityResolver}
 * - Collects ratings with {@link RatingPrecedence}, normalizes them onto 0-10 and adds the weighted composite
 * - Degrades per provider; only a missing primary record fails the aggregation
 * - Enforces a deadline and caches results by primary id
 */
package com.williamcallahan.film_rating_aggregator.service;

import com.williamcallahan.film_rating_aggregator.config.AppConfigurationProperties;
import com.williamcallahan.film_rating_aggregator.exception.AggregationException;
import com.williamcallahan.film_rating_aggregator.exception.AggregationTimeoutException;
import com.williamcallahan.film_rating_aggregator.model.AggregationStage;
import com.williamcallahan.film_rating_aggregator.model.FilmReference;
import com.williamcallahan.film_rating_aggregator.model.NormalizedRating;
import com.williamcallahan.film_rating_aggregator.model.ProviderRecord;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.model.RatingSource;
import com.williamcallahan.film_rating_aggregator.model.RatingStatistics;
import com.williamcallahan.film_rating_aggregator.model.RawRating;
import com.williamcallahan.film_rating_aggregator.model.UnifiedFilm;
import com.williamcallahan.film_rating_aggregator.service.cache.PrimaryTitleGuessCache;
import com.williamcallahan.film_rating_aggregator.service.cache.UnifiedFilmCache;
import com.williamcallahan.film_rating_aggregator.service.provider.KinopoiskFilmService;
import com.williamcallahan.film_rating_aggregator.service.provider.OmdbRatingsService;
import com.williamcallahan.film_rating_aggregator.service.provider.TmdbFilmService;
import com.williamcallahan.film_rating_aggregator.service.rating.CompositeRatingCalculator;
import com.williamcallahan.film_rating_aggregator.service.rating.RatingNormalizer;
import com.williamcallahan.film_rating_aggregator.util.LoggingUtils;
import com.williamcallahan.film_rating_aggregator.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
public class FilmAggregationOrchestrator {

    private final TmdbFilmService tmdbFilmService;
    private final OmdbRatingsService omdbRatingsService;
    private final KinopoiskFilmService kinopoiskFilmService;
    private final FilmIdentityResolver identityResolver;
    private final RatingNormalizer ratingNormalizer;
    private final CompositeRatingCalculator compositeRatingCalculator;
    private final PrimaryTitleGuessCache titleGuessCache;
    private final UnifiedFilmCache unifiedFilmCache;
    private final Duration defaultDeadline;

    public FilmAggregationOrchestrator(TmdbFilmService tmdbFilmService,
                                       OmdbRatingsService omdbRatingsService,
                                       KinopoiskFilmService kinopoiskFilmService,
                                       FilmIdentityResolver identityResolver,
                                       RatingNormalizer ratingNormalizer,
                                       CompositeRatingCalculator compositeRatingCalculator,
                                       PrimaryTitleGuessCache titleGuessCache,
                                       UnifiedFilmCache unifiedFilmCache,
                                       AppConfigurationProperties appProperties) {
        this.tmdbFilmService = tmdbFilmService;
        this.omdbRatingsService = omdbRatingsService;
        this.kinopoiskFilmService = kinopoiskFilmService;
        this.identityResolver = identityResolver;
        this.ratingNormalizer = ratingNormalizer;
        this.compositeRatingCalculator = compositeRatingCalculator;
        this.titleGuessCache = titleGuessCache;
        this.unifiedFilmCache = unifiedFilmCache;
        this.defaultDeadline = appProperties.getAggregation().getDeadline();
    }

    public Duration getDefaultDeadline() {
        return defaultDeadline;
    }

    /**
     * Aggregates with the configured default deadline ({@code app.aggregation.deadline}).
     */
    public Mono<UnifiedFilm> aggregate(FilmReference reference) {
        return aggregate(reference, defaultDeadline);
    }

    public Mono<UnifiedFilm> aggregate(FilmReference reference, Duration deadline) {
        return aggregate(reference, deadline, false);
    }

    /**
     * @param reference film to aggregate
     * @param deadline upper bound for the whole aggregation
     * @param forceRefresh bypass the result cache
     * @return the unified film, or an {@link AggregationException} when no primary record exists;
     *         {@link AggregationTimeoutException} when the deadline passes first
     */
    public Mono<UnifiedFilm> aggregate(FilmReference reference, Duration deadline, boolean forceRefresh) {
        return run(new AggregationContext(reference), deadline, forceRefresh);
    }

    Mono<UnifiedFilm> run(AggregationContext context, Duration deadline, boolean forceRefresh) {
        FilmReference reference = context.getReference();
        Mono<UnifiedFilm> pipeline = Mono.defer(() -> {
            if (!forceRefresh && reference.hasPrimaryId()) {
                Optional<UnifiedFilm> cached = unifiedFilmCache.get(reference.primaryId());
                if (cached.isPresent()) {
                    log.debug("Serving aggregation for primary id {} from result cache", reference.primaryId());
                    context.advance(AggregationStage.DONE);
                    return Mono.just(cached.get());
                }
            }
            return fetchPrimary(context)
                .switchIfEmpty(Mono.error(() -> new AggregationException(
                    "No primary record found for " + describe(reference), reference)))
                .flatMap(primary -> resolveSecondary(context, primary))
                .flatMap(ignored -> collectRatings(context))
                .map(rawRatings -> normalize(context, rawRatings))
                .doOnNext(film -> finish(context, film));
        });

        return pipeline
            .timeout(deadline, Mono.error(() -> new AggregationTimeoutException(reference, deadline, null)))
            .onErrorMap(e -> !(e instanceof AggregationException),
                e -> new AggregationException("Aggregation failed for " + describe(reference), reference, e))
            .doOnError(e -> {
                context.fail(e);
                LoggingUtils.warn(log, e, "Aggregation failed for {} after {} ms", describe(reference),
                    context.elapsed().toMillis());
            });
    }

    private Mono<ProviderRecord> fetchPrimary(AggregationContext context) {
        FilmReference reference = context.getReference();
        Mono<ProviderRecord> lookup;
        if (reference.hasPrimaryId()) {
            lookup = tmdbFilmService.getByNativeId(reference.primaryId())
                .switchIfEmpty(Mono.defer(() -> recoverPrimary(reference)));
        } else {
            lookup = identityResolver.resolve(reference, ProviderTag.PRIMARY, null)
                .flatMap(found -> tmdbFilmService.getByNativeId(found.nativeId()).defaultIfEmpty(found));
        }
        return lookup.map(primary -> {
            if (primary.crossRefId() == null && reference.hasCrossRefId()) {
                primary = primary.toBuilder().crossRefId(reference.crossRefId()).build();
            }
            context.putRecord(primary);
            return primary;
        });
    }

    /**
     * Title search with the cached guess for the id (else the reference title), then a
     * validated lookup of the first candidate.
     */
    private Mono<ProviderRecord> recoverPrimary(FilmReference reference) {
        String guess = titleGuessCache.get(reference.primaryId()).orElse(reference.bestTitle());
        if (!ValidationUtils.hasText(guess)) {
            log.info("Primary lookup for id {} failed and no title guess is available", reference.primaryId());
            return Mono.empty();
        }
        log.info("Primary lookup for id {} failed; retrying through title search '{}'", reference.primaryId(), guess);
        return tmdbFilmService.searchByTitle(guess, reference.year(), 1)
            .flatMap(candidates -> candidates.isEmpty()
                ? Mono.<ProviderRecord>empty()
                : tmdbFilmService.getByNativeId(candidates.get(0).nativeId()));
    }

    private Mono<IdentityResolution> resolveSecondary(AggregationContext context, ProviderRecord primary) {
        context.advance(AggregationStage.RESOLVING_SECONDARY);
        FilmReference secondaryReference = FilmReference.fromRecord(primary);
        return identityResolver.resolveAll(secondaryReference)
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "Secondary resolution failed for primary id {}; continuing with primary only",
                    primary.nativeId());
                return Mono.just(new IdentityResolution(Map.of()));
            })
            .doOnNext(resolution -> resolution.records().values().forEach(context::putRecord));
    }

    private Mono<Map<RatingSource, RawRating>> collectRatings(AggregationContext context) {
        context.advance(AggregationStage.COLLECTING_RATINGS);
        ProviderRecord primary = context.getRecord(ProviderTag.PRIMARY);
        ProviderRecord ratingsRecord = context.getRecord(ProviderTag.RATINGS);
        ProviderRecord regionalRecord = context.getRecord(ProviderTag.REGIONAL);

        Mono<List<RawRating>> omdbRatings = ratingsRecord == null
            ? Mono.just(List.of())
            : omdbRatingsService.getRatingsByCrossRefId(ratingsRecord.crossRefId())
                .<List<RawRating>>map(ratings -> ratings.isEmpty() ? ratingsRecord.ratings() : List.copyOf(ratings.values()))
                .onErrorResume(e -> {
                    LoggingUtils.warn(log, e, "OMDb ratings unavailable for {}", ratingsRecord.crossRefId());
                    return Mono.just(ratingsRecord.ratings());
                });

        Mono<List<RawRating>> regionalRatings = regionalRecord == null
            ? Mono.just(List.of())
            : kinopoiskFilmService.getByNativeId(regionalRecord.nativeId())
                .doOnNext(context::putRecord)
                .map(ProviderRecord::ratings)
                .defaultIfEmpty(regionalRecord.ratings())
                .onErrorResume(e -> {
                    LoggingUtils.warn(log, e, "Kinopoisk details unavailable for {}", regionalRecord.nativeId());
                    return Mono.just(regionalRecord.ratings());
                });

        return Mono.zip(omdbRatings, regionalRatings).map(pair -> {
            Map<ProviderTag, Collection<RawRating>> byProvider = new EnumMap<>(ProviderTag.class);
            byProvider.put(ProviderTag.PRIMARY, primary.ratings());
            byProvider.put(ProviderTag.RATINGS, pair.getT1());
            byProvider.put(ProviderTag.REGIONAL, pair.getT2());
            Map<RatingSource, RawRating> collected = RatingPrecedence.collect(byProvider);
            collected.keySet().forEach(source -> log.debug("Rating {} taken from {}", source.getKey(),
                RatingPrecedence.winner(source, byProvider)));
            return collected;
        });
    }

    private UnifiedFilm normalize(AggregationContext context, Map<RatingSource, RawRating> rawRatings) {
        context.advance(AggregationStage.NORMALIZING);
        Map<RatingSource, NormalizedRating> normalized = ratingNormalizer.normalizeAll(rawRatings.values());
        BigDecimal weighted = compositeRatingCalculator.computeWeighted(normalized.values());
        return UnifiedFilm.fromRecords(context.getRecords(), normalized, weighted);
    }

    private void finish(AggregationContext context, UnifiedFilm film) {
        context.advance(AggregationStage.DONE);
        unifiedFilmCache.put(film.primaryId(), film);
        titleGuessCache.record(film.primaryId(), film.title());
        RatingStatistics statistics = film.statistics();
        log.info("Aggregated {} (primary id {}) from {} provider(s): {} rating(s), composite {}, weighted {}, range {}-{} in {} ms",
            film.title(), film.primaryId(), film.providerRecords().size(), statistics.sourcesCount(),
            film.compositeRating(), film.weightedRating(), statistics.min(), statistics.max(),
            context.elapsed().toMillis());
    }

    private static String describe(FilmReference reference) {
        return String.format("[primaryId=%s, crossRefId=%s, title='%s', year=%s]",
            reference.primaryId(), reference.crossRefId(), reference.bestTitle(), reference.year());
    }
}
