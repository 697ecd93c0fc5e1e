/**
 * Finds the record that denotes a given film in a target provider
 *
 * @author William Callahan
 *
 * Features:
 * - One fixed chain, stopping at the first hit:
 *   1. exact cross-reference (IMDb) id lookup, when the provider supports it
 *   2. validated lookup by an already known native id
 *   3. title search (title, then original title) with year tolerance and case-insensitive title match
 *   4. sanitized-title search, regional catalog only
 * - A provider failure inside a step is a miss for that step
 * - Not finding a film is an empty result, never an error
 */
package com.williamcallahan.film_rating_aggregator.service;

import com.williamcallahan.film_rating_aggregator.config.AppConfigurationProperties;
import com.williamcallahan.film_rating_aggregator.model.FilmReference;
import com.williamcallahan.film_rating_aggregator.model.ProviderRecord;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.service.provider.FilmProviderClient;
import com.williamcallahan.film_rating_aggregator.util.LoggingUtils;
import com.williamcallahan.film_rating_aggregator.util.TextUtils;
import com.williamcallahan.film_rating_aggregator.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
public class FilmIdentityResolver {

    private final Map<ProviderTag, FilmProviderClient> clients = new EnumMap<>(ProviderTag.class);
    private final int yearTolerance;

    public FilmIdentityResolver(List<FilmProviderClient> providerClients, AppConfigurationProperties appProperties) {
        for (FilmProviderClient client : providerClients) {
            clients.put(client.provider(), client);
        }
        this.yearTolerance = Math.max(0, appProperties.getAggregation().getYearTolerance());
    }

    /**
     * Resolves the reference in the target provider.
     *
     * @param reference what is known about the film
     * @param target provider to resolve in
     * @param knownNativeId the film's id in the target provider, if already known
     * @return the matching record, or empty when nothing matched
     */
    public Mono<ProviderRecord> resolve(FilmReference reference, ProviderTag target, String knownNativeId) {
        FilmProviderClient client = clients.get(target);
        if (client == null) {
            log.warn("No provider client registered for {}", target);
            return Mono.empty();
        }
        String nativeId = knownNativeId;
        if (nativeId == null && target == ProviderTag.PRIMARY) {
            nativeId = reference.primaryId();
        }
        String finalNativeId = nativeId;

        return byCrossRefId(client, reference)
            .switchIfEmpty(Mono.defer(() -> byNativeId(client, finalNativeId)))
            .switchIfEmpty(Mono.defer(() -> byTitleSearch(client, reference)))
            .switchIfEmpty(Mono.defer(() -> bySanitizedTitle(client, reference)))
            .doOnNext(record -> log.debug("Resolved {} in {} as native id {}", describe(reference),
                target.getDisplayName(), record.nativeId()))
            .switchIfEmpty(Mono.defer(() -> {
                log.info("No {} record found for {}", target.getDisplayName(), describe(reference));
                return Mono.empty();
            }));
    }

    /**
     * Resolves the reference in the ratings aggregator and the regional catalog.
     */
    public Mono<IdentityResolution> resolveAll(FilmReference reference) {
        return resolveAll(reference, Map.of());
    }

    /**
     * @param knownNativeIds native ids already known per provider
     */
    public Mono<IdentityResolution> resolveAll(FilmReference reference, Map<ProviderTag, String> knownNativeIds) {
        Mono<Optional<ProviderRecord>> ratings = resolve(reference, ProviderTag.RATINGS, knownNativeIds.get(ProviderTag.RATINGS))
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());
        Mono<Optional<ProviderRecord>> regional = resolve(reference, ProviderTag.REGIONAL, knownNativeIds.get(ProviderTag.REGIONAL))
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());
        return Mono.zip(ratings, regional).map(pair -> {
            Map<ProviderTag, ProviderRecord> records = new EnumMap<>(ProviderTag.class);
            pair.getT1().ifPresent(r -> records.put(ProviderTag.RATINGS, r));
            pair.getT2().ifPresent(r -> records.put(ProviderTag.REGIONAL, r));
            return new IdentityResolution(records);
        });
    }

    private Mono<ProviderRecord> byCrossRefId(FilmProviderClient client, FilmReference reference) {
        if (!reference.hasCrossRefId() || !client.supportsCrossRefLookup()) {
            return Mono.empty();
        }
        return guarded(client, "cross-reference lookup", client.findByCrossRefId(reference.crossRefId(), reference.year()));
    }

    private Mono<ProviderRecord> byNativeId(FilmProviderClient client, String nativeId) {
        if (!ValidationUtils.hasText(nativeId)) {
            return Mono.empty();
        }
        return guarded(client, "native id lookup", client.getByNativeId(nativeId));
    }

    private Mono<ProviderRecord> byTitleSearch(FilmProviderClient client, FilmReference reference) {
        if (!reference.hasTitle()) {
            return Mono.empty();
        }
        List<String> queries = new ArrayList<>();
        if (reference.title() != null) {
            queries.add(reference.title());
        }
        if (reference.originalTitle() != null && !TextUtils.titlesMatch(reference.title(), reference.originalTitle())) {
            queries.add(reference.originalTitle());
        }
        List<Optional<Integer>> searchYears = searchYears(reference.year());

        return Flux.fromIterable(queries)
            .concatMap(query -> Flux.fromIterable(searchYears)
                .concatMap(searchYear -> guarded(client, "title search",
                    client.searchByTitle(query, searchYear.orElse(null), 1)
                        .flatMapMany(Flux::fromIterable)
                        .filter(candidate -> matches(candidate, reference))
                        .next())))
            .next();
    }

    /**
     * Provider year filters to try in order. The filter is exact, so with a tolerance the
     * year-filtered page is followed by an unfiltered one; empty means no filter.
     */
    private List<Optional<Integer>> searchYears(Integer year) {
        if (year == null) {
            return List.of(Optional.empty());
        }
        return yearTolerance == 0 ? List.of(Optional.of(year)) : List.of(Optional.of(year), Optional.empty());
    }

    private Mono<ProviderRecord> bySanitizedTitle(FilmProviderClient client, FilmReference reference) {
        if (client.provider() != ProviderTag.REGIONAL || !reference.hasTitle()) {
            return Mono.empty();
        }
        String sanitized = TextUtils.sanitizeTitleForSearch(reference.bestTitle());
        if (sanitized.isEmpty()) {
            return Mono.empty();
        }
        return guarded(client, "sanitized title search",
            client.searchByTitle(sanitized, reference.year(), 1)
                .flatMap(results -> results.isEmpty() ? Mono.<ProviderRecord>empty() : Mono.just(results.get(0))));
    }

    /**
     * Year within tolerance (any year when the reference has none) and title or original title
     * equal, ignoring case, to the reference's title or original title.
     */
    boolean matches(ProviderRecord candidate, FilmReference reference) {
        if (reference.year() != null) {
            if (candidate.year() == null || Math.abs(candidate.year() - reference.year()) > yearTolerance) {
                return false;
            }
        }
        return TextUtils.titlesMatch(candidate.title(), reference.title())
            || TextUtils.titlesMatch(candidate.title(), reference.originalTitle())
            || TextUtils.titlesMatch(candidate.originalTitle(), reference.title())
            || TextUtils.titlesMatch(candidate.originalTitle(), reference.originalTitle());
    }

    private Mono<ProviderRecord> guarded(FilmProviderClient client, String step, Mono<ProviderRecord> lookup) {
        return lookup.onErrorResume(e -> {
            LoggingUtils.warn(log, e, "{} {} failed; treating as a miss", client.provider().getDisplayName(), step);
            return Mono.empty();
        });
    }

    private static String describe(FilmReference reference) {
        return String.format("[primaryId=%s, crossRefId=%s, title='%s', year=%s]",
            reference.primaryId(), reference.crossRefId(), reference.bestTitle(), reference.year());
    }
}
