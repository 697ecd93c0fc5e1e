/**
 * Tests for FilmIdentityResolver lookup order, year tolerance and failure handling
 *
 * @author William Callahan
 */
package com.williamcallahan.film_rating_aggregator.service;

import com.williamcallahan.film_rating_aggregator.config.AppConfigurationProperties;
import com.williamcallahan.film_rating_aggregator.model.FilmReference;
import com.williamcallahan.film_rating_aggregator.model.ProviderRecord;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.service.provider.FilmProviderClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FilmIdentityResolverTest {

    private FilmProviderClient primary;
    private FilmProviderClient ratings;
    private FilmProviderClient regional;
    private AppConfigurationProperties properties;
    private FilmIdentityResolver resolver;

    @BeforeEach
    void setUp() {
        primary = client(ProviderTag.PRIMARY);
        ratings = client(ProviderTag.RATINGS);
        regional = client(ProviderTag.REGIONAL);
        properties = new AppConfigurationProperties();
        resolver = new FilmIdentityResolver(List.of(primary, ratings, regional), properties);
    }

    @Test
    void crossReferenceHitSkipsTitleSearch() {
        FilmReference reference = new FilmReference("603", "tt0133093", "The Matrix", null, 1999);
        when(ratings.findByCrossRefId("tt0133093", 1999)).thenReturn(Mono.just(record(ProviderTag.RATINGS, "tt0133093", "The Matrix", 1999)));

        StepVerifier.create(resolver.resolve(reference, ProviderTag.RATINGS, null))
            .assertNext(found -> assertEquals("tt0133093", found.nativeId()))
            .verifyComplete();

        verify(ratings, never()).searchByTitle(anyString(), any(), anyInt());
    }

    @Test
    void crossReferenceMissFallsBackToTitleSearchWithinTolerance() {
        FilmReference reference = new FilmReference("949", "tt0113277", "Heat", null, 1995);
        when(regional.searchByTitle("Heat", null, 1)).thenReturn(Mono.just(List.of(
            record(ProviderTag.REGIONAL, "1", "Heat", 1972),
            record(ProviderTag.REGIONAL, "2", "HEAT", 1996))));

        StepVerifier.create(resolver.resolve(reference, ProviderTag.REGIONAL, null))
            .assertNext(found -> assertEquals("2", found.nativeId()))
            .verifyComplete();

        InOrder order = inOrder(regional);
        order.verify(regional).findByCrossRefId("tt0113277", 1995);
        order.verify(regional).searchByTitle("Heat", 1995, 1);
        order.verify(regional).searchByTitle("Heat", null, 1);
    }

    @Test
    void yearFilteredPageIsSearchedBeforeUnfilteredOne() {
        FilmReference reference = new FilmReference(null, null, "Heat", null, 1995);
        when(ratings.searchByTitle("Heat", null, 1)).thenReturn(Mono.just(List.of(
            record(ProviderTag.RATINGS, "tt0068699", "Heat", 1972))));
        when(ratings.searchByTitle("Heat", 1995, 1)).thenReturn(Mono.just(List.of(
            record(ProviderTag.RATINGS, "tt0113277", "Heat", 1995))));

        StepVerifier.create(resolver.resolve(reference, ProviderTag.RATINGS, null))
            .assertNext(found -> assertEquals("tt0113277", found.nativeId()))
            .verifyComplete();
        verify(ratings, never()).searchByTitle(eq("Heat"), isNull(), anyInt());
    }

    @Test
    void referenceWithoutYearSearchesUnfilteredOnly() {
        FilmReference reference = new FilmReference(null, null, "Heat", null, null);
        when(ratings.searchByTitle("Heat", null, 1)).thenReturn(Mono.just(List.of(
            record(ProviderTag.RATINGS, "tt0068699", "Heat", 1972))));

        StepVerifier.create(resolver.resolve(reference, ProviderTag.RATINGS, null))
            .assertNext(found -> assertEquals("tt0068699", found.nativeId()))
            .verifyComplete();
        verify(ratings).searchByTitle("Heat", null, 1);
    }

    @Test
    void yearOutsideToleranceIsRejected() {
        FilmReference reference = new FilmReference(null, null, "Heat", null, 1995);
        when(ratings.searchByTitle("Heat", null, 1)).thenReturn(Mono.just(List.of(
            record(ProviderTag.RATINGS, "tt0068699", "Heat", 1972),
            record(ProviderTag.RATINGS, "tt9999999", "Heat", null))));

        StepVerifier.create(resolver.resolve(reference, ProviderTag.RATINGS, null)).verifyComplete();
    }

    @Test
    void zeroToleranceUsesProviderYearFilter() {
        properties.getAggregation().setYearTolerance(0);
        resolver = new FilmIdentityResolver(List.of(primary, ratings, regional), properties);
        FilmReference reference = new FilmReference(null, null, "Heat", null, 1995);
        when(ratings.searchByTitle("Heat", 1995, 1)).thenReturn(Mono.just(List.of(
            record(ProviderTag.RATINGS, "tt0113277", "Heat", 1995))));

        StepVerifier.create(resolver.resolve(reference, ProviderTag.RATINGS, null))
            .assertNext(found -> assertEquals("tt0113277", found.nativeId()))
            .verifyComplete();
        verify(ratings, never()).searchByTitle(eq("Heat"), isNull(), anyInt());
    }

    @Test
    void originalTitleIsSearchedWhenTitleFindsNothing() {
        FilmReference reference = new FilmReference(null, null, "Матрица", "The Matrix", 1999);
        when(ratings.searchByTitle("The Matrix", null, 1)).thenReturn(Mono.just(List.of(
            record(ProviderTag.RATINGS, "tt0133093", "The Matrix", 1999))));

        StepVerifier.create(resolver.resolve(reference, ProviderTag.RATINGS, null))
            .assertNext(found -> assertEquals("tt0133093", found.nativeId()))
            .verifyComplete();

        InOrder order = inOrder(ratings);
        order.verify(ratings).searchByTitle("Матрица", null, 1);
        order.verify(ratings).searchByTitle("The Matrix", null, 1);
    }

    @Test
    void regionalFallsBackToSanitizedTitle() {
        FilmReference reference = new FilmReference(null, null, "The Matrix (1999)", null, 1999);
        when(regional.searchByTitle("The Matrix", 1999, 1)).thenReturn(Mono.just(List.of(
            record(ProviderTag.REGIONAL, "301", "Матрица", 1999))));

        StepVerifier.create(resolver.resolve(reference, ProviderTag.REGIONAL, null))
            .assertNext(found -> assertEquals("301", found.nativeId()))
            .verifyComplete();
    }

    @Test
    void sanitizedFallbackIsRegionalOnly() {
        FilmReference reference = new FilmReference(null, null, "The Matrix (1999)", null, 1999);
        when(ratings.searchByTitle("The Matrix", 1999, 1)).thenReturn(Mono.just(List.of(
            record(ProviderTag.RATINGS, "tt0133093", "The Matrix", 1999))));

        StepVerifier.create(resolver.resolve(reference, ProviderTag.RATINGS, null)).verifyComplete();
    }

    @Test
    void providerErrorInOneStepIsTreatedAsMiss() {
        FilmReference reference = new FilmReference(null, "tt0113277", "Heat", null, 1995);
        when(ratings.findByCrossRefId("tt0113277", 1995)).thenReturn(Mono.error(new IllegalStateException("503")));
        when(ratings.searchByTitle("Heat", null, 1)).thenReturn(Mono.just(List.of(
            record(ProviderTag.RATINGS, "tt0113277", "Heat", 1995))));

        StepVerifier.create(resolver.resolve(reference, ProviderTag.RATINGS, null))
            .assertNext(found -> assertEquals("tt0113277", found.nativeId()))
            .verifyComplete();
    }

    @Test
    void knownNativeIdIsTriedBeforeTitleSearch() {
        FilmReference reference = new FilmReference("603", null, "The Matrix", null, 1999);
        when(primary.getByNativeId("603")).thenReturn(Mono.just(record(ProviderTag.PRIMARY, "603", "The Matrix", 1999)));

        StepVerifier.create(resolver.resolve(reference, ProviderTag.PRIMARY, null))
            .assertNext(found -> assertEquals("603", found.nativeId()))
            .verifyComplete();
        verify(primary, never()).searchByTitle(anyString(), any(), anyInt());
    }

    @Test
    void resolveAllCombinesSecondaryProviders() {
        FilmReference reference = new FilmReference("603", "tt0133093", "The Matrix", null, 1999);
        when(ratings.findByCrossRefId("tt0133093", 1999)).thenReturn(Mono.just(record(ProviderTag.RATINGS, "tt0133093", "The Matrix", 1999)));

        StepVerifier.create(resolver.resolveAll(reference))
            .assertNext(resolution -> {
                assertEquals(1, resolution.resolvedCount());
                assertTrue(resolution.get(ProviderTag.RATINGS).isPresent());
                assertTrue(resolution.get(ProviderTag.REGIONAL).isEmpty());
            })
            .verifyComplete();
    }

    @Test
    void resolveAllUsesKnownRegionalId() {
        FilmReference reference = new FilmReference(null, null, "Heat", null, 1995);
        when(regional.getByNativeId("4123")).thenReturn(Mono.just(record(ProviderTag.REGIONAL, "4123", "Схватка", 1995)));

        StepVerifier.create(resolver.resolveAll(reference, Map.of(ProviderTag.REGIONAL, "4123")))
            .assertNext(resolution -> assertEquals("4123", resolution.get(ProviderTag.REGIONAL).orElseThrow().nativeId()))
            .verifyComplete();
    }

    @Test
    void matchComparesTitlesAndOriginalTitlesIgnoringCase() {
        FilmReference reference = new FilmReference(null, null, "Схватка", "Heat", 1995);
        ProviderRecord candidate = ProviderRecord.builder().provider(ProviderTag.RATINGS).nativeId("tt0113277")
            .title("heat").year(1997).build();

        assertTrue(resolver.matches(candidate, reference));
        assertFalse(resolver.matches(candidate.toBuilder().year(1998).build(), reference));
    }

    private static FilmProviderClient client(ProviderTag tag) {
        FilmProviderClient client = mock(FilmProviderClient.class);
        when(client.provider()).thenReturn(tag);
        when(client.supportsCrossRefLookup()).thenReturn(true);
        when(client.findByCrossRefId(anyString(), any())).thenReturn(Mono.empty());
        when(client.getByNativeId(anyString())).thenReturn(Mono.empty());
        when(client.searchByTitle(anyString(), any(), anyInt())).thenReturn(Mono.just(List.of()));
        return client;
    }

    private static ProviderRecord record(ProviderTag tag, String id, String title, Integer year) {
        return ProviderRecord.builder().provider(tag).nativeId(id).title(title).year(year).build();
    }
}
