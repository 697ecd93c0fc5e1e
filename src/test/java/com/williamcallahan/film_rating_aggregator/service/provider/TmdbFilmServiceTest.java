/**
 * Test suite for TmdbFilmService
 *
 * @author William Callahan
 */
package com.williamcallahan.film_rating_aggregator.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.film_rating_aggregator.config.ProviderConfigurationProperties;
import com.williamcallahan.film_rating_aggregator.exception.ExternalApiRequestException;
import com.williamcallahan.film_rating_aggregator.mapper.TmdbFilmMapper;
import com.williamcallahan.film_rating_aggregator.model.ProviderTag;
import com.williamcallahan.film_rating_aggregator.model.RatingSource;
import com.williamcallahan.film_rating_aggregator.service.gateway.GatewayOutcome;
import com.williamcallahan.film_rating_aggregator.service.gateway.RequestGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TmdbFilmServiceTest {

    @Mock
    private RequestGateway gateway;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private TmdbFilmService tmdbFilmService;

    @BeforeEach
    void setUp() {
        tmdbFilmService = new TmdbFilmService(gateway, new TmdbFilmMapper(), new ProviderConfigurationProperties());
    }

    @Test
    void getByNativeIdMapsDetails() throws IOException {
        when(gateway.get(eq("movie/603"), anyMap())).thenReturn(Mono.just(loadFixture("tmdb-movie-603.json")));

        StepVerifier.create(tmdbFilmService.getByNativeId("603"))
            .assertNext(record -> {
                assertEquals("The Matrix", record.title());
                assertEquals("tt0133093", record.crossRefId());
            })
            .verifyComplete();
    }

    @Test
    void getByNativeIdRequestsCreditsInConfiguredLanguage() throws IOException {
        when(gateway.get(eq("movie/603"), anyMap())).thenReturn(Mono.just(loadFixture("tmdb-movie-603.json")));

        tmdbFilmService.getByNativeId("603").block();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(gateway).get(eq("movie/603"), params.capture());
        assertEquals("credits", params.getValue().get("append_to_response"));
        assertEquals("en-US", params.getValue().get("language"));
    }

    @Test
    void mismatchedEmbeddedIdIsTreatedAsNotFound() throws IOException {
        // Provider answered with a different film than requested
        when(gateway.get(eq("movie/604"), anyMap())).thenReturn(Mono.just(loadFixture("tmdb-movie-603.json")));

        StepVerifier.create(tmdbFilmService.getByNativeId("604")).verifyComplete();
    }

    @Test
    void outOfRangeRatingKeepsTheRecord() throws IOException {
        JsonNode details = objectMapper.readTree(
            "{\"id\":603,\"title\":\"The Matrix\",\"imdb_id\":\"tt0133093\",\"vote_average\":10.5}");
        when(gateway.get(eq("movie/603"), anyMap())).thenReturn(Mono.just(details));

        StepVerifier.create(tmdbFilmService.getByNativeId("603"))
            .assertNext(record -> {
                assertEquals("The Matrix", record.title());
                assertTrue(record.ratings().isEmpty());
            })
            .verifyComplete();
    }

    @Test
    void nonNumericIdIsRejectedWithoutRequest() {
        StepVerifier.create(tmdbFilmService.getByNativeId("tt0133093")).verifyComplete();

        verify(gateway, never()).get(anyString(), anyMap());
    }

    @Test
    void gatewayFailureDegradesToEmpty() {
        when(gateway.get(eq("movie/603"), anyMap())).thenReturn(Mono.error(new ExternalApiRequestException(
            ProviderTag.PRIMARY, "movie/603", GatewayOutcome.forErrorStatus(3, 503), 3)));

        StepVerifier.create(tmdbFilmService.getByNativeId("603")).verifyComplete();
    }

    @Test
    void searchDropsEntriesWithoutId() throws IOException {
        when(gateway.get(eq("search/movie"), anyMap())).thenReturn(Mono.just(loadFixture("tmdb-search-matrix.json")));

        StepVerifier.create(tmdbFilmService.searchByTitle("  The Matrix ", null, 1))
            .assertNext(results -> {
                assertEquals(2, results.size());
                assertEquals("603", results.get(0).nativeId());
                assertEquals(2003, results.get(1).year());
            })
            .verifyComplete();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(gateway).get(eq("search/movie"), params.capture());
        assertEquals("The Matrix", params.getValue().get("query"));
        assertNull(params.getValue().get("year"));
    }

    @Test
    void searchKeepsValidEntriesNextToAnOutOfRangeRating() throws IOException {
        JsonNode page = objectMapper.readTree("{\"results\":["
            + "{\"id\":603,\"title\":\"The Matrix\",\"release_date\":\"1999-03-30\",\"vote_average\":8.2},"
            + "{\"id\":9999,\"title\":\"The Matrix Bootleg\",\"vote_average\":12}]}");
        when(gateway.get(eq("search/movie"), anyMap())).thenReturn(Mono.just(page));

        StepVerifier.create(tmdbFilmService.searchByTitle("The Matrix", null, 1))
            .assertNext(results -> {
                assertEquals(2, results.size());
                assertEquals(8.2, results.get(0).ratingFor(RatingSource.TMDB).orElseThrow().value());
                assertEquals("9999", results.get(1).nativeId());
                assertTrue(results.get(1).ratings().isEmpty());
            })
            .verifyComplete();
    }

    @Test
    void searchFailureDegradesToEmptyList() {
        when(gateway.get(eq("search/movie"), anyMap())).thenReturn(Mono.error(new IllegalStateException("boom")));

        StepVerifier.create(tmdbFilmService.searchByTitle("Matrix", 1999, 1))
            .assertNext(results -> assertTrue(results.isEmpty()))
            .verifyComplete();
    }

    @Test
    void findByCrossRefIdReadsMovieResults() throws IOException {
        JsonNode findResponse = objectMapper.readTree(
            "{\"movie_results\":[{\"id\":603,\"title\":\"The Matrix\",\"release_date\":\"1999-03-30\",\"vote_average\":8.2}],"
                + "\"tv_results\":[]}");
        when(gateway.get(eq("find/tt0133093"), anyMap())).thenReturn(Mono.just(findResponse));

        StepVerifier.create(tmdbFilmService.findByCrossRefId("tt0133093", 1999))
            .assertNext(record -> {
                assertEquals("603", record.nativeId());
                assertEquals("tt0133093", record.crossRefId());
            })
            .verifyComplete();
    }

    @Test
    void findByCrossRefIdWithNoMovieIsEmpty() throws IOException {
        when(gateway.get(eq("find/tt0000000"), anyMap()))
            .thenReturn(Mono.just(objectMapper.readTree("{\"movie_results\":[]}")));

        StepVerifier.create(tmdbFilmService.findByCrossRefId("tt0000000", null)).verifyComplete();
    }

    private JsonNode loadFixture(String filename) throws IOException {
        return objectMapper.readTree(Files.readString(Paths.get("src/test/resources/fixtures/" + filename)));
    }
}
