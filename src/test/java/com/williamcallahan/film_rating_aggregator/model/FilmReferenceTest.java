package com.williamcallahan.film_rating_aggregator.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FilmReferenceTest {

    @Test
    void requiresAtLeastOneIdentifier() {
        assertThrows(IllegalArgumentException.class, () -> new FilmReference(null, " ", "", null, 1999));
    }

    @Test
    void trimsIdentifiersAndFallsBackToOriginalTitle() {
        FilmReference reference = new FilmReference(" 603 ", null, null, " Léon ", null);

        assertEquals("603", reference.primaryId());
        assertTrue(reference.hasPrimaryId());
        assertFalse(reference.hasCrossRefId());
        assertTrue(reference.hasTitle());
        assertEquals("Léon", reference.bestTitle());
    }

    @Test
    void fromRecordCarriesPrimaryIdOnlyForPrimaryRecords() {
        ProviderRecord primary = ProviderRecord.builder().provider(ProviderTag.PRIMARY).nativeId("603")
            .crossRefId("tt0133093").title("The Matrix").year(1999).build();
        ProviderRecord regional = ProviderRecord.builder().provider(ProviderTag.REGIONAL).nativeId("301")
            .title("Матрица").originalTitle("The Matrix").build();

        assertEquals("603", FilmReference.fromRecord(primary).primaryId());
        assertEquals("tt0133093", FilmReference.fromRecord(primary).crossRefId());
        assertNull(FilmReference.fromRecord(regional).primaryId());
        assertEquals("The Matrix", FilmReference.fromRecord(regional).originalTitle());
    }
}
