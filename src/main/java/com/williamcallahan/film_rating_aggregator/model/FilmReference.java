/**
 * Query unit for identity resolution and aggregation
 *
 * @author William Callahan
 *
 * Features:
 * - Carries any subset of primary id, cross-reference (IMDb) id, title, original title and year
 * - Rejects references with no identifying field at construction time
 * - Immutable; use {@link #toBuilder()} to derive variants
 */
package com.williamcallahan.film_rating_aggregator.model;

import com.williamcallahan.film_rating_aggregator.util.ValidationUtils;
import lombok.Builder;

@Builder(toBuilder = true)
public record FilmReference(
    String primaryId,
    String crossRefId,
    String title,
    String originalTitle,
    Integer year
) {
    public FilmReference {
        primaryId = ValidationUtils.trimToNull(primaryId);
        crossRefId = ValidationUtils.trimToNull(crossRefId);
        title = ValidationUtils.trimToNull(title);
        originalTitle = ValidationUtils.trimToNull(originalTitle);
        if (primaryId == null && crossRefId == null && title == null && originalTitle == null) {
            throw new IllegalArgumentException("FilmReference requires at least one of primaryId, crossRefId, title or originalTitle");
        }
    }

    public static FilmReference ofPrimaryId(String primaryId) {
        return FilmReference.builder().primaryId(primaryId).build();
    }

    /**
     * Builds the reference used to look a primary record up in the secondary providers
     */
    public static FilmReference fromRecord(ProviderRecord record) {
        return FilmReference.builder()
                .primaryId(record.provider() == ProviderTag.PRIMARY ? record.nativeId() : null)
                .crossRefId(record.crossRefId())
                .title(record.title())
                .originalTitle(record.originalTitle())
                .year(record.year())
                .build();
    }

    public boolean hasPrimaryId() {
        return primaryId != null;
    }

    public boolean hasCrossRefId() {
        return crossRefId != null;
    }

    public boolean hasTitle() {
        return title != null || originalTitle != null;
    }

    /**
     * @return the title, falling back to the original title
     */
    public String bestTitle() {
        return title != null ? title : originalTitle;
    }
}
