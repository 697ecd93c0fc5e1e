package com.williamcallahan.film_rating_aggregator.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility class for title normalization used by searches and identity matching.
 */
public final class TextUtils {

    private static final Pattern YEAR_SUFFIX = Pattern.compile("\\s*\\(\\d{4}\\)");
    private static final Pattern PARENTHETICAL = Pattern.compile("\\s*\\([^)]*\\)");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextUtils() {
        // Private constructor to prevent instantiation
    }

    /**
     * Strips a trailing {@code (YYYY)} and any other parenthetical suffix, collapses every run
     * of non-alphanumeric characters to one space and trims.
     *
     * <pre>{@code
     * sanitizeTitleForSearch("Amélie (2001)")            -> "Amélie"
     * sanitizeTitleForSearch("Spider-Man: No Way Home") -> "Spider Man No Way Home"
     * }</pre>
     *
     * @param title raw title, may be null
     * @return sanitized title, empty string for null or blank input
     */
    public static String sanitizeTitleForSearch(String title) {
        if (title == null || title.isBlank()) {
            return "";
        }
        String result = YEAR_SUFFIX.matcher(title).replaceAll("");
        result = PARENTHETICAL.matcher(result).replaceAll("");
        result = NON_ALPHANUMERIC.matcher(result).replaceAll(" ");
        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    /**
     * Trimmed, lowercased form used for case-insensitive title equality.
     */
    public static String normalizeForComparison(String title) {
        if (title == null) {
            return null;
        }
        return WHITESPACE.matcher(title.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    public static boolean titlesMatch(String left, String right) {
        if (left == null || right == null) {
            return false;
        }
        return normalizeForComparison(left).equals(normalizeForComparison(right));
    }
}
