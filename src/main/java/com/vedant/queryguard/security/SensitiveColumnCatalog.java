package com.vedant.queryguard.security;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Column-level security metadata: substring patterns that mark a column as sensitive,
 * grouped by category, plus aggregate expressions that may be served instead.
 *
 * Immutable once built. Matching is case-insensitive and by substring, so
 * {@code user_password_hash} is caught by {@code password}.
 */
public final class SensitiveColumnCatalog {

    public static final String DEFAULT_ALTERNATIVE = "COUNT(*) AS record_count";

    private final String version;
    private final Map<String, String> categoryByPattern;
    private final Map<String, String> safeAlternatives;

    public SensitiveColumnCatalog(String version,
                                  Map<String, List<String>> patternsByCategory,
                                  Map<String, String> safeAlternatives) {
        this.version = version;

        Map<String, String> byPattern = new LinkedHashMap<>();
        if (patternsByCategory != null) {
            patternsByCategory.forEach((category, patterns) -> {
                for (String p : patterns) {
                    if (p != null && !p.isBlank()) {
                        byPattern.putIfAbsent(p.trim().toLowerCase(Locale.ROOT), category);
                    }
                }
            });
        }
        this.categoryByPattern = Collections.unmodifiableMap(byPattern);

        Map<String, String> alternatives = new LinkedHashMap<>();
        if (safeAlternatives != null) {
            safeAlternatives.forEach((k, v) -> alternatives.put(k.trim().toLowerCase(Locale.ROOT), v));
        }
        this.safeAlternatives = Collections.unmodifiableMap(alternatives);
    }

    /** Reads the JSON catalog document ({@code version}, {@code categories}, {@code safeAlternatives}). */
    public static SensitiveColumnCatalog load(InputStream in, ObjectMapper mapper) throws IOException {
        CatalogDocument doc = mapper.readValue(in, CatalogDocument.class);
        if (doc.categories() == null || doc.categories().isEmpty()) {
            throw new IOException("Sensitive column catalog defines no patterns");
        }
        return new SensitiveColumnCatalog(doc.version(), doc.categories(), doc.safeAlternatives());
    }

    /** First catalog pattern contained in the column name, if any. */
    public Optional<String> matchingPattern(String columnName) {
        if (columnName == null) return Optional.empty();
        String lower = columnName.toLowerCase(Locale.ROOT);
        return categoryByPattern.keySet().stream()
                .filter(lower::contains)
                .findFirst();
    }

    public boolean isSensitive(String columnName) {
        return matchingPattern(columnName).isPresent();
    }

    public Optional<String> categoryOf(String columnName) {
        return matchingPattern(columnName).map(categoryByPattern::get);
    }

    /** Safe aggregate registered for exactly this column name (case-insensitive). */
    public Optional<String> safeAlternativeFor(String columnName) {
        if (columnName == null) return Optional.empty();
        return Optional.ofNullable(safeAlternatives.get(columnName.toLowerCase(Locale.ROOT)));
    }

    public List<String> patterns() {
        return new ArrayList<>(categoryByPattern.keySet());
    }

    public String version() {
        return version;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CatalogDocument(String version,
                           LinkedHashMap<String, List<String>> categories,
                           LinkedHashMap<String, String> safeAlternatives) {}
}
