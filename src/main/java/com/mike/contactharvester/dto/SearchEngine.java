package com.mike.contactharvester.dto;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Search engines a {@link com.mike.contactharvester.service.search.SearchProvider} can be asked to query.
 */
public enum SearchEngine {
    GOOGLE("google"),
    BING("bing"),
    YAHOO("yahoo"),
    YANDEX("yandex"),
    DUCKDUCKGO("duckduckgo");

    private final String id;

    SearchEngine(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static SearchEngine fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Search engine id must not be blank");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(e -> e.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unsupported search engine '" + id + "', supported: " + Arrays.stream(values())
                                .map(SearchEngine::id)
                                .collect(Collectors.joining(", "))));
    }
}
