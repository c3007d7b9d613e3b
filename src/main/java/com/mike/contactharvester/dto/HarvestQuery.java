package com.mike.contactharvester.dto;

/**
 * A search query plus the category it is reported under (a country, or "default").
 */
public record HarvestQuery(String text, String category) {

    public static final String DEFAULT_CATEGORY = "default";

    public static HarvestQuery of(String text) {
        return new HarvestQuery(text, DEFAULT_CATEGORY);
    }
}
