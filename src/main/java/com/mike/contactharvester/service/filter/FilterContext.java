package com.mike.contactharvester.service.filter;

/**
 * Where a candidate was found: the page URL and the query that led to it.
 */
public record FilterContext(String sourceUrl, String originQuery) {

    public static FilterContext none() {
        return new FilterContext(null, null);
    }
}
