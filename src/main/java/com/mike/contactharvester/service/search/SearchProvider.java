package com.mike.contactharvester.service.search;

import com.mike.contactharvester.dto.SearchEngine;

import java.util.List;

/**
 * Source of candidate seed URLs for a query.
 */
public interface SearchProvider {

    /**
     * @return at most {@code limit} distinct http(s) URLs, in result order
     * @throws SearchProviderException when the engine call fails or its answer cannot be read
     */
    List<String> search(String query, SearchEngine engine, int limit);
}
