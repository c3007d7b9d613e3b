package com.mike.contactharvester.service.search;

import com.mike.contactharvester.dto.SearchEngine;
import lombok.Getter;

@Getter
public class SearchProviderException extends RuntimeException {

    private final SearchEngine engine;

    public SearchProviderException(SearchEngine engine, String message) {
        super(message);
        this.engine = engine;
    }

    public SearchProviderException(SearchEngine engine, String message, Throwable cause) {
        super(message, cause);
        this.engine = engine;
    }
}
