package com.mike.contactharvester.service.fetch;

import java.io.IOException;
import java.time.Duration;

/**
 * Pluggable way of getting a page: a plain HTTP client or a real browser for challenge-protected sites.
 * Network-level failures (timeouts, resets) are reported as {@link IOException};
 * any HTTP status, error or not, is returned as a response.
 */
public interface FetchTransport {

    TransportResponse get(String url, Duration timeout) throws IOException;
}
