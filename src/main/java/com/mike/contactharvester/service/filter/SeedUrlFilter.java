package com.mike.contactharvester.service.filter;

import com.mike.contactharvester.config.FilterConfig;
import com.mike.contactharvester.util.UrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Drops search results before any fetch: non-http URLs, social/video platforms and excluded domains.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SeedUrlFilter {

    private final FilterConfig config;

    public boolean isAllowed(String url) {
        if (!UrlUtils.isHttpUrl(url)) {
            log.debug("SeedUrlFilter: dropping url={} (not http)", url);
            return false;
        }

        String host = UrlUtils.hostOf(url);

        for (String social : config.socialDomains()) {
            if (UrlUtils.isSameOrSubdomain(host, social)) {
                log.debug("SeedUrlFilter: dropping url={} (social domain={})", url, social);
                return false;
            }
        }
        for (String excluded : config.excludedDomainSuffixes()) {
            if (UrlUtils.isSameOrSubdomain(host, excluded)) {
                log.debug("SeedUrlFilter: dropping url={} (excluded domain={})", url, excluded);
                return false;
            }
        }
        return true;
    }
}
