package com.mike.contactharvester.service.search;

import com.mike.contactharvester.config.SerpApiProperties;
import com.mike.contactharvester.dto.OrganicResult;
import com.mike.contactharvester.dto.SearchEngine;
import com.mike.contactharvester.dto.SerpApiSearchResponse;
import com.mike.contactharvester.util.UrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Queries engines through SerpAPI's JSON endpoint instead of scraping result pages.
 */
@Service
@ConditionalOnProperty(prefix = "harvester.search", name = "backend", havingValue = "SERPAPI")
@Slf4j
public class SerpApiSearchProvider implements SearchProvider {

    private final SerpApiProperties props;
    private final RestClient restClient;

    public SerpApiSearchProvider(SerpApiProperties props) {
        if (props.apiKey() == null || props.apiKey().isBlank()) {
            throw new IllegalStateException("serpapi.api-key must be set when harvester.search.backend=SERPAPI");
        }
        this.props = props;
        this.restClient = RestClient.builder()
                .baseUrl(props.baseUrl())
                .build();
    }

    SerpApiSearchProvider(SerpApiProperties props, RestClient restClient) {
        this.props = props;
        this.restClient = restClient;
    }

    @Override
    public List<String> search(String query, SearchEngine engine, int limit) {
        log.info("SerpApiSearchProvider: querying SerpAPI engine={} query='{}' limit={}", engine, query, limit);

        SerpApiSearchResponse response;
        try {
            response = restClient.get()
                    .uri(uriBuilder -> engineParams(uriBuilder.path(""), engine, query, limit)
                            .queryParam("engine", engine.id())
                            .queryParam("api_key", props.apiKey())
                            .build())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw new SearchProviderException(engine,
                                "SerpAPI returned HTTP " + res.getStatusCode().value() + " for query '" + query + "'");
                    })
                    .body(SerpApiSearchResponse.class);
        } catch (RestClientException e) {
            throw new SearchProviderException(engine, "SerpAPI call failed for query '" + query + "'", e);
        }

        if (response == null) {
            throw new SearchProviderException(engine, "Empty SerpAPI response for query '" + query + "'");
        }
        if (response.error() != null && !response.error().isBlank()) {
            throw new SearchProviderException(engine, "SerpAPI error: " + response.error());
        }
        if (response.organicResults() == null) {
            log.warn("SerpApiSearchProvider: no organic_results for engine={} query='{}'", engine, query);
            return List.of();
        }

        List<String> links = response.organicResults().stream()
                .map(OrganicResult::link)
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(UrlUtils::isHttpUrl)
                .distinct()
                .limit(limit)
                .toList();

        log.info("SerpApiSearchProvider: engine={} returned {} organic links", engine, links.size());
        return links;
    }

    private UriBuilder engineParams(UriBuilder builder, SearchEngine engine, String query, int limit) {
        return switch (engine) {
            case GOOGLE -> builder
                    .queryParam("q", query)
                    .queryParam("num", limit)
                    .queryParamIfPresent("hl", Optional.ofNullable(props.defaultLanguage()))
                    .queryParamIfPresent("gl", Optional.ofNullable(props.defaultCountry()));
            case BING -> builder.queryParam("q", query).queryParam("count", limit);
            case YAHOO -> builder.queryParam("p", query);
            case YANDEX -> builder.queryParam("text", query);
            case DUCKDUCKGO -> builder.queryParam("q", query);
        };
    }
}
