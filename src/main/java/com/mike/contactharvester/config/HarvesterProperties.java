package com.mike.contactharvester.config;

import com.mike.contactharvester.dto.SearchEngine;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {

    /**
     * Explicit queries, run under the "default" category.
     */
    private List<String> queries = List.of();

    /**
     * Countries expanded through keywords x templates (one category per country).
     */
    private List<String> countries = List.of();

    private List<String> keywords = List.of();

    /**
     * Placeholders: {keyword}, {country}, {tld}.
     */
    private List<String> queryTemplates = List.of();

    /**
     * Country name -> TLD used by the "site:.{tld}" templates. Unknown countries fall back to "com".
     */
    private Map<String, String> countryTlds = new LinkedHashMap<>();

    private Set<SearchEngine> engines = Set.of(SearchEngine.GOOGLE, SearchEngine.BING, SearchEngine.YAHOO, SearchEngine.YANDEX);

    private int maxQueriesPerBatch = 8;

    /**
     * Max URLs kept per query after merging all engines.
     */
    private int urlLimitPerQuery = 20;

    private int maxPagesPerSession = 6;

    private int maxPagesPerHost = 6;

    /**
     * How many contact-like links are followed from a seed page.
     */
    private int discoverLimit = 4;

    private int workerPoolSize = 5;

    private Delay delay = new Delay();
    private Fetch fetch = new Fetch();
    private Search search = new Search();
    private Output output = new Output();
    private Runner runner = new Runner();

    @Data
    public static class Delay {
        /** pause after every page fetch */
        private Duration requestMin = Duration.ofMillis(300);
        private Duration requestMax = Duration.ofMillis(600);

        /** pause between two queries */
        private Duration queryMin = Duration.ofSeconds(2);
        private Duration queryMax = Duration.ofSeconds(4);
    }

    @Data
    public static class Fetch {
        private Duration timeout = Duration.ofSeconds(15);
        private int maxAttempts = 3;
        private Duration backoffBase = Duration.ofMillis(600);
        private Duration backoffMax = Duration.ofSeconds(10);
        private TransportType transport = TransportType.HTTP;
        private List<String> userAgents = List.of(
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36"
        );
        private String referrer = "https://www.google.com";
    }

    @Data
    public static class Search {
        private SearchBackend backend = SearchBackend.HTML;
    }

    @Data
    public static class Output {
        private String path = "output/extract-emails/multi-engine-harvest.csv";

        /** additionally write one CSV per category */
        private boolean perCategory = false;
    }

    @Data
    public static class Runner {
        private boolean enabled = true;
    }

    public enum TransportType {
        HTTP, BROWSER
    }

    public enum SearchBackend {
        HTML, SERPAPI
    }
}
