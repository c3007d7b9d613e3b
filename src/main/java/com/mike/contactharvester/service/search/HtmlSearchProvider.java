package com.mike.contactharvester.service.search;

import com.mike.contactharvester.dto.FetchResult;
import com.mike.contactharvester.dto.SearchEngine;
import com.mike.contactharvester.service.fetch.PageFetcher;
import com.mike.contactharvester.service.fetch.RequestPacer;
import com.mike.contactharvester.util.UrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scrapes the engines' own HTML result pages.
 */
@Service
@ConditionalOnProperty(prefix = "harvester.search", name = "backend", havingValue = "HTML", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class HtmlSearchProvider implements SearchProvider {

    private final PageFetcher pageFetcher;
    private final RequestPacer pacer;

    @Override
    public List<String> search(String query, SearchEngine engine, int limit) {
        String url = searchUrl(engine, query, limit);
        log.info("HtmlSearchProvider: querying engine={} query='{}' limit={}", engine, query, limit);

        FetchResult page;
        try {
            page = pageFetcher.fetch(url);
        } finally {
            pacer.pauseBetween(Duration.ofSeconds(1), Duration.ofSeconds(2));
        }

        if (!page.statusOk()) {
            throw new SearchProviderException(engine,
                    "Search page unavailable (status=" + page.statusCode() + ") for query '" + query + "'");
        }

        List<String> links = parseResults(engine, page.body(), url, limit);
        log.info("HtmlSearchProvider: engine={} returned {} links", engine, links.size());
        return links;
    }

    static String searchUrl(SearchEngine engine, String query, int limit) {
        String q = URLEncoder.encode(query, StandardCharsets.UTF_8);
        return switch (engine) {
            case GOOGLE -> "https://www.google.com/search?q=" + q + "&num=" + limit;
            case BING -> "https://www.bing.com/search?q=" + q + "&count=" + limit;
            case YAHOO -> "https://search.yahoo.com/search?p=" + q + "&n=" + limit;
            case YANDEX -> "https://yandex.com/search/?text=" + q + "&numdoc=" + limit;
            case DUCKDUCKGO -> "https://html.duckduckgo.com/html/?q=" + q;
        };
    }

    static List<String> parseResults(SearchEngine engine, String html, String pageUrl, int limit) {
        Document doc = Jsoup.parse(html, pageUrl);
        Set<String> links = new LinkedHashSet<>();

        String selector = engine == SearchEngine.DUCKDUCKGO ? "a.result__a" : "a[href]";
        for (Element a : doc.select(selector)) {
            String link = resultLink(engine, a.attr("href"));
            if (link != null && UrlUtils.isHttpUrl(link)) {
                links.add(link);
            }
            if (links.size() >= limit) break;
        }
        return new ArrayList<>(links);
    }

    private static String resultLink(SearchEngine engine, String href) {
        if (href == null || href.isBlank()) return null;
        String h = href.trim();

        return switch (engine) {
            case GOOGLE -> {
                int idx = h.indexOf("/url?q=");
                if (idx < 0) yield null;
                yield decode(cutAt(h.substring(idx + "/url?q=".length()), '&'));
            }
            case BING -> external(h, "bing.com");
            case YAHOO -> {
                int ru = h.indexOf("/RU=");
                if (ru >= 0) {
                    yield decode(cutAt(h.substring(ru + "/RU=".length()), '/'));
                }
                yield external(h, "yahoo.com");
            }
            case YANDEX -> external(h, "yandex");
            case DUCKDUCKGO -> {
                int uddg = h.indexOf("uddg=");
                if (uddg >= 0) {
                    yield decode(cutAt(h.substring(uddg + "uddg=".length()), '&'));
                }
                yield h.startsWith("http") ? h : null;
            }
        };
    }

    private static String external(String href, String engineDomain) {
        return href.startsWith("http") && !href.contains(engineDomain) ? href : null;
    }

    private static String cutAt(String s, char c) {
        int idx = s.indexOf(c);
        return idx >= 0 ? s.substring(0, idx) : s;
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("HtmlSearchProvider: cannot decode result link '{}'", s);
            return null;
        }
    }
}
