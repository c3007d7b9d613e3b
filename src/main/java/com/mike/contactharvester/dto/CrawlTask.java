package com.mike.contactharvester.dto;

/**
 * One URL scheduled inside a crawl session. Depth 0 is the seed, depth 1 a discovered contact page.
 */
public record CrawlTask(String url, String originQuery, int depth) {

    public static CrawlTask seed(String url, String originQuery) {
        return new CrawlTask(url, originQuery, 0);
    }

    public CrawlTask discovered(String discoveredUrl) {
        return new CrawlTask(discoveredUrl, originQuery, depth + 1);
    }

    public boolean isSeed() {
        return depth == 0;
    }
}
