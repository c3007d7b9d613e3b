package com.mike.contactharvester.service.crawl;

import com.mike.contactharvester.dto.EmailRecord;

import java.util.List;

/**
 * What one finished session produced. An aborted session carries no records.
 */
public record SessionResult(
        String seedUrl,
        List<EmailRecord> records,
        int pagesFetched,
        int candidatesFound,
        boolean completed
) {

    public static SessionResult aborted(String seedUrl, int pagesFetched) {
        return new SessionResult(seedUrl, List.of(), pagesFetched, 0, false);
    }
}
