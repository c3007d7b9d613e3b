package com.mike.contactharvester.dto;

public record FetchResult(
        String url,
        boolean statusOk,
        int statusCode,
        String body,
        String contentType,
        int attempts
) {

    public static FetchResult ok(String url, int statusCode, String body, String contentType, int attempts) {
        return new FetchResult(url, true, statusCode, body, contentType, attempts);
    }

    public static FetchResult failed(String url, int statusCode, String contentType, int attempts) {
        return new FetchResult(url, false, statusCode, "", contentType == null ? "" : contentType, attempts);
    }
}
