package com.mike.contactharvester.service.fetch;

public record TransportResponse(int statusCode, String body, String contentType) {

    public boolean ok() {
        return statusCode >= 200 && statusCode < 300;
    }
}
