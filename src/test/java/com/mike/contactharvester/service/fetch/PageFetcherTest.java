package com.mike.contactharvester.service.fetch;

import com.mike.contactharvester.config.HarvesterProperties;
import com.mike.contactharvester.dto.FetchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PageFetcherTest {

    private static final String URL = "https://skyjet.aero/contact";
    private static final String HTML = "text/html; charset=UTF-8";

    private FetchTransport transport;
    private RequestPacer pacer;
    private PageFetcher fetcher;

    @BeforeEach
    void setUp() {
        transport = mock(FetchTransport.class);
        pacer = mock(RequestPacer.class);

        HarvesterProperties props = new HarvesterProperties();
        props.getFetch().setMaxAttempts(3);
        props.getFetch().setBackoffBase(Duration.ofMillis(100));
        props.getFetch().setBackoffMax(Duration.ofMillis(250));
        fetcher = new PageFetcher(transport, pacer, props);
    }

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @DisplayName("503 then 200 -> ok after two attempts")
        void serverErrorThenOk() throws IOException {
            when(transport.get(eq(URL), any()))
                    .thenReturn(new TransportResponse(503, "", HTML))
                    .thenReturn(new TransportResponse(200, "<html>ok</html>", HTML));

            FetchResult result = fetcher.fetch(URL);

            assertTrue(result.statusOk());
            assertEquals(2, result.attempts());
            assertEquals("<html>ok</html>", result.body());
            verify(pacer).sleep(Duration.ofMillis(100));
        }

        @Test
        @DisplayName("429 and network errors are retried")
        void rateLimitAndIoErrors() throws IOException {
            when(transport.get(eq(URL), any()))
                    .thenReturn(new TransportResponse(429, "", HTML))
                    .thenThrow(new SocketTimeoutException("read timed out"))
                    .thenReturn(new TransportResponse(200, "<html>ok</html>", HTML));

            FetchResult result = fetcher.fetch(URL);

            assertTrue(result.statusOk());
            assertEquals(3, result.attempts());
            verify(transport, times(3)).get(eq(URL), any());
        }

        @Test
        @DisplayName("gives up after max attempts")
        void givesUp() throws IOException {
            when(transport.get(eq(URL), any())).thenReturn(new TransportResponse(502, "", HTML));

            FetchResult result = fetcher.fetch(URL);

            assertFalse(result.statusOk());
            assertEquals(502, result.statusCode());
            assertEquals(3, result.attempts());
            assertEquals("", result.body());
            verify(transport, times(3)).get(eq(URL), any());
            verify(pacer, times(2)).sleep(any());
        }

        @Test
        @DisplayName("404 is not retried")
        void notFound() throws IOException {
            when(transport.get(eq(URL), any())).thenReturn(new TransportResponse(404, "nope", HTML));

            FetchResult result = fetcher.fetch(URL);

            assertFalse(result.statusOk());
            assertEquals(404, result.statusCode());
            verify(transport, times(1)).get(eq(URL), any());
            verify(pacer, never()).sleep(any());
        }

        @Test
        @DisplayName("backoff doubles and is capped")
        void backoff() {
            assertEquals(Duration.ofMillis(100), fetcher.backoffDelay(0));
            assertEquals(Duration.ofMillis(200), fetcher.backoffDelay(1));
            assertEquals(Duration.ofMillis(250), fetcher.backoffDelay(2));
            assertEquals(Duration.ofMillis(250), fetcher.backoffDelay(40));
        }
    }

    @Nested
    @DisplayName("malformed content")
    class MalformedContent {

        @Test
        @DisplayName("non-HTML content type -> failed result, no retry")
        void nonHtml() throws IOException {
            when(transport.get(eq(URL), any())).thenReturn(new TransportResponse(200, "%PDF-1.7", "application/pdf"));

            FetchResult result = fetcher.fetch(URL);

            assertFalse(result.statusOk());
            assertEquals("application/pdf", result.contentType());
            verify(transport, times(1)).get(eq(URL), any());
        }

        @Test
        @DisplayName("blank body -> failed result")
        void blankBody() throws IOException {
            when(transport.get(eq(URL), any())).thenReturn(new TransportResponse(200, "  ", HTML));

            assertFalse(fetcher.fetch(URL).statusOk());
        }

        @Test
        @DisplayName("unexpected transport exception -> failed result, never thrown")
        void runtimeFailure() throws IOException {
            when(transport.get(eq(URL), any())).thenThrow(new IllegalStateException("boom"));

            assertFalse(fetcher.fetch(URL).statusOk());
        }

        @Test
        void htmlDetection() {
            assertTrue(PageFetcher.isHtml("text/html"));
            assertTrue(PageFetcher.isHtml("application/xhtml+xml; charset=utf-8"));
            assertFalse(PageFetcher.isHtml("image/png"));
            assertFalse(PageFetcher.isHtml(null));
        }
    }

    @Test
    @DisplayName("interrupted thread -> no transport call")
    void interrupted() throws IOException {
        Thread.currentThread().interrupt();
        try {
            FetchResult result = fetcher.fetch(URL);
            assertFalse(result.statusOk());
            verify(transport, never()).get(any(), any());
        } finally {
            Thread.interrupted();
        }
    }
}
