package com.mike.contactharvester.service.fetch;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import com.mike.contactharvester.config.HarvesterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;

import static com.microsoft.playwright.options.LoadState.NETWORKIDLE;

/**
 * Headless Chromium transport for targets behind a browser challenge. A Playwright instance is bound to
 * the thread that created it, so every call gets its own.
 */
@Component
@ConditionalOnProperty(prefix = "harvester.fetch", name = "transport", havingValue = "BROWSER")
@Slf4j
public class PlaywrightFetchTransport implements FetchTransport {

    private static final double SETTLE_TIMEOUT_MS = 5_000;

    private final String userAgent;

    public PlaywrightFetchTransport(HarvesterProperties properties) {
        this.userAgent = properties.getFetch().getUserAgents().get(0);
    }

    @Override
    public TransportResponse get(String url, Duration timeout) throws IOException {
        try (Playwright pw = Playwright.create();
             Browser browser = pw.chromium().launch(
                     new BrowserType.LaunchOptions()
                             .setHeadless(true)
                             .setArgs(List.of("--no-sandbox", "--disable-dev-shm-usage",
                                     "--disable-blink-features=AutomationControlled")));
             BrowserContext ctx = browser.newContext(
                     new Browser.NewContextOptions()
                             .setUserAgent(userAgent)
                             .setLocale("en-US"))) {

            Page page = ctx.newPage();
            page.setDefaultNavigationTimeout(timeout.toMillis());

            Response response = page.navigate(url,
                    new Page.NavigateOptions().setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
            if (response == null) {
                throw new IOException("No response for " + url);
            }

            try {
                page.waitForLoadState(NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(SETTLE_TIMEOUT_MS));
            } catch (TimeoutError e) {
                log.debug("PlaywrightFetchTransport: {} did not reach network idle, using current DOM", url);
            }

            return new TransportResponse(response.status(), page.content(), response.headerValue("content-type"));

        } catch (TimeoutError e) {
            throw new SocketTimeoutException("Navigation timed out for " + url + ": " + e.getMessage());
        } catch (PlaywrightException e) {
            throw new IOException("Browser fetch failed for " + url + ": " + e.getMessage(), e);
        }
    }
}
