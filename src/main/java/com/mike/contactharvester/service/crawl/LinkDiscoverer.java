package com.mike.contactharvester.service.crawl;

import com.mike.contactharvester.util.UrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Proposes same-host pages that look like contact pages, in document order.
 * Only ever applied to a session's seed page.
 */
@Component
@Slf4j
public class LinkDiscoverer {

    static final List<String> CONTACT_KEYWORDS = List.of(
            "contact", "kontakt", "about", "team", "company", "support", "services",
            "locations", "branches", "offices", "directions", "impressum"
    );

    public List<String> discover(String baseUrl, String html, int limit) {
        if (limit <= 0 || html == null || html.isBlank()) return List.of();

        String baseHost = UrlUtils.hostOf(baseUrl);
        if (baseHost == null) return List.of();

        Document doc = Jsoup.parse(html, baseUrl);
        Set<String> related = new LinkedHashSet<>();

        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href").trim();
            if (href.isEmpty()) continue;

            String hrefLower = href.toLowerCase(Locale.ROOT);
            if (hrefLower.startsWith("mailto:") || hrefLower.startsWith("javascript:")
                    || hrefLower.startsWith("tel:") || hrefLower.startsWith("#")) {
                continue;
            }

            String absUrl = a.absUrl("href");
            if (absUrl.isBlank() || !UrlUtils.isHttpUrl(absUrl)) continue;

            // stay on the seed host
            if (!Objects.equals(baseHost, UrlUtils.hostOf(absUrl))) continue;

            String linkText = a.text().toLowerCase(Locale.ROOT);
            boolean looksLikeContact = CONTACT_KEYWORDS.stream()
                    .anyMatch(k -> hrefLower.contains(k) || linkText.contains(k));
            if (!looksLikeContact) continue;

            int hash = absUrl.indexOf('#');
            String withoutFragment = hash >= 0 ? absUrl.substring(0, hash) : absUrl;
            if (related.add(withoutFragment)) {
                log.debug("LinkDiscoverer: contact-like link on {} -> text='{}', href='{}'", baseUrl, linkText, href);
            }
            if (related.size() >= limit) break;
        }
        return new ArrayList<>(related);
    }
}
