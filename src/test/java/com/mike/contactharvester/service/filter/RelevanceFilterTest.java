package com.mike.contactharvester.service.filter;

import com.mike.contactharvester.config.FilterConfig;
import com.mike.contactharvester.service.filter.FilterDecision.Rule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelevanceFilterTest {

    private static final FilterConfig AVIATION = FilterConfig.builder()
            .genericProviderDomains(Set.of("gmail.com", "yahoo.com"))
            .excludedDomainSuffixes(Set.of("wixpress.com", ".gov"))
            .excludedSubstrings(Set.of("noreply"))
            .assetTlds(Set.of("png", "jpg"))
            .trustedLocalParts(Set.of("ops", "info"))
            .relevanceKeywords(Set.of("airline", "charter"))
            .regionalTlds(Set.of("ae", "za"))
            .verticalSuffixes(Set.of(".aero"))
            .build();

    private final RelevanceFilter filter = new RelevanceFilter(AVIATION);

    private FilterDecision decide(String email) {
        return filter.decide(email, FilterContext.none());
    }

    @Nested
    @DisplayName("reject rules")
    class Rejects {

        @Test
        @DisplayName("generic provider wins over a trusted local part")
        void genericProviderBeatsRoleAccount() {
            assertEquals(new FilterDecision(false, Rule.GENERIC_PROVIDER), decide("ops@gmail.com"));
        }

        @Test
        @DisplayName("generic provider wins over a keyword in the address")
        void genericProviderBeatsKeyword() {
            assertFalse(filter.accept("airline.charter@yahoo.com", FilterContext.none()));
        }

        @Test
        void excludedSuffix() {
            assertEquals(Rule.EXCLUDED_DOMAIN, decide("info@site.wixpress.com").rule());
            assertEquals(Rule.EXCLUDED_DOMAIN, decide("ops@faa.gov").rule());
        }

        @Test
        @DisplayName("excluded domains match whole labels only")
        void excludedSuffixNeedsLabelBoundary() {
            assertNotEquals(Rule.EXCLUDED_DOMAIN, decide("john@notwixpress.com").rule());
            assertEquals(new FilterDecision(true, Rule.RELEVANCE_KEYWORD), decide("sales@charterwixpress.com"));
        }

        @Test
        void excludedSubstring() {
            assertEquals(new FilterDecision(false, Rule.EXCLUDED_SUBSTRING), decide("noreply@airline.ae"));
        }

        @Test
        void assetExtension() {
            assertEquals(new FilterDecision(false, Rule.ASSET_TLD), decide("logo@2x.png"));
        }

        @Test
        @DisplayName(".com with no positive signal is noise")
        void noSignal() {
            assertEquals(new FilterDecision(false, Rule.NO_SIGNAL), decide("john@randomshop.com"));
        }

        @Test
        void malformed() {
            assertEquals(Rule.MALFORMED, decide(null).rule());
            assertEquals(Rule.MALFORMED, decide("no-at-sign").rule());
            assertEquals(Rule.MALFORMED, decide("x@nodot").rule());
        }
    }

    @Nested
    @DisplayName("accept rules")
    class Accepts {

        @Test
        @DisplayName("role account on an unrelated domain is accepted")
        void trustedLocalPart() {
            assertEquals(new FilterDecision(true, Rule.TRUSTED_LOCAL_PART), decide("ops@randomdomain.com"));
        }

        @Test
        void keywordInDomain() {
            assertEquals(new FilterDecision(true, Rule.RELEVANCE_KEYWORD), decide("john@bestairline.com"));
        }

        @Test
        void regionalTld() {
            assertEquals(new FilterDecision(true, Rule.REGIONAL_TLD), decide("john@shop.ae"));
        }

        @Test
        void verticalSuffix() {
            assertEquals(new FilterDecision(true, Rule.REGIONAL_TLD), decide("john@skyjet.aero"));
        }
    }

    @Nested
    @DisplayName("required substrings")
    class RequiredSubstrings {

        private final RelevanceFilter strict = new RelevanceFilter(AVIATION.toBuilder()
                .requiredDomainSubstrings(Set.of("jet"))
                .build());

        @Test
        void domainWithRequiredSubstringIsAccepted() {
            assertEquals(new FilterDecision(true, Rule.REQUIRED_SUBSTRING),
                    strict.decide("john@flyjets.com", FilterContext.none()));
        }

        @Test
        void domainWithoutRequiredSubstringIsRejected() {
            assertEquals(new FilterDecision(false, Rule.REQUIRED_SUBSTRING),
                    strict.decide("john@randomshop.com", FilterContext.none()));
        }

        @Test
        @DisplayName("earlier positive rules still fire first")
        void earlierRulesWin() {
            assertTrue(strict.accept("ops@randomshop.com", FilterContext.none()));
        }
    }

    @Nested
    @DisplayName("same-site rule")
    class SiteDomain {

        private final FilterContext page = new FilterContext("https://www.randomshop.com/contact", "q");

        @Test
        @DisplayName("off by default")
        void offByDefault() {
            assertFalse(filter.accept("john@randomshop.com", page));
        }

        @Test
        @DisplayName("when enabled, addresses on the page's domain or a subdomain are accepted")
        void enabled() {
            RelevanceFilter siteAware = new RelevanceFilter(AVIATION.toBuilder().acceptSiteDomain(true).build());

            assertEquals(new FilterDecision(true, Rule.SITE_DOMAIN),
                    siteAware.decide("john@randomshop.com", page));
            assertEquals(new FilterDecision(true, Rule.SITE_DOMAIN),
                    siteAware.decide("john@mail.randomshop.com", page));
            assertFalse(siteAware.accept("john@othershop.com", page));
        }

        @Test
        @DisplayName("generic provider still rejects")
        void genericStillRejects() {
            RelevanceFilter siteAware = new RelevanceFilter(AVIATION.toBuilder().acceptSiteDomain(true).build());
            FilterContext gmailPage = new FilterContext("https://gmail.com/", "q");

            assertFalse(siteAware.accept("john@gmail.com", gmailPage));
        }
    }

    @Test
    @DisplayName("same input, same decision")
    void idempotent() {
        for (String email : new String[]{"ops@gmail.com", "ops@randomdomain.com", "john@randomshop.com", "john@skyjet.aero"}) {
            assertEquals(decide(email), decide(email));
        }
    }

    @Test
    @DisplayName("config values are matched case-insensitively")
    void configIsLowercased() {
        RelevanceFilter upper = new RelevanceFilter(FilterConfig.builder()
                .genericProviderDomains(Set.of("GMAIL.COM"))
                .trustedLocalParts(Set.of("OPS"))
                .build());

        assertFalse(upper.accept("ops@gmail.com", FilterContext.none()));
        assertTrue(upper.accept("OPS@Random.com", FilterContext.none()));
    }
}
