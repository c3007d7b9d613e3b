package com.mike.contactharvester.config;

import lombok.Builder;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only relevance policy for one run. All entries are stored lowercase.
 *
 * @param excludedDomainSuffixes  SaaS / tracking / CDN domains, matched on label boundaries
 * @param requiredDomainSubstrings when non-empty, the last-resort rule accepts only domains containing one of them
 * @param genericProviderDomains  free consumer mail hosts, always rejected
 * @param relevanceKeywords       vocabulary matched against domain and full address
 * @param trustedLocalParts       role-account prefixes (info, ops, sales...)
 * @param regionalTlds            geo-targeted TLDs
 * @param excludedSubstrings      address substrings that reject outright
 * @param assetTlds               file extensions that leak into matches (png, jpg...)
 * @param verticalSuffixes        domain suffixes accepted like a regional TLD (.aero)
 * @param socialDomains           social / video hosts dropped before any fetch
 * @param acceptSiteDomain        accept addresses on the domain of the page they were found on
 */
@Builder(toBuilder = true)
@ConfigurationProperties(prefix = "harvester.filter")
public record FilterConfig(
        Set<String> excludedDomainSuffixes,
        Set<String> requiredDomainSubstrings,
        Set<String> genericProviderDomains,
        Set<String> relevanceKeywords,
        Set<String> trustedLocalParts,
        Set<String> regionalTlds,
        Set<String> excludedSubstrings,
        Set<String> assetTlds,
        Set<String> verticalSuffixes,
        Set<String> socialDomains,
        boolean acceptSiteDomain
) {

    public FilterConfig {
        excludedDomainSuffixes = lower(excludedDomainSuffixes);
        requiredDomainSubstrings = lower(requiredDomainSubstrings);
        genericProviderDomains = lower(genericProviderDomains);
        relevanceKeywords = lower(relevanceKeywords);
        trustedLocalParts = lower(trustedLocalParts);
        regionalTlds = lower(regionalTlds);
        excludedSubstrings = lower(excludedSubstrings);
        assetTlds = lower(assetTlds);
        verticalSuffixes = lower(verticalSuffixes);
        socialDomains = lower(socialDomains);
    }

    private static Set<String> lower(Collection<String> values) {
        if (values == null) return Set.of();
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
