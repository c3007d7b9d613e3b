package com.mike.contactharvester.service.filter;

import com.mike.contactharvester.config.FilterConfig;
import com.mike.contactharvester.service.filter.FilterDecision.Rule;
import com.mike.contactharvester.util.UrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Ordered, first-match relevance policy for candidate addresses:
 * <ol>
 *     <li>generic provider domain -> reject</li>
 *     <li>excluded domain suffix or excluded substring -> reject</li>
 *     <li>asset-extension TLD -> reject</li>
 *     <li>trusted local part prefix -> accept</li>
 *     <li>(opt-in) domain of the page it was found on -> accept</li>
 *     <li>relevance keyword in domain or address -> accept</li>
 *     <li>regional TLD or vertical suffix -> accept</li>
 *     <li>required substrings configured: accept only when the domain contains one; otherwise reject</li>
 * </ol>
 * Stateless: the same (email, config, context) always yields the same decision.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RelevanceFilter {

    private final FilterConfig config;

    public boolean accept(String email, FilterContext context) {
        FilterDecision decision = decide(email, context);
        log.debug("RelevanceFilter: {} '{}' (rule={}, source={})",
                decision.accepted() ? "accepted" : "rejected", email, decision.rule(),
                context == null ? null : context.sourceUrl());
        return decision.accepted();
    }

    public FilterDecision decide(String email, FilterContext context) {
        if (email == null) return FilterDecision.reject(Rule.MALFORMED);

        String address = email.trim().toLowerCase(Locale.ROOT);
        int at = address.lastIndexOf('@');
        if (at <= 0 || at == address.length() - 1) return FilterDecision.reject(Rule.MALFORMED);

        String localPart = address.substring(0, at);
        String domain = address.substring(at + 1);
        int lastDot = domain.lastIndexOf('.');
        if (lastDot <= 0 || lastDot == domain.length() - 1) return FilterDecision.reject(Rule.MALFORMED);
        String tld = domain.substring(lastDot + 1);

        if (config.genericProviderDomains().contains(domain)) {
            return FilterDecision.reject(Rule.GENERIC_PROVIDER);
        }

        for (String suffix : config.excludedDomainSuffixes()) {
            if (UrlUtils.isSameOrSubdomain(domain, suffix)) return FilterDecision.reject(Rule.EXCLUDED_DOMAIN);
        }
        for (String substring : config.excludedSubstrings()) {
            if (address.contains(substring)) return FilterDecision.reject(Rule.EXCLUDED_SUBSTRING);
        }

        if (config.assetTlds().contains(tld)) {
            return FilterDecision.reject(Rule.ASSET_TLD);
        }

        for (String prefix : config.trustedLocalParts()) {
            if (localPart.startsWith(prefix)) return FilterDecision.accept(Rule.TRUSTED_LOCAL_PART);
        }

        if (config.acceptSiteDomain() && isSiteDomain(domain, context)) {
            return FilterDecision.accept(Rule.SITE_DOMAIN);
        }

        for (String keyword : config.relevanceKeywords()) {
            if (domain.contains(keyword) || address.contains(keyword)) {
                return FilterDecision.accept(Rule.RELEVANCE_KEYWORD);
            }
        }

        if (config.regionalTlds().contains(tld)) {
            return FilterDecision.accept(Rule.REGIONAL_TLD);
        }
        for (String suffix : config.verticalSuffixes()) {
            if (domain.endsWith(suffix)) return FilterDecision.accept(Rule.REGIONAL_TLD);
        }

        if (!config.requiredDomainSubstrings().isEmpty()) {
            for (String required : config.requiredDomainSubstrings()) {
                if (domain.contains(required)) return FilterDecision.accept(Rule.REQUIRED_SUBSTRING);
            }
            return FilterDecision.reject(Rule.REQUIRED_SUBSTRING);
        }

        return FilterDecision.reject(Rule.NO_SIGNAL);
    }

    private boolean isSiteDomain(String emailDomain, FilterContext context) {
        if (context == null || context.sourceUrl() == null) return false;
        String siteBaseDomain = UrlUtils.baseDomainOf(context.sourceUrl());
        if (siteBaseDomain == null) return false;
        return emailDomain.equals(siteBaseDomain) || emailDomain.endsWith("." + siteBaseDomain);
    }
}
