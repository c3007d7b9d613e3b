package com.mike.contactharvester.service.filter;

/**
 * Outcome of the relevance policy together with the rule that decided it.
 */
public record FilterDecision(boolean accepted, Rule rule) {

    public enum Rule {
        MALFORMED,
        GENERIC_PROVIDER,
        EXCLUDED_DOMAIN,
        EXCLUDED_SUBSTRING,
        ASSET_TLD,
        TRUSTED_LOCAL_PART,
        SITE_DOMAIN,
        RELEVANCE_KEYWORD,
        REGIONAL_TLD,
        REQUIRED_SUBSTRING,
        NO_SIGNAL
    }

    static FilterDecision accept(Rule rule) {
        return new FilterDecision(true, rule);
    }

    static FilterDecision reject(Rule rule) {
        return new FilterDecision(false, rule);
    }
}
