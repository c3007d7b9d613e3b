package com.mike.contactharvester.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Switches for the individual pattern families. The decode-and-rescan sweeps are heuristic
 * and can be turned off on their own.
 */
@ConfigurationProperties(prefix = "harvester.extractor")
public record EmailExtractorProperties(
        @DefaultValue("true") boolean spacedEnabled,
        @DefaultValue("true") boolean encodedEnabled,
        @DefaultValue("true") boolean embeddedEnabled,
        @DefaultValue("true") boolean cloudflareEnabled,
        @DefaultValue("true") boolean base64SweepEnabled,
        @DefaultValue("true") boolean rot13SweepEnabled,
        @DefaultValue("false") boolean mxCheckEnabled,
        @DefaultValue("ALLOW") MxUnknownPolicy mxUnknownPolicy,
        @DefaultValue("2000") long mxTimeoutMs
) {
    public enum MxUnknownPolicy {
        ALLOW, DROP
    }

    public static EmailExtractorProperties allEnabled() {
        return new EmailExtractorProperties(true, true, true, true, true, true,
                false, MxUnknownPolicy.ALLOW, 2000);
    }
}
