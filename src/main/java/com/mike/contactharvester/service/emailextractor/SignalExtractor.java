package com.mike.contactharvester.service.emailextractor;

import com.mike.contactharvester.config.EmailExtractorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Raw page text -> normalized candidate addresses.
 * <p>
 * Pattern families run in a fixed order: plain regex, spaced/worded obfuscation, percent and entity
 * encoding, embedded data (mailto, data-* attributes, "email" keys), Cloudflare protection, then the
 * base64 and rot13 decode-and-rescan sweeps. Every candidate goes through {@link EmailNormalizer}, so
 * only canonical addresses come out. A failing family is logged and skipped; extraction never throws.
 */
@Component
@Slf4j
public class SignalExtractor {

    private final List<EmailSourceExtractor> extractors;
    private final EmailNormalizer emailNormalizer;

    public SignalExtractor(EmailExtractorProperties props,
                           TextObfuscationNormalizer obfuscationNormalizer,
                           EmailNormalizer emailNormalizer) {
        this.emailNormalizer = emailNormalizer;

        List<EmailSourceExtractor> list = new ArrayList<>();
        list.add(new RegexTextExtractor());
        if (props.spacedEnabled()) list.add(new SpacedEmailExtractor(obfuscationNormalizer));
        if (props.encodedEnabled()) list.add(new EncodedEmailExtractor());
        if (props.embeddedEnabled()) {
            list.add(new MailToExtractor(obfuscationNormalizer));
            list.add(new EmbeddedDataExtractor(obfuscationNormalizer));
        }
        if (props.cloudflareEnabled()) list.add(new CloudflareCfEmailExtractor());
        if (props.base64SweepEnabled()) list.add(new Base64SweepExtractor());
        if (props.rot13SweepEnabled()) list.add(new Rot13SweepExtractor());
        this.extractors = Collections.unmodifiableList(list);

        log.info("SignalExtractor: active pattern families={}",
                extractors.stream().map(e -> e.getClass().getSimpleName()).toList());
    }

    public Set<String> extract(String text) {
        Set<String> results = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return results;
        }

        for (EmailSourceExtractor extractor : extractors) {
            try {
                extractor.extractCandidates(text)
                        .map(emailNormalizer::normalize)
                        .filter(Objects::nonNull)
                        .forEach(results::add);
            } catch (RuntimeException e) {
                log.debug("SignalExtractor: {} failed, skipping: {}",
                        extractor.getClass().getSimpleName(), e.toString());
            }
        }
        return results;
    }
}
