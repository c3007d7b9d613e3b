package com.mike.contactharvester.service.emailextractor;

import java.util.stream.Stream;

/**
 * One pattern family of the signal extractor. Produces raw, not yet normalized candidates
 * and never throws on malformed input.
 */
public interface EmailSourceExtractor {
    Stream<String> extractCandidates(String html);
}
