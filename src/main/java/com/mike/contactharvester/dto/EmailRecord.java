package com.mike.contactharvester.dto;

import com.mike.contactharvester.service.emailextractor.EmailValidator;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Locale;

/**
 * An accepted contact address with its first-seen provenance.
 * Equality is by address only.
 */
@Value
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class EmailRecord {

    @EqualsAndHashCode.Include
    String address;

    String sourceUrl;
    String originQuery;
    String pageTitle;
    String category;

    @Builder
    private EmailRecord(String address, String sourceUrl, String originQuery, String pageTitle, String category) {
        String lower = address == null ? null : address.trim().toLowerCase(Locale.ROOT);
        if (!EmailValidator.isCanonical(lower)) {
            throw new IllegalArgumentException("Not a canonical email address: '" + address + "'");
        }
        this.address = lower;
        this.sourceUrl = sourceUrl == null ? "" : sourceUrl;
        this.originQuery = originQuery == null ? "" : originQuery;
        this.pageTitle = pageTitle == null ? "" : pageTitle;
        this.category = category == null || category.isBlank() ? HarvestQuery.DEFAULT_CATEGORY : category;
    }
}
