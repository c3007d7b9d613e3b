package com.mike.contactharvester.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OrganicResult(
        String title,
        String link
) {
}
