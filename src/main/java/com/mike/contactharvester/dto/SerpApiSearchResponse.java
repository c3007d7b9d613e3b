package com.mike.contactharvester.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SerpApiSearchResponse(
        @JsonProperty("organic_results")
        List<OrganicResult> organicResults,
        String error
) {
}
