package com.mike.contactharvester.service;

import com.mike.contactharvester.dto.HarvestRunSummary;
import com.mike.contactharvester.service.crawl.EmailAggregator;

public record HarvestResult(EmailAggregator aggregator, HarvestRunSummary summary) {
}
