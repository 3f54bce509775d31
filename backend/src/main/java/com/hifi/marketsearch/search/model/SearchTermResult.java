package com.hifi.marketsearch.search.model;

import java.util.List;

public record SearchTermResult(
    String term,
    List<String> variants,
    String sort,
    Integer daysBack,
    int totalMatches,
    List<RankedListing> listings,
    List<ProviderOutcome> outcomes
) {
}
