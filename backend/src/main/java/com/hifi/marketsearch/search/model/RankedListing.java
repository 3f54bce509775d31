package com.hifi.marketsearch.search.model;

public record RankedListing(
    String providerName,
    String displaySource,
    String normalizedDate,
    Listing listing
) {
}
