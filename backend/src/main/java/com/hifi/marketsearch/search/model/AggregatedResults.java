package com.hifi.marketsearch.search.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record AggregatedResults(
    List<String> variants,
    Map<String, List<Listing>> listingsByProvider,
    List<ProviderOutcome> outcomes
) {
    public AggregatedResults {
        variants = variants == null ? List.of() : List.copyOf(variants);
        Map<String, List<Listing>> copy = new LinkedHashMap<>();
        if (listingsByProvider != null) {
            listingsByProvider.forEach((name, listings) -> copy.put(name, List.copyOf(listings)));
        }
        listingsByProvider = Collections.unmodifiableMap(copy);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public int totalListings() {
        return listingsByProvider.values().stream().mapToInt(List::size).sum();
    }
}
