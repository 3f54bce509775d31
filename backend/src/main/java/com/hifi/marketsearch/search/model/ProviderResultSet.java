package com.hifi.marketsearch.search.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Results of one dispatch of one query variant, keyed by provider name in dispatch order.
 */
public record ProviderResultSet(
    String query,
    Map<String, List<Listing>> listingsByProvider,
    List<ProviderOutcome> outcomes
) {
    public ProviderResultSet {
        Map<String, List<Listing>> copy = new LinkedHashMap<>();
        if (listingsByProvider != null) {
            listingsByProvider.forEach((name, listings) -> copy.put(name, List.copyOf(listings)));
        }
        listingsByProvider = Collections.unmodifiableMap(copy);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static ProviderResultSet empty(String query) {
        return new ProviderResultSet(query, Map.of(), List.of());
    }

    public static ProviderResultSet fromOutcomes(String query, List<ProviderOutcome> outcomes) {
        Map<String, List<Listing>> byProvider = new LinkedHashMap<>();
        for (ProviderOutcome outcome : outcomes) {
            byProvider.put(outcome.providerName(), outcome.listings());
        }
        return new ProviderResultSet(query, byProvider, outcomes);
    }

    public int totalListings() {
        return listingsByProvider.values().stream().mapToInt(List::size).sum();
    }
}
