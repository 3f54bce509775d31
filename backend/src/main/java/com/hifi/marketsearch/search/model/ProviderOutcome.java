package com.hifi.marketsearch.search.model;

import java.time.Duration;
import java.util.List;

public record ProviderOutcome(
    String providerName,
    OutcomeStatus status,
    List<Listing> listings,
    String faultKind,
    String message,
    Duration elapsed
) {
    public ProviderOutcome {
        listings = listings == null ? List.of() : List.copyOf(listings);
    }

    public static ProviderOutcome success(String providerName, List<Listing> listings, Duration elapsed) {
        return new ProviderOutcome(providerName, OutcomeStatus.SUCCESS, listings, null, null, elapsed);
    }

    public static ProviderOutcome timeout(String providerName, String message, Duration elapsed) {
        return new ProviderOutcome(providerName, OutcomeStatus.TIMEOUT, List.of(), "TIMEOUT", message, elapsed);
    }

    public static ProviderOutcome fault(String providerName, String faultKind, String message, Duration elapsed) {
        return new ProviderOutcome(providerName, OutcomeStatus.FAULT, List.of(), faultKind, message, elapsed);
    }

    public boolean succeeded() {
        return status == OutcomeStatus.SUCCESS;
    }
}
