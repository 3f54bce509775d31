package com.hifi.marketsearch.search.model;

import java.time.Instant;

public record DiagnosticEvent(
    String providerName,
    String kind,
    String message,
    Instant occurredAt
) {
    public static DiagnosticEvent of(String providerName, String kind, String message) {
        return new DiagnosticEvent(providerName, kind, message, Instant.now());
    }
}
