package com.hifi.marketsearch.search.provider;

public class ProviderFetchException extends RuntimeException {
    private final String reasonCode;

    public ProviderFetchException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public ProviderFetchException(String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
