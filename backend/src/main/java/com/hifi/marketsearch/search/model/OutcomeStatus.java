package com.hifi.marketsearch.search.model;

public enum OutcomeStatus {
    SUCCESS,
    TIMEOUT,
    FAULT
}
