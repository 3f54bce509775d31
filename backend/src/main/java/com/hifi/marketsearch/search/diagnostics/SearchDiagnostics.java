package com.hifi.marketsearch.search.diagnostics;

import com.hifi.marketsearch.search.model.DiagnosticEvent;

/**
 * One-way channel for provider timeouts, faults and release failures.
 */
public interface SearchDiagnostics {

    void emit(DiagnosticEvent event);
}
