package com.hifi.marketsearch.search.diagnostics;

import com.hifi.marketsearch.search.model.DiagnosticEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingSearchDiagnostics implements SearchDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(LoggingSearchDiagnostics.class);

    @Override
    public void emit(DiagnosticEvent event) {
        if (event == null) {
            return;
        }
        log.warn("provider={} kind={} message={}", event.providerName(), event.kind(), event.message());
    }
}
