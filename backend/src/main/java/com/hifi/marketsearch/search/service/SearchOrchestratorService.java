package com.hifi.marketsearch.search.service;

import com.hifi.marketsearch.config.SearchProperties;
import com.hifi.marketsearch.search.diagnostics.SearchDiagnostics;
import com.hifi.marketsearch.search.model.DiagnosticEvent;
import com.hifi.marketsearch.search.model.Listing;
import com.hifi.marketsearch.search.model.ProviderOutcome;
import com.hifi.marketsearch.search.model.ProviderResultSet;
import com.hifi.marketsearch.search.provider.Provider;
import com.hifi.marketsearch.search.provider.ProviderFetchException;
import com.hifi.marketsearch.search.util.FaultClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs one query against many providers at once. Every provider gets its own time budget;
 * a provider that times out or fails contributes an empty list and never affects the others.
 *
 * <p>Timeouts and faults reach the operator through {@link SearchDiagnostics} only, one event
 * per provider.
 */
@Service
public class SearchOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(SearchOrchestratorService.class);

    private final Duration providerTimeout;
    private final boolean debug;
    private final SearchDiagnostics diagnostics;

    @Autowired
    public SearchOrchestratorService(SearchProperties properties, SearchDiagnostics diagnostics) {
        this(Duration.ofSeconds(properties.getProviderTimeoutSeconds()), properties.isDebug(), diagnostics);
    }

    public SearchOrchestratorService(Duration providerTimeout, boolean debug, SearchDiagnostics diagnostics) {
        this.providerTimeout = providerTimeout;
        this.debug = debug;
        this.diagnostics = diagnostics;
    }

    public ProviderResultSet dispatch(String query, List<Provider> providers) {
        return dispatch(query, providers, null, null);
    }

    public ProviderResultSet dispatch(
        String query,
        List<Provider> providers,
        BigDecimal minPrice,
        BigDecimal maxPrice
    ) {
        if (query == null || query.isBlank()) {
            log.warn("Search query is empty, nothing dispatched");
            return ProviderResultSet.empty(query);
        }
        List<Provider> targets = providers == null ? List.of() : providers;
        progress("Searching {} providers for '{}'", targets.size(), query);

        List<CompletableFuture<List<Listing>>> searches = new ArrayList<>();
        List<CompletableFuture<ProviderOutcome>> tasks = new ArrayList<>();
        for (Provider provider : targets) {
            CompletableFuture<List<Listing>> search = start(provider, query, minPrice, maxPrice);
            searches.add(search);
            tasks.add(track(provider.name(), search));
        }

        try {
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            tasks.forEach(task -> task.cancel(true));
            searches.forEach(search -> search.cancel(true));
            Thread.currentThread().interrupt();
            throw new SearchInterruptedException("Search for '" + query + "' was interrupted", e);
        } catch (ExecutionException e) {
            // outcomes are mapped in track(), so the join itself never fails
            throw new IllegalStateException("Unexpected dispatch failure for '" + query + "'", e.getCause());
        }

        List<ProviderOutcome> outcomes = tasks.stream().map(CompletableFuture::join).toList();
        ProviderResultSet resultSet = ProviderResultSet.fromOutcomes(query, outcomes);
        progress("Query '{}' finished with {} listings", query, resultSet.totalListings());
        return resultSet;
    }

    private CompletableFuture<List<Listing>> start(
        Provider provider,
        String query,
        BigDecimal minPrice,
        BigDecimal maxPrice
    ) {
        try {
            CompletableFuture<List<Listing>> future = provider.search(query, minPrice, maxPrice);
            if (future == null) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException(provider.name() + " returned no search future")
                );
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<ProviderOutcome> track(String providerName, CompletableFuture<List<Listing>> search) {
        long startedAt = System.nanoTime();
        // time out a dependent stage so the provider's own future is left untouched
        return search.thenApply(Function.identity())
            .orTimeout(providerTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((listings, error) -> {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
                if (error == null) {
                    List<Listing> found = listings == null ? List.of() : listings;
                    progress("{} returned {} listings in {}ms", providerName, found.size(), elapsed.toMillis());
                    return ProviderOutcome.success(providerName, found, elapsed);
                }
                return failed(providerName, FaultClassifier.unwrap(error), elapsed);
            });
    }

    private ProviderOutcome failed(String providerName, Throwable cause, Duration elapsed) {
        if (cause instanceof TimeoutException) {
            String message = "No response within " + providerTimeout.toMillis() + "ms";
            log.debug("Provider {} timed out after {}ms", providerName, providerTimeout.toMillis());
            diagnostics.emit(DiagnosticEvent.of(providerName, FaultClassifier.TIMEOUT, message));
            return ProviderOutcome.timeout(providerName, message, elapsed);
        }
        String kind = cause instanceof ProviderFetchException fetchException && fetchException.getReasonCode() != null
            ? fetchException.getReasonCode()
            : FaultClassifier.kind(cause);
        String message = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
        log.debug("Provider {} failed ({}): {}", providerName, kind, message, cause);
        diagnostics.emit(DiagnosticEvent.of(providerName, kind, message));
        return ProviderOutcome.fault(providerName, kind, message, elapsed);
    }

    private void progress(String format, Object... args) {
        if (debug) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }
}
