package com.hifi.marketsearch.search.service;

import com.hifi.marketsearch.config.SearchProperties;
import com.hifi.marketsearch.search.diagnostics.SearchDiagnostics;
import com.hifi.marketsearch.search.model.DiagnosticEvent;
import com.hifi.marketsearch.search.provider.Provider;
import com.hifi.marketsearch.search.provider.ProviderRegistry;
import com.hifi.marketsearch.search.util.FaultClassifier;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Releases provider resources once, at shutdown or after a CLI run. Each release gets its
 * own timeout and the whole pass is capped by a total budget. An interrupt that arrives
 * before or during the pass does not skip any provider; the flag is restored afterwards.
 */
@Service
public class ProviderShutdownService {
    private static final Logger log = LoggerFactory.getLogger(ProviderShutdownService.class);

    private final ProviderRegistry providerRegistry;
    private final SearchProperties properties;
    private final SearchDiagnostics diagnostics;
    private final AtomicBoolean released = new AtomicBoolean(false);

    public ProviderShutdownService(
        ProviderRegistry providerRegistry,
        SearchProperties properties,
        SearchDiagnostics diagnostics
    ) {
        this.providerRegistry = providerRegistry;
        this.properties = properties;
        this.diagnostics = diagnostics;
    }

    @PreDestroy
    public void releaseAll() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        // a pending interrupt would fail every wait below, so park it until the pass is over
        boolean interrupted = Thread.interrupted();
        try {
            List<Provider> providers = providerRegistry.all();
            long perProviderNanos = TimeUnit.SECONDS.toNanos(properties.getShutdown().getReleaseTimeoutSeconds());
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(properties.getShutdown().getTotalTimeoutSeconds());

            for (Provider provider : providers) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.debug("Release budget exhausted before {}", provider.name());
                    break;
                }
                if (release(provider, Math.min(perProviderNanos, remaining))) {
                    interrupted = true;
                }
            }
            log.debug("Released {} providers", providers.size());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Returns true when the wait was interrupted. The pass carries on with the next provider.
     */
    private boolean release(Provider provider, long timeoutNanos) {
        try {
            CompletableFuture<Void> release = provider.release();
            if (release != null) {
                release.get(timeoutNanos, TimeUnit.NANOSECONDS);
            }
        } catch (TimeoutException e) {
            log.debug("Release of {} timed out after {}ms", provider.name(), TimeUnit.NANOSECONDS.toMillis(timeoutNanos));
        } catch (InterruptedException e) {
            log.debug("Interrupted while releasing {}", provider.name());
            return true;
        } catch (ExecutionException | RuntimeException e) {
            handleFault(provider, e);
        }
        return false;
    }

    private void handleFault(Provider provider, Throwable error) {
        Throwable cause = FaultClassifier.unwrap(error);
        if (FaultClassifier.isBenignShutdownRace(cause)) {
            log.debug("Ignoring release race for {}: {}", provider.name(), cause.getMessage());
            return;
        }
        String message = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
        log.debug("Failed to release {}: {}", provider.name(), message, cause);
        diagnostics.emit(DiagnosticEvent.of(provider.name(), FaultClassifier.RELEASE_FAILED, message));
    }
}
