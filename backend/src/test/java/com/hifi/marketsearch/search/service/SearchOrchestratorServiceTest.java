package com.hifi.marketsearch.search.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.hifi.marketsearch.search.diagnostics.LoggingSearchDiagnostics;
import com.hifi.marketsearch.search.diagnostics.SearchDiagnostics;
import com.hifi.marketsearch.search.model.DiagnosticEvent;
import com.hifi.marketsearch.search.model.Listing;
import com.hifi.marketsearch.search.model.OutcomeStatus;
import com.hifi.marketsearch.search.model.ProviderOutcome;
import com.hifi.marketsearch.search.model.ProviderResultSet;
import com.hifi.marketsearch.search.provider.ProviderFetchException;
import com.hifi.marketsearch.search.provider.StubProvider;
import com.hifi.marketsearch.search.util.FaultClassifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static com.hifi.marketsearch.search.provider.StubProvider.listing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class SearchOrchestratorServiceTest {

    @Mock
    private SearchDiagnostics diagnostics;

    @Test
    void blankQueryDispatchesNothing() {
        StubProvider provider = StubProvider.returning("Blocket", listing("NAD", "https://b.se/1", null, null, "Blocket"));
        SearchOrchestratorService service = new SearchOrchestratorService(Duration.ofSeconds(5), false, diagnostics);

        ProviderResultSet result = service.dispatch("   ", List.of(provider));

        assertTrue(result.listingsByProvider().isEmpty());
        assertTrue(result.outcomes().isEmpty());
        assertEquals(0, provider.searchCalls());
        verifyNoInteractions(diagnostics);
    }

    @Test
    void slowProviderTimesOutWithoutAffectingSiblings() {
        Listing nad = listing("NAD C 356", "https://b.se/1", "1500", "Idag", "Blocket");
        Listing rega = listing("Rega Planar 3", "https://b.se/2", "2500", "Igår", "Blocket");
        StubProvider fast = StubProvider.returning("Blocket", nad, rega);
        StubProvider slow = StubProvider.never("Tradera");
        SearchOrchestratorService service = new SearchOrchestratorService(Duration.ofMillis(200), true, diagnostics);

        ProviderResultSet result = service.dispatch("amp", List.of(slow, fast));

        assertThat(result.listingsByProvider().keySet()).containsExactly("Tradera", "Blocket");
        assertThat(result.listingsByProvider().get("Blocket")).containsExactly(nad, rega);
        assertThat(result.listingsByProvider().get("Tradera")).isEmpty();
        assertThat(result.outcomes()).extracting(ProviderOutcome::status)
            .containsExactly(OutcomeStatus.TIMEOUT, OutcomeStatus.SUCCESS);

        ArgumentCaptor<DiagnosticEvent> event = ArgumentCaptor.forClass(DiagnosticEvent.class);
        verify(diagnostics, times(1)).emit(event.capture());
        assertEquals("Tradera", event.getValue().providerName());
        assertEquals(FaultClassifier.TIMEOUT, event.getValue().kind());
        assertFalse(slow.lastFuture().isDone());
    }

    @Test
    void eachTimeoutOrFaultLogsExactlyOneWarning() {
        Logger logger = (Logger) LoggerFactory.getLogger("com.hifi.marketsearch");
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            SearchOrchestratorService service =
                new SearchOrchestratorService(Duration.ofMillis(200), true, new LoggingSearchDiagnostics());

            service.dispatch("amp", List.of(
                StubProvider.never("Tradera"),
                StubProvider.failing("Blocket", new IllegalStateException("boom")),
                StubProvider.returning("HiFiShark")
            ));

            List<String> warnings = appender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
            assertThat(warnings).hasSize(2);
            assertThat(warnings).anyMatch(line -> line.contains("provider=Tradera kind=TIMEOUT")
                && line.contains("No response within 200ms"));
            assertThat(warnings).anyMatch(line -> line.contains("provider=Blocket") && line.contains("boom"));
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void faultsAreContainedAndTaggedByKind() {
        Listing listing = listing("Pioneer PL-12D", "https://h.se/1", null, null, "HiFi Torget");
        StubProvider healthy = StubProvider.returning("HiFi Torget", listing);
        StubProvider httpFailure = StubProvider.failing(
            "Blocket",
            new ProviderFetchException(FaultClassifier.HTTP_5XX, "Blocket: HTTP 503")
        );
        StubProvider throwsDirectly = StubProvider.throwing("Tradera", new IllegalStateException("selector missing"));
        SearchOrchestratorService service = new SearchOrchestratorService(Duration.ofSeconds(5), false, diagnostics);

        ProviderResultSet result = service.dispatch("turntable", List.of(httpFailure, healthy, throwsDirectly));

        assertThat(result.listingsByProvider().get("HiFi Torget")).containsExactly(listing);
        assertThat(result.listingsByProvider().get("Blocket")).isEmpty();
        assertThat(result.listingsByProvider().get("Tradera")).isEmpty();
        assertThat(result.outcomes()).extracting(ProviderOutcome::faultKind)
            .containsExactly(FaultClassifier.HTTP_5XX, null, "IllegalStateException");

        ArgumentCaptor<DiagnosticEvent> events = ArgumentCaptor.forClass(DiagnosticEvent.class);
        verify(diagnostics, times(2)).emit(events.capture());
        assertThat(events.getAllValues()).extracting(DiagnosticEvent::providerName)
            .containsExactlyInAnyOrder("Blocket", "Tradera");
    }

    @Test
    void interruptCancelsPendingWorkAndRestoresFlag() throws Exception {
        StubProvider slow = StubProvider.never("Facebook Marketplace");
        SearchOrchestratorService service = new SearchOrchestratorService(Duration.ofSeconds(60), false, diagnostics);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        AtomicBoolean interruptFlag = new AtomicBoolean(false);

        Thread caller = new Thread(() -> {
            try {
                service.dispatch("amp", List.of(slow));
            } catch (Throwable e) {
                failure.set(e);
                interruptFlag.set(Thread.currentThread().isInterrupted());
            }
        });
        caller.start();
        long deadline = System.currentTimeMillis() + 5_000;
        while (slow.searchCalls() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        caller.interrupt();
        caller.join(5_000);

        assertThat(failure.get()).isInstanceOf(SearchInterruptedException.class);
        assertTrue(interruptFlag.get());
        assertTrue(slow.lastFuture().isCancelled());
        verifyNoInteractions(diagnostics);
    }
}
