package com.hifi.marketsearch.search.service;

import com.hifi.marketsearch.search.model.AggregatedResults;
import com.hifi.marketsearch.search.model.DiagnosticEvent;
import com.hifi.marketsearch.search.model.Listing;
import com.hifi.marketsearch.search.provider.StubProvider;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.hifi.marketsearch.search.provider.StubProvider.listing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SearchAggregationServiceTest {
    private final List<DiagnosticEvent> events = new ArrayList<>();
    private final SearchAggregationService service = new SearchAggregationService(
        new SearchOrchestratorService(Duration.ofSeconds(5), false, events::add)
    );

    @Test
    void duplicateAcrossVariantsIsKeptOnce() {
        Listing nad = listing("NAD C 356", "https://b.se/1", "1500", "Idag", "Blocket");
        Listing arcam = listing("Arcam A19", "https://b.se/2", "2000", "Igår", "Blocket");
        StubProvider blocket = StubProvider.byQuery("Blocket", Map.of(
            "amp", List.of(nad),
            "amplifier", List.of(nad, arcam)
        ));

        AggregatedResults results = service.aggregate(List.of("amp", "amplifier"), List.of(blocket));

        assertThat(results.listingsByProvider().get("Blocket")).containsExactly(nad, arcam);
        assertEquals(2, results.outcomes().size());
    }

    @Test
    void firstProviderToReturnAListingKeepsIt() {
        Listing shared = listing("Rega Planar 3", "https://shared.se/1", "2500", null, "A");
        Listing sharedCopy = listing("Rega Planar 3 (copy)", "https://shared.se/1", "2600", null, "B");
        StubProvider a = StubProvider.returning("A", shared);
        StubProvider b = StubProvider.returning("B", sharedCopy);

        AggregatedResults results = service.aggregate(List.of("rega"), List.of(a, b));

        assertThat(results.listingsByProvider().keySet()).containsExactly("A", "B");
        assertThat(results.listingsByProvider().get("A")).containsExactly(shared);
        assertThat(results.listingsByProvider().get("B")).isEmpty();
    }

    @Test
    void aggregatingTheSameVariantTwiceChangesNothing() {
        Listing one = listing("Quad 405", "https://t.se/1", "4000", null, "Tradera");
        Listing two = listing("Quad 33", null, "1200", null, "Tradera");
        StubProvider tradera = StubProvider.returning("Tradera", one, two);

        AggregatedResults once = service.aggregate(List.of("quad"), List.of(tradera));
        AggregatedResults twice = service.aggregate(List.of("quad", "quad"), List.of(tradera));

        assertEquals(once.listingsByProvider(), twice.listingsByProvider());
    }

    @Test
    void failedProvidersStillAppearWithEmptyBuckets() {
        StubProvider broken = StubProvider.failing("Blocket", new IllegalStateException("boom"));
        StubProvider healthy = StubProvider.returning("Tradera", listing("Quad 405", "https://t.se/1", null, null, "Tradera"));

        AggregatedResults results = service.aggregate(List.of("quad", "quad 405"), List.of(broken, healthy));

        assertThat(results.listingsByProvider().keySet()).containsExactly("Blocket", "Tradera");
        assertThat(results.listingsByProvider().get("Blocket")).isEmpty();
        assertThat(results.listingsByProvider().get("Tradera")).hasSize(1);
        assertEquals(4, results.outcomes().size());
        assertThat(events).extracting(DiagnosticEvent::providerName).containsExactly("Blocket", "Blocket");
    }
}
