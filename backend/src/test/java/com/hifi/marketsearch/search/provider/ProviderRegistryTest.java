package com.hifi.marketsearch.search.provider;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderRegistryTest {
    private final ProviderRegistry registry = new ProviderRegistry(List.of(
        StubProvider.returning("Blocket"),
        StubProvider.returning("Facebook Marketplace"),
        StubProvider.returning("HiFi Torget"),
        StubProvider.returning("Tradera")
    ));

    @Test
    void matchesWholeNameOrOneWordIgnoringCase() {
        assertTrue(ProviderRegistry.matchesName("facebook", "Facebook Marketplace"));
        assertTrue(ProviderRegistry.matchesName("FACEBOOK MARKETPLACE", "Facebook Marketplace"));
        assertTrue(ProviderRegistry.matchesName(" tradera ", "Tradera"));
        assertFalse(ProviderRegistry.matchesName("face", "Facebook Marketplace"));
        assertFalse(ProviderRegistry.matchesName("", "Tradera"));
    }

    @Test
    void noSelectionReturnsEveryProviderInOrder() {
        assertEquals(List.of("Blocket", "Facebook Marketplace", "HiFi Torget", "Tradera"), names(registry.select(null, List.of())));
    }

    @Test
    void includeFollowsRequestOrderAndAddsEachProviderOnce() {
        List<Provider> selected = registry.select(List.of("tradera", "facebook", "Tradera", "unknown"), List.of());

        assertEquals(List.of("Tradera", "Facebook Marketplace"), names(selected));
    }

    @Test
    void excludeRemovesMatchedProviders() {
        List<Provider> selected = registry.select(List.of(), List.of("hifi", "blocket", "nope"));

        assertEquals(List.of("Facebook Marketplace", "Tradera"), names(selected));
    }

    @Test
    void includeAndExcludeTogetherAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.select(List.of("blocket"), List.of("tradera")));
    }

    @Test
    void duplicateNamesAreRegisteredOnce() {
        ProviderRegistry withDuplicates = new ProviderRegistry(List.of(
            StubProvider.returning("Blocket"),
            StubProvider.returning("blocket")
        ));

        assertThat(withDuplicates.names()).containsExactly("Blocket");
    }

    private List<String> names(List<Provider> providers) {
        return providers.stream().map(Provider::name).toList();
    }
}
