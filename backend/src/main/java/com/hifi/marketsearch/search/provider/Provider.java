package com.hifi.marketsearch.search.provider;

import com.hifi.marketsearch.search.model.Listing;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A marketplace that can be searched. Implementations report "no results" as an empty
 * list; a failed future means the marketplace could not be searched at all.
 */
public interface Provider {

    /**
     * Unique display name, also the key used for include/exclude selection.
     */
    String name();

    /**
     * Starts a search. Price bounds are inclusive and may be {@code null}.
     */
    CompletableFuture<List<Listing>> search(String query, BigDecimal minPrice, BigDecimal maxPrice);

    /**
     * Releases held resources. Must be safe to call more than once.
     */
    default CompletableFuture<Void> release() {
        return CompletableFuture.completedFuture(null);
    }
}
