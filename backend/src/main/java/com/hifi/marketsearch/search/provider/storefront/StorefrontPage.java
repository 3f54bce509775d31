package com.hifi.marketsearch.search.provider.storefront;

import com.hifi.marketsearch.search.model.Listing;

import java.util.List;

/**
 * One fetched result page. {@code itemCount} counts every product on the page, including
 * ones the provider already dropped as non-matching, so an empty page can be told apart
 * from a page with no hits.
 */
public record StorefrontPage(List<Listing> listings, int itemCount, boolean last) {
    public StorefrontPage {
        listings = listings == null ? List.of() : List.copyOf(listings);
    }

    public static StorefrontPage of(List<Listing> listings, int itemCount) {
        return new StorefrontPage(listings, itemCount, false);
    }

    public static StorefrontPage end() {
        return new StorefrontPage(List.of(), 0, true);
    }
}
