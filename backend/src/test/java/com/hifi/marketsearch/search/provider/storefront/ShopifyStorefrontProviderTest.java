package com.hifi.marketsearch.search.provider.storefront;

import com.hifi.marketsearch.search.model.Listing;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ShopifyStorefrontProviderTest {
    private static final String PAGE_ONE = """
        {"products": [
          {"id": 1, "title": "Marantz 2226B", "handle": "marantz-2226b",
           "body_html": "<p>Fint <b>skick</b></p>", "published_at": "2026-10-10T10:00:00+02:00",
           "image": {"src": "https://cdn.shopify.com/marantz.jpg"},
           "variants": [{"price": "4995.00"}]},
          {"id": 2, "title": "Denon DP-300F", "handle": "denon-dp-300f", "variants": [{"price": "2500.00"}]},
          {"id": 3, "title": "Marantz CD-63", "handle": "marantz-cd-63", "variants": []}
        ]}
        """;

    private StorefrontTestSupport testSupport;

    @BeforeEach
    void setUp() throws Exception {
        testSupport = new StorefrontTestSupport();
    }

    @AfterEach
    void tearDown() throws Exception {
        testSupport.close();
    }

    @Test
    void matchesTitlesLocallyAndStopsOnEmptyPage() throws Exception {
        testSupport.server.enqueue(json(PAGE_ONE));
        testSupport.server.enqueue(json("{\"products\": []}"));
        ShopifyStorefrontProvider provider = provider(5);

        List<Listing> listings = provider.search("marantz", null, null).join();

        assertThat(listings).extracting(Listing::title).containsExactly("Marantz 2226B", "Marantz CD-63");
        Listing first = listings.get(0);
        assertEquals(new BigDecimal("4995.00"), first.price());
        assertEquals("Fint skick", first.description());
        assertEquals("2026-10-10T10:00:00+02:00", first.postedDate());
        assertThat(first.url()).endsWith("/products/marantz-2226b");
        assertEquals("https://cdn.shopify.com/marantz.jpg", first.imageUrl());
        assertEquals("Lasses HiFi", first.sourceLabel());
        assertNull(listings.get(1).price());

        RecordedRequest request = testSupport.server.takeRequest();
        assertEquals("/collections/erbjudande/products.json?page=1&limit=250", request.getPath());
        assertEquals(2, testSupport.server.getRequestCount());
    }

    @Test
    void priceBoundsAreInclusiveAndKeepUnpricedListings() {
        testSupport.server.enqueue(json(PAGE_ONE));
        testSupport.server.enqueue(json("{\"products\": []}"));
        ShopifyStorefrontProvider provider = provider(5);

        List<Listing> listings = provider.search("marantz", new BigDecimal("1000"), new BigDecimal("4995")).join();

        assertThat(listings).extracting(Listing::title).containsExactly("Marantz 2226B", "Marantz CD-63");
    }

    @Test
    void stopsAtMaxPages() {
        testSupport.server.enqueue(json(PAGE_ONE));
        testSupport.server.enqueue(json(PAGE_ONE));
        ShopifyStorefrontProvider provider = provider(1);

        provider.search("denon", null, null).join();

        assertEquals(1, testSupport.server.getRequestCount());
    }

    private ShopifyStorefrontProvider provider(int maxPages) {
        return new ShopifyStorefrontProvider(
            "Lasses HiFi",
            testSupport.baseUrl(),
            "/collections/erbjudande",
            testSupport.support("Lasses HiFi", maxPages),
            testSupport.objectMapper
        );
    }

    private MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
