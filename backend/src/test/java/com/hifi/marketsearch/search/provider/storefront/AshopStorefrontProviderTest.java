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
import static org.junit.jupiter.api.Assertions.assertTrue;

class AshopStorefrontProviderTest {
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
    void readsEmbeddedProductDataUntilTheLastPage() throws Exception {
        testSupport.server.enqueue(html(page(
            "{&quot;product_id&quot;: 1, &quot;product_name&quot;: &quot;Linn LP12&quot;,"
                + " &quot;product_display_price&quot;: &quot;29 900 kr&quot;,"
                + " &quot;product_info_puff&quot;: &quot;Begagnad vinylspelare&quot;,"
                + " &quot;product_link&quot;: &quot;/produkt/linn-lp12&quot;,"
                + " &quot;tags&quot;: [{&quot;product_tag_name&quot;: &quot;Butik&quot;}]},"
                + "{&quot;product_id&quot;: 2, &quot;product_name&quot;: &quot;Naim Nait 5&quot;,"
                + " &quot;product_price&quot;: 8900}",
            3,
            2
        )));
        testSupport.server.enqueue(html(page(
            "{&quot;product_id&quot;: 3, &quot;product_title&quot;: &quot;Rega Planar 6&quot;,"
                + " &quot;product_info_puff&quot;: &quot;Vinylspelare med Ania&quot;,"
                + " &quot;product_url&quot;: &quot;https://shop.example/rega-planar-6&quot;}",
            3,
            2
        )));
        AshopStorefrontProvider provider = new AshopStorefrontProvider(
            "Reference Audio",
            testSupport.baseUrl(),
            "/kategori/935/begagnat",
            testSupport.support("Reference Audio", 10),
            testSupport.objectMapper
        );

        List<Listing> listings = provider.search("vinylspelare", null, null).join();

        assertThat(listings).extracting(Listing::title).containsExactly("Linn LP12", "Rega Planar 6");
        Listing linn = listings.get(0);
        assertEquals(new BigDecimal("29900"), linn.price());
        assertEquals("Begagnad vinylspelare", linn.description());
        assertEquals("Butik", linn.location());
        assertThat(linn.url()).endsWith("/produkt/linn-lp12");
        assertEquals("https://shop.example/rega-planar-6", listings.get(1).url());

        RecordedRequest first = testSupport.server.takeRequest();
        assertEquals("/kategori/935/begagnat", first.getPath());
        RecordedRequest second = testSupport.server.takeRequest();
        assertEquals("/kategori/935/begagnat?page=2", second.getPath());
        assertEquals(2, testSupport.server.getRequestCount());
    }

    @Test
    void blankQueryMakesNoRequest() {
        AshopStorefrontProvider provider = new AshopStorefrontProvider(
            "Ljudmakarn",
            testSupport.baseUrl(),
            "/kategori/107/fyndhornan",
            testSupport.support("Ljudmakarn", 10),
            testSupport.objectMapper
        );

        assertTrue(provider.search("  ", null, null).join().isEmpty());
        assertEquals(0, testSupport.server.getRequestCount());
    }

    private String page(String productsJson, int total, int perPage) {
        return "<html><body><div id=\"app\"><product-list :product-data=\"{&quot;products&quot;: ["
            + productsJson
            + "], &quot;total_amount_of_products&quot;: " + total
            + ", &quot;per_page&quot;: " + perPage + "}\"></product-list></div></body></html>";
    }

    private MockResponse html(String body) {
        return new MockResponse().setHeader("Content-Type", "text/html; charset=utf-8").setBody(body);
    }
}
