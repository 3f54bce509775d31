package com.hifi.marketsearch.search.provider.storefront;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hifi.marketsearch.search.model.HttpFetchResult;
import com.hifi.marketsearch.search.model.Listing;
import com.hifi.marketsearch.search.provider.Provider;
import com.hifi.marketsearch.search.provider.ProviderFetchException;
import com.hifi.marketsearch.search.util.FaultClassifier;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Public WooCommerce Store API. Searching happens server side; asking for a page past the
 * end answers HTTP 400.
 */
public class WooCommerceStorefrontProvider implements Provider {
    private static final int PER_PAGE = 20;

    private final String name;
    private final String apiEndpoint;
    private final StorefrontSearchSupport support;
    private final ObjectMapper objectMapper;

    public WooCommerceStorefrontProvider(
        String name,
        String baseUrl,
        StorefrontSearchSupport support,
        ObjectMapper objectMapper
    ) {
        this.name = name;
        this.apiEndpoint = StorefrontSearchSupport.trimTrailingSlash(baseUrl) + "/wp-json/wc/store/products";
        this.support = support;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletableFuture<List<Listing>> search(String query, BigDecimal minPrice, BigDecimal maxPrice) {
        return support.supplyAsync(
            () -> support.collectPages(page -> fetchPage(query, page), minPrice, maxPrice)
        );
    }

    private StorefrontPage fetchPage(String query, int page) {
        String url = apiEndpoint
            + "?search=" + StorefrontSearchSupport.encode(query == null ? "" : query.trim())
            + "&page=" + page
            + "&per_page=" + PER_PAGE;
        HttpFetchResult result = support.fetch(url, "application/json,*/*;q=0.8");
        if (result.statusCode() == 400) {
            return StorefrontPage.end();
        }
        JsonNode products = readTree(support.requireBody(result));
        if (!products.isArray() || products.isEmpty()) {
            return StorefrontPage.end();
        }
        List<Listing> listings = new ArrayList<>();
        for (JsonNode product : products) {
            String title = product.path("name").asText("");
            if (title.isBlank()) {
                continue;
            }
            listings.add(toListing(product, title));
        }
        return StorefrontPage.of(listings, products.size());
    }

    private Listing toListing(JsonNode product, String title) {
        JsonNode images = product.path("images");
        String imageUrl = images.isArray() && !images.isEmpty() ? images.get(0).path("src").asText(null) : null;
        return new Listing(
            title,
            StorefrontSearchSupport.htmlToText(product.path("short_description").asText(null)),
            priceOf(product.path("prices")),
            product.path("permalink").asText(null),
            imageUrl,
            product.path("date_created").asText(null),
            null,
            name,
            Map.of("source", "woocommerce", "product_id", product.path("id").asText(""))
        );
    }

    /**
     * Store API prices are integers in the currency's minor unit.
     */
    static BigDecimal priceOf(JsonNode prices) {
        String raw = prices.path("price").asText("");
        if (raw.isEmpty() || !raw.chars().allMatch(Character::isDigit)) {
            return null;
        }
        int minorUnit = prices.path("currency_minor_unit").asInt(2);
        return new BigDecimal(raw).movePointLeft(Math.max(0, minorUnit));
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderFetchException(FaultClassifier.PARSING_FAILED, name + ": invalid store API payload", e);
        }
    }
}
