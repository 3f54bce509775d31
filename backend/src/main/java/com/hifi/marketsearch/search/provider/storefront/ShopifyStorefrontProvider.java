package com.hifi.marketsearch.search.provider.storefront;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hifi.marketsearch.search.model.Listing;
import com.hifi.marketsearch.search.provider.Provider;
import com.hifi.marketsearch.search.provider.ProviderFetchException;
import com.hifi.marketsearch.search.util.FaultClassifier;
import com.hifi.marketsearch.search.util.PriceParser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Shopify collections expose every product through {@code products.json}; there is no
 * search parameter, so titles are matched locally.
 */
public class ShopifyStorefrontProvider implements Provider {
    private static final int PAGE_LIMIT = 250;

    private final String name;
    private final String baseUrl;
    private final String collectionPath;
    private final StorefrontSearchSupport support;
    private final ObjectMapper objectMapper;

    public ShopifyStorefrontProvider(
        String name,
        String baseUrl,
        String collectionPath,
        StorefrontSearchSupport support,
        ObjectMapper objectMapper
    ) {
        this.name = name;
        this.baseUrl = StorefrontSearchSupport.trimTrailingSlash(baseUrl);
        this.collectionPath = StorefrontSearchSupport.trimTrailingSlash(collectionPath);
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
        String url = baseUrl + collectionPath + "/products.json?page=" + page + "&limit=" + PAGE_LIMIT;
        String body = support.fetchBody(url, "application/json,*/*;q=0.8");
        JsonNode products = readTree(body).path("products");
        if (!products.isArray() || products.isEmpty()) {
            return StorefrontPage.end();
        }
        List<Listing> listings = new ArrayList<>();
        for (JsonNode product : products) {
            String title = product.path("title").asText("");
            if (!StorefrontSearchSupport.matchesQuery(query, title)) {
                continue;
            }
            listings.add(toListing(product, title));
        }
        return StorefrontPage.of(listings, products.size());
    }

    private Listing toListing(JsonNode product, String title) {
        JsonNode variants = product.path("variants");
        BigDecimal price = null;
        if (variants.isArray() && !variants.isEmpty()) {
            price = PriceParser.parse(variants.get(0).path("price").asText(null)).orElse(null);
        }
        String handle = product.path("handle").asText("");
        JsonNode image = product.path("image");
        return new Listing(
            title,
            StorefrontSearchSupport.htmlToText(product.path("body_html").asText(null)),
            price,
            handle.isBlank() ? null : baseUrl + "/products/" + handle,
            image.isObject() ? image.path("src").asText(null) : null,
            product.path("published_at").asText(null),
            null,
            name,
            Map.of("source", "shopify", "product_id", product.path("id").asText(""))
        );
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderFetchException(FaultClassifier.PARSING_FAILED, name + ": invalid products.json payload", e);
        }
    }
}
