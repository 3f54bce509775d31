package com.hifi.marketsearch.search.provider.storefront;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hifi.marketsearch.search.model.Listing;
import com.hifi.marketsearch.search.provider.Provider;
import com.hifi.marketsearch.search.provider.ProviderFetchException;
import com.hifi.marketsearch.search.util.FaultClassifier;
import com.hifi.marketsearch.search.util.PriceParser;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Ashop category pages embed their product list as JSON in a {@code :product-data}
 * attribute. The category is browsed page by page and products are matched locally.
 */
public class AshopStorefrontProvider implements Provider {
    private static final String PRODUCT_DATA_ATTRIBUTE = ":product-data";

    private final String name;
    private final String baseUrl;
    private final String categoryUrl;
    private final StorefrontSearchSupport support;
    private final ObjectMapper objectMapper;

    public AshopStorefrontProvider(
        String name,
        String baseUrl,
        String categoryPath,
        StorefrontSearchSupport support,
        ObjectMapper objectMapper
    ) {
        this.name = name;
        this.baseUrl = StorefrontSearchSupport.trimTrailingSlash(baseUrl);
        this.categoryUrl = StorefrontSearchSupport.trimTrailingSlash(
            StorefrontSearchSupport.absoluteUrl(this.baseUrl, categoryPath == null || categoryPath.isBlank() ? "/" : categoryPath)
        );
        this.support = support;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletableFuture<List<Listing>> search(String query, BigDecimal minPrice, BigDecimal maxPrice) {
        if (query == null || query.isBlank()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return support.supplyAsync(
            () -> support.collectPages(page -> fetchPage(query, page), minPrice, maxPrice)
        );
    }

    private StorefrontPage fetchPage(String query, int page) {
        String url = categoryUrl;
        if (page > 1) {
            url = url + (url.contains("?") ? "&" : "?") + "page=" + page;
        }
        String html = support.fetchBody(url, "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8");
        Document document = Jsoup.parse(html, baseUrl);
        Element node = document.getElementsByAttribute(PRODUCT_DATA_ATTRIBUTE).first();
        if (node == null) {
            return StorefrontPage.end();
        }
        JsonNode data = readTree(node.attr(PRODUCT_DATA_ATTRIBUTE));
        JsonNode products = data.path("products");
        if (!products.isArray() || products.isEmpty()) {
            return StorefrontPage.end();
        }

        List<Listing> listings = new ArrayList<>();
        for (JsonNode product : products) {
            String productName = text(product, "product_name");
            String productTitle = text(product, "product_title");
            String infoPuff = text(product, "product_info_puff");
            if (!StorefrontSearchSupport.matchesQuery(query, productName, productTitle, infoPuff)) {
                continue;
            }
            Listing listing = toListing(product, productName, productTitle, infoPuff);
            if (listing != null) {
                listings.add(listing);
            }
        }

        int total = data.path("total_amount_of_products").asInt(0);
        int perPage = data.path("per_page").asInt(products.size());
        boolean last = total > 0 && perPage > 0 && page >= (total + perPage - 1) / perPage;
        return new StorefrontPage(listings, products.size(), last);
    }

    private Listing toListing(JsonNode product, String productName, String productTitle, String infoPuff) {
        String title = productName != null ? productName : productTitle;
        if (title == null) {
            return null;
        }
        String priceText = text(product, "product_display_price");
        if (priceText == null) {
            priceText = text(product, "product_price");
        }
        String url = text(product, "product_url");
        if (url == null) {
            url = StorefrontSearchSupport.absoluteUrl(baseUrl, text(product, "product_link"));
        }
        List<String> tags = new ArrayList<>();
        for (JsonNode tag : product.path("tags")) {
            String tagName = text(tag, "product_tag_name");
            if (tagName != null) {
                tags.add(tagName);
            }
        }
        return new Listing(
            title,
            infoPuff != null ? infoPuff : text(product, "product_status_name"),
            priceText == null ? null : PriceParser.parse(priceText).orElse(null),
            url,
            text(product, "product_puff_image"),
            null,
            tags.isEmpty() ? null : String.join(", ", tags),
            name,
            Map.of("source", "ashop", "product_id", product.path("product_id").asText(""))
        );
    }

    private JsonNode readTree(String payload) {
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ProviderFetchException(FaultClassifier.PARSING_FAILED, name + ": invalid product data", e);
        }
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
