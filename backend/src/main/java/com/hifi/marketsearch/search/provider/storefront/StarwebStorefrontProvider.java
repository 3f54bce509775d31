package com.hifi.marketsearch.search.provider.storefront;

import com.hifi.marketsearch.search.model.Listing;
import com.hifi.marketsearch.search.provider.Provider;
import com.hifi.marketsearch.search.util.PriceParser;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class StarwebStorefrontProvider implements Provider {
    private final String name;
    private final String baseUrl;
    private final StorefrontSearchSupport support;

    public StarwebStorefrontProvider(String name, String baseUrl, StorefrontSearchSupport support) {
        this.name = name;
        this.baseUrl = StorefrontSearchSupport.trimTrailingSlash(baseUrl);
        this.support = support;
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
        String url = baseUrl + "/search?q=" + StorefrontSearchSupport.encode(query == null ? "" : query.trim())
            + "&page=" + page;
        String html = support.fetchBody(url, "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8");
        Document document = Jsoup.parse(html, baseUrl);
        Elements items = document.select("ul.products li.gallery-item");
        if (items.isEmpty()) {
            return StorefrontPage.end();
        }
        List<Listing> listings = new ArrayList<>();
        for (Element item : items) {
            Listing listing = parseItem(item);
            if (listing == null || !StorefrontSearchSupport.matchesQuery(query, listing.title())) {
                continue;
            }
            listings.add(listing);
        }
        return StorefrontPage.of(listings, items.size());
    }

    private Listing parseItem(Element item) {
        Element link = item.selectFirst("a.gallery-info-link");
        if (link == null) {
            return null;
        }
        Element titleTag = item.selectFirst(".description h3");
        String title = titleTag != null ? titleTag.text().trim() : link.attr("title").trim();
        if (title.isEmpty()) {
            return null;
        }
        Element priceTag = item.selectFirst(".product-price .amount");
        Element skuTag = item.selectFirst(".product-sku");
        Element status = item.selectFirst(".stock-status");
        Element image = item.selectFirst("img");
        String imageUrl = null;
        if (image != null) {
            imageUrl = image.hasAttr("data-src") ? image.absUrl("data-src") : image.absUrl("src");
            if (imageUrl.isBlank()) {
                imageUrl = null;
            }
        }
        return new Listing(
            title,
            textOrNull(skuTag),
            priceTag == null ? null : PriceParser.parse(priceTag.text()).orElse(null),
            StorefrontSearchSupport.absoluteUrl(baseUrl, link.attr("href")),
            imageUrl,
            null,
            textOrNull(status),
            name,
            Map.of("source", "starweb")
        );
    }

    private String textOrNull(Element element) {
        if (element == null) {
            return null;
        }
        String text = element.text().trim();
        return text.isEmpty() ? null : text;
    }
}
