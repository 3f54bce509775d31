package com.hifi.marketsearch.search.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One normalized marketplace search result.
 *
 * <p>{@code postedDate} is the raw text the provider showed; it is parsed on demand when
 * filtering or sorting. {@code extra} is opaque provider metadata, except for
 * {@link #SOURCE_SITE_KEY} which names the marketplace a listing was re-surfaced from.
 */
public record Listing(
    String title,
    String description,
    BigDecimal price,
    String url,
    String imageUrl,
    String postedDate,
    String location,
    String sourceLabel,
    Map<String, Object> extra
) {
    public static final String SOURCE_SITE_KEY = "source_site";

    public Listing {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("listing title must not be blank");
        }
        title = title.trim();
        extra = extra == null || extra.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    /**
     * Identity used for deduplication: the URL, or {@code title|price|location} when no URL
     * is available.
     */
    public String signature() {
        if (url != null && !url.isBlank()) {
            return url;
        }
        String priceText = price == null ? "null" : price.stripTrailingZeros().toPlainString();
        return title + "|" + priceText + "|" + location;
    }

    public Optional<String> originSite() {
        Object value = extra.get(SOURCE_SITE_KEY);
        if (value == null) {
            return Optional.empty();
        }
        String site = value.toString().trim();
        return site.isEmpty() ? Optional.empty() : Optional.of(site);
    }

    public boolean hasPostedDate() {
        return postedDate != null && !postedDate.isBlank();
    }

    public static String qualifiedSourceLabel(String providerName, String originSite) {
        if (originSite == null || originSite.isBlank() || originSite.equalsIgnoreCase(providerName)) {
            return providerName;
        }
        return providerName + " (" + originSite.trim() + ")";
    }
}
