package com.hifi.marketsearch.search.provider.storefront;

import com.hifi.marketsearch.search.http.StorefrontHttpClient;
import com.hifi.marketsearch.search.model.HttpFetchResult;
import com.hifi.marketsearch.search.model.Listing;
import com.hifi.marketsearch.search.provider.ProviderFetchException;
import com.hifi.marketsearch.search.util.FaultClassifier;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * Paging, filtering and fetching shared by the storefront providers.
 */
public class StorefrontSearchSupport {
    private static final Logger log = LoggerFactory.getLogger(StorefrontSearchSupport.class);

    private final String storefrontName;
    private final int maxPages;
    private final StorefrontHttpClient httpClient;
    private final ExecutorService executor;

    public StorefrontSearchSupport(
        String storefrontName,
        int maxPages,
        StorefrontHttpClient httpClient,
        ExecutorService executor
    ) {
        this.storefrontName = storefrontName;
        this.maxPages = Math.max(1, maxPages);
        this.httpClient = httpClient;
        this.executor = executor;
    }

    public int maxPages() {
        return maxPages;
    }

    public CompletableFuture<List<Listing>> supplyAsync(Supplier<List<Listing>> work) {
        return CompletableFuture.supplyAsync(work, executor);
    }

    /**
     * Walks pages 1..maxPages until a page comes back empty or marked last. Listings outside
     * the inclusive price bounds are dropped, except those without a price. A listing seen
     * earlier in the same search is skipped.
     */
    public List<Listing> collectPages(IntFunction<StorefrontPage> pageFetcher, BigDecimal minPrice, BigDecimal maxPrice) {
        List<Listing> results = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int page = 1; page <= maxPages; page++) {
            StorefrontPage fetched = pageFetcher.apply(page);
            if (fetched == null || fetched.itemCount() == 0) {
                break;
            }
            for (Listing listing : fetched.listings()) {
                if (!withinPrice(listing.price(), minPrice, maxPrice)) {
                    continue;
                }
                if (!seen.add(listing.signature())) {
                    continue;
                }
                results.add(listing);
            }
            if (fetched.last()) {
                break;
            }
        }
        log.debug("{} collected {} listings", storefrontName, results.size());
        return results;
    }

    /**
     * GETs {@code url}. Transport failures raise {@link ProviderFetchException}; HTTP error
     * statuses are returned for the caller to inspect.
     */
    public HttpFetchResult fetch(String url, String acceptHeader) {
        HttpFetchResult result = httpClient.get(url, acceptHeader);
        if (result.errorCode() != null) {
            throw new ProviderFetchException(
                FaultClassifier.fromErrorCode(result.errorCode(), result.errorMessage()),
                storefrontName + ": " + result.errorCode() + " fetching " + url
                    + (result.errorMessage() == null ? "" : " (" + result.errorMessage() + ")")
            );
        }
        return result;
    }

    public String requireBody(HttpFetchResult result) {
        if (!result.isSuccessful()) {
            throw new ProviderFetchException(
                FaultClassifier.fromHttpStatus(result.statusCode()),
                storefrontName + ": HTTP " + result.statusCode() + " fetching " + result.requestedUrl()
            );
        }
        return result.body() == null ? "" : result.body();
    }

    public String fetchBody(String url, String acceptHeader) {
        return requireBody(fetch(url, acceptHeader));
    }

    public static boolean withinPrice(BigDecimal price, BigDecimal minPrice, BigDecimal maxPrice) {
        if (price == null) {
            return true;
        }
        if (minPrice != null && price.compareTo(minPrice) < 0) {
            return false;
        }
        return maxPrice == null || price.compareTo(maxPrice) <= 0;
    }

    /**
     * True when the lower-cased query occurs in any of {@code texts}. A blank query
     * matches nothing.
     */
    public static boolean matchesQuery(String query, String... texts) {
        String needle = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        if (needle.isEmpty()) {
            return false;
        }
        for (String text : texts) {
            if (text != null && text.toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    public static String htmlToText(String html) {
        if (html == null || html.isBlank()) {
            return null;
        }
        String text = Jsoup.parse(html).text().trim();
        return text.isEmpty() ? null : text;
    }

    public static String absoluteUrl(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String value = href.trim();
        if (value.startsWith("http://") || value.startsWith("https://")) {
            return value;
        }
        if (value.startsWith("//")) {
            return "https:" + value;
        }
        String base = trimTrailingSlash(baseUrl);
        return value.startsWith("/") ? base + value : base + "/" + value;
    }

    public static String trimTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
