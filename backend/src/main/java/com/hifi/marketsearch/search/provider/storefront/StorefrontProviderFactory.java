package com.hifi.marketsearch.search.provider.storefront;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hifi.marketsearch.config.SearchProperties;
import com.hifi.marketsearch.search.http.StorefrontHttpClient;
import com.hifi.marketsearch.search.provider.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Builds providers for the storefronts listed under {@code search.storefronts}.
 */
@Component
public class StorefrontProviderFactory {
    private static final Logger log = LoggerFactory.getLogger(StorefrontProviderFactory.class);

    private final StorefrontHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ExecutorService providerExecutor;

    public StorefrontProviderFactory(
        StorefrontHttpClient httpClient,
        ObjectMapper objectMapper,
        @Qualifier("providerExecutor") ExecutorService providerExecutor
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.providerExecutor = providerExecutor;
    }

    public List<Provider> createAll(List<SearchProperties.Storefront> storefronts) {
        List<Provider> providers = new ArrayList<>();
        if (storefronts == null) {
            return providers;
        }
        for (SearchProperties.Storefront storefront : storefronts) {
            if (storefront == null || !storefront.isEnabled()) {
                continue;
            }
            if (isBlank(storefront.getName()) || isBlank(storefront.getBaseUrl()) || storefront.getPlatform() == null) {
                log.warn("Skipping storefront with missing name, base-url or platform: {}", storefront.getName());
                continue;
            }
            providers.add(create(storefront));
        }
        return providers;
    }

    public Provider create(SearchProperties.Storefront storefront) {
        StorefrontSearchSupport support = new StorefrontSearchSupport(
            storefront.getName(),
            storefront.getMaxPages(),
            httpClient,
            providerExecutor
        );
        return switch (storefront.getPlatform()) {
            case SHOPIFY -> new ShopifyStorefrontProvider(
                storefront.getName(),
                storefront.getBaseUrl(),
                storefront.getPath(),
                support,
                objectMapper
            );
            case WOOCOMMERCE -> new WooCommerceStorefrontProvider(
                storefront.getName(),
                storefront.getBaseUrl(),
                support,
                objectMapper
            );
            case STARWEB -> new StarwebStorefrontProvider(storefront.getName(), storefront.getBaseUrl(), support);
            case ASHOP -> new AshopStorefrontProvider(
                storefront.getName(),
                storefront.getBaseUrl(),
                storefront.getPath(),
                support,
                objectMapper
            );
        };
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
