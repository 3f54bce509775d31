package com.hifi.marketsearch.search.provider.storefront;

public enum StorefrontPlatform {
    SHOPIFY,
    WOOCOMMERCE,
    STARWEB,
    ASHOP
}
