package com.hifi.marketsearch.search.provider;

import com.hifi.marketsearch.search.model.Listing;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

public class StubProvider implements Provider {
    private final String name;
    private final Function<String, CompletableFuture<List<Listing>>> behavior;
    private final AtomicInteger searchCalls = new AtomicInteger();
    private final AtomicInteger releaseCalls = new AtomicInteger();
    private final AtomicReference<CompletableFuture<List<Listing>>> lastFuture = new AtomicReference<>();
    private Supplier<CompletableFuture<Void>> releaseBehavior = () -> CompletableFuture.completedFuture(null);

    public StubProvider(String name, Function<String, CompletableFuture<List<Listing>>> behavior) {
        this.name = name;
        this.behavior = behavior;
    }

    public static StubProvider returning(String name, Listing... listings) {
        return new StubProvider(name, query -> CompletableFuture.completedFuture(List.of(listings)));
    }

    public static StubProvider byQuery(String name, Map<String, List<Listing>> listingsByQuery) {
        return new StubProvider(
            name,
            query -> CompletableFuture.completedFuture(listingsByQuery.getOrDefault(query, List.of()))
        );
    }

    public static StubProvider never(String name) {
        return new StubProvider(name, query -> new CompletableFuture<>());
    }

    public static StubProvider failing(String name, RuntimeException error) {
        return new StubProvider(name, query -> CompletableFuture.failedFuture(error));
    }

    public static StubProvider throwing(String name, RuntimeException error) {
        return new StubProvider(name, query -> {
            throw error;
        });
    }

    public StubProvider withRelease(Supplier<CompletableFuture<Void>> releaseBehavior) {
        this.releaseBehavior = releaseBehavior;
        return this;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletableFuture<List<Listing>> search(String query, BigDecimal minPrice, BigDecimal maxPrice) {
        searchCalls.incrementAndGet();
        CompletableFuture<List<Listing>> future = behavior.apply(query);
        lastFuture.set(future);
        return future;
    }

    @Override
    public CompletableFuture<Void> release() {
        releaseCalls.incrementAndGet();
        return releaseBehavior.get();
    }

    public int searchCalls() {
        return searchCalls.get();
    }

    public int releaseCalls() {
        return releaseCalls.get();
    }

    public CompletableFuture<List<Listing>> lastFuture() {
        return lastFuture.get();
    }

    public static Listing listing(String title, String url, String price, String postedDate, String sourceLabel) {
        return new Listing(
            title,
            null,
            price == null ? null : new BigDecimal(price),
            url,
            null,
            postedDate,
            null,
            sourceLabel,
            Map.of()
        );
    }
}
