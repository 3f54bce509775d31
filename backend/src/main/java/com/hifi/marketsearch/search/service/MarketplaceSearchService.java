package com.hifi.marketsearch.search.service;

import com.hifi.marketsearch.config.SearchProperties;
import com.hifi.marketsearch.search.model.AggregatedResults;
import com.hifi.marketsearch.search.model.Listing;
import com.hifi.marketsearch.search.model.RankedListing;
import com.hifi.marketsearch.search.model.SearchRequest;
import com.hifi.marketsearch.search.model.SearchTermResult;
import com.hifi.marketsearch.search.model.SortKey;
import com.hifi.marketsearch.search.provider.Provider;
import com.hifi.marketsearch.search.provider.ProviderRegistry;
import com.hifi.marketsearch.search.query.QueryExpander;
import com.hifi.marketsearch.search.ranking.ListingSorter;
import com.hifi.marketsearch.search.ranking.RecencyFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Full search for a user request: provider selection, then per term expansion,
 * aggregation, recency filtering and sorting.
 */
@Service
public class MarketplaceSearchService {
    private static final Logger log = LoggerFactory.getLogger(MarketplaceSearchService.class);

    private final ProviderRegistry providerRegistry;
    private final QueryExpander queryExpander;
    private final SearchAggregationService aggregationService;
    private final RecencyFilter recencyFilter;
    private final ListingSorter listingSorter;
    private final SearchProperties properties;

    public MarketplaceSearchService(
        ProviderRegistry providerRegistry,
        QueryExpander queryExpander,
        SearchAggregationService aggregationService,
        RecencyFilter recencyFilter,
        ListingSorter listingSorter,
        SearchProperties properties
    ) {
        this.providerRegistry = providerRegistry;
        this.queryExpander = queryExpander;
        this.aggregationService = aggregationService;
        this.recencyFilter = recencyFilter;
        this.listingSorter = listingSorter;
        this.properties = properties;
    }

    public List<SearchTermResult> search(SearchRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("search request is required");
        }
        List<String> terms = request.normalizedTerms();
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("at least one search term is required");
        }
        if (request.minPrice() != null && request.maxPrice() != null
            && request.minPrice().compareTo(request.maxPrice()) > 0) {
            throw new IllegalArgumentException("minPrice must not be greater than maxPrice");
        }
        String sortText = request.sort() == null || request.sort().isBlank() ? properties.getDefaultSort() : request.sort();
        SortKey sortKey = SortKey.fromString(sortText);
        List<Provider> providers = providerRegistry.select(request.normalizedInclude(), request.normalizedExclude());
        if (providers.isEmpty()) {
            log.warn("No providers selected for search");
        }

        int daysBack = request.effectiveDaysBack();
        List<SearchTermResult> results = new ArrayList<>();
        for (String term : terms) {
            List<String> variants = queryExpander.expand(term);
            try {
                results.add(searchTerm(term, variants, providers, request, sortKey, daysBack));
            } catch (SearchInterruptedException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Search for '{}' failed", term, e);
                results.add(new SearchTermResult(
                    term,
                    variants,
                    sortKey.label(),
                    daysBack > 0 ? daysBack : null,
                    0,
                    List.of(),
                    List.of()
                ));
            }
        }
        return results;
    }

    private SearchTermResult searchTerm(
        String term,
        List<String> variants,
        List<Provider> providers,
        SearchRequest request,
        SortKey sortKey,
        int daysBack
    ) {
        log.info("Searching for '{}' across {} providers ({} variants)", term, providers.size(), variants.size());
        AggregatedResults aggregated = aggregationService.aggregate(
            variants,
            providers,
            request.minPrice(),
            request.maxPrice()
        );
        Map<String, List<Listing>> listings = aggregated.listingsByProvider();
        if (daysBack > 0) {
            listings = recencyFilter.filterByDays(listings, daysBack);
        }
        List<RankedListing> ranked = listingSorter.sort(listings, sortKey);
        log.info("Found {} listings for '{}'", ranked.size(), term);
        return new SearchTermResult(
            term,
            aggregated.variants(),
            sortKey.label(),
            daysBack > 0 ? daysBack : null,
            ranked.size(),
            ranked,
            aggregated.outcomes()
        );
    }
}
