package com.hifi.marketsearch.search.service;

import com.hifi.marketsearch.search.model.AggregatedResults;
import com.hifi.marketsearch.search.model.Listing;
import com.hifi.marketsearch.search.model.ProviderOutcome;
import com.hifi.marketsearch.search.model.ProviderResultSet;
import com.hifi.marketsearch.search.provider.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dispatches each query variant in turn and merges the results. A listing is kept the
 * first time its signature is seen within one call; later copies, from the same or another
 * provider, are dropped.
 */
@Service
public class SearchAggregationService {
    private static final Logger log = LoggerFactory.getLogger(SearchAggregationService.class);

    private final SearchOrchestratorService orchestratorService;

    public SearchAggregationService(SearchOrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    public AggregatedResults aggregate(List<String> variants, List<Provider> providers) {
        return aggregate(variants, providers, null, null);
    }

    public AggregatedResults aggregate(
        List<String> variants,
        List<Provider> providers,
        BigDecimal minPrice,
        BigDecimal maxPrice
    ) {
        List<String> queries = variants == null ? List.of() : variants;
        List<Provider> targets = providers == null ? List.of() : providers;

        Map<String, List<Listing>> merged = new LinkedHashMap<>();
        for (Provider provider : targets) {
            merged.put(provider.name(), new ArrayList<>());
        }
        Set<String> seenSignatures = new HashSet<>();
        List<ProviderOutcome> outcomes = new ArrayList<>();
        int duplicates = 0;

        for (String variant : queries) {
            ProviderResultSet resultSet = orchestratorService.dispatch(variant, targets, minPrice, maxPrice);
            outcomes.addAll(resultSet.outcomes());
            for (Map.Entry<String, List<Listing>> entry : resultSet.listingsByProvider().entrySet()) {
                List<Listing> bucket = merged.computeIfAbsent(entry.getKey(), ignored -> new ArrayList<>());
                for (Listing listing : entry.getValue()) {
                    if (seenSignatures.add(listing.signature())) {
                        bucket.add(listing);
                    } else {
                        duplicates++;
                    }
                }
            }
        }

        AggregatedResults results = new AggregatedResults(queries, merged, outcomes);
        log.debug(
            "Aggregated {} variants into {} listings ({} duplicates dropped)",
            queries.size(),
            results.totalListings(),
            duplicates
        );
        return results;
    }
}
