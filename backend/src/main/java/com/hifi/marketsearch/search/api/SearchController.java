package com.hifi.marketsearch.search.api;

import com.hifi.marketsearch.search.model.SearchRequest;
import com.hifi.marketsearch.search.model.SearchTermResult;
import com.hifi.marketsearch.search.provider.ProviderRegistry;
import com.hifi.marketsearch.search.service.MarketplaceSearchService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api")
public class SearchController {
    private final MarketplaceSearchService searchService;
    private final ProviderRegistry providerRegistry;

    public SearchController(MarketplaceSearchService searchService, ProviderRegistry providerRegistry) {
        this.searchService = searchService;
        this.providerRegistry = providerRegistry;
    }

    @GetMapping("/search")
    public List<SearchTermResult> search(
        @RequestParam(name = "q") List<String> terms,
        @RequestParam(name = "days", required = false) Integer days,
        @RequestParam(name = "include", required = false) List<String> include,
        @RequestParam(name = "exclude", required = false) List<String> exclude,
        @RequestParam(name = "sort", required = false) String sort,
        @RequestParam(name = "minPrice", required = false) BigDecimal minPrice,
        @RequestParam(name = "maxPrice", required = false) BigDecimal maxPrice
    ) {
        if (days != null && days < 0) {
            throw new IllegalArgumentException("days must be zero or positive");
        }
        return searchService.search(new SearchRequest(terms, days, include, exclude, sort, minPrice, maxPrice));
    }

    @GetMapping("/providers")
    public List<String> providers() {
        return providerRegistry.names();
    }
}
