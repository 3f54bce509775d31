package com.hifi.marketsearch.search.service;

import com.hifi.marketsearch.config.SearchProperties;
import com.hifi.marketsearch.search.model.RankedListing;
import com.hifi.marketsearch.search.model.SearchRequest;
import com.hifi.marketsearch.search.model.SearchTermResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

@Component
public class SearchCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SearchCliRunner.class);

    private final SearchProperties properties;
    private final MarketplaceSearchService searchService;
    private final ProviderShutdownService shutdownService;
    private final ConfigurableApplicationContext applicationContext;

    public SearchCliRunner(
        SearchProperties properties,
        MarketplaceSearchService searchService,
        ProviderShutdownService shutdownService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.searchService = searchService;
        this.shutdownService = shutdownService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        SearchProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        int exitCode = 0;
        try {
            SearchRequest request = new SearchRequest(
                split(cli.getTerms()),
                cli.getDays() > 0 ? cli.getDays() : null,
                split(cli.getInclude()),
                split(cli.getExclude()),
                cli.getSort(),
                null,
                null
            );
            List<SearchTermResult> results = searchService.search(request);
            for (SearchTermResult result : results) {
                log.info("Results for '{}' (variants {}, sort {})", result.term(), result.variants(), result.sort());
                for (RankedListing ranked : result.listings()) {
                    log.info(
                        "[{}] {} | {} | {} | {}",
                        ranked.normalizedDate() == null ? "----------" : ranked.normalizedDate(),
                        ranked.listing().sourceLabel() == null ? ranked.displaySource() : ranked.listing().sourceLabel(),
                        ranked.listing().title(),
                        formatPrice(ranked.listing().price()),
                        ranked.listing().url() == null ? "" : ranked.listing().url()
                    );
                }
                log.info("Total matches for '{}': {}", result.term(), result.totalMatches());
            }
        } catch (IllegalArgumentException e) {
            log.error("Invalid search: {}", e.getMessage());
            exitCode = 2;
        } catch (SearchInterruptedException e) {
            log.warn("Search interrupted");
            exitCode = 130;
        } finally {
            shutdownService.releaseAll();
        }

        if (cli.isExitAfterRun()) {
            int code = exitCode;
            int status = SpringApplication.exit(applicationContext, () -> code);
            System.exit(status);
        }
    }

    private List<String> split(String value) {
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
    }

    private String formatPrice(BigDecimal price) {
        return price == null ? "n/a" : price.stripTrailingZeros().toPlainString() + " kr";
    }
}
