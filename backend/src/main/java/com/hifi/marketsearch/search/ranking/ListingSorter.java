package com.hifi.marketsearch.search.ranking;

import com.hifi.marketsearch.search.dates.DateNormalizer;
import com.hifi.marketsearch.search.model.Listing;
import com.hifi.marketsearch.search.model.RankedListing;
import com.hifi.marketsearch.search.model.SortKey;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flattens per-provider results into one ordered list. Sorting is stable, so entries that
 * compare equal keep provider order and then provider-local order.
 */
@Component
public class ListingSorter {
    private final DateNormalizer dateNormalizer;
    private final Clock clock;

    public ListingSorter(DateNormalizer dateNormalizer, Clock clock) {
        this.dateNormalizer = dateNormalizer;
        this.clock = clock;
    }

    public List<RankedListing> sort(Map<String, List<Listing>> listingsByProvider, SortKey sortKey) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Entry> entries = new ArrayList<>();
        if (listingsByProvider != null) {
            listingsByProvider.forEach((provider, listings) -> {
                for (Listing listing : listings) {
                    entries.add(toEntry(provider, listing, now));
                }
            });
        }
        entries.sort(comparator(sortKey == null ? SortKey.DATE : sortKey));
        return entries.stream().map(Entry::ranked).toList();
    }

    private Entry toEntry(String provider, Listing listing, LocalDateTime now) {
        LocalDateTime posted = listing.hasPostedDate()
            ? dateNormalizer.normalize(listing.postedDate(), now).orElse(null)
            : null;
        RankedListing ranked = new RankedListing(
            provider,
            listing.originSite().orElse(provider),
            posted == null ? null : posted.toLocalDate().toString(),
            listing
        );
        return new Entry(ranked, posted);
    }

    private Comparator<Entry> comparator(SortKey sortKey) {
        return switch (sortKey) {
            case DATE -> Comparator
                .comparing(Entry::posted, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
                .thenComparing((Entry entry) -> lower(entry.ranked().displaySource()));
            case SITE -> Comparator.comparing((Entry entry) -> lower(entry.ranked().providerName()));
            case PRICE -> Comparator.comparing(
                (Entry entry) -> entry.ranked().listing().price(),
                Comparator.nullsLast(Comparator.<BigDecimal>naturalOrder())
            );
        };
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private record Entry(RankedListing ranked, LocalDateTime posted) {
    }
}
