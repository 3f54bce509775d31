package com.hifi.marketsearch.search.ranking;

import com.hifi.marketsearch.search.dates.DateNormalizer;
import com.hifi.marketsearch.search.model.Listing;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drops listings posted before a recency window. Listings without a date, or with a date
 * that cannot be read, are kept.
 */
@Component
public class RecencyFilter {
    private final DateNormalizer dateNormalizer;
    private final Clock clock;

    public RecencyFilter(DateNormalizer dateNormalizer, Clock clock) {
        this.dateNormalizer = dateNormalizer;
        this.clock = clock;
    }

    public Map<String, List<Listing>> filterByDays(Map<String, List<Listing>> listingsByProvider, int days) {
        Map<String, List<Listing>> filtered = new LinkedHashMap<>();
        if (listingsByProvider == null) {
            return filtered;
        }
        if (days <= 0) {
            listingsByProvider.forEach((provider, listings) -> filtered.put(provider, List.copyOf(listings)));
            return filtered;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime cutoff = now.minusDays(days);
        listingsByProvider.forEach((provider, listings) -> filtered.put(
            provider,
            listings.stream().filter(listing -> keep(listing, now, cutoff)).toList()
        ));
        return filtered;
    }

    /**
     * Inclusive: a listing posted exactly at the cutoff is inside the window.
     */
    public static boolean isWithinWindow(LocalDateTime posted, LocalDateTime cutoff) {
        return !posted.isBefore(cutoff);
    }

    private boolean keep(Listing listing, LocalDateTime now, LocalDateTime cutoff) {
        if (!listing.hasPostedDate()) {
            return true;
        }
        Optional<LocalDateTime> posted = dateNormalizer.normalize(listing.postedDate(), now);
        return posted.map(value -> isWithinWindow(value, cutoff)).orElse(true);
    }
}
