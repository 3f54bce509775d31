package com.hifi.marketsearch.search.provider;

import com.hifi.marketsearch.config.SearchProperties;
import com.hifi.marketsearch.search.provider.storefront.StorefrontProviderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Every provider available for searching, in registration order, plus the include/exclude
 * selection users apply by name.
 */
@Component
public class ProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final List<Provider> providers;

    @Autowired
    public ProviderRegistry(
        ObjectProvider<Provider> providerBeans,
        StorefrontProviderFactory storefrontProviderFactory,
        SearchProperties properties
    ) {
        List<Provider> all = new ArrayList<>();
        providerBeans.orderedStream().forEach(all::add);
        all.addAll(storefrontProviderFactory.createAll(properties.getStorefronts()));
        this.providers = List.copyOf(uniqueByName(all));
        log.info("Registered {} providers: {}", providers.size(), names());
    }

    public ProviderRegistry(List<Provider> providers) {
        this.providers = List.copyOf(uniqueByName(providers == null ? List.of() : providers));
    }

    public List<Provider> all() {
        return providers;
    }

    public List<String> names() {
        return providers.stream().map(Provider::name).toList();
    }

    /**
     * Providers to search. With an include list only the first match of each entry is used,
     * in include order; with an exclude list the first match of each entry is removed.
     * Supplying both is rejected.
     */
    public List<Provider> select(List<String> include, List<String> exclude) {
        List<String> includeNames = include == null ? List.of() : include;
        List<String> excludeNames = exclude == null ? List.of() : exclude;
        if (!includeNames.isEmpty() && !excludeNames.isEmpty()) {
            throw new IllegalArgumentException("include and exclude cannot be combined");
        }

        if (!includeNames.isEmpty()) {
            List<Provider> selected = new ArrayList<>();
            for (String requested : includeNames) {
                Optional<Provider> match = firstMatch(providers, requested);
                if (match.isEmpty()) {
                    warnUnknown(requested);
                    continue;
                }
                if (!selected.contains(match.get())) {
                    selected.add(match.get());
                }
            }
            return List.copyOf(selected);
        }

        List<Provider> remaining = new ArrayList<>(providers);
        for (String requested : excludeNames) {
            Optional<Provider> match = firstMatch(remaining, requested);
            if (match.isEmpty()) {
                warnUnknown(requested);
                continue;
            }
            remaining.remove(match.get());
        }
        return List.copyOf(remaining);
    }

    /**
     * A requested name matches a provider when it equals the provider name or one of its
     * whitespace separated words, ignoring case.
     */
    public static boolean matchesName(String requested, String providerName) {
        if (requested == null || providerName == null) {
            return false;
        }
        String wanted = requested.trim().toLowerCase(Locale.ROOT);
        String actual = providerName.trim().toLowerCase(Locale.ROOT);
        if (wanted.isEmpty()) {
            return false;
        }
        if (wanted.equals(actual)) {
            return true;
        }
        return Arrays.asList(actual.split("\\s+")).contains(wanted);
    }

    private Optional<Provider> firstMatch(List<Provider> candidates, String requested) {
        return candidates.stream()
            .filter(provider -> matchesName(requested, provider.name()))
            .findFirst();
    }

    private void warnUnknown(String requested) {
        log.warn("Unknown provider '{}'. Available providers: {}", requested, String.join(", ", names()));
    }

    private static List<Provider> uniqueByName(List<Provider> candidates) {
        Set<String> seen = new HashSet<>();
        List<Provider> unique = new ArrayList<>();
        for (Provider provider : candidates) {
            if (provider == null || provider.name() == null || provider.name().isBlank()) {
                continue;
            }
            if (!seen.add(provider.name().toLowerCase(Locale.ROOT))) {
                log.warn("Skipping duplicate provider name {}", provider.name());
                continue;
            }
            unique.add(provider);
        }
        return unique;
    }
}
