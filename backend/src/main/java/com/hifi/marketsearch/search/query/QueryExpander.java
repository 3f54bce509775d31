package com.hifi.marketsearch.search.query;

import com.hifi.marketsearch.config.SearchProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Broadens a search term with known synonyms so every variant is dispatched separately.
 * Entries are directional: the synonyms of {@code amp} say nothing about what
 * {@code amplifier} expands to.
 */
@Component
public class QueryExpander {
    private static final Map<String, List<String>> DEFAULT_SYNONYMS = defaultSynonyms();

    private final Map<String, List<String>> synonyms;

    public QueryExpander(SearchProperties properties) {
        Map<String, List<String>> merged = new LinkedHashMap<>();
        DEFAULT_SYNONYMS.forEach((term, values) -> merged.put(term, new ArrayList<>(values)));
        properties.getQuery().getSynonyms().forEach((term, values) -> {
            if (term == null || term.isBlank() || values == null) {
                return;
            }
            List<String> target = merged.computeIfAbsent(normalize(term), ignored -> new ArrayList<>());
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    target.add(value.trim());
                }
            }
        });
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        merged.forEach((term, values) -> frozen.put(term, List.copyOf(values)));
        this.synonyms = Map.copyOf(frozen);
    }

    public List<String> expand(String term) {
        if (term == null) {
            return List.of();
        }
        String original = term.trim();
        Set<String> variants = new LinkedHashSet<>();
        variants.add(original);
        if (original.isEmpty()) {
            return List.copyOf(variants);
        }
        variants.addAll(synonyms.getOrDefault(normalize(original), List.of()));
        return List.copyOf(variants);
    }

    private static String normalize(String term) {
        return term.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, List<String>> defaultSynonyms() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("amp", List.of("amplifier", "förstärkare"));
        table.put("amplifier", List.of("amp", "förstärkare"));
        table.put("förstärkare", List.of("amp", "amplifier"));
        table.put("turntable", List.of("record player", "skivspelare"));
        table.put("record", List.of("record player", "vinyl"));
        table.put("hifi", List.of("audio", "audio equipment"));
        return table;
    }
}
