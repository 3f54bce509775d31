package com.hifi.marketsearch.search.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

public record SearchRequest(
    List<String> terms,
    Integer daysBack,
    List<String> include,
    List<String> exclude,
    String sort,
    BigDecimal minPrice,
    BigDecimal maxPrice
) {
    public List<String> normalizedTerms() {
        return clean(terms);
    }

    public List<String> normalizedInclude() {
        return clean(include);
    }

    public List<String> normalizedExclude() {
        return clean(exclude);
    }

    public int effectiveDaysBack() {
        return daysBack == null ? 0 : Math.max(0, daysBack);
    }

    private static List<String> clean(List<String> values) {
        if (values == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }
}
