package com.hifi.marketsearch.search.util;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Reads a price out of display text such as {@code "12 995 kr"}, {@code "1.299,50 SEK"} or
 * {@code "$1,299.00"}.
 */
public final class PriceParser {
  private PriceParser() {}

  public static Optional<BigDecimal> parse(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    StringBuilder kept = new StringBuilder();
    for (char c : text.toCharArray()) {
      if (Character.isDigit(c) || c == ',' || c == '.') {
        kept.append(c);
      }
    }
    String cleaned = stripTrailingSeparators(kept.toString());
    if (cleaned.isEmpty() || cleaned.chars().noneMatch(Character::isDigit)) {
      return Optional.empty();
    }

    int lastComma = cleaned.lastIndexOf(',');
    int lastDot = cleaned.lastIndexOf('.');
    String normalized;
    if (lastComma >= 0 && lastDot >= 0) {
      if (lastComma > lastDot) {
        normalized = cleaned.replace(".", "").replace(',', '.');
      } else {
        normalized = cleaned.replace(",", "");
      }
    } else if (lastComma >= 0) {
      int decimals = cleaned.length() - lastComma - 1;
      if (decimals == 2 && cleaned.indexOf(',') == lastComma) {
        normalized = cleaned.replace(',', '.');
      } else {
        normalized = cleaned.replace(",", "");
      }
    } else {
      normalized = cleaned;
    }

    // several dots left means dots were thousands separators
    if (normalized.indexOf('.') != normalized.lastIndexOf('.')) {
      normalized = normalized.replace(".", "");
    }
    try {
      return Optional.of(new BigDecimal(normalized));
    } catch (NumberFormatException ignored) {
      return Optional.empty();
    }
  }

  private static String stripTrailingSeparators(String value) {
    int end = value.length();
    while (end > 0 && (value.charAt(end - 1) == ',' || value.charAt(end - 1) == '.')) {
      end--;
    }
    int start = 0;
    while (start < end && (value.charAt(start) == ',' || value.charAt(start) == '.')) {
      start++;
    }
    return value.substring(start, end);
  }
}
