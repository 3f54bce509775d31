package com.hifi.marketsearch.search.dates;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the free-text, Swedish/English date expressions marketplaces print next to a
 * listing ("Idag 14:32", "2 days ago", "22 sep.", "Oct 26, 2025", "17/10/2025").
 *
 * <p>Rules are tried in a fixed order and the first one that yields a valid date wins:
 * keywords, relative offsets, ISO dates, numeric day-month-year, month-first text,
 * day-first text and finally a bare time of day. Day-level results are returned at
 * midnight; "just now" and hour offsets keep the time of day.
 *
 * <p>An empty result means the text was not understood. It is never substituted with the
 * current time, so callers can tell "no date" apart from "posted now".
 */
@Component
public class DateNormalizer {
    private static final Map<String, Integer> MONTHS = Map.ofEntries(
        Map.entry("jan", 1),
        Map.entry("feb", 2),
        Map.entry("mar", 3),
        Map.entry("apr", 4),
        Map.entry("maj", 5),
        Map.entry("may", 5),
        Map.entry("jun", 6),
        Map.entry("jul", 7),
        Map.entry("aug", 8),
        Map.entry("sep", 9),
        Map.entry("okt", 10),
        Map.entry("oct", 10),
        Map.entry("nov", 11),
        Map.entry("dec", 12)
    );

    private static final Pattern RELATIVE_AGO = Pattern.compile(
        "(?<!\\d)(\\d{1,6})\\s+(days?|hours?|weeks?)\\s+ago",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );
    private static final Pattern RELATIVE_SEDAN = Pattern.compile(
        "(?<!\\d)(\\d{1,6})\\s+(dag|dagar|timme|timmar|vecka|veckor)\\s+sedan",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );
    private static final Pattern ISO_DATE = Pattern.compile("(?<!\\d)(\\d{4})-(\\d{2})-(\\d{2})(?!\\d)");
    private static final Pattern NUMERIC_DATE = Pattern.compile(
        "(?<!\\d)(\\d{1,2})[/-](\\d{1,2})[/-](\\d{2,4})(?!\\d)"
    );
    private static final Pattern MONTH_FIRST = Pattern.compile(
        "(?<!\\p{L})(\\p{L}{3,9})\\.?\\s+(\\d{1,2}),\\s*(\\d{4})(?!\\d)",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );
    private static final Pattern DAY_FIRST = Pattern.compile(
        "(?<!\\d)(\\d{1,2})\\s+(\\p{L}{3,9})\\.?(?:,?\\s*(\\d{4})(?!\\d))?",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );
    private static final Pattern TIME_OF_DAY = Pattern.compile("^\\d{1,2}:\\d{2}$");

    private final Clock clock;

    public DateNormalizer(Clock clock) {
        this.clock = clock;
    }

    public Optional<LocalDateTime> normalize(String text) {
        return normalize(text, LocalDateTime.now(clock));
    }

    /**
     * Same as {@link #normalize(String)} but relative expressions are resolved against
     * {@code now}, which lets a caller parse a whole batch against one reference instant.
     */
    public Optional<LocalDateTime> normalize(String text, LocalDateTime now) {
        if (text == null || text.isBlank() || now == null) {
            return Optional.empty();
        }
        String lower = text.trim().toLowerCase(Locale.ROOT);
        LocalDate today = now.toLocalDate();

        Optional<LocalDateTime> keyword = fromKeyword(lower, now);
        if (keyword.isPresent()) {
            return keyword;
        }
        Optional<LocalDateTime> relative = fromRelativeOffset(lower, now);
        if (relative.isPresent()) {
            return relative;
        }
        Optional<LocalDateTime> iso = fromIsoDate(lower);
        if (iso.isPresent()) {
            return iso;
        }
        Optional<LocalDateTime> numeric = fromNumericDate(lower);
        if (numeric.isPresent()) {
            return numeric;
        }
        Optional<LocalDateTime> monthFirst = fromMonthFirst(lower);
        if (monthFirst.isPresent()) {
            return monthFirst;
        }
        Optional<LocalDateTime> dayFirst = fromDayFirst(lower, today);
        if (dayFirst.isPresent()) {
            return dayFirst;
        }
        if (TIME_OF_DAY.matcher(lower).matches()) {
            return Optional.of(today.atStartOfDay());
        }
        return Optional.empty();
    }

    /**
     * Calendar date of the parsed expression as {@code yyyy-MM-dd}, for display.
     */
    public Optional<String> toIsoDate(String text) {
        return normalize(text).map(parsed -> parsed.toLocalDate().toString());
    }

    private Optional<LocalDateTime> fromKeyword(String lower, LocalDateTime now) {
        LocalDate today = now.toLocalDate();
        if (lower.contains("idag") || lower.contains("today")) {
            return Optional.of(today.atStartOfDay());
        }
        if (lower.contains("igår") || lower.contains("yesterday")) {
            return Optional.of(today.minusDays(1).atStartOfDay());
        }
        if (lower.contains("just nu") || lower.contains("just now") || lower.contains("justnow")) {
            return Optional.of(now);
        }
        return Optional.empty();
    }

    private Optional<LocalDateTime> fromRelativeOffset(String lower, LocalDateTime now) {
        Matcher english = RELATIVE_AGO.matcher(lower);
        if (english.find()) {
            long amount = Long.parseLong(english.group(1));
            String unit = english.group(2);
            if (unit.startsWith("hour")) {
                return safely(() -> now.minusHours(amount));
            }
            if (unit.startsWith("week")) {
                return safely(() -> now.toLocalDate().minusWeeks(amount).atStartOfDay());
            }
            return safely(() -> now.toLocalDate().minusDays(amount).atStartOfDay());
        }
        Matcher swedish = RELATIVE_SEDAN.matcher(lower);
        if (swedish.find()) {
            long amount = Long.parseLong(swedish.group(1));
            String unit = swedish.group(2);
            if (unit.startsWith("timm")) {
                return safely(() -> now.minusHours(amount));
            }
            if (unit.startsWith("veck")) {
                return safely(() -> now.toLocalDate().minusWeeks(amount).atStartOfDay());
            }
            return safely(() -> now.toLocalDate().minusDays(amount).atStartOfDay());
        }
        return Optional.empty();
    }

    private Optional<LocalDateTime> fromIsoDate(String lower) {
        Matcher matcher = ISO_DATE.matcher(lower);
        while (matcher.find()) {
            int year = Integer.parseInt(matcher.group(1));
            int month = Integer.parseInt(matcher.group(2));
            int day = Integer.parseInt(matcher.group(3));
            Optional<LocalDateTime> parsed = atStartOfDay(year, month, day);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private Optional<LocalDateTime> fromNumericDate(String lower) {
        Matcher matcher = NUMERIC_DATE.matcher(lower);
        while (matcher.find()) {
            int day = Integer.parseInt(matcher.group(1));
            int month = Integer.parseInt(matcher.group(2));
            int year = Integer.parseInt(matcher.group(3));
            if (year < 100) {
                year += 2000;
            }
            Optional<LocalDateTime> parsed = atStartOfDay(year, month, day);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private Optional<LocalDateTime> fromMonthFirst(String lower) {
        Matcher matcher = MONTH_FIRST.matcher(lower);
        while (matcher.find()) {
            Integer month = monthOf(matcher.group(1));
            if (month == null) {
                continue;
            }
            int day = Integer.parseInt(matcher.group(2));
            int year = Integer.parseInt(matcher.group(3));
            Optional<LocalDateTime> parsed = atStartOfDay(year, month, day);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private Optional<LocalDateTime> fromDayFirst(String lower, LocalDate today) {
        Matcher matcher = DAY_FIRST.matcher(lower);
        while (matcher.find()) {
            Integer month = monthOf(matcher.group(2));
            if (month == null) {
                continue;
            }
            int day = Integer.parseInt(matcher.group(1));
            String yearText = matcher.group(3);
            if (yearText != null) {
                Optional<LocalDateTime> parsed = atStartOfDay(Integer.parseInt(yearText), month, day);
                if (parsed.isPresent()) {
                    return parsed;
                }
                continue;
            }
            Optional<LocalDateTime> thisYear = atStartOfDay(today.getYear(), month, day);
            if (thisYear.isPresent() && thisYear.get().toLocalDate().isAfter(today)) {
                // year-less dates in the future belong to last year
                return atStartOfDay(today.getYear() - 1, month, day);
            }
            if (thisYear.isPresent()) {
                return thisYear;
            }
        }
        return Optional.empty();
    }

    private Integer monthOf(String name) {
        if (name == null || name.length() < 3) {
            return null;
        }
        return MONTHS.get(name.substring(0, 3).toLowerCase(Locale.ROOT));
    }

    private Optional<LocalDateTime> atStartOfDay(int year, int month, int day) {
        return safely(() -> LocalDate.of(year, month, day).atStartOfDay());
    }

    private Optional<LocalDateTime> safely(Supplier<LocalDateTime> supplier) {
        try {
            return Optional.of(supplier.get());
        } catch (DateTimeException | ArithmeticException ignored) {
            return Optional.empty();
        }
    }
}
