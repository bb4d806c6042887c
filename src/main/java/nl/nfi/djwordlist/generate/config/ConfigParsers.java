package nl.nfi.djwordlist.generate.config;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.lang.Math.max;
import static java.lang.Math.min;

/**
 * Turns the textual option forms accepted on the command line into typed configuration values.
 * Every malformed input is rejected with a {@link ConfigException}, before anything is generated.
 */
public final class ConfigParsers {

    private static final String LAST_YEARS_PREFIX = "last:";

    static final int MIN_YEAR = 0;
    static final int MAX_YEAR = 9999;

    private ConfigParsers() {
    }

    /**
     * Splits a comma separated list, keeping empty elements. The literal token {@code ""} is read as an
     * empty element as well, so that shells which swallow empty arguments can still express one.
     * A {@code null} or entirely empty input yields a single empty element.
     */
    public static List<String> parseCsvAllowEmpty(final String csv) {
        if (csv == null || csv.isEmpty()) {
            return List.of("");
        }
        final List<String> values = new ArrayList<>();
        for (final String part : csv.split(",", -1)) {
            final String value = part.strip();
            values.add(value.equals("\"\"") ? "" : value);
        }
        return Collections.unmodifiableList(values);
    }

    public static List<CaseMode> parseCases(final String csv) {
        final Set<CaseMode> modes = new LinkedHashSet<>();
        if (csv != null) {
            for (final String token : csv.split(",")) {
                if (!token.isBlank()) {
                    modes.add(CaseMode.parse(token));
                }
            }
        }
        return modes.isEmpty() ? List.of(CaseMode.ORIGINAL) : List.copyOf(modes);
    }

    public static List<String> parseYears(final String spec) {
        return parseYears(spec, Clock.systemDefaultZone());
    }

    // years keep first-appearance order: ranges ascend, last:N descends from the current year;
    // every year lies in MIN_YEAR..MAX_YEAR, so a single item never expands to more than 10000 years
    public static List<String> parseYears(final String spec, final Clock clock) {
        if (spec == null || spec.isBlank()) {
            return List.of("");
        }

        final Set<Integer> years = new LinkedHashSet<>();
        for (final String part : spec.split(",")) {
            final String token = part.strip();
            if (token.isEmpty()) {
                continue;
            }
            if (token.startsWith(LAST_YEARS_PREFIX)) {
                final int count = parseNumber(token.substring(LAST_YEARS_PREFIX.length()), token);
                final int currentYear = checkYear(Year.now(clock).getValue(), token);
                if (count < 1 || count > currentYear - MIN_YEAR + 1) {
                    throw new ConfigException("Year count must be in 1..%d: %s".formatted(currentYear - MIN_YEAR + 1, token));
                }
                for (int year = currentYear; year > currentYear - count; year--) {
                    years.add(year);
                }
            } else if (token.indexOf('-', 1) > 0) {
                final int separator = token.indexOf('-', 1);
                final int first = checkYear(parseNumber(token.substring(0, separator), token), token);
                final int second = checkYear(parseNumber(token.substring(separator + 1), token), token);
                for (int year = min(first, second); year <= max(first, second); year++) {
                    years.add(year);
                }
            } else {
                years.add(checkYear(parseNumber(token, token), token));
            }
        }

        if (years.isEmpty()) {
            return List.of("");
        }
        return years.stream().map(String::valueOf).toList();
    }

    /**
     * Parses a leet map such as {@code a=@,4;s=$,5;e=3}. Keys are single characters and matched
     * case-sensitively. An empty spec disables substitution.
     */
    public static Map<Character, List<String>> parseLeet(final String spec) {
        final Map<Character, List<String>> mapping = new LinkedHashMap<>();
        if (spec == null || spec.isBlank()) {
            return mapping;
        }
        for (final String chunk : spec.split(";")) {
            if (chunk.isBlank()) {
                continue;
            }
            final int separator = chunk.indexOf('=');
            if (separator < 0) {
                throw new ConfigException("Leet item is missing '=': %s".formatted(chunk));
            }
            final String key = chunk.substring(0, separator).strip();
            if (key.length() != 1) {
                throw new ConfigException("Leet key must be a single character: %s".formatted(chunk));
            }
            final List<String> replacements = new ArrayList<>();
            for (final String value : chunk.substring(separator + 1).split(",")) {
                if (!value.isBlank()) {
                    replacements.add(value.strip());
                }
            }
            if (replacements.isEmpty()) {
                throw new ConfigException("Leet item has no replacements: %s".formatted(chunk));
            }
            mapping.merge(key.charAt(0), List.copyOf(replacements), (previous, next) -> {
                final List<String> merged = new ArrayList<>(previous);
                next.stream().filter(value -> !merged.contains(value)).forEach(merged::add);
                return List.copyOf(merged);
            });
        }
        return mapping;
    }

    private static int checkYear(final int year, final String token) {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new ConfigException("Year out of range %d..%d: %s".formatted(MIN_YEAR, MAX_YEAR, token));
        }
        return year;
    }

    private static int parseNumber(final String value, final String token) {
        try {
            return Integer.parseInt(value.strip());
        } catch (final NumberFormatException e) {
            throw new ConfigException("Malformed years item: %s".formatted(token), e);
        }
    }
}
