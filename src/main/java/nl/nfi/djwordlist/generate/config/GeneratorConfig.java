package nl.nfi.djwordlist.generate.config;

import nl.nfi.djwordlist.generate.mask.Mask;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.lang.Math.min;

/**
 * Immutable description of one generation run. Built once, before generation starts, and shared
 * read-only by every worker.
 */
public record GeneratorConfig(
        List<String> words,
        List<String> joiners,
        int maxPermutationLength,
        List<Mask> masks,
        List<String> numbers,
        List<String> symbols,
        List<String> years,
        List<CaseMode> cases,
        Map<Character, List<String>> leetMap,
        int leetMaxExpansions,
        int minLength,
        int maxLength,
        double minEntropy,
        Set<String> blacklist,
        long maxCount,
        int workerCount,
        ExecutionMode executionMode
) {

    public static final long UNLIMITED = Long.MAX_VALUE;

    public static final List<String> DEFAULT_MASKS = List.of(
            "{base}{num}{sym}",
            "{base}{year}{sym}",
            "{sym}{base}{num}",
            "{camel}{num}",
            "{Base}{year}",
            "{BASE}{sym}{num}"
    );

    public static final String DEFAULT_JOINERS = ",-,_,.";
    public static final String DEFAULT_CASES = "original,lower,upper,title,invert";
    public static final String DEFAULT_NUMBERS = "1,12,123,2025,007";
    public static final String DEFAULT_SYMBOLS = "!,@,#,$";
    public static final String DEFAULT_LEET = "a=@,4;s=$,5;e=3;i=1;o=0";
    public static final int DEFAULT_LEET_MAX_EXPANSIONS = 4;
    public static final int DEFAULT_MIN_LENGTH = 4;
    public static final int DEFAULT_MAX_LENGTH = 64;
    public static final int DEFAULT_WORKER_COUNT = 4;

    public boolean hasMaxCount() {
        return maxCount != UNLIMITED;
    }

    public static Builder builder() {
        return new Builder();
    }

    Builder toBuilder() {
        return new Builder()
                .words(words)
                .joiners(joiners)
                .maxPermutationLength(maxPermutationLength)
                .masks(masks.stream().map(Mask::template).toList())
                .numbers(numbers)
                .symbols(symbols)
                .years(years)
                .cases(cases)
                .leetMap(leetMap)
                .leetMaxExpansions(leetMaxExpansions)
                .minLength(minLength)
                .maxLength(maxLength)
                .minEntropy(minEntropy)
                .blacklist(blacklist)
                .maxCount(maxCount)
                .workerCount(workerCount)
                .executionMode(executionMode);
    }

    public static final class Builder {

        private List<String> words = List.of();
        private List<String> joiners = ConfigParsers.parseCsvAllowEmpty(DEFAULT_JOINERS);
        // 0 means: all words
        private int maxPermutationLength = 0;
        private List<String> masks = DEFAULT_MASKS;
        private List<String> numbers = ConfigParsers.parseCsvAllowEmpty(DEFAULT_NUMBERS);
        private List<String> symbols = ConfigParsers.parseCsvAllowEmpty(DEFAULT_SYMBOLS);
        private List<String> years = List.of("");
        private List<CaseMode> cases = ConfigParsers.parseCases(DEFAULT_CASES);
        private Map<Character, List<String>> leetMap = ConfigParsers.parseLeet(DEFAULT_LEET);
        private int leetMaxExpansions = DEFAULT_LEET_MAX_EXPANSIONS;
        private int minLength = DEFAULT_MIN_LENGTH;
        private int maxLength = DEFAULT_MAX_LENGTH;
        private double minEntropy = 0.0;
        private Set<String> blacklist = Set.of();
        private long maxCount = UNLIMITED;
        private int workerCount = 1;
        private ExecutionMode executionMode = ExecutionMode.THREADS;

        private Builder() {
        }

        public Builder words(final List<String> words) {
            this.words = words;
            return this;
        }

        public Builder joiners(final List<String> joiners) {
            this.joiners = joiners;
            return this;
        }

        public Builder maxPermutationLength(final int maxPermutationLength) {
            this.maxPermutationLength = maxPermutationLength;
            return this;
        }

        public Builder masks(final List<String> masks) {
            this.masks = masks;
            return this;
        }

        public Builder numbers(final List<String> numbers) {
            this.numbers = numbers;
            return this;
        }

        public Builder symbols(final List<String> symbols) {
            this.symbols = symbols;
            return this;
        }

        public Builder years(final List<String> years) {
            this.years = years;
            return this;
        }

        public Builder cases(final List<CaseMode> cases) {
            this.cases = cases;
            return this;
        }

        public Builder leetMap(final Map<Character, List<String>> leetMap) {
            this.leetMap = leetMap;
            return this;
        }

        public Builder leetMaxExpansions(final int leetMaxExpansions) {
            this.leetMaxExpansions = leetMaxExpansions;
            return this;
        }

        public Builder minLength(final int minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(final int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder minEntropy(final double minEntropy) {
            this.minEntropy = minEntropy;
            return this;
        }

        public Builder blacklist(final Set<String> blacklist) {
            this.blacklist = blacklist;
            return this;
        }

        public Builder maxCount(final long maxCount) {
            this.maxCount = maxCount;
            return this;
        }

        public Builder workerCount(final int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder executionMode(final ExecutionMode executionMode) {
            this.executionMode = executionMode;
            return this;
        }

        public GeneratorConfig build() {
            if (words.isEmpty()) {
                throw new ConfigException("No words provided");
            }
            if (words.stream().anyMatch(String::isEmpty)) {
                throw new ConfigException("Words must not be empty");
            }
            if (maxPermutationLength < 0) {
                throw new ConfigException("Max permutation length must be positive: %d".formatted(maxPermutationLength));
            }
            if (leetMaxExpansions < 0) {
                throw new ConfigException("Leet max expansions must not be negative: %d".formatted(leetMaxExpansions));
            }
            if (minLength < 0) {
                throw new ConfigException("Min length must not be negative: %d".formatted(minLength));
            }
            if (minLength > maxLength) {
                throw new ConfigException("Min length %d exceeds max length %d".formatted(minLength, maxLength));
            }
            if (maxCount < 1) {
                throw new ConfigException("Max count must be positive: %d".formatted(maxCount));
            }
            if (workerCount < 1) {
                throw new ConfigException("Worker count must be positive: %d".formatted(workerCount));
            }
            if (joiners.isEmpty()) {
                throw new ConfigException("At least one joiner is required");
            }
            if (cases.isEmpty()) {
                throw new ConfigException("At least one case mode is required");
            }
            leetMap.forEach((key, replacements) -> {
                if (replacements.isEmpty()) {
                    throw new ConfigException("Leet key '%s' has no replacements".formatted(key));
                }
            });

            final List<Mask> parsedMasks = (masks.isEmpty() ? DEFAULT_MASKS : masks).stream()
                    .map(Mask::parse)
                    .toList();

            // a length beyond the word count cannot be filled, so it means "all words"
            final int permutationLength = maxPermutationLength == 0
                    ? words.size()
                    : min(maxPermutationLength, words.size());

            final Map<Character, List<String>> leet = new LinkedHashMap<>();
            leetMap.forEach((key, replacements) -> leet.put(key, List.copyOf(replacements)));

            return new GeneratorConfig(
                    List.copyOf(words),
                    distinct(joiners),
                    permutationLength,
                    parsedMasks,
                    List.copyOf(numbers),
                    List.copyOf(symbols),
                    List.copyOf(years),
                    distinct(cases),
                    Collections.unmodifiableMap(leet),
                    leetMaxExpansions,
                    minLength,
                    maxLength,
                    minEntropy,
                    Set.copyOf(blacklist),
                    maxCount,
                    workerCount,
                    executionMode
            );
        }

        private static <T> List<T> distinct(final Collection<T> values) {
            return List.copyOf(new ArrayList<>(new LinkedHashSet<>(values)));
        }
    }
}
