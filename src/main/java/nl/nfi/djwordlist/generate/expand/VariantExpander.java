package nl.nfi.djwordlist.generate.expand;

import nl.nfi.djwordlist.generate.config.CaseMode;
import nl.nfi.djwordlist.generate.config.GeneratorConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

public final class VariantExpander {

    private final List<CaseMode> cases;
    private final Map<Character, List<String>> leetMap;
    private final int leetMaxExpansions;

    private VariantExpander(final List<CaseMode> cases, final Map<Character, List<String>> leetMap, final int leetMaxExpansions) {
        this.cases = cases;
        this.leetMap = leetMap;
        this.leetMaxExpansions = leetMaxExpansions;
    }

    public static VariantExpander of(final List<CaseMode> cases, final Map<Character, List<String>> leetMap, final int leetMaxExpansions) {
        return new VariantExpander(cases, leetMap, leetMaxExpansions);
    }

    public static VariantExpander forConfig(final GeneratorConfig config) {
        return of(config.cases(), config.leetMap(), config.leetMaxExpansions());
    }

    public Variants expand(final String base) {
        return new Variants(
                () -> new BaseVariantIterator(base),
                capitalize(base),
                base.toUpperCase(Locale.ROOT),
                camel(base)
        );
    }

    /**
     * The case transforms of the base string, in configured case mode order, without duplicates.
     */
    public List<String> caseVariants(final String base) {
        final Set<String> variants = new LinkedHashSet<>();
        for (final CaseMode mode : cases) {
            variants.add(mode.apply(base));
        }
        return Collections.unmodifiableList(new ArrayList<>(variants));
    }

    public static String capitalize(final String value) {
        if (value.isEmpty()) {
            return value;
        }
        final int first = value.codePointAt(0);
        return new StringBuilder(value.length())
                .appendCodePoint(Character.toUpperCase(first))
                .append(value, Character.charCount(first), value.length())
                .toString();
    }

    // alphanumeric runs become "Xxxx", everything between them is kept verbatim
    public static String camel(final String value) {
        final StringBuilder result = new StringBuilder(value.length());
        boolean startOfRun = true;
        for (int i = 0; i < value.length(); ) {
            final int codePoint = value.codePointAt(i);
            if (Character.isLetterOrDigit(codePoint)) {
                result.appendCodePoint(startOfRun ? Character.toUpperCase(codePoint) : Character.toLowerCase(codePoint));
                startOfRun = false;
            } else {
                result.appendCodePoint(codePoint);
                startOfRun = true;
            }
            i += Character.charCount(codePoint);
        }
        return result.toString();
    }

    private final class BaseVariantIterator implements Iterator<String> {

        private final String base;
        private final Iterator<String> cased;
        private final Set<String> seen = new HashSet<>();

        private Iterator<String> substituted = Collections.emptyIterator();
        private String next;

        private BaseVariantIterator(final String base) {
            this.base = base;
            this.cased = caseVariants(base).iterator();
            advance();
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public String next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            final String current = next;
            advance();
            return current;
        }

        private void advance() {
            next = null;
            while (next == null) {
                while (!substituted.hasNext()) {
                    if (!cased.hasNext()) {
                        return;
                    }
                    substituted = LeetExpansion.of(cased.next(), base, leetMap, leetMaxExpansions).iterator();
                }
                final String candidate = substituted.next();
                if (seen.add(candidate)) {
                    next = candidate;
                }
            }
        }
    }
}
