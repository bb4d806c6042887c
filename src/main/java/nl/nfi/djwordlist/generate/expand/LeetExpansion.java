package nl.nfi.djwordlist.generate.expand;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import static java.lang.Math.min;

/**
 * Bounded substitution expansion of one string.
 * <p>
 * At most {@code maxSubstitutions} eligible positions are replaced at the same time. The enumeration walks
 * subset sizes from 0 upwards, then position subsets in lexicographic order, then the product of the
 * replacement choices of the chosen positions. Nothing beyond the bound is ever generated. The unmodified
 * string always comes first, and strings produced more than once are emitted only the first time.
 */
public final class LeetExpansion implements Iterable<String> {

    private final String value;
    private final int[] positions;
    private final List<List<String>> replacements;
    private final int maxSubstitutions;

    private LeetExpansion(final String value, final int[] positions, final List<List<String>> replacements, final int maxSubstitutions) {
        this.value = value;
        this.positions = positions;
        this.replacements = replacements;
        this.maxSubstitutions = maxSubstitutions;
    }

    /**
     * @param value     the string to substitute in
     * @param reference the string whose characters decide which positions are eligible, normally the
     *                  base string before any case transform; ignored when its length differs from value
     */
    public static LeetExpansion of(final String value, final String reference, final Map<Character, List<String>> leetMap, final int maxSubstitutions) {
        final String eligibility = reference.length() == value.length() ? reference : value;

        final List<Integer> positions = new ArrayList<>();
        final List<List<String>> replacements = new ArrayList<>();
        for (int i = 0; i < eligibility.length(); i++) {
            final List<String> options = leetMap.get(eligibility.charAt(i));
            if (options != null && !options.isEmpty()) {
                positions.add(i);
                replacements.add(options);
            }
        }

        return new LeetExpansion(
                value,
                positions.stream().mapToInt(Integer::intValue).toArray(),
                replacements,
                min(positions.size(), maxSubstitutions)
        );
    }

    int eligiblePositionCount() {
        return positions.length;
    }

    @Override
    public Iterator<String> iterator() {
        return new SubstitutionIterator();
    }

    private final class SubstitutionIterator implements Iterator<String> {

        private final Set<String> seen = new HashSet<>();

        // indices into positions, the current subset of size subsetSize
        private int[] subset = new int[0];
        // replacement choice per subset member
        private int[] choices = new int[0];
        private boolean exhausted;
        private String next;

        private SubstitutionIterator() {
            next = value;
            seen.add(value);
            step();
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
            next = null;
            while (next == null && !exhausted) {
                final String candidate = render();
                step();
                if (seen.add(candidate)) {
                    next = candidate;
                }
            }
            return current;
        }

        private String render() {
            final StringBuilder result = new StringBuilder(value.length() + subset.length * 2);
            int from = 0;
            for (int member = 0; member < subset.length; member++) {
                final int position = positions[subset[member]];
                result.append(value, from, position);
                result.append(replacements.get(subset[member]).get(choices[member]));
                from = position + 1;
            }
            result.append(value, from, value.length());
            return result.toString();
        }

        // moves to the next (subset, choices) state; the state reached is rendered by the following call
        private void step() {
            if (nextChoices() || nextSubset()) {
                return;
            }
            final int size = subset.length + 1;
            if (size > maxSubstitutions) {
                exhausted = true;
                return;
            }
            subset = new int[size];
            choices = new int[size];
            for (int i = 0; i < size; i++) {
                subset[i] = i;
            }
        }

        private boolean nextChoices() {
            for (int member = choices.length - 1; member >= 0; member--) {
                if (choices[member] + 1 < replacements.get(subset[member]).size()) {
                    choices[member]++;
                    return true;
                }
                choices[member] = 0;
            }
            return false;
        }

        private boolean nextSubset() {
            final int size = subset.length;
            for (int member = size - 1; member >= 0; member--) {
                if (subset[member] < positions.length - size + member) {
                    subset[member]++;
                    for (int following = member + 1; following < size; following++) {
                        subset[following] = subset[following - 1] + 1;
                    }
                    return true;
                }
            }
            return false;
        }
    }
}
