package nl.nfi.djwordlist.generate.combine;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazily enumerates base strings: ordered permutations of 1 to {@code maxLength} distinct word
 * positions, joined by each joiner in turn.
 * <p>
 * Emission order is by permutation length, then lexicographically by word index tuple, then by joiner.
 * Words are positions, not values: a word listed twice is permuted as two different words. A single
 * word has nothing to join, so it is emitted once instead of once per joiner.
 */
public final class BaseCombinations implements Iterable<String> {

    private final List<String> words;
    private final List<String> joiners;
    private final int maxLength;

    private BaseCombinations(final List<String> words, final List<String> joiners, final int maxLength) {
        this.words = words;
        this.joiners = joiners;
        this.maxLength = maxLength;
    }

    public static BaseCombinations of(final List<String> words, final List<String> joiners, final int maxLength) {
        if (maxLength < 1 || maxLength > words.size()) {
            throw new IllegalArgumentException("Permutation length %d not in 1..%d".formatted(maxLength, words.size()));
        }
        if (joiners.isEmpty()) {
            throw new IllegalArgumentException("At least one joiner is required");
        }
        return new BaseCombinations(words, joiners, maxLength);
    }

    @Override
    public Iterator<String> iterator() {
        return new PermutationIterator();
    }

    private final class PermutationIterator implements Iterator<String> {

        private final int wordCount = words.size();
        private final boolean[] used = new boolean[wordCount];

        private int[] indices;
        private int joinerIndex;
        private boolean finished;

        private PermutationIterator() {
            startLength(1);
        }

        @Override
        public boolean hasNext() {
            return !finished;
        }

        @Override
        public String next() {
            if (finished) {
                throw new NoSuchElementException();
            }
            final String joiner = joiners.get(joinerIndex);
            final StringBuilder base = new StringBuilder(words.get(indices[0]));
            for (int i = 1; i < indices.length; i++) {
                base.append(joiner).append(words.get(indices[i]));
            }
            advance();
            return base.toString();
        }

        private void advance() {
            // single words are not joined, so all joiners would yield the same string
            if (indices.length > 1 && joinerIndex + 1 < joiners.size()) {
                joinerIndex++;
                return;
            }
            joinerIndex = 0;
            if (nextPermutation()) {
                return;
            }
            if (indices.length < maxLength) {
                startLength(indices.length + 1);
            } else {
                finished = true;
            }
        }

        private void startLength(final int length) {
            indices = new int[length];
            for (int i = 0; i < wordCount; i++) {
                used[i] = i < length;
            }
            for (int i = 0; i < length; i++) {
                indices[i] = i;
            }
        }

        // steps to the lexicographically next tuple of distinct indices, false when exhausted
        private boolean nextPermutation() {
            for (int position = indices.length - 1; position >= 0; position--) {
                used[indices[position]] = false;
                int candidate = indices[position] + 1;
                while (candidate < wordCount && used[candidate]) {
                    candidate++;
                }
                if (candidate < wordCount) {
                    indices[position] = candidate;
                    used[candidate] = true;
                    fillAscending(position + 1);
                    return true;
                }
            }
            return false;
        }

        private void fillAscending(final int from) {
            int candidate = 0;
            for (int position = from; position < indices.length; position++) {
                while (used[candidate]) {
                    candidate++;
                }
                indices[position] = candidate;
                used[candidate] = true;
            }
        }
    }
}
