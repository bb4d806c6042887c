package nl.nfi.djwordlist.generate.filter;

import java.util.HashMap;
import java.util.Map;

public final class Entropy {

    private static final double LOG_2 = Math.log(2.0);

    private Entropy() {
    }

    /**
     * Shannon entropy in bits of the character (code point) distribution of the given string.
     * Strings of length 0 and 1 have entropy 0.
     */
    public static double shannon(final String value) {
        final Map<Integer, Integer> counts = new HashMap<>();
        value.codePoints().forEach(codePoint -> counts.merge(codePoint, 1, Integer::sum));

        final int length = counts.values().stream().mapToInt(Integer::intValue).sum();
        if (length <= 1) {
            return 0.0;
        }

        double entropy = 0.0;
        for (final int count : counts.values()) {
            final double probability = (double) count / length;
            entropy -= probability * Math.log(probability) / LOG_2;
        }
        return entropy;
    }
}
