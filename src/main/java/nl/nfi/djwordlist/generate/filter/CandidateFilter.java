package nl.nfi.djwordlist.generate.filter;

import nl.nfi.djwordlist.generate.config.GeneratorConfig;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Accepts a candidate when its length (in code points) is within bounds, its Shannon entropy reaches the
 * threshold and it is not blacklisted. Side effect free.
 */
public final class CandidateFilter implements Predicate<String> {

    private final int minLength;
    private final int maxLength;
    private final double minEntropy;
    private final Set<String> blacklist;

    private CandidateFilter(final int minLength, final int maxLength, final double minEntropy, final Set<String> blacklist) {
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.minEntropy = minEntropy;
        this.blacklist = blacklist;
    }

    public static CandidateFilter of(final int minLength, final int maxLength, final double minEntropy, final Set<String> blacklist) {
        return new CandidateFilter(minLength, maxLength, minEntropy, blacklist);
    }

    public static CandidateFilter forConfig(final GeneratorConfig config) {
        return of(config.minLength(), config.maxLength(), config.minEntropy(), config.blacklist());
    }

    @Override
    public boolean test(final String candidate) {
        final int length = candidate.codePointCount(0, candidate.length());
        if (length < minLength || length > maxLength) {
            return false;
        }
        // entropy is never negative, a zero threshold rejects nothing
        if (minEntropy > 0.0 && Entropy.shannon(candidate) < minEntropy) {
            return false;
        }
        return !blacklist.contains(candidate);
    }
}
