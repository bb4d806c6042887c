package nl.nfi.djwordlist.generate.stream;

import nl.nfi.djwordlist.generate.combine.BaseCombinations;
import nl.nfi.djwordlist.generate.config.GeneratorConfig;
import nl.nfi.djwordlist.generate.filter.CandidateFilter;
import nl.nfi.djwordlist.generate.mask.MaskComposer;

import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Predicate;

/**
 * The lazy generation pipeline of one shard: base strings, variants, masks and filtering, pulled one
 * accepted candidate at a time.
 * <p>
 * Shards split the base string stream round-robin: shard {@code i} of {@code n} takes the base strings at
 * positions {@code i, i + n, i + 2n, ...}. Each shard runs every later stage on its own.
 */
public final class CandidatePipeline implements Iterator<String> {

    private final Iterator<String> bases;
    private final MaskComposer composer;
    private final Predicate<String> filter;
    private final int shardIndex;
    private final int shardCount;

    private long basePosition = -1;
    private Iterator<String> candidates = Collections.emptyIterator();
    private String next;

    private CandidatePipeline(final Iterator<String> bases, final MaskComposer composer, final Predicate<String> filter, final int shardIndex, final int shardCount) {
        this.bases = bases;
        this.composer = composer;
        this.filter = filter;
        this.shardIndex = shardIndex;
        this.shardCount = shardCount;
    }

    public static CandidatePipeline forShard(final GeneratorConfig config, final int shardIndex, final int shardCount) {
        if (shardIndex < 0 || shardIndex >= shardCount) {
            throw new IllegalArgumentException("Shard %d not in 0..%d".formatted(shardIndex, shardCount - 1));
        }
        final BaseCombinations bases = BaseCombinations.of(config.words(), config.joiners(), config.maxPermutationLength());
        return new CandidatePipeline(bases.iterator(), MaskComposer.forConfig(config), CandidateFilter.forConfig(config), shardIndex, shardCount);
    }

    public static CandidatePipeline forAll(final GeneratorConfig config) {
        return forShard(config, 0, 1);
    }

    @Override
    public boolean hasNext() {
        while (next == null) {
            while (!candidates.hasNext()) {
                final String base = nextBaseOfShard();
                if (base == null) {
                    return false;
                }
                candidates = composer.candidates(base);
            }
            final String candidate = candidates.next();
            if (filter.test(candidate)) {
                next = candidate;
            }
        }
        return true;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        final String candidate = next;
        next = null;
        return candidate;
    }

    /**
     * Writes accepted candidates to the sink until the shard is exhausted or the budget refuses. The budget is
     * consulted once per candidate.
     *
     * @return the number of lines written
     */
    public long drainTo(final Sink sink, final Budget budget) throws IOException {
        long written = 0;
        while (hasNext() && budget.tryAcquire()) {
            sink.writeLine(next());
            written++;
        }
        return written;
    }

    private String nextBaseOfShard() {
        while (bases.hasNext()) {
            final String base = bases.next();
            basePosition++;
            if (basePosition % shardCount == shardIndex) {
                return base;
            }
        }
        return null;
    }
}
