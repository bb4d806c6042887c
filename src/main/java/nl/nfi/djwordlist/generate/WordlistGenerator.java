package nl.nfi.djwordlist.generate;

import nl.nfi.djwordlist.generate.config.GeneratorConfig;
import nl.nfi.djwordlist.generate.stream.Budget;
import nl.nfi.djwordlist.generate.stream.CandidateGenerator;
import nl.nfi.djwordlist.generate.stream.ProcessGenerator;
import nl.nfi.djwordlist.generate.stream.ProgressReporter;
import nl.nfi.djwordlist.generate.stream.SequentialGenerator;
import nl.nfi.djwordlist.generate.stream.Sink;
import nl.nfi.djwordlist.generate.stream.ThreadedGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

public final class WordlistGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(WordlistGenerator.class);

    private final GeneratorConfig config;
    private final ProgressReporter progress;

    private WordlistGenerator(final GeneratorConfig config, final ProgressReporter progress) {
        this.config = config;
        this.progress = progress;
    }

    public static WordlistGenerator forConfig(final GeneratorConfig config) {
        return new WordlistGenerator(config, ProgressReporter.noop());
    }

    public WordlistGenerator progress(final ProgressReporter progress) {
        return new WordlistGenerator(config, progress);
    }

    public long generate(final Sink sink) throws IOException {
        return generate(sink, Budget.of(config.maxCount()));
    }

    /**
     * Writes all accepted candidates to the sink, stopping early once the budget is spent or cancelled.
     * The sink is flushed but not closed.
     *
     * @return the number of lines written
     */
    public long generate(final Sink sink, final Budget budget) throws IOException {
        LOG.info("Generating: {} word(s), permutation length {}, {} mask(s), {} worker(s) ({})",
                config.words().size(), config.maxPermutationLength(), config.masks().size(),
                config.workerCount(), config.executionMode());
        LOG.debug("Joiners: {}", config.joiners());
        LOG.debug("Numbers: {}", config.numbers());
        LOG.debug("Symbols: {}", config.symbols());
        LOG.debug("Years: {}", config.years());
        LOG.debug("Cases: {}", config.cases());
        LOG.debug("Masks: {}", config.masks());
        LOG.debug("Leet map: {} (at most {} substitutions)", config.leetMap(), config.leetMaxExpansions());

        final long start = System.nanoTime();
        final long written = initGenerator().writeCandidates(budget, sink, progress);
        sink.flush();

        if (config.hasMaxCount() && written >= config.maxCount()) {
            LOG.info("Reached max-count={}; stopping.", config.maxCount());
        }
        LOG.info("Done. Generated {} line(s) in {}.", written, Duration.ofNanos(System.nanoTime() - start));
        return written;
    }

    private CandidateGenerator initGenerator() {
        if (config.workerCount() == 1) {
            return SequentialGenerator.init(config);
        }
        return switch (config.executionMode()) {
            case THREADS -> ThreadedGenerator.init(config);
            case PROCESSES -> ProcessGenerator.init(config);
        };
    }
}
