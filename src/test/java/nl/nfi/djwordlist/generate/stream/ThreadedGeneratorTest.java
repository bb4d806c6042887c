package nl.nfi.djwordlist.generate.stream;

import nl.nfi.djwordlist.Utils.CollectingSink;
import nl.nfi.djwordlist.Utils.FailingSink;
import nl.nfi.djwordlist.generate.config.GeneratorConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.concurrent.TimeUnit.SECONDS;
import static nl.nfi.djwordlist.Utils.richConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadedGeneratorTest {

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 8})
    @Timeout(value = 30, unit = SECONDS)
    void globalCapHoldsForAnyWorkerCount(final int workerCount) throws IOException {
        final GeneratorConfig config = richConfig().maxCount(100).workerCount(workerCount).build();
        final CollectingSink sink = new CollectingSink();

        final long written = ThreadedGenerator.init(config).writeCandidates(Budget.of(config.maxCount()), sink, ProgressReporter.noop());

        assertThat(written).isEqualTo(sink.lines().size());
        assertThat(sink.lines().size()).isBetween(100, 100 + workerCount);
    }

    @Test
    @Timeout(value = 30, unit = SECONDS)
    void uncappedOutputMatchesSequentialOutput() throws IOException {
        final GeneratorConfig config = richConfig().workerCount(3).build();
        final CollectingSink sequential = new CollectingSink();
        final CollectingSink threaded = new CollectingSink();

        SequentialGenerator.init(config).writeCandidates(Budget.unlimited(), sequential, ProgressReporter.noop());
        ThreadedGenerator.init(config).writeCandidates(Budget.unlimited(), threaded, ProgressReporter.noop());

        assertThat(threaded.lines()).containsExactlyInAnyOrderElementsOf(sequential.lines());
    }

    @Test
    @Timeout(value = 30, unit = SECONDS)
    void progressCountsEveryLine() throws IOException {
        final GeneratorConfig config = richConfig().workerCount(4).build();
        final LoggingProgressReporter progress = LoggingProgressReporter.start(1000);

        final long written = ThreadedGenerator.init(config).writeCandidates(Budget.unlimited(), new CollectingSink(), progress);

        assertThat(progress.written()).isEqualTo(written);
    }

    @Test
    @Timeout(value = 30, unit = SECONDS)
    void sinkFailureAbortsRun() {
        final GeneratorConfig config = richConfig().workerCount(4).build();

        assertThatThrownBy(() -> ThreadedGenerator.init(config).writeCandidates(Budget.unlimited(), FailingSink.withIOException(), ProgressReporter.noop()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("No space left on device");
    }

    @Test
    @Timeout(value = 30, unit = SECONDS)
    void noWorkerWritesAfterFailedRunReturns() throws InterruptedException {
        final GeneratorConfig config = richConfig().workerCount(8).build();
        final FailOnceSink sink = new FailOnceSink();

        assertThatThrownBy(() -> ThreadedGenerator.init(config).writeCandidates(Budget.unlimited(), sink, ProgressReporter.noop()))
                .isInstanceOf(IOException.class);
        sink.runReturned.set(true);

        // give lingering workers the chance to flush their batches
        Thread.sleep(500);
        assertThat(sink.writesAfterReturn.get()).isZero();
    }

    @Test
    @Timeout(value = 30, unit = SECONDS)
    void unexpectedWorkerFailureIsReportedWithShard() {
        final GeneratorConfig config = richConfig().workerCount(2).build();

        assertThatThrownBy(() -> ThreadedGenerator.init(config).writeCandidates(Budget.unlimited(), FailingSink.with(new IllegalStateException("boom")), ProgressReporter.noop()))
                .isInstanceOf(WorkerException.class)
                .hasRootCauseInstanceOf(IllegalStateException.class)
                .satisfies(e -> assertThat(((WorkerException) e).shardIndex()).isBetween(0, 1));
    }

    @Test
    void cancelledBudgetWritesNothing() throws IOException {
        final GeneratorConfig config = richConfig().workerCount(4).build();
        final Budget budget = Budget.unlimited();
        budget.cancel();
        final CollectingSink sink = new CollectingSink();

        assertThat(ThreadedGenerator.init(config).writeCandidates(budget, sink, ProgressReporter.noop())).isZero();
        assertThat(sink.lines()).isEmpty();
    }

    private static final class FailOnceSink implements Sink {

        private final AtomicBoolean failed = new AtomicBoolean();
        private final AtomicBoolean runReturned = new AtomicBoolean();
        private final AtomicInteger writesAfterReturn = new AtomicInteger();

        @Override
        public void writeLine(final String line) throws IOException {
            writeLines(List.of(line));
        }

        @Override
        public void writeLines(final List<String> lines) throws IOException {
            if (runReturned.get()) {
                writesAfterReturn.incrementAndGet();
            }
            if (failed.compareAndSet(false, true)) {
                throw new IOException("Disk quota exceeded");
            }
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    }
}
