package nl.nfi.djwordlist.generate.stream;

import nl.nfi.djwordlist.generate.config.GeneratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Shared-memory execution: every shard runs on its own thread, all threads share one budget and write
 * their batches through one locked sink.
 */
public final class ThreadedGenerator implements CandidateGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(ThreadedGenerator.class);

    private final GeneratorConfig config;
    private final int workerCount;

    private ThreadedGenerator(final GeneratorConfig config, final int workerCount) {
        this.config = config;
        this.workerCount = workerCount;
    }

    public static ThreadedGenerator init(final GeneratorConfig config) {
        return new ThreadedGenerator(config, config.workerCount());
    }

    public ThreadedGenerator workerCount(final int workerCount) {
        return new ThreadedGenerator(config, workerCount);
    }

    @Override
    public long writeCandidates(final Budget budget, final Sink sink, final ProgressReporter progress) throws IOException {
        final Sink sharedSink = Sinks.synchronizedSink(sink);
        final ExecutorService executorService = Executors.newFixedThreadPool(workerCount);
        try {
            final CompletionService<Long> completion = new ExecutorCompletionService<>(executorService);
            for (int i = 0; i < workerCount; i++) {
                final int shardIndex = i;
                completion.submit(() -> runShard(shardIndex, budget, sharedSink, progress));
            }

            long written = 0;
            for (int i = 0; i < workerCount; i++) {
                written += awaitNext(completion, budget);
            }
            return written;
        } finally {
            // cancelled or failed runs get here with workers still draining their batches
            Workers.stop(executorService);
        }
    }

    private long runShard(final int shardIndex, final Budget budget, final Sink sharedSink, final ProgressReporter progress) throws IOException {
        // shards not yet started when the budget runs out are not started at all
        if (budget.isExhausted()) {
            LOG.debug("Skipping shard [{}], budget exhausted", shardIndex);
            return 0L;
        }
        LOG.debug("Starting worker for shard [{}/{}]", shardIndex, workerCount);
        try (final BatchingSink output = new BatchingSink(sharedSink, progress)) {
            final long written = CandidatePipeline.forShard(config, shardIndex, workerCount).drainTo(output, budget);
            LOG.debug("Finished shard [{}], {} lines", shardIndex, written);
            return written;
        } catch (final IOException e) {
            LOG.error("Exception in worker for shard [{}]", shardIndex, e);
            throw e;
        } catch (final RuntimeException e) {
            LOG.error("Exception in worker for shard [{}]", shardIndex, e);
            throw new WorkerException(shardIndex, e);
        }
    }

    private long awaitNext(final CompletionService<Long> completion, final Budget budget) throws IOException {
        try {
            return completion.take().get();
        } catch (final InterruptedException e) {
            budget.cancel();
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        } catch (final ExecutionException e) {
            // stop the siblings before reporting, they observe the cancelled budget at their next candidate
            budget.cancel();
            final Throwable cause = e.getCause();
            if (cause instanceof final IOException ioException) {
                throw ioException;
            }
            if (cause instanceof final UncheckedIOException uncheckedIOException) {
                throw uncheckedIOException.getCause();
            }
            if (cause instanceof final WorkerException workerException) {
                throw workerException;
            }
            throw new RuntimeException(cause);
        }
    }
}
