package nl.nfi.djwordlist.generate.stream;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Worker local buffer in front of a shared sink. Lines are handed over in batches, each followed by a
 * progress update, so the shared sink's lock is taken once per batch instead of once per line.
 */
public final class BatchingSink implements Sink {

    static final int DEFAULT_BATCH_SIZE = 1 << 12;

    private final int batchSize;
    private final Sink target;
    private final ProgressReporter progress;
    private List<String> batch;

    public BatchingSink(final Sink target, final ProgressReporter progress) {
        this(DEFAULT_BATCH_SIZE, target, progress);
    }

    public BatchingSink(final int batchSize, final Sink target, final ProgressReporter progress) {
        this.batchSize = batchSize;
        this.target = target;
        this.progress = progress;
        this.batch = new ArrayList<>(batchSize);
    }

    @Override
    public void writeLine(final String line) throws IOException {
        batch.add(line);
        if (batch.size() >= batchSize) {
            transferBatch();
        }
    }

    @Override
    public void flush() throws IOException {
        if (!batch.isEmpty()) {
            transferBatch();
        }
    }

    // closes only the local buffer, the shared target stays open for the other workers
    @Override
    public void close() throws IOException {
        flush();
    }

    private void transferBatch() throws IOException {
        final List<String> lines = batch;
        batch = new ArrayList<>(batchSize);
        target.writeLines(lines);
        progress.advance(lines.size());
    }
}
