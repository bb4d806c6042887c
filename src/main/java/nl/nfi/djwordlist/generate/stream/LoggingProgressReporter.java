package nl.nfi.djwordlist.generate.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

// the total is unknown up front, so progress is reported as lines written and throughput
public final class LoggingProgressReporter implements ProgressReporter {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingProgressReporter.class);

    static final long DEFAULT_LOG_INTERVAL = 1_000_000;

    private final long logInterval;
    private final long startTime;
    private final AtomicLong written = new AtomicLong();

    private LoggingProgressReporter(final long logInterval) {
        this.logInterval = logInterval;
        this.startTime = System.nanoTime();
    }

    public static LoggingProgressReporter start() {
        return new LoggingProgressReporter(DEFAULT_LOG_INTERVAL);
    }

    public static LoggingProgressReporter start(final long logInterval) {
        return new LoggingProgressReporter(logInterval);
    }

    @Override
    public void advance(final long lineCount) {
        final long before = written.getAndAdd(lineCount);
        final long after = before + lineCount;
        if (before / logInterval != after / logInterval) {
            final Duration elapsed = Duration.ofNanos(System.nanoTime() - startTime);
            LOG.info("Generating: {} lines written in {} ({} lines/s)", after, elapsed, String.format("%.0f", linesPerSecond(after, elapsed)));
        }
    }

    public long written() {
        return written.get();
    }

    private static double linesPerSecond(final long lines, final Duration elapsed) {
        final double seconds = elapsed.toNanos() / 1e9;
        return seconds > 0 ? lines / seconds : 0.0;
    }
}
