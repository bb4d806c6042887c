package nl.nfi.djwordlist.generate;

import nl.nfi.djwordlist.generate.stream.Budget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Cancels a run when the JVM is asked to shut down, and gives the run a few seconds to flush its sink.
 * Closing it unregisters the hook, so that repeated runs in one JVM do not accumulate hooks.
 */
final class AbortOnShutdown implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AbortOnShutdown.class);

    private final Thread hook;
    private final CountDownLatch finished = new CountDownLatch(1);

    private AbortOnShutdown(final Budget budget) {
        this.hook = new Thread(() -> {
            LOG.info("Shutdown requested, stopping generation");
            budget.cancel();
            try {
                finished.await(10, SECONDS);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "abort-on-shutdown");
    }

    static AbortOnShutdown register(final Budget budget) {
        final AbortOnShutdown abort = new AbortOnShutdown(budget);
        Runtime.getRuntime().addShutdownHook(abort.hook);
        return abort;
    }

    Thread hook() {
        return hook;
    }

    @Override
    public void close() {
        finished.countDown();
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (final IllegalStateException e) {
            // the hook is running or about to, and returns once the latch is released
            LOG.debug("Shutdown in progress, hook stays registered");
        }
    }
}
