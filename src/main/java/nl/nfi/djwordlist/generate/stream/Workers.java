package nl.nfi.djwordlist.generate.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;

import static java.util.concurrent.TimeUnit.MINUTES;

final class Workers {

    private static final Logger LOG = LoggerFactory.getLogger(Workers.class);

    private Workers() {
    }

    /**
     * Interrupts all workers and waits for them to finish, so that none of them still writes to the shared sink
     * once the generator returns.
     */
    static void stop(final ExecutorService executorService) {
        executorService.shutdownNow();
        try {
            if (!executorService.awaitTermination(1, MINUTES)) {
                LOG.error("Workers did not stop within a minute");
            }
        } catch (final InterruptedException e) {
            LOG.warn("Interrupted while waiting for workers to stop");
            Thread.currentThread().interrupt();
        }
    }
}
