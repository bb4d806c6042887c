package nl.nfi.djwordlist.generate.stream;

import nl.nfi.djwordlist.common.HostUtils;
import nl.nfi.djwordlist.generate.config.GeneratorConfig;
import nl.nfi.djwordlist.main.WorkerMain;
import nl.nfi.djwordlist.serialize.ConfigCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Isolated-memory execution: every shard runs in its own child JVM.
 * <p>
 * Children cannot share a live counter, so the global cap is split up front into fixed per-shard quotas
 * that each child enforces on its own. Children stream their lines over stdout; one reader thread per
 * child hands them to the shared, locked sink. The sum of the quotas equals the cap, so the total never
 * exceeds it, but it falls short when some shard runs dry before its quota is used.
 */
public final class ProcessGenerator implements CandidateGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessGenerator.class);

    private final GeneratorConfig config;
    private final int workerCount;
    private final String workerMainClass;

    private ProcessGenerator(final GeneratorConfig config, final int workerCount, final String workerMainClass) {
        this.config = config;
        this.workerCount = workerCount;
        this.workerMainClass = workerMainClass;
    }

    public static ProcessGenerator init(final GeneratorConfig config) {
        return new ProcessGenerator(config, config.workerCount(), WorkerMain.class.getName());
    }

    public ProcessGenerator workerCount(final int workerCount) {
        return new ProcessGenerator(config, workerCount, workerMainClass);
    }

    // the class started in every child JVM, it must accept the arguments of WorkerMain
    ProcessGenerator workerMainClass(final String workerMainClass) {
        return new ProcessGenerator(config, workerCount, workerMainClass);
    }

    @Override
    public long writeCandidates(final Budget budget, final Sink sink, final ProgressReporter progress) throws IOException {
        final Sink sharedSink = Sinks.synchronizedSink(sink);
        final long[] quotas = Budget.quotas(config.maxCount(), workerCount);
        final String encodedConfig = ConfigCodec.encode(config);

        final List<Process> processes = new ArrayList<>();
        final ExecutorService executorService = Executors.newFixedThreadPool(workerCount);
        try {
            final CompletionService<Long> completion = new ExecutorCompletionService<>(executorService);
            int started = 0;
            for (int shardIndex = 0; shardIndex < workerCount; shardIndex++) {
                if (quotas[shardIndex] == 0) {
                    LOG.debug("Not starting shard [{}], its quota is 0", shardIndex);
                    continue;
                }
                final Process process = startWorker(shardIndex, quotas[shardIndex], encodedConfig);
                processes.add(process);

                final int index = shardIndex;
                completion.submit(() -> collectOutput(index, process, budget, sharedSink, progress));
                started++;
            }

            long written = 0;
            for (int i = 0; i < started; i++) {
                written += awaitNext(completion, budget, processes);
            }
            return written;
        } finally {
            // destroyed children close their stdout, which ends the reader threads
            processes.forEach(Process::destroyForcibly);
            Workers.stop(executorService);
        }
    }

    private Process startWorker(final int shardIndex, final long quota, final String encodedConfig) throws IOException {
        final List<String> command = new ArrayList<>();
        command.add(HostUtils.javaExecutable().toString());
        final String logLevel = System.getProperty("LOG_LEVEL");
        if (logLevel != null) {
            command.add("-DLOG_LEVEL=" + logLevel);
        }
        command.add("-cp");
        command.add(HostUtils.classPath());
        command.add(workerMainClass);
        command.add("--shard=" + shardIndex);
        command.add("--shard_count=" + workerCount);
        command.add("--quota=" + quota);

        LOG.debug("Starting worker process for shard [{}/{}], quota {}", shardIndex, workerCount, quota);
        final Process process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();

        try (final OutputStream input = process.getOutputStream()) {
            input.write(encodedConfig.getBytes(UTF_8));
        }
        return process;
    }

    private long collectOutput(final int shardIndex, final Process process, final Budget budget, final Sink sharedSink, final ProgressReporter progress) throws IOException, InterruptedException {
        long written = 0;
        try (final BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), UTF_8));
             final BatchingSink output = new BatchingSink(sharedSink, progress)) {
            while (true) {
                final String line = readLine(shardIndex, reader);
                if (line == null) {
                    break;
                }
                if (!budget.tryAcquire()) {
                    LOG.debug("Stopping worker process for shard [{}], budget exhausted", shardIndex);
                    process.destroy();
                    return written;
                }
                output.writeLine(line);
                written++;
            }
        }

        final int exitCode = process.waitFor();
        if (exitCode != 0) {
            throw new WorkerException(shardIndex, "worker process exited with status %d".formatted(exitCode));
        }
        LOG.debug("Finished shard [{}], {} lines", shardIndex, written);
        return written;
    }

    // a broken pipe from the child is a worker failure, not a sink failure
    private static String readLine(final int shardIndex, final BufferedReader reader) {
        try {
            return reader.readLine();
        } catch (final IOException e) {
            throw new WorkerException(shardIndex, e);
        }
    }

    private static long awaitNext(final CompletionService<Long> completion, final Budget budget, final List<Process> processes) throws IOException {
        try {
            return completion.take().get();
        } catch (final InterruptedException e) {
            budget.cancel();
            processes.forEach(Process::destroyForcibly);
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        } catch (final ExecutionException e) {
            budget.cancel();
            processes.forEach(Process::destroyForcibly);
            final Throwable cause = e.getCause();
            LOG.error("Worker process failed, stopping all workers", cause);
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
