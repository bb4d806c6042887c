package nl.nfi.djwordlist.generate;

import nl.nfi.djwordlist.generate.config.GeneratorConfig;
import nl.nfi.djwordlist.generate.stream.Budget;
import nl.nfi.djwordlist.generate.stream.ProgressReporter;
import nl.nfi.djwordlist.generate.stream.SequentialGenerator;
import nl.nfi.djwordlist.generate.stream.Sink;
import nl.nfi.djwordlist.generate.stream.Sinks;
import nl.nfi.djwordlist.serialize.ConfigCodec;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.util.concurrent.Callable;

import static java.nio.charset.StandardCharsets.UTF_8;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

/**
 * Child process side of isolated-memory execution: reads the encoded configuration from stdin and writes
 * the candidates of one shard, at most its quota, to stdout.
 */
@Command(name = "wordlist_worker", hidden = true)
public class ShardWorkerCli implements Callable<Integer> {

    @Option(names = {"--shard"}, description = "Index of the shard to generate", required = true)
    private int shardIndex;

    @Option(names = {"--shard_count"}, description = "Total number of shards", required = true)
    private int shardCount;

    @Option(names = {"--quota"}, description = "Write at most <quota> lines")
    private long quota = GeneratorConfig.UNLIMITED;

    @Override
    public Integer call() throws Exception {
        try {
            final GeneratorConfig config = ConfigCodec.decode(new String(System.in.readAllBytes(), UTF_8));

            final PrintStream stdout = new PrintStream(new BufferedOutputStream(new FileOutputStream(FileDescriptor.out), 1 << 16), false, UTF_8);
            try (final Sink sink = Sinks.console(stdout)) {
                SequentialGenerator.init(config)
                        .shard(shardIndex, shardCount)
                        .writeCandidates(Budget.of(quota), sink, ProgressReporter.noop());
            }
            stdout.flush();
        } catch (final Throwable t) {
            LoggerFactory.getLogger(ShardWorkerCli.class).error("Fatal error in worker for shard [{}]", shardIndex, t);
            return ExitCode.SOFTWARE;
        }
        return ExitCode.OK;
    }
}
