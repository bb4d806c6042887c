package nl.nfi.djwordlist.main;

import nl.nfi.djwordlist.generate.ShardWorkerCli;
import picocli.CommandLine;

public final class WorkerMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new ShardWorkerCli()).execute(args);
        System.exit(exitCode);
    }
}
