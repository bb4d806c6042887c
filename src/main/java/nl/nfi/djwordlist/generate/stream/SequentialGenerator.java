package nl.nfi.djwordlist.generate.stream;

import nl.nfi.djwordlist.generate.config.GeneratorConfig;

import java.io.IOException;

public final class SequentialGenerator implements CandidateGenerator {

    private final GeneratorConfig config;
    private final int shardIndex;
    private final int shardCount;

    private SequentialGenerator(final GeneratorConfig config, final int shardIndex, final int shardCount) {
        this.config = config;
        this.shardIndex = shardIndex;
        this.shardCount = shardCount;
    }

    public static SequentialGenerator init(final GeneratorConfig config) {
        return new SequentialGenerator(config, 0, 1);
    }

    // restricts generation to one shard, used by child processes
    public SequentialGenerator shard(final int shardIndex, final int shardCount) {
        return new SequentialGenerator(config, shardIndex, shardCount);
    }

    @Override
    public long writeCandidates(final Budget budget, final Sink sink, final ProgressReporter progress) throws IOException {
        try (final BatchingSink output = new BatchingSink(sink, progress)) {
            return CandidatePipeline.forShard(config, shardIndex, shardCount).drainTo(output, budget);
        }
    }
}
