package nl.nfi.djwordlist.generate.stream;

import nl.nfi.djwordlist.Utils.CollectingSink;
import nl.nfi.djwordlist.generate.config.GeneratorConfig;
import nl.nfi.djwordlist.generate.filter.Entropy;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static nl.nfi.djwordlist.Utils.richConfig;
import static nl.nfi.djwordlist.Utils.smallConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidatePipelineTest {

    @Test
    void emitsCandidatesInPipelineOrder() {
        final GeneratorConfig config = smallConfig("red", "fox").build();

        assertThat(collect(CandidatePipeline.forAll(config)))
                .containsExactly("red1", "red2", "fox1", "fox2", "redfox1", "redfox2", "foxred1", "foxred2");
    }

    @Test
    void outputIsDeterministic() {
        final GeneratorConfig config = richConfig().build();
        assertThat(collect(CandidatePipeline.forAll(config))).isEqualTo(collect(CandidatePipeline.forAll(config)));
    }

    @Test
    void shardsSplitBaseStringsRoundRobin() {
        final GeneratorConfig config = smallConfig("red", "fox").build();

        assertThat(collect(CandidatePipeline.forShard(config, 0, 2))).containsExactly("red1", "red2", "redfox1", "redfox2");
        assertThat(collect(CandidatePipeline.forShard(config, 1, 2))).containsExactly("fox1", "fox2", "foxred1", "foxred2");
    }

    @Test
    void shardsTogetherCoverFullOutput() {
        final GeneratorConfig config = richConfig().build();

        final List<String> sharded = new ArrayList<>();
        for (int shard = 0; shard < 3; shard++) {
            sharded.addAll(collect(CandidatePipeline.forShard(config, shard, 3)));
        }
        assertThat(sharded).containsExactlyInAnyOrderElementsOf(collect(CandidatePipeline.forAll(config)));
    }

    @Test
    void moreShardsThanBaseStringsLeavesSomeEmpty() {
        final GeneratorConfig config = smallConfig("solo").build();
        assertThat(collect(CandidatePipeline.forShard(config, 1, 4))).isEmpty();
    }

    @Test
    void everyEmittedLineSatisfiesFilters() {
        final GeneratorConfig config = richConfig()
                .minLength(6)
                .maxLength(10)
                .minEntropy(2.5)
                .blacklist(Set.of("red1!", "Red12!", "fox12#"))
                .build();

        final List<String> lines = collect(CandidatePipeline.forAll(config));

        assertThat(lines).isNotEmpty();
        assertThat(lines).allSatisfy(line -> {
            assertThat(line.codePointCount(0, line.length())).isBetween(6, 10);
            assertThat(Entropy.shannon(line)).isGreaterThanOrEqualTo(2.5);
            assertThat(config.blacklist()).doesNotContain(line);
        });
    }

    @Test
    void drainStopsWhenBudgetRefuses() throws IOException {
        final CollectingSink sink = new CollectingSink();

        final long written = CandidatePipeline.forAll(richConfig().build()).drainTo(sink, Budget.of(5));

        assertThat(written).isEqualTo(5);
        assertThat(sink.lines()).hasSize(5);
    }

    @Test
    void cancelledBudgetWritesNothing() throws IOException {
        final CollectingSink sink = new CollectingSink();
        final Budget budget = Budget.unlimited();
        budget.cancel();

        assertThat(CandidatePipeline.forAll(richConfig().build()).drainTo(sink, budget)).isZero();
        assertThat(sink.lines()).isEmpty();
    }

    @Test
    void shardIndexMustBeInRange() {
        final GeneratorConfig config = smallConfig("red").build();
        assertThatThrownBy(() -> CandidatePipeline.forShard(config, 2, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    private static List<String> collect(final CandidatePipeline pipeline) {
        final List<String> lines = new ArrayList<>();
        pipeline.forEachRemaining(lines::add);
        return lines;
    }
}
