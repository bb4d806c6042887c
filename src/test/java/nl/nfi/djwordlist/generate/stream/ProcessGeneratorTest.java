package nl.nfi.djwordlist.generate.stream;

import nl.nfi.djwordlist.Utils.CollectingSink;
import nl.nfi.djwordlist.Utils.FailingSink;
import nl.nfi.djwordlist.generate.config.ExecutionMode;
import nl.nfi.djwordlist.generate.config.GeneratorConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.util.List;

import static java.util.concurrent.TimeUnit.SECONDS;
import static nl.nfi.djwordlist.Utils.richConfig;
import static nl.nfi.djwordlist.Utils.smallConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

// starts real worker JVMs from the test class path
class ProcessGeneratorTest {

    @Test
    @Timeout(value = 120, unit = SECONDS)
    void workerProcessesProduceSameLinesAsSequentialRun() throws IOException {
        final GeneratorConfig config = smallConfig("alpha", "beta", "gamma")
                .masks(GeneratorConfig.DEFAULT_MASKS)
                .workerCount(2)
                .executionMode(ExecutionMode.PROCESSES)
                .build();
        final CollectingSink sequential = new CollectingSink();
        final CollectingSink processes = new CollectingSink();

        SequentialGenerator.init(config).writeCandidates(Budget.unlimited(), sequential, ProgressReporter.noop());
        final long written = ProcessGenerator.init(config).writeCandidates(Budget.unlimited(), processes, ProgressReporter.noop());

        assertThat(written).isEqualTo(sequential.lines().size());
        assertThat(processes.lines()).containsExactlyInAnyOrderElementsOf(sequential.lines());
    }

    @Test
    @Timeout(value = 120, unit = SECONDS)
    void quotasKeepTotalWithinCap() throws IOException {
        // quotas 2 and 1, both shards have more candidates than that
        final GeneratorConfig config = smallConfig("alpha", "beta")
                .maxCount(3)
                .workerCount(2)
                .executionMode(ExecutionMode.PROCESSES)
                .build();
        final CollectingSink sink = new CollectingSink();

        final long written = ProcessGenerator.init(config).writeCandidates(Budget.of(config.maxCount()), sink, ProgressReporter.noop());

        assertThat(written).isEqualTo(3);
        assertThat(sink.lines()).containsExactlyInAnyOrder("alpha1", "alpha2", "beta1");
    }

    @Test
    @Timeout(value = 120, unit = SECONDS)
    void failingWorkerProcessIsReported() {
        final GeneratorConfig config = smallConfig("alpha", "beta")
                .workerCount(2)
                .executionMode(ExecutionMode.PROCESSES)
                .build();
        final CollectingSink sink = new CollectingSink();

        assertThatThrownBy(() -> ProcessGenerator.init(config)
                .workerMainClass(ExitingWorkerMain.class.getName())
                .writeCandidates(Budget.unlimited(), sink, ProgressReporter.noop()))
                .isInstanceOf(WorkerException.class)
                .hasMessageContaining("exited with status 3")
                .satisfies(e -> assertThat(((WorkerException) e).shardIndex()).isBetween(0, 1));
    }

    @Test
    @Timeout(value = 120, unit = SECONDS)
    void sinkFailureDestroysAllWorkerProcesses() throws Exception {
        // far more output than fits in a pipe, children only end when destroyed
        final GeneratorConfig config = richConfig()
                .words(List.of("red", "fox", "jumps", "over", "the", "lazy", "dog"))
                .workerCount(3)
                .executionMode(ExecutionMode.PROCESSES)
                .build();

        assertThatThrownBy(() -> ProcessGenerator.init(config).writeCandidates(Budget.unlimited(), FailingSink.withIOException(), ProgressReporter.noop()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("No space left on device");

        for (final ProcessHandle child : ProcessHandle.current().children().toList()) {
            child.onExit().get(30, SECONDS);
            assertThat(child.isAlive()).isFalse();
        }
    }
}
