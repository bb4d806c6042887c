package nl.nfi.djwordlist;

import nl.nfi.djwordlist.generate.config.CaseMode;
import nl.nfi.djwordlist.generate.config.GeneratorConfig;
import nl.nfi.djwordlist.generate.stream.Sink;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public final class Utils {

    /**
     * A small configuration without defaults that multiply the output: no leet, original case only.
     */
    public static GeneratorConfig.Builder smallConfig(final String... words) {
        return GeneratorConfig.builder()
                .words(List.of(words))
                .joiners(List.of(""))
                .masks(List.of("{base}{num}"))
                .numbers(List.of("1", "2"))
                .symbols(List.of("!"))
                .years(List.of(""))
                .cases(List.of(CaseMode.ORIGINAL))
                .leetMap(Map.of())
                .leetMaxExpansions(0)
                .minLength(0)
                .maxLength(64);
    }

    // enough output per shard to exercise sharding and caps
    public static GeneratorConfig.Builder richConfig() {
        return GeneratorConfig.builder()
                .words(List.of("red", "fox", "jumps"))
                .joiners(List.of("", "-"))
                .numbers(List.of("1", "12", "2025"))
                .symbols(List.of("!", "#"))
                .years(List.of("2020", ""))
                .leetMap(Map.of('e', List.of("3"), 'o', List.of("0")))
                .leetMaxExpansions(1)
                .minLength(4)
                .maxLength(32);
    }

    public static class CollectingSink implements Sink {

        private final List<String> lines = Collections.synchronizedList(new ArrayList<>());
        private boolean closed;

        @Override
        public void writeLine(final String line) {
            lines.add(line);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
            closed = true;
        }

        public List<String> lines() {
            synchronized (lines) {
                return new ArrayList<>(lines);
            }
        }

        public boolean isClosed() {
            return closed;
        }
    }

    public static final class FailingSink implements Sink {

        private final RuntimeException runtimeFailure;

        private FailingSink(final RuntimeException runtimeFailure) {
            this.runtimeFailure = runtimeFailure;
        }

        public static FailingSink withIOException() {
            return new FailingSink(null);
        }

        public static FailingSink with(final RuntimeException failure) {
            return new FailingSink(failure);
        }

        @Override
        public void writeLine(final String line) throws IOException {
            if (runtimeFailure != null) {
                throw runtimeFailure;
            }
            throw new IOException("No space left on device");
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    }
}
