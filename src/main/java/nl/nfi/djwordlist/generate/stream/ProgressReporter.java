package nl.nfi.djwordlist.generate.stream;

public interface ProgressReporter {

    // called after each batch of written lines, possibly from several threads
    void advance(final long lineCount);

    static ProgressReporter noop() {
        return lineCount -> {
        };
    }
}
