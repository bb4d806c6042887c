package nl.nfi.djwordlist.generate.stream;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Line oriented destination of accepted candidates. Any failure is fatal for the run.
 */
public interface Sink extends Closeable {

    void writeLine(final String line) throws IOException;

    default void writeLines(final List<String> lines) throws IOException {
        for (final String line : lines) {
            writeLine(line);
        }
    }

    void flush() throws IOException;
}
