package nl.nfi.djwordlist.generate.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static java.nio.charset.StandardCharsets.UTF_8;

public final class Sinks {

    private static final Logger LOG = LoggerFactory.getLogger(Sinks.class);

    private static final int BUFFER_SIZE = 1 << 16;

    private Sinks() {
    }

    /**
     * Writes to the given stream, typically stdout. Closing the sink flushes, but does not close, the stream.
     */
    public static Sink console(final PrintStream output) {
        return new Sink() {
            @Override
            public void writeLine(final String line) {
                output.print(line);
                output.print('\n');
            }

            @Override
            public void writeLines(final List<String> lines) throws IOException {
                for (final String line : lines) {
                    writeLine(line);
                }
                // PrintStream swallows exceptions, so check once per batch
                if (output.checkError()) {
                    throw new IOException("Error writing to console");
                }
            }

            @Override
            public void flush() throws IOException {
                if (output.checkError()) {
                    throw new IOException("Error writing to console");
                }
            }

            @Override
            public void close() throws IOException {
                flush();
            }
        };
    }

    /**
     * Writes UTF-8 lines to the file at the given path, gzip compressed when the file name ends in
     * {@code .gz}. An existing file is only replaced when {@code force} is set.
     */
    public static Sink file(final Path path, final boolean force) throws IOException {
        if (Files.exists(path) && !force) {
            throw new FileAlreadyExistsException(path.toString(), null, "output file exists (use --force to overwrite)");
        }
        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        final boolean compress = path.getFileName().toString().endsWith(".gz");
        LOG.info("Writing {}: {}", compress ? "gzip" : "plain text", path);

        OutputStream output = new BufferedOutputStream(Files.newOutputStream(path), BUFFER_SIZE);
        if (compress) {
            output = new GZIPOutputStream(output, BUFFER_SIZE);
        }
        return writing(new BufferedWriter(new OutputStreamWriter(output, UTF_8), BUFFER_SIZE));
    }

    public static Sink writing(final Writer writer) {
        return new Sink() {
            @Override
            public void writeLine(final String line) throws IOException {
                writer.write(line);
                writer.write('\n');
            }

            @Override
            public void flush() throws IOException {
                writer.flush();
            }

            @Override
            public void close() throws IOException {
                writer.close();
            }
        };
    }

    /**
     * Writes every line to all given sinks, in order. Closing closes all of them, reporting the first failure.
     */
    public static Sink tee(final List<Sink> sinks) {
        if (sinks.size() == 1) {
            return sinks.get(0);
        }
        return new Sink() {
            @Override
            public void writeLine(final String line) throws IOException {
                for (final Sink sink : sinks) {
                    sink.writeLine(line);
                }
            }

            @Override
            public void writeLines(final List<String> lines) throws IOException {
                for (final Sink sink : sinks) {
                    sink.writeLines(lines);
                }
            }

            @Override
            public void flush() throws IOException {
                for (final Sink sink : sinks) {
                    sink.flush();
                }
            }

            @Override
            public void close() throws IOException {
                IOException failure = null;
                for (final Sink sink : sinks) {
                    try {
                        sink.close();
                    } catch (final IOException e) {
                        if (failure == null) {
                            failure = e;
                        } else {
                            failure.addSuppressed(e);
                        }
                    }
                }
                if (failure != null) {
                    throw failure;
                }
            }
        };
    }

    // used when neither an output file nor console output is requested, the run then only counts
    public static Sink discarding() {
        return new Sink() {
            @Override
            public void writeLine(final String line) {
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
    }

    /**
     * Guards the given sink with a lock, so that lines and batches of different workers never interleave.
     */
    public static Sink synchronizedSink(final Sink sink) {
        return new Sink() {
            @Override
            public synchronized void writeLine(final String line) throws IOException {
                sink.writeLine(line);
            }

            @Override
            public synchronized void writeLines(final List<String> lines) throws IOException {
                sink.writeLines(lines);
            }

            @Override
            public synchronized void flush() throws IOException {
                sink.flush();
            }

            @Override
            public synchronized void close() throws IOException {
                sink.close();
            }
        };
    }
}
