package nl.nfi.djwordlist.generate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Loads the input words and the blacklist, once, before generation starts.
 */
public final class WordSource {

    private static final Logger LOG = LoggerFactory.getLogger(WordSource.class);

    public static final String STDIN = "-";

    private WordSource() {
    }

    /**
     * Collects words from a comma separated list (or stdin when it is {@code -}) followed by the lines of a
     * word file. Words are trimmed and NFKC normalized; blanks and repeated words are dropped.
     */
    public static List<String> loadWords(final String words, final Path wordFile, final InputStream stdin) throws IOException {
        final List<String> collected = new ArrayList<>();

        if (words != null) {
            if (words.equals(STDIN)) {
                LOG.info("Reading words from STDIN...");
                collected.addAll(readLines(stdin));
            } else {
                collected.addAll(List.of(words.split(",")));
            }
        }
        if (wordFile != null) {
            try (final InputStream input = Files.newInputStream(wordFile)) {
                collected.addAll(readLines(input));
            }
        }

        final Set<String> unique = new LinkedHashSet<>();
        for (final String word : collected) {
            final String normalized = normalize(word);
            if (!normalized.isEmpty()) {
                unique.add(normalized);
            }
        }
        return List.copyOf(unique);
    }

    /**
     * Reads a blacklist file, one entry per line. A missing or unreadable file is reported and results in an
     * empty blacklist.
     */
    public static Set<String> loadBlacklist(final Path path) {
        if (path == null) {
            return Set.of();
        }
        try (final InputStream input = Files.newInputStream(path)) {
            final Set<String> blacklist = new HashSet<>();
            for (final String line : readLines(input)) {
                final String entry = line.strip();
                if (!entry.isEmpty()) {
                    blacklist.add(entry);
                }
            }
            LOG.debug("Loaded {} blacklist entries from {}", blacklist.size(), path);
            return blacklist;
        } catch (final IOException e) {
            LOG.warn("Could not load blacklist '{}': {}", path, e.toString());
            return Set.of();
        }
    }

    static String normalize(final String word) {
        return Normalizer.normalize(word.strip(), Normalizer.Form.NFKC);
    }

    private static List<String> readLines(final InputStream input) throws IOException {
        final BufferedReader reader = new BufferedReader(new InputStreamReader(input, UTF_8));
        final List<String> lines = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            lines.add(line);
        }
        return lines;
    }
}
