package nl.nfi.djwordlist.generate;

import nl.nfi.djwordlist.common.logger.LogLevel;
import nl.nfi.djwordlist.generate.config.ConfigException;
import nl.nfi.djwordlist.generate.config.ConfigParsers;
import nl.nfi.djwordlist.generate.config.ExecutionMode;
import nl.nfi.djwordlist.generate.config.GeneratorConfig;
import nl.nfi.djwordlist.generate.stream.Budget;
import nl.nfi.djwordlist.generate.stream.LoggingProgressReporter;
import nl.nfi.djwordlist.generate.stream.ProgressReporter;
import nl.nfi.djwordlist.generate.stream.Sink;
import nl.nfi.djwordlist.generate.stream.Sinks;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import static java.nio.charset.StandardCharsets.UTF_8;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

@Command(
        name = "wordlist_generator",
        description = "Generate password variations from simple words by combining them with masks, "
                + "case/leet variants, numbers/symbols/years, and filters. Streams output to file/stdout.",
        footer = {
                "",
                "Mask placeholders: {base} {Base} {BASE} {camel} {num} {sym} {year}",
                "Years: CSV of items like 1990-1995, 2020 or last:5 (the last 5 years, newest first)",
        }
)
public class WordlistGeneratorCli implements Callable<Integer> {

    @Option(names = {"-w", "--word"}, description = "Base word(s), comma separated. Use '-' to read from STDIN (one word per line)")
    private String words;

    @Option(names = {"--word-file"}, description = "File with base words (one per line), combined with -w if both are given")
    private String wordFile;

    @Option(names = {"-o", "--output"}, description = "Output file path, gzip compressed when ending in .gz. If omitted, no file is written")
    private String outputPath;

    @Option(names = {"-s", "--show"}, description = "Print generated passwords to stdout")
    private boolean show = false;

    @Option(names = {"--force"}, description = "Overwrite the output file if it exists")
    private boolean force = false;

    @Option(names = {"--progress"}, description = "Periodically log the number of lines written")
    private boolean progress = false;

    @Option(names = {"--joiners"}, description = "Join strings between words as CSV, an empty element means no joiner (default: \"${DEFAULT-VALUE}\")")
    private String joiners = GeneratorConfig.DEFAULT_JOINERS;

    @Option(names = {"--cases"}, description = "Case variants as CSV, any of: original,lower,upper,title,invert")
    private String cases = GeneratorConfig.DEFAULT_CASES;

    @Option(names = {"--numbers"}, description = "Numbers to try as CSV, an empty element means none (default: ${DEFAULT-VALUE})")
    private String numbers = GeneratorConfig.DEFAULT_NUMBERS;

    @Option(names = {"--symbols"}, description = "Symbols to try as CSV, an empty element means none (default: ${DEFAULT-VALUE})")
    private String symbols = GeneratorConfig.DEFAULT_SYMBOLS;

    @Option(names = {"--years"}, description = "Years as CSV of items like 1990-1995, 2020 or last:5. Empty means none")
    private String years = "";

    @Option(names = {"--mask"}, description = "Mask using placeholders, may be repeated. If omitted, a default set is used")
    private List<String> masks = new ArrayList<>();

    @Option(names = {"--max-permutation-length"}, description = "Max number of words to combine per candidate (default: all words)")
    private int maxPermutationLength = 0;

    @Option(names = {"--leet"}, description = "Leet map as semicolon separated items like a=@,4;s=$,5. Empty to disable (default: ${DEFAULT-VALUE})")
    private String leet = GeneratorConfig.DEFAULT_LEET;

    @Option(names = {"--leet-max-expansions"}, description = "Max number of simultaneous leet substitutions per variant (default: ${DEFAULT-VALUE})")
    private int leetMaxExpansions = GeneratorConfig.DEFAULT_LEET_MAX_EXPANSIONS;

    @Option(names = {"--min-length"}, description = "Minimum password length (default: ${DEFAULT-VALUE})")
    private int minLength = GeneratorConfig.DEFAULT_MIN_LENGTH;

    @Option(names = {"--max-length"}, description = "Maximum password length (default: ${DEFAULT-VALUE})")
    private int maxLength = GeneratorConfig.DEFAULT_MAX_LENGTH;

    @Option(names = {"--min-entropy"}, description = "Minimum Shannon entropy, 0 to disable")
    private double minEntropy = 0.0;

    @Option(names = {"--blacklist"}, description = "File with passwords to exclude, one per line")
    private String blacklistPath;

    @Option(names = {"--max-count"}, description = "Stop after generating this many lines")
    private long maxCount = GeneratorConfig.UNLIMITED;

    @Option(names = {"-t", "--threads"}, description = "Number of workers (default: ${DEFAULT-VALUE})")
    private int workerCount = GeneratorConfig.DEFAULT_WORKER_COUNT;

    @Option(names = {"--processes"}, description = "Use processes instead of threads")
    private boolean processes = false;

    @Option(names = {"--log-level"}, description = "Valid values: ${COMPLETION-CANDIDATES} (case insensitive)", defaultValue = "info")
    private LogLevel logLevel;

    @Option(names = {"--log_directory_path"}, description = "Directory where to store live and archived log files")
    private String logPath;

    @Override
    public Integer call() throws Exception {
        // must happen before the first logger is created
        System.setProperty("LOG_LEVEL", logLevel.logbackLevel());
        if (logPath != null) {
            System.setProperty("LOG_DIRECTORY_PATH", logPath);
        }

        try {
            final GeneratorConfig config = buildConfig();
            final Budget budget = Budget.of(config.maxCount());
            final ProgressReporter reporter = progress ? LoggingProgressReporter.start() : ProgressReporter.noop();

            try (final AbortOnShutdown ignored = AbortOnShutdown.register(budget);
                 final Sink sink = openSink()) {
                WordlistGenerator.forConfig(config)
                        .progress(reporter)
                        .generate(sink, budget);
            }
        } catch (final ConfigException e) {
            LoggerFactory.getLogger(WordlistGeneratorCli.class).error("Invalid configuration: {}", e.getMessage());
            System.err.println("Invalid configuration: " + e.getMessage());
            return ExitCode.USAGE;
        } catch (final Throwable t) {
            LoggerFactory.getLogger(WordlistGeneratorCli.class).error("Fatal error", t);
            System.err.println("Fatal error: " + t.getMessage());
            return ExitCode.SOFTWARE;
        }

        return ExitCode.OK;
    }

    GeneratorConfig buildConfig() throws IOException {
        final List<String> loadedWords = WordSource.loadWords(words, wordFile == null ? null : Paths.get(wordFile), System.in);
        if (loadedWords.isEmpty()) {
            throw new ConfigException("No words provided. Use -w or --word-file.");
        }
        LoggerFactory.getLogger(WordlistGeneratorCli.class).info("Starting words: {}", loadedWords);

        return GeneratorConfig.builder()
                .words(loadedWords)
                .joiners(ConfigParsers.parseCsvAllowEmpty(joiners))
                .maxPermutationLength(maxPermutationLength)
                .masks(masks)
                .numbers(ConfigParsers.parseCsvAllowEmpty(numbers))
                .symbols(ConfigParsers.parseCsvAllowEmpty(symbols))
                .years(ConfigParsers.parseYears(years))
                .cases(ConfigParsers.parseCases(cases))
                .leetMap(ConfigParsers.parseLeet(leet))
                .leetMaxExpansions(leetMaxExpansions)
                .minLength(minLength)
                .maxLength(maxLength)
                .minEntropy(minEntropy)
                .blacklist(WordSource.loadBlacklist(blacklistPath == null ? null : Paths.get(blacklistPath)))
                .maxCount(maxCount)
                .workerCount(workerCount)
                .executionMode(processes ? ExecutionMode.PROCESSES : ExecutionMode.THREADS)
                .build();
    }

    private Sink openSink() throws IOException {
        final List<Sink> sinks = new ArrayList<>();
        if (show) {
            sinks.add(Sinks.console(new PrintStream(new BufferedOutputStream(new FileOutputStream(FileDescriptor.out), 1 << 16), false, UTF_8)));
        }
        if (outputPath != null) {
            final Path path = Paths.get(outputPath);
            sinks.add(Sinks.file(path, force));
        }
        if (sinks.isEmpty()) {
            return Sinks.discarding();
        }
        return Sinks.tee(sinks);
    }
}
