package nl.nfi.djwordlist.main;

import nl.nfi.djwordlist.generate.WordlistGeneratorCli;
import picocli.CommandLine;

public final class GeneratorMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new WordlistGeneratorCli()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        System.exit(exitCode);
    }
}
