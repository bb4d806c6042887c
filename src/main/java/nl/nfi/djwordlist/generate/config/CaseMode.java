package nl.nfi.djwordlist.generate.config;

import java.util.Locale;

public enum CaseMode {

    ORIGINAL,
    LOWER,
    UPPER,
    TITLE,
    INVERT;

    public String apply(final String value) {
        return switch (this) {
            case ORIGINAL -> value;
            case LOWER -> value.toLowerCase(Locale.ROOT);
            case UPPER -> value.toUpperCase(Locale.ROOT);
            case TITLE -> title(value);
            case INVERT -> invert(value);
        };
    }

    public static CaseMode parse(final String name) {
        for (final CaseMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name.trim())) {
                return mode;
            }
        }
        throw new ConfigException("Unknown case mode: %s".formatted(name));
    }

    // capitalizes every whitespace delimited word, lowering the rest of it
    private static String title(final String value) {
        final StringBuilder result = new StringBuilder(value.length());
        boolean startOfWord = true;
        for (int i = 0; i < value.length(); ) {
            final int codePoint = value.codePointAt(i);
            if (Character.isWhitespace(codePoint)) {
                result.appendCodePoint(codePoint);
                startOfWord = true;
            } else {
                result.appendCodePoint(startOfWord ? Character.toUpperCase(codePoint) : Character.toLowerCase(codePoint));
                startOfWord = false;
            }
            i += Character.charCount(codePoint);
        }
        return result.toString();
    }

    private static String invert(final String value) {
        final StringBuilder result = new StringBuilder(value.length());
        value.codePoints().forEach(codePoint -> {
            if (Character.isUpperCase(codePoint)) {
                result.appendCodePoint(Character.toLowerCase(codePoint));
            } else if (Character.isLowerCase(codePoint)) {
                result.appendCodePoint(Character.toUpperCase(codePoint));
            } else {
                result.appendCodePoint(codePoint);
            }
        });
        return result.toString();
    }
}
