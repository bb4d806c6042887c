package nl.nfi.djwordlist.generate.mask;

import java.util.Optional;

public enum Placeholder {

    BASE("base"),
    CAPITALIZED("Base"),
    UPPER("BASE"),
    CAMEL("camel"),
    NUMBER("num"),
    SYMBOL("sym"),
    YEAR("year");

    // the name between the braces, e.g. "Base" for {Base}
    private final String token;

    Placeholder(final String token) {
        this.token = token;
    }

    public static Optional<Placeholder> forToken(final String token) {
        for (final Placeholder placeholder : values()) {
            if (placeholder.token.equals(token)) {
                return Optional.of(placeholder);
            }
        }
        return Optional.empty();
    }
}
