package nl.nfi.djwordlist.generate.mask;

import nl.nfi.djwordlist.generate.config.ConfigException;

public final class InvalidMaskException extends ConfigException {

    private final String template;

    public InvalidMaskException(final String template, final String unknownToken) {
        super("Mask %s references unknown placeholder {%s}".formatted(template, unknownToken));
        this.template = template;
    }

    public String template() {
        return template;
    }
}
