package nl.nfi.djwordlist.generate.config;

public class ConfigException extends IllegalArgumentException {

    public ConfigException(final String message) {
        super(message);
    }

    public ConfigException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
