package nl.nfi.djwordlist.common.logger;

public enum LogLevel {

    DEBUG("DEBUG"),
    INFO("INFO"),
    WARNING("WARN"),
    ERROR("ERROR");

    private final String logbackLevel;

    LogLevel(final String logbackLevel) {
        this.logbackLevel = logbackLevel;
    }

    public String logbackLevel() {
        return logbackLevel;
    }
}
