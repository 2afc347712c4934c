package io.configurator;

import org.jetbrains.annotations.NotNull;

/**
 * Signals that the configuration file stage could not be applied.
 */
public class ConfigFileException extends Exception {
    private static final long serialVersionUID = 4275630513347729251L;
    private final Reason reason;

    public enum Reason {
        /** the configuration location variable is unset or empty */
        NO_PATH_CONFIGURED,
        /** the configured file could not be read */
        FILE_UNAVAILABLE,
        /** the file contents are no valid JSON or do not match the configuration object */
        DECODE_FAILURE
    }

    public ConfigFileException(@NotNull final Reason reason, final String message) {
        super(message);
        this.reason = reason;
    }

    public ConfigFileException(@NotNull final Reason reason, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
