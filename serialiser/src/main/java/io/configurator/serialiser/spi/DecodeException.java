package io.configurator.serialiser.spi;

/**
 * Signals a configuration document that is no valid JSON or does not fit the configuration class.
 */
public class DecodeException extends Exception {
    private static final long serialVersionUID = 2218035463201935762L;

    public DecodeException(final String message) {
        super(message);
    }

    public DecodeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
