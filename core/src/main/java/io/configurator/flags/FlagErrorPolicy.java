package io.configurator.flags;

/**
 * Reaction of the {@link FlagRegistry} to unknown or malformed command-line arguments and to {@code --help}.
 */
public enum FlagErrorPolicy {
    /** log a warning and keep the current field values */
    CONTINUE,
    /** throw an {@link IllegalArgumentException} */
    THROW,
    /** print the usage and terminate the JVM (exit code 0 for help, 2 otherwise) */
    EXIT
}
