package io.configurator;

import java.util.Map;

import org.jetbrains.annotations.NotNull;

/**
 * Read access to environment variables by name.
 */
@FunctionalInterface
public interface Environment {
    /**
     * @param name variable name
     * @return the variable value or {@code null} if the variable is not set
     */
    String get(@NotNull String name);

    /**
     * @return the process environment as seen by {@link System#getenv(String)}
     */
    static Environment system() {
        return System::getenv;
    }

    /**
     * @param variables initial variables
     * @return a mutable, map-backed environment
     */
    static MapEnvironment of(@NotNull final Map<String, String> variables) {
        return new MapEnvironment(variables);
    }
}
