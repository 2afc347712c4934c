package io.configurator;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.jetbrains.annotations.NotNull;

/**
 * Mutable environment backed by a map, e.g. for embedding applications that assemble their own variable set.
 */
public class MapEnvironment implements Environment {
    private final Map<String, String> variables = new ConcurrentHashMap<>();

    public MapEnvironment() {
        // empty environment
    }

    public MapEnvironment(@NotNull final Map<String, String> variables) {
        this.variables.putAll(variables);
    }

    @Override
    public String get(@NotNull final String name) {
        return variables.get(name);
    }

    public MapEnvironment set(@NotNull final String name, @NotNull final String value) {
        variables.put(name, value);
        return this;
    }

    public MapEnvironment unset(@NotNull final String name) {
        variables.remove(name);
        return this;
    }

    @Override
    public String toString() {
        return MapEnvironment.class.getSimpleName() + variables.keySet();
    }
}
