package io.configurator.serialiser;

import java.util.Set;

import org.jetbrains.annotations.NotNull;

/**
 * Closed set of field kinds the configuration passes know how to populate.
 */
public enum FieldKind {
    BOOLEAN,
    INTEGER,
    STRING,
    RECORD,
    UNSUPPORTED;

    private static final Set<String> PLATFORM_PACKAGES = Set.of("java.", "javax.", "jdk.", "sun.", "com.sun.");

    /**
     * @param type declared field type
     * @return the kind a field of the given type is handled as
     */
    public static FieldKind fromClassType(@NotNull final Class<?> type) {
        if (type == boolean.class || type == Boolean.class) {
            return BOOLEAN;
        }
        if (type == int.class || type == Integer.class || type == long.class || type == Long.class) {
            return INTEGER;
        }
        if (type == String.class) {
            return STRING;
        }
        return isRecordType(type) ? RECORD : UNSUPPORTED;
    }

    /**
     * @return {@code true} for kinds that hold a single value (boolean, integer and string)
     */
    public boolean isValue() {
        return this == BOOLEAN || this == INTEGER || this == STRING;
    }

    private static boolean isRecordType(final Class<?> type) {
        if (type.isPrimitive() || type.isArray() || type.isEnum() || type.isInterface() || type.isAnnotation() || type.isRecord()) {
            return false;
        }
        if (java.lang.reflect.Modifier.isAbstract(type.getModifiers())) {
            return false;
        }
        final String name = type.getName();
        return PLATFORM_PACKAGES.stream().noneMatch(name::startsWith);
    }
}
