package io.configurator.serialiser.utils;

import java.util.Set;

import org.jetbrains.annotations.NotNull;

import io.configurator.serialiser.spi.ConfigFieldDescription;

/**
 * Converts string literals (defaults, environment values, flag arguments) to configuration field values.
 */
public final class ValueParser {
    private static final Set<String> TRUE_TOKENS = Set.of("1", "t", "T", "TRUE", "true", "True");
    private static final Set<String> FALSE_TOKENS = Set.of("0", "f", "F", "FALSE", "false", "False");

    private ValueParser() {
        // utility class
    }

    /**
     * @param token one of {@code 1 t T TRUE true True 0 f F FALSE false False}
     * @return the parsed boolean
     * @throws IllegalArgumentException for any other token
     */
    public static boolean parseBoolean(final String token) {
        if (TRUE_TOKENS.contains(token)) {
            return true;
        }
        if (FALSE_TOKENS.contains(token)) {
            return false;
        }
        throw new IllegalArgumentException("invalid boolean value '" + token + "'");
    }

    /**
     * @param token base-10 number with optional sign
     * @param longType {@code true} for {@code long} range, {@code false} for {@code int} range
     * @return {@link Long} or {@link Integer} depending on {@code longType}
     * @throws NumberFormatException if the token is no number or exceeds the range
     */
    public static Number parseInteger(final String token, final boolean longType) {
        if (longType) {
            return Long.parseLong(token, 10);
        }
        return Integer.parseInt(token, 10);
    }

    /**
     * @param field target field description, determines kind and width
     * @param token literal to convert
     * @return value assignable to the field
     * @throws IllegalArgumentException if the literal cannot be converted ({@link NumberFormatException} for integers)
     */
    public static Object parse(@NotNull final ConfigFieldDescription field, @NotNull final String token) {
        switch (field.getKind()) {
        case BOOLEAN:
            return parseBoolean(token);
        case INTEGER:
            return parseInteger(token, field.isLongType());
        case STRING:
            return token;
        default:
            throw new IllegalArgumentException("field kind " + field.getKind() + " of " + field.getFieldNameRelative() + " holds no single value");
        }
    }

    /**
     * @param field target field description
     * @return the zero value of the field's kind ({@code false}, {@code 0}, {@code ""})
     */
    public static Object zeroValue(@NotNull final ConfigFieldDescription field) {
        switch (field.getKind()) {
        case BOOLEAN:
            return Boolean.FALSE;
        case INTEGER:
            return field.isLongType() ? (Object) 0L : (Object) 0;
        case STRING:
            return "";
        default:
            throw new IllegalArgumentException("field kind " + field.getKind() + " of " + field.getFieldNameRelative() + " has no zero value");
        }
    }
}
