package io.configurator.flags;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

import io.configurator.serialiser.FieldKind;
import io.configurator.serialiser.spi.ConfigFieldDescription;
import io.configurator.serialiser.utils.ValueParser;

/**
 * Command-line flag bound to one field of one configuration object.
 */
public final class Flag {
    private final String name;
    private final ConfigFieldDescription field;
    private final Object fieldParent;
    private final String defaultValue;

    /**
     * @param name flag name without leading dashes, e.g. {@code env-foo}
     * @param field the bound field, must hold a single value
     * @param fieldParent the object holding the field, its current value becomes the flag's default
     */
    public Flag(@NotNull final String name, @NotNull final ConfigFieldDescription field, @NotNull final Object fieldParent) {
        if (!field.getKind().isValue()) {
            throw new IllegalArgumentException("flag '" + name + "' cannot be bound to " + field.getKind() + " field " + field.getFieldNameRelative());
        }
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.field = field;
        this.fieldParent = Objects.requireNonNull(fieldParent, "fieldParent must not be null");
        this.defaultValue = Objects.toString(field.getValue(fieldParent), "");
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public ConfigFieldDescription getField() {
        return field;
    }

    public String getName() {
        return name;
    }

    /**
     * @return docopt option pattern, e.g. {@code --env-bar=<int>} or {@code --env-baz} for switches
     */
    public String getOptionPattern() {
        switch (field.getKind()) {
        case BOOLEAN:
            return "--" + name;
        case INTEGER:
            return "--" + name + "=<int>";
        default:
            return "--" + name + "=<string>";
        }
    }

    public Object getValue() {
        return field.getValue(fieldParent);
    }

    public boolean isBoolean() {
        return field.getKind() == FieldKind.BOOLEAN;
    }

    /**
     * @param value command-line literal
     * @throws IllegalArgumentException if the literal cannot be parsed for the field kind, the field is left unchanged
     */
    public void set(@NotNull final String value) {
        field.setValue(fieldParent, ValueParser.parse(field, value));
    }

    @Override
    public String toString() {
        return "Flag{--" + name + " -> " + field.getFieldNameRelative() + ", default=" + defaultValue + '}';
    }
}
