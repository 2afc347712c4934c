package io.configurator;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.configurator.serialiser.FieldVisitor;
import io.configurator.serialiser.spi.ConfigFieldDescription;
import io.configurator.serialiser.utils.ValueParser;

/**
 * Writes the default literals declared via {@link io.configurator.serialiser.annotations.Setting#value()} into a
 * configuration object. Fields with an empty literal keep their current value, literals that cannot be parsed
 * yield the zero value of the field kind.
 */
public class DefaultApplier implements FieldVisitor {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultApplier.class);

    public void apply(@NotNull final Object config) {
        ConfigFieldDescription.of(config.getClass()).acceptChildren(this, config);
    }

    @Override
    public void visitBoolean(final ConfigFieldDescription field, final Object parent) {
        applyDefault(field, parent);
    }

    @Override
    public void visitInteger(final ConfigFieldDescription field, final Object parent) {
        applyDefault(field, parent);
    }

    @Override
    public void visitString(final ConfigFieldDescription field, final Object parent) {
        applyDefault(field, parent);
    }

    @Override
    public void visitRecord(final ConfigFieldDescription field, final Object parent) {
        final Object nested = field.getOrAllocate(parent);
        if (nested != null) {
            field.acceptChildren(this, nested);
        }
    }

    private void applyDefault(final ConfigFieldDescription field, final Object parent) {
        final String literal = field.getDefaultValue();
        if (literal.isEmpty()) {
            return;
        }
        Object value;
        try {
            value = ValueParser.parse(field, literal);
        } catch (IllegalArgumentException e) { // NOPMD - invalid defaults degrade to the zero value
            LOGGER.atWarn().addArgument(literal).addArgument(field.getFieldNameRelative()).addArgument(e.getMessage()).log("invalid default '{}' for '{}', using zero value: {}");
            value = ValueParser.zeroValue(field);
        }
        field.setValue(parent, value);
    }
}
