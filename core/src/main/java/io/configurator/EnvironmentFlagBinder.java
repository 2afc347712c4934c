package io.configurator;

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.configurator.flags.Flag;
import io.configurator.serialiser.FieldVisitor;
import io.configurator.serialiser.spi.ConfigFieldDescription;
import io.configurator.serialiser.utils.ValueParser;

/**
 * Overlays environment variables ({@code <prefix><ENV>}) onto a configuration object and registers one command-line
 * flag per field with an environment suffix.
 */
public class EnvironmentFlagBinder implements FieldVisitor {
    private static final Logger LOGGER = LoggerFactory.getLogger(EnvironmentFlagBinder.class);
    private final ConfigContext context;
    private final NameFormatter nameFormatter;

    public EnvironmentFlagBinder(@NotNull final ConfigContext context) {
        this.context = context;
        this.nameFormatter = new NameFormatter(context);
    }

    public void bind(@NotNull final Object config) {
        ConfigFieldDescription.of(config.getClass()).acceptChildren(this, config);
    }

    @Override
    public void visitBoolean(final ConfigFieldDescription field, final Object parent) {
        bindField(field, parent);
    }

    @Override
    public void visitInteger(final ConfigFieldDescription field, final Object parent) {
        bindField(field, parent);
    }

    @Override
    public void visitString(final ConfigFieldDescription field, final Object parent) {
        bindField(field, parent);
    }

    @Override
    public void visitRecord(final ConfigFieldDescription field, final Object parent) {
        final Object nested = field.getOrAllocate(parent);
        if (nested != null) {
            field.acceptChildren(this, nested);
        }
    }

    private void bindField(final ConfigFieldDescription field, final Object parent) {
        if (field.getEnvSuffix().isEmpty()) {
            return;
        }
        final String key = StringUtils.upperCase(context.getEnvPrefix() + field.getEnvSuffix(), Locale.ROOT);
        final String value = context.getEnvironment().get(key);
        if (StringUtils.isNotEmpty(value)) {
            try {
                field.setValue(parent, ValueParser.parse(field, value));
                LOGGER.atDebug().addArgument(field.getFieldNameRelative()).addArgument(key).log("set '{}' from environment variable {}");
            } catch (IllegalArgumentException e) { // NOPMD - unparsable values keep the current field value
                LOGGER.atWarn().addArgument(key).addArgument(value).addArgument(e.getMessage()).log("ignoring environment variable {}='{}': {}");
            }
        }

        final String flagName = nameFormatter.formFlagName(key);
        if (context.getFlags().lookup(flagName) == null && context.getFlags().register(new Flag(flagName, field, parent))) {
            LOGGER.atTrace().addArgument(flagName).addArgument(field.getFieldNameRelative()).log("registered flag --{} for '{}'");
        }
    }
}
