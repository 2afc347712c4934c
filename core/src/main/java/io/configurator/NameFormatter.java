package io.configurator;

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;

/**
 * Derives command-line flag names from environment variable names.
 *
 * <p> E.g. with prefix {@code IMG_}: {@code IMG_FOO_BAR_BAZ} yields {@code foo-bar-baz}.
 */
public class NameFormatter {
    private final ConfigContext context;

    public NameFormatter(@NotNull final ConfigContext context) {
        this.context = context;
    }

    /**
     * @param key environment variable name, usually including the prefix
     * @return key without the (case-insensitive) prefix, lower case, underscores replaced by hyphens
     */
    public String formFlagName(final String key) {
        return formFlagName(context.getEnvPrefix(), key);
    }

    public static String formFlagName(final String prefix, final String key) {
        final String name = StringUtils.removeStartIgnoreCase(StringUtils.upperCase(StringUtils.defaultString(key), Locale.ROOT), prefix);
        return StringUtils.lowerCase(StringUtils.replaceChars(name, '_', '-'), Locale.ROOT);
    }
}
