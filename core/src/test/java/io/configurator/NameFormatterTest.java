package io.configurator;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class NameFormatterTest {
    private final NameFormatter formatter = new NameFormatter(new ConfigContext());

    @ParameterizedTest
    @CsvSource({ "test, test", "TEST, test", "test_foo, test-foo", "CONFIGURATOR_foo_bar, foo-bar", "CONFIGURATOR_FOO_BAR, foo-bar", "configurator_env_foo, env-foo", "OTHER_FOO, other-foo", "CONFIGURATOR_, ''" })
    void testFormFlagName(final String key, final String expected) {
        assertEquals(expected, formatter.formFlagName(key));
    }

    @Test
    void testEdgeCases() {
        assertEquals("", formatter.formFlagName(""));
        assertEquals("", formatter.formFlagName(null));
        assertEquals("foo-configurator-bar", formatter.formFlagName("FOO_CONFIGURATOR_BAR"), "prefix is only removed at the start");
        assertEquals("--x", formatter.formFlagName("__X"));
    }

    @Test
    void testCustomPrefix() {
        final ConfigContext context = new ConfigContext("IMG_", new MapEnvironment());
        final NameFormatter imgFormatter = new NameFormatter(context);
        assertEquals("foo-bar-baz", imgFormatter.formFlagName("IMG_FOO_BAR_BAZ"));
        assertEquals("configurator-foo", imgFormatter.formFlagName("CONFIGURATOR_FOO"));
        assertEquals("foo", NameFormatter.formFlagName("img_", "IMG_FOO"));

        context.setEnvPrefix("APP_");
        assertEquals("foo", imgFormatter.formFlagName("APP_FOO"), "prefix is read from the context on each call");
    }
}
