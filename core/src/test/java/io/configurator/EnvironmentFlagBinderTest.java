package io.configurator;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import org.hamcrest.Matchers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.configurator.flags.Flag;
import io.configurator.serialiser.annotations.Setting;

class EnvironmentFlagBinderTest {
    private MapEnvironment environment;
    private ConfigContext context;
    private EnvironmentFlagBinder binder;

    @BeforeEach
    void init() {
        environment = new MapEnvironment() //
                              .set("CONFIGURATOR_ENV_FOO", "foo")
                              .set("CONFIGURATOR_ENV_BAR", "1234")
                              .set("CONFIGURATOR_ENV_BAZ", "1")
                              .set("CONFIGURATOR_ENV_TEST_FOO", "test-foo");
        context = new ConfigContext(ConfigContext.DEFAULT_ENV_PREFIX, environment);
        binder = new EnvironmentFlagBinder(context);
    }

    @Test
    void testEnvironmentValues() {
        final TestConfig config = new TestConfig();
        binder.bind(config);

        assertEquals("foo", config.foo);
        assertEquals(1234, config.bar);
        assertTrue(config.baz);
        assertEquals("test-foo", config.test.foo);
        assertNull(config.unsupported);
    }

    @Test
    void testFlagRegistration() {
        binder.bind(new TestConfig());

        assertNotNull(context.getFlags().lookup("env-foo"));
        assertNotNull(context.getFlags().lookup("env-bar"));
        assertNotNull(context.getFlags().lookup("env-baz"));
        assertNotNull(context.getFlags().lookup("env-test-foo"));
        assertNull(context.getFlags().lookup("doesnt-matter"), "unsupported fields get no flag");
        assertThat(context.getFlags().getFlags().keySet(), Matchers.contains("env-bar", "env-baz", "env-foo", "env-test-foo"));

        final Flag bar = context.getFlags().lookup("env-bar");
        assertEquals("1234", bar.getDefaultValue());
        assertEquals("--env-bar=<int>", bar.getOptionPattern());
        assertTrue(context.getFlags().lookup("env-baz").isBoolean());
        assertEquals("--env-baz", context.getFlags().lookup("env-baz").getOptionPattern());
        assertEquals("--env-foo=<string>", context.getFlags().lookup("env-foo").getOptionPattern());
    }

    @Test
    void testFlagsWithoutEnvironment() {
        environment = new MapEnvironment();
        context.setEnvironment(environment);
        final TestConfig config = new TestConfig();
        new DefaultApplier().apply(config);
        binder.bind(config);

        assertEquals("foo", config.foo);
        assertEquals(4, context.getFlags().getFlags().size(), "flags are registered whether or not the variable is set");
        assertEquals("foo", context.getFlags().lookup("env-foo").getDefaultValue());
        assertEquals("true", context.getFlags().lookup("env-baz").getDefaultValue());
    }

    @Test
    void testFirstRegistrationWins() {
        final TestConfig first = new TestConfig();
        binder.bind(first);
        final TestConfig second = new TestConfig();
        environment.set("CONFIGURATOR_ENV_FOO", "second");
        binder.bind(second);

        assertEquals(4, context.getFlags().getFlags().size());
        assertEquals("second", second.foo, "environment values are applied on every pass");
        assertEquals("foo", context.getFlags().lookup("env-foo").getDefaultValue());

        context.getFlags().lookup("env-foo").set("flag");
        assertEquals("flag", first.foo, "flag stays bound to the first configuration object");
        assertEquals("second", second.foo);
    }

    @Test
    void testInvalidEnvironmentValuesAreIgnored() {
        environment.set("CONFIGURATOR_ENV_BAR", "12x").set("CONFIGURATOR_ENV_BAZ", "yes").set("CONFIGURATOR_ENV_FOO", "");
        final TestConfig config = new TestConfig();
        config.foo = "kept";
        config.bar = 7;
        config.baz = true;
        binder.bind(config);

        assertEquals("kept", config.foo, "empty variables are treated as unset");
        assertEquals(7, config.bar);
        assertTrue(config.baz);
    }

    @Test
    void testKeysAreUpperCase() {
        final LowerCaseSuffix config = new LowerCaseSuffix();
        environment.set("CONFIGURATOR_LEVEL_NAME", "debug");
        binder.bind(config);
        assertEquals("debug", config.level);
        assertNotNull(context.getFlags().lookup("level-name"));
    }

    @Test
    void testCustomPrefix() {
        context.setEnvPrefix("IMG_");
        environment.set("IMG_ENV_FOO", "img");
        final TestConfig config = new TestConfig();
        binder.bind(config);
        assertEquals("img", config.foo);
        assertNotNull(context.getFlags().lookup("env-foo"));
    }

    @Test
    void testEmptySuffixGetsNoFlag() {
        final WithoutSuffix config = new WithoutSuffix();
        environment.set("CONFIGURATOR_", "value").set("CONFIGURATOR_VALUE", "value");
        binder.bind(config);
        assertNull(config.value);
        assertTrue(context.getFlags().getFlags().isEmpty());
    }

    static class LowerCaseSuffix {
        @Setting(env = "level_name")
        String level;
    }

    static class WithoutSuffix {
        @Setting(value = "default", file = "value")
        String value;
    }
}
