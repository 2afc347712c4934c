package io.configurator;

import static org.junit.jupiter.api.Assertions.*;

import static io.configurator.TestConfig.resourcePath;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.configurator.flags.FlagErrorPolicy;
import io.configurator.serialiser.annotations.Setting;

class ConfiguratorTest {
    private MapEnvironment environment;
    private ConfigContext context;
    private Configurator configurator;
    private TestConfig config;

    @BeforeEach
    void init() {
        environment = new MapEnvironment().set("CONFIGURATOR_CONFIG", resourcePath("test/data/valid-config.json"));
        context = new ConfigContext(ConfigContext.DEFAULT_ENV_PREFIX, environment).setProgramName("configurator-test");
        configurator = new Configurator(context);
        config = new TestConfig();
    }

    @Test
    @DisplayName("without config file or environment variables: defaults")
    void testDefaults() {
        environment.unset("CONFIGURATOR_CONFIG");
        configurator.initialize(config);

        assertEquals("foo", config.foo);
        assertEquals(1234, config.bar);
        assertTrue(config.baz);
        assertEquals("test-foo", config.test.foo);
    }

    @Test
    @DisplayName("config file overrides defaults")
    void testConfigFile() {
        configurator.initialize(config);

        assertEquals("abcd", config.foo);
        assertEquals(1234, config.bar);
        assertTrue(config.baz);
        assertEquals("bcde", config.test.foo);
    }

    @Test
    @DisplayName("environment variables override config file")
    void testEnvironment() {
        environment.set("CONFIGURATOR_ENV_FOO", "foo").set("CONFIGURATOR_ENV_BAR", "1234").set("CONFIGURATOR_ENV_BAZ", "0");
        configurator.initialize(config);

        assertEquals("foo", config.foo);
        assertEquals(1234, config.bar);
        assertFalse(config.baz);
        assertEquals("bcde", config.test.foo);
    }

    @Test
    @DisplayName("command-line flags override environment variables")
    void testFlags() {
        environment.set("CONFIGURATOR_ENV_FOO", "env").set("CONFIGURATOR_ENV_BAZ", "0");
        configurator.initialize(config, "--env-foo=flag", "--env-test-foo", "flag-test", "input.txt");

        assertEquals("flag", config.foo);
        assertFalse(config.baz);
        assertEquals("flag-test", config.test.foo);
        assertEquals(List.of("input.txt"), context.getFlags().getArgs());
    }

    @Test
    void testBrokenSourcesFallBack() {
        environment.set("CONFIGURATOR_CONFIG", resourcePath("test/data/invalid-config.json")).set("CONFIGURATOR_ENV_BAR", "not-a-number");
        configurator.initialize(config, "--unknown-flag");

        assertEquals("foo", config.foo);
        assertEquals(1234, config.bar);
        assertTrue(config.baz);
        assertEquals("test-foo", config.test.foo);
    }

    @Test
    void testFlagErrorPolicy() {
        context.setFlagErrorPolicy(FlagErrorPolicy.THROW);
        assertThrows(IllegalArgumentException.class, () -> configurator.initialize(config, "--unknown-flag"));
        assertEquals("abcd", config.foo, "earlier stages have been applied");
    }

    @Test
    @DisplayName("unknown flags do not discard the valid ones")
    void testUnknownFlagKeepsValidFlags() {
        configurator.initialize(config, "--env-foo=flag", "--env-bar=99", "--typo");

        assertEquals("flag", config.foo);
        assertEquals(99, config.bar);
        assertEquals("bcde", config.test.foo);
    }

    @Test
    @DisplayName("final nested sections get defaults, environment and flags in place")
    void testFinalNestedSection() {
        environment.unset("CONFIGURATOR_CONFIG").set("CONFIGURATOR_INNER_X", "from-env");
        final FinalNestedConfig nested = new FinalNestedConfig();
        final FinalNestedConfig.Inner inner = nested.inner;
        configurator.initialize(nested);

        assertEquals("top", nested.top);
        assertEquals("from-env", nested.inner.x);
        assertNotNull(context.getFlags().lookup("inner-x"));

        configurator.initialize(nested, "--inner-x=flag");
        assertEquals("flag", nested.inner.x);
        assertSame(inner, nested.inner);
    }

    @Test
    void testDefaultWithUsageKeyword() {
        environment.unset("CONFIGURATOR_CONFIG");
        context.setFlagErrorPolicy(FlagErrorPolicy.THROW);
        final TextConfig text = new TextConfig();
        configurator.initialize(text, "--num=7");

        assertEquals(7, text.num);
        assertEquals("see usage: manual", text.text);
    }

    @Test
    @DisplayName("flag registration is idempotent, field values are re-applied on every pass")
    void testRepeatedPasses() {
        configurator.initialize(config);
        assertEquals(4, context.getFlags().getFlags().size());
        config.foo = "modified";

        configurator.initialize(config);
        assertEquals(4, context.getFlags().getFlags().size());
        assertEquals("abcd", config.foo);

        final TestConfig second = new TestConfig();
        configurator.initialize(second, "--env-bar=7");
        assertEquals(4, context.getFlags().getFlags().size());
        assertEquals(1234, second.bar);
        assertEquals(7, config.bar, "flags stay bound to the first registered configuration object");
    }

    @Test
    void testInvalidArguments() {
        assertThrows(NullPointerException.class, () -> configurator.initialize(null));
        assertThrows(IllegalArgumentException.class, () -> configurator.initialize("a string"));
        assertThrows(NullPointerException.class, () -> new Configurator(null));
    }

    @Test
    void testDefaultContext() {
        assertSame(ConfigContext.getDefault(), new Configurator().getContext());
        assertEquals(ConfigContext.DEFAULT_ENV_PREFIX, ConfigContext.getDefault().getEnvPrefix());
        assertEquals("CONFIGURATOR_CONFIG", ConfigContext.getDefault().getConfigLocation());
        assertEquals(FlagErrorPolicy.CONTINUE, ConfigContext.getDefault().getFlagErrorPolicy());

        final StandaloneConfig standalone = new StandaloneConfig();
        Configurator.initializeConfig(standalone);
        assertEquals("standalone", standalone.name);
        assertEquals(3, standalone.retries);
    }

    static class StandaloneConfig {
        @Setting(value = "standalone", env = "CONFIGURATOR_TEST_STANDALONE_NAME")
        String name;
        @Setting(value = "3")
        int retries;
    }

    static class FinalNestedConfig {
        @Setting(value = "top", env = "TOP")
        String top;
        final Inner inner = new Inner();

        static class Inner {
            @Setting(value = "inner-default", env = "INNER_X")
            String x;
        }
    }

    static class TextConfig {
        @Setting(value = "see usage: manual", env = "TEXT")
        String text;
        @Setting(value = "1", env = "NUM")
        int num;
    }
}
