package io.configurator;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

import io.configurator.flags.FlagErrorPolicy;
import io.configurator.flags.FlagRegistry;

/**
 * Settings shared by all population passes of one application: environment prefix, name of the config-file
 * variable, environment source and the flag registry.
 *
 * <p> {@link #getDefault()} is the process-wide instance used by {@link Configurator#initializeConfig(Object, String...)}.
 * Modify it before the first population pass, it is not meant to be changed concurrently with one.
 */
public class ConfigContext {
    public static final String DEFAULT_ENV_PREFIX = "CONFIGURATOR_";
    public static final String CONFIG_LOCATION_SUFFIX = "CONFIG";
    private static final ConfigContext DEFAULT_CONTEXT = new ConfigContext();
    private final FlagRegistry flags;
    private String envPrefix;
    private String configLocation;
    private Environment environment;

    public ConfigContext() {
        this(DEFAULT_ENV_PREFIX, Environment.system());
    }

    public ConfigContext(@NotNull final String envPrefix, @NotNull final Environment environment) {
        this.envPrefix = Objects.requireNonNull(envPrefix, "envPrefix must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.configLocation = envPrefix + CONFIG_LOCATION_SUFFIX;
        this.flags = new FlagRegistry();
    }

    public static ConfigContext getDefault() {
        return DEFAULT_CONTEXT;
    }

    /**
     * @return name of the environment variable holding the configuration file path
     */
    public String getConfigLocation() {
        return configLocation;
    }

    public Environment getEnvironment() {
        return environment;
    }

    public String getEnvPrefix() {
        return envPrefix;
    }

    public FlagErrorPolicy getFlagErrorPolicy() {
        return flags.getErrorPolicy();
    }

    public FlagRegistry getFlags() {
        return flags;
    }

    public String getProgramName() {
        return flags.getProgramName();
    }

    /**
     * Re-derives the configuration file variable name from the current prefix (prefix + {@value #CONFIG_LOCATION_SUFFIX}).
     *
     * @return this context
     */
    public ConfigContext resetConfigLocation() {
        this.configLocation = envPrefix + CONFIG_LOCATION_SUFFIX;
        return this;
    }

    public ConfigContext setConfigLocation(@NotNull final String configLocation) {
        this.configLocation = Objects.requireNonNull(configLocation, "configLocation must not be null");
        return this;
    }

    public ConfigContext setEnvironment(@NotNull final Environment environment) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        return this;
    }

    /**
     * N.B. the configuration file variable name is not derived again, see {@link #resetConfigLocation()}.
     *
     * @param envPrefix prefix of all environment variable names, e.g. {@code "MYAPP_"}
     * @return this context
     */
    public ConfigContext setEnvPrefix(@NotNull final String envPrefix) {
        this.envPrefix = Objects.requireNonNull(envPrefix, "envPrefix must not be null");
        return this;
    }

    public ConfigContext setFlagErrorPolicy(@NotNull final FlagErrorPolicy policy) {
        flags.setErrorPolicy(policy);
        return this;
    }

    public ConfigContext setProgramName(@NotNull final String programName) {
        flags.setProgramName(programName);
        return this;
    }

    @Override
    public String toString() {
        return "ConfigContext{envPrefix='" + envPrefix + "', configLocation='" + configLocation + "', environment=" + environment + ", flags=" + flags.getFlags().keySet() + '}';
    }
}
