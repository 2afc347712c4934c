package io.configurator;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Populates a configuration object from, in increasing precedence: field defaults, the JSON file named by
 * {@code <prefix>CONFIG}, environment variables {@code <prefix><ENV>} and command-line flags.
 *
 * <pre>
 * public class AppConfig {
 *     &#64;Setting(value = "8080", file = "port", env = "PORT")
 *     public int port;
 * }
 *
 * final AppConfig config = new AppConfig();
 * Configurator.initializeConfig(config, args); // e.g. CONFIGURATOR_PORT=9090 or --port=9090
 * </pre>
 */
public class Configurator {
    private static final Logger LOGGER = LoggerFactory.getLogger(Configurator.class);
    private final ConfigContext context;
    private final DefaultApplier defaultApplier;
    private final ConfigFileMerger fileMerger;
    private final EnvironmentFlagBinder environmentFlagBinder;

    public Configurator() {
        this(ConfigContext.getDefault());
    }

    public Configurator(@NotNull final ConfigContext context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.defaultApplier = new DefaultApplier();
        this.fileMerger = new ConfigFileMerger(context);
        this.environmentFlagBinder = new EnvironmentFlagBinder(context);
    }

    public ConfigContext getContext() {
        return context;
    }

    /**
     * Runs one population pass. Flags are registered once per context, field values are re-applied on every pass.
     *
     * @param config the configuration object to populate
     * @param args command-line arguments, without the program name
     */
    public void initialize(@NotNull final Object config, @NotNull final String... args) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(args, "args must not be null");
        LOGGER.atDebug().addArgument(config.getClass().getName()).log("initialising configuration {}");

        defaultApplier.apply(config);
        final boolean fileApplied = fileMerger.setFromConfigFile(config); // optional, failures fall back to the defaults
        environmentFlagBinder.bind(config);
        context.getFlags().parse(args);

        LOGGER.atDebug().addArgument(config.getClass().getName()).addArgument(fileApplied).log("initialised configuration {} (configuration file applied: {})");
    }

    /**
     * {@link #initialize(Object, String...)} using {@link ConfigContext#getDefault()}.
     */
    public static void initializeConfig(@NotNull final Object config, @NotNull final String... args) {
        new Configurator(ConfigContext.getDefault()).initialize(config, args);
    }
}
