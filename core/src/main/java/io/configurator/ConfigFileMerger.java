package io.configurator;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.configurator.ConfigFileException.Reason;
import io.configurator.serialiser.spi.DecodeException;
import io.configurator.serialiser.spi.JsonFieldDecoder;

/**
 * Overlays the JSON configuration file onto a configuration object.
 */
public class ConfigFileMerger {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigFileMerger.class);
    private final ConfigFileLoader loader;
    private final JsonFieldDecoder decoder = new JsonFieldDecoder();

    public ConfigFileMerger(@NotNull final ConfigContext context) {
        this(new ConfigFileLoader(context));
    }

    public ConfigFileMerger(@NotNull final ConfigFileLoader loader) {
        this.loader = loader;
    }

    /**
     * Decodes {@code contents} into {@code config}. Either all matching fields are written or, on failure, none.
     *
     * @param contents JSON document
     * @param config object to update
     * @throws ConfigFileException with {@link Reason#DECODE_FAILURE} for malformed documents or mismatching value types
     */
    public void merge(@NotNull final byte[] contents, @NotNull final Object config) throws ConfigFileException {
        try {
            final int written = decoder.decode(contents, config);
            LOGGER.atDebug().addArgument(written).addArgument(config.getClass().getName()).log("configuration file set {} fields of {}");
        } catch (DecodeException e) {
            throw new ConfigFileException(Reason.DECODE_FAILURE, e.getMessage(), e);
        }
    }

    /**
     * Loads and merges the configuration file.
     *
     * @param config object to update
     * @return {@code true} if the file was read and merged, {@code false} if it is not configured, not readable or not decodable
     */
    public boolean setFromConfigFile(@NotNull final Object config) {
        try {
            merge(loader.load(), config);
            return true;
        } catch (ConfigFileException e) {
            LOGGER.atDebug().setCause(e.getCause()).addArgument(e.getReason()).addArgument(e.getMessage()).log("configuration file skipped ({}): {}");
            return false;
        }
    }
}
