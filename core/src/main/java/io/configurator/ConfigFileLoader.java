package io.configurator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.configurator.ConfigFileException.Reason;

/**
 * Reads the raw configuration file named by the context's configuration location variable.
 */
public class ConfigFileLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigFileLoader.class);
    private final ConfigContext context;

    public ConfigFileLoader(@NotNull final ConfigContext context) {
        this.context = context;
    }

    /**
     * @return the file contents
     * @throws ConfigFileException with {@link Reason#NO_PATH_CONFIGURED} if the variable is unset or empty,
     *         {@link Reason#FILE_UNAVAILABLE} if the file cannot be read
     */
    public byte[] load() throws ConfigFileException {
        final String variable = context.getConfigLocation();
        final String location = context.getEnvironment().get(variable);
        if (StringUtils.isEmpty(location)) {
            throw new ConfigFileException(Reason.NO_PATH_CONFIGURED, "no valid file path detected under environment variable " + variable);
        }
        try {
            final Path path = Paths.get(location);
            final byte[] contents = Files.readAllBytes(path);
            LOGGER.atDebug().addArgument(contents.length).addArgument(path).log("read {} bytes from configuration file '{}'");
            return contents;
        } catch (IOException | InvalidPathException e) {
            throw new ConfigFileException(Reason.FILE_UNAVAILABLE, "could not read configuration file '" + location + "'", e);
        }
    }
}
