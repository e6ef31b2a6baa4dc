package org.plcore.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the front-end configuration from its sources, in a fixed precedence order.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    /** The configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "plcore.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@value #CONFIG_FILE_NAME} as the optional user file.
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(CONFIG_FILE_NAME);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. System properties (e.g. -Dplcore.lexer.unique-start=100)
     * 3. The given configuration file, or a classpath resource of that name if no such file exists
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param fileName The path of the user configuration file.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String fileName) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final File configFile = new File(fileName);
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found, trying the classpath.", configFile.getPath());
            fileConfig = ConfigFactory.parseResources(fileName);
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        final Config combinedConfig = envConfig
            .withFallback(propertiesConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        return combinedConfig.resolve();
    }
}
