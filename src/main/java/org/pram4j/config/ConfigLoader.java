package org.pram4j.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the simulation configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String DEFAULT_CONFIG_FILE_NAME = "pram.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using the default file name ({@code pram.conf} in the working directory).
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(DEFAULT_CONFIG_FILE_NAME);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. System Properties (e.g., -Dpram.simulation.autocompact=true)
     * 2. Configuration File (filesystem path, or classpath resource if no such file exists)
     * 3. Default values (from reference.conf on the classpath)
     *
     * @param configFile The configuration file to load.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String configFile) {
        final Config sysConfig = ConfigFactory.systemProperties();

        final Config fileConfig = parseConfigFile(configFile);
        if (fileConfig.isEmpty()) {
            LOG.warn("Configuration file '{}' not found or is empty. Using defaults.", configFile);
        } else {
            LOG.debug("Loaded configuration from '{}'", configFile);
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return sysConfig
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }

    private static Config parseConfigFile(final String configFile) {
        final File file = new File(configFile);
        if (file.isFile()) {
            return ConfigFactory.parseFile(file);
        }
        return ConfigFactory.parseResources(configFile);
    }
}
