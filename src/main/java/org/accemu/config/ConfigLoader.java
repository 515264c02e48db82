package org.accemu.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Demulator.trace-execution=true)
     * 2. Environment Variables
     * 3. Configuration file (filesystem path first, then classpath resource)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param path Path of the configuration file, as a filesystem path or classpath resource name.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String path) {
        final Config fileConfig = parseFile(path);
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }

    /**
     * Loads the configuration without a file layer: system properties, environment
     * variables and reference.conf.
     *
     * @return A resolved {@link Config} object.
     */
    public static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }

    private static Config parseFile(final String path) {
        final File file = new File(path);
        final Config fileConfig;
        if (file.isFile()) {
            LOG.info("Loading configuration from file: {}", file.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(file);
        } else {
            fileConfig = ConfigFactory.parseResources(path);
        }

        if (fileConfig.isEmpty()) {
            LOG.warn("Configuration file '{}' not found or is empty. Using defaults.", path);
        }
        return fileConfig;
    }
}
