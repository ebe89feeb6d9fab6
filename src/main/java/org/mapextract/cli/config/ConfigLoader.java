package org.mapextract.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.util.List;

/**
 * Configuration loader for the command line tool.
 * <p>
 * Composes HOCON configuration from several layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file ({@code --config}, {@code -Dconfig.file} or {@code config/mapextract.conf})</li>
 *   <li>Defaults from {@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved only after all layers are merged, so an override of a
 * referenced value reaches every place that refers to it.
 * <p>
 * The extraction settings live under {@value #ROOT}; {@link #keyPath(Config)} and
 * {@link #fieldSeparator(Config)} read and validate them for the commands.
 */
public final class ConfigLoader {

    /** Root path of all extraction settings, also the base name of the config file. */
    public static final String ROOT = "mapextract";
    public static final String KEY_PATH = ROOT + ".extraction.key-path";
    public static final String FIELD_SEPARATOR = ROOT + ".definitions.field-separator";

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = ROOT + ".conf";

    private ConfigLoader() {
    }

    /**
     * Message severity levels for configuration resolution feedback.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is being located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * @param level   the severity of the message.
         * @param message the human-readable description.
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Resolves configuration, taking the first file found in this order:
     * <ol>
     *   <li>the file passed via {@code --config}</li>
     *   <li>the file named by the {@code -Dconfig.file} JVM argument</li>
     *   <li>{@code config/mapextract.conf} relative to the working directory</li>
     * </ol>
     * Without any of them only the classpath defaults are used.
     *
     * @param explicitConfigFile config file from the CLI option, or {@code null}.
     * @param handler            callback for resolution progress messages.
     * @return the resolved {@link Config}.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: " + systemConfigFile);
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via -Dconfig.file: " + systemConfigFile);
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        handler.log(MessageLevel.INFO,
                "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME + "' found, using default configuration");
        return loadDefaults();
    }

    /**
     * Loads configuration from a file, merged with classpath defaults.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads configuration from classpath defaults only.
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Returns the configured key path of the province array.
     *
     * @throws ConfigException.BadValue if the path is empty or contains a blank key.
     */
    public static List<String> keyPath(final Config config) {
        final List<String> path = config.getStringList(KEY_PATH);
        if (path.isEmpty() || path.stream().anyMatch(String::isBlank)) {
            throw new ConfigException.BadValue(config.origin(), KEY_PATH,
                    "must be a non-empty list of non-blank keys, was " + path);
        }
        return path;
    }

    /**
     * Returns the configured field separator of definition records.
     *
     * @throws ConfigException.BadValue if the separator is empty.
     */
    public static String fieldSeparator(final Config config) {
        final String separator = config.getString(FIELD_SEPARATOR);
        if (separator.isEmpty()) {
            throw new ConfigException.BadValue(config.origin(), FIELD_SEPARATOR, "must not be empty");
        }
        return separator;
    }
}
