package org.mapextract.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from configuration to the Logback context.
 * <p>
 * Reads {@code logging.level} for the root logger and {@code logging.loggers}, a map
 * of logger name to level, for individual loggers:
 * <pre>
 * logging {
 *   level = WARN
 *   loggers { "org.mapextract.api" = DEBUG }
 * }
 * </pre>
 * Unknown level names fall back to {@code DEBUG}, as {@link Level#toLevel(String)} does.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * @param config the resolved application configuration.
     */
    public static void configure(final Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.level")) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                .setLevel(Level.toLevel(config.getString("logging.level")));
        }
        if (config.hasPath("logging.loggers")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.loggers").entrySet()) {
                final Logger logger = context.getLogger(entry.getKey());
                logger.setLevel(Level.toLevel(String.valueOf(entry.getValue().unwrapped())));
            }
        }
    }

    /**
     * Sets the root level directly, used by the {@code --verbose} flag.
     */
    public static void setRootLevel(final Level level) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
    }
}
