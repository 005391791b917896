package org.terragraph.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the application configuration to Logback at runtime:
 * <pre>
 *   logging {
 *     level = WARN
 *     levels {
 *       "org.terragraph.engine" = INFO
 *     }
 *   }
 * </pre>
 */
public final class LoggingConfigurator {

    static final String ROOT_LEVEL = "logging.level";
    static final String LOGGER_LEVELS = "logging.levels";
    static final String BASE_PACKAGE = "org.terragraph";

    private LoggingConfigurator() {
    }

    /**
     * @throws com.typesafe.config.ConfigException if a level is not a string.
     */
    public static void configure(Config config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        if (config.hasPath(ROOT_LEVEL)) {
            setLevel(context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME), config.getString(ROOT_LEVEL));
        }
        if (config.hasPath(LOGGER_LEVELS)) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject(LOGGER_LEVELS).entrySet()) {
                setLevel(context.getLogger(entry.getKey()), String.valueOf(entry.getValue().unwrapped()));
            }
        }
    }

    /**
     * Lowers the level of the application's own loggers to DEBUG.
     */
    public static void enableDebug() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(BASE_PACKAGE).setLevel(Level.DEBUG);
    }

    private static void setLevel(Logger logger, String level) {
        // Level.toLevel falls back to DEBUG on unknown names
        Level parsed = Level.toLevel(level, null);
        if (parsed == null) {
            throw new IllegalArgumentException("Unknown log level '" + level + "' for logger " + logger.getName());
        }
        logger.setLevel(parsed);
    }
}
