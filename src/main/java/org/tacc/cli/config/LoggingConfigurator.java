package org.tacc.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies per-logger levels from the {@code logging.levels} configuration block to Logback.
 * <p>
 * Keys are logger names (quoted in HOCON when they contain dots), values are level names:
 * <pre>
 * logging.levels {
 *   "org.tacc" = "INFO"
 *   "org.tacc.compiler.frontend.lexer" = "DEBUG"
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final String LEVELS_PATH = "logging.levels";

    private LoggingConfigurator() {
    }

    /**
     * Applies the configured levels. Does nothing when the block is absent or Logback is not the
     * active SLF4J backend.
     *
     * @param config the resolved application configuration.
     */
    public static void configure(final Config config) {
        if (!config.hasPath(LEVELS_PATH)) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        for (Map.Entry<String, ConfigValue> entry : config.getObject(LEVELS_PATH).entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = String.valueOf(entry.getValue().unwrapped());
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                context.getLogger(LoggingConfigurator.class)
                        .warn("Ignoring unknown log level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            final String target = "root".equalsIgnoreCase(loggerName) ? Logger.ROOT_LOGGER_NAME : loggerName;
            context.getLogger(target).setLevel(level);
        }
    }
}
