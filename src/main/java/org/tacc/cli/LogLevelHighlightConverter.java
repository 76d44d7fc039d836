package org.tacc.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter coloring the wrapped pattern by log level, registered as {@code %levelcolor}
 * in {@code logback.xml}.
 *
 * <p>Colors:
 * <ul>
 *   <li>ERROR - Red</li>
 *   <li>WARN - Yellow</li>
 *   <li>INFO - Blue</li>
 *   <li>DEBUG/TRACE - Dim</li>
 * </ul>
 * Coloring is off when the {@code NO_COLOR} environment variable is set.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_BLUE = "\u001B[34m";
    private static final String ANSI_DIM = "\u001B[2m";

    private final boolean enabled;

    public LogLevelHighlightConverter() {
        this(System.getenv("NO_COLOR") == null);
    }

    LogLevelHighlightConverter(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    protected String transform(ILoggingEvent event, String in) {
        if (!enabled) {
            return in;
        }
        return colorFor(event.getLevel()) + in + ANSI_RESET;
    }

    static String colorFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.INFO_INT -> ANSI_BLUE;
            default -> ANSI_DIM;
        };
    }
}
