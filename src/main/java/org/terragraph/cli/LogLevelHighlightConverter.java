package org.terragraph.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colors the wrapped pattern by log level: red for ERROR, yellow for WARN, cyan for DEBUG and TRACE.
 * INFO is left uncolored so that it reads like the tool output it is interleaved with.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_CYAN = "\u001B[36m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String color = colorOf(event.getLevel());
        return color == null ? in : color + in + ANSI_RESET;
    }

    static String colorOf(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.DEBUG_INT, Level.TRACE_INT -> ANSI_CYAN;
            default -> null;
        };
    }
}
