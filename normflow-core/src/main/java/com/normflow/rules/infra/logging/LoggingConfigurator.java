package com.normflow.rules.infra.logging;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Date;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Sets up {@code java.util.logging} for command-line runs.
 *
 * <p>An explicit {@code java.util.logging.config.file} is left alone. Otherwise the
 * {@code logging.properties} resource on the classpath is applied, and when there is none a
 * single console handler at INFO with a one-line format is installed.
 */
public final class LoggingConfigurator {
    private static final Logger logger = Logger.getLogger(LoggingConfigurator.class.getName());

    public static final String DEFAULT_RESOURCE = "logging.properties";
    static final String LINE_FORMAT = "[%1$tF %1$tT.%1$tL] [%2$-7s] %3$s - %4$s%n";

    private LoggingConfigurator() {
    }

    public static void configure() {
        configure(DEFAULT_RESOURCE);
    }

    /**
     * Applies the named classpath resource, falling back to the console default.
     *
     * @return true if the resource was found and applied
     */
    public static boolean configure(String resource) {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return false;
        }
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = LoggingConfigurator.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
                return true;
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read logging configuration " + resource + ", using console default", e);
        }
        installConsoleDefault();
        return false;
    }

    static void installConsoleDefault() {
        LogManager.getLogManager().reset();
        Logger rootLogger = Logger.getLogger("");
        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(Level.INFO);
        consoleHandler.setFormatter(new OneLineFormatter());
        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(Level.INFO);
    }

    /**
     * {@code [date time] [LEVEL] logger - message}, plus the stack trace when present.
     */
    public static class OneLineFormatter extends SimpleFormatter {
        @Override
        public String format(LogRecord record) {
            String line = String.format(LINE_FORMAT,
                    new Date(record.getMillis()), record.getLevel(),
                    record.getLoggerName(), formatMessage(record));
            if (record.getThrown() == null) {
                return line;
            }
            StringWriter trace = new StringWriter();
            record.getThrown().printStackTrace(new PrintWriter(trace));
            return line + trace;
        }
    }
}
