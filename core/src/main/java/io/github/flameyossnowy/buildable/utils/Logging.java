package io.github.flameyossnowy.buildable.utils;

import org.jetbrains.annotations.ApiStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLogger;

import java.util.logging.Level;

/**
 * Logging for programs built on buildable. Goes through SLF4J when a binding is present
 * and falls back to {@code java.util.logging} otherwise.
 */
@ApiStatus.Internal
public final class Logging {
    public static volatile boolean ENABLED = false;
    public static volatile boolean DEEP = false;

    private static final Logger LOGGER;
    private static final java.util.logging.Logger FALLBACK;

    static {
        Logger detected;
        try {
            Logger logger = LoggerFactory.getLogger("buildable");
            detected = logger instanceof NOPLogger ? null : logger;
        } catch (NoClassDefFoundError e) {
            detected = null;
        }
        LOGGER = detected;
        FALLBACK = LOGGER == null ? java.util.logging.Logger.getLogger("buildable") : null;
    }

    private Logging() {}

    /**
     * Logs an error whether or not logging is enabled.
     * @param message the message
     * @param throwable the cause
     */
    public static void error(String message, Throwable throwable) {
        if (LOGGER != null) LOGGER.error(message, throwable);
        else FALLBACK.log(Level.SEVERE, message, throwable);
    }

    /**
     * Logs an info message if {@link #ENABLED} is set.
     * @param message the message
     */
    public static void info(String message) {
        if (!ENABLED) return;
        if (LOGGER != null) LOGGER.info(message);
        else FALLBACK.info(message);
    }

    /**
     * Logs a trace of a produced value, only if {@link #DEEP} is set.
     * @param type the simple name of the produced type
     * @param value the produced value
     */
    public static void deepInfo(String type, Object value) {
        if (!DEEP) return;
        if (LOGGER != null) LOGGER.info("Produced {} = {}", type, value);
        else FALLBACK.info("Produced " + type + " = " + value);
    }
}
