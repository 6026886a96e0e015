package io.github.flameyossnowy.fluentsql.api.utils;

import org.jetbrains.annotations.ApiStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLogger;

import java.util.function.Supplier;

/**
 * Logging facade for query tracing.
 * <p>
 * Uses SLF4J when a binding is present and {@code java.util.logging} otherwise.
 * Errors and warnings are always written, query tracing only when {@link #ENABLED} is set
 * and parameter tracing only when {@link #DEEP} is set.
 */
@ApiStatus.Internal
public final class Logging {
    public static boolean ENABLED = false;
    public static boolean DEEP = false;

    private static final Logger LOGGER;
    private static final java.util.logging.Logger FALLBACK;

    static {
        Logger detected;
        try {
            Logger logger = LoggerFactory.getLogger("fluentsql");
            detected = logger instanceof NOPLogger ? null : logger;
        } catch (NoClassDefFoundError e) {
            detected = null;
        }
        LOGGER = detected;

        if (LOGGER == null) {
            FALLBACK = java.util.logging.Logger.getLogger("fluentsql");
        } else {
            FALLBACK = null;
        }
    }

    private Logging() {
    }

    /**
     * Logs an error message but does not require debugging to be enabled.
     * @param string the message
     */
    public static void error(String string) {
        if (LOGGER != null) LOGGER.error(string);
        else FALLBACK.severe(string);
    }

    /**
     * Logs an error message but does not require debugging to be enabled.
     * @param string the message
     * @param throwable the throwable that caused the error
     */
    public static void error(String string, Throwable throwable) {
        if (LOGGER != null) LOGGER.error(string, throwable);
        else FALLBACK.log(java.util.logging.Level.SEVERE, string, throwable);
    }

    /**
     * Logs a warning but does not require debugging to be enabled.
     * @param string the message
     */
    public static void warn(String string) {
        if (LOGGER != null) LOGGER.warn(string);
        else FALLBACK.warning(string);
    }

    /**
     * Logs an info message if {@link #ENABLED} is set.
     * @param string the message
     */
    public static void info(String string) {
        if (ENABLED) {
            if (LOGGER != null) LOGGER.info(string);
            else FALLBACK.info(string);
        }
    }

    /**
     * Logs an info message if {@link #ENABLED} is set, building it only then.
     * @param string the message supplier
     */
    public static void info(Supplier<String> string) {
        if (ENABLED) info(string.get());
    }

    /**
     * Logs an info message only if {@link #DEEP} is set.
     * The message is only built when it is going to be written.
     * @param string the message supplier
     */
    public static void deepInfo(Supplier<String> string) {
        if (DEEP) {
            if (LOGGER != null) LOGGER.info(string.get());
            else FALLBACK.info(string.get());
        }
    }
}
