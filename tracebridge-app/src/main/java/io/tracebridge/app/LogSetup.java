package io.tracebridge.app;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.nio.file.Path;
import org.slf4j.LoggerFactory;

/**
 * Points the file appender at the state directory and applies the debug toggle.
 */
final class LogSetup {
    static final String LOG_DIR_PROPERTY = "tracebridge.logDir";
    private static final String BASE_LOGGER = "io.tracebridge";

    private LogSetup() {
    }

    /**
     * Must run before the first logger is requested so logback.xml sees the directory.
     */
    static void prepare(Path stateDir) {
        if (System.getProperty(LOG_DIR_PROPERTY) == null) {
            System.setProperty(LOG_DIR_PROPERTY, stateDir.toString());
        }
    }

    static void applyDebug(boolean debug) {
        if (!debug) {
            return;
        }
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            Logger logger = context.getLogger(BASE_LOGGER);
            logger.setLevel(Level.DEBUG);
        }
    }
}
