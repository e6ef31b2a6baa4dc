package org.plcore.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiler-internal logging façade with integer verbosity levels over SLF4J.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE
 */
public final class CompilerLogger {

    /** Log level for errors. */
    public static final int ERROR = 0;
    /** Log level for warnings. */
    public static final int WARN  = 1;
    /** Log level for informational messages. */
    public static final int INFO  = 2;
    /** Log level for debug messages. */
    public static final int DEBUG = 3;
    /** Log level for trace messages. */
    public static final int TRACE = 4;
    private static volatile int level = INFO;

    private static final Logger logger = LoggerFactory.getLogger(CompilerLogger.class);

    private CompilerLogger() {}

    /**
     * Sets the logging verbosity level. Values outside ERROR..TRACE are clamped.
     * @param newLevel The new level to set.
     */
    public static void setLevel(int newLevel) { level = Math.max(ERROR, Math.min(TRACE, newLevel)); }

    /**
     * @return The current verbosity level.
     */
    public static int getLevel() { return level; }

    public static void error(String format, Object... args) {
        if (level >= ERROR) logger.error(format, args);
    }

    public static void warn(String format, Object... args) {
        if (level >= WARN) logger.warn(format, args);
    }

    public static void info(String format, Object... args) {
        if (level >= INFO) logger.info(format, args);
    }

    public static void debug(String format, Object... args) {
        if (level >= DEBUG) logger.debug(format, args);
    }

    public static void trace(String format, Object... args) {
        if (level >= TRACE && logger.isTraceEnabled()) logger.trace(format, args);
    }
}
