package org.plcore.compiler.frontend.lexer;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.plcore.compiler.api.Unique;
import org.plcore.compiler.diagnostics.CompilerLogger;

/**
 * Lexer options read from the {@code plcore.lexer} section of the configuration.
 *
 * @param uniqueStart The first handle new sessions allocate.
 * @param fileName The logical file name used for positions when none is given.
 * @param logLevel The {@link CompilerLogger} verbosity.
 */
public record LexerSettings(Unique uniqueStart, String fileName, int logLevel) {

    /** The configuration path of the lexer section. */
    public static final String PATH = "plcore.lexer";

    /**
     * Reads the settings from a resolved configuration.
     *
     * @param config The configuration, usually from {@link org.plcore.config.ConfigLoader}.
     * @return The lexer settings.
     * @throws ConfigException if a value is missing or out of range.
     */
    public static LexerSettings fromConfig(Config config) {
        Config lexer = config.getConfig(PATH);
        int start = lexer.getInt("unique-start");
        if (start < 0) {
            throw new ConfigException.BadValue(lexer.origin(), PATH + ".unique-start",
                    "must not be negative, was " + start);
        }
        int level = lexer.getInt("log-level");
        if (level < CompilerLogger.ERROR || level > CompilerLogger.TRACE) {
            throw new ConfigException.BadValue(lexer.origin(), PATH + ".log-level",
                    "must be between " + CompilerLogger.ERROR + " and " + CompilerLogger.TRACE + ", was " + level);
        }
        return new LexerSettings(new Unique(start), lexer.getString("file-name"), level);
    }

    /**
     * @return The settings from {@code reference.conf} alone.
     */
    public static LexerSettings defaults() {
        return fromConfig(ConfigFactory.parseResources("reference.conf").resolve());
    }
}
