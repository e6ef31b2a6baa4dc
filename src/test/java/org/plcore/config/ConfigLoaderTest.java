package org.plcore.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.plcore.junit.extensions.logging.ExpectLog;
import org.plcore.junit.extensions.logging.LogLevel;
import org.plcore.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. System properties over the configuration file
 * 2. Configuration file over reference.conf
 * 3. reference.conf for everything not overridden
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String FIXTURE = "org/plcore/config/test-config.conf";

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("plcore.lexer.unique-start");
        System.clearProperty("plcore.lexer.log-level");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Defaults come from reference.conf when no file is present")
    void load_shouldFallBackToReferenceDefaults() {
        Config config = ConfigLoader.load("does-not-exist.conf");

        assertEquals(0, config.getInt("plcore.lexer.unique-start"));
        assertEquals("<memory>", config.getString("plcore.lexer.file-name"));
        assertEquals(2, config.getInt("plcore.lexer.log-level"));
    }

    @Test
    @DisplayName("A classpath configuration overrides the defaults it names")
    void load_shouldOverlayClasspathConfigOnDefaults() {
        Config config = ConfigLoader.load(FIXTURE);

        assertEquals(100, config.getInt("plcore.lexer.unique-start"));
        assertEquals("fixture.plc", config.getString("plcore.lexer.file-name"));
        assertEquals(2, config.getInt("plcore.lexer.log-level"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("plcore.lexer.unique-start", "7");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(FIXTURE);

        assertEquals(7, config.getInt("plcore.lexer.unique-start"));
        assertEquals("fixture.plc", config.getString("plcore.lexer.file-name"));
    }

    @Test
    @DisplayName("A configuration file on disk is loaded and announced")
    @ExpectLog(level = LogLevel.INFO, loggerPattern = "org\\.plcore\\.config\\.ConfigLoader",
            messagePattern = "Loading configuration from file: .*custom\\.conf")
    void load_shouldReadFileFromDisk(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("custom.conf");
        Files.writeString(file, "plcore.lexer.log-level = 4\n");

        Config config = ConfigLoader.load(file.toString());

        assertEquals(4, config.getInt("plcore.lexer.log-level"));
        assertEquals(0, config.getInt("plcore.lexer.unique-start"));
    }
}
