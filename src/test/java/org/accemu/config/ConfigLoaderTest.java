package org.accemu.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.accemu.junit.extensions.logging.AllowLog;
import org.accemu.junit.extensions.logging.LogLevel;
import org.accemu.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. System Properties (highest priority)
 * 2. Environment Variables
 * 3. Configuration File
 * 4. Default reference configuration (lowest priority)
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("emulator.default-run-steps");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should load classpath configuration file on top of reference defaults")
    void load_shouldLoadClasspathFileWithDefaults() {
        Config config = ConfigLoader.load("org/accemu/config/test-config.conf");

        assertEquals("file-value", config.getString("test.value"));
        assertTrue(config.getBoolean("emulator.trace-execution"));
        assertEquals(16, config.getInt("emulator.default-run-steps"));
        // Not in the file, so it comes from reference.conf
        assertEquals("INFO", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("Should load configuration from a filesystem path")
    void load_shouldLoadFilesystemFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("accemu.conf");
        Files.writeString(file, "emulator.default-run-steps = 3\n", StandardCharsets.UTF_8);

        Config config = ConfigLoader.load(file.toString());

        assertEquals(3, config.getInt("emulator.default-run-steps"));
        assertFalse(config.getBoolean("emulator.trace-execution"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        System.setProperty("emulator.default-run-steps", "99");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load("org/accemu/config/test-config.conf");

        assertEquals("system-value", config.getString("test.value"));
        assertEquals(99, config.getInt("emulator.default-run-steps"));
        assertEquals("file-priority", config.getString("test.priority"));
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Configuration file 'non-existent-config.conf' not found or is empty. Using defaults.")
    @DisplayName("Should handle missing configuration file gracefully")
    void load_shouldHandleMissingConfigFile() {
        Config config = ConfigLoader.load("non-existent-config.conf");

        assertNotNull(config);
        assertEquals(256, config.getInt("emulator.default-run-steps"));
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Configuration file.*not found or is empty. Using defaults.")
    @DisplayName("Should handle empty configuration file")
    void load_shouldHandleEmptyConfigFile() {
        Config config = ConfigLoader.load("org/accemu/config/empty-config.conf");

        assertFalse(config.getBoolean("emulator.trace-execution"));
    }

    @Test
    @DisplayName("Defaults come from reference.conf")
    void loadDefaults_shouldUseReferenceConf() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals(EmulatorOptions.defaults(), EmulatorOptions.fromConfig(config));
    }
}
