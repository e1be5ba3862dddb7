package com.nightscan.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldLetWorkingDirFileOverrideResourceValues() throws Exception {
        Files.writeString(tempDir.resolve("config.properties"),
                "scan.threads=9\nscoring.top_n=5\n", StandardCharsets.UTF_8);

        Config config = Config.load(tempDir);

        assertEquals(9, config.getInt("scan.threads"));
        assertEquals(5, config.getInt("scoring.top_n"));
        assertEquals("override", config.sourceOf("scan.threads"));
    }

    @Test
    void getters_shouldFallBackToDefaultsForMissingOrBlankValues() {
        Config config = Config.of(tempDir, Map.of("predict.threads", "  ", "scan.threads", "abc"));

        assertEquals(4, config.getInt("predict.threads"));
        assertEquals(7, config.getInt("scan.threads", 7));
        assertEquals(0.94, config.getDouble("regime.ewma.lambda"), 1e-12);
        assertEquals("default", config.sourceOf("regime.ewma.lambda"));
    }

    @Test
    void getRawString_shouldKeepExplicitBlank() {
        Config config = Config.of(tempDir, Map.of("regime.vol_symbol", ""));

        assertEquals("", config.getRawString("regime.vol_symbol"));
        assertEquals("^vix", config.getString("regime.vol_symbol"));
    }

    @Test
    void getPath_shouldResolveAgainstWorkingDir() {
        Config config = Config.of(tempDir, Map.of("report.dir", "out/reports"));

        assertEquals(tempDir.resolve("out/reports").normalize(), config.getPath("report.dir"));
    }

    @Test
    void getList_shouldSplitOnCommaAndSemicolon() {
        Config config = Config.of(tempDir, Map.of("notify.channels", "log; mail ,,"));

        assertEquals(List.of("log", "mail"), config.getList("notify.channels"));
    }

    @Test
    void getBoolean_shouldAcceptCommonTruthyForms() {
        Config config = Config.of(tempDir, Map.of("a", "yes", "b", "1", "c", "off"));

        assertTrue(config.getBoolean("a"));
        assertTrue(config.getBoolean("b"));
        assertFalse(config.getBoolean("c"));
        assertTrue(config.getBoolean("missing.key", true));
    }

    @Test
    void requireString_shouldThrowWhenMissing() {
        Config config = Config.of(tempDir, Map.of());

        assertThrows(IllegalArgumentException.class, () -> config.requireString("no.such.key"));
    }
}
