package com.titiplex.engagement.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path dir;

    @Test
    void testLastSweepIsReadBack() throws Exception {
        ConfigService config = new ConfigService(dir.toString());
        assertNull(config.lastSweep());

        SweepState state = new SweepState(LocalDate.of(2025, 6, 15), 4, 1);
        config.saveLastSweep(state);

        assertEquals(state, new ConfigService(dir.toString()).lastSweep());
        assertTrue(Files.readString(dir.resolve("config.json")).contains("\"2025-06-15\""));

        config.clear();
        assertNull(config.lastSweep());
    }

    @Test
    void testCorruptFileIsIgnored() throws Exception {
        Files.writeString(dir.resolve("config.json"), "{ pas du json");

        assertNull(new ConfigService(dir.toString()).lastSweep());
    }

    @Test
    void testSaveCreatesMissingDirectory() {
        Path nested = dir.resolve("a").resolve("b");
        ConfigService config = new ConfigService(nested.toString());

        config.saveLastSweep(new SweepState(LocalDate.of(2025, 1, 2), 0, 0));

        assertTrue(Files.exists(nested.resolve("config.json")));
    }
}
