package com.titiplex.engagement.core.store;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Base SQLite jetable et horloge figée au 15 juin 2025.
 */
public final class TestStores {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-15T10:00:00Z"), ZoneOffset.UTC);
    public static final LocalDate TODAY = LocalDate.now(CLOCK);
    public static final int YEAR = TODAY.getYear();

    private TestStores() {
    }

    public static SqliteRepository open(Path dir) {
        return new SqliteRepository(dir.toString(), "test.db", 5000);
    }
}
