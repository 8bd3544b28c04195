package com.projectpulse.service.runtime;

import com.projectpulse.core.model.CycleType;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CycleLockTest {
    @Test
    void secondAcquireOfTheSameTypeIsRefusedUntilReleased() throws Exception {
        Path dir = Files.createTempDirectory("cycle-lock-");

        try (CycleLock held = CycleLock.tryAcquire(dir, CycleType.DAILY).orElseThrow()) {
            assertEquals(dir.resolve("daily.lock"), held.file());
            assertTrue(CycleLock.tryAcquire(dir, CycleType.DAILY).isEmpty());
        }

        Optional<CycleLock> again = CycleLock.tryAcquire(dir, CycleType.DAILY);
        assertTrue(again.isPresent());
        again.get().close();
    }

    @Test
    void differentCycleTypesDoNotBlockEachOther() throws Exception {
        Path dir = Files.createTempDirectory("cycle-lock-types-").resolve("state");

        try (CycleLock daily = CycleLock.tryAcquire(dir, CycleType.DAILY).orElseThrow();
             CycleLock weekly = CycleLock.tryAcquire(dir, CycleType.WEEKLY).orElseThrow()) {
            assertTrue(Files.exists(daily.file()));
            assertTrue(Files.exists(weekly.file()));
        }
    }
}
