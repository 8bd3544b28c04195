package com.projectpulse.service.runtime;

import com.projectpulse.core.model.CycleType;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Advisory lock that keeps two processes from running the same cycle type at once. The lock file stays on disk;
 * only the OS lock on it matters.
 */
public final class CycleLock implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(CycleLock.class.getName());

    private final Path file;
    private final FileChannel channel;
    private final FileLock lock;

    private CycleLock(Path file, FileChannel channel, FileLock lock) {
        this.file = file;
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * @return the held lock, or empty when another process (or this one) holds it
     */
    public static Optional<CycleLock> tryAcquire(Path directory, CycleType cycleType) {
        Path file = directory.resolve(cycleType.name().toLowerCase(Locale.ROOT) + ".lock");
        FileChannel channel = null;
        try {
            Files.createDirectories(directory);
            channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
                return Optional.empty();
            }
            return Optional.of(new CycleLock(file, channel, lock));
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            return Optional.empty();
        } catch (IOException e) {
            closeQuietly(channel);
            throw new IllegalStateException("Failed acquiring cycle lock " + file, e);
        }
    }

    public Path file() {
        return file;
    }

    @Override
    public void close() {
        try {
            lock.release();
            channel.close();
        } catch (IOException e) {
            throw new IllegalStateException("Failed releasing cycle lock " + file, e);
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Failed closing unlocked cycle lock channel", e);
        }
    }
}
