package com.projectpulse.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectpulse.core.store.InMemoryActivityStore;
import com.projectpulse.core.store.StoreSnapshot;
import com.projectpulse.core.store.StoreUnavailableException;
import com.projectpulse.core.util.JsonUtils;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Activity store kept in one JSON document that several processes may share. Every mutation reloads the document
 * and rewrites it while holding an exclusive lock on {@code <file>.lock}; the rewrite goes through a temporary file
 * and an atomic rename, so readers and a crash see either the old or the new state. Reads reload the document when
 * another writer changed it.
 */
public class JsonFileActivityStore extends InMemoryActivityStore {
    private static final Logger LOGGER = Logger.getLogger(JsonFileActivityStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    // file locks are held per JVM, so stores of one file inside a process queue here first
    private static final ConcurrentMap<Path, ReentrantLock> PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final Path file;
    private final Path lockFile;
    private final ReentrantLock processLock;
    private byte[] loaded;

    public JsonFileActivityStore(Path file) {
        super(StoreSnapshot.empty());
        this.file = file;
        this.lockFile = file.resolveSibling(file.getFileName() + ".lock");
        this.processLock = PROCESS_LOCKS.computeIfAbsent(file.toAbsolutePath().normalize(), key -> new ReentrantLock());
        refresh();
    }

    public Path file() {
        return file;
    }

    @Override
    protected <T> T access(boolean mutating, Supplier<T> operation) {
        if (!mutating) {
            refresh();
            return operation.get();
        }
        processLock.lock();
        try {
            createParentDirectories();
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                refresh();
                return operation.get();
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed locking activity store " + file, e);
        } finally {
            processLock.unlock();
        }
    }

    @Override
    protected void persist(StoreSnapshot snapshot) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            createParentDirectories();
            byte[] content = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot);
            Files.write(temp, content);
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            loaded = content;
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed writing activity store " + file, e);
        }
    }

    private void refresh() {
        byte[] content = readContent();
        if (Arrays.equals(content, loaded)) {
            return;
        }
        if (content == null) {
            replace(StoreSnapshot.empty());
        } else {
            try {
                StoreSnapshot snapshot = MAPPER.readValue(content, StoreSnapshot.class);
                replace(snapshot == null ? StoreSnapshot.empty() : snapshot);
            } catch (IOException e) {
                throw new StoreUnavailableException("Failed loading activity store " + file, e);
            }
            if (loaded != null) {
                LOGGER.fine(() -> "Reloaded activity store " + file + " after an outside change");
            }
        }
        loaded = content;
    }

    private byte[] readContent() {
        if (!Files.exists(file)) {
            return null;
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed loading activity store " + file, e);
        }
    }

    private void createParentDirectories() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
