package com.yoursp.filestorage.service.storage;

import com.yoursp.filestorage.service.storage.exception.FileKeyNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link StorageAdapter} for the mock and test profiles.
 * Records are copied on the way in and out.
 */
@Slf4j
@Service
@Profile({ "mock", "test" })
public class InMemoryStorageAdapter implements StorageAdapter {

    private final Map<String, FileRecord> files = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryStorageAdapter() {
        this(Clock.systemUTC());
    }

    public InMemoryStorageAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean save(FileRecord file) {
        FileRecord stored = file.copy();
        stored.setLastModified(clock.instant());
        files.put(file.getKey(), stored);
        file.setLastModified(stored.getLastModified());
        log.debug("Stored {} ({} bytes)", file.getKey(), file.size());
        return true;
    }

    @Override
    public FileRecord load(String key) {
        FileRecord stored = files.get(key);
        if (stored == null) {
            throw new FileKeyNotFoundException(key, "File not found: " + key);
        }
        return stored.copy();
    }

    @Override
    public FileRecord init(String key, boolean touch) {
        return new FileRecord(key, new byte[0]);
    }

    @Override
    public boolean delete(String key) {
        if (files.remove(key) == null) {
            throw new FileKeyNotFoundException(key, "File not found: " + key);
        }
        log.debug("Removed {}", key);
        return true;
    }

    public int size() {
        return files.size();
    }
}
