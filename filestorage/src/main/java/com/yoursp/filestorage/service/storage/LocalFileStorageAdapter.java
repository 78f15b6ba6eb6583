package com.yoursp.filestorage.service.storage;

import com.yoursp.filestorage.config.FileStorageProperties;
import com.yoursp.filestorage.service.storage.exception.FileKeyNotFoundException;
import com.yoursp.filestorage.service.storage.exception.StorageBackendException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;

/**
 * Local filesystem implementation of {@link StorageAdapter}.
 * Active for dev (default) and staging profiles only.
 * Each key is a path relative to the configured root directory.
 */
@Slf4j
@Service
@Profile({ "default", "staging" })
public class LocalFileStorageAdapter implements StorageAdapter {

    private final Path storageRoot;

    @Autowired
    public LocalFileStorageAdapter(FileStorageProperties properties) {
        this(Paths.get(properties.getLocal().getRoot()));
    }

    public LocalFileStorageAdapter(Path storageRoot) {
        this.storageRoot = storageRoot.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.storageRoot);
            log.info("LocalFileStorageAdapter initialized at {}", this.storageRoot);
        } catch (IOException e) {
            throw new StorageBackendException(null, "Failed to create local storage directory: " + this.storageRoot, e);
        }
    }

    @Override
    public boolean save(FileRecord file) {
        String key = file.getKey();
        byte[] content = file.getContent() == null ? new byte[0] : file.getContent();
        try {
            Path filePath = resolve(key);
            Files.createDirectories(filePath.getParent());
            Files.write(filePath, content);
            file.setLastModified(Files.getLastModifiedTime(filePath).toInstant());
            log.debug("Wrote {} ({} bytes)", key, content.length);
            return true;
        } catch (IOException e) {
            throw new StorageBackendException(key, "Failed to save file: " + key, e);
        }
    }

    @Override
    public FileRecord load(String key) {
        Path filePath = resolve(key);
        if (!Files.isRegularFile(filePath)) {
            throw new FileKeyNotFoundException(key, "File not found: " + key);
        }
        try {
            byte[] content = Files.readAllBytes(filePath);
            Instant lastModified = Files.getLastModifiedTime(filePath).toInstant();
            log.debug("Read {} ({} bytes)", key, content.length);
            return new FileRecord(key, content, lastModified);
        } catch (NoSuchFileException e) {
            throw new FileKeyNotFoundException(key, "File not found: " + key);
        } catch (IOException e) {
            throw new StorageBackendException(key, "Failed to load file: " + key, e);
        }
    }

    @Override
    public FileRecord init(String key, boolean touch) {
        // Fail fast on traversal before the caller fills in content
        resolve(key);
        return new FileRecord(key, new byte[0]);
    }

    @Override
    public boolean delete(String key) {
        Path filePath = resolve(key);
        if (!Files.isRegularFile(filePath)) {
            throw new FileKeyNotFoundException(key, "File not found: " + key);
        }
        try {
            boolean deleted = Files.deleteIfExists(filePath);
            if (!deleted) {
                throw new FileKeyNotFoundException(key, "File not found: " + key);
            }
            log.debug("Deleted {}", key);
            return true;
        } catch (IOException e) {
            throw new StorageBackendException(key, "Failed to delete file: " + key, e);
        }
    }

    public Path getStorageRoot() {
        return storageRoot;
    }

    private Path resolve(String key) {
        // Prevent path-traversal attacks
        Path resolved = storageRoot.resolve(key).normalize();
        if (!resolved.startsWith(storageRoot) || resolved.equals(storageRoot)) {
            throw new SecurityException("Path traversal attempt detected: " + key);
        }
        return resolved;
    }
}
