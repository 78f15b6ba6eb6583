package com.yoursp.filestorage.service.storage;

import com.yoursp.filestorage.service.storage.exception.EmptyFileContentException;
import com.yoursp.filestorage.service.storage.exception.FileKeyAlreadyExistsException;
import com.yoursp.filestorage.service.storage.exception.FileKeyNotFoundException;
import com.yoursp.filestorage.service.storage.exception.InvalidFileKeyException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Facade over a pluggable {@link StorageAdapter}.
 * <ul>
 * <li>Every key is validated before the adapter sees it</li>
 * <li>Empty content is never saved, except the empty record written by {@code init} with touch</li>
 * <li>Adapter errors reach the caller unchanged; only {@code init} interprets "not found"</li>
 * </ul>
 * Holds no state besides the adapter. The absence check in {@code init} is not atomic:
 * two callers can both reserve the same absent key unless the adapter prevents it.
 */
@Slf4j
@RequiredArgsConstructor
public class FileStorage {

    private final StorageAdapter adapter;

    /**
     * Save changes to a file.
     *
     * @param file record to persist
     * @return the adapter's success flag
     * @throws InvalidFileKeyException   if the key is invalid
     * @throws EmptyFileContentException if the content is null or empty
     */
    public boolean save(FileRecord file) {
        validateKey(file.getKey());

        if (!file.hasContent()) {
            log.warn("Rejected save of empty file {}", file.getKey());
            throw new EmptyFileContentException(file.getKey(), "Cannot save an empty file.");
        }

        log.debug("Saving {} ({} bytes)", file.getKey(), file.size());
        return adapter.save(file);
    }

    /**
     * Load a file for reading and modifying.
     *
     * @param key storage key
     * @return the stored record
     * @throws InvalidFileKeyException  if the key is invalid
     * @throws FileKeyNotFoundException if no file is stored under the key
     */
    public FileRecord load(String key) {
        validateKey(key);

        log.debug("Loading {}", key);
        return adapter.load(key);
    }

    /**
     * Initialize a new, unsaved file for further modifying.
     *
     * @see #init(String, boolean)
     */
    public FileRecord init(String key) {
        return init(key, false);
    }

    /**
     * Initialize a new file for further modifying.
     * With touch enabled, the empty file is saved right away so the key is reserved,
     * at the cost of an extra request to the backend.
     *
     * @param key   storage key
     * @param touch save the empty file immediately
     * @return the new record
     * @throws InvalidFileKeyException       if the key is invalid
     * @throws FileKeyAlreadyExistsException if a file is already stored under the key
     */
    public FileRecord init(String key, boolean touch) {
        validateKey(key);

        FileRecord existing;
        try {
            existing = load(key);
        } catch (FileKeyNotFoundException e) {
            existing = null;
        }

        // A null load result counts as absent, same as not-found
        if (existing != null) {
            log.warn("Init refused, {} already exists", key);
            throw new FileKeyAlreadyExistsException(key, "File already exists");
        }

        FileRecord file = adapter.init(key, touch);
        if (touch) {
            // Empty sentinel: goes straight to the adapter, past the content check in save()
            if (adapter.save(file)) {
                log.debug("Initialized and touched {}", key);
            } else {
                log.warn("Touch of {} was not accepted by the adapter, key is not reserved", key);
            }
        } else {
            log.debug("Initialized {}", key);
        }
        return file;
    }

    /**
     * Delete a file from storage.
     *
     * @param key storage key
     * @return the adapter's success flag
     * @throws InvalidFileKeyException  if the key is invalid
     * @throws FileKeyNotFoundException if no file is stored under the key
     */
    public boolean delete(String key) {
        validateKey(key);

        log.debug("Deleting {}", key);
        return adapter.delete(key);
    }

    private void validateKey(String key) {
        if (key == null || key.trim().isEmpty()) {
            log.warn("Rejected invalid file key [{}]", key);
            throw new InvalidFileKeyException(key, "File key cannot be empty");
        }
    }
}
