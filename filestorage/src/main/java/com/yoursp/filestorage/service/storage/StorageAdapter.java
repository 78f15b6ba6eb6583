package com.yoursp.filestorage.service.storage;

import com.yoursp.filestorage.service.storage.exception.FileKeyNotFoundException;

/**
 * Abstraction for the backing store behind {@link FileStorage}.
 * Implementations can target local FS, an in-memory map, S3, etc.
 * Keys passed in have already been validated by the facade.
 */
public interface StorageAdapter {

    /**
     * Persist the record, replacing any previous content under its key.
     *
     * @param file record to store
     * @return true if the backend accepted the write
     */
    boolean save(FileRecord file);

    /**
     * Load the record stored under a key.
     *
     * @param key storage key / path
     * @return the stored record; {@code init} on the facade also treats null as absent
     * @throws FileKeyNotFoundException if nothing is stored under the key
     */
    FileRecord load(String key);

    /**
     * Build a new, empty record bound to the key. Nothing is persisted here;
     * the facade follows up with {@link #save(FileRecord)} when touch is requested.
     *
     * @param key   storage key / path
     * @param touch whether the caller intends to reserve the key immediately
     * @return a fresh record with empty content
     */
    FileRecord init(String key, boolean touch);

    /**
     * Remove the record stored under a key.
     *
     * @param key storage key / path
     * @return true if the record was removed
     * @throws FileKeyNotFoundException if nothing is stored under the key
     */
    boolean delete(String key);
}
