package com.yoursp.filestorage.service.storage.exception;

/**
 * Wraps I/O failures of a bundled adapter's backing store.
 */
public class StorageBackendException extends FileStorageException {

    public StorageBackendException(String key, String message, Throwable cause) {
        super(key, message, cause);
    }
}
