package com.yoursp.filestorage.service.storage.exception;

/**
 * Thrown by an adapter when no record maps to the requested key.
 */
public class FileKeyNotFoundException extends FileStorageException {

    public FileKeyNotFoundException(String key, String message) {
        super(key, message);
    }
}
