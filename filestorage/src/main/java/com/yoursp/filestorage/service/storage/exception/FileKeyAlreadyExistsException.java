package com.yoursp.filestorage.service.storage.exception;

/**
 * Thrown by {@code init} when a record already exists for the key.
 */
public class FileKeyAlreadyExistsException extends FileStorageException {

    public FileKeyAlreadyExistsException(String key, String message) {
        super(key, message);
    }
}
