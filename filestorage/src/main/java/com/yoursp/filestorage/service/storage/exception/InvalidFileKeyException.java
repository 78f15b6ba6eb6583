package com.yoursp.filestorage.service.storage.exception;

/**
 * Thrown when a file key is null or blank. Raised before any adapter call.
 */
public class InvalidFileKeyException extends FileStorageException {

    public InvalidFileKeyException(String key, String message) {
        super(key, message);
    }
}
