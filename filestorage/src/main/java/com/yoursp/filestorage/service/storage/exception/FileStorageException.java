package com.yoursp.filestorage.service.storage.exception;

import lombok.Getter;

/**
 * Base type for failures raised by the file storage facade and its adapters.
 * Carries the key the failing operation was addressed to.
 */
@Getter
public class FileStorageException extends RuntimeException {

    private final String key;

    public FileStorageException(String key, String message) {
        super(message);
        this.key = key;
    }

    public FileStorageException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }
}
