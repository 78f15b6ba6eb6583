package com.yoursp.filestorage.service.storage.exception;

/**
 * Thrown when saving a record whose content is null or empty.
 */
public class EmptyFileContentException extends FileStorageException {

    public EmptyFileContentException(String key, String message) {
        super(key, message);
    }
}
