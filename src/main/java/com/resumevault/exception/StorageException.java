package com.resumevault.exception;

/**
 * Blob store I/O failure: write, read or delete.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
