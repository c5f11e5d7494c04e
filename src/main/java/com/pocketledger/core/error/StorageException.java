package com.pocketledger.core.error;

/**
 * Unrecoverable failure of the underlying database or file system. Aborts the current action only.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(Throwable cause) {
        super(cause.getMessage(), cause);
    }
}
