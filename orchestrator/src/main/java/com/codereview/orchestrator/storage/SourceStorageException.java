package com.codereview.orchestrator.storage;

/**
 * Thrown when an uploaded source file cannot be stored or read back.
 */
public class SourceStorageException extends RuntimeException {

    public SourceStorageException(String message) {
        super(message);
    }

    public SourceStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
