package com.example.gcsconnector.exception;

/**
 * Any failure talking to the object-storage backend.
 * Uploaders treat it as transient and retry on their next poll cycle.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
