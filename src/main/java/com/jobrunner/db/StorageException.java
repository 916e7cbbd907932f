package com.jobrunner.db;

/**
 * Unchecked wrapper for a database failure behind an interface that cannot declare
 * {@link java.sql.SQLException}.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
