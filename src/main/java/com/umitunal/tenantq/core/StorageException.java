package com.umitunal.tenantq.core;

/**
 * Raised when the job store or the queue cannot complete an operation.
 */
public class StorageException extends Exception {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
