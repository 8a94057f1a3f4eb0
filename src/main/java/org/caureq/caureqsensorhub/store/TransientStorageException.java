package org.caureq.caureqsensorhub.store;

/** A storage write failed in a way a later attempt may not. */
public class TransientStorageException extends RuntimeException {
    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransientStorageException(String message) {
        super(message);
    }
}
