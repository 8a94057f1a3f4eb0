package org.caureq.caureqsensorhub.store;

/** The store refused a write (constraint or column width); repeating it cannot succeed. */
public class PermanentStorageException extends RuntimeException {
    public PermanentStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
