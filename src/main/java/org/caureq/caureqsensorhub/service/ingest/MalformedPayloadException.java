package org.caureq.caureqsensorhub.service.ingest;

/** A transport payload could not be decoded into a {@link RawReading}. */
public class MalformedPayloadException extends RuntimeException {
    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
