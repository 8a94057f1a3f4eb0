package org.caureq.caureqsensorhub.service.pipeline;

/** The core is shutting down (or the submitter was interrupted) and took no new work. */
public class PipelineUnavailableException extends RuntimeException {
    public PipelineUnavailableException(String message) {
        super(message);
    }
}
