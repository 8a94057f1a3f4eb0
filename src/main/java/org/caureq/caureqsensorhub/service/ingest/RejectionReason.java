package org.caureq.caureqsensorhub.service.ingest;

public enum RejectionReason {
    MALFORMED_PAYLOAD,
    UNKNOWN_SENSOR_TYPE,
    OUT_OF_RANGE_TIMESTAMP,
    /** not a validation error: the core is shutting down */
    PIPELINE_UNAVAILABLE
}
