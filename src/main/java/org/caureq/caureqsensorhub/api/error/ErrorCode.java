package org.caureq.caureqsensorhub.api.error;

import org.caureq.caureqsensorhub.service.ingest.RejectionReason;

public enum ErrorCode {
    BAD_REQUEST, MALFORMED_PAYLOAD, UNKNOWN_SENSOR_TYPE, OUT_OF_RANGE_TIMESTAMP,
    SENSOR_NOT_FOUND, ALERT_NOT_FOUND, SERVICE_UNAVAILABLE, INTERNAL_ERROR;

    public static ErrorCode of(RejectionReason reason) {
        return switch (reason) {
            case MALFORMED_PAYLOAD -> MALFORMED_PAYLOAD;
            case UNKNOWN_SENSOR_TYPE -> UNKNOWN_SENSOR_TYPE;
            case OUT_OF_RANGE_TIMESTAMP -> OUT_OF_RANGE_TIMESTAMP;
            case PIPELINE_UNAVAILABLE -> SERVICE_UNAVAILABLE;
        };
    }
}
