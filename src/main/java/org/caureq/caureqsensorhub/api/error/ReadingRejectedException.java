package org.caureq.caureqsensorhub.api.error;

import org.caureq.caureqsensorhub.service.ingest.RejectionReason;

/** A submitted reading was turned away by the gateway; rendered as 400 or 503. */
public class ReadingRejectedException extends RuntimeException {
    private final RejectionReason reason;

    public ReadingRejectedException(RejectionReason reason, String detail) {
        super(detail);
        this.reason = reason;
    }

    public RejectionReason reason() { return reason; }
}
