package org.caureq.caureqsensorhub.service.ingest;

import org.caureq.caureqsensorhub.domain.Reading;

/** Outcome of {@link IngestGateway#submit}: the accepted reading, or why it was turned away. */
public record IngestResult(Reading reading, RejectionReason reason, String detail) {

    public static IngestResult accepted(Reading reading) {
        return new IngestResult(reading, null, null);
    }

    public static IngestResult rejected(RejectionReason reason, String detail) {
        return new IngestResult(null, reason, detail);
    }

    public boolean isAccepted() { return reason == null; }
}
