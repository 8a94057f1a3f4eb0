package org.caureq.caureqsensorhub.api;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqsensorhub.api.dto.ReadingSubmission;
import org.caureq.caureqsensorhub.api.dto.SubmissionResponse;
import org.caureq.caureqsensorhub.api.error.ReadingRejectedException;
import org.caureq.caureqsensorhub.service.ingest.IngestGateway;
import org.caureq.caureqsensorhub.service.ingest.RejectionReason;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/** Push transport. {@code /api/sensors/data} is the path older devices still post to. */
@RestController
@RequiredArgsConstructor
public class IngestController {
    private final IngestGateway gateway;

    @PostMapping({"/api/readings", "/api/sensors/data"})
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SubmissionResponse submit(@RequestBody(required = false) ReadingSubmission body) {
        if (body == null) throw new ReadingRejectedException(RejectionReason.MALFORMED_PAYLOAD, "empty body");
        var result = gateway.submit(body.toRaw());
        if (!result.isAccepted()) throw new ReadingRejectedException(result.reason(), result.detail());
        var r = result.reading();
        return new SubmissionResponse("accepted", r.getSensorId(), r.getTs());
    }
}
