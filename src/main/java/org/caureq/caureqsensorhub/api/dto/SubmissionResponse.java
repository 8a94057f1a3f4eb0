package org.caureq.caureqsensorhub.api.dto;

import java.time.Instant;

public record SubmissionResponse(String status, String sensorId, Instant timestamp) {}
