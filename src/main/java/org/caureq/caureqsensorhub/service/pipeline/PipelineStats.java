package org.caureq.caureqsensorhub.service.pipeline;

public record PipelineStats(long accepted, long processed, long persisted, long deadLettered,
                            long alertsRaised, int inFlight, int lines, boolean accepting) {}
