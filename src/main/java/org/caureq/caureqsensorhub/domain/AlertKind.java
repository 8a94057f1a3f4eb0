package org.caureq.caureqsensorhub.domain;

public enum AlertKind {
    BELOW_MIN, ABOVE_MAX, ANOMALY
}
