package org.caureq.caureqsensorhub.service.alerts;

/**
 * Observable state of one (sensor, kind) pair. Raising an alert moves the pair
 * directly into COOLING, so "raised" is an event rather than a resting state.
 */
public enum AlertState {
    CLEAR, COOLING
}
