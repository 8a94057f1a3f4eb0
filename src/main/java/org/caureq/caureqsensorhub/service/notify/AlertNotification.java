package org.caureq.caureqsensorhub.service.notify;

import org.caureq.caureqsensorhub.domain.AlertRecord;
import org.caureq.caureqsensorhub.domain.Reading;
import org.caureq.caureqsensorhub.domain.Sensor;

/** What a notifier receives for every raised alert. */
public record AlertNotification(AlertRecord alert, Sensor sensor, Reading reading) {}
