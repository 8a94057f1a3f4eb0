package org.caureq.caureqsensorhub.service.ingest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqsensorhub.config.AppProps;
import org.caureq.caureqsensorhub.domain.Reading;
import org.caureq.caureqsensorhub.domain.Sensor;
import org.caureq.caureqsensorhub.domain.SensorType;
import org.caureq.caureqsensorhub.service.SensorRegistry;
import org.caureq.caureqsensorhub.service.pipeline.PipelineUnavailableException;
import org.caureq.caureqsensorhub.service.pipeline.ProcessingCore;
import org.springframework.stereotype.Service;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Single entry point shared by both transports (REST push and MQTT subscription).
 *
 * Validates a {@link RawReading}, resolves the sensor type, registers unseen sensors and
 * hands a canonical {@link Reading} to the processing core. Invalid input is returned as a
 * rejection and never enters the pipeline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestGateway {
    /** Column widths of {@code sensors.id/name/location} and {@code readings.unit}. */
    static final int MAX_ID_LENGTH = 128;
    static final int MAX_LABEL_LENGTH = 128;
    static final int MAX_UNIT_LENGTH = 16;

    private final SensorRegistry sensors;
    private final ProcessingCore core;
    private final Clock clock;
    private final AppProps props;

    public IngestResult submit(RawReading raw) {
        if (raw == null) return IngestResult.rejected(RejectionReason.MALFORMED_PAYLOAD, "empty payload");
        var sensorId = raw.sensorId() == null ? "" : raw.sensorId().trim();
        if (sensorId.isEmpty()) {
            return IngestResult.rejected(RejectionReason.MALFORMED_PAYLOAD, "sensor_id is required");
        }
        var tooLong = tooLong(sensorId, raw);
        if (tooLong != null) {
            return IngestResult.rejected(RejectionReason.MALFORMED_PAYLOAD, tooLong);
        }
        if (raw.value() == null) {
            return IngestResult.rejected(RejectionReason.MALFORMED_PAYLOAD, "value is required");
        }
        if (!Double.isFinite(raw.value())) {
            return IngestResult.rejected(RejectionReason.MALFORMED_PAYLOAD, "value must be a finite number");
        }

        var now = clock.instant();
        Instant ts;
        if (raw.timestamp() == null || raw.timestamp().isBlank()) {
            ts = now;
        } else {
            var parsed = parseTimestamp(raw.timestamp().trim());
            if (parsed.isEmpty()) {
                return IngestResult.rejected(RejectionReason.MALFORMED_PAYLOAD, "unparseable timestamp: " + raw.timestamp());
            }
            ts = parsed.get();
            var skew = props.ingest().maxClockSkew();
            if (ts.isAfter(now.plus(skew))) {
                return IngestResult.rejected(RejectionReason.OUT_OF_RANGE_TIMESTAMP,
                        "timestamp %s is more than %s ahead of server time".formatted(ts, skew));
            }
        }

        var known = sensors.find(sensorId);
        SensorType type;
        if (known.isPresent()) {
            type = known.get().getType();
        } else {
            var resolved = resolveType(sensorId, raw.type());
            if (resolved.isEmpty()) {
                return IngestResult.rejected(RejectionReason.UNKNOWN_SENSOR_TYPE,
                        "cannot resolve sensor type for " + sensorId + (raw.type() == null ? "" : " (type=" + raw.type() + ")"));
            }
            type = resolved.get();
        }
        Sensor sensor = known.orElseGet(() -> sensors.resolveOrRegister(sensorId, type, raw.name(), raw.location()));

        var reading = Reading.builder()
                .sensorId(sensor.getId())
                .ts(ts)
                .value(raw.value())
                .unit(raw.unit() == null || raw.unit().isBlank() ? type.defaultUnit() : raw.unit().trim())
                .build();
        try {
            core.process(reading);
        } catch (PipelineUnavailableException e) {
            return IngestResult.rejected(RejectionReason.PIPELINE_UNAVAILABLE, e.getMessage());
        }
        log.debug("accepted {} value={} ts={}", sensorId, raw.value(), ts);
        return IngestResult.accepted(reading);
    }

    private static String tooLong(String sensorId, RawReading raw) {
        if (sensorId.length() > MAX_ID_LENGTH) return "sensor_id longer than " + MAX_ID_LENGTH + " characters";
        if (raw.unit() != null && raw.unit().trim().length() > MAX_UNIT_LENGTH) {
            return "unit longer than " + MAX_UNIT_LENGTH + " characters";
        }
        if (raw.name() != null && raw.name().trim().length() > MAX_LABEL_LENGTH) {
            return "name longer than " + MAX_LABEL_LENGTH + " characters";
        }
        if (raw.location() != null && raw.location().trim().length() > MAX_LABEL_LENGTH) {
            return "location longer than " + MAX_LABEL_LENGTH + " characters";
        }
        return null;
    }

    /**
     * Explicit type wins; otherwise the id prefix ({@code temperature_living_room} -> temperature).
     * An explicit but unknown type is not second-guessed from the id.
     */
    static Optional<SensorType> resolveType(String sensorId, String explicitType) {
        if (explicitType != null && !explicitType.isBlank()) return SensorType.resolve(explicitType);
        var id = sensorId.toLowerCase(Locale.ROOT);
        return Stream.of(SensorType.values())
                .filter(t -> id.equals(t.code()) || id.startsWith(t.code() + "_"))
                .max(Comparator.comparingInt(t -> t.code().length()));
    }

    /** ISO instant, offset or UTC local date-time; all-digit input is epoch seconds (<= 10 digits) or millis. */
    static Optional<Instant> parseTimestamp(String s) {
        if (s.chars().allMatch(Character::isDigit)) {
            try {
                long n = Long.parseLong(s);
                return Optional.of(s.length() <= 10 ? Instant.ofEpochSecond(n) : Instant.ofEpochMilli(n));
            } catch (NumberFormatException | DateTimeException e) {
                return Optional.empty();
            }
        }
        try {
            var parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(s, OffsetDateTime::from, LocalDateTime::from);
            return Optional.of(parsed instanceof OffsetDateTime odt
                    ? odt.toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
