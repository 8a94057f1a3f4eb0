package org.caureq.caureqsensorhub.service.ingest;

import org.caureq.caureqsensorhub.domain.SensorType;
import org.caureq.caureqsensorhub.service.SensorRegistry;
import org.caureq.caureqsensorhub.service.pipeline.PipelineUnavailableException;
import org.caureq.caureqsensorhub.service.pipeline.ProcessingCore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.caureq.caureqsensorhub.TestFixtures.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestGatewayTest {

    @Mock
    private SensorRegistry sensors;
    @Mock
    private ProcessingCore core;

    private IngestGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new IngestGateway(sensors, core, CLOCK, props());
    }

    private static RawReading raw(String sensorId, Double value, String timestamp) {
        return new RawReading(sensorId, null, null, null, value, null, timestamp);
    }

    @Test
    void missingFieldsAreMalformed() {
        assertThat(gateway.submit(raw(" ", 1.0, null)).reason()).isEqualTo(RejectionReason.MALFORMED_PAYLOAD);
        assertThat(gateway.submit(raw("temperature_a", null, null)).reason()).isEqualTo(RejectionReason.MALFORMED_PAYLOAD);
        assertThat(gateway.submit(raw("temperature_a", Double.NaN, null)).reason()).isEqualTo(RejectionReason.MALFORMED_PAYLOAD);
        assertThat(gateway.submit(raw("temperature_a", 1.0, "yesterday")).reason()).isEqualTo(RejectionReason.MALFORMED_PAYLOAD);
        assertThat(gateway.submit(null).reason()).isEqualTo(RejectionReason.MALFORMED_PAYLOAD);
        verifyNoInteractions(core);
    }

    @Test
    void fieldsWiderThanTheirColumnsAreMalformed() {
        var longId = "temperature_" + "x".repeat(IngestGateway.MAX_ID_LENGTH);
        var longLabel = "y".repeat(IngestGateway.MAX_LABEL_LENGTH + 1);

        var id = gateway.submit(raw(longId, 1.0, null));
        var unit = gateway.submit(new RawReading("temperature_a", null, null, null, 1.0, "degrees_celsius_x", null));
        var name = gateway.submit(new RawReading("temperature_a", null, longLabel, null, 1.0, null, null));
        var location = gateway.submit(new RawReading("temperature_a", null, null, longLabel, 1.0, null, null));

        assertThat(id.reason()).isEqualTo(RejectionReason.MALFORMED_PAYLOAD);
        assertThat(id.detail()).contains("sensor_id");
        assertThat(unit.reason()).isEqualTo(RejectionReason.MALFORMED_PAYLOAD);
        assertThat(unit.detail()).contains("unit");
        assertThat(name.detail()).contains("name");
        assertThat(location.detail()).contains("location");
        verifyNoInteractions(sensors, core);
    }

    @Test
    void fieldsAtTheirColumnWidthAreAccepted() {
        var id = "temperature_" + "x".repeat(IngestGateway.MAX_ID_LENGTH - "temperature_".length());
        when(sensors.find(id)).thenReturn(Optional.of(sensor(id, SensorType.TEMPERATURE)));

        var result = gateway.submit(new RawReading(id, null, null, null, 1.0, "x".repeat(IngestGateway.MAX_UNIT_LENGTH), null));

        assertThat(result.isAccepted()).isTrue();
    }

    @Test
    void timestampTooFarAheadIsOutOfRange() {
        var result = gateway.submit(raw("temperature_a", 21.0, T0.plusSeconds(301).toString()));

        assertThat(result.isAccepted()).isFalse();
        assertThat(result.reason()).isEqualTo(RejectionReason.OUT_OF_RANGE_TIMESTAMP);
        verifyNoInteractions(core);
    }

    @Test
    void unresolvableTypeIsRejected() {
        when(sensors.find("weird_sensor")).thenReturn(Optional.empty());

        var result = gateway.submit(raw("weird_sensor", 1.0, null));

        assertThat(result.reason()).isEqualTo(RejectionReason.UNKNOWN_SENSOR_TYPE);
        verify(sensors, never()).resolveOrRegister(any(), any(), any(), any());
        verifyNoInteractions(core);
    }

    @Test
    void acceptedReadingIsRegisteredAndHandedToTheCore() {
        var sensor = sensor("temperature_living_room", SensorType.TEMPERATURE);
        when(sensors.find("temperature_living_room")).thenReturn(Optional.empty());
        when(sensors.resolveOrRegister(eq("temperature_living_room"), eq(SensorType.TEMPERATURE), isNull(), isNull()))
                .thenReturn(sensor);

        var result = gateway.submit(raw("temperature_living_room", 22.5, null));

        assertThat(result.isAccepted()).isTrue();
        verify(core).process(argThat(r -> r.getSensorId().equals("temperature_living_room")
                && r.getValue() == 22.5
                && r.getTs().equals(T0)
                && r.getUnit().equals("°C")));
    }

    @Test
    void knownSensorKeepsItsRegisteredType() {
        when(sensors.find("meter_1")).thenReturn(Optional.of(sensor("meter_1", SensorType.CO2)));

        var result = gateway.submit(new RawReading("meter_1", "humidity", null, null, 600.0, "ppm", "2024-03-01T11:59:00Z"));

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.reading().getTs()).isEqualTo(Instant.parse("2024-03-01T11:59:00Z"));
        verify(sensors, never()).resolveOrRegister(any(), any(), any(), any());
        verify(core).process(any());
    }

    @Test
    void shuttingDownPipelineIsReported() {
        when(sensors.find("humidity_cellar")).thenReturn(Optional.of(sensor("humidity_cellar", SensorType.HUMIDITY)));
        doThrow(new PipelineUnavailableException("pipeline is shutting down")).when(core).process(any());

        var result = gateway.submit(raw("humidity_cellar", 55.0, null));

        assertThat(result.reason()).isEqualTo(RejectionReason.PIPELINE_UNAVAILABLE);
    }

    @Test
    void typeComesFromExplicitValueOrLongestIdPrefix() {
        assertThat(IngestGateway.resolveType("soil_moisture_bed1", null)).contains(SensorType.SOIL_MOISTURE);
        assertThat(IngestGateway.resolveType("Temperature", null)).contains(SensorType.TEMPERATURE);
        assertThat(IngestGateway.resolveType("anything", "Humidity")).contains(SensorType.HUMIDITY);
        assertThat(IngestGateway.resolveType("temperature_a", "radiation")).isEmpty();
        assertThat(IngestGateway.resolveType("temperatures", null)).isEmpty();
    }

    @Test
    void timestampFormats() {
        var expected = Instant.parse("2024-03-01T10:00:00Z");

        assertThat(IngestGateway.parseTimestamp("2024-03-01T10:00:00Z")).contains(expected);
        assertThat(IngestGateway.parseTimestamp("2024-03-01T12:00:00+02:00")).contains(expected);
        assertThat(IngestGateway.parseTimestamp("2024-03-01T10:00:00")).contains(expected);
        assertThat(IngestGateway.parseTimestamp(Long.toString(expected.getEpochSecond()))).contains(expected);
        assertThat(IngestGateway.parseTimestamp(Long.toString(expected.toEpochMilli()))).contains(expected);
        assertThat(IngestGateway.parseTimestamp("01/03/2024")).isEmpty();
    }
}
