package org.caureq.caureqsensorhub.simulator;

import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqsensorhub.service.ingest.IngestGateway;
import org.caureq.caureqsensorhub.service.ingest.RawReading;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/**
 * Demo data source for the {@code simulator} profile. Every cycle it submits one reading per
 * simulated sensor, uniformly inside the sensor's normal band, and one cycle in ten adds an
 * out-of-band value (2 to 10 units past min or max) for a random sensor.
 */
@Slf4j
@Component
@Profile("simulator")
public class SensorSimulator {
    static final double ANOMALY_CHANCE = 0.1;

    record SimulatedSensor(String id, String type, String unit, double min, double max) {}

    static final List<SimulatedSensor> SENSORS = List.of(
            new SimulatedSensor("temperature_living_room", "temperature", "°C", 18, 32),
            new SimulatedSensor("temperature_bedroom", "temperature", "°C", 18, 25),
            new SimulatedSensor("humidity_living_room", "humidity", "%", 30, 90),
            new SimulatedSensor("humidity_bedroom", "humidity", "%", 35, 75));

    private final IngestGateway gateway;
    private final Random random;

    @Autowired
    public SensorSimulator(IngestGateway gateway) {
        this(gateway, new Random());
    }

    SensorSimulator(IngestGateway gateway, Random random) {
        this.gateway = gateway;
        this.random = random;
    }

    @Scheduled(fixedDelayString = "${app.simulator.interval-ms:2000}")
    public void tick() {
        for (var s : SENSORS) send(s, round(s.min() + random.nextDouble() * (s.max() - s.min())));
        if (random.nextDouble() < ANOMALY_CHANCE) {
            var s = SENSORS.get(random.nextInt(SENSORS.size()));
            var offset = 2 + random.nextDouble() * 8;
            var value = round(random.nextBoolean() ? s.max() + offset : s.min() - offset);
            log.info("[Simulator] out-of-band value for {}: {} {}", s.id(), value, s.unit());
            send(s, value);
        }
    }

    private void send(SimulatedSensor s, double value) {
        var result = gateway.submit(new RawReading(s.id(), s.type(), null, null, value, s.unit(), null));
        if (!result.isAccepted()) {
            log.warn("[Simulator] {} rejected: {} {}", s.id(), result.reason(), result.detail());
        }
    }

    private static double round(double v) {
        return Math.round(v * 100) / 100.0;
    }
}
