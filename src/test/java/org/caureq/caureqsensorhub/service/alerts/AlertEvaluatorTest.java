package org.caureq.caureqsensorhub.service.alerts;

import org.caureq.caureqsensorhub.domain.AlertKind;
import org.caureq.caureqsensorhub.domain.AlertRecord;
import org.caureq.caureqsensorhub.domain.Sensor;
import org.caureq.caureqsensorhub.domain.SensorType;
import org.caureq.caureqsensorhub.service.anomaly.AnomalyScore;
import org.caureq.caureqsensorhub.service.rules.RuleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.caureq.caureqsensorhub.TestFixtures.*;

class AlertEvaluatorTest {

    private AlertEvaluator evaluator;
    private Sensor sensor;

    @BeforeEach
    void setUp() {
        // temperature 10..30, cooldown 3 minutes
        evaluator = new AlertEvaluator(new RuleStore(props(Duration.ofMinutes(3), 5, 50)));
        sensor = sensor("temperature_lab", SensorType.TEMPERATURE);
    }

    private List<AlertRecord> eval(Instant ts, double value) {
        return evaluator.evaluate(sensor, reading(sensor.getId(), ts, value), AnomalyScore.insufficient());
    }

    @Test
    void sustainedBreachRaisesOnceWithinCooldown() {
        var raised = new ArrayList<>(eval(T0, 5));
        raised.addAll(eval(T0.plusSeconds(60), 6));
        raised.addAll(eval(T0.plusSeconds(120), 7));

        assertThat(raised).hasSize(1);
        var alert = raised.get(0);
        assertThat(alert.getKind()).isEqualTo(AlertKind.BELOW_MIN);
        assertThat(alert.getValueAtTrigger()).isEqualTo(5.0);
        assertThat(alert.getThreshold()).isEqualTo(10.0);
        assertThat(alert.getMessage()).isEqualTo("Low temperature alert: 5.00°C is below threshold of 10.00°C");
        assertThat(evaluator.state(sensor.getId(), AlertKind.BELOW_MIN)).isEqualTo(AlertState.COOLING);
    }

    @Test
    void breachRaisesAgainOnceCooldownElapsed() {
        assertThat(eval(T0, 5)).hasSize(1);
        assertThat(eval(T0.plusSeconds(179), 5)).isEmpty();
        assertThat(eval(T0.plusSeconds(180), 5)).extracting(AlertRecord::getKind).containsExactly(AlertKind.BELOW_MIN);
    }

    @Test
    void kindsCoolDownIndependently() {
        assertThat(eval(T0, 5)).hasSize(1);

        var high = eval(T0.plusSeconds(30), 35);

        assertThat(high).extracting(AlertRecord::getKind).containsExactly(AlertKind.ABOVE_MAX);
        assertThat(high.get(0).getMessage()).startsWith("High temperature alert: 35.00°C");
    }

    @Test
    void recoveryClearsPendingCooldown() {
        assertThat(eval(T0, 5)).hasSize(1);
        assertThat(eval(T0.plusSeconds(10), 20)).isEmpty();
        assertThat(evaluator.state(sensor.getId(), AlertKind.BELOW_MIN)).isEqualTo(AlertState.CLEAR);

        assertThat(eval(T0.plusSeconds(20), 4)).hasSize(1);
    }

    @Test
    void inRangeReadingRaisesNothing() {
        assertThat(eval(T0, 10)).isEmpty();
        assertThat(eval(T0.plusSeconds(1), 30)).isEmpty();
        assertThat(evaluator.state(sensor.getId(), AlertKind.ABOVE_MAX)).isEqualTo(AlertState.CLEAR);
    }

    @Test
    void thresholdAndAnomalyCanFireTogether() {
        var raised = evaluator.evaluate(sensor, reading(sensor.getId(), T0, 80), AnomalyScore.of(7.5));

        assertThat(raised).extracting(AlertRecord::getKind)
                .containsExactlyInAnyOrder(AlertKind.ABOVE_MAX, AlertKind.ANOMALY);
        var anomaly = raised.stream().filter(a -> a.getKind() == AlertKind.ANOMALY).findFirst().orElseThrow();
        assertThat(anomaly.getScore()).isEqualTo(7.5);
        assertThat(anomaly.getThreshold()).isEqualTo(3.0);
    }

    @Test
    void scoreAtThresholdIsNotAnomalous() {
        var raised = evaluator.evaluate(sensor, reading(sensor.getId(), T0, 20), AnomalyScore.of(3.0));

        assertThat(raised).isEmpty();
    }

    @Test
    void sensorsAreTrackedSeparately() {
        var other = sensor("temperature_attic", SensorType.TEMPERATURE);
        assertThat(eval(T0, 5)).hasSize(1);

        var raised = evaluator.evaluate(other, reading(other.getId(), T0.plusSeconds(1), 5), AnomalyScore.insufficient());

        assertThat(raised).hasSize(1);
    }
}
