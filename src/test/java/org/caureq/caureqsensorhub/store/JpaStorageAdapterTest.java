package org.caureq.caureqsensorhub.store;

import org.caureq.caureqsensorhub.domain.AlertKind;
import org.caureq.caureqsensorhub.domain.AlertRecord;
import org.caureq.caureqsensorhub.domain.Reading;
import org.caureq.caureqsensorhub.domain.SensorType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.caureq.caureqsensorhub.TestFixtures.*;

@DataJpaTest
@Import(JpaStorageAdapter.class)
class JpaStorageAdapterTest {

    @Autowired
    private JpaStorageAdapter store;

    @Test
    void readingsComeBackInArrivalOrder() {
        store.registerSensor(sensor("temperature_lab", SensorType.TEMPERATURE));
        store.insertReading(reading("temperature_lab", T0.plusSeconds(30), 3));
        store.insertReading(reading("temperature_lab", T0.plusSeconds(10), 1));
        store.insertReading(reading("temperature_lab", T0.plusSeconds(20), 2));
        store.insertReading(reading("temperature_lab", T0.plusSeconds(90), 9));

        assertThat(store.getReadings("temperature_lab", new TimeRange(T0, T0.plusSeconds(60)), 100))
                .extracting(Reading::getValue).containsExactly(3.0, 1.0, 2.0);
        assertThat(store.getReadings("temperature_lab", TimeRange.all(), 2))
                .extracting(Reading::getValue).containsExactly(2.0, 9.0);
    }

    @Test
    void insertAssignsIdsAndRegisterIsIdempotent() {
        var first = store.registerSensor(sensor("humidity_cellar", SensorType.HUMIDITY));
        var again = store.registerSensor(sensor("humidity_cellar", SensorType.CO2));

        assertThat(again.getType()).isEqualTo(SensorType.HUMIDITY);
        assertThat(store.findSensor("humidity_cellar")).get().extracting(s -> s.getType()).isEqualTo(first.getType());
        assertThat(store.insertReading(reading("humidity_cellar", T0, 55)).getId()).isNotNull();
        assertThat(store.listSensors()).extracting(s -> s.getId()).contains("humidity_cellar");
    }

    @Test
    void alertQueriesAndIdempotentAcknowledge() {
        var id = UUID.randomUUID().toString();
        store.insertAlert(AlertRecord.builder().id(id).sensorId("co2_office").kind(AlertKind.ANOMALY)
                .ts(T0).valueAtTrigger(2400).threshold(3.0).score(Double.POSITIVE_INFINITY)
                .message("Anomalous co2").build());
        store.insertAlert(AlertRecord.builder().id(UUID.randomUUID().toString()).sensorId("co2_office")
                .kind(AlertKind.ABOVE_MAX).ts(T0.plusSeconds(5)).valueAtTrigger(2400).threshold(1200.0)
                .message("High co2").build());

        assertThat(store.acknowledgeAlert(id)).isTrue();
        assertThat(store.acknowledgeAlert(id)).isTrue();
        assertThat(store.acknowledgeAlert("missing")).isFalse();

        assertThat(store.getAlerts(new AlertFilter("co2_office", null, T0, 10, 0)))
                .extracting(AlertRecord::getKind).containsExactly(AlertKind.ABOVE_MAX, AlertKind.ANOMALY);
        assertThat(store.getAlerts(new AlertFilter(null, true, null, 10, 0)))
                .extracting(AlertRecord::getId).containsExactly(id);
        assertThat(store.getAlerts(new AlertFilter(null, false, T0.plusSeconds(10), 10, 0))).isEmpty();
    }

    @Test
    void offsetOffAPageBoundarySkipsExactlyThatManyAlerts() {
        for (int i = 0; i < 5; i++) {
            store.insertAlert(AlertRecord.builder().id(UUID.randomUUID().toString()).sensorId("pressure_pump")
                    .kind(AlertKind.ABOVE_MAX).ts(T0.plusSeconds(i)).valueAtTrigger(i).threshold(1100.0)
                    .message("High pressure").build());
        }

        assertThat(store.getAlerts(new AlertFilter("pressure_pump", null, T0, 2, 1)))
                .extracting(AlertRecord::getValueAtTrigger).containsExactly(3.0, 2.0);
        assertThat(store.getAlerts(new AlertFilter("pressure_pump", null, T0, 2, 2)))
                .extracting(AlertRecord::getValueAtTrigger).containsExactly(2.0, 1.0);
        assertThat(store.getAlerts(new AlertFilter("pressure_pump", null, T0, 2, 7))).isEmpty();
    }

    @Test
    void valueWiderThanItsColumnIsAPermanentFailure() {
        store.registerSensor(sensor("temperature_lab", SensorType.TEMPERATURE));
        var reading = Reading.builder().sensorId("temperature_lab").ts(T0).value(21).unit("degrees_celsius_x").build();

        assertThatThrownBy(() -> store.insertReading(reading)).isInstanceOf(PermanentStorageException.class);
    }
}
