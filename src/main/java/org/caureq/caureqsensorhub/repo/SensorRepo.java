package org.caureq.caureqsensorhub.repo;

import org.caureq.caureqsensorhub.domain.Sensor;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SensorRepo extends JpaRepository<Sensor, String> {
}
