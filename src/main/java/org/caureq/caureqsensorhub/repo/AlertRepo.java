package org.caureq.caureqsensorhub.repo;

import org.caureq.caureqsensorhub.domain.AlertRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;

public interface AlertRepo extends JpaRepository<AlertRecord, String> {
    Page<AlertRecord> findByTsGreaterThanEqual(Instant since, Pageable pageable);
    Page<AlertRecord> findBySensorIdAndTsGreaterThanEqual(String sensorId, Instant since, Pageable pageable);
    Page<AlertRecord> findByAcknowledgedAndTsGreaterThanEqual(boolean acknowledged, Instant since, Pageable pageable);
    Page<AlertRecord> findBySensorIdAndAcknowledgedAndTsGreaterThanEqual(String sensorId, boolean acknowledged,
                                                                         Instant since, Pageable pageable);
}
