package org.caureq.caureqsensorhub.repo;

import org.caureq.caureqsensorhub.domain.Reading;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface ReadingRepo extends JpaRepository<Reading, Long> {
    /** Newest first by arrival; callers reverse the slice back to arrival order. */
    List<Reading> findBySensorIdAndTsBetweenOrderByIdDesc(String sensorId, Instant from, Instant to, Pageable pageable);
}
