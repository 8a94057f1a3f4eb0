package org.caureq.caureqsensorhub.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One timestamped observation. The id is assigned by the store on insert and
 * follows arrival order at the processing core.
 */
@Entity
@Table(name = "readings", indexes = {
        @Index(name = "idx_reading_sensor_id", columnList = "sensor_id, id")
})
@Getter @ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED) @AllArgsConstructor @Builder(toBuilder = true)
public class Reading {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String sensorId;

    @Column(nullable = false)
    private Instant ts;

    @Column(name = "reading_value", nullable = false)
    private double value;

    @Column(length = 16)
    private String unit;
}
