package org.caureq.caureqsensorhub.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * An alert raised by the evaluator. Never deleted; the only mutation is acknowledgement.
 */
@Entity
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alert_ts", columnList = "ts DESC"),
        @Index(name = "idx_alert_sensor_ts", columnList = "sensor_id, ts DESC")
})
@Getter @NoArgsConstructor(access = AccessLevel.PROTECTED) @AllArgsConstructor @Builder(toBuilder = true)
public class AlertRecord {
    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 128)
    private String sensorId;

    private Long readingId; // null when the reading itself was dead-lettered

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertKind kind;

    @Column(nullable = false)
    private Instant ts;

    @Column(nullable = false)
    private double valueAtTrigger;

    private Double threshold;

    private Double score; // anomaly score, ANOMALY only

    @Column(nullable = false, length = 512)
    private String message;

    @Setter
    @Column(nullable = false)
    private boolean acknowledged;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (ts == null) ts = Instant.now();
    }
}
