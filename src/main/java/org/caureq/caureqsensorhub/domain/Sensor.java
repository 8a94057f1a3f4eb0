package org.caureq.caureqsensorhub.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A physical sensor, registered on the first reading seen for its id.
 * The core never updates or deletes it.
 */
@Entity
@Table(name = "sensors")
@Getter @NoArgsConstructor(access = AccessLevel.PROTECTED) @AllArgsConstructor @Builder
public class Sensor {

    @Id
    @Column(length = 128)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private SensorType type;

    @Column(length = 128)
    private String name;

    @Column(length = 128)
    private String location;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
