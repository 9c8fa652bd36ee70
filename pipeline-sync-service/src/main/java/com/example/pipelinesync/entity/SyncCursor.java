package com.example.pipelinesync.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Resume point for one entity and mode.
 * FULL rows hold the Source continuation token, INCREMENTAL rows hold an ISO-8601 watermark.
 */
@Entity
@Table(name = "sync_cursors",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_sync_cursors_entity_mode",
                        columnNames = {"entity_name", "mode"})
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncCursor extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_name", nullable = false, length = 100)
    private String entityName;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode", nullable = false, length = 20)
    private SyncMode mode;

    @Column(name = "cursor_value", columnDefinition = "TEXT")
    private String cursorValue;
}
