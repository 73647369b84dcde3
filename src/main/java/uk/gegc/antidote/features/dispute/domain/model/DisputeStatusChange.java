package uk.gegc.antidote.features.dispute.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Audit row written on filing ({@code fromStatus} null) and on resolution.
 */
@Entity
@Table(name = "dispute_status_changes",
        indexes = @Index(name = "idx_dispute_changes_dispute", columnList = "dispute_id, changed_at"))
@Getter
@Setter
public class DisputeStatusChange {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "dispute_id", nullable = false, updatable = false)
    private UUID disputeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", length = 16, updatable = false)
    private DisputeStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, length = 16, updatable = false)
    private DisputeStatus toStatus;

    @Column(name = "actor", nullable = false, length = 128, updatable = false)
    private String actor;

    @Column(name = "note", length = 2000, updatable = false)
    private String note;

    @Column(name = "changed_at", nullable = false, updatable = false)
    private LocalDateTime changedAt;
}
