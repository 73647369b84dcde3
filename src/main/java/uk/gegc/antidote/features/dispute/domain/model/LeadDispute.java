package uk.gegc.antidote.features.dispute.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A clinic's challenge of a lead charge. One dispute per charged transaction, ever.
 */
@Entity
@Table(name = "lead_disputes",
        uniqueConstraints = @UniqueConstraint(name = "uk_lead_disputes_origin_tx", columnNames = "origin_transaction_id"),
        indexes = {
                @Index(name = "idx_lead_disputes_clinic_status", columnList = "clinic_id, status"),
                @Index(name = "idx_lead_disputes_status_priority", columnList = "status, priority")
        })
@Getter
@Setter
public class LeadDispute {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "lead_id", nullable = false, updatable = false)
    private Long leadId;

    @Column(name = "clinic_id", nullable = false, updatable = false)
    private Long clinicId;

    @Column(name = "origin_transaction_id", nullable = false, updatable = false)
    private UUID originTransactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 48)
    private DisputeReason reason;

    @Column(name = "description", length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private DisputeStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 16)
    private DisputePriority priority;

    @Column(name = "admin_notes", length = 2000)
    private String adminNotes;

    @Column(name = "resolved_by", length = 128)
    private String resolvedBy;

    @Column(name = "refund_amount")
    private Long refundAmount;

    @Column(name = "refund_transaction_id")
    private UUID refundTransactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
