package uk.gegc.antidote.features.ledger.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "credit_transactions",
        uniqueConstraints = @UniqueConstraint(name = "uk_credit_tx_idempotency_key", columnNames = "idempotency_key"),
        indexes = {
                @Index(name = "idx_credit_tx_clinic_created", columnList = "clinic_id, created_at, id"),
                @Index(name = "idx_credit_tx_order", columnList = "external_order_id"),
                @Index(name = "idx_credit_tx_kind_status_created", columnList = "kind, status, created_at")
        })
@Getter
@Setter
public class CreditTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "clinic_id", nullable = false, updatable = false)
    private Long clinicId;

    /** Positive for credits, negative for debits. */
    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 32, updatable = false)
    private CreditTransactionKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private CreditTransactionStatus status;

    @Column(name = "lead_id")
    private Long leadId;

    @Column(name = "external_order_id", length = 64)
    private String externalOrderId;

    @Column(name = "external_payment_id", length = 64)
    private String externalPaymentId;

    @Column(name = "idempotency_key", nullable = false, length = 191, updatable = false)
    private String idempotencyKey;

    @Column(name = "ref_id", length = 255)
    private String refId;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "meta_json", length = 2000)
    private String metaJson;

    @Column(name = "failure_reason", length = 255)
    private String failureReason;

    @Column(name = "balance_after")
    private Long balanceAfter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }

    public boolean isPending() {
        return status == CreditTransactionStatus.PENDING;
    }
}
