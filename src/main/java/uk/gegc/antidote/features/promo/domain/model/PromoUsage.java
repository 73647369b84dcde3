package uk.gegc.antidote.features.promo.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "promo_usages",
        uniqueConstraints = @UniqueConstraint(name = "uk_promo_usages_transaction", columnNames = "transaction_id"),
        indexes = @Index(name = "idx_promo_usages_clinic_code", columnList = "clinic_id, promo_code_id, status"))
@Getter
@Setter
public class PromoUsage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "clinic_id", nullable = false, updatable = false)
    private Long clinicId;

    @Column(name = "promo_code_id", nullable = false, updatable = false)
    private UUID promoCodeId;

    /** The purchase this usage belongs to. */
    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    @Column(name = "discount_applied", nullable = false)
    private long discountApplied;

    @Column(name = "bonus_credits", nullable = false)
    private long bonusCredits;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PromoUsageStatus status;

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

    @PreUpdate
    void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
