package uk.gegc.antidote.features.promo.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "promo_codes",
        uniqueConstraints = @UniqueConstraint(name = "uk_promo_codes_code", columnNames = "code"))
@Getter
@Setter
public class PromoCode {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    /** Stored upper-case. */
    @Column(name = "code", nullable = false, length = 64, updatable = false)
    private String code;

    @Column(name = "description", length = 255)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "discount_type", nullable = false, length = 16)
    private PromoDiscountType discountType;

    /** Percent for {@code PERCENTAGE}, currency units for {@code FIXED}. */
    @Column(name = "discount_value", nullable = false, precision = 12, scale = 2)
    private BigDecimal discountValue;

    @Column(name = "bonus_credits", nullable = false)
    private long bonusCredits;

    @Column(name = "min_amount", nullable = false)
    private long minAmount;

    /** Null means uncapped. */
    @Column(name = "max_discount")
    private Long maxDiscount;

    @Column(name = "usage_limit", nullable = false)
    private int usageLimit;

    @Column(name = "used_count", nullable = false)
    private int usedCount;

    @Column(name = "single_use_per_clinic", nullable = false)
    private boolean singleUsePerClinic;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "valid_from")
    private LocalDateTime validFrom;

    @Column(name = "valid_until")
    private LocalDateTime validUntil;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
