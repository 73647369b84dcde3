package uk.gegc.antidote.features.ledger.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Prepaid credit account of a clinic. {@code balance} is a cache of the sum of the clinic's
 * completed credit transactions and is only ever changed together with a ledger entry.
 */
@Entity
@Table(name = "clinic_accounts")
@Getter
@Setter
public class ClinicAccount {

    @Id
    @Column(name = "clinic_id", nullable = false, updatable = false)
    private Long clinicId;

    @Column(name = "balance", nullable = false)
    private long balance;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
