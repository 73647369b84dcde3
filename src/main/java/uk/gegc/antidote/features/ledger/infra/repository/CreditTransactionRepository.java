package uk.gegc.antidote.features.ledger.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransaction;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransactionKind;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransactionStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CreditTransactionRepository extends JpaRepository<CreditTransaction, UUID> {

    Optional<CreditTransaction> findByIdempotencyKey(String idempotencyKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM CreditTransaction t WHERE t.id = :id")
    Optional<CreditTransaction> findByIdForUpdate(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM CreditTransaction t WHERE t.idempotencyKey = :idempotencyKey")
    Optional<CreditTransaction> findByIdempotencyKeyForUpdate(@Param("idempotencyKey") String idempotencyKey);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM CreditTransaction t " +
           "WHERE t.clinicId = :clinicId AND t.status = :status")
    long sumAmountByClinicIdAndStatus(@Param("clinicId") Long clinicId,
                                      @Param("status") CreditTransactionStatus status);

    @Query("SELECT t.id FROM CreditTransaction t " +
           "WHERE t.kind = :kind AND t.status = :status AND t.createdAt < :cutoff " +
           "ORDER BY t.createdAt ASC")
    List<UUID> findIdsByKindAndStatusCreatedBefore(@Param("kind") CreditTransactionKind kind,
                                                   @Param("status") CreditTransactionStatus status,
                                                   @Param("cutoff") LocalDateTime cutoff);

    @Query("SELECT t FROM CreditTransaction t " +
           "WHERE t.clinicId = :clinicId " +
           "AND (:kind IS NULL OR t.kind = :kind) " +
           "ORDER BY t.createdAt DESC, t.id DESC")
    List<CreditTransaction> findFirstPage(@Param("clinicId") Long clinicId,
                                          @Param("kind") CreditTransactionKind kind,
                                          Pageable pageable);

    @Query("SELECT t FROM CreditTransaction t " +
           "WHERE t.clinicId = :clinicId " +
           "AND (:kind IS NULL OR t.kind = :kind) " +
           "AND (t.createdAt < :createdAt OR (t.createdAt = :createdAt AND t.id < :id)) " +
           "ORDER BY t.createdAt DESC, t.id DESC")
    List<CreditTransaction> findPageAfter(@Param("clinicId") Long clinicId,
                                          @Param("kind") CreditTransactionKind kind,
                                          @Param("createdAt") LocalDateTime createdAt,
                                          @Param("id") UUID id,
                                          Pageable pageable);
}
