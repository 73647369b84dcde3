package uk.gegc.antidote.features.dispute.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.antidote.features.dispute.domain.model.DisputePriority;
import uk.gegc.antidote.features.dispute.domain.model.DisputeStatus;
import uk.gegc.antidote.features.dispute.domain.model.LeadDispute;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface LeadDisputeRepository extends JpaRepository<LeadDispute, UUID> {

    Optional<LeadDispute> findByOriginTransactionId(UUID originTransactionId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM LeadDispute d WHERE d.id = :id")
    Optional<LeadDispute> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT d FROM LeadDispute d " +
           "WHERE d.clinicId = :clinicId AND (:status IS NULL OR d.status = :status) " +
           "ORDER BY d.createdAt DESC")
    List<LeadDispute> findByClinic(@Param("clinicId") Long clinicId, @Param("status") DisputeStatus status);

    @Query("SELECT d FROM LeadDispute d " +
           "WHERE (:status IS NULL OR d.status = :status) AND (:priority IS NULL OR d.priority = :priority) " +
           "ORDER BY d.createdAt ASC")
    List<LeadDispute> findByFilters(@Param("status") DisputeStatus status, @Param("priority") DisputePriority priority);

    long countByClinicIdAndStatus(Long clinicId, DisputeStatus status);
}
