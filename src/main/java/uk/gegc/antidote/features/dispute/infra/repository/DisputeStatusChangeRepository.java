package uk.gegc.antidote.features.dispute.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.antidote.features.dispute.domain.model.DisputeStatusChange;

import java.util.List;
import java.util.UUID;

public interface DisputeStatusChangeRepository extends JpaRepository<DisputeStatusChange, UUID> {

    List<DisputeStatusChange> findByDisputeIdOrderByChangedAtAsc(UUID disputeId);
}
