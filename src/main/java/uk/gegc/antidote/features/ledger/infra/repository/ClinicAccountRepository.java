package uk.gegc.antidote.features.ledger.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.antidote.features.ledger.domain.model.ClinicAccount;

import java.util.List;
import java.util.Optional;

public interface ClinicAccountRepository extends JpaRepository<ClinicAccount, Long> {

    /**
     * Loads the account with a row lock held until the surrounding transaction ends.
     * Every balance-affecting ledger write goes through this lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM ClinicAccount a WHERE a.clinicId = :clinicId")
    Optional<ClinicAccount> findByClinicIdForUpdate(@Param("clinicId") Long clinicId);

    @Query("SELECT a.clinicId FROM ClinicAccount a ORDER BY a.clinicId")
    List<Long> findAllClinicIds();
}
