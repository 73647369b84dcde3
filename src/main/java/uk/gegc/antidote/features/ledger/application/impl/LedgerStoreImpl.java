package uk.gegc.antidote.features.ledger.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;
import uk.gegc.antidote.features.ledger.application.LedgerEntry;
import uk.gegc.antidote.features.ledger.application.LedgerPage;
import uk.gegc.antidote.features.ledger.application.LedgerStore;
import uk.gegc.antidote.features.ledger.application.LedgerStructuredLogger;
import uk.gegc.antidote.features.ledger.application.PageTokenCodec;
import uk.gegc.antidote.features.ledger.application.TransitionResult;
import uk.gegc.antidote.features.ledger.domain.exception.DuplicateLedgerEntryException;
import uk.gegc.antidote.features.ledger.domain.model.ClinicAccount;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransaction;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransactionKind;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransactionStatus;
import uk.gegc.antidote.features.ledger.infra.repository.ClinicAccountRepository;
import uk.gegc.antidote.features.ledger.infra.repository.CreditTransactionRepository;
import uk.gegc.antidote.shared.exception.InvalidInputException;
import uk.gegc.antidote.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
public class LedgerStoreImpl implements LedgerStore {

    private final ClinicAccountRepository accountRepository;
    private final CreditTransactionRepository transactionRepository;
    private final Clock clock;
    private final TransactionTemplate accountCreation;

    public LedgerStoreImpl(ClinicAccountRepository accountRepository,
                           CreditTransactionRepository transactionRepository,
                           Clock clock,
                           PlatformTransactionManager transactionManager) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
        this.clock = clock;
        this.accountCreation = new TransactionTemplate(transactionManager);
        this.accountCreation.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    @Transactional
    public ClinicAccount openAccount(Long clinicId) {
        ClinicAccount account = lockAccount(clinicId);
        if (!account.isActive()) {
            account.setActive(true);
            log.info("Reactivated clinic account {}", clinicId);
        }
        return account;
    }

    @Override
    @Transactional
    public void deactivateAccount(Long clinicId) {
        ClinicAccount account = accountRepository.findByClinicIdForUpdate(clinicId)
                .orElseThrow(() -> new ResourceNotFoundException("No account for clinic " + clinicId));
        account.setActive(false);
        log.info("Deactivated clinic account {}", clinicId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ClinicAccount> findAccount(Long clinicId) {
        return accountRepository.findById(clinicId);
    }

    @Override
    @Transactional
    public ClinicAccount lockAccount(Long clinicId) {
        if (clinicId == null) {
            throw new InvalidInputException("clinicId is required");
        }
        Optional<ClinicAccount> locked = accountRepository.findByClinicIdForUpdate(clinicId);
        if (locked.isPresent()) {
            return locked.get();
        }
        // a missing row cannot be locked, so the insert commits on its own and the lock is taken afterwards
        createAccount(clinicId);
        return accountRepository.findByClinicIdForUpdate(clinicId)
                .orElseThrow(() -> new IllegalStateException("Account for clinic " + clinicId + " missing after creation"));
    }

    private void createAccount(Long clinicId) {
        try {
            accountCreation.executeWithoutResult(status -> {
                ClinicAccount account = new ClinicAccount();
                account.setClinicId(clinicId);
                account.setBalance(0L);
                account.setActive(true);
                account.setCreatedAt(now());
                accountRepository.saveAndFlush(account);
            });
            log.info("Opened clinic account {}", clinicId);
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            if (!accountRepository.existsById(clinicId)) {
                throw e;
            }
            log.debug("Account for clinic {} was opened by a concurrent writer", clinicId);
        }
    }

    @Override
    @Transactional
    public CreditTransaction append(LedgerEntry entry) {
        validate(entry);
        ClinicAccount account = lockAccount(entry.clinicId());

        if (transactionRepository.findByIdempotencyKey(entry.idempotencyKey()).isPresent()) {
            throw new DuplicateLedgerEntryException(
                    "Ledger entry already exists for key " + entry.idempotencyKey(), entry.idempotencyKey());
        }

        CreditTransaction tx = new CreditTransaction();
        tx.setClinicId(entry.clinicId());
        tx.setAmount(entry.amount());
        tx.setKind(entry.kind());
        tx.setStatus(entry.status());
        tx.setIdempotencyKey(entry.idempotencyKey());
        tx.setLeadId(entry.leadId());
        tx.setExternalOrderId(entry.externalOrderId());
        tx.setExternalPaymentId(entry.externalPaymentId());
        tx.setRefId(entry.refId());
        tx.setDescription(entry.description());
        tx.setMetaJson(entry.metaJson());
        tx.setCreatedAt(now());

        if (entry.status() == CreditTransactionStatus.COMPLETED) {
            account.setBalance(account.getBalance() + entry.amount());
            tx.setBalanceAfter(account.getBalance());
        }

        try {
            tx = transactionRepository.saveAndFlush(tx);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateLedgerEntryException(
                    "Ledger entry already exists for key " + entry.idempotencyKey(), entry.idempotencyKey(), e);
        }
        accountRepository.save(account);

        LedgerStructuredLogger.logLedgerWrite(log, "Appended {} {} entry for clinic {}",
                tx, tx.getStatus(), tx.getKind(), tx.getClinicId());
        return tx;
    }

    @Override
    @Transactional
    public TransitionResult complete(UUID transactionId, String paymentId) {
        CreditTransaction tx = transactionRepository.findByIdForUpdate(transactionId)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction " + transactionId + " not found"));
        if (!tx.isPending()) {
            log.debug("Transaction {} is {}; completion skipped", transactionId, tx.getStatus());
            return new TransitionResult(tx, false);
        }

        ClinicAccount account = lockAccount(tx.getClinicId());
        account.setBalance(account.getBalance() + tx.getAmount());
        tx.setStatus(CreditTransactionStatus.COMPLETED);
        tx.setExternalPaymentId(paymentId);
        tx.setBalanceAfter(account.getBalance());
        tx.setUpdatedAt(now());
        transactionRepository.save(tx);
        accountRepository.save(account);

        LedgerStructuredLogger.logLedgerWrite(log, "Completed {} entry {} for clinic {}",
                tx, tx.getKind(), tx.getId(), tx.getClinicId());
        return new TransitionResult(tx, true);
    }

    @Override
    @Transactional
    public TransitionResult fail(UUID transactionId, String reason) {
        CreditTransaction tx = transactionRepository.findByIdForUpdate(transactionId)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction " + transactionId + " not found"));
        if (!tx.isPending()) {
            log.debug("Transaction {} is {}; failure skipped", transactionId, tx.getStatus());
            return new TransitionResult(tx, false);
        }

        tx.setStatus(CreditTransactionStatus.FAILED);
        tx.setFailureReason(reason);
        tx.setUpdatedAt(now());
        transactionRepository.save(tx);

        log.info("Failed {} entry {} for clinic {}: {}", tx.getKind(), tx.getId(), tx.getClinicId(), reason);
        return new TransitionResult(tx, true);
    }

    @Override
    @Transactional(readOnly = true)
    public long getBalance(Long clinicId) {
        return accountRepository.findById(clinicId)
                .map(ClinicAccount::getBalance)
                .orElse(0L);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CreditTransaction> findTransaction(UUID transactionId) {
        return transactionRepository.findById(transactionId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CreditTransaction> findByIdempotencyKey(String idempotencyKey) {
        return transactionRepository.findByIdempotencyKey(idempotencyKey);
    }

    @Override
    @Transactional
    public Optional<CreditTransaction> lockByIdempotencyKey(String idempotencyKey) {
        return transactionRepository.findByIdempotencyKeyForUpdate(idempotencyKey);
    }

    @Override
    @Transactional
    public Optional<CreditTransaction> lockTransaction(UUID transactionId) {
        return transactionRepository.findByIdForUpdate(transactionId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<UUID> findPendingPurchasesCreatedBefore(LocalDateTime cutoff) {
        return transactionRepository.findIdsByKindAndStatusCreatedBefore(
                CreditTransactionKind.PURCHASE, CreditTransactionStatus.PENDING, cutoff);
    }

    @Override
    @Transactional(readOnly = true)
    public LedgerPage listTransactions(Long clinicId, String pageToken, int size, CreditTransactionKind kind) {
        if (size < 1 || size > 100) {
            throw new InvalidInputException("Page size must be between 1 and 100");
        }
        // one extra row tells us whether another page exists
        PageRequest limit = PageRequest.of(0, size + 1);
        List<CreditTransaction> rows;
        if (StringUtils.hasText(pageToken)) {
            PageTokenCodec.Cursor cursor = PageTokenCodec.decode(pageToken);
            rows = transactionRepository.findPageAfter(clinicId, kind, cursor.createdAt(), cursor.id(), limit);
        } else {
            rows = transactionRepository.findFirstPage(clinicId, kind, limit);
        }

        if (rows.size() <= size) {
            return new LedgerPage(rows, null);
        }
        List<CreditTransaction> page = new ArrayList<>(rows.subList(0, size));
        return new LedgerPage(page, PageTokenCodec.encode(page.get(page.size() - 1)));
    }

    private void validate(LedgerEntry entry) {
        if (entry.clinicId() == null) {
            throw new InvalidInputException("clinicId is required");
        }
        if (entry.kind() == null) {
            throw new InvalidInputException("Transaction kind is required");
        }
        if (entry.status() != CreditTransactionStatus.PENDING && entry.status() != CreditTransactionStatus.COMPLETED) {
            throw new InvalidInputException("Only PENDING or COMPLETED entries can be appended");
        }
        if (entry.amount() == 0) {
            throw new InvalidInputException("Transaction amount must be non-zero");
        }
        if (!StringUtils.hasText(entry.idempotencyKey())) {
            throw new InvalidInputException("Idempotency key is required");
        }
    }

    private LocalDateTime now() {
        // the database keeps microseconds; keep page cursors comparable with stored values
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
