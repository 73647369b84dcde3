package uk.gegc.antidote.features.ledger.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import uk.gegc.antidote.BaseUnitTest;
import uk.gegc.antidote.features.ledger.domain.model.ClinicAccount;
import uk.gegc.antidote.features.ledger.infra.repository.ClinicAccountRepository;
import uk.gegc.antidote.features.ledger.infra.repository.CreditTransactionRepository;
import uk.gegc.antidote.shared.exception.InvalidInputException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("LedgerStoreImpl")
class LedgerStoreImplTest extends BaseUnitTest {

    private static final Long CLINIC_ID = 77L;

    @Mock private ClinicAccountRepository accountRepository;
    @Mock private CreditTransactionRepository transactionRepository;
    @Mock private PlatformTransactionManager transactionManager;

    private LedgerStoreImpl ledgerStore;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC);
        ledgerStore = new LedgerStoreImpl(accountRepository, transactionRepository, clock, transactionManager);
    }

    @Nested
    @DisplayName("lockAccount")
    class LockAccount {

        @Test
        @DisplayName("returns the locked row when the account exists")
        void existingAccount() {
            ClinicAccount account = account();
            when(accountRepository.findByClinicIdForUpdate(CLINIC_ID)).thenReturn(Optional.of(account));

            assertThat(ledgerStore.lockAccount(CLINIC_ID)).isSameAs(account);
            verify(accountRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("creates a missing account in its own transaction and then locks it")
        void createsMissingAccount() {
            ClinicAccount created = account();
            when(accountRepository.findByClinicIdForUpdate(CLINIC_ID))
                    .thenReturn(Optional.empty())
                    .thenReturn(Optional.of(created));

            assertThat(ledgerStore.lockAccount(CLINIC_ID)).isSameAs(created);

            ArgumentCaptor<ClinicAccount> saved = ArgumentCaptor.forClass(ClinicAccount.class);
            verify(accountRepository).saveAndFlush(saved.capture());
            assertThat(saved.getValue().getClinicId()).isEqualTo(CLINIC_ID);
            assertThat(saved.getValue().getBalance()).isZero();
            assertThat(saved.getValue().isActive()).isTrue();
            verify(transactionManager).commit(any());
            verify(accountRepository, times(2)).findByClinicIdForUpdate(CLINIC_ID);
        }

        @Test
        @DisplayName("an account opened by a concurrent writer is locked instead of failing")
        void concurrentCreationIsAbsorbed() {
            ClinicAccount winner = account();
            when(accountRepository.findByClinicIdForUpdate(CLINIC_ID))
                    .thenReturn(Optional.empty())
                    .thenReturn(Optional.of(winner));
            when(accountRepository.saveAndFlush(any(ClinicAccount.class)))
                    .thenThrow(new DataIntegrityViolationException("duplicate primary key"));
            when(accountRepository.existsById(CLINIC_ID)).thenReturn(true);

            assertThat(ledgerStore.lockAccount(CLINIC_ID)).isSameAs(winner);
            verify(transactionManager).rollback(any());
        }

        @Test
        @DisplayName("an insert failure that left no account behind is rethrown")
        void unrelatedFailureRethrown() {
            when(accountRepository.findByClinicIdForUpdate(CLINIC_ID)).thenReturn(Optional.empty());
            when(accountRepository.saveAndFlush(any(ClinicAccount.class)))
                    .thenThrow(new DataIntegrityViolationException("check constraint"));
            when(accountRepository.existsById(CLINIC_ID)).thenReturn(false);

            assertThatThrownBy(() -> ledgerStore.lockAccount(CLINIC_ID))
                    .isInstanceOf(DataIntegrityViolationException.class);
        }

        @Test
        @DisplayName("a null clinic id is invalid input")
        void nullClinic() {
            assertThatThrownBy(() -> ledgerStore.lockAccount(null))
                    .isInstanceOf(InvalidInputException.class);
        }
    }

    private static ClinicAccount account() {
        ClinicAccount account = new ClinicAccount();
        account.setClinicId(CLINIC_ID);
        account.setBalance(0L);
        account.setActive(true);
        return account;
    }
}
