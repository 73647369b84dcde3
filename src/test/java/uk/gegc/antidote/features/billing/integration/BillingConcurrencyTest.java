package uk.gegc.antidote.features.billing.integration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import uk.gegc.antidote.features.billing.api.dto.DeductionResult;
import uk.gegc.antidote.features.billing.application.BillingService;
import uk.gegc.antidote.features.payment.application.OrderHandle;
import uk.gegc.antidote.features.payment.application.PaymentGateway;
import uk.gegc.antidote.features.promo.api.dto.CreatePromoCodeRequest;
import uk.gegc.antidote.features.promo.application.PromoCodeService;
import uk.gegc.antidote.features.promo.domain.exception.PromoInvalidException;
import uk.gegc.antidote.features.promo.domain.exception.PromoRejectionReason;
import uk.gegc.antidote.features.promo.domain.model.PromoDiscountType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Runs without a test transaction so that concurrent callers really commit against each other.
 */
@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@DisplayName("Billing under concurrent callers")
class BillingConcurrencyTest {

    private static final int THREADS = 6;

    @Autowired private BillingService billingService;
    @Autowired private PromoCodeService promoCodeService;
    @Autowired private JdbcTemplate jdbcTemplate;

    @MockitoBean
    private PaymentGateway paymentGateway;

    private final AtomicInteger orderSequence = new AtomicInteger();
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(THREADS);
        when(paymentGateway.createOrder(any(), anyLong(), anyString())).thenAnswer(inv -> {
            String orderId = "order_cc_" + orderSequence.incrementAndGet();
            long charge = inv.getArgument(1);
            return new OrderHandle(orderId, charge, "INR", "rzp_test_key", Map.of());
        });
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        jdbcTemplate.update("DELETE FROM dispute_status_changes");
        jdbcTemplate.update("DELETE FROM lead_disputes");
        jdbcTemplate.update("DELETE FROM promo_usages");
        jdbcTemplate.update("DELETE FROM credit_transactions");
        jdbcTemplate.update("DELETE FROM promo_codes");
        jdbcTemplate.update("DELETE FROM clinic_accounts");
    }

    @Test
    @WithMockUser(username = "ops-admin", authorities = "BILLING_ADMIN")
    @DisplayName("the same lead delivered concurrently is debited exactly once")
    void concurrentDeductionOfSameLead() throws Exception {
        billingService.openAccount(301L);

        List<DeductionResult> results = runConcurrently(
                () -> billingService.deductForLead(301L, 77L, new BigDecimal("7500")));

        assertThat(results).hasSize(THREADS);
        assertThat(results).filteredOn(r -> !r.duplicate()).hasSize(1);
        assertThat(results).extracting(DeductionResult::transactionId).containsOnly(results.get(0).transactionId());
        assertThat(billingService.getBalance(301L).balance()).isEqualTo(-180L);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM credit_transactions WHERE clinic_id = 301", Integer.class)).isEqualTo(1);
    }

    @Test
    @DisplayName("concurrent first deliveries to a clinic without an account are all billed")
    void concurrentFirstWritesOpenOneAccount() throws Exception {
        AtomicInteger lead = new AtomicInteger(1000);

        List<DeductionResult> results = runConcurrently(
                () -> billingService.deductForLead(302L, (long) lead.incrementAndGet(), new BigDecimal("7500")));

        assertThat(results).hasSize(THREADS);
        assertThat(results).noneMatch(DeductionResult::duplicate);
        assertThat(results).extracting(DeductionResult::leadId).doesNotHaveDuplicates();
        assertThat(billingService.getBalance(302L).balance()).isEqualTo(-180L * THREADS);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM clinic_accounts WHERE clinic_id = 302", Integer.class)).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM credit_transactions WHERE clinic_id = 302 AND kind = 'LEAD_DEDUCTION'",
                Integer.class)).isEqualTo(THREADS);
    }

    @Test
    @WithMockUser(username = "ops-admin", authorities = "BILLING_ADMIN")
    @DisplayName("a promo with one use left is reserved by only one of several clinics")
    void concurrentPromoRedemption() throws Exception {
        promoCodeService.create(new CreatePromoCodeRequest("LASTONE", "one left", PromoDiscountType.PERCENTAGE,
                new BigDecimal("10"), 0, 0, null, 1, false, null, null));
        AtomicInteger clinic = new AtomicInteger(400);

        List<Future<Object>> futures = submitConcurrently(() -> {
            long clinicId = clinic.incrementAndGet();
            try {
                return billingService.initiateTopUp(clinicId, 5000, "LASTONE");
            } catch (PromoInvalidException e) {
                return e.getReason();
            }
        });

        int reserved = 0;
        int exhausted = 0;
        for (Future<Object> future : futures) {
            Object outcome = future.get(30, TimeUnit.SECONDS);
            if (outcome == PromoRejectionReason.EXHAUSTED) {
                exhausted++;
            } else {
                reserved++;
            }
        }
        assertThat(reserved).isEqualTo(1);
        assertThat(exhausted).isEqualTo(THREADS - 1);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT used_count FROM promo_codes WHERE code = 'LASTONE'", Integer.class)).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM credit_transactions WHERE kind = 'PURCHASE'", Integer.class)).isEqualTo(1);
    }

    private <T> List<T> runConcurrently(Callable<T> task) throws InterruptedException, ExecutionException,
            java.util.concurrent.TimeoutException {
        List<T> results = new ArrayList<>();
        for (Future<T> future : submitConcurrently(task)) {
            results.add(future.get(30, TimeUnit.SECONDS));
        }
        return results;
    }

    private <T> List<Future<T>> submitConcurrently(Callable<T> task) throws InterruptedException {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();
        return futures;
    }
}
