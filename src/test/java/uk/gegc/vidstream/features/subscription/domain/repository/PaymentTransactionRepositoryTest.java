package uk.gegc.vidstream.features.subscription.domain.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.vidstream.features.subscription.domain.model.PaymentTransaction;
import uk.gegc.vidstream.features.subscription.domain.model.PaymentTransactionStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("Payment transaction repository")
class PaymentTransactionRepositoryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 1, 10, 0);

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private PaymentTransactionRepository paymentTransactionRepository;

    private UUID userId;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
    }

    private PaymentTransaction persist(String reference, PaymentTransactionStatus status, LocalDateTime completedAt) {
        PaymentTransaction transaction = new PaymentTransaction();
        transaction.setReference(reference);
        transaction.setUserId(userId);
        transaction.setPlanId(UUID.randomUUID());
        transaction.setAmount(new BigDecimal("5000.00"));
        transaction.setCurrency("MWK");
        transaction.setStatus(status);
        transaction.setCreatedAt(NOW.minusHours(1));
        transaction.setCompletedAt(completedAt);
        return entityManager.persistFlushFind(transaction);
    }

    @Test
    @DisplayName("only the first completion of a reference succeeds")
    void completesOnce() {
        persist("sub-once", PaymentTransactionStatus.PENDING, null);

        int first = paymentTransactionRepository.markCompletedIfNotCompleted("sub-once", PaymentTransactionStatus.COMPLETED, NOW);
        int second = paymentTransactionRepository.markCompletedIfNotCompleted("sub-once", PaymentTransactionStatus.COMPLETED, NOW.plusMinutes(1));

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        PaymentTransaction reloaded = paymentTransactionRepository.findById("sub-once").orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(PaymentTransactionStatus.COMPLETED);
        assertThat(reloaded.getCompletedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("a failed transaction can still complete when the provider later confirms it")
    void failedThenCompleted() {
        persist("sub-late", PaymentTransactionStatus.FAILED, null);

        assertThat(paymentTransactionRepository.markCompletedIfNotCompleted("sub-late", PaymentTransactionStatus.COMPLETED, NOW))
                .isEqualTo(1);
    }

    @Test
    @DisplayName("marking failed only affects pending rows")
    void failsOnlyPending() {
        persist("sub-pending", PaymentTransactionStatus.PENDING, null);
        persist("sub-done", PaymentTransactionStatus.COMPLETED, NOW);

        assertThat(paymentTransactionRepository.markFailedIfPending("sub-pending", PaymentTransactionStatus.PENDING, PaymentTransactionStatus.FAILED))
                .isEqualTo(1);
        assertThat(paymentTransactionRepository.markFailedIfPending("sub-done", PaymentTransactionStatus.PENDING, PaymentTransactionStatus.FAILED))
                .isZero();
        assertThat(paymentTransactionRepository.findById("sub-done").orElseThrow().getStatus())
                .isEqualTo(PaymentTransactionStatus.COMPLETED);
    }

    @Test
    @DisplayName("the latest completed payment is found per user")
    void latestCompleted() {
        persist("sub-old", PaymentTransactionStatus.COMPLETED, NOW.minusDays(30));
        persist("sub-new", PaymentTransactionStatus.COMPLETED, NOW);
        persist("sub-open", PaymentTransactionStatus.PENDING, null);

        assertThat(paymentTransactionRepository.findFirstByUserIdAndStatusOrderByCompletedAtDesc(userId, PaymentTransactionStatus.COMPLETED))
                .map(PaymentTransaction::getReference)
                .contains("sub-new");
    }
}
