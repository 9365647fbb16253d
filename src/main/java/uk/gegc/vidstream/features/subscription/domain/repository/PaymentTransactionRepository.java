package uk.gegc.vidstream.features.subscription.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.vidstream.features.subscription.domain.model.PaymentTransaction;
import uk.gegc.vidstream.features.subscription.domain.model.PaymentTransactionStatus;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransaction, String> {

    /**
     * Moves a transaction to COMPLETED unless it already is. Exactly one caller per reference
     * sees {@code 1}; every later caller sees {@code 0} and must not extend the subscription again.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE PaymentTransaction p
        SET p.status = :completed, p.completedAt = :now
        WHERE p.reference = :reference AND p.status <> :completed
        """)
    int markCompletedIfNotCompleted(@Param("reference") String reference,
                                    @Param("completed") PaymentTransactionStatus completed,
                                    @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE PaymentTransaction p
        SET p.status = :failed
        WHERE p.reference = :reference AND p.status = :pending
        """)
    int markFailedIfPending(@Param("reference") String reference,
                            @Param("pending") PaymentTransactionStatus pending,
                            @Param("failed") PaymentTransactionStatus failed);

    Optional<PaymentTransaction> findFirstByUserIdAndStatusOrderByCompletedAtDesc(UUID userId, PaymentTransactionStatus status);

    @Modifying
    @Query("DELETE FROM PaymentTransaction p WHERE p.userId = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}
