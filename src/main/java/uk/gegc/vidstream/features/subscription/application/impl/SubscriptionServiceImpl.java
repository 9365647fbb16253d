package uk.gegc.vidstream.features.subscription.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.vidstream.features.subscription.api.dto.InitiatePaymentRequest;
import uk.gegc.vidstream.features.subscription.api.dto.InitiatePaymentResponse;
import uk.gegc.vidstream.features.subscription.api.dto.SubscriptionPlanDto;
import uk.gegc.vidstream.features.subscription.api.dto.SubscriptionStatusDto;
import uk.gegc.vidstream.features.subscription.application.ActivationResult;
import uk.gegc.vidstream.features.subscription.application.PaymentGateway;
import uk.gegc.vidstream.features.subscription.application.PaymentGateway.ChargeRequest;
import uk.gegc.vidstream.features.subscription.application.PaymentGateway.ProviderCharge;
import uk.gegc.vidstream.features.subscription.application.PaymentGateway.ProviderVerification;
import uk.gegc.vidstream.features.subscription.application.SubscriptionGuard;
import uk.gegc.vidstream.features.subscription.application.SubscriptionMetricsService;
import uk.gegc.vidstream.features.subscription.application.SubscriptionService;
import uk.gegc.vidstream.features.subscription.application.SubscriptionState;
import uk.gegc.vidstream.features.subscription.domain.exception.InvalidTransactionReferenceException;
import uk.gegc.vidstream.features.subscription.domain.exception.PaymentNotCompletedException;
import uk.gegc.vidstream.features.subscription.domain.exception.PaymentVerificationUnavailableException;
import uk.gegc.vidstream.features.subscription.domain.model.PaymentTransaction;
import uk.gegc.vidstream.features.subscription.domain.model.PaymentTransactionStatus;
import uk.gegc.vidstream.features.subscription.domain.model.SubscriptionPlan;
import uk.gegc.vidstream.features.subscription.domain.repository.PaymentTransactionRepository;
import uk.gegc.vidstream.features.subscription.domain.repository.SubscriptionPlanRepository;
import uk.gegc.vidstream.features.subscription.infra.mapping.SubscriptionPlanMapper;
import uk.gegc.vidstream.features.user.domain.model.User;
import uk.gegc.vidstream.features.user.domain.repository.UserRepository;
import uk.gegc.vidstream.shared.email.EmailService;
import uk.gegc.vidstream.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionServiceImpl implements SubscriptionService {

    static final String REFERENCE_PREFIX = "sub-";
    private static final String UNKNOWN_REFERENCE = "Unknown transaction reference";

    private final PaymentTransactionRepository paymentTransactionRepository;
    private final SubscriptionPlanRepository planRepository;
    private final UserRepository userRepository;
    private final PaymentGateway paymentGateway;
    private final SubscriptionGuard subscriptionGuard;
    private final SubscriptionPlanMapper planMapper;
    private final SubscriptionMetricsService metricsService;
    private final EmailService emailService;
    private final TransactionTemplate transactionTemplate;
    @Qualifier("utcClock")
    private final Clock utcClock;

    @Override
    public InitiatePaymentResponse initiatePayment(User user, InitiatePaymentRequest request) {
        SubscriptionPlan plan = planRepository.findById(request.planId())
                .filter(SubscriptionPlan::isActive)
                .orElseThrow(() -> new ResourceNotFoundException("Subscription plan not found or inactive"));

        String reference = REFERENCE_PREFIX + UUID.randomUUID();
        PaymentTransaction transaction = new PaymentTransaction();
        transaction.setReference(reference);
        transaction.setUserId(user.getId());
        transaction.setPlanId(plan.getId());
        transaction.setAmount(plan.getPrice());
        transaction.setCurrency(plan.getCurrency());
        transaction.setStatus(PaymentTransactionStatus.PENDING);
        transaction.setCreatedAt(LocalDateTime.now(utcClock));
        paymentTransactionRepository.save(transaction);

        ProviderCharge charge;
        try {
            charge = paymentGateway.initiateCharge(new ChargeRequest(
                    reference,
                    plan.getPrice(),
                    plan.getCurrency(),
                    request.phoneNumber(),
                    request.network(),
                    user.getEmail(),
                    user.getFirstName(),
                    user.getLastName(),
                    "VidStream " + plan.getName() + " subscription"
            ));
        } catch (PaymentVerificationUnavailableException ex) {
            transactionTemplate.executeWithoutResult(status -> paymentTransactionRepository.markFailedIfPending(
                    reference, PaymentTransactionStatus.PENDING, PaymentTransactionStatus.FAILED));
            throw ex;
        }

        log.info("Initiated payment {} for user {} on plan '{}' ({} {})",
                reference, user.getId(), plan.getName(), plan.getPrice(), plan.getCurrency());
        return new InitiatePaymentResponse(
                charge.paymentUrl(),
                reference,
                "/api/v1/subscriptions/payments/" + reference + "/verify",
                plan.getId()
        );
    }

    @Override
    public SubscriptionStatusDto verifyPayment(User user, String reference) {
        paymentTransactionRepository.findById(reference)
                .filter(transaction -> transaction.getUserId().equals(user.getId()))
                .orElseThrow(() -> new InvalidTransactionReferenceException(UNKNOWN_REFERENCE));
        confirmAndActivate(reference);
        return getStatus(user.getId());
    }

    @Override
    public ActivationResult confirmAndActivate(String reference) {
        PaymentTransaction transaction = paymentTransactionRepository.findById(reference)
                .orElseThrow(() -> new InvalidTransactionReferenceException(UNKNOWN_REFERENCE));
        if (transaction.getStatus() == PaymentTransactionStatus.COMPLETED) {
            metricsService.incrementActivationAlreadyApplied();
            log.debug("Transaction {} already completed; skipping provider verification", reference);
            return ActivationResult.ALREADY_APPLIED;
        }
        confirmWithProvider(transaction);
        return applyActivation(reference);
    }

    @Override
    public ActivationResult applyActivation(String reference) {
        AppliedActivation applied = transactionTemplate.execute(status -> completeAndExtend(reference));
        if (applied == null) {
            metricsService.incrementActivationAlreadyApplied();
            log.info("Transaction {} was already applied; subscription left unchanged", reference);
            return ActivationResult.ALREADY_APPLIED;
        }
        metricsService.incrementActivationApplied(applied.planName());
        emailService.sendSubscriptionActivatedEmail(applied.email(), applied.planName(), applied.expiry());
        return ActivationResult.APPLIED;
    }

    @Override
    @Transactional(readOnly = true)
    public SubscriptionStatusDto getStatus(UUID userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User " + userId + " not found"));
        SubscriptionState state = subscriptionGuard.stateOf(user);
        SubscriptionPlanDto currentPlan = paymentTransactionRepository
                .findFirstByUserIdAndStatusOrderByCompletedAtDesc(userId, PaymentTransactionStatus.COMPLETED)
                .flatMap(transaction -> planRepository.findById(transaction.getPlanId()))
                .map(planMapper::toDto)
                .orElse(null);
        return new SubscriptionStatusDto(
                user.isSubscribed(),
                user.getSubscriptionExpiry(),
                state == SubscriptionState.ACTIVE,
                state,
                currentPlan
        );
    }

    private void confirmWithProvider(PaymentTransaction transaction) {
        ProviderVerification verification = paymentGateway.verifyCharge(transaction.getReference());
        if (!verification.successful()) {
            log.info("Provider reports transaction {} as '{}'", transaction.getReference(), verification.status());
            throw new PaymentNotCompletedException("Payment not completed or failed");
        }
        if (verification.amount() == null || verification.amount().compareTo(transaction.getAmount()) < 0) {
            log.warn("Transaction {} paid {} but {} was due",
                    transaction.getReference(), verification.amount(), transaction.getAmount());
            throw new PaymentNotCompletedException("Paid amount does not cover the plan price");
        }
        if (verification.currency() != null && !verification.currency().equalsIgnoreCase(transaction.getCurrency())) {
            log.warn("Transaction {} paid in {} but the plan is priced in {}",
                    transaction.getReference(), verification.currency(), transaction.getCurrency());
            throw new PaymentNotCompletedException("Payment currency does not match the plan");
        }
    }

    /**
     * Runs inside the activation transaction. Returns {@code null} when another caller already
     * completed the reference.
     */
    private AppliedActivation completeAndExtend(String reference) {
        LocalDateTime now = LocalDateTime.now(utcClock);
        int updated = paymentTransactionRepository.markCompletedIfNotCompleted(
                reference, PaymentTransactionStatus.COMPLETED, now);
        if (updated == 0) {
            return null;
        }

        PaymentTransaction transaction = paymentTransactionRepository.findById(reference)
                .orElseThrow(() -> new InvalidTransactionReferenceException(UNKNOWN_REFERENCE));
        SubscriptionPlan plan = planRepository.findById(transaction.getPlanId())
                .orElseThrow(() -> new IllegalStateException("Plan " + transaction.getPlanId() + " of transaction " + reference + " no longer exists"));
        User user = userRepository.findByIdForUpdate(transaction.getUserId())
                .orElseThrow(() -> new IllegalStateException("Owner of transaction " + reference + " no longer exists"));

        LocalDateTime expiry = extendSubscription(user, plan, now);
        log.info("Activated plan '{}' for user {} via {}; expiry now {}",
                plan.getName(), user.getId(), reference, expiry != null ? expiry : "never");
        return new AppliedActivation(user.getEmail(), plan.getName(), expiry);
    }

    private LocalDateTime extendSubscription(User user, SubscriptionPlan plan, LocalDateTime now) {
        LocalDateTime current = user.getSubscriptionExpiry();
        if (user.isSubscribed() && current == null) {
            // non-expiring entitlement stays non-expiring
            return null;
        }
        LocalDateTime base = current != null && current.isAfter(now) ? current : now;
        LocalDateTime expiry = base.plusDays(plan.getDurationDays());
        user.setSubscribed(true);
        user.setSubscriptionExpiry(expiry);
        userRepository.save(user);
        return expiry;
    }

    private record AppliedActivation(String email, String planName, LocalDateTime expiry) {
    }
}
