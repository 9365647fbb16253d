package uk.gegc.vidstream.features.subscription.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.vidstream.features.subscription.api.dto.CreatePlanRequest;
import uk.gegc.vidstream.features.subscription.api.dto.SubscriptionPlanDto;
import uk.gegc.vidstream.features.subscription.api.dto.UpdatePlanRequest;
import uk.gegc.vidstream.features.subscription.application.SubscriptionPlanService;
import uk.gegc.vidstream.features.subscription.domain.model.SubscriptionPlan;
import uk.gegc.vidstream.features.subscription.domain.repository.SubscriptionPlanRepository;
import uk.gegc.vidstream.features.subscription.infra.mapping.SubscriptionPlanMapper;
import uk.gegc.vidstream.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionPlanServiceImpl implements SubscriptionPlanService {

    private final SubscriptionPlanRepository planRepository;
    private final SubscriptionPlanMapper planMapper;
    @Qualifier("utcClock")
    private final Clock utcClock;

    @Value("${app.payments.default-currency:MWK}")
    private String defaultCurrency;

    @Override
    @Transactional(readOnly = true)
    public List<SubscriptionPlanDto> listPlans(boolean activeOnly) {
        List<SubscriptionPlan> plans = activeOnly
                ? planRepository.findByActiveTrueOrderByPriceAsc()
                : planRepository.findAllByOrderByPriceAsc();
        return plans.stream().map(planMapper::toDto).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public SubscriptionPlanDto getPlan(UUID planId) {
        return planMapper.toDto(loadPlan(planId));
    }

    @Override
    @Transactional
    public SubscriptionPlanDto createPlan(CreatePlanRequest request) {
        SubscriptionPlan plan = planMapper.toEntity(request);
        plan.setCurrency(request.currency() != null ? request.currency() : defaultCurrency);
        plan.setCreatedAt(LocalDateTime.now(utcClock));
        SubscriptionPlan saved = planRepository.save(plan);
        log.info("Created subscription plan '{}' ({}): {} {} for {} days",
                saved.getName(), saved.getId(), saved.getPrice(), saved.getCurrency(), saved.getDurationDays());
        return planMapper.toDto(saved);
    }

    @Override
    @Transactional
    public SubscriptionPlanDto updatePlan(UUID planId, UpdatePlanRequest request) {
        SubscriptionPlan plan = loadPlan(planId);
        planMapper.updateEntity(request, plan);
        SubscriptionPlan saved = planRepository.save(plan);
        log.info("Updated subscription plan {} (active={}, price={})", saved.getId(), saved.isActive(), saved.getPrice());
        return planMapper.toDto(saved);
    }

    private SubscriptionPlan loadPlan(UUID planId) {
        return planRepository.findById(planId)
                .orElseThrow(() -> new ResourceNotFoundException("Subscription plan " + planId + " not found"));
    }
}
