package uk.gegc.vidstream.features.subscription.application;

import uk.gegc.vidstream.features.subscription.api.dto.CreatePlanRequest;
import uk.gegc.vidstream.features.subscription.api.dto.SubscriptionPlanDto;
import uk.gegc.vidstream.features.subscription.api.dto.UpdatePlanRequest;

import java.util.List;
import java.util.UUID;

public interface SubscriptionPlanService {

    List<SubscriptionPlanDto> listPlans(boolean activeOnly);

    SubscriptionPlanDto getPlan(UUID planId);

    SubscriptionPlanDto createPlan(CreatePlanRequest request);

    SubscriptionPlanDto updatePlan(UUID planId, UpdatePlanRequest request);
}
