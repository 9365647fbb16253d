package uk.gegc.vidstream.features.subscription.infra.mapping;

import org.mapstruct.BeanMapping;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;
import org.mapstruct.ReportingPolicy;
import uk.gegc.vidstream.features.subscription.api.dto.CreatePlanRequest;
import uk.gegc.vidstream.features.subscription.api.dto.SubscriptionPlanDto;
import uk.gegc.vidstream.features.subscription.api.dto.UpdatePlanRequest;
import uk.gegc.vidstream.features.subscription.domain.model.SubscriptionPlan;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface SubscriptionPlanMapper {

    @Mapping(target = "isActive", source = "active")
    SubscriptionPlanDto toDto(SubscriptionPlan plan);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "active", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "currency", ignore = true)
    SubscriptionPlan toEntity(CreatePlanRequest request);

    @BeanMapping(nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "currency", ignore = true)
    @Mapping(target = "durationDays", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "active", source = "isActive")
    void updateEntity(UpdatePlanRequest request, @MappingTarget SubscriptionPlan plan);
}
