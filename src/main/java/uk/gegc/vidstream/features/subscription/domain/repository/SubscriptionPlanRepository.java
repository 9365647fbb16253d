package uk.gegc.vidstream.features.subscription.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.vidstream.features.subscription.domain.model.SubscriptionPlan;

import java.util.List;
import java.util.UUID;

@Repository
public interface SubscriptionPlanRepository extends JpaRepository<SubscriptionPlan, UUID> {

    List<SubscriptionPlan> findAllByOrderByPriceAsc();

    List<SubscriptionPlan> findByActiveTrueOrderByPriceAsc();
}
