package uk.gegc.learnhub.features.purchase.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.learnhub.features.purchase.domain.model.ProcessedGatewayEvent;

public interface ProcessedGatewayEventRepository extends JpaRepository<ProcessedGatewayEvent, String> {
    boolean existsByEventId(String eventId);
}
