package uk.gegc.learnhub.features.catalog.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.learnhub.features.catalog.domain.model.ServiceOffering;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ServiceOfferingRepository extends JpaRepository<ServiceOffering, UUID> {
    Optional<ServiceOffering> findByIdAndDeletedAtIsNull(UUID id);
}
