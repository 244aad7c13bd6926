package uk.gegc.learnhub.features.catalog.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.learnhub.features.catalog.domain.model.Course;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CourseRepository extends JpaRepository<Course, UUID> {
    Optional<Course> findByIdAndDeletedAtIsNull(UUID id);
}
