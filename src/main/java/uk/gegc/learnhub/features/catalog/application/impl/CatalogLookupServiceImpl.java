package uk.gegc.learnhub.features.catalog.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.learnhub.features.catalog.application.CatalogItem;
import uk.gegc.learnhub.features.catalog.application.CatalogLookupService;
import uk.gegc.learnhub.features.catalog.domain.model.Course;
import uk.gegc.learnhub.features.catalog.domain.model.ServiceOffering;
import uk.gegc.learnhub.features.catalog.domain.repository.CourseRepository;
import uk.gegc.learnhub.features.catalog.domain.repository.ServiceOfferingRepository;

import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CatalogLookupServiceImpl implements CatalogLookupService {

    private final ServiceOfferingRepository serviceOfferingRepository;
    private final CourseRepository courseRepository;

    @Override
    public Optional<CatalogItem> findService(UUID serviceId) {
        return serviceOfferingRepository.findByIdAndDeletedAtIsNull(serviceId)
                .map(this::toServiceItem);
    }

    @Override
    public Optional<CatalogItem> findCourse(UUID courseId) {
        return courseRepository.findByIdAndDeletedAtIsNull(courseId)
                .map(this::toCourseItem);
    }

    private CatalogItem toServiceItem(ServiceOffering service) {
        return new CatalogItem(service.getId(), service.getName(), service.getDescription(), service.getPrice(), false);
    }

    private CatalogItem toCourseItem(Course course) {
        return new CatalogItem(course.getId(), course.getTitle(), course.getDescription(), course.getPrice(),
                Boolean.TRUE.equals(course.getIsPremium()));
    }
}
