package uk.gegc.learnhub.features.purchase.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.learnhub.features.purchase.api.dto.PurchaseDto;
import uk.gegc.learnhub.features.purchase.api.dto.PurchaseStatusResponse;
import uk.gegc.learnhub.features.purchase.domain.model.Purchase;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface PurchaseMapper {

    PurchaseDto toDto(Purchase purchase);

    @Mapping(target = "orderId", source = "gatewayOrderId")
    PurchaseStatusResponse toStatusResponse(Purchase purchase);
}
