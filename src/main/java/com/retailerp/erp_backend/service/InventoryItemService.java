package com.retailerp.erp_backend.service;

import com.retailerp.erp_backend.dto.response.InventoryItemResponse;
import com.retailerp.erp_backend.model.InventoryItem;
import com.retailerp.erp_backend.repository.InventoryItemRepository;
import com.retailerp.erp_backend.security.TenantContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class InventoryItemService {

    private final InventoryItemRepository inventoryItemRepository;

    @Transactional(readOnly = true)
    public List<InventoryItemResponse> getInventoryItems(UUID variantId, UUID locationId, boolean lowStockOnly,
                                                        TenantContext tenant) {
        return inventoryItemRepository.findItemsByCriteria(tenant.getCompanyId(), variantId, locationId, lowStockOnly)
                .stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    private InventoryItemResponse mapToResponse(InventoryItem item) {
        int minStockLevel = item.getVariant().getMinStockLevel();
        return InventoryItemResponse.builder()
                .id(item.getId())
                .productVariantId(item.getVariant().getId())
                .variantName(item.getVariant().getVariantName())
                .sku(item.getVariant().getSku())
                .locationId(item.getLocation().getId())
                .locationName(item.getLocation().getName())
                .quantity(item.getQuantity())
                .minStockLevel(minStockLevel)
                .lowStock(item.getQuantity() <= minStockLevel)
                .updatedAt(item.getUpdatedAt())
                .build();
    }
}
