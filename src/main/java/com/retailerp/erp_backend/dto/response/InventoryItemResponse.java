package com.retailerp.erp_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryItemResponse {
    private UUID id;
    private UUID productVariantId;
    private String variantName;
    private String sku;
    private UUID locationId;
    private String locationName;
    private int quantity;
    private int minStockLevel;
    private boolean lowStock;
    private LocalDateTime updatedAt;
}
