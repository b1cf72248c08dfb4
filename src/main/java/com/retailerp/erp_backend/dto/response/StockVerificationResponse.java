package com.retailerp.erp_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockVerificationResponse {
    private UUID productVariantId;
    private UUID locationId;
    private int storedQuantity;
    private int replayedQuantity;
    private int movementCount;
    private boolean consistent;
}
