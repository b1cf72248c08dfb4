package com.retailerp.erp_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerTierResponse {
    private UUID id;
    private String name;
    private String description;
    private BigDecimal discountPercentage;
    private boolean defaultTier;
    private long customerCount;
    private LocalDateTime createdAt;
}
