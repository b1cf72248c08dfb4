package com.retailerp.erp_backend.dto.response;

import com.retailerp.erp_backend.enums.CustomerStatus;
import com.retailerp.erp_backend.enums.CustomerType;
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
public class CustomerResponse {
    private UUID id;
    private CustomerType customerType;
    private String name;
    private String email;
    private String phone;
    private String address;
    private UUID tierId;
    private String tierName;
    private BigDecimal tierDiscountPercentage;
    private BigDecimal creditLimit;
    private BigDecimal currentBalance;
    private CustomerStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
