package com.retailerp.erp_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResponse {
    private UUID customerId;
    private BigDecimal storedBalance;
    private BigDecimal expectedBalance;
    private BigDecimal drift;
    private boolean consistent;
    private boolean corrected;
    // Sales whose paid/due amounts, payments or status disagree
    private List<String> saleIssues;
}
