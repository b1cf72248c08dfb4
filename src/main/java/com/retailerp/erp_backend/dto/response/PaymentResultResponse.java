package com.retailerp.erp_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Recorded payment together with the sale or expense it was applied to, as it stands afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentResultResponse<T> {
    private PaymentResponse payment;
    private T updated;
}
