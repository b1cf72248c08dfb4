package com.retailerp.erp_backend.service;

import com.retailerp.erp_backend.enums.SaleType;
import com.retailerp.erp_backend.model.Company;
import com.retailerp.erp_backend.model.SaleNumberSequence;
import com.retailerp.erp_backend.repository.SaleNumberSequenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues sale numbers such as {@code INV-000042} and {@code CN-000007}, monotonic per company and sale type.
 * The counter row stays locked until the surrounding sale commits; a rolled back sale leaves a gap.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SaleNumberService {

    private final SaleNumberSequenceRepository saleNumberSequenceRepository;

    @Transactional
    public String nextSaleNumber(Company company, SaleType saleType) {
        SaleNumberSequence sequence = saleNumberSequenceRepository.findForUpdate(company.getId(), saleType)
                .orElseGet(() -> {
                    log.info("Starting {} numbering for company {}", saleType.getValue(), company.getId());
                    return SaleNumberSequence.builder()
                            .company(company)
                            .saleType(saleType)
                            .nextValue(1L)
                            .build();
                });

        long value = sequence.getNextValue();
        sequence.setNextValue(value + 1);
        saleNumberSequenceRepository.save(sequence);

        return String.format("%s-%06d", saleType.getNumberPrefix(), value);
    }
}
