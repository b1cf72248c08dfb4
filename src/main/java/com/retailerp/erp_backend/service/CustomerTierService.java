package com.retailerp.erp_backend.service;

import com.retailerp.erp_backend.dto.request.CustomerTierRequest;
import com.retailerp.erp_backend.dto.response.CustomerTierResponse;
import com.retailerp.erp_backend.exception.DuplicateNameException;
import com.retailerp.erp_backend.exception.InvalidOperationException;
import com.retailerp.erp_backend.exception.ResourceNotFoundException;
import com.retailerp.erp_backend.model.CustomerTier;
import com.retailerp.erp_backend.repository.CustomerRepository;
import com.retailerp.erp_backend.repository.CustomerTierRepository;
import com.retailerp.erp_backend.security.TenantContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerTierService {

    private final CustomerTierRepository customerTierRepository;
    private final CustomerRepository customerRepository;
    private final ReferenceDataService referenceDataService;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public List<CustomerTierResponse> getTiers(TenantContext tenant) {
        return customerTierRepository.findByCompanyIdOrderByNameAsc(tenant.getCompanyId()).stream()
                .map(this::mapToTierResponse)
                .collect(Collectors.toList());
    }

    @Transactional
    public CustomerTierResponse createTier(CustomerTierRequest request, TenantContext tenant) {
        String name = request.getName().trim();
        if (customerTierRepository.existsByCompanyIdAndNameIgnoreCase(tenant.getCompanyId(), name)) {
            throw new DuplicateNameException("Customer tier", name);
        }

        if (request.isDefaultTier()) {
            customerTierRepository.findFirstByCompanyIdAndDefaultTierTrue(tenant.getCompanyId())
                    .ifPresent(current -> {
                        current.setDefaultTier(false);
                        customerTierRepository.save(current);
                    });
        }

        CustomerTier tier = CustomerTier.builder()
                .company(referenceDataService.getCompany(tenant))
                .name(name)
                .description(request.getDescription())
                .discountPercentage(request.getDiscountPercentage())
                .defaultTier(request.isDefaultTier())
                .build();

        CustomerTier savedTier = customerTierRepository.save(tier);
        log.info("Customer tier '{}' created with {}% discount", name, savedTier.getDiscountPercentage());
        return mapToTierResponse(savedTier);
    }

    @Transactional
    public void deleteTier(UUID id, TenantContext tenant) {
        CustomerTier tier = customerTierRepository.findByIdAndCompanyId(id, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Customer tier", "id", id));

        if (tier.isDefaultTier()) {
            throw new InvalidOperationException("Cannot delete the default tier");
        }
        long customerCount = customerRepository.countByTierId(id);
        if (customerCount > 0) {
            throw new InvalidOperationException(
                    "Cannot delete tier. " + customerCount + " customer(s) are using this tier");
        }

        customerTierRepository.delete(tier);
        log.info("Customer tier {} deleted", id);
    }

    private CustomerTierResponse mapToTierResponse(CustomerTier tier) {
        CustomerTierResponse response = modelMapper.map(tier, CustomerTierResponse.class);
        response.setCustomerCount(customerRepository.countByTierId(tier.getId()));
        return response;
    }
}
