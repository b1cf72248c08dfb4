package com.retailerp.erp_backend.service;

import com.retailerp.erp_backend.TestDataBuilder;
import com.retailerp.erp_backend.config.ModelMapperConfig;
import com.retailerp.erp_backend.dto.request.CustomerTierRequest;
import com.retailerp.erp_backend.enums.Role;
import com.retailerp.erp_backend.exception.DuplicateNameException;
import com.retailerp.erp_backend.exception.InvalidOperationException;
import com.retailerp.erp_backend.model.Company;
import com.retailerp.erp_backend.model.CustomerTier;
import com.retailerp.erp_backend.repository.CustomerRepository;
import com.retailerp.erp_backend.repository.CustomerTierRepository;
import com.retailerp.erp_backend.security.TenantContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.modelmapper.ModelMapper;
import org.springframework.http.HttpStatus;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CustomerTierServiceTest {

    @Mock
    private CustomerTierRepository customerTierRepository;
    @Mock
    private CustomerRepository customerRepository;
    @Mock
    private ReferenceDataService referenceDataService;
    @Spy
    private ModelMapper modelMapper = new ModelMapperConfig().modelMapper();

    @InjectMocks
    private CustomerTierService customerTierService;

    private Company company;
    private TenantContext tenant;

    @BeforeEach
    void setUp() {
        company = TestDataBuilder.company();
        tenant = TestDataBuilder.tenant(company, Role.ADMIN);
    }

    private CustomerTierRequest tierRequest(String name, String discount, boolean defaultTier) {
        CustomerTierRequest request = new CustomerTierRequest();
        request.setName(name);
        request.setDiscountPercentage(new BigDecimal(discount));
        request.setDefaultTier(defaultTier);
        return request;
    }

    @Test
    void createTier_ShouldRejectDuplicateNameIgnoringCase() {
        when(customerTierRepository.existsByCompanyIdAndNameIgnoreCase(company.getId(), "Gold")).thenReturn(true);

        DuplicateNameException ex = assertThrows(DuplicateNameException.class,
                () -> customerTierService.createTier(tierRequest(" Gold ", "5.00", false), tenant));

        assertEquals(HttpStatus.CONFLICT, ex.getStatus());
        verify(customerTierRepository, never()).save(any());
    }

    @Test
    void createTier_ShouldMoveDefaultFlagToNewTier() {
        CustomerTier previousDefault = TestDataBuilder.tier(company, "Standard", "0.00");
        previousDefault.setDefaultTier(true);
        when(customerTierRepository.existsByCompanyIdAndNameIgnoreCase(company.getId(), "Retail")).thenReturn(false);
        when(customerTierRepository.findFirstByCompanyIdAndDefaultTierTrue(company.getId())).thenReturn(Optional.of(previousDefault));
        when(referenceDataService.getCompany(tenant)).thenReturn(company);
        when(customerTierRepository.save(any(CustomerTier.class))).thenAnswer(i -> i.getArguments()[0]);

        var response = customerTierService.createTier(tierRequest("Retail", "2.50", true), tenant);

        assertFalse(previousDefault.isDefaultTier());
        verify(customerTierRepository).save(previousDefault);
        assertEquals("Retail", response.getName());
        assertEquals(0, new BigDecimal("2.50").compareTo(response.getDiscountPercentage()));
    }

    @Test
    void deleteTier_ShouldRefuseDefaultTier() {
        CustomerTier standard = TestDataBuilder.tier(company, "Standard", "0.00");
        standard.setDefaultTier(true);
        when(customerTierRepository.findByIdAndCompanyId(standard.getId(), company.getId())).thenReturn(Optional.of(standard));

        InvalidOperationException ex = assertThrows(InvalidOperationException.class,
                () -> customerTierService.deleteTier(standard.getId(), tenant));

        assertEquals("Cannot delete the default tier", ex.getMessage());
        verify(customerTierRepository, never()).delete(any());
    }

    @Test
    void deleteTier_ShouldRefuseTierInUse() {
        CustomerTier gold = TestDataBuilder.tier(company, "Gold", "7.50");
        when(customerTierRepository.findByIdAndCompanyId(gold.getId(), company.getId())).thenReturn(Optional.of(gold));
        when(customerRepository.countByTierId(gold.getId())).thenReturn(3L);

        InvalidOperationException ex = assertThrows(InvalidOperationException.class,
                () -> customerTierService.deleteTier(gold.getId(), tenant));

        assertEquals("Cannot delete tier. 3 customer(s) are using this tier", ex.getMessage());
        verify(customerTierRepository, never()).delete(any());
    }

    @Test
    void deleteTier_ShouldDeleteUnusedTier() {
        CustomerTier gold = TestDataBuilder.tier(company, "Gold", "7.50");
        when(customerTierRepository.findByIdAndCompanyId(gold.getId(), company.getId())).thenReturn(Optional.of(gold));
        when(customerRepository.countByTierId(gold.getId())).thenReturn(0L);

        customerTierService.deleteTier(gold.getId(), tenant);

        verify(customerTierRepository).delete(gold);
    }
}
