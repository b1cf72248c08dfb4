package com.retailerp.erp_backend.service;

import com.retailerp.erp_backend.dto.request.CustomerRequest;
import com.retailerp.erp_backend.dto.response.CreditCheckResponse;
import com.retailerp.erp_backend.dto.response.CustomerBalanceResponse;
import com.retailerp.erp_backend.dto.response.CustomerResponse;
import com.retailerp.erp_backend.dto.response.PaginatedResponse;
import com.retailerp.erp_backend.enums.CustomerStatus;
import com.retailerp.erp_backend.enums.CustomerType;
import com.retailerp.erp_backend.exception.InvalidOperationException;
import com.retailerp.erp_backend.exception.ResourceNotFoundException;
import com.retailerp.erp_backend.model.Customer;
import com.retailerp.erp_backend.model.CustomerTier;
import com.retailerp.erp_backend.repository.CustomerRepository;
import com.retailerp.erp_backend.repository.CustomerTierRepository;
import com.retailerp.erp_backend.security.TenantContext;
import com.retailerp.erp_backend.util.MoneyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerService {

    private final CustomerRepository customerRepository;
    private final CustomerTierRepository customerTierRepository;
    private final ReferenceDataService referenceDataService;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public CustomerResponse getCustomerById(UUID id, TenantContext tenant) {
        return mapToCustomerResponse(getCustomer(id, tenant));
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<CustomerResponse> getCustomers(int page, int limit, CustomerType customerType,
                                                           CustomerStatus status, TenantContext tenant) {
        Page<Customer> customersPage = customerRepository.findCustomersByCriteria(
                tenant.getCompanyId(), customerType, status, PageRequest.of(page - 1, limit));

        List<CustomerResponse> customers = customersPage.getContent().stream()
                .map(this::mapToCustomerResponse)
                .collect(Collectors.toList());

        return PaginatedResponse.of(customers, page, limit, customersPage.getTotalElements());
    }

    @Transactional
    public CustomerResponse createCustomer(CustomerRequest request, TenantContext tenant) {
        CustomerTier tier = request.getTierId() != null
                ? getTier(request.getTierId(), tenant)
                : customerTierRepository.findFirstByCompanyIdAndDefaultTierTrue(tenant.getCompanyId()).orElse(null);

        Customer customer = Customer.builder()
                .company(referenceDataService.getCompany(tenant))
                .customerType(request.getCustomerType())
                .name(request.getName().trim())
                .email(request.getEmail())
                .phone(request.getPhone())
                .address(request.getAddress())
                .tier(tier)
                .creditLimit(MoneyUtil.round(MoneyUtil.orZero(request.getCreditLimit())))
                .currentBalance(BigDecimal.ZERO)
                .status(request.getStatus() != null ? request.getStatus() : CustomerStatus.ACTIVE)
                .build();

        Customer savedCustomer = customerRepository.save(customer);
        log.info("Customer created with ID: {}", savedCustomer.getId());
        return mapToCustomerResponse(savedCustomer);
    }

    /**
     * Updates profile and credit terms. The running balance is owned by the ledger and never taken from the request.
     */
    @Transactional
    public CustomerResponse updateCustomer(UUID id, CustomerRequest request, TenantContext tenant) {
        Customer customer = customerRepository.findByIdAndCompanyIdForUpdate(id, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Customer", "id", id));

        if (customer.isSystemDefault() && request.getCustomerType() != CustomerType.WALK_IN) {
            throw new InvalidOperationException("The default walk-in customer cannot change type");
        }

        customer.setCustomerType(request.getCustomerType());
        customer.setName(request.getName().trim());
        customer.setEmail(request.getEmail());
        customer.setPhone(request.getPhone());
        customer.setAddress(request.getAddress());
        customer.setTier(request.getTierId() != null ? getTier(request.getTierId(), tenant) : null);
        if (request.getCreditLimit() != null) {
            customer.setCreditLimit(MoneyUtil.round(request.getCreditLimit()));
        }
        if (request.getStatus() != null) {
            customer.setStatus(request.getStatus());
        }

        Customer updatedCustomer = customerRepository.save(customer);
        log.info("Customer updated with ID: {}", id);
        return mapToCustomerResponse(updatedCustomer);
    }

    @Transactional
    public void deactivateCustomer(UUID id, TenantContext tenant) {
        Customer customer = getCustomer(id, tenant);
        if (customer.isSystemDefault()) {
            throw new InvalidOperationException("The default walk-in customer cannot be deleted");
        }
        customer.setStatus(CustomerStatus.INACTIVE);
        customerRepository.save(customer);
        log.info("Customer {} deactivated", id);
    }

    @Transactional(readOnly = true)
    public CustomerBalanceResponse getBalance(UUID id, TenantContext tenant) {
        Customer customer = getCustomer(id, tenant);
        return CustomerBalanceResponse.builder()
                .customerId(customer.getId())
                .customerName(customer.getName())
                .creditLimit(customer.getCreditLimit())
                .currentBalance(customer.getCurrentBalance())
                .availableCredit(availableCredit(customer))
                .build();
    }

    /**
     * Answers whether a sale of {@code saleAmount} would pass the credit check, without reserving anything.
     */
    @Transactional(readOnly = true)
    public CreditCheckResponse checkCredit(UUID id, BigDecimal saleAmount, TenantContext tenant) {
        Customer customer = getCustomer(id, tenant);
        BigDecimal available = availableCredit(customer);

        if (customer.isWalkIn()) {
            return CreditCheckResponse.builder()
                    .approved(true)
                    .creditLimit(customer.getCreditLimit())
                    .currentBalance(customer.getCurrentBalance())
                    .availableCredit(available)
                    .saleAmount(saleAmount)
                    .message("Walk-in customers are not subject to credit limits")
                    .build();
        }

        boolean approved = customer.getCurrentBalance().add(saleAmount).compareTo(customer.getCreditLimit()) <= 0;
        String message = approved
                ? "Credit approved. Available credit: " + MoneyUtil.format(available, tenant.getCurrency())
                : "Credit limit exceeded. Available credit: " + MoneyUtil.format(available, tenant.getCurrency());

        return CreditCheckResponse.builder()
                .approved(approved)
                .creditLimit(customer.getCreditLimit())
                .currentBalance(customer.getCurrentBalance())
                .availableCredit(available)
                .saleAmount(saleAmount)
                .message(message)
                .build();
    }

    private BigDecimal availableCredit(Customer customer) {
        return customer.getCreditLimit().subtract(customer.getCurrentBalance()).max(BigDecimal.ZERO);
    }

    private Customer getCustomer(UUID id, TenantContext tenant) {
        return customerRepository.findByIdAndCompanyId(id, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Customer", "id", id));
    }

    private CustomerTier getTier(UUID tierId, TenantContext tenant) {
        return customerTierRepository.findByIdAndCompanyId(tierId, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Customer tier", "id", tierId));
    }

    private CustomerResponse mapToCustomerResponse(Customer customer) {
        return modelMapper.map(customer, CustomerResponse.class);
    }
}
