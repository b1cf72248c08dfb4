package com.retailerp.erp_backend.security;

import com.retailerp.erp_backend.config.AppProperties;
import com.retailerp.erp_backend.exception.UnauthorizedException;
import com.retailerp.erp_backend.model.Company;
import com.retailerp.erp_backend.model.CompanyUser;
import com.retailerp.erp_backend.repository.CompanyUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class TenantResolver {

    private final CompanyUserRepository companyUserRepository;
    private final AppProperties appProperties;

    /**
     * Resolves the caller's active membership. With a requested company id only that company is
     * considered; otherwise the oldest active membership wins.
     */
    @Transactional(readOnly = true)
    public TenantContext resolve(UUID userId, String requestedCompanyId) {
        Optional<CompanyUser> membership;
        if (StringUtils.hasText(requestedCompanyId)) {
            UUID companyId;
            try {
                companyId = UUID.fromString(requestedCompanyId.trim());
            } catch (IllegalArgumentException e) {
                throw new UnauthorizedException("Invalid company id: " + requestedCompanyId);
            }
            membership = companyUserRepository.findActiveMembership(userId, companyId);
        } else {
            membership = companyUserRepository.findActiveMemberships(userId).stream().findFirst();
        }

        CompanyUser companyUser = membership
                .orElseThrow(() -> new UnauthorizedException("No company found for user"));
        Company company = companyUser.getCompany();

        return TenantContext.builder()
                .userId(userId)
                .companyId(company.getId())
                .companyName(company.getName())
                .role(companyUser.getRole())
                .currency(StringUtils.hasText(company.getCurrency())
                        ? company.getCurrency() : appProperties.getDefaultCurrency())
                .build();
    }
}
