package com.retailerp.erp_backend.security;

import com.retailerp.erp_backend.enums.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * Authenticated caller resolved to one company membership. Used as the Spring Security principal and
 * passed to every service call, which scopes all reads and writes by {@link #getCompanyId()}.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class TenantContext {
    private final UUID userId;
    private final UUID companyId;
    private final String companyName;
    private final Role role;
    private final String currency;
}
