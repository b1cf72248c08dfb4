package com.retailerp.erp_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "jwt")
@Data
public class JwtConfig {
    // HS256 shared secret of the identity provider, at least 32 bytes
    private String secret;
    private String issuer;
}
