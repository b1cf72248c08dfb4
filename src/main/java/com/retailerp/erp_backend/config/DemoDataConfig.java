package com.retailerp.erp_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@ConfigurationProperties(prefix = "app.demo")
@Data
public class DemoDataConfig {
    private String companyName = "Demo Retail Ltd";
    private UUID adminUserId;
    private String locationName = "Main Shop";
    private String productName = "Sample Product";
    private String variantName = "Sample Product 500g";
}
