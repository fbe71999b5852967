package com.ClaimFlow.expense_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "jwt")
@Data
public class JwtProperties {
    private String secret;
    private long expiration = 86400000;          // 24 hours
    private long refreshExpiration = 604800000;  // 7 days
}
