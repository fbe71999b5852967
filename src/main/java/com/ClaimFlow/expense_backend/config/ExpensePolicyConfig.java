package com.ClaimFlow.expense_backend.config;

import com.ClaimFlow.expense_backend.service.GradeLimitPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class ExpensePolicyConfig {

    @Bean
    public GradeLimitPolicy gradeLimitPolicy(ExpensePolicyProperties properties) {
        GradeLimitPolicy policy = GradeLimitPolicy.from(properties);
        log.info("Loaded expense policy for grades: {}", policy.configuredGrades());
        return policy;
    }
}
