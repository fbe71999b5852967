package com.ClaimFlow.expense_backend.config;

import com.ClaimFlow.expense_backend.enums.Grade;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "admin.default")
@Data
public class DefaultAdminConfig {
    private String username = "admin";
    private String email = "admin@claimflow.local";
    private String password;
    private String fullName = "System Administrator";
    private String employeeCode = "EMP000";
    private String department = "Administration";
    private Grade grade = Grade.D;
    private boolean enabled = true;
}
