package com.ClaimFlow.expense_backend.dto.response;

import com.ClaimFlow.expense_backend.enums.Grade;
import com.ClaimFlow.expense_backend.enums.Role;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserResponse {
    private UUID id;
    private String username;
    private String email;
    private String fullName;
    private String employeeCode;
    private String department;
    private String phone;
    private Role role;
    private Grade grade;
    private boolean canClaimExpenses;
    private boolean active;
    private LocalDateTime lastLogin;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
