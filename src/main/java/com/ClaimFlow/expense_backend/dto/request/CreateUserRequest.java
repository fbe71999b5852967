package com.ClaimFlow.expense_backend.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateUserRequest {

    @NotBlank(message = "Username is required")
    @Size(min = 3, max = 50, message = "Username must be between 3 and 50 characters")
    @Pattern(regexp = "^[A-Za-z0-9._-]+$", message = "Username may only contain letters, digits, '.', '_' and '-'")
    private String username;

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be valid")
    private String email;

    @NotBlank(message = "Password is required")
    @Size(min = 8, max = 100, message = "Password must be at least 8 characters")
    private String password;

    @NotBlank(message = "Full name is required")
    @Size(max = 100, message = "Full name must not exceed 100 characters")
    private String fullName;

    // Generated as EMP### when absent
    @Size(max = 20, message = "Employee code must not exceed 20 characters")
    private String employeeCode;

    private String department;

    @Size(max = 20, message = "Phone must not exceed 20 characters")
    private String phone;

    @NotBlank(message = "Role is required")
    private String role;

    @NotBlank(message = "Grade is required")
    private String grade;

    private Boolean canClaimExpenses;

    @Override
    public String toString() {
        return "CreateUserRequest{username='" + username + "', role='" + role + "', grade='" + grade + "'}";
    }
}
