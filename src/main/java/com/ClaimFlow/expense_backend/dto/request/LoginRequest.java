package com.ClaimFlow.expense_backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Form-encoded login. {@code username} also accepts the account email.
 */
@Data
public class LoginRequest {

    @NotBlank(message = "Username is required")
    private String username;

    @NotBlank(message = "Password is required")
    private String password;

    @Override
    public String toString() {
        return "LoginRequest{username='" + username + "'}";
    }
}
