package com.ClaimFlow.expense_backend.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthResponse {
    private UserResponse user;
    private String token;
    private String refreshToken;
    @Builder.Default
    private String tokenType = "bearer";
    private Long expiresIn;

    // Tokens are masked so the response can be logged
    @Override
    public String toString() {
        return "AuthResponse{" +
                "user=" + (user != null ? user.getUsername() : "null") +
                ", token=" + mask(token) +
                ", refreshToken=" + mask(refreshToken) +
                '}';
    }

    private static String mask(String value) {
        if (value == null) {
            return "null";
        }
        return "***" + (value.length() > 10 ? value.substring(value.length() - 10) : value);
    }
}
