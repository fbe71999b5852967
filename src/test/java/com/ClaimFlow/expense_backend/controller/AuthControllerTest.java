package com.ClaimFlow.expense_backend.controller;

import com.ClaimFlow.expense_backend.config.JwtAuthenticationFilter;
import com.ClaimFlow.expense_backend.config.JwtTokenProvider;
import com.ClaimFlow.expense_backend.config.SecurityConfig;
import com.ClaimFlow.expense_backend.dto.request.LoginRequest;
import com.ClaimFlow.expense_backend.dto.response.AuthResponse;
import com.ClaimFlow.expense_backend.dto.response.UserResponse;
import com.ClaimFlow.expense_backend.service.AuthService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AuthController.class)
@Import({SecurityConfig.class, JwtAuthenticationFilter.class})
class AuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuthService authService;

    @MockBean
    private JwtTokenProvider jwtTokenProvider;

    @MockBean
    private UserDetailsService userDetailsService;

    @Test
    void formLoginReturnsTokens() throws Exception {
        AuthResponse response = AuthResponse.builder()
                .user(UserResponse.builder().username("asha").build())
                .token("access-token")
                .refreshToken("refresh-token")
                .expiresIn(86400L)
                .build();
        when(authService.login(argThat((LoginRequest r) -> "asha".equals(r.getUsername())))).thenReturn(response);

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", "asha")
                        .param("password", "correct-horse"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.token").value("access-token"))
                .andExpect(jsonPath("$.data.tokenType").value("bearer"))
                .andExpect(jsonPath("$.data.user.username").value("asha"));
    }

    @Test
    void badCredentialsAnswer401() throws Exception {
        when(authService.login(any(LoginRequest.class)))
                .thenThrow(new BadCredentialsException("Incorrect username or password"));

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", "asha")
                        .param("password", "wrong"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("BAD_CREDENTIALS"));
    }

    @Test
    void disabledAccountAnswers401WithItsOwnCode() throws Exception {
        when(authService.login(any(LoginRequest.class))).thenThrow(new DisabledException("Account is disabled"));

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", "asha")
                        .param("password", "correct-horse"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("USER_ACCOUNT_DISABLED"));
    }

    @Test
    void missingPasswordIsAValidationError() throws Exception {
        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", "asha"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.errors.password").value("Password is required"));

        verifyNoInteractions(authService);
    }

    @Test
    void changePasswordRequiresAuthentication() throws Exception {
        mockMvc.perform(post("/api/auth/change-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currentPassword\":\"a\",\"newPassword\":\"abcdefgh\"}"))
                .andExpect(status().isUnauthorized());
    }
}
