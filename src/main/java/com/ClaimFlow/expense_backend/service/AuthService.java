package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.config.JwtProperties;
import com.ClaimFlow.expense_backend.config.JwtTokenProvider;
import com.ClaimFlow.expense_backend.dto.request.ChangePasswordRequest;
import com.ClaimFlow.expense_backend.dto.request.LoginRequest;
import com.ClaimFlow.expense_backend.dto.response.AuthResponse;
import com.ClaimFlow.expense_backend.dto.response.UserResponse;
import com.ClaimFlow.expense_backend.exception.ResourceNotFoundException;
import com.ClaimFlow.expense_backend.exception.UnauthorizedException;
import com.ClaimFlow.expense_backend.exception.ValidationException;
import com.ClaimFlow.expense_backend.model.User;
import com.ClaimFlow.expense_backend.repository.UserRepository;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private static final String INVALID_CREDENTIALS = "Incorrect username or password";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;
    private final JwtProperties jwtProperties;
    private final UserService userService;
    private final Clock clock;

    @Transactional
    public AuthResponse login(LoginRequest request) {
        log.info("Login attempt for {}", request.getUsername());

        User user = userRepository.findByLogin(request.getUsername().trim())
                .orElseThrow(() -> new BadCredentialsException(INVALID_CREDENTIALS));

        if (!passwordEncoder.matches(request.getPassword(), user.getPassword())) {
            log.warn("Bad password for {}", user.getUsername());
            throw new BadCredentialsException(INVALID_CREDENTIALS);
        }
        if (!user.isEnabled()) {
            throw new DisabledException("Account is disabled");
        }

        user.setLastLogin(LocalDateTime.now(clock));
        userRepository.save(user);

        log.info("Login successful: {}", user.getUsername());
        return issueTokens(user);
    }

    @Transactional(readOnly = true)
    public AuthResponse refreshToken(String refreshToken) {
        String username;
        try {
            if (!jwtTokenProvider.isRefreshToken(refreshToken)) {
                throw new UnauthorizedException("Invalid refresh token");
            }
            username = jwtTokenProvider.extractUsername(refreshToken);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Refresh token rejected: {}", e.getMessage());
            throw new UnauthorizedException("Invalid refresh token");
        }

        User user = userRepository.findByUsername(username)
                .orElseThrow(() -> new UnauthorizedException("Invalid refresh token"));
        if (!jwtTokenProvider.isTokenValid(refreshToken, user)) {
            throw new UnauthorizedException("Invalid refresh token");
        }

        log.debug("Token refreshed for: {}", username);
        return issueTokens(user);
    }

    @Transactional(readOnly = true)
    public UserResponse getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new UnauthorizedException("User not authenticated");
        }

        String username = authentication.getName();
        User user = userRepository.findByUsername(username)
                .orElseThrow(() -> new UnauthorizedException("User not found"));
        return userService.mapToUserResponse(user);
    }

    @Transactional
    public void changePassword(User principal, ChangePasswordRequest request) {
        User user = userRepository.findById(principal.getId())
                .orElseThrow(() -> new ResourceNotFoundException("User", "id", principal.getId()));

        if (!passwordEncoder.matches(request.getCurrentPassword(), user.getPassword())) {
            log.warn("Current password incorrect for {}", user.getUsername());
            throw new ValidationException("Current password is incorrect");
        }

        user.setPassword(passwordEncoder.encode(request.getNewPassword()));
        userRepository.save(user);
        log.info("Password changed for {}", user.getUsername());
    }

    private AuthResponse issueTokens(User user) {
        return AuthResponse.builder()
                .user(userService.mapToUserResponse(user))
                .token(jwtTokenProvider.generateToken(user))
                .refreshToken(jwtTokenProvider.generateRefreshToken(user))
                .expiresIn(jwtProperties.getExpiration() / 1000)
                .build();
    }
}
