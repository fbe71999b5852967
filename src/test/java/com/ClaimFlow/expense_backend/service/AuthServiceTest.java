package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.config.JwtProperties;
import com.ClaimFlow.expense_backend.config.JwtTokenProvider;
import com.ClaimFlow.expense_backend.config.ModelMapperConfig;
import com.ClaimFlow.expense_backend.dto.request.ChangePasswordRequest;
import com.ClaimFlow.expense_backend.dto.request.LoginRequest;
import com.ClaimFlow.expense_backend.dto.response.AuthResponse;
import com.ClaimFlow.expense_backend.enums.Grade;
import com.ClaimFlow.expense_backend.enums.Role;
import com.ClaimFlow.expense_backend.exception.UnauthorizedException;
import com.ClaimFlow.expense_backend.exception.ValidationException;
import com.ClaimFlow.expense_backend.model.User;
import com.ClaimFlow.expense_backend.repository.ApprovalDecisionRepository;
import com.ClaimFlow.expense_backend.repository.ExpenseClaimRepository;
import com.ClaimFlow.expense_backend.repository.NotificationRepository;
import com.ClaimFlow.expense_backend.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    @Mock
    private UserRepository userRepository;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private JwtTokenProvider jwtTokenProvider;
    private AuthService authService;
    private User user;

    @BeforeEach
    void setUp() {
        JwtProperties jwtProperties = new JwtProperties();
        jwtProperties.setSecret("test-only-jwt-secret-key-for-expense-claim-backend");
        jwtTokenProvider = new JwtTokenProvider(jwtProperties);
        UserService userService = new UserService(userRepository, new ModelMapperConfig().modelMapper(),
                passwordEncoder, mock(AuditService.class), mock(ExpenseClaimRepository.class),
                mock(ApprovalDecisionRepository.class), mock(NotificationRepository.class));
        Clock clock = Clock.fixed(Instant.parse("2024-06-03T06:30:00Z"), ZoneId.of("Asia/Kolkata"));
        authService = new AuthService(userRepository, passwordEncoder, jwtTokenProvider, jwtProperties, userService, clock);

        user = User.builder()
                .id(UUID.randomUUID())
                .username("asha")
                .email("asha@example.com")
                .password(passwordEncoder.encode("correct-horse"))
                .fullName("Asha Rao")
                .employeeCode("EMP007")
                .role(Role.EMPLOYEE)
                .grade(Grade.A)
                .active(true)
                .build();
    }

    @Test
    void loginIssuesTokenPairAndStampsLastLogin() {
        when(userRepository.findByLogin("asha@example.com")).thenReturn(Optional.of(user));

        AuthResponse response = authService.login(login("asha@example.com", "correct-horse"));

        assertThat(response.getTokenType()).isEqualTo("bearer");
        assertThat(response.getExpiresIn()).isEqualTo(86400L);
        assertThat(jwtTokenProvider.isAccessToken(response.getToken())).isTrue();
        assertThat(jwtTokenProvider.isRefreshToken(response.getRefreshToken())).isTrue();
        assertThat(response.getUser().getUsername()).isEqualTo("asha");
        assertThat(user.getLastLogin()).isEqualTo(LocalDateTime.of(2024, 6, 3, 12, 0));
        verify(userRepository).save(user);
    }

    @Test
    void wrongPasswordAndUnknownUserLookTheSame() {
        when(userRepository.findByLogin("asha")).thenReturn(Optional.of(user));
        when(userRepository.findByLogin("nobody")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.login(login("asha", "wrong")))
                .isInstanceOf(BadCredentialsException.class)
                .hasMessage("Incorrect username or password");
        assertThatThrownBy(() -> authService.login(login("nobody", "wrong")))
                .isInstanceOf(BadCredentialsException.class)
                .hasMessage("Incorrect username or password");
    }

    @Test
    void disabledAccountCannotLogIn() {
        user.setActive(false);
        when(userRepository.findByLogin("asha")).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> authService.login(login("asha", "correct-horse")))
                .isInstanceOf(DisabledException.class);
    }

    @Test
    void refreshRequiresARefreshToken() {
        String access = jwtTokenProvider.generateToken(user);

        assertThatThrownBy(() -> authService.refreshToken(access)).isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> authService.refreshToken("not-a-jwt")).isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void refreshIssuesNewPair() {
        when(userRepository.findByUsername("asha")).thenReturn(Optional.of(user));

        AuthResponse response = authService.refreshToken(jwtTokenProvider.generateRefreshToken(user));

        assertThat(jwtTokenProvider.extractUsername(response.getToken())).isEqualTo("asha");
    }

    @Test
    void changePasswordChecksCurrentPassword() {
        when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
        ChangePasswordRequest wrong = new ChangePasswordRequest();
        wrong.setCurrentPassword("guess");
        wrong.setNewPassword("new-password-1");

        assertThatThrownBy(() -> authService.changePassword(user, wrong)).isInstanceOf(ValidationException.class);

        ChangePasswordRequest right = new ChangePasswordRequest();
        right.setCurrentPassword("correct-horse");
        right.setNewPassword("new-password-1");
        authService.changePassword(user, right);

        assertThat(passwordEncoder.matches("new-password-1", user.getPassword())).isTrue();
        verify(userRepository).save(any(User.class));
    }

    private static LoginRequest login(String username, String password) {
        LoginRequest request = new LoginRequest();
        request.setUsername(username);
        request.setPassword(password);
        return request;
    }
}
