package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.config.ModelMapperConfig;
import com.ClaimFlow.expense_backend.dto.request.CreateUserRequest;
import com.ClaimFlow.expense_backend.dto.response.SystemStatsResponse;
import com.ClaimFlow.expense_backend.dto.response.UserResponse;
import com.ClaimFlow.expense_backend.enums.AuditAction;
import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.Grade;
import com.ClaimFlow.expense_backend.enums.Role;
import com.ClaimFlow.expense_backend.exception.ApiException;
import com.ClaimFlow.expense_backend.exception.ValidationException;
import com.ClaimFlow.expense_backend.model.User;
import com.ClaimFlow.expense_backend.repository.ApprovalDecisionRepository;
import com.ClaimFlow.expense_backend.repository.ExpenseClaimRepository;
import com.ClaimFlow.expense_backend.repository.NotificationRepository;
import com.ClaimFlow.expense_backend.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private AuditService auditService;

    @Mock
    private ExpenseClaimRepository expenseClaimRepository;

    @Mock
    private ApprovalDecisionRepository approvalDecisionRepository;

    @Mock
    private NotificationRepository notificationRepository;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private UserService userService;
    private User admin;

    @BeforeEach
    void setUp() {
        userService = new UserService(userRepository, new ModelMapperConfig().modelMapper(), passwordEncoder,
                auditService, expenseClaimRepository, approvalDecisionRepository, notificationRepository);
        admin = User.builder()
                .id(UUID.randomUUID())
                .username("admin")
                .fullName("System Administrator")
                .employeeCode("EMP000")
                .role(Role.ADMIN)
                .grade(Grade.D)
                .build();
    }

    @Test
    void nextEmployeeCodeFollowsHighestNumericSuffix() {
        assertThat(UserService.nextEmployeeCode(List.of())).isEqualTo("EMP001");
        assertThat(UserService.nextEmployeeCode(List.of("EMP000", "EMP009", "EMP042", "EMPTEMP"))).isEqualTo("EMP043");
        assertThat(UserService.nextEmployeeCode(List.of("EMP999"))).isEqualTo("EMP1000");
    }

    @Test
    void createUserGeneratesCodeAndHashesPassword() {
        when(userRepository.findAllEmployeeCodes()).thenReturn(List.of("EMP000", "EMP007"));
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> {
            User user = invocation.getArgument(0);
            user.setId(UUID.randomUUID());
            return user;
        });

        UserResponse response = userService.createUser(admin, createRequest("priya.n", "Priya@Example.com"));

        assertThat(response.getEmployeeCode()).isEqualTo("EMP008");
        assertThat(response.getEmail()).isEqualTo("priya@example.com");
        assertThat(response.getRole()).isEqualTo(Role.MANAGER);
        assertThat(response.getGrade()).isEqualTo(Grade.C);
        assertThat(response.isCanClaimExpenses()).isTrue();
        assertThat(response.isActive()).isTrue();

        ArgumentCaptor<User> saved = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(saved.capture());
        assertThat(passwordEncoder.matches("s3cure-pass", saved.getValue().getPassword())).isTrue();
        verify(auditService).logUserAction(eq(admin), eq(AuditAction.USER_CREATED), any(User.class), anyString());
    }

    @Test
    void duplicateUsernameIsAConflict() {
        when(userRepository.existsByUsername("priya.n")).thenReturn(true);

        assertThatThrownBy(() -> userService.createUser(admin, createRequest("priya.n", "priya@example.com")))
                .isInstanceOf(ApiException.class)
                .extracting("status").isEqualTo(HttpStatus.CONFLICT);
        verify(userRepository, never()).save(any());
    }

    @Test
    void unknownRoleIsRejected() {
        CreateUserRequest request = createRequest("priya.n", "priya@example.com");
        request.setRole("overlord");

        assertThatThrownBy(() -> userService.createUser(admin, request))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void adminCannotDeactivateThemselves() {
        when(userRepository.findById(admin.getId())).thenReturn(Optional.of(admin));

        assertThatThrownBy(() -> userService.toggleActive(admin, admin.getId()))
                .isInstanceOf(ValidationException.class);
        assertThat(admin.isActive()).isTrue();
    }

    @Test
    void gradeChangeIsAudited() {
        User employee = User.builder().id(UUID.randomUUID()).username("ravi").fullName("Ravi K")
                .employeeCode("EMP011").role(Role.EMPLOYEE).grade(Grade.A).build();
        when(userRepository.findById(employee.getId())).thenReturn(Optional.of(employee));
        when(userRepository.save(employee)).thenReturn(employee);

        UserResponse response = userService.updateGrade(admin, employee.getId(), "b");

        assertThat(response.getGrade()).isEqualTo(Grade.B);
        verify(auditService).logUserAction(admin, AuditAction.USER_UPDATED, employee, "grade A -> B");
    }

    @Test
    void toggleClaimPermissionFlipsFlag() {
        User employee = User.builder().id(UUID.randomUUID()).username("ravi").fullName("Ravi K")
                .employeeCode("EMP011").role(Role.EMPLOYEE).grade(Grade.A).build();
        when(userRepository.findById(employee.getId())).thenReturn(Optional.of(employee));
        when(userRepository.save(employee)).thenReturn(employee);

        UserResponse response = userService.toggleClaimPermission(admin, employee.getId());

        assertThat(response.isCanClaimExpenses()).isFalse();
    }

    @Test
    void adminCannotDeleteThemselves() {
        when(userRepository.findById(admin.getId())).thenReturn(Optional.of(admin));

        assertThatThrownBy(() -> userService.deleteUser(admin, admin.getId()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("own account");
        verify(userRepository, never()).delete(any());
    }

    @Test
    void userWithClaimHistoryMustBeDeactivatedInstead() {
        User employee = User.builder().id(UUID.randomUUID()).username("ravi").fullName("Ravi K")
                .employeeCode("EMP011").role(Role.EMPLOYEE).grade(Grade.A).build();
        when(userRepository.findById(employee.getId())).thenReturn(Optional.of(employee));
        when(expenseClaimRepository.existsByOwner_Id(employee.getId())).thenReturn(true);

        assertThatThrownBy(() -> userService.deleteUser(admin, employee.getId()))
                .isInstanceOf(ApiException.class)
                .extracting("status").isEqualTo(HttpStatus.CONFLICT);
        verify(userRepository, never()).delete(any());
        verify(notificationRepository, never()).deleteAllForRecipient(any());
    }

    @Test
    void unusedAccountIsDeletedWithItsNotificationsAndAudited() {
        User employee = User.builder().id(UUID.randomUUID()).username("ravi").fullName("Ravi K")
                .employeeCode("EMP011").role(Role.EMPLOYEE).grade(Grade.A).build();
        when(userRepository.findById(employee.getId())).thenReturn(Optional.of(employee));
        when(expenseClaimRepository.existsByOwner_Id(employee.getId())).thenReturn(false);
        when(approvalDecisionRepository.existsByActor_Id(employee.getId())).thenReturn(false);
        when(notificationRepository.deleteAllForRecipient(employee.getId())).thenReturn(2);

        userService.deleteUser(admin, employee.getId());

        verify(auditService).logUserAction(admin, AuditAction.USER_DELETED, employee,
                "username=ravi employeeCode=EMP011");
        verify(notificationRepository).deleteAllForRecipient(employee.getId());
        verify(userRepository).delete(employee);
    }

    @Test
    void systemStatsGroupPendingClaimsByStage() {
        when(userRepository.count()).thenReturn(5L);
        when(userRepository.countByActiveTrue()).thenReturn(4L);
        when(userRepository.countByRole()).thenReturn(List.of(
                new Object[]{Role.EMPLOYEE, 3L}, new Object[]{Role.ADMIN, 2L}));
        when(userRepository.countByGrade()).thenReturn(List.<Object[]>of(new Object[]{Grade.B, 5L}));
        when(expenseClaimRepository.summarizeByStatus(null, null)).thenReturn(List.of(
                new Object[]{ClaimStatus.SUBMITTED, 2L, new BigDecimal("300.00")},
                new Object[]{ClaimStatus.MANAGER_REVIEW, 1L, new BigDecimal("100.00")},
                new Object[]{ClaimStatus.FINANCE_REVIEW, 1L, new BigDecimal("50.00")},
                new Object[]{ClaimStatus.APPROVED, 3L, new BigDecimal("900.00")}));

        SystemStatsResponse stats = userService.getSystemStats();

        assertThat(stats.getUsers().getInactive()).isEqualTo(1);
        assertThat(stats.getUsers().getByRole()).containsEntry("employee", 3L).containsEntry("admin", 2L);
        assertThat(stats.getUsers().getByGrade()).containsEntry("B", 5L);
        assertThat(stats.getClaims().getTotal()).isEqualTo(7);
        assertThat(stats.getClaims().getPendingManager()).isEqualTo(3);
        assertThat(stats.getClaims().getPendingHr()).isZero();
        assertThat(stats.getClaims().getPendingFinance()).isEqualTo(1);
        assertThat(stats.getClaims().getRejected()).isZero();
        assertThat(stats.getClaims().getTotalClaimedAmount()).isEqualByComparingTo("1350.00");
        assertThat(stats.getClaims().getTotalApprovedAmount()).isEqualByComparingTo("900.00");
    }

    private static CreateUserRequest createRequest(String username, String email) {
        CreateUserRequest request = new CreateUserRequest();
        request.setUsername(username);
        request.setEmail(email);
        request.setPassword("s3cure-pass");
        request.setFullName("Priya Nair");
        request.setDepartment("Sales");
        request.setRole("manager");
        request.setGrade("C");
        return request;
    }
}
