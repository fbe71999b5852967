package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.dto.request.CreateUserRequest;
import com.ClaimFlow.expense_backend.dto.response.PaginatedResponse;
import com.ClaimFlow.expense_backend.dto.response.SystemStatsResponse;
import com.ClaimFlow.expense_backend.dto.response.UserResponse;
import com.ClaimFlow.expense_backend.enums.AuditAction;
import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.Grade;
import com.ClaimFlow.expense_backend.enums.Role;
import com.ClaimFlow.expense_backend.exception.ApiException;
import com.ClaimFlow.expense_backend.exception.ResourceNotFoundException;
import com.ClaimFlow.expense_backend.exception.ValidationException;
import com.ClaimFlow.expense_backend.model.User;
import com.ClaimFlow.expense_backend.repository.ApprovalDecisionRepository;
import com.ClaimFlow.expense_backend.repository.ExpenseClaimRepository;
import com.ClaimFlow.expense_backend.repository.NotificationRepository;
import com.ClaimFlow.expense_backend.repository.UserRepository;
import com.ClaimFlow.expense_backend.util.FilterParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Admin-side account management.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private static final String EMPLOYEE_CODE_PREFIX = "EMP";

    private final UserRepository userRepository;
    private final ModelMapper modelMapper;
    private final PasswordEncoder passwordEncoder;
    private final AuditService auditService;
    private final ExpenseClaimRepository expenseClaimRepository;
    private final ApprovalDecisionRepository approvalDecisionRepository;
    private final NotificationRepository notificationRepository;

    @Transactional(readOnly = true)
    public UserResponse getUserById(UUID id) {
        return mapToUserResponse(findUser(id));
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<UserResponse> getAllUsers(int page, int limit, String search, String role) {
        Pageable pageable = PageRequest.of(page - 1, limit, Sort.by("createdAt").descending());
        Page<User> usersPage = userRepository.searchUsers(search, FilterParser.role(role), pageable);

        return PaginatedResponse.from(usersPage, this::mapToUserResponse);
    }

    @Transactional
    public UserResponse createUser(User admin, CreateUserRequest request) {
        Role role = requireRole(request.getRole());
        Grade grade = requireGrade(request.getGrade());

        if (userRepository.existsByUsername(request.getUsername())) {
            throw new ApiException("Username already taken", HttpStatus.CONFLICT, "CONFLICT");
        }
        if (userRepository.existsByEmail(request.getEmail().trim().toLowerCase())) {
            throw new ApiException("Email already registered", HttpStatus.CONFLICT, "CONFLICT");
        }

        List<String> existingCodes = userRepository.findAllEmployeeCodes();
        String employeeCode = request.getEmployeeCode();
        if (employeeCode == null || employeeCode.isBlank()) {
            employeeCode = nextEmployeeCode(existingCodes);
        } else if (existingCodes.contains(employeeCode.trim())) {
            throw new ApiException("Employee code already in use", HttpStatus.CONFLICT, "CONFLICT");
        }

        User user = User.builder()
                .username(request.getUsername().trim())
                .email(request.getEmail().trim().toLowerCase())
                .password(passwordEncoder.encode(request.getPassword()))
                .fullName(request.getFullName().trim())
                .employeeCode(employeeCode.trim())
                .department(request.getDepartment())
                .phone(request.getPhone())
                .role(role)
                .grade(grade)
                .canClaimExpenses(request.getCanClaimExpenses() == null || request.getCanClaimExpenses())
                .active(true)
                .build();

        User savedUser = userRepository.save(user);
        auditService.logUserAction(admin, AuditAction.USER_CREATED, savedUser,
                String.format("role=%s grade=%s", role, grade));
        log.info("User {} created with employee code {} by {}", savedUser.getUsername(),
                savedUser.getEmployeeCode(), admin.getUsername());

        return mapToUserResponse(savedUser);
    }

    @Transactional
    public UserResponse toggleActive(User admin, UUID id) {
        User user = findUser(id);
        if (user.getId().equals(admin.getId())) {
            throw new ValidationException("You cannot deactivate your own account");
        }
        user.setActive(!user.isActive());
        return saveUpdate(admin, user, "active=" + user.isActive());
    }

    @Transactional
    public UserResponse toggleClaimPermission(User admin, UUID id) {
        User user = findUser(id);
        user.setCanClaimExpenses(!user.isCanClaimExpenses());
        return saveUpdate(admin, user, "canClaimExpenses=" + user.isCanClaimExpenses());
    }

    @Transactional
    public UserResponse updateRole(User admin, UUID id, String roleValue) {
        Role role = requireRole(roleValue);
        User user = findUser(id);
        if (user.getId().equals(admin.getId()) && role != Role.ADMIN) {
            throw new ValidationException("You cannot remove your own admin role");
        }
        Role previous = user.getRole();
        user.setRole(role);
        return saveUpdate(admin, user, String.format("role %s -> %s", previous, role));
    }

    @Transactional
    public UserResponse updateGrade(User admin, UUID id, String gradeValue) {
        Grade grade = requireGrade(gradeValue);
        User user = findUser(id);
        Grade previous = user.getGrade();
        user.setGrade(grade);
        return saveUpdate(admin, user, String.format("grade %s -> %s", previous, grade));
    }

    /**
     * Hard-deletes an account that never claimed or reviewed anything. Accounts with claim
     * history keep their rows for the audit trail and can only be deactivated.
     */
    @Transactional
    public void deleteUser(User admin, UUID id) {
        User user = findUser(id);
        if (user.getId().equals(admin.getId())) {
            throw new ValidationException("You cannot delete your own account");
        }
        if (expenseClaimRepository.existsByOwner_Id(id) || approvalDecisionRepository.existsByActor_Id(id)) {
            throw new ApiException("User has expense history; deactivate the account instead",
                    HttpStatus.CONFLICT, "CONFLICT");
        }

        auditService.logUserAction(admin, AuditAction.USER_DELETED, user,
                String.format("username=%s employeeCode=%s", user.getUsername(), user.getEmployeeCode()));
        int notifications = notificationRepository.deleteAllForRecipient(id);
        userRepository.delete(user);
        log.info("User {} deleted by {} ({} notifications removed)", user.getUsername(), admin.getUsername(),
                notifications);
    }

    @Transactional(readOnly = true)
    public SystemStatsResponse getSystemStats() {
        long totalUsers = userRepository.count();
        long activeUsers = userRepository.countByActiveTrue();

        Map<String, Long> byRole = new LinkedHashMap<>();
        for (Object[] row : userRepository.countByRole()) {
            byRole.put(((Role) row[0]).getValue(), ((Number) row[1]).longValue());
        }
        Map<String, Long> byGrade = new LinkedHashMap<>();
        for (Object[] row : userRepository.countByGrade()) {
            byGrade.put(((Grade) row[0]).toValue(), ((Number) row[1]).longValue());
        }

        Map<ClaimStatus, Long> counts = new EnumMap<>(ClaimStatus.class);
        long totalClaims = 0;
        BigDecimal claimedAmount = BigDecimal.ZERO;
        BigDecimal approvedAmount = BigDecimal.ZERO;
        for (Object[] row : expenseClaimRepository.summarizeByStatus(null, null)) {
            ClaimStatus status = (ClaimStatus) row[0];
            long count = ((Number) row[1]).longValue();
            BigDecimal amount = row[2] == null ? BigDecimal.ZERO : (BigDecimal) row[2];
            counts.put(status, count);
            totalClaims += count;
            claimedAmount = claimedAmount.add(amount);
            if (status == ClaimStatus.APPROVED) {
                approvedAmount = amount;
            }
        }

        return SystemStatsResponse.builder()
                .users(SystemStatsResponse.Users.builder()
                        .total(totalUsers)
                        .active(activeUsers)
                        .inactive(totalUsers - activeUsers)
                        .byRole(byRole)
                        .byGrade(byGrade)
                        .build())
                .claims(SystemStatsResponse.Claims.builder()
                        .total(totalClaims)
                        .pendingManager(counts.getOrDefault(ClaimStatus.SUBMITTED, 0L)
                                + counts.getOrDefault(ClaimStatus.MANAGER_REVIEW, 0L))
                        .pendingHr(counts.getOrDefault(ClaimStatus.HR_REVIEW, 0L))
                        .pendingFinance(counts.getOrDefault(ClaimStatus.FINANCE_REVIEW, 0L))
                        .approved(counts.getOrDefault(ClaimStatus.APPROVED, 0L))
                        .rejected(counts.getOrDefault(ClaimStatus.REJECTED, 0L))
                        .totalClaimedAmount(claimedAmount)
                        .totalApprovedAmount(approvedAmount)
                        .build())
                .build();
    }

    public UserResponse mapToUserResponse(User user) {
        return modelMapper.map(user, UserResponse.class);
    }

    /**
     * Next free {@code EMP###} code, one past the highest numeric suffix in use.
     */
    static String nextEmployeeCode(List<String> existingCodes) {
        int max = 0;
        for (String code : existingCodes) {
            if (code == null || !code.startsWith(EMPLOYEE_CODE_PREFIX)) {
                continue;
            }
            try {
                max = Math.max(max, Integer.parseInt(code.substring(EMPLOYEE_CODE_PREFIX.length())));
            } catch (NumberFormatException e) {
                log.debug("Skipping non-numeric employee code {}", code);
            }
        }
        return String.format("%s%03d", EMPLOYEE_CODE_PREFIX, max + 1);
    }

    private UserResponse saveUpdate(User admin, User user, String detail) {
        User saved = userRepository.save(user);
        auditService.logUserAction(admin, AuditAction.USER_UPDATED, saved, detail);
        log.info("User {} updated by {}: {}", saved.getUsername(), admin.getUsername(), detail);
        return mapToUserResponse(saved);
    }

    private User findUser(UUID id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("User", "id", id));
    }

    private Role requireRole(String value) {
        Role role = FilterParser.role(value);
        if (role == null) {
            throw new ValidationException("Role is required");
        }
        return role;
    }

    private Grade requireGrade(String value) {
        Grade grade = FilterParser.grade(value);
        if (grade == null) {
            throw new ValidationException("Grade is required");
        }
        return grade;
    }
}
