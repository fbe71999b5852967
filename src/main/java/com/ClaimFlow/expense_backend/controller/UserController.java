package com.ClaimFlow.expense_backend.controller;

import com.ClaimFlow.expense_backend.dto.request.CreateUserRequest;
import com.ClaimFlow.expense_backend.dto.request.UpdateGradeRequest;
import com.ClaimFlow.expense_backend.dto.request.UpdateRoleRequest;
import com.ClaimFlow.expense_backend.dto.response.ApiResponse;
import com.ClaimFlow.expense_backend.dto.response.PaginatedResponse;
import com.ClaimFlow.expense_backend.dto.response.UserResponse;
import com.ClaimFlow.expense_backend.model.User;
import com.ClaimFlow.expense_backend.service.UserService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/admin/users")
@RequiredArgsConstructor
@Validated
@PreAuthorize("hasRole('ADMIN')")
public class UserController {

    private final UserService userService;

    @PostMapping
    public ResponseEntity<ApiResponse<UserResponse>> createUser(@AuthenticationPrincipal User admin,
                                                                @Valid @RequestBody CreateUserRequest request) {
        UserResponse user = userService.createUser(admin, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(user, "User created successfully"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<UserResponse>>> getAllUsers(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String role) {

        PaginatedResponse<UserResponse> users = userService.getAllUsers(page, limit, search, role);
        return ResponseEntity.ok(ApiResponse.success(users));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<UserResponse>> getUserById(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(userService.getUserById(id)));
    }

    @PutMapping("/{id}/toggle-active")
    public ResponseEntity<ApiResponse<UserResponse>> toggleActive(@AuthenticationPrincipal User admin,
                                                                  @PathVariable UUID id) {
        UserResponse user = userService.toggleActive(admin, id);
        String message = user.isActive() ? "User activated successfully" : "User deactivated successfully";
        return ResponseEntity.ok(ApiResponse.success(user, message));
    }

    @PutMapping("/{id}/toggle-claim-permission")
    public ResponseEntity<ApiResponse<UserResponse>> toggleClaimPermission(@AuthenticationPrincipal User admin,
                                                                           @PathVariable UUID id) {
        UserResponse user = userService.toggleClaimPermission(admin, id);
        return ResponseEntity.ok(ApiResponse.success(user, "Claim permission updated successfully"));
    }

    @PutMapping("/{id}/role")
    public ResponseEntity<ApiResponse<UserResponse>> updateRole(@AuthenticationPrincipal User admin,
                                                                @PathVariable UUID id,
                                                                @Valid @RequestBody UpdateRoleRequest request) {
        UserResponse user = userService.updateRole(admin, id, request.getRole());
        return ResponseEntity.ok(ApiResponse.success(user, "Role updated successfully"));
    }

    @PutMapping("/{id}/grade")
    public ResponseEntity<ApiResponse<UserResponse>> updateGrade(@AuthenticationPrincipal User admin,
                                                                 @PathVariable UUID id,
                                                                 @Valid @RequestBody UpdateGradeRequest request) {
        UserResponse user = userService.updateGrade(admin, id, request.getGrade());
        return ResponseEntity.ok(ApiResponse.success(user, "Grade updated successfully"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteUser(@AuthenticationPrincipal User admin, @PathVariable UUID id) {
        userService.deleteUser(admin, id);
        return ResponseEntity.ok(ApiResponse.success(null, "User deleted successfully"));
    }
}
