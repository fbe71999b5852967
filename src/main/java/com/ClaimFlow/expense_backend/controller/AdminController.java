package com.ClaimFlow.expense_backend.controller;

import com.ClaimFlow.expense_backend.dto.response.ApiResponse;
import com.ClaimFlow.expense_backend.dto.response.SystemStatsResponse;
import com.ClaimFlow.expense_backend.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AdminController {

    private final UserService userService;

    @GetMapping("/system-stats")
    public ResponseEntity<ApiResponse<SystemStatsResponse>> getSystemStats() {
        return ResponseEntity.ok(ApiResponse.success(userService.getSystemStats()));
    }
}
