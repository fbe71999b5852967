package com.ClaimFlow.expense_backend.controller;

import com.ClaimFlow.expense_backend.dto.request.ApprovalActionRequest;
import com.ClaimFlow.expense_backend.dto.response.ApiResponse;
import com.ClaimFlow.expense_backend.dto.response.ExpenseClaimResponse;
import com.ClaimFlow.expense_backend.dto.response.PaginatedResponse;
import com.ClaimFlow.expense_backend.model.User;
import com.ClaimFlow.expense_backend.service.ApprovalService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/approvals")
@RequiredArgsConstructor
@Validated
public class ApprovalController {

    private final ApprovalService approvalService;

    @GetMapping("/pending")
    @PreAuthorize("hasAnyRole('MANAGER', 'HR', 'FINANCE')")
    public ResponseEntity<ApiResponse<PaginatedResponse<ExpenseClaimResponse>>> getPendingApprovals(
            @AuthenticationPrincipal User user,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {

        return ResponseEntity.ok(ApiResponse.success(approvalService.getPendingApprovals(user, page, limit)));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<ApiResponse<ExpenseClaimResponse>> approve(
            @AuthenticationPrincipal User user,
            @PathVariable UUID id,
            @Valid @RequestBody(required = false) ApprovalActionRequest request) {

        String comments = request != null ? request.getComments() : null;
        ExpenseClaimResponse claim = approvalService.approve(user, id, comments);
        return ResponseEntity.ok(ApiResponse.success(claim, "Expense claim approved"));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<ApiResponse<ExpenseClaimResponse>> reject(
            @AuthenticationPrincipal User user,
            @PathVariable UUID id,
            @Valid @RequestBody ApprovalActionRequest request) {

        ExpenseClaimResponse claim = approvalService.reject(user, id, request.getComments());
        return ResponseEntity.ok(ApiResponse.success(claim, "Expense claim rejected"));
    }
}
