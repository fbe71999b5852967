package com.ClaimFlow.expense_backend.controller;

import com.ClaimFlow.expense_backend.dto.request.ExpenseClaimRequest;
import com.ClaimFlow.expense_backend.dto.response.ApiResponse;
import com.ClaimFlow.expense_backend.dto.response.BillStatusResponse;
import com.ClaimFlow.expense_backend.dto.response.ExpenseClaimResponse;
import com.ClaimFlow.expense_backend.dto.response.GradeRulesResponse;
import com.ClaimFlow.expense_backend.dto.response.PaginatedResponse;
import com.ClaimFlow.expense_backend.model.User;
import com.ClaimFlow.expense_backend.service.ExpenseService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/expenses")
@RequiredArgsConstructor
@Validated
public class ExpenseController {

    private final ExpenseService expenseService;

    @PostMapping(value = "/claim", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<ExpenseClaimResponse>> submitClaim(
            @AuthenticationPrincipal User user,
            @Valid @ModelAttribute ExpenseClaimRequest request) {

        ExpenseClaimResponse claim = expenseService.submitClaim(user, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(claim, "Expense claim submitted successfully"));
    }

    @GetMapping("/my-expenses")
    public ResponseEntity<ApiResponse<PaginatedResponse<ExpenseClaimResponse>>> getMyExpenses(
            @AuthenticationPrincipal User user,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String category) {

        PaginatedResponse<ExpenseClaimResponse> expenses =
                expenseService.getMyExpenses(user, page, limit, status, category);
        return ResponseEntity.ok(ApiResponse.success(expenses));
    }

    @GetMapping("/bill-status/{expenseNumber}")
    public ResponseEntity<ApiResponse<BillStatusResponse>> getBillStatus(@AuthenticationPrincipal User user,
                                                                         @PathVariable String expenseNumber) {
        return ResponseEntity.ok(ApiResponse.success(expenseService.getBillStatus(user, expenseNumber)));
    }

    @GetMapping("/rules")
    public ResponseEntity<ApiResponse<GradeRulesResponse>> getRules(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(ApiResponse.success(expenseService.getRules(user)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ExpenseClaimResponse>> getExpenseById(@AuthenticationPrincipal User user,
                                                                            @PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(expenseService.getExpenseById(user, id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteExpense(@AuthenticationPrincipal User user,
                                                           @PathVariable UUID id) {
        expenseService.deleteExpense(user, id);
        return ResponseEntity.ok(ApiResponse.success(null, "Expense claim deleted successfully"));
    }
}
