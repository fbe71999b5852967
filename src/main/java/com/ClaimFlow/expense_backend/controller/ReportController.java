package com.ClaimFlow.expense_backend.controller;

import com.ClaimFlow.expense_backend.dto.request.ClaimSearchCriteria;
import com.ClaimFlow.expense_backend.dto.response.ApiResponse;
import com.ClaimFlow.expense_backend.dto.response.AuditLogResponse;
import com.ClaimFlow.expense_backend.dto.response.ClaimStatisticsResponse;
import com.ClaimFlow.expense_backend.dto.response.ExpenseClaimResponse;
import com.ClaimFlow.expense_backend.dto.response.PaginatedResponse;
import com.ClaimFlow.expense_backend.model.User;
import com.ClaimFlow.expense_backend.service.AuditService;
import com.ClaimFlow.expense_backend.service.BillFile;
import com.ClaimFlow.expense_backend.service.ExpenseService;
import com.ClaimFlow.expense_backend.service.ReportService;
import com.ClaimFlow.expense_backend.util.FilterParser;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Validated
@Slf4j
public class ReportController {

    private static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final ReportService reportService;
    private final ExpenseService expenseService;
    private final AuditService auditService;

    @GetMapping("/search")
    @PreAuthorize("hasAnyRole('MANAGER', 'HR', 'FINANCE', 'ADMIN')")
    public ResponseEntity<ApiResponse<PaginatedResponse<ExpenseClaimResponse>>> searchClaims(
            @AuthenticationPrincipal User user,
            @RequestParam(required = false) String q,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) UUID employeeId,
            @RequestParam(required = false) String grade,
            @RequestParam(required = false) String department,
            @RequestParam(required = false) BigDecimal minAmount,
            @RequestParam(required = false) BigDecimal maxAmount,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate,
            @RequestParam(required = false) String aiRecommendation,
            @RequestParam(required = false) Boolean withinLimits,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortDir) {

        ClaimSearchCriteria criteria = criteria(q, category, status, employeeId, grade, department,
                minAmount, maxAmount, fromDate, toDate, aiRecommendation, withinLimits);
        return ResponseEntity.ok(ApiResponse.success(
                reportService.searchClaims(user, criteria, page, limit, sortBy, sortDir)));
    }

    @GetMapping("/statistics")
    @PreAuthorize("hasAnyRole('MANAGER', 'HR', 'FINANCE', 'ADMIN')")
    public ResponseEntity<ApiResponse<ClaimStatisticsResponse>> getStatistics(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate) {

        return ResponseEntity.ok(ApiResponse.success(reportService.getStatistics(fromDate, toDate)));
    }

    @GetMapping("/export")
    @PreAuthorize("hasAnyRole('MANAGER', 'HR', 'FINANCE', 'ADMIN')")
    public ResponseEntity<byte[]> exportClaims(
            @RequestParam(required = false) String q,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) UUID employeeId,
            @RequestParam(required = false) String grade,
            @RequestParam(required = false) String department,
            @RequestParam(required = false) BigDecimal minAmount,
            @RequestParam(required = false) BigDecimal maxAmount,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate,
            @RequestParam(required = false) String aiRecommendation,
            @RequestParam(required = false) Boolean withinLimits,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortDir) {

        ClaimSearchCriteria criteria = criteria(q, category, status, employeeId, grade, department,
                minAmount, maxAmount, fromDate, toDate, aiRecommendation, withinLimits);
        byte[] workbook = reportService.exportClaims(criteria, sortBy, sortDir);

        String fileName = "expense-claims-" + LocalDate.now().format(DateTimeFormatter.BASIC_ISO_DATE) + ".xlsx";
        return ResponseEntity.ok()
                .contentType(XLSX)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(fileName)
                        .build()
                        .toString())
                .body(workbook);
    }

    @GetMapping("/bills/{id}/download")
    public ResponseEntity<Resource> downloadBill(@AuthenticationPrincipal User user, @PathVariable UUID id) {
        BillFile bill = expenseService.getBillFile(user, id);
        log.debug("Bill for claim {} downloaded by {}", id, user.getUsername());

        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(bill.getContentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(bill.getFileName(), StandardCharsets.UTF_8)
                        .build()
                        .toString())
                .body(bill.getResource());
    }

    @GetMapping("/audit-logs")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<PaginatedResponse<AuditLogResponse>>> getAuditLogs(
            @RequestParam(required = false) UUID actorId,
            @RequestParam(required = false) String action,
            @RequestParam(required = false) UUID claimId,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(200) int limit) {

        return ResponseEntity.ok(ApiResponse.success(
                auditService.searchAuditLogs(page, limit, actorId, action, claimId)));
    }

    private static ClaimSearchCriteria criteria(String q, String category, String status, UUID employeeId,
                                                String grade, String department, BigDecimal minAmount,
                                                BigDecimal maxAmount, LocalDate fromDate, LocalDate toDate,
                                                String aiRecommendation, Boolean withinLimits) {
        return ClaimSearchCriteria.builder()
                .q(q)
                .category(FilterParser.category(category))
                .status(FilterParser.status(status))
                .employeeId(employeeId)
                .grade(FilterParser.grade(grade))
                .department(department)
                .minAmount(minAmount)
                .maxAmount(maxAmount)
                .fromDate(fromDate)
                .toDate(toDate)
                .aiRecommendation(FilterParser.recommendation(aiRecommendation))
                .withinLimits(withinLimits)
                .build();
    }
}
