package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.dto.request.ClaimSearchCriteria;
import com.ClaimFlow.expense_backend.dto.response.ClaimStatisticsResponse;
import com.ClaimFlow.expense_backend.dto.response.ExpenseClaimResponse;
import com.ClaimFlow.expense_backend.dto.response.PaginatedResponse;
import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.ExpenseCategory;
import com.ClaimFlow.expense_backend.exception.ValidationException;
import com.ClaimFlow.expense_backend.model.ExpenseClaim;
import com.ClaimFlow.expense_backend.model.User;
import com.ClaimFlow.expense_backend.repository.ClaimSpecifications;
import com.ClaimFlow.expense_backend.repository.ExpenseClaimRepository;
import com.ClaimFlow.expense_backend.util.ReportGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reviewer-facing search, statistics and export over all claims.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class ReportService {

    static final int MAX_EXPORT_ROWS = 5000;

    private static final Set<String> SORTABLE_FIELDS =
            Set.of("submittedAt", "expenseDate", "amount", "status", "category", "expenseNumber", "ownerName");

    private final ExpenseClaimRepository expenseClaimRepository;
    private final ExpenseClaimMapper expenseClaimMapper;

    public PaginatedResponse<ExpenseClaimResponse> searchClaims(User viewer, ClaimSearchCriteria criteria,
                                                                int page, int limit, String sortBy, String sortDir) {
        validateRange(criteria);
        Pageable pageable = PageRequest.of(page - 1, limit, resolveSort(sortBy, sortDir));
        Page<ExpenseClaim> claimsPage = expenseClaimRepository.findAll(ClaimSpecifications.matching(criteria), pageable);

        log.debug("Claim search {} returned {} of {} results", criteria, claimsPage.getNumberOfElements(),
                claimsPage.getTotalElements());

        return PaginatedResponse.from(claimsPage, claim -> expenseClaimMapper.toResponse(claim, viewer));
    }

    public ClaimStatisticsResponse getStatistics(LocalDate fromDate, LocalDate toDate) {
        if (fromDate != null && toDate != null && fromDate.isAfter(toDate)) {
            throw new ValidationException("fromDate must not be after toDate");
        }

        Map<String, ClaimStatisticsResponse.Bucket> byStatus = new LinkedHashMap<>();
        long totalClaims = 0;
        long pendingClaims = 0;
        BigDecimal totalAmount = BigDecimal.ZERO;
        BigDecimal approvedAmount = BigDecimal.ZERO;

        for (Object[] row : expenseClaimRepository.summarizeByStatus(fromDate, toDate)) {
            ClaimStatus status = (ClaimStatus) row[0];
            ClaimStatisticsResponse.Bucket bucket = toBucket(row);
            byStatus.put(status.getValue(), bucket);

            totalClaims += bucket.getCount();
            totalAmount = totalAmount.add(bucket.getAmount());
            if (status == ClaimStatus.APPROVED) {
                approvedAmount = bucket.getAmount();
            } else if (!status.isTerminal()) {
                pendingClaims += bucket.getCount();
            }
        }

        Map<String, ClaimStatisticsResponse.Bucket> byCategory = new LinkedHashMap<>();
        for (Object[] row : expenseClaimRepository.summarizeByCategory(fromDate, toDate)) {
            byCategory.put(((ExpenseCategory) row[0]).getValue(), toBucket(row));
        }

        return ClaimStatisticsResponse.builder()
                .fromDate(fromDate)
                .toDate(toDate)
                .totalClaims(totalClaims)
                .totalAmount(totalAmount)
                .approvedAmount(approvedAmount)
                .pendingClaims(pendingClaims)
                .byStatus(byStatus)
                .byCategory(byCategory)
                .build();
    }

    public byte[] exportClaims(ClaimSearchCriteria criteria, String sortBy, String sortDir) {
        validateRange(criteria);
        Pageable pageable = PageRequest.of(0, MAX_EXPORT_ROWS, resolveSort(sortBy, sortDir));
        Page<ExpenseClaim> claimsPage = expenseClaimRepository.findAll(ClaimSpecifications.matching(criteria), pageable);

        if (claimsPage.getTotalElements() > MAX_EXPORT_ROWS) {
            log.warn("Export truncated to {} of {} matching claims", MAX_EXPORT_ROWS, claimsPage.getTotalElements());
        }
        log.info("Exporting {} claims", claimsPage.getNumberOfElements());
        return ReportGenerator.generateClaimsExcel(claimsPage.getContent(), "Expense Claims Report");
    }

    static Sort resolveSort(String sortBy, String sortDir) {
        String field = sortBy == null || sortBy.isBlank() ? "submittedAt" : sortBy.trim();
        if (!SORTABLE_FIELDS.contains(field)) {
            throw new ValidationException("Invalid sortBy: " + sortBy);
        }
        Sort.Direction direction;
        if (sortDir == null || sortDir.isBlank()) {
            direction = Sort.Direction.DESC;
        } else {
            direction = Sort.Direction.fromOptionalString(sortDir.trim())
                    .orElseThrow(() -> new ValidationException("Invalid sortDir: " + sortDir));
        }
        return Sort.by(direction, field);
    }

    private void validateRange(ClaimSearchCriteria criteria) {
        if (criteria.getFromDate() != null && criteria.getToDate() != null
                && criteria.getFromDate().isAfter(criteria.getToDate())) {
            throw new ValidationException("fromDate must not be after toDate");
        }
        if (criteria.getMinAmount() != null && criteria.getMaxAmount() != null
                && criteria.getMinAmount().compareTo(criteria.getMaxAmount()) > 0) {
            throw new ValidationException("minAmount must not exceed maxAmount");
        }
    }

    private static ClaimStatisticsResponse.Bucket toBucket(Object[] row) {
        long count = ((Number) row[1]).longValue();
        BigDecimal amount = row[2] != null ? (BigDecimal) row[2] : BigDecimal.ZERO;
        return ClaimStatisticsResponse.Bucket.builder()
                .count(count)
                .amount(amount)
                .build();
    }
}
