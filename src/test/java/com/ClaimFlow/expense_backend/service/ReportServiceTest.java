package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.dto.request.ClaimSearchCriteria;
import com.ClaimFlow.expense_backend.dto.response.ClaimStatisticsResponse;
import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.ExpenseCategory;
import com.ClaimFlow.expense_backend.exception.ValidationException;
import com.ClaimFlow.expense_backend.repository.ExpenseClaimRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReportServiceTest {

    @Mock
    private ExpenseClaimRepository expenseClaimRepository;

    @Mock
    private ExpenseClaimMapper expenseClaimMapper;

    @InjectMocks
    private ReportService reportService;

    @Test
    void sortDefaultsToNewestSubmissionFirst() {
        assertThat(ReportService.resolveSort(null, null)).isEqualTo(Sort.by(Sort.Direction.DESC, "submittedAt"));
        assertThat(ReportService.resolveSort("amount", "asc")).isEqualTo(Sort.by(Sort.Direction.ASC, "amount"));
    }

    @Test
    void unknownSortFieldOrDirectionIsRejected() {
        assertThatThrownBy(() -> ReportService.resolveSort("password", null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("sortBy");
        assertThatThrownBy(() -> ReportService.resolveSort("amount", "sideways"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("sortDir");
    }

    @Test
    void statisticsAggregateStatusAndCategoryRows() {
        LocalDate from = LocalDate.of(2024, 6, 1);
        LocalDate to = LocalDate.of(2024, 6, 30);
        when(expenseClaimRepository.summarizeByStatus(from, to)).thenReturn(List.of(
                new Object[]{ClaimStatus.SUBMITTED, 3L, new BigDecimal("2400.00")},
                new Object[]{ClaimStatus.HR_REVIEW, 1L, new BigDecimal("900.00")},
                new Object[]{ClaimStatus.APPROVED, 2L, new BigDecimal("3100.50")},
                new Object[]{ClaimStatus.REJECTED, 1L, new BigDecimal("15000.00")}
        ));
        when(expenseClaimRepository.summarizeByCategory(from, to)).thenReturn(List.of(
                new Object[]{ExpenseCategory.TRAVEL, 5L, new BigDecimal("19500.00")},
                new Object[]{ExpenseCategory.FOOD, 2L, null}
        ));

        ClaimStatisticsResponse stats = reportService.getStatistics(from, to);

        assertThat(stats.getTotalClaims()).isEqualTo(7);
        assertThat(stats.getPendingClaims()).isEqualTo(4);
        assertThat(stats.getTotalAmount()).isEqualByComparingTo("21400.50");
        assertThat(stats.getApprovedAmount()).isEqualByComparingTo("3100.50");
        assertThat(stats.getByStatus()).containsOnlyKeys("submitted", "hr_review", "approved", "rejected");
        assertThat(stats.getByCategory().get("travel").getCount()).isEqualTo(5);
        assertThat(stats.getByCategory().get("food").getAmount()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void emptyPeriodYieldsZeroes() {
        when(expenseClaimRepository.summarizeByStatus(null, null)).thenReturn(List.of());
        when(expenseClaimRepository.summarizeByCategory(null, null)).thenReturn(List.of());

        ClaimStatisticsResponse stats = reportService.getStatistics(null, null);

        assertThat(stats.getTotalClaims()).isZero();
        assertThat(stats.getApprovedAmount()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(stats.getByStatus()).isEmpty();
    }

    @Test
    void invertedRangesAreRejectedBeforeQuerying() {
        ClaimSearchCriteria dates = ClaimSearchCriteria.builder()
                .fromDate(LocalDate.of(2024, 6, 30))
                .toDate(LocalDate.of(2024, 6, 1))
                .build();
        ClaimSearchCriteria amounts = ClaimSearchCriteria.builder()
                .minAmount(new BigDecimal("500"))
                .maxAmount(new BigDecimal("100"))
                .build();

        assertThatThrownBy(() -> reportService.searchClaims(null, dates, 1, 20, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> reportService.exportClaims(amounts, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> reportService.getStatistics(LocalDate.of(2024, 7, 1), LocalDate.of(2024, 6, 1)))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(expenseClaimRepository);
    }
}
