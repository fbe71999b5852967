package com.ClaimFlow.expense_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimStatisticsResponse {
    private LocalDate fromDate;
    private LocalDate toDate;
    private long totalClaims;
    private BigDecimal totalAmount;
    private BigDecimal approvedAmount;
    private long pendingClaims;
    private Map<String, Bucket> byStatus;
    private Map<String, Bucket> byCategory;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Bucket {
        private long count;
        private BigDecimal amount;
    }
}
